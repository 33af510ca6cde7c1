package com.tinytalk.compiler.ast;

import com.tinytalk.compiler.ast.decl.*;
import com.tinytalk.compiler.ast.expr.*;
import com.tinytalk.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitFnDecl(FnDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitEnumDecl(EnumDecl node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitLetStmt(LetStmt node, C ctx) { return null; }

    default R visitConstStmt(ConstStmt node, C ctx) { return null; }

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    default R visitImportStmt(ImportStmt node, C ctx) { return null; }

    default R visitTryStmt(TryStmt node, C ctx) { return null; }

    default R visitThrowStmt(ThrowStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitMemberExpr(MemberExpr node, C ctx) { return null; }

    default R visitArrayLiteral(ArrayLiteral node, C ctx) { return null; }

    default R visitMapLiteral(MapLiteral node, C ctx) { return null; }

    default R visitLambdaExpr(LambdaExpr node, C ctx) { return null; }

    default R visitConditionalExpr(ConditionalExpr node, C ctx) { return null; }

    default R visitRangeExpr(RangeExpr node, C ctx) { return null; }

    default R visitPipeExpr(PipeExpr node, C ctx) { return null; }

    default R visitStepChainExpr(StepChainExpr node, C ctx) { return null; }

    default R visitStringInterpolation(StringInterpolation node, C ctx) { return null; }

    default R visitMatchExpr(MatchExpr node, C ctx) { return null; }
}

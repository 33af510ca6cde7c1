package com.tinytalk.compiler.ast;

import com.tinytalk.compiler.ast.decl.*;
import com.tinytalk.compiler.ast.expr.*;
import com.tinytalk.compiler.ast.stmt.*;

import java.util.List;

/**
 * AST 的 S 表达式输出（不含位置信息）
 *
 * <p>顶层语句各占一行。同一语义的现代语法与经典语法程序输出完全相同，
 * 命令行 {@code --ast} 也使用此格式。</p>
 */
public class AstPrinter implements AstVisitor<Void, StringBuilder> {

    public String print(Program program) {
        StringBuilder out = new StringBuilder();
        visitProgram(program, out);
        return out.toString();
    }

    public String print(AstNode node) {
        StringBuilder out = new StringBuilder();
        node.accept(this, out);
        return out.toString();
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, StringBuilder out) {
        for (Statement stmt : node.getStatements()) {
            stmt.accept(this, out);
            out.append('\n');
        }
        return null;
    }

    @Override
    public Void visitFnDecl(FnDecl node, StringBuilder out) {
        out.append("(fn ").append(node.getName()).append(" (");
        printParams(node.getParams(), out);
        out.append(')');
        if (node.getReturnType() != null) {
            out.append(" -> ").append(node.getReturnType());
        }
        out.append(' ');
        visitBlock(node.getBody(), out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, StringBuilder out) {
        out.append(node.getName());
        if (node.getTypeHint() != null) {
            out.append(':').append(node.getTypeHint());
        }
        if (node.getDefaultValue() != null) {
            out.append('=');
            node.getDefaultValue().accept(this, out);
        }
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, StringBuilder out) {
        out.append("(struct ").append(node.getName());
        for (StructDecl.FieldDecl field : node.getFields()) {
            out.append(" (field ").append(field.getName());
            if (field.getTypeHint() != null) {
                out.append(':').append(field.getTypeHint());
            }
            if (field.getDefaultValue() != null) {
                out.append(' ');
                field.getDefaultValue().accept(this, out);
            }
            out.append(')');
        }
        for (FnDecl method : node.getMethods()) {
            out.append(' ');
            visitFnDecl(method, out);
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitEnumDecl(EnumDecl node, StringBuilder out) {
        out.append("(enum ").append(node.getName());
        for (EnumDecl.Variant variant : node.getVariants()) {
            out.append(' ').append(variant.getName());
            if (variant.getValue() != null) {
                out.append('=');
                variant.getValue().accept(this, out);
            }
        }
        out.append(')');
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, StringBuilder out) {
        out.append("(block");
        for (Statement stmt : node.getStatements()) {
            out.append(' ');
            stmt.accept(this, out);
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, StringBuilder out) {
        node.getExpression().accept(this, out);
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, StringBuilder out) {
        out.append("(let ").append(node.getName());
        if (node.getTypeHint() != null) {
            out.append(':').append(node.getTypeHint());
        }
        if (node.getInitializer() != null) {
            out.append(' ');
            node.getInitializer().accept(this, out);
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitConstStmt(ConstStmt node, StringBuilder out) {
        out.append("(const ").append(node.getName()).append(' ');
        node.getValue().accept(this, out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, StringBuilder out) {
        out.append('(').append(node.getOperator().getSymbol()).append(' ');
        node.getTarget().accept(this, out);
        out.append(' ');
        node.getValue().accept(this, out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, StringBuilder out) {
        out.append("(if ");
        node.getCondition().accept(this, out);
        out.append(' ');
        visitBlock(node.getThenBranch(), out);
        for (IfStmt.ElifBranch elif : node.getElifBranches()) {
            out.append(" (elif ");
            elif.getCondition().accept(this, out);
            out.append(' ');
            visitBlock(elif.getBody(), out);
            out.append(')');
        }
        if (node.getElseBranch() != null) {
            out.append(" (else ");
            visitBlock(node.getElseBranch(), out);
            out.append(')');
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, StringBuilder out) {
        out.append("(for ").append(node.getVariable()).append(' ');
        node.getIterable().accept(this, out);
        out.append(' ');
        visitBlock(node.getBody(), out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, StringBuilder out) {
        out.append("(while ");
        node.getCondition().accept(this, out);
        out.append(' ');
        visitBlock(node.getBody(), out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, StringBuilder out) {
        out.append("(return");
        if (node.getValue() != null) {
            out.append(' ');
            node.getValue().accept(this, out);
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, StringBuilder out) {
        out.append("(break)");
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, StringBuilder out) {
        out.append("(continue)");
        return null;
    }

    @Override
    public Void visitImportStmt(ImportStmt node, StringBuilder out) {
        out.append("(import \"").append(node.getPath()).append('"');
        if (node.getAlias() != null) {
            out.append(" as ").append(node.getAlias());
        }
        if (!node.getItems().isEmpty()) {
            out.append(" use ").append(String.join(",", node.getItems()));
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitTryStmt(TryStmt node, StringBuilder out) {
        out.append("(try ");
        visitBlock(node.getBody(), out);
        if (node.getCatchBody() != null) {
            out.append(" (catch");
            if (node.getCatchVariable() != null) {
                out.append(' ').append(node.getCatchVariable());
            }
            out.append(' ');
            visitBlock(node.getCatchBody(), out);
            out.append(')');
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitThrowStmt(ThrowStmt node, StringBuilder out) {
        out.append("(throw");
        if (node.getValue() != null) {
            out.append(' ');
            node.getValue().accept(this, out);
        }
        out.append(')');
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, StringBuilder out) {
        switch (node.getKind()) {
            case STRING:
                out.append('"').append(escape((String) node.getValue())).append('"');
                break;
            case NULL:
                out.append("null");
                break;
            default:
                out.append(node.getValue());
                break;
        }
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, StringBuilder out) {
        out.append(node.getName());
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, StringBuilder out) {
        out.append('(').append(node.getOperator().getSymbol()).append(' ');
        node.getLeft().accept(this, out);
        out.append(' ');
        node.getRight().accept(this, out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, StringBuilder out) {
        out.append('(').append(node.getOperator().getSymbol()).append(' ');
        node.getOperand().accept(this, out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, StringBuilder out) {
        out.append("(call ");
        node.getCallee().accept(this, out);
        printList(node.getArgs(), out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, StringBuilder out) {
        out.append("(index ");
        node.getTarget().accept(this, out);
        out.append(' ');
        node.getIndex().accept(this, out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, StringBuilder out) {
        out.append("(. ");
        node.getTarget().accept(this, out);
        out.append(' ').append(node.getMember()).append(')');
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteral node, StringBuilder out) {
        out.append("(list");
        printList(node.getElements(), out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitMapLiteral(MapLiteral node, StringBuilder out) {
        out.append("(map");
        for (MapLiteral.Entry entry : node.getEntries()) {
            out.append(" (");
            entry.getKey().accept(this, out);
            out.append(' ');
            entry.getValue().accept(this, out);
            out.append(')');
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitLambdaExpr(LambdaExpr node, StringBuilder out) {
        out.append("(lambda (");
        printParams(node.getParams(), out);
        out.append(") ");
        node.getBody().accept(this, out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitConditionalExpr(ConditionalExpr node, StringBuilder out) {
        out.append("(? ");
        node.getCondition().accept(this, out);
        out.append(' ');
        node.getThenExpr().accept(this, out);
        out.append(' ');
        node.getElseExpr().accept(this, out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitRangeExpr(RangeExpr node, StringBuilder out) {
        out.append(node.isInclusive() ? "(..= " : "(.. ");
        node.getStart().accept(this, out);
        out.append(' ');
        node.getEnd().accept(this, out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitPipeExpr(PipeExpr node, StringBuilder out) {
        out.append("(|> ");
        node.getLeft().accept(this, out);
        out.append(' ');
        node.getRight().accept(this, out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitStepChainExpr(StepChainExpr node, StringBuilder out) {
        out.append("(chain ");
        node.getSource().accept(this, out);
        for (StepChainExpr.Step step : node.getSteps()) {
            out.append(" (").append(step.getVerb());
            printList(step.getArgs(), out);
            out.append(')');
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitStringInterpolation(StringInterpolation node, StringBuilder out) {
        out.append("(interp");
        printList(node.getParts(), out);
        out.append(')');
        return null;
    }

    @Override
    public Void visitMatchExpr(MatchExpr node, StringBuilder out) {
        out.append("(match ");
        node.getSubject().accept(this, out);
        for (MatchExpr.MatchCase c : node.getCases()) {
            out.append(" (");
            c.getPattern().accept(this, out);
            out.append(" => ");
            c.getBody().accept(this, out);
            out.append(')');
        }
        out.append(')');
        return null;
    }

    // ============ 辅助 ============

    private void printParams(List<Parameter> params, StringBuilder out) {
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) out.append(' ');
            visitParameter(params.get(i), out);
        }
    }

    private void printList(List<Expression> items, StringBuilder out) {
        for (Expression item : items) {
            out.append(' ');
            item.accept(this, out);
        }
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}

package com.tinytalk.compiler.analysis;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.decl.*;
import com.tinytalk.compiler.ast.expr.*;
import com.tinytalk.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 步骤链类型推断（仅作提示，不影响执行）
 *
 * <p>按每个动词的签名把类型从源表达式一路推到链尾：输入约束不满足时记录
 * {@link ChainTypeError}。变量类型来自 let / const 的类型标注或初始值，
 * 环境是整个程序共用的一张表。</p>
 */
public final class ChainTypeChecker {

    /** 动词对输入的要求 */
    enum Input { LIST, MAP, ANY }

    /** 输出类型规则 */
    enum Output { PRESERVE, INT, FLOAT, NUM, ELEMENT, MAP, GROUP, LIST, MAPPED_LIST, ANY }

    static final class Signature {
        final Input input;
        final Output output;

        Signature(Input input, Output output) {
            this.input = input;
            this.output = output;
        }
    }

    private static final Map<String, Signature> SIGNATURES = new LinkedHashMap<String, Signature>();

    static {
        sig("_filter", Input.LIST, Output.PRESERVE);
        sig("_sort", Input.LIST, Output.PRESERVE);
        sig("_map", Input.LIST, Output.MAPPED_LIST);
        sig("_take", Input.LIST, Output.PRESERVE);
        sig("_drop", Input.LIST, Output.PRESERVE);
        sig("_first", Input.LIST, Output.ELEMENT);
        sig("_last", Input.LIST, Output.ELEMENT);
        sig("_reverse", Input.LIST, Output.PRESERVE);
        sig("_unique", Input.LIST, Output.PRESERVE);
        sig("_count", Input.LIST, Output.INT);
        sig("_sum", Input.LIST, Output.NUM);
        sig("_avg", Input.LIST, Output.FLOAT);
        sig("_min", Input.LIST, Output.ELEMENT);
        sig("_max", Input.LIST, Output.ELEMENT);
        sig("_group", Input.LIST, Output.GROUP);
        sig("_groupBy", Input.LIST, Output.GROUP);
        sig("_flatten", Input.LIST, Output.LIST);
        sig("_zip", Input.LIST, Output.LIST);
        sig("_chunk", Input.LIST, Output.LIST);
        sig("_reduce", Input.LIST, Output.ANY);
        sig("_sortBy", Input.LIST, Output.PRESERVE);
        sig("_each", Input.LIST, Output.PRESERVE);
        sig("_select", Input.LIST, Output.PRESERVE);
        sig("_mutate", Input.LIST, Output.PRESERVE);
        sig("_rename", Input.LIST, Output.PRESERVE);
        sig("_arrange", Input.LIST, Output.PRESERVE);
        sig("_distinct", Input.LIST, Output.PRESERVE);
        sig("_slice", Input.LIST, Output.PRESERVE);
        sig("_pull", Input.LIST, Output.LIST);
        sig("_join", Input.LIST, Output.LIST);
        sig("_leftJoin", Input.LIST, Output.LIST);
        sig("_pivot", Input.LIST, Output.LIST);
        sig("_unpivot", Input.LIST, Output.LIST);
        sig("_window", Input.LIST, Output.LIST);
        sig("_mapValues", Input.MAP, Output.MAP);
        sig("_summarize", Input.ANY, Output.MAP);
    }

    private static void sig(String verb, Input input, Output output) {
        SIGNATURES.put(verb, new Signature(input, output));
    }

    /**
     * 检查整个程序中的所有步骤链
     */
    public List<ChainTypeError> check(Program program) {
        Walker walker = new Walker();
        program.accept(walker, new HashMap<String, TinyType>());
        return walker.errors;
    }

    /**
     * 推断单条步骤链
     */
    public ChainTypeInfo infer(StepChainExpr chain, Map<String, TinyType> env) {
        Map<String, TinyType> types = env != null ? env : Collections.<String, TinyType>emptyMap();
        List<ChainTypeError> errors = new ArrayList<ChainTypeError>();
        List<TinyType> stepTypes = new ArrayList<TinyType>();

        TinyType inputType = inferExpr(chain.getSource(), types);
        TinyType current = inputType;
        List<StepChainExpr.Step> steps = chain.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            StepChainExpr.Step step = steps.get(i);
            String verb = step.getVerb();
            int line = step.getLocation().getLine();
            Signature signature = SIGNATURES.get(verb);
            if (signature == null) {
                errors.add(new ChainTypeError(i, verb, "Unknown step '" + verb + "'", line));
                current = TinyType.anyType();
                stepTypes.add(current);
                continue;
            }

            if (signature.input == Input.LIST && !current.is(TinyType.Kind.LIST) && !current.is(TinyType.Kind.ANY)) {
                errors.add(new ChainTypeError(i, verb, "'" + verb + "' expects a list, got " + current, line));
            } else if (signature.input == Input.MAP && !current.is(TinyType.Kind.MAP) && !current.is(TinyType.Kind.ANY)) {
                errors.add(new ChainTypeError(i, verb, "'" + verb + "' expects a map, got " + current, line));
            }

            current = outputType(signature.output, current, step, types);
            stepTypes.add(current);
        }
        return new ChainTypeInfo(inputType, stepTypes, current, errors);
    }

    private TinyType outputType(Output output, TinyType input, StepChainExpr.Step step,
                                Map<String, TinyType> env) {
        switch (output) {
            case PRESERVE:
                return input;
            case INT:
                return TinyType.intType();
            case FLOAT:
                return TinyType.floatType();
            case NUM:
                return input.elementType().is(TinyType.Kind.FLOAT) ? TinyType.floatType() : TinyType.intType();
            case ELEMENT:
                return input.elementType();
            case GROUP:
                return TinyType.mapOf(TinyType.anyType(), TinyType.listOf(input.elementType()));
            case MAP:
                return TinyType.mapOf(TinyType.strType(), TinyType.anyType());
            case MAPPED_LIST:
                return TinyType.listOf(lambdaResult(step, input.elementType(), env));
            case LIST:
                return TinyType.listOf(TinyType.anyType());
            default:
                return TinyType.anyType();
        }
    }

    /**
     * _map 的 lambda 若为单表达式体，以参数绑定元素类型后推断其结果
     */
    private TinyType lambdaResult(StepChainExpr.Step step, TinyType element, Map<String, TinyType> env) {
        if (step.getArgs().size() != 1 || !(step.getArgs().get(0) instanceof LambdaExpr)) {
            return TinyType.anyType();
        }
        LambdaExpr lambda = (LambdaExpr) step.getArgs().get(0);
        if (lambda.hasBlockBody() || lambda.getParams().size() != 1) {
            return TinyType.anyType();
        }
        Map<String, TinyType> inner = new HashMap<String, TinyType>(env);
        inner.put(lambda.getParams().get(0).getName(), element);
        return inferExpr((Expression) lambda.getBody(), inner);
    }

    /**
     * 简化的表达式类型推断
     */
    TinyType inferExpr(Expression expr, Map<String, TinyType> env) {
        if (expr instanceof Literal) {
            switch (((Literal) expr).getKind()) {
                case INT:     return TinyType.intType();
                case FLOAT:   return TinyType.floatType();
                case STRING:  return TinyType.strType();
                case BOOLEAN: return TinyType.boolType();
                default:      return TinyType.nullType();
            }
        }
        if (expr instanceof StringInterpolation) {
            return TinyType.strType();
        }
        if (expr instanceof Identifier) {
            TinyType type = env.get(((Identifier) expr).getName());
            return type != null ? type : TinyType.anyType();
        }
        if (expr instanceof ArrayLiteral) {
            List<Expression> elements = ((ArrayLiteral) expr).getElements();
            if (elements.isEmpty()) {
                return TinyType.listOf(TinyType.anyType());
            }
            return TinyType.listOf(inferExpr(elements.get(0), env));
        }
        if (expr instanceof RangeExpr) {
            return TinyType.listOf(TinyType.intType());
        }
        if (expr instanceof MapLiteral) {
            return TinyType.mapOf(TinyType.strType(), TinyType.anyType());
        }
        if (expr instanceof StepChainExpr) {
            return infer((StepChainExpr) expr, env).getOutputType();
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            if (unary.getOperator() == UnaryExpr.UnaryOp.NOT) {
                return TinyType.boolType();
            }
            return inferExpr(unary.getOperand(), env);
        }
        if (expr instanceof BinaryExpr) {
            return inferBinary((BinaryExpr) expr, env);
        }
        return TinyType.anyType();
    }

    private TinyType inferBinary(BinaryExpr expr, Map<String, TinyType> env) {
        TinyType left = inferExpr(expr.getLeft(), env);
        TinyType right = inferExpr(expr.getRight(), env);
        switch (expr.getOperator()) {
            case ADD:
                if (left.is(TinyType.Kind.STR) || right.is(TinyType.Kind.STR)) {
                    return TinyType.strType();
                }
                return arithmetic(left, right);
            case SUB:
            case MUL:
            case MOD:
            case POW:
                return arithmetic(left, right);
            case DIV:
                return TinyType.floatType();
            case FLOOR_DIV:
                return TinyType.intType();
            case EQ: case NE: case LT: case GT: case LE: case GE:
            case IS: case ISNT: case HAS: case HASNT: case ISIN: case ISLIKE:
            case AND: case OR:
                return TinyType.boolType();
            default:
                return TinyType.anyType();
        }
    }

    private static TinyType arithmetic(TinyType left, TinyType right) {
        if (left.is(TinyType.Kind.FLOAT) || right.is(TinyType.Kind.FLOAT)) {
            return TinyType.floatType();
        }
        if (left.is(TinyType.Kind.INT) && right.is(TinyType.Kind.INT)) {
            return TinyType.intType();
        }
        return TinyType.anyType();
    }

    // ============ 遍历 ============

    /**
     * 深度优先遍历 AST，沿途登记变量类型并检查遇到的每条步骤链
     */
    private final class Walker implements AstVisitor<Void, Map<String, TinyType>> {

        final List<ChainTypeError> errors = new ArrayList<ChainTypeError>();

        private void visit(AstNode node, Map<String, TinyType> env) {
            if (node != null) {
                node.accept(this, env);
            }
        }

        private void visitAll(List<? extends AstNode> nodes, Map<String, TinyType> env) {
            for (AstNode node : nodes) {
                visit(node, env);
            }
        }

        @Override
        public Void visitProgram(Program node, Map<String, TinyType> env) {
            visitAll(node.getStatements(), env);
            return null;
        }

        @Override
        public Void visitFnDecl(FnDecl node, Map<String, TinyType> env) {
            Map<String, TinyType> inner = new HashMap<String, TinyType>(env);
            for (Parameter param : node.getParams()) {
                inner.put(param.getName(), TinyType.fromHint(param.getTypeHint()));
            }
            visit(node.getBody(), inner);
            return null;
        }

        @Override
        public Void visitStructDecl(StructDecl node, Map<String, TinyType> env) {
            for (FnDecl method : node.getMethods()) {
                visitFnDecl(method, env);
            }
            return null;
        }

        @Override
        public Void visitBlock(Block node, Map<String, TinyType> env) {
            visitAll(node.getStatements(), env);
            return null;
        }

        @Override
        public Void visitExpressionStmt(ExpressionStmt node, Map<String, TinyType> env) {
            visit(node.getExpression(), env);
            return null;
        }

        @Override
        public Void visitLetStmt(LetStmt node, Map<String, TinyType> env) {
            visit(node.getInitializer(), env);
            if (node.getTypeHint() != null) {
                env.put(node.getName(), TinyType.fromHint(node.getTypeHint()));
            } else if (node.getInitializer() != null) {
                env.put(node.getName(), inferExpr(node.getInitializer(), env));
            } else {
                env.put(node.getName(), TinyType.anyType());
            }
            return null;
        }

        @Override
        public Void visitConstStmt(ConstStmt node, Map<String, TinyType> env) {
            visit(node.getValue(), env);
            env.put(node.getName(), inferExpr(node.getValue(), env));
            return null;
        }

        @Override
        public Void visitAssignStmt(AssignStmt node, Map<String, TinyType> env) {
            visit(node.getValue(), env);
            if (node.getTarget() instanceof Identifier && !node.getOperator().isCompound()) {
                String name = ((Identifier) node.getTarget()).getName();
                env.put(name, inferExpr(node.getValue(), env));
            }
            return null;
        }

        @Override
        public Void visitIfStmt(IfStmt node, Map<String, TinyType> env) {
            visit(node.getCondition(), env);
            visit(node.getThenBranch(), env);
            for (IfStmt.ElifBranch elif : node.getElifBranches()) {
                visit(elif.getCondition(), env);
                visit(elif.getBody(), env);
            }
            visit(node.getElseBranch(), env);
            return null;
        }

        @Override
        public Void visitForStmt(ForStmt node, Map<String, TinyType> env) {
            visit(node.getIterable(), env);
            env.put(node.getVariable(), inferExpr(node.getIterable(), env).elementType());
            visit(node.getBody(), env);
            return null;
        }

        @Override
        public Void visitWhileStmt(WhileStmt node, Map<String, TinyType> env) {
            visit(node.getCondition(), env);
            visit(node.getBody(), env);
            return null;
        }

        @Override
        public Void visitReturnStmt(ReturnStmt node, Map<String, TinyType> env) {
            visit(node.getValue(), env);
            return null;
        }

        @Override
        public Void visitTryStmt(TryStmt node, Map<String, TinyType> env) {
            visit(node.getBody(), env);
            visit(node.getCatchBody(), env);
            return null;
        }

        @Override
        public Void visitThrowStmt(ThrowStmt node, Map<String, TinyType> env) {
            visit(node.getValue(), env);
            return null;
        }

        @Override
        public Void visitBinaryExpr(BinaryExpr node, Map<String, TinyType> env) {
            visit(node.getLeft(), env);
            visit(node.getRight(), env);
            return null;
        }

        @Override
        public Void visitUnaryExpr(UnaryExpr node, Map<String, TinyType> env) {
            visit(node.getOperand(), env);
            return null;
        }

        @Override
        public Void visitCallExpr(CallExpr node, Map<String, TinyType> env) {
            visit(node.getCallee(), env);
            visitAll(node.getArgs(), env);
            return null;
        }

        @Override
        public Void visitIndexExpr(IndexExpr node, Map<String, TinyType> env) {
            visit(node.getTarget(), env);
            visit(node.getIndex(), env);
            return null;
        }

        @Override
        public Void visitMemberExpr(MemberExpr node, Map<String, TinyType> env) {
            visit(node.getTarget(), env);
            return null;
        }

        @Override
        public Void visitArrayLiteral(ArrayLiteral node, Map<String, TinyType> env) {
            visitAll(node.getElements(), env);
            return null;
        }

        @Override
        public Void visitMapLiteral(MapLiteral node, Map<String, TinyType> env) {
            for (MapLiteral.Entry entry : node.getEntries()) {
                visit(entry.getKey(), env);
                visit(entry.getValue(), env);
            }
            return null;
        }

        @Override
        public Void visitLambdaExpr(LambdaExpr node, Map<String, TinyType> env) {
            Map<String, TinyType> inner = new HashMap<String, TinyType>(env);
            for (Parameter param : node.getParams()) {
                inner.put(param.getName(), TinyType.fromHint(param.getTypeHint()));
            }
            visit(node.getBody(), inner);
            return null;
        }

        @Override
        public Void visitConditionalExpr(ConditionalExpr node, Map<String, TinyType> env) {
            visit(node.getCondition(), env);
            visit(node.getThenExpr(), env);
            visit(node.getElseExpr(), env);
            return null;
        }

        @Override
        public Void visitRangeExpr(RangeExpr node, Map<String, TinyType> env) {
            visit(node.getStart(), env);
            visit(node.getEnd(), env);
            return null;
        }

        @Override
        public Void visitPipeExpr(PipeExpr node, Map<String, TinyType> env) {
            visit(node.getLeft(), env);
            visit(node.getRight(), env);
            return null;
        }

        @Override
        public Void visitStepChainExpr(StepChainExpr node, Map<String, TinyType> env) {
            visit(node.getSource(), env);
            for (StepChainExpr.Step step : node.getSteps()) {
                visitAll(step.getArgs(), env);
            }
            errors.addAll(infer(node, env).getErrors());
            return null;
        }

        @Override
        public Void visitStringInterpolation(StringInterpolation node, Map<String, TinyType> env) {
            visitAll(node.getParts(), env);
            return null;
        }

        @Override
        public Void visitMatchExpr(MatchExpr node, Map<String, TinyType> env) {
            visit(node.getSubject(), env);
            for (MatchExpr.MatchCase c : node.getCases()) {
                visit(c.getBody(), env);
            }
            return null;
        }
    }
}

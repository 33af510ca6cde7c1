package tinytalk.runtime.interpreter;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.expr.ArrayLiteral;
import com.tinytalk.compiler.ast.expr.BinaryExpr;
import com.tinytalk.compiler.ast.expr.CallExpr;
import com.tinytalk.compiler.ast.expr.ConditionalExpr;
import com.tinytalk.compiler.ast.expr.Expression;
import com.tinytalk.compiler.ast.expr.Identifier;
import com.tinytalk.compiler.ast.expr.IndexExpr;
import com.tinytalk.compiler.ast.expr.LambdaExpr;
import com.tinytalk.compiler.ast.expr.Literal;
import com.tinytalk.compiler.ast.expr.MapLiteral;
import com.tinytalk.compiler.ast.expr.MatchExpr;
import com.tinytalk.compiler.ast.expr.MemberExpr;
import com.tinytalk.compiler.ast.expr.PipeExpr;
import com.tinytalk.compiler.ast.expr.RangeExpr;
import com.tinytalk.compiler.ast.expr.StepChainExpr;
import com.tinytalk.compiler.ast.expr.StringInterpolation;
import com.tinytalk.compiler.ast.expr.UnaryExpr;
import com.tinytalk.compiler.ast.stmt.Block;
import tinytalk.runtime.TinyBool;
import tinytalk.runtime.TinyFloat;
import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;

import java.util.ArrayList;
import java.util.List;

/**
 * 表达式求值器
 *
 * <p>包内类，持有所属 {@link Interpreter} 的引用，子表达式一律经
 * {@link Interpreter#evaluate} 分派以便计量。</p>
 */
final class ExpressionEvaluator implements AstVisitor<TinyValue, Scope> {

    final Interpreter interp;

    ExpressionEvaluator(Interpreter interp) {
        this.interp = interp;
    }

    private TinyValue eval(Expression expr, Scope scope) {
        return interp.evaluate(expr, scope);
    }

    // ============ 字面量与标识符 ============

    @Override
    public TinyValue visitLiteral(Literal node, Scope scope) {
        switch (node.getKind()) {
            case INT:     return TinyInt.of(((Number) node.getValue()).longValue());
            case FLOAT:   return TinyFloat.of(((Number) node.getValue()).doubleValue());
            case STRING:  return TinyString.of((String) node.getValue());
            case BOOLEAN: return TinyBool.of((Boolean) node.getValue());
            default:      return TinyNull.NULL;
        }
    }

    @Override
    public TinyValue visitIdentifier(Identifier node, Scope scope) {
        TinyValue value = scope.lookup(node.getName());
        if (value == null) {
            throw new LanguageError(Suggestions.undefinedVariable(node.getName(), scope.collectNames()), node.getLine());
        }
        return value;
    }

    @Override
    public TinyValue visitStringInterpolation(StringInterpolation node, Scope scope) {
        StringBuilder sb = new StringBuilder();
        for (Expression part : node.getParts()) {
            sb.append(eval(part, scope).asString());
        }
        return TinyString.of(sb.toString());
    }

    @Override
    public TinyValue visitArrayLiteral(ArrayLiteral node, Scope scope) {
        TinyList list = new TinyList();
        for (Expression element : node.getElements()) {
            list.add(eval(element, scope));
        }
        return list;
    }

    @Override
    public TinyValue visitMapLiteral(MapLiteral node, Scope scope) {
        TinyMap map = new TinyMap();
        for (MapLiteral.Entry entry : node.getEntries()) {
            TinyValue key = eval(entry.getKey(), scope);
            map.put(key.toKey(), eval(entry.getValue(), scope));
        }
        return map;
    }

    @Override
    public TinyValue visitLambdaExpr(LambdaExpr node, Scope scope) {
        return new TinyFunction("<lambda>", node.getParams(), node.getBody(), scope, null);
    }

    @Override
    public TinyValue visitRangeExpr(RangeExpr node, Scope scope) {
        long start = rangeBound(eval(node.getStart(), scope));
        long end = rangeBound(eval(node.getEnd(), scope));
        if (node.isInclusive()) {
            end++;
        }
        TinyList list = new TinyList();
        if (end > start) {
            interp.meter().checkAllocation(end - start, node.getLine());
            for (long i = start; i < end; i++) {
                list.add(TinyInt.of(i));
            }
        }
        return list;
    }

    private static long rangeBound(TinyValue value) {
        if (BinaryOps.isIntegral(value)) {
            return value.asLong();
        }
        if (value.isFloat()) {
            return (long) value.asDouble();
        }
        throw new LanguageError("Range bounds must be numbers, got " + value.getTypeName());
    }

    // ============ 运算 ============

    @Override
    public TinyValue visitBinaryExpr(BinaryExpr node, Scope scope) {
        switch (node.getOperator()) {
            case AND: {
                if (!eval(node.getLeft(), scope).isTruthy()) return TinyBool.FALSE;
                return TinyBool.of(eval(node.getRight(), scope).isTruthy());
            }
            case OR: {
                if (eval(node.getLeft(), scope).isTruthy()) return TinyBool.TRUE;
                return TinyBool.of(eval(node.getRight(), scope).isTruthy());
            }
            default: {
                TinyValue left = eval(node.getLeft(), scope);
                TinyValue right = eval(node.getRight(), scope);
                interp.meter().checkAllocation(
                        BinaryOps.allocationSize(node.getOperator(), left, right), node.getLine());
                return BinaryOps.apply(node.getOperator(), left, right);
            }
        }
    }

    @Override
    public TinyValue visitUnaryExpr(UnaryExpr node, Scope scope) {
        TinyValue operand = eval(node.getOperand(), scope);
        switch (node.getOperator()) {
            case NEG:     return BinaryOps.negate(operand);
            case NOT:     return TinyBool.of(!operand.isTruthy());
            case BIT_NOT: return BinaryOps.bitNot(operand);
            default:
                throw new LanguageError("Unknown unary operator: " + node.getOperator());
        }
    }

    @Override
    public TinyValue visitConditionalExpr(ConditionalExpr node, Scope scope) {
        return eval(node.getCondition(), scope).isTruthy()
                ? eval(node.getThenExpr(), scope)
                : eval(node.getElseExpr(), scope);
    }

    // ============ 调用 ============

    @Override
    public TinyValue visitCallExpr(CallExpr node, Scope scope) {
        TinyValue callee = eval(node.getCallee(), scope);
        List<TinyValue> args = new ArrayList<TinyValue>(node.getArgs().size());
        for (Expression arg : node.getArgs()) {
            args.add(callArgument(arg, scope));
        }
        if (!callee.isCallable()) {
            throw new LanguageError("Cannot call " + callee.getTypeName(), node.getLine());
        }
        return interp.invoke(callee, args);
    }

    /**
     * 未绑定的裸标识符实参按其名字作为字符串传入：{@code print(Hello, world!)}
     */
    private TinyValue callArgument(Expression arg, Scope scope) {
        if (arg instanceof Identifier) {
            TinyValue value = scope.lookup(((Identifier) arg).getName());
            if (value != null) {
                interp.meter().tick(arg.getLine());
                return value;
            }
            return TinyString.of(((Identifier) arg).getName());
        }
        return eval(arg, scope);
    }

    /**
     * {@code x |> f(a)} 调用 f(x, a)；{@code x |> f} 调用 f(x)
     */
    @Override
    public TinyValue visitPipeExpr(PipeExpr node, Scope scope) {
        TinyValue input = eval(node.getLeft(), scope);
        Expression right = node.getRight();
        TinyValue fn;
        List<TinyValue> args = new ArrayList<TinyValue>();
        args.add(input);
        if (right instanceof CallExpr) {
            CallExpr call = (CallExpr) right;
            fn = eval(call.getCallee(), scope);
            for (Expression arg : call.getArgs()) {
                args.add(callArgument(arg, scope));
            }
        } else if (right instanceof Identifier) {
            String name = ((Identifier) right).getName();
            fn = scope.lookup(name);
            if (fn == null) {
                throw new LanguageError("Undefined '" + name + "'", right.getLine());
            }
        } else {
            fn = eval(right, scope);
        }
        if (!fn.isCallable()) {
            throw new LanguageError("Cannot call " + fn.getTypeName(), node.getLine());
        }
        return interp.invoke(fn, args);
    }

    // ============ 访问 ============

    @Override
    public TinyValue visitIndexExpr(IndexExpr node, Scope scope) {
        TinyValue target = eval(node.getTarget(), scope);
        TinyValue index = eval(node.getIndex(), scope);
        return readIndex(target, index);
    }

    static TinyValue readIndex(TinyValue target, TinyValue index) {
        if (target.isList()) {
            TinyList list = (TinyList) target;
            int i = list.normalizeIndex(integerIndex(index));
            if (i < 0) {
                throw new LanguageError("Index " + index.asString() + " out of bounds");
            }
            return list.get(i);
        }
        if (target.isString()) {
            String s = target.asString();
            long raw = integerIndex(index);
            long i = raw < 0 ? raw + s.length() : raw;
            if (i < 0 || i >= s.length()) {
                throw new LanguageError("Index " + raw + " out of bounds");
            }
            return TinyString.of(String.valueOf(s.charAt((int) i)));
        }
        if (target.isMap()) {
            return ((TinyMap) target).get(index.toKey());
        }
        throw new LanguageError("Cannot index " + target.getTypeName());
    }

    static long integerIndex(TinyValue index) {
        if (!BinaryOps.isIntegral(index)) {
            throw new LanguageError("Indices must be integers, got " + index.getTypeName());
        }
        return index.asLong();
    }

    @Override
    public TinyValue visitMemberExpr(MemberExpr node, Scope scope) {
        return MemberResolver.resolve(eval(node.getTarget(), scope), node.getMember());
    }

    // ============ 步骤链 ============

    @Override
    public TinyValue visitStepChainExpr(StepChainExpr node, Scope scope) {
        TinyValue data = eval(node.getSource(), scope);
        for (StepChainExpr.Step step : node.getSteps()) {
            List<TinyValue> args = new ArrayList<TinyValue>(step.getArgs().size());
            for (Expression arg : step.getArgs()) {
                args.add(eval(arg, scope));
            }
            try {
                data = interp.steps.apply(data, step.getVerb(), args);
            } catch (LanguageError e) {
                throw e.hasLine() ? e : e.withLine(step.getLocation().getLine());
            }
        }
        return data;
    }

    // ============ match ============

    /**
     * 选中的分支与其作用域（标识符模式的绑定在其中）
     */
    static final class Arm {
        final AstNode body;
        final Scope scope;

        Arm(AstNode body, Scope scope) {
            this.body = body;
            this.scope = scope;
        }
    }

    /**
     * 依次尝试各分支：{@code _} 总是匹配，裸标识符绑定主体值，其它模式按值相等比较
     */
    Arm selectArm(MatchExpr node, Scope scope) {
        TinyValue subject = eval(node.getSubject(), scope);
        for (MatchExpr.MatchCase matchCase : node.getCases()) {
            Expression pattern = matchCase.getPattern();
            if (pattern instanceof Identifier) {
                Identifier id = (Identifier) pattern;
                Scope armScope = new Scope(scope);
                if (!id.isWildcard()) {
                    armScope.define(id.getName(), subject);
                }
                return new Arm(matchCase.getBody(), armScope);
            }
            if (BinaryOps.valuesEqual(subject, eval(pattern, scope))) {
                return new Arm(matchCase.getBody(), new Scope(scope));
            }
        }
        return null;
    }

    @Override
    public TinyValue visitMatchExpr(MatchExpr node, Scope scope) {
        Arm arm = selectArm(node, scope);
        if (arm == null) {
            return TinyNull.NULL;
        }
        if (arm.body instanceof Block) {
            ControlSignal signal = interp.executeBlock((Block) arm.body, arm.scope);
            if (!signal.isNormal()) {
                throw new LanguageError("'" + signal.getKind().name().toLowerCase()
                        + "' inside a match arm is only allowed when the match is a statement", node.getLine());
            }
            return signal.getValue();
        }
        return eval((Expression) arm.body, arm.scope);
    }
}

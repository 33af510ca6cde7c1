package tinytalk.runtime.interpreter;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.decl.EnumDecl;
import com.tinytalk.compiler.ast.decl.FnDecl;
import com.tinytalk.compiler.ast.decl.StructDecl;
import com.tinytalk.compiler.ast.expr.Expression;
import com.tinytalk.compiler.ast.expr.Identifier;
import com.tinytalk.compiler.ast.expr.IndexExpr;
import com.tinytalk.compiler.ast.expr.MatchExpr;
import com.tinytalk.compiler.ast.expr.MemberExpr;
import com.tinytalk.compiler.ast.stmt.AssignStmt;
import com.tinytalk.compiler.ast.stmt.Block;
import com.tinytalk.compiler.ast.stmt.BreakStmt;
import com.tinytalk.compiler.ast.stmt.ConstStmt;
import com.tinytalk.compiler.ast.stmt.ContinueStmt;
import com.tinytalk.compiler.ast.stmt.ExpressionStmt;
import com.tinytalk.compiler.ast.stmt.ForStmt;
import com.tinytalk.compiler.ast.stmt.IfStmt;
import com.tinytalk.compiler.ast.stmt.ImportStmt;
import com.tinytalk.compiler.ast.stmt.LetStmt;
import com.tinytalk.compiler.ast.stmt.ReturnStmt;
import com.tinytalk.compiler.ast.stmt.ThrowStmt;
import com.tinytalk.compiler.ast.stmt.TryStmt;
import com.tinytalk.compiler.ast.stmt.WhileStmt;
import tinytalk.runtime.EnumVariant;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;

import java.util.List;

/**
 * 语句执行器，控制流以 {@link ControlSignal} 返回
 */
final class StatementExecutor implements AstVisitor<ControlSignal, Scope> {

    final Interpreter interp;

    StatementExecutor(Interpreter interp) {
        this.interp = interp;
    }

    private TinyValue eval(Expression expr, Scope scope) {
        return interp.evaluate(expr, scope);
    }

    // ============ 声明 ============

    @Override
    public ControlSignal visitLetStmt(LetStmt node, Scope scope) {
        TinyValue value = node.getInitializer() != null ? eval(node.getInitializer(), scope) : TinyNull.NULL;
        TypeChecks.check(value, node.getTypeHint(), "variable '" + node.getName() + "'");
        scope.define(node.getName(), value);
        return ControlSignal.normal(value);
    }

    @Override
    public ControlSignal visitConstStmt(ConstStmt node, Scope scope) {
        TinyValue value = eval(node.getValue(), scope);
        scope.defineConstant(node.getName(), value);
        return ControlSignal.normal(value);
    }

    @Override
    public ControlSignal visitFnDecl(FnDecl node, Scope scope) {
        TinyFunction fn = new TinyFunction(node.getName(), node.getParams(), node.getBody(), scope, node.getReturnType());
        scope.defineConstant(node.getName(), fn);
        return ControlSignal.NORMAL_NULL;
    }

    @Override
    public ControlSignal visitStructDecl(StructDecl node, Scope scope) {
        StructType type = new StructType(node.getName(), node.getFields());
        for (FnDecl method : node.getMethods()) {
            type.addMethod(new TinyFunction(method.getName(), method.getParams(), method.getBody(),
                    scope, method.getReturnType()));
        }
        interp.registerStruct(type);
        scope.defineConstant(node.getName(), type);
        return ControlSignal.NORMAL_NULL;
    }

    @Override
    public ControlSignal visitEnumDecl(EnumDecl node, Scope scope) {
        EnumType type = new EnumType(node.getName());
        for (EnumDecl.Variant variant : node.getVariants()) {
            TinyValue data = variant.getValue() != null ? eval(variant.getValue(), scope) : TinyNull.NULL;
            type.addVariant(new EnumVariant(node.getName(), variant.getName(), data));
        }
        interp.registerEnum(type);
        scope.defineConstant(node.getName(), type.toMap());
        return ControlSignal.NORMAL_NULL;
    }

    // ============ 基本语句 ============

    @Override
    public ControlSignal visitBlock(Block node, Scope scope) {
        return interp.executeBlock(node, new Scope(scope));
    }

    @Override
    public ControlSignal visitExpressionStmt(ExpressionStmt node, Scope scope) {
        Expression expr = node.getExpression();
        if (expr instanceof MatchExpr) {
            return executeMatch((MatchExpr) expr, scope);
        }
        return ControlSignal.normal(eval(expr, scope));
    }

    /**
     * 语句位置的 match：分支代码块中的 return / break / continue 向外传播
     */
    private ControlSignal executeMatch(MatchExpr node, Scope scope) {
        interp.meter().tick(node.getLine());
        ExpressionEvaluator.Arm arm = interp.expressions.selectArm(node, scope);
        if (arm == null) {
            return ControlSignal.NORMAL_NULL;
        }
        if (arm.body instanceof Block) {
            return interp.executeBlock((Block) arm.body, arm.scope);
        }
        return ControlSignal.normal(eval((Expression) arm.body, arm.scope));
    }

    @Override
    public ControlSignal visitAssignStmt(AssignStmt node, Scope scope) {
        TinyValue value = eval(node.getValue(), scope);
        AssignStmt.AssignOp op = node.getOperator();
        Expression target = node.getTarget();

        if (target instanceof Identifier) {
            String name = ((Identifier) target).getName();
            if (op.isCompound()) {
                TinyValue old = scope.lookup(name);
                if (old == null) {
                    throw new LanguageError(Suggestions.undefinedVariable(name, scope.collectNames()));
                }
                value = compound(op, old, value, node.getLine());
                scope.assign(name, value);
            } else if (!scope.assign(name, value)) {
                scope.define(name, value);
            }
        } else if (target instanceof IndexExpr) {
            IndexExpr indexExpr = (IndexExpr) target;
            TinyValue container = eval(indexExpr.getTarget(), scope);
            TinyValue index = eval(indexExpr.getIndex(), scope);
            if (op.isCompound()) {
                value = compound(op, ExpressionEvaluator.readIndex(container, index), value, node.getLine());
            }
            assignIndex(container, index, value);
        } else if (target instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) target;
            TinyValue object = eval(member.getTarget(), scope);
            if (op.isCompound()) {
                value = compound(op, MemberResolver.resolve(object, member.getMember()), value, node.getLine());
            }
            if (object instanceof StructInstance) {
                ((StructInstance) object).setField(member.getMember(), value);
            } else if (object.isMap()) {
                ((TinyMap) object).put(member.getMember(), value);
            } else {
                throw new LanguageError("Cannot assign to '." + member.getMember() + "' on " + object.getTypeName());
            }
        } else {
            throw new LanguageError("Invalid assignment target");
        }
        return ControlSignal.normal(value);
    }

    private TinyValue compound(AssignStmt.AssignOp op, TinyValue old, TinyValue value, int line) {
        interp.meter().checkAllocation(BinaryOps.allocationSize(op.getBinaryOp(), old, value), line);
        return BinaryOps.applyCompound(op.getBinaryOp(), old, value);
    }

    private static void assignIndex(TinyValue container, TinyValue index, TinyValue value) {
        if (container.isList()) {
            TinyList list = (TinyList) container;
            int i = list.normalizeIndex(ExpressionEvaluator.integerIndex(index));
            if (i < 0) {
                throw new LanguageError("Index " + index.asString() + " out of bounds");
            }
            list.set(i, value);
        } else if (container.isMap()) {
            ((TinyMap) container).put(index.toKey(), value);
        } else {
            throw new LanguageError("Cannot assign by index to " + container.getTypeName());
        }
    }

    // ============ 控制流 ============

    @Override
    public ControlSignal visitIfStmt(IfStmt node, Scope scope) {
        if (eval(node.getCondition(), scope).isTruthy()) {
            return visitBlock(node.getThenBranch(), scope);
        }
        for (IfStmt.ElifBranch elif : node.getElifBranches()) {
            if (eval(elif.getCondition(), scope).isTruthy()) {
                return visitBlock(elif.getBody(), scope);
            }
        }
        if (node.hasElse()) {
            return visitBlock(node.getElseBranch(), scope);
        }
        return ControlSignal.NORMAL_NULL;
    }

    @Override
    public ControlSignal visitForStmt(ForStmt node, Scope scope) {
        TinyValue iterable = eval(node.getIterable(), scope);
        List<TinyValue> items;
        if (iterable.isList()) {
            // 直接遍历底层存储，循环体内追加的元素也会被访问
            items = ((TinyList) iterable).getElements();
        } else if (iterable.isString()) {
            items = ((TinyString) iterable).chars().getElements();
        } else if (iterable.isMap()) {
            items = ((TinyMap) iterable).keyStrings();
        } else {
            throw new LanguageError("Cannot iterate over " + iterable.getTypeName());
        }

        for (int i = 0; i < items.size(); i++) {
            interp.meter().iteration(node.getLine());
            Scope loopScope = new Scope(scope);
            loopScope.define(node.getVariable(), items.get(i));
            ControlSignal signal = interp.executeBlock(node.getBody(), loopScope);
            if (signal.getKind() == ControlSignal.Kind.BREAK) {
                break;
            }
            if (signal.getKind() == ControlSignal.Kind.RETURN) {
                return signal;
            }
        }
        return ControlSignal.NORMAL_NULL;
    }

    @Override
    public ControlSignal visitWhileStmt(WhileStmt node, Scope scope) {
        while (true) {
            interp.meter().iteration(node.getLine());
            if (!eval(node.getCondition(), scope).isTruthy()) {
                break;
            }
            ControlSignal signal = interp.executeBlock(node.getBody(), new Scope(scope));
            if (signal.getKind() == ControlSignal.Kind.BREAK) {
                break;
            }
            if (signal.getKind() == ControlSignal.Kind.RETURN) {
                return signal;
            }
        }
        return ControlSignal.NORMAL_NULL;
    }

    @Override
    public ControlSignal visitReturnStmt(ReturnStmt node, Scope scope) {
        TinyValue value = node.getValue() != null ? eval(node.getValue(), scope) : TinyNull.NULL;
        return ControlSignal.returnValue(value);
    }

    @Override
    public ControlSignal visitBreakStmt(BreakStmt node, Scope scope) {
        return ControlSignal.BREAK;
    }

    @Override
    public ControlSignal visitContinueStmt(ContinueStmt node, Scope scope) {
        return ControlSignal.CONTINUE;
    }

    // ============ 错误处理 ============

    @Override
    public ControlSignal visitTryStmt(TryStmt node, Scope scope) {
        try {
            return interp.executeBlock(node.getBody(), new Scope(scope));
        } catch (LanguageError e) {
            if (node.getCatchBody() == null) {
                throw e;
            }
            Scope catchScope = new Scope(scope);
            if (node.getCatchVariable() != null) {
                catchScope.define(node.getCatchVariable(), TinyString.of(e.getRawMessage()));
            }
            return interp.executeBlock(node.getCatchBody(), catchScope);
        }
    }

    @Override
    public ControlSignal visitThrowStmt(ThrowStmt node, Scope scope) {
        TinyValue value = node.getValue() != null ? eval(node.getValue(), scope) : TinyNull.NULL;
        throw new LanguageError(value.asString(), node.getLine());
    }

    // ============ 模块 ============

    @Override
    public ControlSignal visitImportStmt(ImportStmt node, Scope scope) {
        interp.modules.importInto(node, scope);
        return ControlSignal.NORMAL_NULL;
    }
}

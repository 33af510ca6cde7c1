package com.tinytalk.compiler.ast.stmt;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.tinytalk.compiler.ast.expr.Expression;

/**
 * 赋值语句，目标为标识符、索引或成员访问
 */
public class AssignStmt extends Statement {
    private final Expression target;
    private final AssignOp operator;
    private final Expression value;

    public AssignStmt(SourceLocation location, Expression target, AssignOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public AssignOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }

    /**
     * 赋值运算符
     */
    public enum AssignOp {
        ASSIGN("=", null),
        ADD_ASSIGN("+=", BinaryOp.ADD),
        SUB_ASSIGN("-=", BinaryOp.SUB),
        MUL_ASSIGN("*=", BinaryOp.MUL),
        DIV_ASSIGN("/=", BinaryOp.DIV),
        MOD_ASSIGN("%=", BinaryOp.MOD);

        private final String symbol;
        private final BinaryOp binaryOp;

        AssignOp(String symbol, BinaryOp binaryOp) {
            this.symbol = symbol;
            this.binaryOp = binaryOp;
        }

        public String getSymbol() {
            return symbol;
        }

        /** 复合赋值对应的二元运算符，= 返回 null */
        public BinaryOp getBinaryOp() {
            return binaryOp;
        }

        public boolean isCompound() {
            return binaryOp != null;
        }
    }
}

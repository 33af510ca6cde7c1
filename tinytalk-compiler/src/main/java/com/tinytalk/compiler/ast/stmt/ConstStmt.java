package com.tinytalk.compiler.ast.stmt;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.expr.Expression;

/**
 * 常量声明：const name = expr，经典语法 when name = expr
 */
public class ConstStmt extends Statement {
    private final String name;
    private final Expression value;

    public ConstStmt(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstStmt(this, context);
    }
}

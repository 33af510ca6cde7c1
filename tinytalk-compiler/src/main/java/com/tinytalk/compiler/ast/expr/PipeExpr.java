package com.tinytalk.compiler.ast.expr;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;

/**
 * 管道表达式 left |> right（也写作 %&gt;%）
 */
public class PipeExpr extends Expression {
    private final Expression left;
    private final Expression right;

    public PipeExpr(SourceLocation location, Expression left, Expression right) {
        super(location);
        this.left = left;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPipeExpr(this, context);
    }
}

package com.tinytalk.compiler.ast.expr;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.decl.Parameter;
import com.tinytalk.compiler.ast.stmt.Block;

import java.util.List;

/**
 * Lambda 表达式：(a, b) => body 或 |a, b| body
 *
 * <p>body 为 {@link Block} 或 {@link Expression}。</p>
 */
public class LambdaExpr extends Expression {
    private final List<Parameter> params;
    private final AstNode body;

    public LambdaExpr(SourceLocation location, List<Parameter> params, AstNode body) {
        super(location);
        this.params = params;
        this.body = body;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public AstNode getBody() {
        return body;
    }

    public boolean hasBlockBody() {
        return body instanceof Block;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLambdaExpr(this, context);
    }
}

package com.tinytalk.compiler.ast.decl;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.expr.Expression;

/**
 * 函数参数 name [: type] [= default]
 */
public class Parameter extends AstNode {
    private final String name;
    private final String typeHint;          // 可选
    private final Expression defaultValue;  // 可选

    public Parameter(SourceLocation location, String name, String typeHint, Expression defaultValue) {
        super(location);
        this.name = name;
        this.typeHint = typeHint;
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public String getTypeHint() {
        return typeHint;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}

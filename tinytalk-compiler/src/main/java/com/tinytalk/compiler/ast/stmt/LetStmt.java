package com.tinytalk.compiler.ast.stmt;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.expr.Expression;

/**
 * 变量声明 let name [: type] [= expr]
 */
public class LetStmt extends Statement {
    private final String name;
    private final String typeHint;          // 可选
    private final Expression initializer;   // 可选

    public LetStmt(SourceLocation location, String name, String typeHint, Expression initializer) {
        super(location);
        this.name = name;
        this.typeHint = typeHint;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public String getTypeHint() {
        return typeHint;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }
}

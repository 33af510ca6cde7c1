package com.tinytalk.compiler.ast.stmt;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;

/**
 * try { ... } catch (e) { ... }
 */
public class TryStmt extends Statement {
    private final Block body;
    private final String catchVariable;  // 可选
    private final Block catchBody;       // 可选

    public TryStmt(SourceLocation location, Block body, String catchVariable, Block catchBody) {
        super(location);
        this.body = body;
        this.catchVariable = catchVariable;
        this.catchBody = catchBody;
    }

    public Block getBody() {
        return body;
    }

    public String getCatchVariable() {
        return catchVariable;
    }

    public Block getCatchBody() {
        return catchBody;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTryStmt(this, context);
    }
}

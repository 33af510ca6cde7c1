package com.tinytalk.compiler.ast.stmt;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.expr.Expression;

import java.util.List;

/**
 * if / elif / else 语句
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBranch;
    private final List<ElifBranch> elifBranches;
    private final Block elseBranch;  // 可选

    public IfStmt(SourceLocation location, Expression condition, Block thenBranch,
                  List<ElifBranch> elifBranches, Block elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elifBranches = elifBranches;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBranch() {
        return thenBranch;
    }

    public List<ElifBranch> getElifBranches() {
        return elifBranches;
    }

    public Block getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }

    public static final class ElifBranch {
        private final Expression condition;
        private final Block body;

        public ElifBranch(Expression condition, Block body) {
            this.condition = condition;
            this.body = body;
        }

        public Expression getCondition() {
            return condition;
        }

        public Block getBody() {
            return body;
        }
    }
}

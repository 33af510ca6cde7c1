package com.tinytalk.compiler.ast.expr;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;

import java.util.List;

/**
 * match 表达式
 *
 * <pre>
 * match v {
 *     1 => "one",
 *     n => "other {n}",
 *     _ => "none"
 * }
 * </pre>
 */
public class MatchExpr extends Expression {
    private final Expression subject;
    private final List<MatchCase> cases;

    public MatchExpr(SourceLocation location, Expression subject, List<MatchCase> cases) {
        super(location);
        this.subject = subject;
        this.cases = cases;
    }

    public Expression getSubject() {
        return subject;
    }

    public List<MatchCase> getCases() {
        return cases;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatchExpr(this, context);
    }

    /**
     * 分支：模式为字面量、通配符 _、绑定标识符或任意表达式；body 为表达式或 Block
     */
    public static final class MatchCase {
        private final Expression pattern;
        private final AstNode body;

        public MatchCase(Expression pattern, AstNode body) {
            this.pattern = pattern;
            this.body = body;
        }

        public Expression getPattern() {
            return pattern;
        }

        public AstNode getBody() {
            return body;
        }
    }
}

package com.tinytalk.compiler.ast.expr;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 步骤链：source _verb(args) _verb ...
 *
 * <p>source 只求值一次，结果依次经过每个步骤。</p>
 */
public class StepChainExpr extends Expression {
    private final Expression source;
    private final List<Step> steps;

    public StepChainExpr(SourceLocation location, Expression source, List<Step> steps) {
        super(location);
        this.source = source;
        this.steps = steps;
    }

    public Expression getSource() {
        return source;
    }

    public List<Step> getSteps() {
        return steps;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStepChainExpr(this, context);
    }

    /**
     * 单个步骤（动词 + 参数表达式）
     */
    public static final class Step {
        private final SourceLocation location;
        private final String verb;
        private final List<Expression> args;

        public Step(SourceLocation location, String verb, List<Expression> args) {
            this.location = location;
            this.verb = verb;
            this.args = args;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public String getVerb() {
            return verb;
        }

        public List<Expression> getArgs() {
            return args;
        }

        @Override
        public String toString() {
            return verb + "(" + args.size() + " args)";
        }
    }
}

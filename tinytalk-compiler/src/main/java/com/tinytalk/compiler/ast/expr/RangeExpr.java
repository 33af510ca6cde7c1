package com.tinytalk.compiler.ast.expr;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;

/**
 * 范围表达式：a..b（不含 b）或 a..=b（含 b）
 */
public class RangeExpr extends Expression {
    private final Expression start;
    private final Expression end;
    private final boolean inclusive;

    public RangeExpr(SourceLocation location, Expression start, Expression end, boolean inclusive) {
        super(location);
        this.start = start;
        this.end = end;
        this.inclusive = inclusive;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    public boolean isInclusive() {
        return inclusive;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRangeExpr(this, context);
    }
}

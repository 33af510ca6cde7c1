package com.tinytalk.compiler.ast.expr;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字符串插值（如 "Hello, {name}!"）
 *
 * <p>parts 中文本片段为字符串 {@link Literal}，其余为嵌入表达式，按源码顺序排列。</p>
 */
public class StringInterpolation extends Expression {
    private final List<Expression> parts;

    public StringInterpolation(SourceLocation location, List<Expression> parts) {
        super(location);
        this.parts = parts;
    }

    public List<Expression> getParts() {
        return parts;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStringInterpolation(this, context);
    }
}

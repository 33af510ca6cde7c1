package com.tinytalk.compiler.ast.expr;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 映射字面量 {k: v}
 *
 * <p>裸标识符键在解析时已转为字符串字面量，其余键按表达式求值。</p>
 */
public class MapLiteral extends Expression {
    private final List<Entry> entries;

    public MapLiteral(SourceLocation location, List<Entry> entries) {
        super(location);
        this.entries = entries;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMapLiteral(this, context);
    }

    /**
     * 键值对
     */
    public static final class Entry {
        private final Expression key;
        private final Expression value;

        public Entry(Expression key, Expression value) {
            this.key = key;
            this.value = value;
        }

        public Expression getKey() {
            return key;
        }

        public Expression getValue() {
            return value;
        }
    }
}

package com.tinytalk.compiler.ast.decl;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 枚举声明 enum Name { A, B = expr }
 */
public class EnumDecl extends Declaration {
    private final List<Variant> variants;

    public EnumDecl(SourceLocation location, String name, List<Variant> variants) {
        super(location, name);
        this.variants = variants;
    }

    public List<Variant> getVariants() {
        return variants;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumDecl(this, context);
    }

    public static final class Variant {
        private final String name;
        private final Expression value;  // 可选

        public Variant(String name, Expression value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }
    }
}

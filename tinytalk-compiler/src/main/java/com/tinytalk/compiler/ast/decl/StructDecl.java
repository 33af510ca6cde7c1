package com.tinytalk.compiler.ast.decl;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 结构体声明：{@code struct Name { ... }} 或经典语法 {@code blueprint Name ... end}
 */
public class StructDecl extends Declaration {
    private final List<FieldDecl> fields;
    private final List<FnDecl> methods;

    public StructDecl(SourceLocation location, String name, List<FieldDecl> fields, List<FnDecl> methods) {
        super(location, name);
        this.fields = fields;
        this.methods = methods;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public List<FnDecl> getMethods() {
        return methods;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }

    /**
     * 字段声明 name [: type] [= default]
     */
    public static final class FieldDecl {
        private final SourceLocation location;
        private final String name;
        private final String typeHint;
        private final Expression defaultValue;

        public FieldDecl(SourceLocation location, String name, String typeHint, Expression defaultValue) {
            this.location = location;
            this.name = name;
            this.typeHint = typeHint;
            this.defaultValue = defaultValue;
        }

        public SourceLocation getLocation() {
            return location;
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
    }
}

package com.tinytalk.compiler.ast.decl;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.stmt.Block;

import java.util.List;

/**
 * 函数声明
 *
 * <p>现代语法 {@code fn name(params) { ... }} 与经典语法
 * {@code law/forge name(params) ... end}、{@code when name(params) ... fin}
 * 都产生此节点。</p>
 */
public class FnDecl extends Declaration {
    private final List<Parameter> params;
    private final String returnType;  // 可选
    private final Block body;

    public FnDecl(SourceLocation location, String name, List<Parameter> params,
                  String returnType, Block body) {
        super(location, name);
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public String getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFnDecl(this, context);
    }
}

package com.tinytalk.compiler.ast.decl;

import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.stmt.Statement;

/**
 * 具名声明基类（函数、结构体、枚举）
 */
public abstract class Declaration extends Statement {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

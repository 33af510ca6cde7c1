package com.tinytalk.compiler.ast.expr;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}

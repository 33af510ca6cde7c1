package com.tinytalk.compiler.ast.stmt;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}

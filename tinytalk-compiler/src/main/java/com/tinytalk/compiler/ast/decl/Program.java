package com.tinytalk.compiler.ast.decl;

import com.tinytalk.compiler.ast.AstNode;
import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 程序（编译单元），独占其语句树
 */
public class Program extends AstNode {
    private final List<Statement> statements;

    public Program(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}

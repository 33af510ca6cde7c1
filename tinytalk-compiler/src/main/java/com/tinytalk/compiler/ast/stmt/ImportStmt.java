package com.tinytalk.compiler.ast.stmt;

import com.tinytalk.compiler.ast.AstVisitor;
import com.tinytalk.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 模块导入
 *
 * <ul>
 *   <li>{@code import "path"}：导入全部非下划线开头的顶层名字</li>
 *   <li>{@code import "path" as m}：以映射形式绑定到 m</li>
 *   <li>{@code from "path" use {a, b}}：只导入指定名字</li>
 * </ul>
 */
public class ImportStmt extends Statement {
    private final String path;
    private final String alias;         // 可选
    private final List<String> items;   // 空表示整体导入

    public ImportStmt(SourceLocation location, String path, String alias, List<String> items) {
        super(location);
        this.path = path;
        this.alias = alias;
        this.items = items;
    }

    public String getPath() {
        return path;
    }

    public String getAlias() {
        return alias;
    }

    public List<String> getItems() {
        return items;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportStmt(this, context);
    }
}

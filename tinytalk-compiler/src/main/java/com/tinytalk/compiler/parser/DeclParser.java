package com.tinytalk.compiler.parser;

import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.decl.EnumDecl;
import com.tinytalk.compiler.ast.decl.FnDecl;
import com.tinytalk.compiler.ast.decl.Parameter;
import com.tinytalk.compiler.ast.decl.StructDecl;
import com.tinytalk.compiler.ast.expr.Expression;
import com.tinytalk.compiler.ast.stmt.Block;
import com.tinytalk.compiler.ast.stmt.ConstStmt;
import com.tinytalk.compiler.ast.stmt.Statement;
import com.tinytalk.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.tinytalk.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类：函数、结构体、枚举，以及经典语法的 blueprint / law / forge / when
 *
 * <p>两套语法产生同样的节点，解释器无法区分它们来自哪种写法。</p>
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 现代语法 ============

    /**
     * fn name(params) [-> T | : T] { body }
     */
    FnDecl parseFnDecl() {
        Token keyword = parser.advance();
        String name = parser.expectName("Expected function name");
        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = parseParams();
        parser.expect(RPAREN, "Expected ')'");

        String returnType = null;
        if (parser.matchAny(ARROW, COLON)) {
            returnType = parseTypeHint();
        }
        parser.skipNewlines();
        if (!parser.check(LBRACE)) {
            throw parser.error("Expected '{' before function body", "LBRACE");
        }
        Block body = parser.stmtParser.parseBlock();
        return new FnDecl(parser.locationOf(keyword), name, params, returnType, body);
    }

    /**
     * 参数列表（不含括号），遇到 ')' 结束
     */
    List<Parameter> parseParams() {
        List<Parameter> params = new ArrayList<Parameter>();
        parser.skipNewlines();
        if (parser.check(RPAREN)) {
            return params;
        }
        do {
            parser.skipNewlines();
            Token nameToken = parser.current();
            String name = parser.expectName("Expected parameter name");
            String typeHint = null;
            if (parser.match(COLON)) {
                typeHint = parseTypeHint();
            }
            Expression defaultValue = null;
            if (parser.match(ASSIGN)) {
                defaultValue = parser.exprParser.parseExpression();
            }
            params.add(new Parameter(parser.locationOf(nameToken), name, typeHint, defaultValue));
            parser.skipNewlines();
        } while (parser.match(COMMA));
        return params;
    }

    /**
     * 类型标注：?T、T?、T[A, B]
     */
    String parseTypeHint() {
        boolean optional = parser.match(QUESTION);
        Token token = parser.current();
        if (!token.is(IDENTIFIER) && !token.getType().isTypeKeyword()) {
            throw parser.error("Expected type", "type");
        }
        parser.advance();
        StringBuilder sb = new StringBuilder(token.getLexeme());
        if (parser.match(LBRACKET)) {
            sb.append('[').append(parseTypeHint());
            while (parser.match(COMMA)) {
                sb.append(", ").append(parseTypeHint());
            }
            parser.expect(RBRACKET, "Expected ']'");
            sb.append(']');
        }
        if (optional || parser.match(QUESTION)) {
            sb.insert(0, '?');
        }
        return sb.toString();
    }

    /**
     * struct Name { x [: T] [= d], ...  fn method(..) { .. } }
     */
    StructDecl parseStructDecl() {
        Token keyword = parser.advance();
        String name = parser.expectName("Expected struct name");
        parser.skipNewlines();
        parser.expect(LBRACE, "Expected '{' after struct name");

        List<StructDecl.FieldDecl> fields = new ArrayList<StructDecl.FieldDecl>();
        List<FnDecl> methods = new ArrayList<FnDecl>();
        skipMemberSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            if (parser.check(KW_FN)) {
                methods.add(parseFnDecl());
            } else {
                fields.add(parseField());
            }
            skipMemberSeparators();
        }
        parser.expect(RBRACE, "Expected '}' after struct body");
        return new StructDecl(parser.locationOf(keyword), name, fields, methods);
    }

    /**
     * enum Name { A [= expr], B, ... }
     */
    EnumDecl parseEnumDecl() {
        Token keyword = parser.advance();
        String name = parser.expectName("Expected enum name");
        parser.skipNewlines();
        parser.expect(LBRACE, "Expected '{' after enum name");

        List<EnumDecl.Variant> variants = new ArrayList<EnumDecl.Variant>();
        skipMemberSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            String variant = parser.expectName("Expected variant name");
            Expression value = null;
            if (parser.match(ASSIGN)) {
                value = parser.exprParser.parseExpression();
            }
            variants.add(new EnumDecl.Variant(variant, value));
            skipMemberSeparators();
        }
        parser.expect(RBRACE, "Expected '}' after enum body");
        return new EnumDecl(parser.locationOf(keyword), name, variants);
    }

    private StructDecl.FieldDecl parseField() {
        Token nameToken = parser.current();
        String field = parser.expectName("Expected field name");
        String typeHint = null;
        if (parser.match(COLON)) {
            typeHint = parseTypeHint();
        }
        Expression defaultValue = null;
        if (parser.match(ASSIGN)) {
            defaultValue = parser.exprParser.parseExpression();
        }
        return new StructDecl.FieldDecl(parser.locationOf(nameToken), field, typeHint, defaultValue);
    }

    private void skipMemberSeparators() {
        while (parser.matchAny(NEWLINE, SEMICOLON, COMMA)) {
            // 成员之间可用逗号、分号或换行分隔
        }
    }

    // ============ 经典语法 ============

    /**
     * blueprint Name (field x [: T] [= d] | forge m(..) .. end | law m(..) .. end)* end
     */
    StructDecl parseBlueprint() {
        Token keyword = parser.advance();
        String name = parser.expectName("Expected blueprint name");

        List<StructDecl.FieldDecl> fields = new ArrayList<StructDecl.FieldDecl>();
        List<FnDecl> methods = new ArrayList<FnDecl>();
        parser.skipSeparators();
        while (!parser.check(KW_END) && !parser.isAtEnd()) {
            if (parser.match(KW_FIELD)) {
                fields.add(parseField());
            } else if (parser.checkAny(KW_FORGE, KW_LAW)) {
                methods.add(parseEndDelimitedFn());
            } else {
                throw parser.error("Expected 'field', 'forge', 'law' or 'end' in blueprint");
            }
            parser.skipSeparators();
        }
        parser.expect(KW_END, "Expected 'end' after blueprint");
        return new StructDecl(parser.locationOf(keyword), name, fields, methods);
    }

    /**
     * law name[(params)] [-> T] .. end 或 forge name[(params)] .. end
     */
    FnDecl parseEndDelimitedFn() {
        Token keyword = parser.advance();
        String name = parser.expectName("Expected function name");
        List<Parameter> params = new ArrayList<Parameter>();
        if (parser.match(LPAREN)) {
            params = parseParams();
            parser.expect(RPAREN, "Expected ')'");
        }
        String returnType = null;
        if (parser.match(ARROW)) {
            returnType = parseTypeHint();
        }
        SourceLocation loc = parser.locationOf(keyword);
        Block body = parser.stmtParser.parseStatementsUntil(loc, KW_END);
        parser.expect(KW_END, "Expected 'end'");
        return new FnDecl(loc, name, params, returnType, body);
    }

    /**
     * when name(params) .. fin|end 产生函数，when name = expr 产生常量
     */
    Statement parseWhen() {
        Token keyword = parser.advance();
        String name = parser.expectName("Expected name after 'when'");
        SourceLocation loc = parser.locationOf(keyword);

        if (parser.match(LPAREN)) {
            List<Parameter> params = parseParams();
            parser.expect(RPAREN, "Expected ')'");
            String returnType = null;
            if (parser.match(ARROW)) {
                returnType = parseTypeHint();
            }
            Block body = parser.stmtParser.parseStatementsUntil(loc, KW_FIN, KW_END);
            if (!parser.match(KW_FIN)) {
                parser.expect(KW_END, "Expected 'fin' or 'end'");
            }
            return new FnDecl(loc, name, params, returnType, body);
        }

        parser.expect(ASSIGN, "Expected '=' or '(' after name");
        parser.skipNewlines();
        Expression value = parser.exprParser.parseExpression();
        return new ConstStmt(loc, name, value);
    }
}

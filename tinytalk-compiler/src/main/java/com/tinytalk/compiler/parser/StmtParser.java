package com.tinytalk.compiler.parser;

import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.expr.Expression;
import com.tinytalk.compiler.ast.expr.Identifier;
import com.tinytalk.compiler.ast.expr.IndexExpr;
import com.tinytalk.compiler.ast.expr.MemberExpr;
import com.tinytalk.compiler.ast.stmt.*;
import com.tinytalk.compiler.ast.stmt.AssignStmt.AssignOp;
import com.tinytalk.compiler.lexer.Token;
import com.tinytalk.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.tinytalk.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        parser.skipNewlines();

        // 现代语法
        if (parser.check(KW_LET)) return parseLet();
        if (parser.check(KW_CONST)) return parseConst();
        if (parser.check(KW_FN)) return parser.declParser.parseFnDecl();
        if (parser.check(KW_IF)) return parseIf();
        if (parser.check(KW_FOR)) return parseFor();
        if (parser.check(KW_WHILE)) return parseWhile();
        if (parser.check(KW_RETURN)) return parseReturn();
        if (parser.check(KW_BREAK)) {
            return new BreakStmt(parser.locationOf(parser.advance()));
        }
        if (parser.check(KW_CONTINUE)) {
            return new ContinueStmt(parser.locationOf(parser.advance()));
        }
        if (parser.check(KW_FROM)) return parseFromImport();
        if (parser.check(KW_IMPORT)) return parseImport();
        if (parser.check(KW_TRY)) return parseTry();
        if (parser.check(KW_THROW)) return parseThrow();
        if (parser.check(KW_STRUCT)) return parser.declParser.parseStructDecl();
        if (parser.check(KW_ENUM)) return parser.declParser.parseEnumDecl();

        // 经典语法
        if (parser.check(KW_BLUEPRINT)) return parser.declParser.parseBlueprint();
        if (parser.checkAny(KW_LAW, KW_FORGE)) return parser.declParser.parseEndDelimitedFn();
        if (parser.check(KW_WHEN)) return parser.declParser.parseWhen();
        if (parser.checkAny(KW_FIN, KW_REPLY, KW_DO)) return parseKeywordReturn();

        // 裸代码块
        if (parser.check(LBRACE)) return parseBlock();

        return parseExpressionStatement();
    }

    // ============ 代码块 ============

    /**
     * 解析 { ... } 代码块（当前 token 为 '{'）
     */
    Block parseBlock() {
        Token open = parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<Statement>();
        parser.skipSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
            parser.skipSeparators();
        }
        parser.expect(RBRACE, "Expected '}'");
        return new Block(parser.locationOf(open), statements);
    }

    /**
     * 解析经典语法的语句序列，直到遇到任一终止记号（不消费终止记号）
     */
    Block parseStatementsUntil(SourceLocation loc, TokenType... terminators) {
        List<Statement> statements = new ArrayList<Statement>();
        parser.skipSeparators();
        while (!parser.checkAny(terminators) && !parser.isAtEnd()) {
            statements.add(parseStatement());
            parser.skipSeparators();
        }
        return new Block(loc, statements);
    }

    /**
     * 跳过换行后解析代码块
     */
    private Block parseBodyBlock(String message) {
        parser.skipNewlines();
        if (!parser.check(LBRACE)) {
            throw parser.error(message, "LBRACE");
        }
        return parseBlock();
    }

    // ============ 声明语句 ============

    private Statement parseLet() {
        Token keyword = parser.advance();
        String name = parser.expectName("Expected variable name");
        String typeHint = null;
        if (parser.match(COLON)) {
            typeHint = parser.declParser.parseTypeHint();
        }
        Expression value = null;
        if (parser.match(ASSIGN)) {
            parser.skipNewlines();
            value = parser.exprParser.parseExpression();
        }
        return new LetStmt(parser.locationOf(keyword), name, typeHint, value);
    }

    private Statement parseConst() {
        Token keyword = parser.advance();
        String name = parser.expectName("Expected constant name");
        parser.expect(ASSIGN, "Expected '=' after constant name");
        parser.skipNewlines();
        Expression value = parser.exprParser.parseExpression();
        return new ConstStmt(parser.locationOf(keyword), name, value);
    }

    // ============ 控制流 ============

    private Statement parseIf() {
        Token keyword = parser.advance();
        Expression condition = parser.exprParser.parseExpression();
        Block thenBranch = parseBodyBlock("Expected '{' after if condition");

        List<IfStmt.ElifBranch> elifs = new ArrayList<IfStmt.ElifBranch>();
        Block elseBranch = null;

        int beforeElse = parser.mark();
        parser.skipNewlines();
        while (true) {
            if (parser.match(KW_ELIF)) {
                Expression cond = parser.exprParser.parseExpression();
                elifs.add(new IfStmt.ElifBranch(cond, parseBodyBlock("Expected '{' after elif condition")));
            } else if (parser.check(KW_ELSE) && parser.peek(1).is(KW_IF)) {
                // else if 视同 elif
                parser.advance();
                parser.advance();
                Expression cond = parser.exprParser.parseExpression();
                elifs.add(new IfStmt.ElifBranch(cond, parseBodyBlock("Expected '{' after else if condition")));
            } else {
                break;
            }
            beforeElse = parser.mark();
            parser.skipNewlines();
        }
        if (parser.match(KW_ELSE)) {
            elseBranch = parseBodyBlock("Expected '{' after else");
        } else {
            parser.reset(beforeElse);
        }
        return new IfStmt(parser.locationOf(keyword), condition, thenBranch, elifs, elseBranch);
    }

    private Statement parseFor() {
        Token keyword = parser.advance();
        String variable = parser.expectName("Expected loop variable");
        parser.expect(KW_IN, "Expected 'in'");
        Expression iterable = parser.exprParser.parseExpression();
        Block body = parseBodyBlock("Expected '{' after for clause");
        return new ForStmt(parser.locationOf(keyword), variable, iterable, body);
    }

    private Statement parseWhile() {
        Token keyword = parser.advance();
        Expression condition = parser.exprParser.parseExpression();
        Block body = parseBodyBlock("Expected '{' after while condition");
        return new WhileStmt(parser.locationOf(keyword), condition, body);
    }

    private Statement parseReturn() {
        Token keyword = parser.advance();
        Expression value = null;
        if (!parser.checkAny(NEWLINE, SEMICOLON, RBRACE, EOF)) {
            value = parser.exprParser.parseExpression();
        }
        return new ReturnStmt(parser.locationOf(keyword), value);
    }

    /**
     * fin / reply / do 均产生 ReturnStmt
     */
    private Statement parseKeywordReturn() {
        Token keyword = parser.advance();
        Expression value = null;
        if (!parser.checkAny(NEWLINE, SEMICOLON, KW_END, KW_FIN, EOF)) {
            value = parser.exprParser.parseExpression();
        }
        return new ReturnStmt(parser.locationOf(keyword), value);
    }

    private Statement parseTry() {
        Token keyword = parser.advance();
        Block body = parseBodyBlock("Expected '{' after try");
        String catchVariable = null;
        Block catchBody = null;

        int beforeCatch = parser.mark();
        parser.skipNewlines();
        if (parser.match(KW_CATCH)) {
            if (parser.match(LPAREN)) {
                catchVariable = parser.expectName("Expected catch variable");
                parser.expect(RPAREN, "Expected ')' after catch variable");
            } else if (parser.check(IDENTIFIER)) {
                catchVariable = parser.advance().getLexeme();
            }
            catchBody = parseBodyBlock("Expected '{' after catch");
        } else {
            parser.reset(beforeCatch);
        }
        return new TryStmt(parser.locationOf(keyword), body, catchVariable, catchBody);
    }

    private Statement parseThrow() {
        Token keyword = parser.advance();
        Expression value = parser.exprParser.parseExpression();
        return new ThrowStmt(parser.locationOf(keyword), value);
    }

    // ============ 导入 ============

    /**
     * import "path" [as alias]
     */
    private Statement parseImport() {
        Token keyword = parser.advance();
        String path = parser.expect(STRING, "Expected module path").getText();
        String alias = null;
        if (parser.match(KW_AS)) {
            alias = parser.expectName("Expected alias after 'as'");
        }
        return new ImportStmt(parser.locationOf(keyword), path, alias, Collections.<String>emptyList());
    }

    /**
     * from "path" use {a, b} 或 from "path" use a, b
     */
    private Statement parseFromImport() {
        Token keyword = parser.advance();
        String path = parser.expect(STRING, "Expected module path after 'from'").getText();
        parser.expect(KW_USE, "Expected 'use' after module path");
        List<String> items = new ArrayList<String>();
        if (parser.match(LBRACE)) {
            parser.skipNewlines();
            if (!parser.check(RBRACE)) {
                items.add(parser.expectName("Expected name"));
                while (parser.match(COMMA)) {
                    parser.skipNewlines();
                    if (parser.check(RBRACE)) break;
                    items.add(parser.expectName("Expected name"));
                }
            }
            parser.skipNewlines();
            parser.expect(RBRACE, "Expected '}'");
        } else {
            items.add(parser.expectName("Expected name after 'use'"));
            while (parser.match(COMMA)) {
                items.add(parser.expectName("Expected name"));
            }
        }
        return new ImportStmt(parser.locationOf(keyword), path, null, items);
    }

    // ============ 表达式语句 ============

    private Statement parseExpressionStatement() {
        Token start = parser.current();
        Expression expr = parser.exprParser.parseExpression();

        AssignOp op = assignOp(parser.current().getType());
        if (op != null) {
            Token opToken = parser.advance();
            if (!(expr instanceof Identifier || expr instanceof IndexExpr || expr instanceof MemberExpr)) {
                throw new ParseException("Invalid assignment target", opToken);
            }
            parser.skipNewlines();
            Expression value = parser.exprParser.parseExpression();
            return new AssignStmt(expr.getLocation(), expr, op, value);
        }
        return new ExpressionStmt(parser.locationOf(start), expr);
    }

    private static AssignOp assignOp(TokenType type) {
        switch (type) {
            case ASSIGN:
            case WALRUS:     return AssignOp.ASSIGN;
            case PLUS_EQ:    return AssignOp.ADD_ASSIGN;
            case MINUS_EQ:   return AssignOp.SUB_ASSIGN;
            case STAR_EQ:    return AssignOp.MUL_ASSIGN;
            case SLASH_EQ:   return AssignOp.DIV_ASSIGN;
            case PERCENT_EQ: return AssignOp.MOD_ASSIGN;
            default:         return null;
        }
    }
}

package com.tinytalk.compiler.parser;

import com.tinytalk.compiler.ast.SourceLocation;
import com.tinytalk.compiler.ast.decl.Program;
import com.tinytalk.compiler.ast.expr.Expression;
import com.tinytalk.compiler.ast.stmt.Statement;
import com.tinytalk.compiler.lexer.Lexer;
import com.tinytalk.compiler.lexer.Token;
import com.tinytalk.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.tinytalk.compiler.lexer.TokenType.*;

/**
 * TinyTalk 语法分析器（递归下降）
 *
 * <p>游标是记号列表中的下标，{@link #mark()} / {@link #reset(int)} 保存和恢复位置，
 * 用于 lambda 与括号表达式的区分以及跨行步骤链的前瞻。</p>
 */
public class Parser {

    final List<Token> tokens;
    final String fileName;
    private int pos = 0;

    // === Helper 实例 ===
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens, String fileName) {
        this.fileName = fileName;
        this.tokens = ensureEof(tokens);
    }

    public Parser(List<Token> tokens) {
        this(tokens, "<input>");
    }

    public Parser(Lexer lexer) {
        this(lexer.tokenize(), lexer.getFileName());
    }

    private static List<Token> ensureEof(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).is(EOF)) {
            return tokens;
        }
        List<Token> copy = new ArrayList<Token>(tokens);
        Token last = copy.isEmpty() ? null : copy.get(copy.size() - 1);
        copy.add(new Token(EOF, "", null,
                last != null ? last.getLine() : 1, last != null ? last.getColumn() : 1,
                last != null ? last.getOffset() : 0));
        return copy;
    }

    // ============ 基础方法 ============

    Token current() {
        return tokens.get(pos);
    }

    Token previous() {
        return tokens.get(Math.max(0, pos - 1));
    }

    /**
     * 向后查看第 distance 个 token（0 为当前）
     */
    Token peek(int distance) {
        int index = pos + distance;
        if (index >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(index);
    }

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        Token token = tokens.get(pos);
        if (!token.is(EOF)) {
            pos++;
        }
        return token;
    }

    /**
     * 保存当前位置
     */
    int mark() {
        return pos;
    }

    /**
     * 恢复到 mark 返回的位置
     */
    void reset(int marked) {
        pos = marked;
    }

    boolean check(TokenType type) {
        return current().getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean checkStep() {
        return current().isStep();
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message, type.name());
    }

    /**
     * 期望名字：标识符或可作标识符的类型关键词
     */
    String expectName(String message) {
        if (check(IDENTIFIER) || current().getType().isTypeKeyword()) {
            return advance().getLexeme();
        }
        throw error(message, "IDENTIFIER");
    }

    /**
     * 构造指向当前 token 的语法错误；ERROR 记号直接报告词法问题
     */
    ParseException error(String message, String expected) {
        Token token = current();
        if (token.is(ERROR)) {
            return new ParseException(String.valueOf(token.getLiteral()), token);
        }
        return new ParseException(message, token, expected);
    }

    ParseException error(String message) {
        return error(message, null);
    }

    SourceLocation location() {
        return SourceLocation.of(fileName, current());
    }

    SourceLocation locationOf(Token token) {
        return SourceLocation.of(fileName, token);
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    void skipNewlines() {
        while (match(NEWLINE)) {
            // 跳过
        }
    }

    void skipSeparators() {
        while (matchAny(NEWLINE, SEMICOLON)) {
            // 跳过换行符和分号
        }
    }

    // ============ 程序解析 ============

    /**
     * 解析程序，遇到第一个语法错误即抛出 {@link ParseException}
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<Statement>();
        skipSeparators();
        while (!isAtEnd()) {
            statements.add(stmtParser.parseStatement());
            skipSeparators();
        }
        return new Program(loc, statements);
    }

    /**
     * 容错解析：遇到错误时跳到下一行继续解析，供工具使用
     */
    public ParseResult parseTolerant() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<Statement>();
        List<ParseError> errors = new ArrayList<ParseError>();
        skipSeparators();
        while (!isAtEnd()) {
            try {
                statements.add(stmtParser.parseStatement());
            } catch (ParseException e) {
                errors.add(new ParseError(e.getRawMessage(), e.getToken()));
                synchronize();
            }
            skipSeparators();
        }
        return new ParseResult(new Program(loc, statements), errors);
    }

    /**
     * 错误恢复：跳到下一个语句分隔符
     */
    private void synchronize() {
        while (!isAtEnd() && !checkAny(NEWLINE, SEMICOLON)) {
            advance();
        }
    }

    /**
     * 解析单个表达式（插值子表达式、REPL 等使用），要求消费全部 token
     */
    public Expression parseExpressionOnly() {
        skipNewlines();
        Expression expr = exprParser.parseExpression();
        skipSeparators();
        if (!isAtEnd()) {
            throw error("Unexpected token '" + current().getLexeme() + "' after expression");
        }
        return expr;
    }
}

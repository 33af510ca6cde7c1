package com.tinytalk.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TinyTalk 词法分析器
 *
 * <p>从不抛异常：非法字符和未闭合字符串都以 {@link TokenType#ERROR} 记号输出，
 * 由语法分析器带上下文报告。Token 流总以一个 EOF 结束。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // ( 和 [ 的嵌套深度：大于 0 时 // 是整除，否则是行注释
    private int nesting = 0;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    // 步骤动词（含别名）到 Token 类型
    private static final Map<String, TokenType> STEP_KEYWORDS;

    // 别名到规范动词名
    private static final Map<String, String> STEP_ALIASES;

    // 多字符操作符，按匹配优先级排列
    private static final String[] MULTI_OPS = {
            "**", "//", ":=", "~~", "==", "!=", "<=", ">=", "&&", "||",
            "<<", ">>", "+=", "-=", "*=", "/=", "%>%", "%=", "->", "=>",
            "|>", "::", "..=", ".."
    };
    private static final TokenType[] MULTI_OP_TYPES = {
            TokenType.POWER, TokenType.FLOOR_DIV, TokenType.WALRUS, TokenType.NE,
            TokenType.EQ, TokenType.NE, TokenType.LE, TokenType.GE,
            TokenType.AND, TokenType.OR, TokenType.SHL, TokenType.SHR,
            TokenType.PLUS_EQ, TokenType.MINUS_EQ, TokenType.STAR_EQ, TokenType.SLASH_EQ,
            TokenType.PIPE, TokenType.PERCENT_EQ, TokenType.ARROW, TokenType.FAT_ARROW,
            TokenType.PIPE, TokenType.DOUBLE_COLON, TokenType.RANGE_INCL, TokenType.RANGE
    };

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 经典语法
        map.put("when", TokenType.KW_WHEN);
        map.put("fin", TokenType.KW_FIN);
        map.put("blueprint", TokenType.KW_BLUEPRINT);
        map.put("law", TokenType.KW_LAW);
        map.put("field", TokenType.KW_FIELD);
        map.put("forge", TokenType.KW_FORGE);
        map.put("reply", TokenType.KW_REPLY);
        map.put("do", TokenType.KW_DO);
        map.put("end", TokenType.KW_END);

        // 现代语法
        map.put("let", TokenType.KW_LET);
        map.put("const", TokenType.KW_CONST);
        map.put("fn", TokenType.KW_FN);
        map.put("return", TokenType.KW_RETURN);
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("elif", TokenType.KW_ELIF);
        map.put("for", TokenType.KW_FOR);
        map.put("while", TokenType.KW_WHILE);
        map.put("in", TokenType.KW_IN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("match", TokenType.KW_MATCH);
        map.put("struct", TokenType.KW_STRUCT);
        map.put("enum", TokenType.KW_ENUM);
        map.put("import", TokenType.KW_IMPORT);
        map.put("from", TokenType.KW_FROM);
        map.put("use", TokenType.KW_USE);
        map.put("as", TokenType.KW_AS);
        map.put("try", TokenType.KW_TRY);
        map.put("catch", TokenType.KW_CATCH);
        map.put("throw", TokenType.KW_THROW);

        // 字面量
        map.put("true", TokenType.BOOLEAN);
        map.put("false", TokenType.BOOLEAN);
        map.put("null", TokenType.NULL);
        map.put("nil", TokenType.NULL);

        // 逻辑
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);

        // 自然语言比较
        map.put("is", TokenType.KW_IS);
        map.put("isnt", TokenType.KW_ISNT);
        map.put("has", TokenType.KW_HAS);
        map.put("hasnt", TokenType.KW_HASNT);
        map.put("isin", TokenType.KW_ISIN);
        map.put("islike", TokenType.KW_ISLIKE);

        // 类型
        map.put("int", TokenType.KW_INT);
        map.put("float", TokenType.KW_FLOAT);
        map.put("str", TokenType.KW_STR);
        map.put("bool", TokenType.KW_BOOL);
        map.put("list", TokenType.KW_LIST);
        map.put("map", TokenType.KW_MAP);
        map.put("any", TokenType.KW_ANY);
        map.put("void", TokenType.KW_VOID);

        KEYWORDS = Collections.unmodifiableMap(map);

        Map<String, TokenType> steps = new LinkedHashMap<>();
        steps.put("_filter", TokenType.STEP_FILTER);
        steps.put("_sort", TokenType.STEP_SORT);
        steps.put("_map", TokenType.STEP_MAP);
        steps.put("_take", TokenType.STEP_TAKE);
        steps.put("_drop", TokenType.STEP_DROP);
        steps.put("_first", TokenType.STEP_FIRST);
        steps.put("_last", TokenType.STEP_LAST);
        steps.put("_reverse", TokenType.STEP_REVERSE);
        steps.put("_unique", TokenType.STEP_UNIQUE);
        steps.put("_count", TokenType.STEP_COUNT);
        steps.put("_sum", TokenType.STEP_SUM);
        steps.put("_avg", TokenType.STEP_AVG);
        steps.put("_min", TokenType.STEP_MIN);
        steps.put("_max", TokenType.STEP_MAX);
        steps.put("_group", TokenType.STEP_GROUP);
        steps.put("_flatten", TokenType.STEP_FLATTEN);
        steps.put("_zip", TokenType.STEP_ZIP);
        steps.put("_chunk", TokenType.STEP_CHUNK);
        steps.put("_reduce", TokenType.STEP_REDUCE);
        steps.put("_sortBy", TokenType.STEP_SORT_BY);
        steps.put("_join", TokenType.STEP_JOIN);
        steps.put("_mapValues", TokenType.STEP_MAP_VALUES);
        steps.put("_each", TokenType.STEP_EACH);
        // dplyr 风格
        steps.put("_select", TokenType.STEP_SELECT);
        steps.put("_mutate", TokenType.STEP_MUTATE);
        steps.put("_summarize", TokenType.STEP_SUMMARIZE);
        steps.put("_summarise", TokenType.STEP_SUMMARIZE);
        steps.put("_rename", TokenType.STEP_RENAME);
        steps.put("_arrange", TokenType.STEP_ARRANGE);
        steps.put("_distinct", TokenType.STEP_DISTINCT);
        steps.put("_slice", TokenType.STEP_SLICE);
        steps.put("_pull", TokenType.STEP_PULL);
        steps.put("_groupBy", TokenType.STEP_GROUP_BY);
        steps.put("_group_by", TokenType.STEP_GROUP_BY);
        steps.put("_leftJoin", TokenType.STEP_LEFT_JOIN);
        steps.put("_left_join", TokenType.STEP_LEFT_JOIN);
        steps.put("_pivot", TokenType.STEP_PIVOT);
        steps.put("_unpivot", TokenType.STEP_UNPIVOT);
        steps.put("_window", TokenType.STEP_WINDOW);
        STEP_KEYWORDS = Collections.unmodifiableMap(steps);

        Map<String, String> aliases = new HashMap<>();
        aliases.put("_summarise", "_summarize");
        aliases.put("_group_by", "_groupBy");
        aliases.put("_left_join", "_leftJoin");
        STEP_ALIASES = Collections.unmodifiableMap(aliases);
    }

    /** 获取所有关键词集合（供 REPL 补全等外部工具使用） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    /** 获取所有步骤动词拼写（含别名） */
    public static Set<String> getStepVerbs() {
        return STEP_KEYWORDS.keySet();
    }

    /** 别名归一为规范动词名 */
    public static String canonicalVerb(String verb) {
        String canonical = STEP_ALIASES.get(verb);
        return canonical != null ? canonical : verb;
    }

    public Lexer(String source, String fileName) {
        this.source = source != null ? source : "";
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表
     */
    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;
            start = current;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    /**
     * 跳过空白与注释；换行输出 NEWLINE
     */
    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '\n') {
                tokens.add(new Token(TokenType.NEWLINE, "\n", null, line, column, current));
                advance();
                newLine();
            } else if (c == '/' && peekNext() == '/') {
                if (nesting > 0) break;
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '/' && peekNext() == '*') {
                blockComment();
            } else if (c == '#') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        int startLine = line;
        int startColumn = column;

        for (int i = 0; i < MULTI_OPS.length; i++) {
            String op = MULTI_OPS[i];
            if (source.startsWith(op, current)) {
                for (int k = 0; k < op.length(); k++) advance();
                tokens.add(new Token(MULTI_OP_TYPES[i], op, null, startLine, startColumn, start));
                return;
            }
        }

        char c = peek();

        // 字符串（支持插值）
        if (c == '"' || c == '\'') {
            string(c, false);
            return;
        }

        // 原始字符串 r"..."
        if (c == 'r' && (peekNext() == '"' || peekNext() == '\'')) {
            advance();
            string(peek(), true);
            return;
        }

        if (isDigit(c) || (c == '.' && isDigit(peekNext()))) {
            number();
            return;
        }

        if (isAlpha(c)) {
            identifier();
            return;
        }

        advance();
        TokenType single = singleCharType(c);
        if (single == null) {
            tokens.add(new Token(TokenType.ERROR, String.valueOf(c),
                    "Unexpected character '" + c + "'", startLine, startColumn, start));
            return;
        }
        if (single == TokenType.LPAREN || single == TokenType.LBRACKET) {
            nesting++;
        } else if (single == TokenType.RPAREN || single == TokenType.RBRACKET) {
            nesting = Math.max(0, nesting - 1);
        }
        tokens.add(new Token(single, String.valueOf(c), null, startLine, startColumn, start));
    }

    private static TokenType singleCharType(char c) {
        switch (c) {
            case '+': return TokenType.PLUS;
            case '-': return TokenType.MINUS;
            case '*': return TokenType.STAR;
            case '/': return TokenType.SLASH;
            case '%': return TokenType.PERCENT;
            case '<': return TokenType.LT;
            case '>': return TokenType.GT;
            case '=': return TokenType.ASSIGN;
            case '&': return TokenType.BIT_AND;
            case '|': return TokenType.BIT_OR;
            case '^': return TokenType.BIT_XOR;
            case '~': return TokenType.BIT_NOT;
            case '!': return TokenType.NOT;
            case '(': return TokenType.LPAREN;
            case ')': return TokenType.RPAREN;
            case '[': return TokenType.LBRACKET;
            case ']': return TokenType.RBRACKET;
            case '{': return TokenType.LBRACE;
            case '}': return TokenType.RBRACE;
            case ',': return TokenType.COMMA;
            case '.': return TokenType.DOT;
            case ':': return TokenType.COLON;
            case ';': return TokenType.SEMICOLON;
            case '?': return TokenType.QUESTION;
            case '@': return TokenType.AT;
            default: return null;
        }
    }

    // === 字符串 ===

    /**
     * 扫描字符串字面量。非原始字符串中的 {expr} 被拆成插值记号序列：
     * INTERP_START(text) 表达式记号 (INTERP_MID(text) 表达式记号)* INTERP_END(text)
     */
    private void string(char quote, boolean raw) {
        int startLine = line;
        int startColumn = column;
        int startOffset = start;
        advance(); // 开引号

        boolean triple = false;
        if (peek() == quote && peekNext() == quote) {
            triple = true;
            advance();
            advance();
        }

        List<String> texts = new ArrayList<>();
        List<List<Token>> exprs = new ArrayList<>();
        StringBuilder buf = new StringBuilder();
        boolean terminated = false;

        while (!isAtEnd()) {
            char c = peek();

            if (triple) {
                if (c == quote && peekNext() == quote && peekAt(2) == quote) {
                    advance();
                    advance();
                    advance();
                    terminated = true;
                    break;
                }
            } else {
                if (c == quote) {
                    advance();
                    terminated = true;
                    break;
                }
                if (c == '\n') {
                    break;
                }
            }

            if (!raw && c == '{') {
                texts.add(buf.toString());
                buf.setLength(0);
                advance();
                exprs.add(interpolation());
                continue;
            }

            if (!raw && c == '\\') {
                advance();
                if (isAtEnd()) break;
                char escaped = advance();
                if (escaped == '\n') newLine();
                buf.append(escapeChar(escaped));
            } else if (c == '\n') {
                advance();
                newLine();
                buf.append('\n');
            } else {
                buf.append(advance());
            }
        }

        String lexeme = source.substring(startOffset, current);
        if (!terminated) {
            tokens.add(new Token(TokenType.ERROR, lexeme, "Unterminated string",
                    startLine, startColumn, startOffset));
            return;
        }

        String trailing = buf.toString();
        if (exprs.isEmpty()) {
            tokens.add(new Token(TokenType.STRING, lexeme, trailing, startLine, startColumn, startOffset));
            return;
        }

        for (int i = 0; i < exprs.size(); i++) {
            TokenType type = i == 0 ? TokenType.INTERP_START : TokenType.INTERP_MID;
            tokens.add(new Token(type, lexeme, texts.get(i), startLine, startColumn, startOffset));
            tokens.addAll(exprs.get(i));
        }
        tokens.add(new Token(TokenType.INTERP_END, lexeme, trailing, startLine, startColumn, startOffset));
    }

    /**
     * 扫描 { ... } 内的表达式记号，复用同一个 scanToken，嵌套花括号计数
     */
    private List<Token> interpolation() {
        List<Token> exprTokens = new ArrayList<>();
        int depth = 1;
        int savedNesting = nesting;
        nesting = 0;
        while (!isAtEnd()) {
            while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\r' || peek() == '\n')) {
                if (advance() == '\n') newLine();
            }
            if (isAtEnd()) break;

            char c = peek();
            if (c == '}') {
                depth--;
                if (depth == 0) {
                    advance();
                    break;
                }
            } else if (c == '{') {
                depth++;
            }

            List<Token> outer = tokens;
            tokens = new ArrayList<>();
            start = current;
            scanToken();
            exprTokens.addAll(tokens);
            tokens = outer;
        }
        nesting = savedNesting;
        return exprTokens;
    }

    private char escapeChar(char escaped) {
        switch (escaped) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            // \\ \" \' \{ \} 以及其它字符原样保留
            default: return escaped;
        }
    }

    // === 数字 ===

    private void number() {
        int startLine = line;
        int startColumn = column;
        int startOffset = current;

        if (peek() == '0') {
            char prefix = peekNext();
            if (prefix == 'x' || prefix == 'X') {
                radixNumber(16, "0123456789abcdefABCDEF_", startLine, startColumn, startOffset);
                return;
            }
            if (prefix == 'o' || prefix == 'O') {
                radixNumber(8, "01234567_", startLine, startColumn, startOffset);
                return;
            }
            if (prefix == 'b' || prefix == 'B') {
                radixNumber(2, "01_", startLine, startColumn, startOffset);
                return;
            }
        }

        advanceDigits();

        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            advanceDigits();
        }

        if (peek() == 'e' || peek() == 'E') {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }

        String lexeme = source.substring(startOffset, current);
        String text = stripUnderscores(lexeme);
        try {
            Object value = isFloat ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            tokens.add(new Token(TokenType.NUMBER, lexeme, value, startLine, startColumn, startOffset));
        } catch (NumberFormatException e) {
            tokens.add(new Token(TokenType.ERROR, lexeme, "Invalid number literal '" + lexeme + "'",
                    startLine, startColumn, startOffset));
        }
    }

    private void radixNumber(int radix, String digits, int startLine, int startColumn, int startOffset) {
        advance(); // 0
        advance(); // x / o / b
        while (!isAtEnd() && digits.indexOf(peek()) >= 0) advance();
        String lexeme = source.substring(startOffset, current);
        String text = stripUnderscores(lexeme.substring(2));
        try {
            long value = Long.parseLong(text, radix);
            tokens.add(new Token(TokenType.NUMBER, lexeme, value, startLine, startColumn, startOffset));
        } catch (NumberFormatException e) {
            tokens.add(new Token(TokenType.ERROR, lexeme, "Invalid number literal '" + lexeme + "'",
                    startLine, startColumn, startOffset));
        }
    }

    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    // === 标识符 ===

    private void identifier() {
        int startLine = line;
        int startColumn = column;
        int startOffset = current;

        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(startOffset, current);

        // 动词优先，用户标识符无法遮蔽动词
        TokenType step = STEP_KEYWORDS.get(text);
        if (step != null) {
            tokens.add(new Token(step, text, canonicalVerb(text), startLine, startColumn, startOffset));
            return;
        }

        TokenType keyword = KEYWORDS.get(text);
        if (keyword == null) {
            tokens.add(new Token(TokenType.IDENTIFIER, text, null, startLine, startColumn, startOffset));
        } else if (keyword == TokenType.BOOLEAN) {
            tokens.add(new Token(keyword, text, "true".equals(text), startLine, startColumn, startOffset));
        } else {
            tokens.add(new Token(keyword, text, null, startLine, startColumn, startOffset));
        }
    }

    private void blockComment() {
        advance(); // /
        advance(); // *
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') newLine();
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        int index = current + distance;
        if (index >= source.length()) return '\0';
        return source.charAt(index);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || (c > 127 && Character.isLetterOrDigit(c));
    }
}

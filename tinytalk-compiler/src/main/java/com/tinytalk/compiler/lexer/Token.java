package com.tinytalk.compiler.lexer;

/**
 * 词法单元
 *
 * <p>literal 取值：数字为 Long / Double，字符串与插值片段为 String，
 * 布尔为 Boolean，null/nil 为 null，步骤动词为规范动词名（别名已归一）。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    public boolean isStep() {
        return type.isStep();
    }

    /** 步骤动词的规范名，例如 _summarise 归一为 _summarize */
    public String getVerb() {
        return isStep() ? (String) literal : null;
    }

    /** 字符串或插值片段的文本 */
    public String getText() {
        return literal instanceof String ? (String) literal : lexeme;
    }

    @Override
    public String toString() {
        if (type == TokenType.NEWLINE || type == TokenType.EOF) {
            return String.format("%s at %d:%d", type, line, column);
        }
        if (literal != null && !literal.equals(lexeme)) {
            return String.format("%s(%s, %s) at %d:%d",
                    type, lexeme, literal, line, column);
        }
        return String.format("%s(%s) at %d:%d",
                type, lexeme, line, column);
    }
}

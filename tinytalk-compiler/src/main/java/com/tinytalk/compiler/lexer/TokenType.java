package com.tinytalk.compiler.lexer;

/**
 * TinyTalk 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER,
    STRING,
    BOOLEAN,
    NULL,

    // === 字符串插值 ===
    INTERP_START,           // "text {
    INTERP_MID,             // } text {
    INTERP_END,             // } text"

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 经典语法 ===
    KW_WHEN, KW_FIN, KW_BLUEPRINT, KW_LAW, KW_FIELD,
    KW_FORGE, KW_REPLY, KW_DO, KW_END,

    // === 关键词 - 现代语法 ===
    KW_LET, KW_CONST, KW_FN, KW_RETURN,
    KW_IF, KW_ELSE, KW_ELIF, KW_FOR, KW_WHILE, KW_IN,
    KW_BREAK, KW_CONTINUE, KW_MATCH, KW_STRUCT, KW_ENUM,
    KW_IMPORT, KW_FROM, KW_USE, KW_AS,
    KW_TRY, KW_CATCH, KW_THROW,

    // === 关键词 - 自然语言比较 ===
    KW_IS, KW_ISNT, KW_HAS, KW_HASNT, KW_ISIN, KW_ISLIKE,

    // === 关键词 - 类型（也可作标识符） ===
    KW_INT, KW_FLOAT, KW_STR, KW_BOOL,
    KW_LIST, KW_MAP, KW_ANY, KW_VOID,

    // === 步骤链动词 ===
    STEP_FILTER, STEP_SORT, STEP_MAP, STEP_TAKE, STEP_DROP,
    STEP_FIRST, STEP_LAST, STEP_REVERSE, STEP_UNIQUE, STEP_COUNT,
    STEP_SUM, STEP_AVG, STEP_MIN, STEP_MAX, STEP_GROUP,
    STEP_FLATTEN, STEP_ZIP, STEP_CHUNK, STEP_REDUCE, STEP_SORT_BY,
    STEP_JOIN, STEP_MAP_VALUES, STEP_EACH,
    STEP_SELECT, STEP_MUTATE, STEP_SUMMARIZE, STEP_RENAME, STEP_ARRANGE,
    STEP_DISTINCT, STEP_SLICE, STEP_PULL, STEP_GROUP_BY, STEP_LEFT_JOIN,
    STEP_PIVOT, STEP_UNPIVOT, STEP_WINDOW,

    // === 操作符 - 逻辑 ===
    AND,            // and &&
    OR,             // or ||
    NOT,            // not !

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /
    PERCENT,        // %
    POWER,          // **
    FLOOR_DIV,      // //

    // === 操作符 - 位运算 ===
    BIT_AND,        // &
    BIT_OR,         // |
    BIT_XOR,        // ^
    BIT_NOT,        // ~
    SHL,            // <<
    SHR,            // >>

    // === 操作符 - 赋值 ===
    ASSIGN,         // =
    WALRUS,         // :=
    PLUS_EQ,        // +=
    MINUS_EQ,       // -=
    STAR_EQ,        // *=
    SLASH_EQ,       // /=
    PERCENT_EQ,     // %=

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // != ~~
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACKET,       // [
    RBRACKET,       // ]
    LBRACE,         // {
    RBRACE,         // }
    COMMA,          // ,
    DOT,            // .
    COLON,          // :
    SEMICOLON,      // ;
    ARROW,          // ->
    FAT_ARROW,      // =>
    PIPE,           // |> %>%
    DOUBLE_COLON,   // ::
    QUESTION,       // ?
    AT,             // @
    RANGE,          // ..
    RANGE_INCL,     // ..=

    // === 特殊 ===
    NEWLINE,
    EOF,
    ERROR;

    /** 是否为步骤链动词 */
    public boolean isStep() {
        return name().startsWith("STEP_");
    }

    /** 是否为可作标识符使用的类型关键词 */
    public boolean isTypeKeyword() {
        switch (this) {
            case KW_INT: case KW_FLOAT: case KW_STR: case KW_BOOL:
            case KW_LIST: case KW_MAP: case KW_ANY: case KW_VOID:
                return true;
            default:
                return false;
        }
    }
}

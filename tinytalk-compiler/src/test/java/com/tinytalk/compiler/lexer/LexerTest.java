package com.tinytalk.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").tokenize();
    }

    /** 扫描源码，返回非 EOF 非 NEWLINE 的 token 列表 */
    private List<Token> tokens(String source) {
        return scan(source).stream()
                .filter(t -> t.getType() != TokenType.EOF && t.getType() != TokenType.NEWLINE)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return tokens(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    private void assertSingleToken(String source, TokenType expected) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expected, toks.get(0).getType());
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    // ================================================================
    // 基本结构
    // ================================================================

    @Test
    @DisplayName("空输入只有 EOF")
    void testEmptySource() {
        List<Token> toks = scan("");
        assertEquals(1, toks.size());
        assertEquals(TokenType.EOF, toks.get(0).getType());
    }

    @Test
    @DisplayName("换行输出 NEWLINE 并记录行号")
    void testNewlines() {
        List<Token> toks = scan("a\nb");
        assertEquals(TokenType.IDENTIFIER, toks.get(0).getType());
        assertEquals(TokenType.NEWLINE, toks.get(1).getType());
        assertEquals(2, toks.get(2).getLine());
        assertEquals(1, toks.get(2).getColumn());
        assertEquals(TokenType.EOF, toks.get(toks.size() - 1).getType());
    }

    // ================================================================
    // 运算符
    // ================================================================

    @Nested
    @DisplayName("运算符")
    class OperatorTests {

        @Test
        @DisplayName("多字符运算符")
        void testMultiCharOperators() {
            assertSingleToken("**", TokenType.POWER);
            assertSingleToken(":=", TokenType.WALRUS);
            assertSingleToken("==", TokenType.EQ);
            assertSingleToken("!=", TokenType.NE);
            assertSingleToken("~~", TokenType.NE);
            assertSingleToken("&&", TokenType.AND);
            assertSingleToken("||", TokenType.OR);
            assertSingleToken("|>", TokenType.PIPE);
            assertSingleToken("%>%", TokenType.PIPE);
            assertSingleToken("%=", TokenType.PERCENT_EQ);
            assertSingleToken("=>", TokenType.FAT_ARROW);
            assertSingleToken("->", TokenType.ARROW);
            assertSingleToken("..=", TokenType.RANGE_INCL);
            assertSingleToken("..", TokenType.RANGE);
            assertSingleToken("<<", TokenType.SHL);
        }

        @Test
        @DisplayName("单字符运算符")
        void testSingleCharOperators() {
            assertEquals(List.of(TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.PERCENT,
                    TokenType.BIT_AND, TokenType.BIT_OR, TokenType.BIT_XOR, TokenType.BIT_NOT,
                    TokenType.NOT, TokenType.QUESTION), types("+ - * % & | ^ ~ ! ?"));
        }

        @Test
        @DisplayName("括号内的 // 是整除")
        void testFloorDivInsideParens() {
            assertEquals(List.of(TokenType.LPAREN, TokenType.NUMBER, TokenType.FLOOR_DIV,
                    TokenType.NUMBER, TokenType.RPAREN), types("(10 // 3)"));
        }

        @Test
        @DisplayName("顶层的 // 是注释")
        void testLineCommentAtTopLevel() {
            assertEquals(List.of(TokenType.IDENTIFIER), types("x // comment here"));
        }

        @Test
        @DisplayName("# 与块注释")
        void testOtherComments() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER),
                    types("a # note\n/* multi\nline */ b"));
            Token b = tokens("a # note\n/* multi\nline */ b").get(1);
            assertEquals(3, b.getLine());
        }
    }

    // ================================================================
    // 字面量
    // ================================================================

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("整数与浮点数")
        void testNumbers() {
            assertSingleToken("42", TokenType.NUMBER, 42L);
            assertSingleToken("3.14", TokenType.NUMBER, 3.14);
            assertSingleToken(".5", TokenType.NUMBER, 0.5);
            assertSingleToken("1e3", TokenType.NUMBER, 1000.0);
            assertSingleToken("1_000_000", TokenType.NUMBER, 1000000L);
        }

        @Test
        @DisplayName("进制前缀")
        void testRadixNumbers() {
            assertSingleToken("0xFF", TokenType.NUMBER, 255L);
            assertSingleToken("0o17", TokenType.NUMBER, 15L);
            assertSingleToken("0b1010", TokenType.NUMBER, 10L);
        }

        @Test
        @DisplayName("区间不会被当作小数")
        void testRangeAfterNumber() {
            assertEquals(List.of(TokenType.NUMBER, TokenType.RANGE, TokenType.NUMBER), types("1..5"));
        }

        @Test
        @DisplayName("字符串与转义")
        void testStrings() {
            assertSingleToken("\"hello\"", TokenType.STRING, "hello");
            assertSingleToken("'single'", TokenType.STRING, "single");
            assertSingleToken("\"a\\nb\"", TokenType.STRING, "a\nb");
            assertSingleToken("\"\\q\"", TokenType.STRING, "q");
            assertSingleToken("\"\\{x\\}\"", TokenType.STRING, "{x}");
        }

        @Test
        @DisplayName("原始字符串不处理转义与插值")
        void testRawString() {
            assertSingleToken("r\"a\\n{b}\"", TokenType.STRING, "a\\n{b}");
        }

        @Test
        @DisplayName("三引号字符串可以跨行")
        void testTripleQuoted() {
            assertSingleToken("\"\"\"line1\nline2\"\"\"", TokenType.STRING, "line1\nline2");
        }

        @Test
        @DisplayName("未闭合字符串产生 ERROR")
        void testUnterminatedString() {
            List<Token> toks = tokens("\"abc\nx");
            assertEquals(TokenType.ERROR, toks.get(0).getType());
            assertEquals("Unterminated string", toks.get(0).getLiteral());
        }

        @Test
        @DisplayName("布尔与空值")
        void testBooleanAndNull() {
            assertSingleToken("true", TokenType.BOOLEAN, true);
            assertSingleToken("false", TokenType.BOOLEAN, false);
            assertSingleToken("null", TokenType.NULL);
            assertSingleToken("nil", TokenType.NULL);
        }
    }

    // ================================================================
    // 插值
    // ================================================================

    @Nested
    @DisplayName("字符串插值")
    class InterpolationTests {

        @Test
        @DisplayName("单个插值")
        void testSingleInterpolation() {
            List<Token> toks = tokens("\"Hi {name}!\"");
            assertEquals(TokenType.INTERP_START, toks.get(0).getType());
            assertEquals("Hi ", toks.get(0).getLiteral());
            assertEquals(TokenType.IDENTIFIER, toks.get(1).getType());
            assertEquals(TokenType.INTERP_END, toks.get(2).getType());
            assertEquals("!", toks.get(2).getLiteral());
        }

        @Test
        @DisplayName("多个插值之间是 INTERP_MID")
        void testMultipleInterpolations() {
            assertEquals(List.of(TokenType.INTERP_START, TokenType.IDENTIFIER, TokenType.INTERP_MID,
                    TokenType.IDENTIFIER, TokenType.PLUS, TokenType.NUMBER, TokenType.INTERP_END),
                    types("\"a {x} b {y + 1} c\""));
        }

        @Test
        @DisplayName("插值内的花括号与嵌套字符串")
        void testNestedBraces() {
            assertEquals(List.of(TokenType.INTERP_START, TokenType.IDENTIFIER, TokenType.LPAREN,
                    TokenType.LBRACE, TokenType.STRING, TokenType.COLON, TokenType.NUMBER,
                    TokenType.RBRACE, TokenType.RPAREN, TokenType.INTERP_END),
                    types("\"v={f({\"k\": 1})}\""));
        }
    }

    // ================================================================
    // 标识符、关键词与步骤动词
    // ================================================================

    @Nested
    @DisplayName("标识符与关键词")
    class IdentifierTests {

        @Test
        @DisplayName("现代与经典关键词")
        void testKeywords() {
            assertSingleToken("let", TokenType.KW_LET);
            assertSingleToken("fn", TokenType.KW_FN);
            assertSingleToken("blueprint", TokenType.KW_BLUEPRINT);
            assertSingleToken("reply", TokenType.KW_REPLY);
            assertSingleToken("islike", TokenType.KW_ISLIKE);
            assertSingleToken("and", TokenType.AND);
            assertSingleToken("str", TokenType.KW_STR);
        }

        @Test
        @DisplayName("步骤动词携带规范名")
        void testStepVerbs() {
            assertSingleToken("_filter", TokenType.STEP_FILTER, "_filter");
            assertSingleToken("_group_by", TokenType.STEP_GROUP_BY, "_groupBy");
            assertSingleToken("_summarise", TokenType.STEP_SUMMARIZE, "_summarize");
            assertSingleToken("_left_join", TokenType.STEP_LEFT_JOIN, "_leftJoin");
        }

        @Test
        @DisplayName("下划线开头的普通名字仍是标识符")
        void testUnderscoreIdentifier() {
            assertSingleToken("_private", TokenType.IDENTIFIER);
            assertSingleToken("_", TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("别名归一")
        void testCanonicalVerb() {
            assertEquals("_groupBy", Lexer.canonicalVerb("_group_by"));
            assertEquals("_sort", Lexer.canonicalVerb("_sort"));
            assertTrue(Lexer.getStepVerbs().contains("_window"));
        }

        @Test
        @DisplayName("未知字符产生 ERROR")
        void testUnknownCharacter() {
            List<Token> toks = tokens("a $ b");
            assertEquals(TokenType.ERROR, toks.get(1).getType());
            assertEquals("Unexpected character '$'", toks.get(1).getLiteral());
        }
    }
}

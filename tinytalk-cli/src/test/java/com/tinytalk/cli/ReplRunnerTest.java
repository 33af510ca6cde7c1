package com.tinytalk.cli;

import tinytalk.runtime.interpreter.ExecutionBounds;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * REPL 测试（不经过终端，直接驱动输入处理）
 */
@DisplayName("REPL")
class ReplRunnerTest {

    private ReplRunner repl;
    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        repl = new ReplRunner(ExecutionBounds.defaults(),
                new PrintStream(outContent, true, StandardCharsets.UTF_8),
                new PrintStream(errContent, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return new String(outContent.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String err() {
        return new String(errContent.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Nested
    @DisplayName("求值")
    class EvaluationTests {

        @Test
        @DisplayName("状态在输入之间保留")
        void testStatePersists() {
            repl.accept("let x = 2");
            repl.accept("x * 21");
            assertThat(out()).contains("42\n");
        }

        @Test
        @DisplayName("字符串结果带引号")
        void testStringQuoted() {
            repl.accept("\"hi\" + \"!\"");
            assertThat(out()).contains("\"hi!\"");
        }

        @Test
        @DisplayName("未闭合括号续行")
        void testMultiline() {
            assertTrue(repl.accept("fn twice(n) {"));
            assertTrue(repl.accept("  return n * 2"));
            assertTrue(repl.accept("}"));
            repl.accept("twice(4)");
            assertThat(out()).contains("8\n");
        }

        @Test
        @DisplayName("反斜杠续行")
        void testBackslashContinuation() {
            repl.accept("let y = 1 + \\");
            repl.accept("2");
            repl.accept("y * 10");
            assertThat(out()).contains("30\n");
        }

        @Test
        @DisplayName("错误不结束会话")
        void testErrorKeepsSession() {
            assertTrue(repl.accept("1 / 0"));
            assertThat(err()).contains("Division by zero");
            repl.accept("5 + 5");
            assertThat(out()).contains("10\n");
        }

        @Test
        @DisplayName("语法错误")
        void testSyntaxError() {
            repl.accept("let = 3");
            assertThat(err()).startsWith("Syntax error: ");
        }
    }

    @Nested
    @DisplayName("命令")
    class CommandTests {

        @Test
        @DisplayName(":quit 退出")
        void testQuit() {
            assertFalse(repl.accept(":quit"));
            assertFalse(repl.handleCommand(":q"));
        }

        @Test
        @DisplayName(":reset 清空环境")
        void testReset() {
            repl.accept("let z = 1");
            repl.accept(":reset");
            repl.accept("z + 1");
            assertThat(out()).contains("Environment reset");
            assertThat(err()).contains("Undefined variable 'z'");
        }

        @Test
        @DisplayName(":env 列出全局变量")
        void testEnv() {
            repl.accept("let name = \"ada\"");
            repl.accept(":env");
            assertThat(out()).contains("name = \"ada\"");
        }

        @Test
        @DisplayName(":bounds 显示限制")
        void testBounds() {
            repl.accept(":bounds");
            assertThat(out()).contains("maxOps=1000000");
        }

        @Test
        @DisplayName("未知命令")
        void testUnknown() {
            assertTrue(repl.accept(":foo"));
            assertThat(out()).contains("Unknown command: :foo");
        }
    }

    @Test
    @DisplayName("括号检测忽略字符串和注释")
    void testUnclosedBrackets() {
        assertTrue(ReplRunner.hasUnclosedBrackets("fn f() {"));
        assertTrue(ReplRunner.hasUnclosedBrackets("show([1,\n2"));
        assertFalse(ReplRunner.hasUnclosedBrackets("show(\"(\")"));
        assertFalse(ReplRunner.hasUnclosedBrackets("show(1) # (unclosed"));
        assertFalse(ReplRunner.hasUnclosedBrackets("show('\\'')"));
    }

    @Test
    @DisplayName("无终端时逐行读取直到 :quit")
    void testPlainLoop() {
        repl.runPlain(new BufferedReader(new StringReader("let a = 20\na + 22\n:quit\nshow(99)\n")));
        assertThat(out()).contains("42").doesNotContain("99");
    }
}

package com.tinytalk.cli;

import tinytalk.runtime.interpreter.ExecutionBounds;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行测试
 */
@DisplayName("命令行")
class MainTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(outContent, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errContent, true, StandardCharsets.UTF_8);
        return Main.commandLine(new Main(out, err)).execute(args);
    }

    private String out() {
        return new String(outContent.toByteArray(), StandardCharsets.UTF_8).trim().replace("\r\n", "\n");
    }

    private String err() {
        return new String(errContent.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private Path script(String name, String source) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, source.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    // ============ -e ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("打印表达式结果")
        void testPrintsResult() {
            assertEquals(0, run("-e", "1 + 2"));
            assertEquals("3", out());
        }

        @Test
        @DisplayName("null 结果不打印")
        void testNullResultSilent() {
            assertEquals(0, run("-e", "show(\"hi\")"));
            assertEquals("hi", out());
        }

        @Test
        @DisplayName("运行时错误返回 1 并显示位置")
        void testRuntimeError() {
            assertEquals(1, run("-e", "1 / 0"));
            assertThat(err()).contains("Runtime error: Division by zero").contains("--> <cmdline>:1");
        }

        @Test
        @DisplayName("语法错误返回 1 并显示指针")
        void testSyntaxError() {
            assertEquals(1, run("-e", "let = 1"));
            assertThat(err()).startsWith("Syntax error: Expected variable name").contains("^");
        }

        @Test
        @DisplayName("断言失败返回 1")
        void testAssertionFailure() {
            assertEquals(1, run("-e", "assert_equal(1, 2)"));
            assertThat(err()).contains("assert_equal failed");
        }
    }

    // ============ 脚本 ============

    @Nested
    @DisplayName("脚本")
    class ScriptTests {

        @Test
        @DisplayName("脚本参数绑定到 args")
        void testScriptArgs() throws IOException {
            Path file = script("greet.tt", "show(args)\nshow(len(args))");
            assertEquals(0, run(file.toString(), "a", "--flag"));
            assertEquals("[a, --flag]\n2", out());
        }

        @Test
        @DisplayName("导入相对于脚本目录")
        void testRelativeImport() throws IOException {
            script("lib.tt", "fn greet(name) { return \"hello \" + name }");
            Path main = script("main.tt", "from \"lib\" use {greet}\nshow(greet(\"ada\"))");
            assertEquals(0, run(main.toString()));
            assertEquals("hello ada", out());
        }

        @Test
        @DisplayName("文件不存在")
        void testMissingFile() {
            assertEquals(1, run(tempDir.resolve("nope.tt").toString()));
            assertThat(err()).contains("file not found");
        }

        @Test
        @DisplayName("错误前的输出保留")
        void testOutputBeforeError() throws IOException {
            Path file = script("fail.tt", "show(\"start\")\nlet x = undefined_name + 1");
            assertEquals(1, run(file.toString()));
            assertEquals("start", out());
            assertThat(err()).contains("Undefined variable 'undefined_name'").contains("fail.tt:2");
        }
    }

    // ============ 执行限制 ============

    @Nested
    @DisplayName("执行限制选项")
    class BoundsTests {

        @Test
        @DisplayName("单项覆盖生效")
        void testOverride() {
            assertEquals(1, run("--bounds", "api", "--max-iterations", "5", "-e", "while true { }"));
            assertThat(err()).contains("Exceeded max iterations (5)");
        }

        @Test
        @DisplayName("未知档位")
        void testUnknownProfile() {
            assertEquals(1, run("--bounds", "nope", "-e", "1"));
            assertThat(err()).contains("Unknown bounds profile: nope");
        }

        @Test
        @DisplayName("非正数覆盖值")
        void testInvalidOverride() {
            assertEquals(1, run("--max-ops", "0", "-e", "1"));
            assertThat(err()).contains("maxOps must be positive");
        }

        @Test
        @DisplayName("resolveBounds 合并档位与覆盖")
        void testResolveBounds() {
            Main main = new Main();
            main.bounds = "api";
            assertEquals(ExecutionBounds.Profile.API, main.resolveBounds().getProfile());

            main.timeout = 2.5;
            ExecutionBounds bounds = main.resolveBounds();
            assertEquals(ExecutionBounds.Profile.CUSTOM, bounds.getProfile());
            assertEquals(2.5, bounds.getTimeoutSeconds());
            assertEquals(50_000L, bounds.getMaxIterations());
        }
    }

    // ============ 分析选项 ============

    @Nested
    @DisplayName("分析选项")
    class InspectTests {

        @Test
        @DisplayName("--ast 打印语法树")
        void testAst() {
            assertEquals(0, run("--ast", "-e", "let y = (10 // 3)"));
            assertEquals("(let y (// 10 3))", out());
        }

        @Test
        @DisplayName("--tokens 打印词法单元")
        void testTokens() {
            assertEquals(0, run("--tokens", "-e", "total"));
            assertThat(out()).contains("IDENTIFIER(total) at 1:1").contains("EOF");
        }

        @Test
        @DisplayName("--check 报告步骤链类型警告")
        void testCheckWarnings() throws IOException {
            Path file = script("chain.tt", "let xs = [1, 2]\nlet ys = xs _mapValues((v) => v)\n");
            assertEquals(0, run("--check", file.toString()));
            assertThat(err()).contains(":2: warning: step 1 (_mapValues): '_mapValues' expects a map, got list[int]");
            assertThat(out()).contains("0 error(s), 1 warning(s)");
        }

        @Test
        @DisplayName("--check 报告全部语法错误")
        void testCheckSyntaxErrors() {
            assertEquals(1, run("--check", "-e", "let = 1\nshow(1)\nlet = 2"));
            assertThat(err()).contains("<cmdline>:1:").contains("<cmdline>:3:").contains("error:");
            assertThat(out()).contains("2 error(s)");
        }

        @Test
        @DisplayName("--check 无问题")
        void testCheckOk() {
            assertEquals(0, run("--check", "-e", "let xs = [3, 1] _sort"));
            assertEquals("<cmdline>: OK", out());
        }

        @Test
        @DisplayName("分析选项需要输入")
        void testInspectNeedsInput() {
            assertEquals(1, run("--ast"));
            assertThat(err()).contains("need a FILE or -e");
        }
    }
}

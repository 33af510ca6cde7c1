package tinytalk.runtime.interpreter;

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
 * 模块导入测试
 */
@DisplayName("模块系统")
class ModuleLoaderTest {

    @TempDir
    Path tempDir;

    private Interpreter interpreter;
    private ByteArrayOutputStream outContent;

    @BeforeEach
    void setUp() throws IOException {
        interpreter = new Interpreter(ExecutionBounds.defaults(), tempDir);
        outContent = new ByteArrayOutputStream();
        interpreter.setStdout(new PrintStream(outContent, true, StandardCharsets.UTF_8));

        writeModule("mathx.tt",
                "fn double(x) { return x * 2 }\n"
                        + "let PI2 = 6.28\n"
                        + "let _secret = 1\n"
                        + "show(\"loaded\")\n");
    }

    private void writeModule(String name, String source) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, source.getBytes(StandardCharsets.UTF_8));
    }

    private String run(String source) {
        interpreter.eval(source, "main.tt");
        return new String(outContent.toByteArray(), StandardCharsets.UTF_8).trim().replace("\r\n", "\n");
    }

    private LanguageError error(String source) {
        return assertThrows(LanguageError.class, () -> interpreter.eval(source, "main.tt"));
    }

    // ============ 导入形式 ============

    @Nested
    @DisplayName("导入形式")
    class ImportFormTests {

        @Test
        @DisplayName("import 导入全部公开名字")
        void testImportAll() {
            assertEquals("loaded\n8 6.28", run("import \"mathx\"\nshow(double(4), PI2)"));
        }

        @Test
        @DisplayName("带扩展名的路径")
        void testImportWithExtension() {
            assertEquals("loaded\n10", run("import \"mathx.tt\"\nshow(double(5))"));
        }

        @Test
        @DisplayName("import as 绑定为命名空间映射")
        void testImportAlias() {
            assertEquals("loaded\n6 6.28", run("import \"mathx\" as m\nshow(m.double(3), m.PI2)"));
        }

        @Test
        @DisplayName("from use 只导入列出的名字")
        void testFromUse() {
            assertEquals("loaded\n10", run("from \"mathx\" use {double}\nshow(double(5))"));
            assertThat(error("show(PI2 + 1)").getMessage()).contains("PI2");
        }

        @Test
        @DisplayName("下划线开头的名字不导出")
        void testPrivateNames() {
            assertEquals("loaded\nfalse true",
                    run("import \"mathx\" as m\nshow(contains(m, \"_secret\"), contains(m, \"double\"))"));
        }

        @Test
        @DisplayName("相对路径以导入方所在目录为基准")
        void testNestedRelativeImport() throws IOException {
            writeModule("lib/helper.tt", "let helper_value = 41\n");
            writeModule("lib/util.tt", "import \"helper\"\nlet v = helper_value + 1\n");
            assertEquals("42", run("import \"lib/util\" as u\nshow(u.v)"));
        }
    }

    // ============ 加载语义 ============

    @Nested
    @DisplayName("加载语义")
    class LoadingTests {

        @Test
        @DisplayName("同一解释器中模块只执行一次")
        void testExecutedOnce() {
            String output = run("import \"mathx\"\nimport \"mathx\" as m\nfrom \"mathx\" use {double}\nshow(m.double(1))");
            assertEquals("loaded\n2", output);
        }

        @Test
        @DisplayName("不同解释器复用解析缓存")
        void testParsedCacheShared() {
            run("import \"mathx\"");
            long hitsBefore = ModuleLoader.parsedCacheStats().getHitCount();

            Interpreter other = new Interpreter(ExecutionBounds.defaults(), tempDir);
            other.setStdout(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
            other.eval("import \"mathx\"", "other.tt");

            assertThat(ModuleLoader.parsedCacheStats().getHitCount()).isGreaterThan(hitsBefore);
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("导入错误")
    class ErrorTests {

        @Test
        @DisplayName("模块不存在")
        void testNotFound() {
            LanguageError e = error("import \"nothere\"");
            assertThat(e.getRawMessage()).startsWith("Module not found: 'nothere'");
            assertEquals(1, e.getLine());
        }

        @Test
        @DisplayName("导入不存在的名字")
        void testMissingExport() {
            assertThat(error("from \"mathx\" use {nope}").getRawMessage())
                    .isEqualTo("Module 'mathx' does not export 'nope'");
        }

        @Test
        @DisplayName("循环导入")
        void testCircular() throws IOException {
            writeModule("a.tt", "import \"b\"\n");
            writeModule("b.tt", "import \"a\"\n");
            assertThat(error("import \"a\"").getRawMessage()).contains("Circular import: 'a'");
        }

        @Test
        @DisplayName("模块中的语法错误")
        void testSyntaxErrorInModule() throws IOException {
            writeModule("bad.tt", "let = 1\n");
            assertThat(error("import \"bad\"").getRawMessage()).startsWith("Syntax error in module 'bad': ");
        }

        @Test
        @DisplayName("模块执行失败后可以再次尝试")
        void testFailedModuleNotCached() throws IOException {
            writeModule("flaky.tt", "throw \"not ready\"\n");
            assertThat(error("import \"flaky\"").getRawMessage()).isEqualTo("not ready");
            assertThat(error("import \"flaky\"").getRawMessage()).isEqualTo("not ready");
        }
    }
}

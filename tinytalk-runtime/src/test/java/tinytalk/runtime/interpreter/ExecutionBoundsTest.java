package tinytalk.runtime.interpreter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 执行限制测试
 */
@DisplayName("执行限制")
class ExecutionBoundsTest {

    private static BoundsExceededError exceeded(ExecutionBounds bounds, String source) {
        Interpreter interpreter = new Interpreter(bounds);
        interpreter.setStdout(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        return assertThrows(BoundsExceededError.class, () -> interpreter.eval(source, "<bounds>"));
    }

    @Nested
    @DisplayName("档位")
    class ProfileTests {

        @Test
        @DisplayName("默认档位的取值")
        void testDefaults() {
            ExecutionBounds bounds = ExecutionBounds.defaults();
            assertEquals(ExecutionBounds.Profile.DEFAULT, bounds.getProfile());
            assertEquals(1_000_000L, bounds.getMaxOps());
            assertEquals(100_000L, bounds.getMaxIterations());
            assertEquals(1000, bounds.getMaxRecursion());
            assertEquals(30.0, bounds.getTimeoutSeconds());
            assertTrue(bounds.hasTimeout());
        }

        @Test
        @DisplayName("api 档位更严格")
        void testApi() {
            ExecutionBounds bounds = ExecutionBounds.api();
            assertEquals(500_000L, bounds.getMaxOps());
            assertEquals(50_000L, bounds.getMaxIterations());
            assertEquals(500, bounds.getMaxRecursion());
            assertEquals(10.0, bounds.getTimeoutSeconds());
        }

        @Test
        @DisplayName("按名称取档位")
        void testNamed() {
            assertEquals(ExecutionBounds.Profile.API, ExecutionBounds.named("API").getProfile());
            assertEquals(ExecutionBounds.Profile.DEFAULT, ExecutionBounds.named("default").getProfile());
            assertThatThrownBy(() -> ExecutionBounds.named("unbounded"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ExecutionBounds.named("x"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown bounds profile");
        }

        @Test
        @DisplayName("Builder 拒绝非正数")
        void testBuilderValidation() {
            assertThrows(IllegalArgumentException.class, () -> ExecutionBounds.builder().maxOps(0));
            assertThrows(IllegalArgumentException.class, () -> ExecutionBounds.builder().maxIterations(-1));
            assertThrows(IllegalArgumentException.class, () -> ExecutionBounds.builder().maxRecursion(0));
            assertThrows(IllegalArgumentException.class, () -> ExecutionBounds.builder().timeoutSeconds(0));
        }

        @Test
        @DisplayName("toBuilder 只覆盖单项")
        void testToBuilder() {
            ExecutionBounds bounds = ExecutionBounds.api().toBuilder().maxOps(42).build();
            assertEquals(ExecutionBounds.Profile.CUSTOM, bounds.getProfile());
            assertEquals(42L, bounds.getMaxOps());
            assertEquals(50_000L, bounds.getMaxIterations());
            assertThat(bounds.toString()).contains("custom").contains("maxOps=42");
        }
    }

    @Nested
    @DisplayName("超限")
    class ExceededTests {

        @Test
        @DisplayName("死循环在默认档位下终止")
        void testInfiniteLoopDefault() {
            BoundsExceededError e = exceeded(ExecutionBounds.defaults(), "while true { }");
            assertEquals("Exceeded max iterations (100000)", e.getRawMessage());
            assertEquals(1, e.getLine());
        }

        @Test
        @DisplayName("死循环在 api 档位下终止")
        void testInfiniteLoopApi() {
            assertEquals("Exceeded max iterations (50000)",
                    exceeded(ExecutionBounds.api(), "while true { }").getRawMessage());
        }

        @Test
        @DisplayName("死循环在每个命名档位下都以计数上限终止")
        void testInfiniteLoopEveryProfile() {
            for (ExecutionBounds.Profile profile : ExecutionBounds.Profile.values()) {
                if (profile == ExecutionBounds.Profile.CUSTOM) {
                    continue;
                }
                ExecutionBounds bounds = ExecutionBounds.named(profile.name());
                assertThat(exceeded(bounds, "while true { }").getRawMessage())
                        .as(profile.name())
                        .matches("Exceeded max (iterations|operations) \\(\\d+\\)");
            }
        }

        @Test
        @DisplayName("操作数上限")
        void testMaxOps() {
            BoundsExceededError e = exceeded(ExecutionBounds.builder().maxOps(50).build(),
                    "let total = 0\nfor i in range(100) {\n  total += i\n}");
            assertEquals("Exceeded max operations (50)", e.getRawMessage());
        }

        @Test
        @DisplayName("递归上限")
        void testMaxRecursion() {
            BoundsExceededError e = exceeded(ExecutionBounds.builder().maxRecursion(20).build(),
                    "fn down(n) { return down(n + 1) }\ndown(0)");
            assertEquals("Exceeded max recursion (20)", e.getRawMessage());
        }

        @Test
        @DisplayName("超时")
        void testTimeout() {
            ExecutionBounds bounds = ExecutionBounds.builder()
                    .maxOps(Long.MAX_VALUE)
                    .maxIterations(Long.MAX_VALUE)
                    .timeoutSeconds(0.05)
                    .build();
            assertThat(exceeded(bounds, "while true { }").getRawMessage()).startsWith("Exceeded timeout (");
        }

        @Test
        @DisplayName("大区间按迭代上限检查")
        void testLargeRange() {
            BoundsExceededError e = exceeded(ExecutionBounds.builder().maxIterations(10).build(), "let xs = range(1000)");
            assertEquals("Exceeded max iterations (10)", e.getRawMessage());
        }

        @Test
        @DisplayName("try 可以捕获超限错误")
        void testCaughtByTry() {
            Interpreter interpreter = new Interpreter(ExecutionBounds.builder().maxIterations(5).build());
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            interpreter.setStdout(new PrintStream(out, true, StandardCharsets.UTF_8));
            interpreter.eval("try {\n  while true { }\n} catch e {\n  show(\"caught: \" + e)\n}", "<bounds>");
            assertEquals("caught: Exceeded max iterations (5)",
                    new String(out.toByteArray(), StandardCharsets.UTF_8).trim());
        }

        @Test
        @DisplayName("捕获后计数不清零，后续循环仍然超限")
        void testStillExceededAfterCatch() {
            BoundsExceededError e = exceeded(ExecutionBounds.builder().maxIterations(5).build(),
                    "try {\n  while true { }\n} catch e { }\nwhile true { }");
            assertEquals("Exceeded max iterations (5)", e.getRawMessage());
            assertEquals(4, e.getLine());
        }

        @Test
        @DisplayName("空列表重复不会空转")
        void testEmptyListRepeat() {
            Interpreter interpreter = new Interpreter(ExecutionBounds.builder().maxIterations(10).build());
            interpreter.setStdout(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
            assertTimeoutPreemptively(Duration.ofSeconds(5), () ->
                    assertEquals(0L, interpreter.eval("len([] * 9000000000000000000)", "<bounds>").asLong()));
        }

        @Test
        @DisplayName("列表重复按迭代上限检查")
        void testListRepeatAllocation() {
            ExecutionBounds bounds = ExecutionBounds.builder().maxIterations(10).build();
            assertEquals("Exceeded max iterations (10)", exceeded(bounds, "let xs = [1, 2] * 6").getRawMessage());
            assertEquals("Exceeded max iterations (10)",
                    exceeded(bounds, "let xs = [1]\nxs *= 9000000000000000000").getRawMessage());
        }

        @Test
        @DisplayName("每次执行重新计数")
        void testCountersReset() {
            Interpreter interpreter = new Interpreter(ExecutionBounds.builder().maxIterations(15).build());
            interpreter.setStdout(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
            interpreter.eval("for i in range(10) { }", "<a>");
            interpreter.eval("for i in range(10) { }", "<b>");
        }
    }
}

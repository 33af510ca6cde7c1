package tinytalk.runtime.interpreter.stdlib;

import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.AssertionFailure;
import tinytalk.runtime.interpreter.Interpreter;
import tinytalk.runtime.interpreter.LanguageError;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 内建函数测试
 */
@DisplayName("内建函数")
class BuiltinsTest {

    private Interpreter interpreter;
    private ByteArrayOutputStream outContent;

    @BeforeEach
    void setUp() {
        interpreter = new Interpreter();
        outContent = new ByteArrayOutputStream();
        interpreter.setStdout(new PrintStream(outContent, true, StandardCharsets.UTF_8));
    }

    private String run(String source) {
        interpreter.eval(source, "<test>");
        return new String(outContent.toByteArray(), StandardCharsets.UTF_8).trim().replace("\r\n", "\n");
    }

    private String error(String source) {
        return assertThrows(LanguageError.class, () -> interpreter.eval(source, "<test>")).getRawMessage();
    }

    @Test
    @DisplayName("内建表不可修改且包含数学常量")
    void testTable() {
        Map<String, TinyValue> table = Builtins.table();
        assertThat(table).containsKeys("show", "print", "len", "range", "format", "parse_json", "PI", "E", "TAU", "INF");
        assertEquals(Math.PI, table.get("PI").asDouble());
        assertThatThrownBy(() -> table.put("extra", table.get("PI")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("内建名不能重新赋值")
    void testBuiltinIsConstant() {
        assertThat(error("len = 5")).isEqualTo("Cannot reassign constant 'len'");
    }

    @Test
    @DisplayName("let 可以遮蔽内建名")
    void testShadowBuiltin() {
        assertEquals("5", run("let len = 5\nshow(len)"));
    }

    // ============ 核心 ============

    @Nested
    @DisplayName("核心函数")
    class CoreTests {

        @Test
        @DisplayName("len 与 type")
        void testLenAndType() {
            assertEquals("3 2 5 int string list", run("show(len([1, 2, 3]), len({a: 1, b: 2}), len(\"hello\"), type(1), type(\"s\"), typeof([]))"));
        }

        @Test
        @DisplayName("类型转换")
        void testConversions() {
            assertEquals("42 3 2.5 true false 7", run("show(int(\"42\"), int(3.9), float(\"2.5\"), bool(1), bool(\"\"), str(7))"));
        }

        @Test
        @DisplayName("println 是 show 的别名")
        void testPrintlnAlias() {
            assertEquals("a b", run("println(\"a\", \"b\")"));
        }
    }

    // ============ 集合 ============

    @Nested
    @DisplayName("集合函数")
    class CollectionTests {

        @Test
        @DisplayName("range 三种形式")
        void testRange() {
            assertEquals("[0, 1, 2] [1, 4, 7] [5, 3, 1] []",
                    run("show(range(3), range(1, 10, 3), range(5, 0, -2), range(3, 1))"));
        }

        @Test
        @DisplayName("range 步长为零报错")
        void testRangeZeroStep() {
            assertThat(error("range(1, 5, 0)")).contains("range() step must not be zero");
        }

        @Test
        @DisplayName("append 原地修改，pop 取出末尾")
        void testAppendPop() {
            assertEquals("[1, 2, 3] 3 [1, 2] null",
                    run("let xs = [1, 2]\npush(xs, 3)\nlet shown = str(xs)\nlet last = pop(xs)\n"
                            + "show(shown, last, xs, pop([]))"));
        }

        @Test
        @DisplayName("keys、values 与 contains")
        void testMapHelpers() {
            assertEquals("[a, b] [1, 2] true false true",
                    run("let m = {a: 1, b: 2}\nshow(keys(m), values(m), contains(m, \"a\"), contains([1, 2], 3), contains(\"hello\", \"ell\"))"));
        }

        @Test
        @DisplayName("slice 越界时截断")
        void testSlice() {
            assertEquals("[2, 3] [3, 4] ell", run("show(slice([1, 2, 3, 4], 1, 3), slice([1, 2, 3, 4], 2, 99), slice(\"hello\", 1, 4))"));
        }

        @Test
        @DisplayName("reverse 与 sort 不修改原列表")
        void testReverseSort() {
            assertEquals("[3, 1, 2] [1, 2, 3] [2, 1, 3] olleh",
                    run("let xs = [2, 1, 3]\nshow(reverse(xs), sort(xs), xs, reverse(\"hello\"))"));
        }

        @Test
        @DisplayName("高阶函数调用用户函数")
        void testHigherOrder() {
            assertEquals("[2, 3] [2, 4, 6] 6",
                    run("let xs = [1, 2, 3]\nshow(filter((x) => x > 1, xs), map_((x) => x * 2, xs), reduce((a, b) => a + b, xs, 0))"));
        }

        @Test
        @DisplayName("zip 以最短列表为准，enumerate 带索引")
        void testZipEnumerate() {
            assertEquals("[[1, a], [2, b]] [[0, x], [1, y]]",
                    run("show(zip([1, 2, 3], [\"a\", \"b\"]), enumerate([\"x\", \"y\"]))"));
        }
    }

    // ============ 文本 ============

    @Nested
    @DisplayName("文本函数")
    class TextTests {

        @Test
        @DisplayName("split 默认按空格并保留空段")
        void testSplit() {
            assertEquals("[a, b] [a, , b]", run("show(split(\"a b\"), split(\"a,,b\", \",\"))"));
        }

        @Test
        @DisplayName("split 空分隔符报错")
        void testSplitEmpty() {
            assertThat(error("split(\"abc\", \"\")")).contains("split() separator must not be empty");
        }

        @Test
        @DisplayName("join 与 replace")
        void testJoinReplace() {
            assertEquals("1-2-3 123 hexxo", run("show(join([1, 2, 3], \"-\"), join([1, 2, 3]), replace(\"hello\", \"l\", \"x\"))"));
        }

        @Test
        @DisplayName("大小写与去空白")
        void testCase() {
            assertEquals("ABC|abc|x|true|false",
                    run("show(join([upcase(\"abc\"), downcase(\"ABC\"), trim(\"  x  \"), str(startswith(\"hello\", \"he\")), str(endswith(\"hello\", \"he\"))], \"|\"))"));
        }

        @Test
        @DisplayName("format 位置与命名替换")
        void testFormat() {
            assertEquals("1 + 2|b a|Ada!|{x}",
                    run("show(join([format(r\"{} + {}\", 1, 2), format(r\"{1} {0}\", \"a\", \"b\"), "
                            + "format(r\"{name}!\", {name: \"Ada\"}), format(r\"{{x}}\")], \"|\"))"));
        }

        @Test
        @DisplayName("format 对齐与填充")
        void testFormatAlign() {
            assertEquals("[   42]|[ab   ]|[**ab***]",
                    run("show(join([format(r\"[{:>5}]\", 42), format(r\"[{:5}]\", \"ab\"), format(r\"[{:*^7}]\", \"ab\")], \"|\"))"));
        }

        @Test
        @DisplayName("format 错误")
        void testFormatErrors() {
            assertThat(error("format(r\"{5}\", 1)"))
                    .contains("Format error: Replacement index 5 out of range for positional args tuple");
            assertThat(error("format(r\"{who}\", {name: 1})")).contains("Format error: 'who'");
            assertThat(error("format(r\"a } b\")")).contains("single '}'");
            assertThat(error("format(r\"{:>x}\", 1)")).contains("Invalid format specifier '>x'");
        }
    }

    // ============ 数学 ============

    @Nested
    @DisplayName("数学函数")
    class MathTests {

        @Test
        @DisplayName("sum、min、max、abs")
        void testAggregates() {
            assertEquals("6 7.5 1 3 5", run("show(sum([1, 2, 3]), sum([1, 2, 4.5]), min(3, 1, 2), max([1, 3, 2]), abs(-5))"));
        }

        @Test
        @DisplayName("round 使用银行家舍入")
        void testRound() {
            assertEquals("2 4 3.14", run("show(round(2.5), round(3.5), round(3.14159, 2))"));
        }

        @Test
        @DisplayName("floor、ceil、sqrt、pow")
        void testFloorCeil() {
            assertEquals("2 3 3.0 8.0", run("show(floor(2.7), ceil(2.1), sqrt(9), pow(2, 3))"));
        }

        @Test
        @DisplayName("定义域错误")
        void testDomainErrors() {
            assertThat(error("sqrt(-1)")).contains("math domain error");
            assertThat(error("log(0)")).contains("math domain error");
        }

        @Test
        @DisplayName("非数值参数")
        void testNotANumber() {
            assertThat(error("sqrt(\"x\")")).contains("'sqrt' expects a number, got string");
        }
    }

    // ============ 断言 ============

    @Nested
    @DisplayName("断言函数")
    class AssertTests {

        @Test
        @DisplayName("断言通过时继续执行")
        void testPass() {
            assertEquals("ok", run("assert(1 == 1)\nassert_equal([1, 2], [1, 2])\nassert_true(1)\nassert_false(\"\")\nshow(\"ok\")"));
        }

        @Test
        @DisplayName("assert_equal 失败给出期望值与实际值")
        void testAssertEqualMessage() {
            AssertionFailure failure = assertThrows(AssertionFailure.class,
                    () -> interpreter.eval("assert_equal(1 + 1, 3)", "<test>"));
            assertThat(failure.getMessage()).contains("assert_equal failed:\n  expected: 3\n  actual:   2");
        }

        @Test
        @DisplayName("自定义消息放在首行")
        void testCustomMessage() {
            AssertionFailure failure = assertThrows(AssertionFailure.class,
                    () -> interpreter.eval("assert_true(0, \"must be set\")", "<test>"));
            assertThat(failure.getMessage()).contains("must be set\nassert_true failed: 0 is not truthy");
        }

        @Test
        @DisplayName("断言失败不会被 try 捕获")
        void testNotCaught() {
            assertThrows(AssertionFailure.class,
                    () -> interpreter.eval("try { assert(false) } catch e { show(\"caught\") }", "<test>"));
            assertThat(outContent.toString(StandardCharsets.UTF_8)).doesNotContain("caught");
        }
    }

    // ============ JSON ============

    @Nested
    @DisplayName("JSON")
    class JsonTests {

        @Test
        @DisplayName("解析对象与数组")
        void testParse() {
            assertEquals("{a: [1, 2.5, true, null]} int",
                    run("let data = parse_json(r'{\"a\": [1, 2.5, true, null]}')\nshow(data, type(data[\"a\"][0]))"));
        }

        @Test
        @DisplayName("紧凑序列化")
        void testToJson() {
            assertEquals("{\"a\":1,\"b\":[1,2.5,null]}", run("show(to_json({a: 1, b: [1, 2.5, null]}))"));
        }

        @Test
        @DisplayName("非法 JSON")
        void testInvalid() {
            assertThat(error("parse_json(r'{\"a\": 1} x')")).startsWith("Invalid JSON: ");
            assertThat(error("parse_json(r'{a: }')")).startsWith("Invalid JSON: ");
            assertThat(error("parse_json(5)")).contains("parse_json requires a JSON string");
        }
    }

    // ============ 正则与散列 ============

    @Nested
    @DisplayName("正则与散列")
    class RegexHashTests {

        @Test
        @DisplayName("regex_match 要求整体匹配")
        void testMatch() {
            assertEquals("true false", run("show(regex_match(\"abc123\", r\"[a-z]+\\d+\"), regex_match(\"abc123x\", r\"[a-z]+\\d+\"))"));
        }

        @Test
        @DisplayName("regex_find 有捕获组时取第一组")
        void testFind() {
            assertEquals("[1, 22] [a, b]", run("show(regex_find(\"a1 b22\", r\"\\d+\"), regex_find(\"a=1, b=2\", r\"(\\w)=\\d\"))"));
        }

        @Test
        @DisplayName("regex_replace 与 regex_split")
        void testReplaceSplit() {
            assertEquals("a#b#c [a, b, c]", run("show(regex_replace(\"a1b22c\", r\"\\d+\", \"#\"), regex_split(\"a, b,c\", r\",\\s*\"))"));
        }

        @Test
        @DisplayName("非法正则")
        void testInvalidRegex() {
            assertThat(error("regex_match(\"x\", r\"(\")")).contains("Invalid regex: ");
        }

        @Test
        @DisplayName("散列摘要")
        void testHash() {
            assertEquals("ba7816bf8f01cfea d41d8cd98f00b204e9800998ecf8427e",
                    run("show(hash(\"abc\"), md5(\"\"))"));
            assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                    StdlibHash.digest("SHA-256", TinyString.of("abc")));
        }
    }
}

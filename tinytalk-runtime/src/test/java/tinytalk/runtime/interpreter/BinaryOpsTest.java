package tinytalk.runtime.interpreter;

import tinytalk.runtime.TinyBool;
import tinytalk.runtime.TinyFloat;
import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 运算符语义测试
 */
@DisplayName("二元运算")
class BinaryOpsTest {

    private static TinyList list(TinyValue... items) {
        return new TinyList(Arrays.asList(items));
    }

    @Nested
    @DisplayName("算术")
    class ArithmeticTests {

        @Test
        @DisplayName("整数溢出报错")
        void testOverflow() {
            assertThatThrownBy(() -> BinaryOps.add(TinyInt.of(Long.MAX_VALUE), TinyInt.ONE))
                    .isInstanceOf(LanguageError.class)
                    .hasMessage("Integer overflow");
        }

        @Test
        @DisplayName("字符串拼接与重复")
        void testStrings() {
            assertEquals("a1", BinaryOps.add(TinyString.of("a"), TinyInt.ONE).asString());
            assertEquals("ababab", BinaryOps.mul(TinyString.of("ab"), TinyInt.of(3)).asString());
        }

        @Test
        @DisplayName("列表拼接产生新列表")
        void testListConcat() {
            TinyList a = list(TinyInt.ONE);
            TinyValue joined = BinaryOps.add(a, list(TinyInt.of(2)));
            assertEquals("[1, 2]", ValueFormatter.format(joined));
            assertEquals("[1]", ValueFormatter.format(a));
        }

        @Test
        @DisplayName("除零")
        void testDivisionByZero() {
            assertThatThrownBy(() -> BinaryOps.div(TinyInt.ONE, TinyInt.ZERO)).hasMessage("Division by zero");
            assertThatThrownBy(() -> BinaryOps.floorDiv(TinyInt.ONE, TinyFloat.of(0.0))).hasMessage("Division by zero");
            assertThatThrownBy(() -> BinaryOps.mod(TinyInt.ONE, TinyInt.ZERO)).hasMessage("Division by zero");
        }

        @Test
        @DisplayName("整除与取模向下取整")
        void testFloorSemantics() {
            assertEquals(-4L, BinaryOps.floorDiv(TinyInt.of(-7), TinyInt.of(2)).asLong());
            assertEquals(1L, BinaryOps.mod(TinyInt.of(-7), TinyInt.of(2)).asLong());
            assertEquals(-0.5, BinaryOps.mod(TinyFloat.of(5.5), TinyInt.of(-2)).asDouble(), 1e-12);
        }

        @Test
        @DisplayName("幂运算")
        void testPow() {
            assertEquals(1024L, BinaryOps.pow(TinyInt.of(2), TinyInt.of(10)).asLong());
            assertTrue(BinaryOps.pow(TinyInt.of(2), TinyInt.of(-1)).isFloat());
            assertThatThrownBy(() -> BinaryOps.pow(TinyInt.ZERO, TinyInt.of(-1))).hasMessage("Division by zero");
        }
    }

    @Nested
    @DisplayName("相等与比较")
    class EqualityTests {

        @Test
        @DisplayName("浮点按容差相等")
        void testFloatTolerance() {
            assertTrue(BinaryOps.valuesEqual(BinaryOps.add(TinyFloat.of(0.1), TinyFloat.of(0.2)), TinyFloat.of(0.3)));
            assertTrue(BinaryOps.valuesEqual(TinyInt.of(2), TinyFloat.of(2.0)));
            assertFalse(BinaryOps.valuesEqual(TinyInt.ONE, TinyString.of("1")));
        }

        @Test
        @DisplayName("列表与映射结构相等")
        void testStructural() {
            assertTrue(BinaryOps.valuesEqual(list(TinyInt.ONE, TinyNull.NULL), list(TinyInt.ONE, TinyNull.NULL)));
            TinyMap a = new TinyMap();
            a.put("k", TinyBool.TRUE);
            TinyMap b = new TinyMap();
            b.put("k", TinyBool.TRUE);
            assertTrue(BinaryOps.valuesEqual(a, b));
            b.put("k", TinyBool.FALSE);
            assertFalse(BinaryOps.valuesEqual(a, b));
        }

        @Test
        @DisplayName("不同类型不能比较大小")
        void testCompare() {
            assertTrue(BinaryOps.compare(TinyInt.ONE, TinyFloat.of(1.5)) < 0);
            assertTrue(BinaryOps.compare(TinyString.of("b"), TinyString.of("a")) > 0);
            assertTrue(BinaryOps.compare(list(TinyInt.ONE), list(TinyInt.ONE, TinyInt.ONE)) < 0);
            assertThatThrownBy(() -> BinaryOps.compare(TinyInt.ONE, TinyString.of("a")))
                    .hasMessage("Cannot compare int and string");
        }
    }

    @Nested
    @DisplayName("自然语言运算符")
    class NaturalTests {

        @Test
        @DisplayName("has 按容器种类判断")
        void testHas() {
            TinyMap m = new TinyMap();
            m.put("x", TinyInt.ONE);
            assertTrue(BinaryOps.has(list(TinyInt.ONE), TinyFloat.of(1.0)));
            assertTrue(BinaryOps.has(m, TinyString.of("x")));
            assertFalse(BinaryOps.has(m, list()));
            assertTrue(BinaryOps.has(TinyString.of("hello"), TinyString.of("ell")));
            assertFalse(BinaryOps.has(TinyInt.ONE, TinyInt.ONE));
        }

        @Test
        @DisplayName("like 通配符不区分大小写")
        void testLike() {
            assertTrue(BinaryOps.isLike(TinyString.of("Hello.txt"), TinyString.of("h*.TXT")));
            assertTrue(BinaryOps.isLike(TinyString.of("cat"), TinyString.of("c?t")));
            assertFalse(BinaryOps.isLike(TinyString.of("cart"), TinyString.of("c?t")));
            assertFalse(BinaryOps.isLike(TinyString.of("a.b"), TinyString.of("a?c")));
            assertFalse(BinaryOps.isLike(TinyInt.ONE, TinyString.of("*")));
        }
    }
}

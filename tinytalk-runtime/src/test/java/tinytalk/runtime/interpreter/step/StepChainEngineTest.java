package tinytalk.runtime.interpreter.step;

import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.Interpreter;
import tinytalk.runtime.interpreter.LanguageError;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 步骤链动词测试
 */
@DisplayName("步骤链")
class StepChainEngineTest {

    private static final String PEOPLE = "let people = [\n"
            + "  {name: \"Ann\", dept: \"eng\", age: 31},\n"
            + "  {name: \"Bob\", dept: \"ops\", age: 25},\n"
            + "  {name: \"Cid\", dept: \"eng\", age: 42}\n"
            + "]\n";

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

    // ============ 列表动词 ============

    @Nested
    @DisplayName("列表动词")
    class ListVerbTests {

        @Test
        @DisplayName("_filter 与 _map")
        void testFilterMap() {
            assertEquals("[20, 30]", run("show([1, 2, 3] _filter((x) => x > 1) _map((x) => x * 10))"));
        }

        @Test
        @DisplayName("_sort 升序且稳定")
        void testSort() {
            assertEquals("[1, 2, 3] [b, aa, ccc]", run(
                    "show([3, 1, 2] _sort, [\"ccc\", \"b\", \"aa\"] _sort((s) => len(s)))"));
        }

        @Test
        @DisplayName("_sort _reverse 等于降序")
        void testSortReverse() {
            assertEquals("[9, 5, 4, 1] true", run(
                    "let xs = [5, 1, 9, 4]\nshow(xs _sort _reverse, (xs _sort) == (xs _sort _sort))"));
        }

        @Test
        @DisplayName("_sort 不修改原列表")
        void testSortCopies() {
            assertEquals("[3, 1, 2]", run("let xs = [3, 1, 2]\nlet ys = xs _sort\nshow(xs)"));
        }

        @Test
        @DisplayName("_take 与 _drop 缺省为 1")
        void testTakeDrop() {
            assertEquals("[1] [2, 3] [1, 2] [3]", run(
                    "let xs = [1, 2, 3]\nshow(xs _take, xs _drop, xs _take(2), xs _drop(2))"));
        }

        @Test
        @DisplayName("_first 与 _last 在空列表上为 null")
        void testFirstLast() {
            assertEquals("1 3 null null", run("show([1, 2, 3] _first, [1, 2, 3] _last, [] _first, [] _last)"));
        }

        @Test
        @DisplayName("_unique 保留首次出现")
        void testUnique() {
            assertEquals("[3, 1, 2]", run("show([3, 1, 3, 2, 1] _unique)"));
        }

        @Test
        @DisplayName("_count 可带谓词")
        void testCount() {
            assertEquals("4 2", run("let xs = [1, 2, 3, 4]\nshow(xs _count, xs _count((x) => x % 2 == 0))"));
        }

        @Test
        @DisplayName("_sum 含浮点时为浮点")
        void testSum() {
            assertEquals("6 6.5 0", run("show([1, 2, 3] _sum, [1, 2, 3.5] _sum, [] _sum)"));
        }

        @Test
        @DisplayName("_avg 为浮点，无数值时为 null")
        void testAvg() {
            assertEquals("2.0 null", run("show([1, 2, 3] _avg, [] _avg)"));
        }

        @Test
        @DisplayName("_min 与 _max")
        void testMinMax() {
            assertEquals("1 9 null", run("let xs = [5, 1, 9]\nshow(xs _min, xs _max, [] _max)"));
        }

        @Test
        @DisplayName("_flatten 只展开一层")
        void testFlatten() {
            assertEquals("[1, 2, [3], 4]", run("show([[1, 2], [[3]], 4] _flatten)"));
        }

        @Test
        @DisplayName("_zip 取较短长度")
        void testZip() {
            assertEquals("[[1, a], [2, b]]", run("show([1, 2, 3] _zip([\"a\", \"b\"]))"));
        }

        @Test
        @DisplayName("_chunk 缺省为 2")
        void testChunk() {
            assertEquals("[[1, 2], [3, 4], [5]] [[1, 2, 3], [4, 5]]",
                    run("let xs = [1, 2, 3, 4, 5]\nshow(xs _chunk, xs _chunk(3))"));
        }

        @Test
        @DisplayName("_reduce 有无初值")
        void testReduce() {
            assertEquals("10 20 null", run(
                    "let xs = [1, 2, 3, 4]\nshow(xs _reduce((a, b) => a + b), xs _reduce((a, b) => a + b, 10), "
                            + "[] _reduce((a, b) => a + b))"));
        }

        @Test
        @DisplayName("_each 返回原列表")
        void testEach() {
            assertEquals("1\n2\n[1, 2]", run("let r = [1, 2] _each((x) => show(x))\nshow(r)"));
        }

        @Test
        @DisplayName("_slice 与 _window")
        void testSliceWindow() {
            assertEquals("[2, 3] [2, 3, 4] [1, 3, 5, 7]", run(
                    "let xs = [1, 2, 3, 4]\nshow(xs _slice(1, 2), xs _slice(1), xs _window(2, (w) => w _sum))"));
        }

        @Test
        @DisplayName("字符串按字符列表处理")
        void testStringSource() {
            assertEquals("[a, b, c] 3", run("show(\"cab\" _sort, \"abc\" _count)"));
        }
    }

    // ============ 表格动词 ============

    @Nested
    @DisplayName("表格动词")
    class RelationalVerbTests {

        @Test
        @DisplayName("_group 按首次出现排序")
        void testGroup() {
            assertEquals("[eng, ops] 2", run(PEOPLE
                    + "let g = people _group((p) => p.dept)\nshow(keys(g), len(g[\"eng\"]))"));
        }

        @Test
        @DisplayName("_group_by 别名")
        void testGroupByAlias() {
            assertEquals("{true: [2, 4], false: [1, 3]}", run(
                    "show([2, 1, 4, 3] _group_by((x) => x % 2 == 0))"));
        }

        @Test
        @DisplayName("_join 交叉匹配且左侧字段优先")
        void testJoin() {
            String source = "let left = [{id: 1, v: \"L\"}, {id: 2, v: \"L2\"}]\n"
                    + "let right = [{id: 1, v: \"R\", w: 1}, {id: 1, v: \"R2\", w: 2}]\n"
                    + "show(left _join(right, (r) => r.id))";
            assertEquals("[{id: 1, v: L, w: 1}, {id: 1, v: L, w: 2}]", run(source));
        }

        @Test
        @DisplayName("_leftJoin 保留未匹配行")
        void testLeftJoin() {
            String source = "let left = [{id: 1}, {id: 2}]\n"
                    + "let right = [{id: 1, w: 9}]\n"
                    + "show(left _leftJoin(right, (r) => r.id))";
            assertEquals("[{id: 1, w: 9}, {id: 2}]", run(source));
        }

        @Test
        @DisplayName("_select 投影并丢弃非映射")
        void testSelect() {
            assertEquals("[{name: Ann, x: null}] [{name: Ann}]", run(
                    "let rows = [{name: \"Ann\", age: 3}, 5]\n"
                            + "show(rows _select([\"name\", \"x\"]), rows _select(\"name\"))"));
        }

        @Test
        @DisplayName("_mutate 合并新列")
        void testMutate() {
            assertEquals("[{a: 1, b: 2}]", run("show([{a: 1}] _mutate((r) => {b: r.a + 1}))"));
        }

        @Test
        @DisplayName("_summarize 作用于列表")
        void testSummarizeList() {
            assertEquals("{n: 3, total: 98, label: all}", run(PEOPLE
                    + "show(people _summarize({n: (rows) => rows _count, "
                    + "total: (rows) => rows _map((p) => p.age) _sum, label: \"all\"}))"));
        }

        @Test
        @DisplayName("_summarize 作用于分组")
        void testSummarizeGroups() {
            assertEquals("[{_group: eng, n: 2}, {_group: ops, n: 1}]", run(PEOPLE
                    + "show(people _group((p) => p.dept) _summarize({n: (rows) => rows _count}))"));
        }

        @Test
        @DisplayName("_rename")
        void testRename() {
            assertEquals("[{years: 31}]", run("show([{age: 31}] _rename({age: \"years\"}))"));
        }

        @Test
        @DisplayName("_arrange 升序与降序")
        void testArrange() {
            assertEquals("[Bob, Ann, Cid] [Cid, Ann, Bob]", run(PEOPLE
                    + "show(people _arrange((p) => p.age) _pull(\"name\"), "
                    + "people _arrange((p) => p.age, \"desc\") _pull(\"name\"))"));
        }

        @Test
        @DisplayName("_distinct 三种形式")
        void testDistinct() {
            assertEquals("[eng, ops] 2 2", run(PEOPLE
                    + "show(people _distinct((p) => p.dept) _pull(\"dept\"), "
                    + "len(people _distinct([\"dept\"])), len([{a: 1}, {a: 1}, {a: 2}] _distinct))"));
        }

        @Test
        @DisplayName("_pull 非映射为 null")
        void testPull() {
            assertEquals("[1, null]", run("show([{a: 1}, 5] _pull(\"a\"))"));
        }

        @Test
        @DisplayName("_mapValues 只作用于映射")
        void testMapValues() {
            assertEquals("{a: 2, b: 4}", run("show({a: 1, b: 2} _mapValues((v) => v * 2))"));
        }

        @Test
        @DisplayName("_pivot 长表转宽表")
        void testPivot() {
            String source = "let sales = [\n"
                    + "  {q: \"Q1\", region: \"N\", amt: 10},\n"
                    + "  {q: \"Q1\", region: \"S\", amt: 20},\n"
                    + "  {q: \"Q2\", region: \"N\", amt: 30}\n"
                    + "]\n"
                    + "show(sales _pivot((r) => r.q, (r) => r.region, (r) => r.amt))";
            assertEquals("[{_index: Q1, N: 10, S: 20}, {_index: Q2, N: 30, S: null}]", run(source));
        }

        @Test
        @DisplayName("_unpivot 宽表转长表")
        void testUnpivot() {
            assertEquals("[{id: 1, variable: a, value: 5}, {id: 1, variable: b, value: 6}]",
                    run("show([{id: 1, a: 5, b: 6}] _unpivot([\"id\"]))"));
        }
    }

    // ============ 错误 ============

    @Nested
    @DisplayName("错误提示")
    class ErrorTests {

        @Test
        @DisplayName("列表动词作用于映射")
        void testListVerbOnMap() {
            assertEquals("'_sort' works on lists. You have a map — try keys(data) _sort or values(data) _sort.",
                    error("let m = {a: 1}\nlet r = m _sort"));
        }

        @Test
        @DisplayName("映射动词作用于列表")
        void testMapVerbOnList() {
            assertThat(error("let r = [1] _mapValues((v) => v)"))
                    .startsWith("'_mapValues' works on maps. You have a list");
        }

        @Test
        @DisplayName("缺少函数参数给出用法")
        void testUsage() {
            assertEquals("_filter requires a function: data _filter((x) => condition)",
                    error("let r = [1] _filter(5)"));
            assertEquals("_window requires (window_size, function)", error("let r = [1] _window(2)"));
            assertEquals("_pivot requires (index_fn, column_fn, value_fn)", error("let r = [1] _pivot((x) => x)"));
        }

        @Test
        @DisplayName("_chunk 大小为零")
        void testChunkZero() {
            assertEquals("_chunk requires a size: data _chunk(3)", error("let r = [1] _chunk(0)"));
        }

        @Test
        @DisplayName("未知动词给出提示")
        void testUnknownVerb() {
            StepChainEngine engine = new StepChainEngine(interpreter);
            LanguageError e = assertThrows(LanguageError.class,
                    () -> engine.apply(new TinyList(), "_fitler", Collections.<TinyValue>emptyList()));
            assertEquals("Unknown step '_fitler'. Did you mean '_filter'?", e.getRawMessage());
        }

        @Test
        @DisplayName("引擎可直接调用")
        void testDirectApply() {
            StepChainEngine engine = new StepChainEngine(interpreter);
            TinyList data = new TinyList(Arrays.<TinyValue>asList(TinyInt.of(2), TinyInt.of(1)));
            TinyValue result = engine.apply(data, "_sort", Collections.<TinyValue>emptyList());
            assertEquals("[1, 2]", result.asString());
            assertEquals("[2, 1]", data.asString());

            TinyValue identity = interpreter.eval("(x) => x");
            TinyValue groups = engine.apply(data, "_group", Arrays.asList(identity));
            assertThat(groups).isInstanceOf(TinyMap.class);
            assertEquals("{2: [2], 1: [1]}", groups.asString());
        }
    }
}

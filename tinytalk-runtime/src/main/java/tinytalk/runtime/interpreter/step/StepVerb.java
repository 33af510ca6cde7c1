package tinytalk.runtime.interpreter.step;

import com.tinytalk.compiler.lexer.Lexer;

import java.util.HashMap;
import java.util.Map;

/**
 * 步骤链动词：输入形状与用法提示
 */
public enum StepVerb {

    FILTER("_filter", Input.LIST, "_filter requires a function: data _filter((x) => condition)"),
    SORT("_sort", Input.LIST, "_sort optionally takes a key function: data _sort or data _sort((x) => x.field)"),
    MAP("_map", Input.LIST, "_map requires a function: data _map((x) => transform(x))"),
    TAKE("_take", Input.LIST, "_take optionally takes a count: data _take(3)"),
    DROP("_drop", Input.LIST, "_drop optionally takes a count: data _drop(3)"),
    FIRST("_first", Input.LIST, null),
    LAST("_last", Input.LIST, null),
    REVERSE("_reverse", Input.LIST, null),
    UNIQUE("_unique", Input.LIST, null),
    COUNT("_count", Input.LIST, null),
    SUM("_sum", Input.LIST, null),
    AVG("_avg", Input.LIST, null),
    MIN("_min", Input.LIST, null),
    MAX("_max", Input.LIST, null),
    GROUP("_group", Input.LIST_PLAIN, "_group requires a key function: data _group((x) => x.category)"),
    GROUP_BY("_groupBy", Input.LIST_PLAIN, "_groupBy requires a key function: data _groupBy((x) => x.category)"),
    FLATTEN("_flatten", Input.LIST, null),
    ZIP("_zip", Input.LIST, "_zip requires a list: list1 _zip(list2)"),
    CHUNK("_chunk", Input.LIST, "_chunk requires a size: data _chunk(3)"),
    REDUCE("_reduce", Input.LIST, "_reduce requires a function and optional initial value: data _reduce((acc, x) => acc + x, 0)"),
    SORT_BY("_sortBy", Input.LIST, "_sortBy requires a key function: data _sortBy((x) => x.field)"),
    JOIN("_join", Input.LIST_PLAIN, "_join requires (right_list, key_fn): left _join(right, (r) => r.id)"),
    LEFT_JOIN("_leftJoin", Input.LIST, "_leftJoin requires (right_list, key_fn): left _leftJoin(right, (r) => r.id)"),
    MAP_VALUES("_mapValues", Input.MAP, "_mapValues requires a function: map_data _mapValues((v) => transform(v))"),
    EACH("_each", Input.LIST, "_each requires a function: data _each((x) => show(x))"),
    SELECT("_select", Input.LIST, "_select requires column names: data _select([\"name\", \"age\"]) or data _select(\"name\", \"age\")"),
    MUTATE("_mutate", Input.LIST, "_mutate requires a function returning a map: data _mutate((r) => {\"new_col\": value})"),
    SUMMARIZE("_summarize", Input.LIST_OR_GROUPED, "_summarize requires a map of aggregation functions: data _summarize({\"total\": (rows) => rows _sum})"),
    RENAME("_rename", Input.LIST, "_rename requires a map of {old: new}: data _rename({\"old_name\": \"new_name\"})"),
    ARRANGE("_arrange", Input.LIST, "_arrange requires a key function: data _arrange((r) => r.field)"),
    DISTINCT("_distinct", Input.LIST, "_distinct optionally takes a key function or column list"),
    SLICE("_slice", Input.LIST, "_slice takes (start, count): data _slice(2, 5)"),
    PULL("_pull", Input.LIST, "_pull requires a column name: data _pull(\"column_name\")"),
    PIVOT("_pivot", Input.LIST, "_pivot requires (index_fn, column_fn, value_fn)"),
    UNPIVOT("_unpivot", Input.LIST, "_unpivot requires a list of id column names"),
    WINDOW("_window", Input.LIST, "_window requires (window_size, function)");

    /** 输入形状 */
    public enum Input {
        /** 列表（字符串按字符列表处理），形状错误时给出转换建议 */
        LIST,
        /** 列表，形状错误时只报告类型 */
        LIST_PLAIN,
        /** 映射 */
        MAP,
        /** 列表或分组映射 */
        LIST_OR_GROUPED
    }

    private static final Map<String, StepVerb> BY_NAME = new HashMap<String, StepVerb>();

    static {
        for (StepVerb verb : values()) {
            BY_NAME.put(verb.verb, verb);
        }
    }

    private final String verb;
    private final Input input;
    private final String usage;

    StepVerb(String verb, Input input, String usage) {
        this.verb = verb;
        this.input = input;
        this.usage = usage;
    }

    public String getVerb() {
        return verb;
    }

    public Input getInput() {
        return input;
    }

    /**
     * 参数错误时的用法提示
     */
    public String getUsage() {
        return usage != null ? usage : "Check the usage of '" + verb + "'";
    }

    /**
     * 按拼写查找（接受别名），未知返回 null
     */
    public static StepVerb lookup(String name) {
        return BY_NAME.get(Lexer.canonicalVerb(name));
    }

    @Override
    public String toString() {
        return verb;
    }
}

package tinytalk.runtime.interpreter.step;

import tinytalk.runtime.TinyCallable;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表格式动词：分组、连接、投影、聚合
 *
 * <p>行通常是映射；不是映射的元素按各动词的约定透传或丢弃。</p>
 */
final class RelationalSteps {

    private RelationalSteps() {}

    /**
     * 分组键：标量直接作映射键，列表等不可哈希的值以显示形式作键
     */
    static Object groupKey(TinyValue key) {
        if (key.isList() || key.isMap() || key.isCallable()) {
            return ValueFormatter.format(key);
        }
        try {
            return key.toKey();
        } catch (RuntimeException e) {
            return ValueFormatter.format(key);
        }
    }

    static TinyValue group(List<TinyValue> items, StepArgs args) {
        TinyCallable keyFn = args.function(0);
        TinyMap groups = new TinyMap();
        for (TinyValue item : items) {
            Object key = groupKey(args.call(keyFn, item));
            TinyValue bucket = groups.getEntries().get(key);
            if (bucket == null) {
                bucket = new TinyList();
                groups.put(key, bucket);
            }
            ((TinyList) bucket).add(item);
        }
        return groups;
    }

    static TinyValue join(List<TinyValue> items, StepArgs args, boolean keepUnmatched) {
        List<TinyValue> right = args.list(0).getElements();
        TinyCallable keyFn = args.function(1);

        Map<Object, List<TinyValue>> index = new HashMap<Object, List<TinyValue>>();
        for (TinyValue row : right) {
            Object key = StepSupport.nativeKey(args.call(keyFn, row));
            index.computeIfAbsent(key, k -> new ArrayList<TinyValue>()).add(row);
        }

        TinyList result = new TinyList();
        for (TinyValue left : items) {
            Object key = StepSupport.nativeKey(args.call(keyFn, left));
            List<TinyValue> matches = index.getOrDefault(key, Collections.<TinyValue>emptyList());
            if (matches.isEmpty()) {
                if (keepUnmatched) {
                    result.add(left);
                }
                continue;
            }
            for (TinyValue match : matches) {
                result.add(StepSupport.mergeRows(left, match));
            }
        }
        return result;
    }

    /**
     * 接受列名列表或多个字符串参数
     */
    static TinyValue select(List<TinyValue> items, StepArgs args) {
        List<Object> columns = new ArrayList<Object>();
        if (args.has(0) && args.get(0).isList()) {
            for (TinyValue col : args.list(0)) {
                columns.add(groupKey(col));
            }
        } else if (args.has(0) && args.get(0).isString()) {
            for (int i = 0; i < args.size(); i++) {
                if (args.get(i).isString()) {
                    columns.add(args.get(i).asString());
                }
            }
        } else {
            throw args.usage();
        }

        TinyList result = new TinyList();
        for (TinyValue row : items) {
            if (!row.isMap()) {
                continue;
            }
            TinyMap source = (TinyMap) row;
            TinyMap projected = new TinyMap();
            for (Object col : columns) {
                projected.put(col, source.get(col));
            }
            result.add(projected);
        }
        return result;
    }

    static TinyValue mutate(List<TinyValue> items, StepArgs args) {
        TinyCallable fn = args.function(0);
        TinyList result = new TinyList();
        for (TinyValue row : items) {
            TinyValue extra = args.call(fn, row);
            if (row.isMap() && extra.isMap()) {
                TinyMap merged = new TinyMap(((TinyMap) row).getEntries());
                merged.getEntries().putAll(((TinyMap) extra).getEntries());
                result.add(merged);
            } else {
                result.add(row);
            }
        }
        return result;
    }

    /**
     * 列表汇总为一行
     */
    static TinyValue summarize(TinyList rows, StepArgs args) {
        return aggregate(rows, args.map(0), args);
    }

    /**
     * 分组映射每组汇总为一行，{@code _group} 列为组键的显示形式
     */
    static TinyValue summarizeGroups(TinyMap groups, StepArgs args) {
        TinyMap aggregations = args.map(0);
        TinyList result = new TinyList();
        for (Map.Entry<Object, TinyValue> e : groups.getEntries().entrySet()) {
            TinyList rows;
            if (e.getValue().isList()) {
                rows = (TinyList) e.getValue();
            } else {
                rows = new TinyList();
                rows.add(e.getValue());
            }
            TinyMap row = new TinyMap();
            row.put("_group", TinyString.of(ValueFormatter.formatKey(e.getKey())));
            row.getEntries().putAll(aggregate(rows, aggregations, args).getEntries());
            result.add(row);
        }
        return result;
    }

    private static TinyMap aggregate(TinyList rows, TinyMap aggregations, StepArgs args) {
        TinyMap row = new TinyMap();
        for (Map.Entry<Object, TinyValue> e : aggregations.getEntries().entrySet()) {
            TinyValue spec = e.getValue();
            row.put(e.getKey(), spec.isCallable() ? args.call((TinyCallable) spec, rows) : spec);
        }
        return row;
    }

    /**
     * 只有值为字符串的条目参与改名
     */
    static TinyValue rename(List<TinyValue> items, StepArgs args) {
        Map<Object, String> renames = new HashMap<Object, String>();
        for (Map.Entry<Object, TinyValue> e : args.map(0).getEntries().entrySet()) {
            if (e.getValue().isString()) {
                renames.put(e.getKey(), e.getValue().asString());
            }
        }
        TinyList result = new TinyList();
        for (TinyValue row : items) {
            if (!row.isMap()) {
                result.add(row);
                continue;
            }
            TinyMap renamed = new TinyMap();
            for (Map.Entry<Object, TinyValue> e : ((TinyMap) row).getEntries().entrySet()) {
                Object key = renames.containsKey(e.getKey()) ? renames.get(e.getKey()) : e.getKey();
                renamed.put(key, e.getValue());
            }
            result.add(renamed);
        }
        return result;
    }

    static TinyValue arrange(List<TinyValue> items, StepArgs args) {
        TinyCallable keyFn = args.function(0);
        boolean descending = args.has(1) && args.get(1).isString() && "desc".equals(args.get(1).asString());
        List<TinyValue> keys = new ArrayList<TinyValue>(items.size());
        for (TinyValue item : items) {
            keys.add(args.call(keyFn, item));
        }
        return new TinyList(StepSupport.sortByKeys(items, keys, descending));
    }

    /**
     * 按键函数、列子集或整个值去重，保留首次出现
     */
    static TinyValue distinct(List<TinyValue> items, StepArgs args) {
        TinyCallable keyFn = args.optionalFunction(0);
        List<Object> columns = null;
        if (keyFn == null && args.has(0) && args.get(0).isList()) {
            columns = new ArrayList<Object>();
            for (TinyValue col : args.list(0)) {
                columns.add(groupKey(col));
            }
        }

        Set<Object> seen = new HashSet<Object>();
        TinyList result = new TinyList();
        for (TinyValue item : items) {
            Object key;
            if (keyFn != null) {
                key = StepSupport.nativeKey(args.call(keyFn, item));
            } else if (columns != null && item.isMap()) {
                List<Object> parts = new ArrayList<Object>(columns.size());
                for (Object col : columns) {
                    parts.add(StepSupport.nativeKey(((TinyMap) item).get(col)));
                }
                key = parts;
            } else {
                key = StepSupport.nativeKey(item);
            }
            if (seen.add(key)) {
                result.add(item);
            }
        }
        return result;
    }

    static TinyValue pull(List<TinyValue> items, StepArgs args) {
        String column = args.string(0);
        TinyList result = new TinyList();
        for (TinyValue row : items) {
            result.add(row.isMap() ? ((TinyMap) row).get(column) : TinyNull.NULL);
        }
        return result;
    }

    static TinyValue mapValues(TinyMap source, StepArgs args) {
        TinyCallable fn = args.function(0);
        TinyMap result = new TinyMap();
        for (Map.Entry<Object, TinyValue> e : source.getEntries().entrySet()) {
            result.put(e.getKey(), args.call(fn, e.getValue()));
        }
        return result;
    }
}

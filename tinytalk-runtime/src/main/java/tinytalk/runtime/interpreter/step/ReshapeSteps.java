package tinytalk.runtime.interpreter.step;

import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 长表与宽表互转
 */
final class ReshapeSteps {

    private ReshapeSteps() {}

    /**
     * 长表转宽表：每个索引值一行 {@code {_index, 列...}}，列按首次出现排序，缺失单元为 null
     */
    static TinyValue pivot(List<TinyValue> items, StepArgs args) {
        if (args.size() < 3) {
            throw args.usage();
        }
        Map<String, Map<String, TinyValue>> cells = new LinkedHashMap<String, Map<String, TinyValue>>();
        Set<String> columns = new LinkedHashSet<String>();
        for (TinyValue item : items) {
            String index = ValueFormatter.format(args.call(args.function(0), item));
            String column = ValueFormatter.format(args.call(args.function(1), item));
            TinyValue value = args.call(args.function(2), item);
            cells.computeIfAbsent(index, k -> new LinkedHashMap<String, TinyValue>()).put(column, value);
            columns.add(column);
        }

        TinyList result = new TinyList();
        for (Map.Entry<String, Map<String, TinyValue>> e : cells.entrySet()) {
            TinyMap row = new TinyMap();
            row.put("_index", TinyString.of(e.getKey()));
            for (String column : columns) {
                TinyValue value = e.getValue().get(column);
                row.put(column, value != null ? value : TinyNull.NULL);
            }
            result.add(row);
        }
        return result;
    }

    /**
     * 宽表转长表：非标识列拆成 {@code variable} / {@code value} 行，非映射行丢弃
     */
    static TinyValue unpivot(List<TinyValue> items, StepArgs args) {
        Set<Object> idColumns = new HashSet<Object>();
        for (TinyValue col : args.list(0)) {
            if (col.isString()) {
                idColumns.add(col.asString());
            }
        }

        TinyList result = new TinyList();
        for (TinyValue item : items) {
            if (!item.isMap()) {
                continue;
            }
            Map<Object, TinyValue> entries = ((TinyMap) item).getEntries();
            TinyMap ids = new TinyMap();
            for (Map.Entry<Object, TinyValue> e : entries.entrySet()) {
                if (idColumns.contains(e.getKey())) {
                    ids.put(e.getKey(), e.getValue());
                }
            }
            for (Map.Entry<Object, TinyValue> e : entries.entrySet()) {
                if (idColumns.contains(e.getKey())) {
                    continue;
                }
                TinyMap row = new TinyMap(ids.getEntries());
                row.put("variable", TinyString.of(ValueFormatter.formatKey(e.getKey())));
                row.put("value", e.getValue());
                result.add(row);
            }
        }
        return result;
    }
}

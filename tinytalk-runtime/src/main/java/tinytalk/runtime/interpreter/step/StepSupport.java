package tinytalk.runtime.interpreter.step;

import tinytalk.runtime.TinyInstance;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.BinaryOps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 步骤实现共用的辅助方法
 */
final class StepSupport {

    private StepSupport() {}

    /**
     * 去重与连接使用的原生键：数值相等即同键（1、1.0、true 视为相同），列表与映射按结构比较
     */
    static Object nativeKey(TinyValue value) {
        if (value.isBool()) {
            return value.asLong();
        }
        if (value.isFloat()) {
            double d = value.asDouble();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.2e18) {
                return (long) d;
            }
            return d;
        }
        if (value.isList()) {
            List<Object> keys = new ArrayList<Object>();
            for (TinyValue item : (TinyList) value) {
                keys.add(nativeKey(item));
            }
            return keys;
        }
        if (value.isMap()) {
            Map<Object, Object> keys = new HashMap<Object, Object>();
            for (Map.Entry<Object, TinyValue> e : ((TinyMap) value).getEntries().entrySet()) {
                keys.put(e.getKey(), nativeKey(e.getValue()));
            }
            return keys;
        }
        if (value instanceof TinyInstance) {
            return value;
        }
        return value.toJavaValue();
    }

    /**
     * 按预先算好的键稳定排序
     */
    static List<TinyValue> sortByKeys(List<TinyValue> items, List<TinyValue> keys, boolean descending) {
        List<Integer> order = new ArrayList<Integer>(items.size());
        for (int i = 0; i < items.size(); i++) {
            order.add(i);
        }
        order.sort((a, b) -> {
            int c = BinaryOps.compare(keys.get(a), keys.get(b));
            return descending ? -c : c;
        });
        List<TinyValue> result = new ArrayList<TinyValue>(items.size());
        for (int i : order) {
            result.add(items.get(i));
        }
        return result;
    }

    /**
     * 半开区间切片 [start, end)，负数从末尾计，越界截断
     */
    static List<TinyValue> slice(List<TinyValue> items, long start, long end) {
        int size = items.size();
        long s = start < 0 ? Math.max(0, start + size) : Math.min(start, size);
        long e = end < 0 ? Math.max(0, end + size) : Math.min(end, size);
        if (e <= s) {
            return new ArrayList<TinyValue>();
        }
        return new ArrayList<TinyValue>(items.subList((int) s, (int) e));
    }

    /**
     * 合并两行：左侧字段优先
     */
    static TinyMap mergeRows(TinyValue left, TinyValue right) {
        TinyMap merged = new TinyMap();
        if (left.isMap()) {
            merged.getEntries().putAll(((TinyMap) left).getEntries());
        }
        if (right.isMap()) {
            for (Map.Entry<Object, TinyValue> e : ((TinyMap) right).getEntries().entrySet()) {
                if (!merged.containsKey(e.getKey())) {
                    merged.put(e.getKey(), e.getValue());
                }
            }
        }
        return merged;
    }

    /**
     * 按键函数分组，保持首次出现顺序
     */
    static Map<Object, List<TinyValue>> index(List<TinyValue> items, List<Object> keys) {
        Map<Object, List<TinyValue>> groups = new LinkedHashMap<Object, List<TinyValue>>();
        for (int i = 0; i < items.size(); i++) {
            groups.computeIfAbsent(keys.get(i), k -> new ArrayList<TinyValue>()).add(items.get(i));
        }
        return groups;
    }

    static List<TinyValue> reversed(List<TinyValue> items) {
        List<TinyValue> copy = new ArrayList<TinyValue>(items);
        Collections.reverse(copy);
        return copy;
    }
}

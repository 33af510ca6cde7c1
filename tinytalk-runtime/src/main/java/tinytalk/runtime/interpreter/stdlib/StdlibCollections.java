package tinytalk.runtime.interpreter.stdlib;

import tinytalk.runtime.TinyBool;
import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;
import tinytalk.runtime.interpreter.BinaryOps;
import tinytalk.runtime.interpreter.Conversions;
import tinytalk.runtime.interpreter.Interpreter;
import tinytalk.runtime.interpreter.LanguageError;
import tinytalk.runtime.interpreter.NativeFunction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 集合函数：range、append、keys、filter 等
 *
 * <p>append / push / pop 原地修改列表，其余函数返回新值。</p>
 */
final class StdlibCollections {

    private StdlibCollections() {}

    static void register(Map<String, TinyValue> table) {
        // range(stop) / range(start, stop) / range(start, stop, step)
        Builtins.define(table, NativeFunction.varargs("range", (ctx, args) -> {
            if (args.isEmpty()) return new TinyList();
            long start = 0;
            long stop;
            long step = 1;
            if (args.size() == 1) {
                stop = integer(args.get(0));
            } else {
                start = integer(args.get(0));
                stop = integer(args.get(1));
                if (args.size() > 2) {
                    step = integer(args.get(2));
                }
            }
            if (step == 0) {
                throw new LanguageError("range() step must not be zero");
            }
            long count = step > 0
                    ? (stop > start ? (stop - start + step - 1) / step : 0)
                    : (start > stop ? (start - stop - step - 1) / -step : 0);
            if (ctx instanceof Interpreter) {
                ((Interpreter) ctx).checkAllocation(count);
            }
            TinyList result = new TinyList();
            for (long i = 0, v = start; i < count; i++, v += step) {
                result.add(TinyInt.of(v));
            }
            return result;
        }));

        Builtins.define(table, NativeFunction.varargs("append", (ctx, args) -> {
            if (args.size() < 2 || !args.get(0).isList()) return TinyNull.NULL;
            TinyList list = (TinyList) args.get(0);
            list.add(args.get(1));
            return list;
        }));
        Builtins.alias(table, "push", "append");

        Builtins.define(table, NativeFunction.varargs("pop", (ctx, args) -> {
            if (args.isEmpty() || !args.get(0).isList()) return TinyNull.NULL;
            List<TinyValue> elements = ((TinyList) args.get(0)).getElements();
            return elements.isEmpty() ? TinyNull.NULL : elements.remove(elements.size() - 1);
        }));

        Builtins.define(table, NativeFunction.varargs("keys", (ctx, args) ->
                args.isEmpty() || !args.get(0).isMap()
                        ? new TinyList() : new TinyList(((TinyMap) args.get(0)).keyStrings())));

        Builtins.define(table, NativeFunction.varargs("values", (ctx, args) ->
                args.isEmpty() || !args.get(0).isMap()
                        ? new TinyList() : new TinyList(((TinyMap) args.get(0)).values())));

        Builtins.define(table, NativeFunction.varargs("contains", (ctx, args) -> {
            if (args.size() < 2) return TinyBool.FALSE;
            TinyValue coll = args.get(0);
            TinyValue item = args.get(1);
            if (coll.isList()) {
                for (TinyValue v : (TinyList) coll) {
                    if (BinaryOps.valuesEqual(v, item)) return TinyBool.TRUE;
                }
                return TinyBool.FALSE;
            }
            if (coll.isMap()) {
                return TinyBool.of(BinaryOps.has(coll, item));
            }
            if (coll.isString()) {
                return TinyBool.of(coll.asString().contains(ValueFormatter.format(item)));
            }
            return TinyBool.FALSE;
        }));

        // slice(x, start[, end])：半开区间，负数从末尾计
        Builtins.define(table, NativeFunction.varargs("slice", (ctx, args) -> {
            if (args.isEmpty()) return TinyNull.NULL;
            TinyValue v = args.get(0);
            long start = args.size() > 1 ? integer(args.get(1)) : 0;
            boolean hasEnd = args.size() > 2 && !args.get(2).isNull();
            if (v.isList()) {
                List<TinyValue> items = ((TinyList) v).getElements();
                long end = hasEnd ? integer(args.get(2)) : items.size();
                int[] range = clamp(start, end, items.size());
                return new TinyList(new ArrayList<TinyValue>(items.subList(range[0], range[1])));
            }
            if (v.isString()) {
                String s = v.asString();
                long end = hasEnd ? integer(args.get(2)) : s.length();
                int[] range = clamp(start, end, s.length());
                return TinyString.of(s.substring(range[0], range[1]));
            }
            return TinyNull.NULL;
        }));

        Builtins.define(table, NativeFunction.varargs("reverse", (ctx, args) -> {
            if (args.isEmpty()) return TinyNull.NULL;
            TinyValue v = args.get(0);
            if (v.isList()) {
                List<TinyValue> copy = new ArrayList<TinyValue>(((TinyList) v).getElements());
                Collections.reverse(copy);
                return new TinyList(copy);
            }
            if (v.isString()) {
                return TinyString.of(new StringBuilder(v.asString()).reverse().toString());
            }
            return v;
        }));

        Builtins.define(table, NativeFunction.varargs("sort", (ctx, args) ->
                args.isEmpty() || !args.get(0).isList()
                        ? new TinyList() : new TinyList(BinaryOps.sorted(((TinyList) args.get(0)).getElements()))));

        // 高阶函数：函数在前，列表在后
        Builtins.define(table, new NativeFunction("filter", 2, (ctx, args) -> {
            TinyList result = new TinyList();
            if (!args.get(0).isCallable() || !args.get(1).isList()) return result;
            for (TinyValue item : (TinyList) args.get(1)) {
                if (ctx.invoke(args.get(0), Collections.singletonList(item)).isTruthy()) {
                    result.add(item);
                }
            }
            return result;
        }));

        Builtins.define(table, new NativeFunction("map_", 2, (ctx, args) -> {
            TinyList result = new TinyList();
            if (!args.get(0).isCallable() || !args.get(1).isList()) return result;
            for (TinyValue item : (TinyList) args.get(1)) {
                result.add(ctx.invoke(args.get(0), Collections.singletonList(item)));
            }
            return result;
        }));

        Builtins.define(table, new NativeFunction("reduce", 3, (ctx, args) -> {
            TinyValue acc = args.get(2);
            if (!args.get(0).isCallable() || !args.get(1).isList()) return acc;
            for (TinyValue item : (TinyList) args.get(1)) {
                acc = ctx.invoke(args.get(0), Arrays.asList(acc, item));
            }
            return acc;
        }));

        // zip(a, b, ...)：按最短列表配对，忽略非列表参数
        Builtins.define(table, NativeFunction.varargs("zip", (ctx, args) -> {
            List<TinyList> lists = new ArrayList<TinyList>();
            for (TinyValue arg : args) {
                if (arg.isList()) lists.add((TinyList) arg);
            }
            TinyList result = new TinyList();
            if (args.size() < 2 || lists.isEmpty()) return result;
            int n = Integer.MAX_VALUE;
            for (TinyList list : lists) {
                n = Math.min(n, list.size());
            }
            for (int i = 0; i < n; i++) {
                TinyList row = new TinyList();
                for (TinyList list : lists) {
                    row.add(list.get(i));
                }
                result.add(row);
            }
            return result;
        }));

        Builtins.define(table, NativeFunction.varargs("enumerate", (ctx, args) -> {
            TinyList result = new TinyList();
            if (args.isEmpty() || !args.get(0).isList()) return result;
            TinyList source = (TinyList) args.get(0);
            for (int i = 0; i < source.size(); i++) {
                TinyList pair = new TinyList();
                pair.add(TinyInt.of(i));
                pair.add(source.get(i));
                result.add(pair);
            }
            return result;
        }));
    }

    private static long integer(TinyValue v) {
        return Conversions.toInt(v).getValue();
    }

    /**
     * 负数下标从末尾计，越界截断，返回 [from, to)
     */
    static int[] clamp(long start, long end, int size) {
        long s = start < 0 ? Math.max(0, start + size) : Math.min(start, size);
        long e = end < 0 ? Math.max(0, end + size) : Math.min(end, size);
        return new int[]{(int) s, (int) Math.max(s, e)};
    }
}

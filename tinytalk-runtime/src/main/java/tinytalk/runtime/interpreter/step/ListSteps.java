package tinytalk.runtime.interpreter.step;

import tinytalk.runtime.TinyCallable;
import tinytalk.runtime.TinyFloat;
import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.BinaryOps;
import tinytalk.runtime.interpreter.LanguageError;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 基本列表动词
 */
final class ListSteps {

    private ListSteps() {}

    static TinyValue filter(List<TinyValue> items, StepArgs args) {
        TinyCallable pred = args.function(0);
        TinyList result = new TinyList();
        for (TinyValue item : items) {
            if (args.test(pred, item)) {
                result.add(item);
            }
        }
        return result;
    }

    static TinyValue map(List<TinyValue> items, StepArgs args) {
        TinyCallable fn = args.function(0);
        TinyList result = new TinyList();
        for (TinyValue item : items) {
            result.add(args.call(fn, item));
        }
        return result;
    }

    static TinyValue sort(List<TinyValue> items, StepArgs args) {
        TinyCallable keyFn = args.optionalFunction(0);
        if (keyFn == null) {
            return new TinyList(BinaryOps.sorted(items));
        }
        return sortBy(items, args, keyFn);
    }

    static TinyValue sortBy(List<TinyValue> items, StepArgs args) {
        return sortBy(items, args, args.function(0));
    }

    private static TinyValue sortBy(List<TinyValue> items, StepArgs args, TinyCallable keyFn) {
        List<TinyValue> keys = new ArrayList<TinyValue>(items.size());
        for (TinyValue item : items) {
            keys.add(args.call(keyFn, item));
        }
        return new TinyList(StepSupport.sortByKeys(items, keys, false));
    }

    static TinyValue take(List<TinyValue> items, StepArgs args) {
        return new TinyList(StepSupport.slice(items, 0, args.integer(0, 1)));
    }

    static TinyValue drop(List<TinyValue> items, StepArgs args) {
        return new TinyList(StepSupport.slice(items, args.integer(0, 1), Long.MAX_VALUE));
    }

    static TinyValue first(List<TinyValue> items) {
        return items.isEmpty() ? TinyNull.NULL : items.get(0);
    }

    static TinyValue last(List<TinyValue> items) {
        return items.isEmpty() ? TinyNull.NULL : items.get(items.size() - 1);
    }

    static TinyValue reverse(List<TinyValue> items) {
        return new TinyList(StepSupport.reversed(items));
    }

    static TinyValue unique(List<TinyValue> items) {
        Set<Object> seen = new HashSet<Object>();
        TinyList result = new TinyList();
        for (TinyValue item : items) {
            if (seen.add(StepSupport.nativeKey(item))) {
                result.add(item);
            }
        }
        return result;
    }

    static TinyValue count(List<TinyValue> items, StepArgs args) {
        TinyCallable pred = args.optionalFunction(0);
        if (pred == null) {
            return TinyInt.of(items.size());
        }
        long n = 0;
        for (TinyValue item : items) {
            if (args.test(pred, item)) n++;
        }
        return TinyInt.of(n);
    }

    /**
     * 只累加 int 与 float 元素；任一元素为 float 时结果为 float
     */
    static TinyValue sum(List<TinyValue> items) {
        boolean anyFloat = false;
        long intTotal = 0;
        double floatTotal = 0.0;
        for (TinyValue item : items) {
            if (item.isInt()) {
                try {
                    intTotal = Math.addExact(intTotal, item.asLong());
                } catch (ArithmeticException e) {
                    throw new LanguageError("Integer overflow");
                }
            } else if (item.isFloat()) {
                anyFloat = true;
                floatTotal += item.asDouble();
            }
        }
        return anyFloat ? TinyFloat.of(intTotal + floatTotal) : TinyInt.of(intTotal);
    }

    static TinyValue avg(List<TinyValue> items) {
        double total = 0.0;
        int n = 0;
        for (TinyValue item : items) {
            if (item.isInt() || item.isFloat()) {
                total += item.asDouble();
                n++;
            }
        }
        return n == 0 ? TinyNull.NULL : TinyFloat.of(total / n);
    }

    static TinyValue min(List<TinyValue> items) {
        TinyValue best = null;
        for (TinyValue item : items) {
            if (best == null || BinaryOps.compare(item, best) < 0) {
                best = item;
            }
        }
        return best == null ? TinyNull.NULL : best;
    }

    static TinyValue max(List<TinyValue> items) {
        TinyValue best = null;
        for (TinyValue item : items) {
            if (best == null || BinaryOps.compare(item, best) > 0) {
                best = item;
            }
        }
        return best == null ? TinyNull.NULL : best;
    }

    static TinyValue flatten(List<TinyValue> items) {
        TinyList result = new TinyList();
        for (TinyValue item : items) {
            if (item.isList()) {
                result.getElements().addAll(((TinyList) item).getElements());
            } else {
                result.add(item);
            }
        }
        return result;
    }

    static TinyValue zip(List<TinyValue> items, StepArgs args) {
        List<TinyValue> other = args.list(0).getElements();
        TinyList result = new TinyList();
        int n = Math.min(items.size(), other.size());
        for (int i = 0; i < n; i++) {
            TinyList pair = new TinyList();
            pair.add(items.get(i));
            pair.add(other.get(i));
            result.add(pair);
        }
        return result;
    }

    static TinyValue chunk(List<TinyValue> items, StepArgs args) {
        long size = args.integer(0, 2);
        if (size == 0) {
            throw args.usage();
        }
        TinyList result = new TinyList();
        if (size < 0) {
            return result;
        }
        for (long i = 0; i < items.size(); i += size) {
            result.add(new TinyList(StepSupport.slice(items, i, i + size)));
        }
        return result;
    }

    /**
     * 无初值时从第一个元素开始折叠，空列表得到 null
     */
    static TinyValue reduce(List<TinyValue> items, StepArgs args) {
        TinyCallable fn = args.function(0);
        TinyValue acc;
        int start;
        if (args.has(1)) {
            acc = args.get(1);
            start = 0;
        } else {
            if (items.isEmpty()) {
                return TinyNull.NULL;
            }
            acc = items.get(0);
            start = 1;
        }
        for (int i = start; i < items.size(); i++) {
            acc = args.call(fn, acc, items.get(i));
        }
        return acc;
    }

    /**
     * 仅为副作用调用，返回原列表
     */
    static TinyValue each(TinyList source, StepArgs args) {
        TinyCallable fn = args.function(0);
        for (TinyValue item : new ArrayList<TinyValue>(source.getElements())) {
            args.call(fn, item);
        }
        return source;
    }

    static TinyValue slice(List<TinyValue> items, StepArgs args) {
        long start = args.integer(0, 0);
        long count = args.integer(1, items.size() - start);
        return new TinyList(StepSupport.slice(items, start, start + count));
    }

    /**
     * 滑动窗口：位置 i 的窗口为 items[max(0, i-n+1) .. i]
     */
    static TinyValue window(List<TinyValue> items, StepArgs args) {
        if (args.size() < 2) {
            throw args.usage();
        }
        long size = args.integer(0, 1);
        TinyCallable fn = args.function(1);
        TinyList result = new TinyList();
        for (int i = 0; i < items.size(); i++) {
            long start = Math.max(0, i - size + 1);
            result.add(args.call(fn, new TinyList(StepSupport.slice(items, start, i + 1L))));
        }
        return result;
    }
}

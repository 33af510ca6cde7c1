package tinytalk.runtime.interpreter.step;

import tinytalk.runtime.ExecutionContext;
import tinytalk.runtime.TinyCallable;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.BinaryOps;
import tinytalk.runtime.interpreter.LanguageError;

import java.util.Arrays;
import java.util.List;

/**
 * 单个步骤的实参与回调入口
 */
final class StepArgs {

    private final ExecutionContext ctx;
    private final StepVerb verb;
    private final List<TinyValue> args;

    StepArgs(ExecutionContext ctx, StepVerb verb, List<TinyValue> args) {
        this.ctx = ctx;
        this.verb = verb;
        this.args = args;
    }

    int size() {
        return args.size();
    }

    boolean has(int index) {
        return index < args.size();
    }

    TinyValue get(int index) {
        return args.get(index);
    }

    LanguageError usage() {
        return new LanguageError(verb.getUsage());
    }

    /**
     * 必需的函数参数
     */
    TinyCallable function(int index) {
        if (!has(index) || !args.get(index).isCallable()) {
            throw usage();
        }
        return (TinyCallable) args.get(index);
    }

    /**
     * 可选的函数参数，缺失或不是函数时返回 null
     */
    TinyCallable optionalFunction(int index) {
        return has(index) && args.get(index).isCallable() ? (TinyCallable) args.get(index) : null;
    }

    TinyList list(int index) {
        if (!has(index) || !args.get(index).isList()) {
            throw usage();
        }
        return (TinyList) args.get(index);
    }

    TinyMap map(int index) {
        if (!has(index) || !args.get(index).isMap()) {
            throw usage();
        }
        return (TinyMap) args.get(index);
    }

    String string(int index) {
        if (!has(index) || !args.get(index).isString()) {
            throw usage();
        }
        return args.get(index).asString();
    }

    /**
     * 整数参数，浮点数截断，缺失时取默认值
     */
    long integer(int index, long defaultValue) {
        if (!has(index)) {
            return defaultValue;
        }
        TinyValue v = args.get(index);
        if (v.isFloat()) {
            return (long) v.asDouble();
        }
        if (v.isInt() || v.isBool()) {
            return v.asLong();
        }
        throw usage();
    }

    TinyValue call(TinyCallable fn, TinyValue... callArgs) {
        return ctx.invoke(fn, Arrays.asList(callArgs));
    }

    boolean test(TinyCallable fn, TinyValue item) {
        return call(fn, item).isTruthy();
    }

    static int compare(TinyValue a, TinyValue b) {
        return BinaryOps.compare(a, b);
    }
}

package tinytalk.runtime.interpreter.stdlib;

import tinytalk.runtime.TinyBool;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;
import tinytalk.runtime.interpreter.AssertionFailure;
import tinytalk.runtime.interpreter.BinaryOps;
import tinytalk.runtime.interpreter.NativeFunction;

import java.util.List;
import java.util.Map;

/**
 * 断言函数，失败时抛出 {@link AssertionFailure}（不被 try/catch 捕获）
 */
final class StdlibAssert {

    private StdlibAssert() {}

    static void register(Map<String, TinyValue> table) {
        Builtins.define(table, NativeFunction.varargs("assert", (ctx, args) -> {
            if (args.isEmpty()) return TinyNull.NULL;
            if (!args.get(0).isTruthy()) {
                throw new AssertionFailure(message(args, 1, null, "Assertion failed"));
            }
            return TinyBool.TRUE;
        }));

        Builtins.define(table, new NativeFunction("assert_equal", 2, (ctx, args) -> {
            TinyValue actual = args.get(0);
            TinyValue expected = args.get(1);
            if (BinaryOps.valuesEqual(actual, expected)) {
                return TinyBool.TRUE;
            }
            String detail = "assert_equal failed:\n  expected: " + ValueFormatter.format(expected)
                    + "\n  actual:   " + ValueFormatter.format(actual);
            throw new AssertionFailure(message(args, 2, detail, detail));
        }));

        Builtins.define(table, new NativeFunction("assert_true", 1, (ctx, args) -> {
            if (args.get(0).isTruthy()) {
                return TinyBool.TRUE;
            }
            String detail = "assert_true failed: " + ValueFormatter.format(args.get(0)) + " is not truthy";
            throw new AssertionFailure(message(args, 1, detail, detail));
        }));

        Builtins.define(table, new NativeFunction("assert_false", 1, (ctx, args) -> {
            if (!args.get(0).isTruthy()) {
                return TinyBool.TRUE;
            }
            String detail = "assert_false failed: " + ValueFormatter.format(args.get(0)) + " is truthy";
            throw new AssertionFailure(message(args, 1, detail, detail));
        }));
    }

    /**
     * 自定义消息（位于 index 的字符串参数）放在首行，detail 随后
     */
    private static String message(List<TinyValue> args, int index, String detail, String fallback) {
        if (args.size() > index && args.get(index).isString()) {
            String custom = args.get(index).asString();
            return detail == null ? custom : custom + "\n" + detail;
        }
        return fallback;
    }
}

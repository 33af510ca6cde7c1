package tinytalk.runtime.interpreter;

import tinytalk.runtime.ExecutionContext;
import tinytalk.runtime.TinyCallable;
import tinytalk.runtime.TinyValue;

import java.util.List;

/**
 * 原生（Java）函数
 */
public final class NativeFunction extends TinyCallable {

    /**
     * 原生函数接口
     */
    @FunctionalInterface
    public interface NativeFunc {
        TinyValue apply(ExecutionContext ctx, List<TinyValue> args);
    }

    @FunctionalInterface
    public interface NativeFunc0 {
        TinyValue apply();
    }

    @FunctionalInterface
    public interface NativeFunc1 {
        TinyValue apply(TinyValue arg);
    }

    @FunctionalInterface
    public interface NativeFunc2 {
        TinyValue apply(TinyValue arg1, TinyValue arg2);
    }

    @FunctionalInterface
    public interface NativeFunc3 {
        TinyValue apply(TinyValue arg1, TinyValue arg2, TinyValue arg3);
    }

    private final String name;
    private final int arity;
    private final NativeFunc function;

    /**
     * @param arity 最少参数数量，-1 表示不检查
     */
    public NativeFunction(String name, int arity, NativeFunc function) {
        this.name = name;
        this.arity = arity;
        this.function = function;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return arity;
    }

    @Override
    public TinyValue call(ExecutionContext ctx, List<TinyValue> args) {
        if (arity > 0 && args.size() < arity) {
            throw new LanguageError("'" + name + "' expects " + arity + " argument(s), but got "
                    + args.size() + ". Missing " + (arity - args.size()) + " argument(s).");
        }
        return function.apply(ctx, args);
    }

    @Override
    public String toString() {
        return "<function>";
    }

    // ============ 便捷工厂方法 ============

    public static NativeFunction create(String name, NativeFunc0 func) {
        return new NativeFunction(name, 0, (ctx, args) -> func.apply());
    }

    public static NativeFunction create(String name, NativeFunc1 func) {
        return new NativeFunction(name, 1, (ctx, args) -> func.apply(args.get(0)));
    }

    public static NativeFunction create(String name, NativeFunc2 func) {
        return new NativeFunction(name, 2, (ctx, args) -> func.apply(args.get(0), args.get(1)));
    }

    public static NativeFunction create(String name, NativeFunc3 func) {
        return new NativeFunction(name, 3, (ctx, args) ->
                func.apply(args.get(0), args.get(1), args.get(2)));
    }

    /**
     * 可变参数函数
     */
    public static NativeFunction varargs(String name, NativeFunc func) {
        return new NativeFunction(name, -1, func);
    }
}

package tinytalk.runtime.interpreter.stdlib;

import tinytalk.runtime.TinyFloat;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.NativeFunction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内建函数表
 *
 * <p>表只构建一次且不可变，所有解释器共享；每个解释器把它装进自己的封闭根作用域。</p>
 */
public final class Builtins {

    private static final Map<String, TinyValue> TABLE = build();

    private Builtins() {}

    /**
     * 名字到内建值（原生函数与数学常量）的不可变映射
     */
    public static Map<String, TinyValue> table() {
        return TABLE;
    }

    private static Map<String, TinyValue> build() {
        Map<String, TinyValue> table = new LinkedHashMap<String, TinyValue>();
        StdlibCore.register(table);
        StdlibCollections.register(table);
        StdlibText.register(table);
        StdlibMath.register(table);
        StdlibAssert.register(table);
        StdlibJson.register(table);
        StdlibRegex.register(table);
        StdlibHash.register(table);

        table.put("PI", TinyFloat.of(Math.PI));
        table.put("E", TinyFloat.of(Math.E));
        table.put("TAU", TinyFloat.of(2 * Math.PI));
        table.put("INF", TinyFloat.of(Double.POSITIVE_INFINITY));
        return Collections.unmodifiableMap(table);
    }

    static void define(Map<String, TinyValue> table, NativeFunction fn) {
        table.put(fn.getName(), fn);
    }

    /**
     * 同一实现以另一个名字注册
     */
    static void alias(Map<String, TinyValue> table, String alias, String target) {
        NativeFunction fn = (NativeFunction) table.get(target);
        table.put(alias, new NativeFunction(alias, fn.getArity(), fn::call));
    }
}

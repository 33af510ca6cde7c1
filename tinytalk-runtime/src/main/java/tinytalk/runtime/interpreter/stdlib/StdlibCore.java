package tinytalk.runtime.interpreter.stdlib;

import tinytalk.runtime.TinyBool;
import tinytalk.runtime.TinyFloat;
import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyMap;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyString;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueFormatter;
import tinytalk.runtime.interpreter.Conversions;
import tinytalk.runtime.interpreter.NativeFunction;

import java.util.List;
import java.util.Map;

/**
 * 输出与类型转换
 */
final class StdlibCore {

    private StdlibCore() {}

    static void register(Map<String, TinyValue> table) {
        // print(...) 以空格连接，不换行
        Builtins.define(table, NativeFunction.varargs("print", (ctx, args) -> {
            ctx.emit(joinFormatted(args));
            return TinyNull.NULL;
        }));

        Builtins.define(table, NativeFunction.varargs("show", (ctx, args) -> {
            ctx.emit(joinFormatted(args) + "\n");
            return TinyNull.NULL;
        }));
        Builtins.alias(table, "println", "show");

        Builtins.define(table, NativeFunction.varargs("len", (ctx, args) -> {
            if (args.isEmpty()) return TinyInt.ZERO;
            TinyValue v = args.get(0);
            if (v.isString()) return TinyInt.of(((TinyString) v).length());
            if (v.isList()) return TinyInt.of(((TinyList) v).size());
            if (v.isMap()) return TinyInt.of(((TinyMap) v).size());
            return TinyInt.ZERO;
        }));

        Builtins.define(table, NativeFunction.varargs("type", (ctx, args) ->
                TinyString.of(args.isEmpty() ? "null" : args.get(0).getTypeName())));
        Builtins.alias(table, "typeof", "type");

        Builtins.define(table, NativeFunction.varargs("str", (ctx, args) ->
                args.isEmpty() ? TinyString.EMPTY : TinyString.of(ValueFormatter.format(args.get(0)))));

        Builtins.define(table, NativeFunction.varargs("int", (ctx, args) ->
                args.isEmpty() ? TinyInt.ZERO : Conversions.toInt(args.get(0))));

        Builtins.define(table, NativeFunction.varargs("float", (ctx, args) ->
                args.isEmpty() ? TinyFloat.ZERO : Conversions.toFloat(args.get(0))));

        Builtins.define(table, NativeFunction.varargs("bool", (ctx, args) ->
                TinyBool.of(!args.isEmpty() && args.get(0).isTruthy())));

        // list(x)：列表原样返回，字符串拆成字符，映射取键；多个参数组成列表
        Builtins.define(table, NativeFunction.varargs("list", (ctx, args) -> {
            if (args.isEmpty()) return new TinyList();
            if (args.size() == 1) {
                TinyValue v = args.get(0);
                if (v.isList()) return v;
                if (v.isString()) return ((TinyString) v).chars();
                if (v.isMap()) return new TinyList(((TinyMap) v).keyStrings());
            }
            return new TinyList(args);
        }));

        // map(pairs)：由 [k, v] 对组成的列表构造映射
        Builtins.define(table, NativeFunction.varargs("map", (ctx, args) -> {
            TinyMap result = new TinyMap();
            if (args.size() == 1 && args.get(0).isList()) {
                for (TinyValue item : (TinyList) args.get(0)) {
                    if (item.isList() && ((TinyList) item).size() >= 2) {
                        TinyList pair = (TinyList) item;
                        result.put(pair.get(0), pair.get(1));
                    }
                }
            }
            return result;
        }));
    }

    static String joinFormatted(List<TinyValue> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(ValueFormatter.format(args.get(i)));
        }
        return sb.toString();
    }
}

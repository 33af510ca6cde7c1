package tinytalk.runtime.interpreter.stdlib;

import tinytalk.runtime.TinyFloat;
import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyList;
import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyValue;
import tinytalk.runtime.interpreter.BinaryOps;
import tinytalk.runtime.interpreter.Conversions;
import tinytalk.runtime.interpreter.LanguageError;
import tinytalk.runtime.interpreter.NativeFunction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * 数学函数
 */
final class StdlibMath {

    private StdlibMath() {}

    static void register(Map<String, TinyValue> table) {
        Builtins.define(table, NativeFunction.varargs("sum", (ctx, args) -> {
            if (args.isEmpty() || !args.get(0).isList()) return TinyInt.ZERO;
            long intTotal = 0;
            double floatTotal = 0.0;
            boolean anyFloat = false;
            for (TinyValue v : (TinyList) args.get(0)) {
                if (v.isInt()) {
                    intTotal = Math.addExact(intTotal, v.asLong());
                } else if (v.isFloat()) {
                    floatTotal += v.asDouble();
                    anyFloat = true;
                }
            }
            return anyFloat ? TinyFloat.of(intTotal + floatTotal) : TinyInt.of(intTotal);
        }));

        Builtins.define(table, NativeFunction.varargs("min", (ctx, args) -> extreme(args, -1)));
        Builtins.define(table, NativeFunction.varargs("max", (ctx, args) -> extreme(args, 1)));

        Builtins.define(table, NativeFunction.varargs("abs", (ctx, args) -> {
            if (args.isEmpty()) return TinyInt.ZERO;
            TinyValue v = args.get(0);
            if (v.isFloat()) return TinyFloat.of(Math.abs(v.asDouble()));
            return TinyInt.of(Math.absExact(Conversions.toInt(v).getValue()));
        }));

        // round(x[, places])：银行家舍入，places 为 0 时得到 int
        Builtins.define(table, NativeFunction.varargs("round", (ctx, args) -> {
            if (args.isEmpty()) return TinyInt.ZERO;
            TinyValue v = number(args.get(0), "round");
            int places = args.size() > 1 ? (int) Conversions.toInt(args.get(1)).getValue() : 0;
            if (v.isInt() && places >= 0) {
                return places == 0 ? v : TinyFloat.of(v.asDouble());
            }
            double d = v.asDouble();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                if (places == 0) {
                    throw new LanguageError("Cannot round " + TinyFloat.of(d) + " to an integer");
                }
                return TinyFloat.of(d);
            }
            BigDecimal rounded = new BigDecimal(d).setScale(places, RoundingMode.HALF_EVEN);
            if (places == 0) {
                return TinyInt.of(rounded.longValueExact());
            }
            return TinyFloat.of(rounded.doubleValue());
        }));

        Builtins.define(table, NativeFunction.varargs("floor", (ctx, args) ->
                args.isEmpty() ? TinyInt.ZERO : toInteger(Math.floor(number(args.get(0), "floor").asDouble()), args.get(0))));

        Builtins.define(table, NativeFunction.varargs("ceil", (ctx, args) ->
                args.isEmpty() ? TinyInt.ZERO : toInteger(Math.ceil(number(args.get(0), "ceil").asDouble()), args.get(0))));

        Builtins.define(table, NativeFunction.varargs("sqrt", (ctx, args) -> {
            if (args.isEmpty()) return TinyFloat.ZERO;
            double d = number(args.get(0), "sqrt").asDouble();
            if (d < 0) {
                throw new LanguageError("math domain error");
            }
            return TinyFloat.of(Math.sqrt(d));
        }));

        Builtins.define(table, NativeFunction.varargs("pow", (ctx, args) -> {
            if (args.size() < 2) return TinyFloat.ZERO;
            return TinyFloat.of(Math.pow(number(args.get(0), "pow").asDouble(), number(args.get(1), "pow").asDouble()));
        }));

        unary(table, "sin", 0.0, Math::sin);
        unary(table, "cos", 1.0, Math::cos);
        unary(table, "tan", 0.0, Math::tan);
        unary(table, "exp", 1.0, Math::exp);

        // log(x[, base])
        Builtins.define(table, NativeFunction.varargs("log", (ctx, args) -> {
            if (args.isEmpty()) return TinyFloat.ZERO;
            double x = number(args.get(0), "log").asDouble();
            if (x <= 0) {
                throw new LanguageError("math domain error");
            }
            if (args.size() < 2) {
                return TinyFloat.of(Math.log(x));
            }
            double base = number(args.get(1), "log").asDouble();
            if (base <= 0 || base == 1.0) {
                throw new LanguageError("math domain error");
            }
            return TinyFloat.of(Math.log(x) / Math.log(base));
        }));
    }

    private static void unary(Map<String, TinyValue> table, String name, double empty, DoubleUnaryOperator op) {
        Builtins.define(table, NativeFunction.varargs(name, (ctx, args) ->
                TinyFloat.of(args.isEmpty() ? empty : op.applyAsDouble(number(args.get(0), name).asDouble()))));
    }

    /**
     * 数学函数的数值参数，布尔按 0/1
     */
    private static TinyValue number(TinyValue v, String fn) {
        if (v.isInt() || v.isFloat() || v.isBool()) {
            return v.isBool() ? TinyInt.of(v.asLong()) : v;
        }
        throw new LanguageError("'" + fn + "' expects a number, got " + v.getTypeName());
    }

    private static TinyValue toInteger(double d, TinyValue original) {
        if (original.isInt()) {
            return original;
        }
        if (Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d) >= 9.223372036854776E18) {
            throw new LanguageError("Cannot convert " + TinyFloat.of(d) + " to integer");
        }
        return TinyInt.of((long) d);
    }

    /**
     * min / max：单个列表参数取其元素，否则比较所有参数；sign 为 -1 取最小
     */
    private static TinyValue extreme(List<TinyValue> args, int sign) {
        if (args.isEmpty()) return TinyNull.NULL;
        List<TinyValue> values = args.get(0).isList() ? ((TinyList) args.get(0)).getElements() : args;
        TinyValue best = null;
        for (TinyValue v : values) {
            if (best == null || Integer.signum(BinaryOps.compare(v, best)) == sign) {
                best = v;
            }
        }
        return best == null ? TinyNull.NULL : best;
    }
}

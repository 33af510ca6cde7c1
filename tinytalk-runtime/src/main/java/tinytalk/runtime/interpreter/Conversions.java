package tinytalk.runtime.interpreter;

import tinytalk.runtime.TinyFloat;
import tinytalk.runtime.TinyInt;
import tinytalk.runtime.TinyValue;

/**
 * 宽松的类型转换，供 {@code .int} / {@code int()} 等使用：无法转换时得到 0 而不是报错
 */
public final class Conversions {

    private Conversions() {}

    /**
     * 解析十进制数字字符串，接受首尾空白、下划线分组、inf、nan；失败返回 null
     */
    public static Double parseNumber(String text) {
        String s = text.trim().replace("_", "");
        if (s.isEmpty()) {
            return null;
        }
        String lower = s.toLowerCase();
        String unsigned = lower.startsWith("+") || lower.startsWith("-") ? lower.substring(1) : lower;
        boolean negative = lower.startsWith("-");
        if (unsigned.equals("inf") || unsigned.equals("infinity")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (unsigned.equals("nan")) {
            return Double.NaN;
        }
        for (int i = 0; i < unsigned.length(); i++) {
            char c = unsigned.charAt(i);
            if (!(Character.isDigit(c) || c == '.' || c == 'e' || c == '+' || c == '-')) {
                return null;
            }
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static long truncate(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d) >= 9.223372036854776E18) {
            return 0;
        }
        return (long) d;
    }

    /**
     * 转为整数：字符串按数字解析后截断，布尔为 1/0，其它为 0
     */
    public static TinyInt toInt(TinyValue value) {
        if (value.isInt()) {
            return (TinyInt) value;
        }
        if (value.isFloat()) {
            return TinyInt.of(truncate(value.asDouble()));
        }
        if (value.isBool()) {
            return TinyInt.of(value.asLong());
        }
        if (value.isString()) {
            String s = value.asString().trim().replace("_", "");
            try {
                return TinyInt.of(Long.parseLong(s));
            } catch (NumberFormatException e) {
                Double parsed = parseNumber(s);
                return TinyInt.of(parsed == null ? 0 : truncate(parsed));
            }
        }
        return TinyInt.ZERO;
    }

    /**
     * 转为浮点数：无法转换时为 0.0
     */
    public static TinyFloat toFloat(TinyValue value) {
        if (value.isInt() || value.isFloat() || value.isBool()) {
            return TinyFloat.of(value.asDouble());
        }
        if (value.isString()) {
            Double parsed = parseNumber(value.asString());
            return TinyFloat.of(parsed == null ? 0.0 : parsed);
        }
        return TinyFloat.ZERO;
    }

    /**
     * 转为数字：含小数点的字符串得到 float，否则 int
     */
    public static TinyValue toNumber(TinyValue value) {
        if (value.isInt() || value.isFloat()) {
            return value;
        }
        if (value.isString()) {
            String s = value.asString();
            if (s.contains(".")) {
                Double parsed = parseNumber(s);
                return parsed == null ? TinyInt.ZERO : TinyFloat.of(parsed);
            }
            try {
                return TinyInt.of(Long.parseLong(s.trim().replace("_", "")));
            } catch (NumberFormatException e) {
                return TinyInt.ZERO;
            }
        }
        return TinyInt.ZERO;
    }
}

package tinytalk.runtime;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * 值的显示形式（show、str、插值、字符串拼接共用）
 *
 * <ul>
 *   <li>字符串原样输出，null 为 {@code null}，布尔为 {@code true/false}</li>
 *   <li>浮点取最短往返形式：{@code 5.0}、{@code 3.3333333333333335}、{@code 1e-05}、{@code inf}、{@code nan}</li>
 *   <li>列表 {@code [1, 2]}，映射 {@code {k: v}}，结构体实例 {@code Name{f: v}}</li>
 *   <li>自引用的列表/映射显示为 {@code [circular]} / {@code {circular}}</li>
 * </ul>
 */
public final class ValueFormatter {

    private ValueFormatter() {}

    public static String format(TinyValue value) {
        StringBuilder sb = new StringBuilder();
        Set<Object> ancestors = Collections.newSetFromMap(new IdentityHashMap<Object, Boolean>());
        append(sb, value, ancestors);
        return sb.toString();
    }

    private static void append(StringBuilder sb, TinyValue value, Set<Object> ancestors) {
        switch (value.getType()) {
            case STRING:
                sb.append(((TinyString) value).getValue());
                return;
            case NULL:
                sb.append("null");
                return;
            case BOOLEAN:
                sb.append(((TinyBool) value).getValue() ? "true" : "false");
                return;
            case INT:
                sb.append(((TinyInt) value).getValue());
                return;
            case FLOAT:
                sb.append(formatFloat(((TinyFloat) value).getValue()));
                return;
            case LIST:
                appendList(sb, (TinyList) value, ancestors);
                return;
            case MAP:
                appendMap(sb, (TinyMap) value, ancestors);
                return;
            case STRUCT_INSTANCE:
                appendInstance(sb, (TinyInstance) value, ancestors);
                return;
            case ENUM_VARIANT:
                EnumVariant variant = (EnumVariant) value;
                sb.append(variant.getEnumName()).append('.').append(variant.getVariantName());
                return;
            case FUNCTION:
            default:
                sb.append("<function>");
        }
    }

    private static void appendList(StringBuilder sb, TinyList list, Set<Object> ancestors) {
        if (!ancestors.add(list)) {
            sb.append("[circular]");
            return;
        }
        sb.append('[');
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) sb.append(", ");
            append(sb, list.get(i), ancestors);
        }
        sb.append(']');
        ancestors.remove(list);
    }

    private static void appendMap(StringBuilder sb, TinyMap map, Set<Object> ancestors) {
        if (!ancestors.add(map)) {
            sb.append("{circular}");
            return;
        }
        sb.append('{');
        Iterator<Map.Entry<Object, TinyValue>> it = map.getEntries().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Object, TinyValue> e = it.next();
            sb.append(formatKey(e.getKey())).append(": ");
            append(sb, e.getValue(), ancestors);
            if (it.hasNext()) sb.append(", ");
        }
        sb.append('}');
        ancestors.remove(map);
    }

    private static void appendInstance(StringBuilder sb, TinyInstance instance, Set<Object> ancestors) {
        if (!ancestors.add(instance)) {
            sb.append(instance.getStructName()).append("{circular}");
            return;
        }
        sb.append(instance.getStructName()).append('{');
        Iterator<Map.Entry<String, TinyValue>> it = instance.getFields().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, TinyValue> e = it.next();
            sb.append(e.getKey()).append(": ");
            append(sb, e.getValue(), ancestors);
            if (it.hasNext()) sb.append(", ");
        }
        sb.append('}');
        ancestors.remove(instance);
    }

    /**
     * 映射原生键的显示形式
     */
    public static String formatKey(Object key) {
        if (key == null) return "null";
        if (key instanceof String) return (String) key;
        if (key instanceof Boolean) return (Boolean) key ? "true" : "false";
        if (key instanceof Double) return formatFloat((Double) key);
        return String.valueOf(key);
    }

    /**
     * 浮点数的最短往返形式，指数小于 -4 或不小于 16 时使用科学计数法
     */
    public static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return 1.0 / d < 0 ? "-0.0" : "0.0";

        String sign = d < 0 ? "-" : "";
        BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
        String digits = decimal.unscaledValue().toString();
        int exponent = digits.length() - 1 - decimal.scale();

        if (exponent < -4 || exponent >= 16) {
            StringBuilder sb = new StringBuilder(sign).append(digits.charAt(0));
            if (digits.length() > 1) {
                sb.append('.').append(digits, 1, digits.length());
            }
            int abs = Math.abs(exponent);
            sb.append('e').append(exponent < 0 ? '-' : '+');
            if (abs < 10) sb.append('0');
            return sb.append(abs).toString();
        }
        String plain = decimal.toPlainString();
        return sign + (plain.indexOf('.') < 0 ? plain + ".0" : plain);
    }
}

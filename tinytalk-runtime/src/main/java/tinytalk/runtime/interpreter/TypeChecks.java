package tinytalk.runtime.interpreter;

import tinytalk.runtime.TinyValue;
import tinytalk.runtime.ValueType;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 运行时类型标注检查
 *
 * <p>只检查基础类型：{@code list[int]} 仅要求值为列表，未知类型名（如结构体名）一律通过，
 * int 满足 float，{@code ?T} 额外允许 null。</p>
 */
final class TypeChecks {

    /** 标注名到允许的值种类，值为 null 表示任意 */
    private static final Map<String, Set<ValueType>> TYPES = new HashMap<String, Set<ValueType>>();

    static {
        TYPES.put("int", EnumSet.of(ValueType.INT));
        TYPES.put("float", EnumSet.of(ValueType.FLOAT, ValueType.INT));
        TYPES.put("str", EnumSet.of(ValueType.STRING));
        TYPES.put("string", EnumSet.of(ValueType.STRING));
        TYPES.put("bool", EnumSet.of(ValueType.BOOLEAN));
        TYPES.put("boolean", EnumSet.of(ValueType.BOOLEAN));
        TYPES.put("list", EnumSet.of(ValueType.LIST));
        TYPES.put("map", EnumSet.of(ValueType.MAP));
        TYPES.put("void", EnumSet.of(ValueType.NULL));
        TYPES.put("null", EnumSet.of(ValueType.NULL));
        TYPES.put("num", EnumSet.of(ValueType.INT, ValueType.FLOAT));
        TYPES.put("number", EnumSet.of(ValueType.INT, ValueType.FLOAT));
        TYPES.put("fn", EnumSet.of(ValueType.FUNCTION));
        TYPES.put("any", null);
    }

    private TypeChecks() {}

    static boolean matches(TinyValue value, String annotation) {
        String hint = annotation.trim();
        boolean optional = false;
        if (hint.startsWith("?")) {
            optional = true;
            hint = hint.substring(1);
        }
        if (hint.endsWith("?")) {
            optional = true;
            hint = hint.substring(0, hint.length() - 1);
        }
        if (optional && value.isNull()) {
            return true;
        }
        int bracket = hint.indexOf('[');
        if (bracket >= 0) {
            hint = hint.substring(0, bracket);
        }
        String key = hint.toLowerCase();
        if (!TYPES.containsKey(key)) {
            return true;
        }
        Set<ValueType> allowed = TYPES.get(key);
        return allowed == null || allowed.contains(value.getType());
    }

    /**
     * 检查失败时抛出 {@code Type mismatch for <context>: expected T, got U}
     */
    static void check(TinyValue value, String annotation, String context) {
        if (annotation != null && !matches(value, annotation)) {
            throw new LanguageError("Type mismatch for " + context + ": expected "
                    + annotation + ", got " + value.getTypeName());
        }
    }
}

package tinytalk.runtime;

import java.util.List;
import java.util.Map;

/**
 * TinyTalk 运行时值的基类
 *
 * <p>值的种类是封闭集合，见 {@link ValueType}。列表和映射持有共享的可变存储，
 * 其余值不可变。</p>
 */
public abstract class TinyValue {

    /**
     * 将 Java 值转换为 TinyValue
     */
    public static TinyValue fromJava(Object javaValue) {
        if (javaValue == null) {
            return TinyNull.NULL;
        }
        if (javaValue instanceof TinyValue) {
            return (TinyValue) javaValue;
        }
        if (javaValue instanceof Integer || javaValue instanceof Long
                || javaValue instanceof Short || javaValue instanceof Byte) {
            return TinyInt.of(((Number) javaValue).longValue());
        }
        if (javaValue instanceof Double || javaValue instanceof Float) {
            return TinyFloat.of(((Number) javaValue).doubleValue());
        }
        if (javaValue instanceof Boolean) {
            return TinyBool.of((Boolean) javaValue);
        }
        if (javaValue instanceof String) {
            return TinyString.of((String) javaValue);
        }
        if (javaValue instanceof Character) {
            return TinyString.of(String.valueOf(javaValue));
        }
        if (javaValue instanceof List) {
            TinyList list = new TinyList();
            for (Object item : (List<?>) javaValue) {
                list.add(fromJava(item));
            }
            return list;
        }
        if (javaValue instanceof Map) {
            TinyMap map = new TinyMap();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) javaValue).entrySet()) {
                map.put(fromJava(entry.getKey()).toKey(), fromJava(entry.getValue()));
            }
            return map;
        }
        throw new TinyTalkException("Cannot convert Java object to TinyValue: " + javaValue.getClass().getName());
    }

    /**
     * 值的种类
     */
    public abstract ValueType getType();

    /**
     * 类型名，与 {@code type(x)} 的结果一致
     */
    public String getTypeName() {
        return getType().getName();
    }

    /**
     * 转换为 Java 原生值（列表、映射递归转换）
     */
    public abstract Object toJavaValue();

    /**
     * 作为映射键使用时的原生值，只有标量可以作键
     */
    public Object toKey() {
        throw new TinyTalkException("Unhashable type: " + getTypeName());
    }

    /**
     * null、false、0、0.0、空字符串/列表/映射为假
     */
    public boolean isTruthy() {
        return true;
    }

    // ============ 类型判断 ============

    public boolean isNull() {
        return false;
    }

    public boolean isInt() {
        return false;
    }

    public boolean isFloat() {
        return false;
    }

    public boolean isNumber() {
        return isInt() || isFloat();
    }

    public boolean isString() {
        return false;
    }

    public boolean isBool() {
        return false;
    }

    public boolean isList() {
        return false;
    }

    public boolean isMap() {
        return false;
    }

    public boolean isCallable() {
        return false;
    }

    // ============ 取值 ============

    public long asLong() {
        throw new TinyTalkException("Expected int, got " + getTypeName());
    }

    public double asDouble() {
        throw new TinyTalkException("Expected float, got " + getTypeName());
    }

    /**
     * 显示形式，与 {@code show} / {@code str} 一致
     */
    public String asString() {
        return ValueFormatter.format(this);
    }

    @Override
    public String toString() {
        return ValueFormatter.format(this);
    }
}

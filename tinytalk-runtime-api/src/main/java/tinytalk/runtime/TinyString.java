package tinytalk.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * 字符串值
 */
public final class TinyString extends TinyValue {

    public static final TinyString EMPTY = new TinyString("");

    public static TinyString of(String value) {
        return value.isEmpty() ? EMPTY : new TinyString(value);
    }

    private final String value;

    private TinyString(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    /**
     * 按字符拆分为列表
     */
    public TinyList chars() {
        List<TinyValue> chars = new ArrayList<TinyValue>(value.length());
        for (int i = 0; i < value.length(); i++) {
            chars.add(of(String.valueOf(value.charAt(i))));
        }
        return new TinyList(chars);
    }

    @Override
    public ValueType getType() {
        return ValueType.STRING;
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public Object toKey() {
        return value;
    }

    @Override
    public boolean isTruthy() {
        return !value.isEmpty();
    }

    @Override
    public boolean isString() {
        return true;
    }

    @Override
    public String asString() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TinyString && ((TinyString) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}

package tinytalk.runtime;

/**
 * 布尔值
 */
public final class TinyBool extends TinyValue {

    public static final TinyBool TRUE = new TinyBool(true);

    public static final TinyBool FALSE = new TinyBool(false);

    public static TinyBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    private final boolean value;

    private TinyBool(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.BOOLEAN;
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
        return value;
    }

    @Override
    public boolean isBool() {
        return true;
    }

    /** 参与算术时视为 0 / 1 */
    @Override
    public long asLong() {
        return value ? 1 : 0;
    }

    @Override
    public double asDouble() {
        return value ? 1.0 : 0.0;
    }
}

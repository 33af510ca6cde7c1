package tinytalk.runtime;

/**
 * null 值
 */
public final class TinyNull extends TinyValue {

    /** 唯一的 null 实例 */
    public static final TinyNull NULL = new TinyNull();

    private TinyNull() {
    }

    @Override
    public ValueType getType() {
        return ValueType.NULL;
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public Object toKey() {
        return null;
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public boolean isNull() {
        return true;
    }
}

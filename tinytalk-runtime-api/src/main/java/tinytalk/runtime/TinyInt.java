package tinytalk.runtime;

/**
 * 整数值（64 位）
 */
public final class TinyInt extends TinyValue {

    // 小整数缓存
    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final TinyInt[] CACHE = new TinyInt[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new TinyInt(CACHE_LOW + i);
        }
    }

    public static final TinyInt ZERO = of(0);
    public static final TinyInt ONE = of(1);

    /** 获取 TinyInt 实例，优先从缓存取 */
    public static TinyInt of(long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new TinyInt(value);
    }

    private final long value;

    private TinyInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.INT;
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
        return value != 0;
    }

    @Override
    public boolean isInt() {
        return true;
    }

    @Override
    public long asLong() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TinyInt && ((TinyInt) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}

package tinytalk.runtime;

/**
 * 浮点值（双精度）
 */
public final class TinyFloat extends TinyValue {

    public static final TinyFloat ZERO = new TinyFloat(0.0);

    public static TinyFloat of(double value) {
        return value == 0.0 && Double.doubleToRawLongBits(value) == 0L ? ZERO : new TinyFloat(value);
    }

    private final double value;

    private TinyFloat(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public ValueType getType() {
        return ValueType.FLOAT;
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
        return value != 0.0;
    }

    @Override
    public boolean isFloat() {
        return true;
    }

    @Override
    public long asLong() {
        return (long) value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TinyFloat && Double.compare(((TinyFloat) o).value, value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}

package tinytalk.runtime;

import java.util.Objects;

/**
 * 枚举变体值，显示为 {@code Enum.Variant}
 */
public final class EnumVariant extends TinyValue {

    private final String enumName;
    private final String variantName;
    private final TinyValue data;

    public EnumVariant(String enumName, String variantName, TinyValue data) {
        this.enumName = enumName;
        this.variantName = variantName;
        this.data = data != null ? data : TinyNull.NULL;
    }

    public String getEnumName() {
        return enumName;
    }

    public String getVariantName() {
        return variantName;
    }

    /** 变体负载，未指定时为 null */
    public TinyValue getData() {
        return data;
    }

    @Override
    public ValueType getType() {
        return ValueType.ENUM_VARIANT;
    }

    @Override
    public Object toJavaValue() {
        return enumName + "." + variantName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnumVariant)) return false;
        EnumVariant other = (EnumVariant) o;
        return enumName.equals(other.enumName) && variantName.equals(other.variantName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enumName, variantName);
    }
}

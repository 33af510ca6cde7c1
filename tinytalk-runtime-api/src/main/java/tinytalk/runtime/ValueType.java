package tinytalk.runtime;

/**
 * 运行时值的种类
 *
 * <p>名称即 {@code type(x)} 返回的字符串。</p>
 */
public enum ValueType {
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BOOLEAN("boolean"),
    NULL("null"),
    LIST("list"),
    MAP("map"),
    FUNCTION("function"),
    STRUCT_INSTANCE("struct_instance"),
    ENUM_VARIANT("enum_variant");

    private final String name;

    ValueType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}

package tinytalk.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 结构体实例的基类，字段按声明顺序保存
 */
public abstract class TinyInstance extends TinyValue {

    protected final LinkedHashMap<String, TinyValue> fields = new LinkedHashMap<String, TinyValue>();

    public abstract String getStructName();

    public Map<String, TinyValue> getFields() {
        return fields;
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public TinyValue getField(String name) {
        return fields.get(name);
    }

    public void setField(String name, TinyValue value) {
        fields.put(name, value);
    }

    @Override
    public ValueType getType() {
        return ValueType.STRUCT_INSTANCE;
    }

    @Override
    public Object toJavaValue() {
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        for (Map.Entry<String, TinyValue> e : fields.entrySet()) {
            result.put(e.getKey(), e.getValue().toJavaValue());
        }
        return result;
    }
}

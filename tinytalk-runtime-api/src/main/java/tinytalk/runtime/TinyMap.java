package tinytalk.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 映射值（可变，按引用共享，保持插入顺序）
 *
 * <p>键是原生标量：{@code String}、{@code Long}、{@code Double}、{@code Boolean} 或 {@code null}。</p>
 */
public final class TinyMap extends TinyValue {

    private final LinkedHashMap<Object, TinyValue> entries;

    public TinyMap() {
        this.entries = new LinkedHashMap<Object, TinyValue>();
    }

    public TinyMap(Map<Object, TinyValue> entries) {
        this.entries = new LinkedHashMap<Object, TinyValue>(entries);
    }

    /** 底层存储，修改直接可见 */
    public Map<Object, TinyValue> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 按原生键取值，缺失返回 null 值
     */
    public TinyValue get(Object key) {
        TinyValue value = entries.get(key);
        return value != null ? value : TinyNull.NULL;
    }

    /**
     * 按值键取值，键必须可哈希
     */
    public TinyValue get(TinyValue key) {
        return get(key.toKey());
    }

    public boolean containsKey(Object key) {
        return entries.containsKey(key);
    }

    public void put(Object key, TinyValue value) {
        entries.put(key, value);
    }

    public void put(TinyValue key, TinyValue value) {
        entries.put(key.toKey(), value);
    }

    /**
     * 键的显示形式列表
     */
    public List<TinyValue> keyStrings() {
        List<TinyValue> keys = new ArrayList<TinyValue>(entries.size());
        for (Object key : entries.keySet()) {
            keys.add(TinyString.of(ValueFormatter.formatKey(key)));
        }
        return keys;
    }

    public List<TinyValue> values() {
        return new ArrayList<TinyValue>(entries.values());
    }

    @Override
    public ValueType getType() {
        return ValueType.MAP;
    }

    @Override
    public Object toJavaValue() {
        Map<Object, Object> result = new LinkedHashMap<Object, Object>();
        for (Map.Entry<Object, TinyValue> e : entries.entrySet()) {
            result.put(e.getKey(), e.getValue().toJavaValue());
        }
        return result;
    }

    @Override
    public boolean isTruthy() {
        return !entries.isEmpty();
    }

    @Override
    public boolean isMap() {
        return true;
    }
}

package tinytalk.runtime;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 列表值（可变，按引用共享）
 *
 * <p>{@code let b = a} 之后 a 与 b 指向同一存储，通过任一名字修改都对另一个可见。</p>
 */
public final class TinyList extends TinyValue implements Iterable<TinyValue> {

    private final List<TinyValue> elements;

    public TinyList() {
        this.elements = new ArrayList<TinyValue>();
    }

    public TinyList(List<TinyValue> values) {
        this.elements = new ArrayList<TinyValue>(values);
    }

    /** 底层存储，修改直接可见 */
    public List<TinyValue> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public TinyValue get(int index) {
        return elements.get(index);
    }

    public void set(int index, TinyValue value) {
        elements.set(index, value);
    }

    public void add(TinyValue value) {
        elements.add(value);
    }

    /**
     * 拼接为新列表，两个操作数不变
     */
    public TinyList concat(TinyList other) {
        TinyList result = new TinyList(elements);
        result.elements.addAll(other.elements);
        return result;
    }

    /**
     * 支持负下标，越界返回 -1
     */
    public int normalizeIndex(long index) {
        long i = index < 0 ? index + elements.size() : index;
        return i < 0 || i >= elements.size() ? -1 : (int) i;
    }

    @Override
    public Iterator<TinyValue> iterator() {
        return elements.iterator();
    }

    @Override
    public ValueType getType() {
        return ValueType.LIST;
    }

    @Override
    public Object toJavaValue() {
        List<Object> result = new ArrayList<Object>();
        for (TinyValue v : elements) {
            result.add(v.toJavaValue());
        }
        return result;
    }

    @Override
    public boolean isTruthy() {
        return !elements.isEmpty();
    }

    @Override
    public boolean isList() {
        return true;
    }
}

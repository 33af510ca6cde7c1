package tinytalk.runtime;

import java.util.List;

/**
 * 可调用值的基类
 *
 * <p>实现类：</p>
 * <ul>
 *   <li>NativeFunction - 原生 Java 函数</li>
 *   <li>TinyFunction - 用户函数与 lambda</li>
 *   <li>BoundMethod - 绑定到结构体实例的方法</li>
 * </ul>
 */
public abstract class TinyCallable extends TinyValue {

    /**
     * 函数名称，lambda 为 {@code <lambda>}
     */
    public abstract String getName();

    /**
     * 参数数量，-1 表示可变参数
     */
    public abstract int getArity();

    /**
     * 调用函数
     *
     * @param ctx  执行上下文
     * @param args 已求值的实参
     */
    public abstract TinyValue call(ExecutionContext ctx, List<TinyValue> args);

    @Override
    public ValueType getType() {
        return ValueType.FUNCTION;
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public boolean isCallable() {
        return true;
    }
}

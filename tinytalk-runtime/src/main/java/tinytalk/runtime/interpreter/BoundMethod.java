package tinytalk.runtime.interpreter;

import tinytalk.runtime.ExecutionContext;
import tinytalk.runtime.TinyCallable;
import tinytalk.runtime.TinyValue;

import java.util.List;

/**
 * 绑定到结构体实例的方法，调用时 {@code self} 指向该实例
 */
public final class BoundMethod extends TinyCallable {

    private final StructInstance receiver;
    private final TinyFunction method;

    public BoundMethod(StructInstance receiver, TinyFunction method) {
        this.receiver = receiver;
        this.method = method;
    }

    public StructInstance getReceiver() {
        return receiver;
    }

    public TinyFunction getMethod() {
        return method;
    }

    @Override
    public String getName() {
        return method.getName();
    }

    @Override
    public int getArity() {
        return method.getArity();
    }

    @Override
    public TinyValue call(ExecutionContext ctx, List<TinyValue> args) {
        return ctx.invoke(this, args);
    }

    @Override
    public String toString() {
        return "<function>";
    }
}

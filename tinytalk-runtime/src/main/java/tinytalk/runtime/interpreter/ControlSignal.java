package tinytalk.runtime.interpreter;

import tinytalk.runtime.TinyNull;
import tinytalk.runtime.TinyValue;

/**
 * 语句执行结果：正常完成（携带语句值）、return、break、continue
 *
 * <p>控制流以返回值传递，不使用异常。</p>
 */
public final class ControlSignal {

    public enum Kind {
        NORMAL,
        RETURN,
        BREAK,
        CONTINUE
    }

    static final ControlSignal NORMAL_NULL = new ControlSignal(Kind.NORMAL, TinyNull.NULL);
    static final ControlSignal BREAK = new ControlSignal(Kind.BREAK, TinyNull.NULL);
    static final ControlSignal CONTINUE = new ControlSignal(Kind.CONTINUE, TinyNull.NULL);

    private final Kind kind;
    private final TinyValue value;

    private ControlSignal(Kind kind, TinyValue value) {
        this.kind = kind;
        this.value = value;
    }

    public static ControlSignal normal(TinyValue value) {
        return value == TinyNull.NULL ? NORMAL_NULL : new ControlSignal(Kind.NORMAL, value);
    }

    public static ControlSignal returnValue(TinyValue value) {
        return new ControlSignal(Kind.RETURN, value);
    }

    public Kind getKind() {
        return kind;
    }

    public TinyValue getValue() {
        return value;
    }

    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }

    /** break 或 continue */
    public boolean isLoopSignal() {
        return kind == Kind.BREAK || kind == Kind.CONTINUE;
    }

    @Override
    public String toString() {
        return kind == Kind.NORMAL || kind == Kind.RETURN ? kind + "(" + value + ")" : kind.name();
    }
}

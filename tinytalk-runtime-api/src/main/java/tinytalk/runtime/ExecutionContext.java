package tinytalk.runtime;

import java.util.List;

/**
 * 原生函数回调解释器的入口
 */
public interface ExecutionContext {

    /**
     * 调用任意可调用值（用户函数、lambda、原生函数、绑定方法）
     */
    TinyValue invoke(TinyValue callee, List<TinyValue> args);

    /**
     * 写出程序输出（不自动换行）
     */
    void emit(String text);
}

package tinytalk.runtime.interpreter;

/**
 * 超出执行限制（操作数、迭代数、递归深度、超时）
 *
 * <p>用户代码的 try/catch 不会捕获此错误。</p>
 */
public class BoundsExceededError extends LanguageError {

    public BoundsExceededError(String message, int line) {
        super(message, line);
    }

    @Override
    public LanguageError withLine(int line) {
        return new BoundsExceededError(getRawMessage(), line);
    }
}

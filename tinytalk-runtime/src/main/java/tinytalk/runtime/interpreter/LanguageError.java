package tinytalk.runtime.interpreter;

import tinytalk.runtime.TinyTalkException;

/**
 * TinyTalk 语言层错误，可被用户代码的 try/catch 捕获
 *
 * <p>{@link #getMessage()} 在行号已知时为 {@code Line N: message}，
 * {@link #getRawMessage()} 返回不含位置的消息（即 catch 绑定的内容）。</p>
 */
public class LanguageError extends TinyTalkException {

    private final int line;

    public LanguageError(String message) {
        this(message, 0);
    }

    public LanguageError(String message, int line) {
        super(message);
        this.line = line;
    }

    public LanguageError(String message, int line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    public int getLine() {
        return line;
    }

    public boolean hasLine() {
        return line > 0;
    }

    /**
     * 补充行号，返回同类型的新异常
     */
    public LanguageError withLine(int line) {
        return new LanguageError(getRawMessage(), line, getCause());
    }

    @Override
    public String getMessage() {
        return line > 0 ? "Line " + line + ": " + getRawMessage() : getRawMessage();
    }
}

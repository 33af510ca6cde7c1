package tinytalk.runtime;

/**
 * TinyTalk 基础运行时异常（无源位置信息）。
 *
 * <p>{@code tinytalk-runtime} 中的 {@code LanguageError} 继承此类并携带行号。</p>
 */
public class TinyTalkException extends RuntimeException {

    public TinyTalkException(String message) {
        super(message);
    }

    public TinyTalkException(String message, Throwable cause) {
        super(message, cause);
    }

    /** 返回不含位置前缀的错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }
}

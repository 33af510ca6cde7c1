package tinytalk.runtime;

/**
 * 一次运行的结果：成功时带最后一条语句的值，失败时带错误消息与行号
 */
public final class RunResult {

    private final boolean success;
    private final TinyValue value;
    private final String output;
    private final String error;
    private final int errorLine;
    private final long opCount;

    RunResult(boolean success, TinyValue value, String output, String error, int errorLine, long opCount) {
        this.success = success;
        this.value = value;
        this.output = output;
        this.error = error;
        this.errorLine = errorLine;
        this.opCount = opCount;
    }

    public boolean isSuccess() {
        return success;
    }

    /** 最后一条语句的值，失败时为 null 值 */
    public TinyValue getValue() {
        return value;
    }

    /** 程序输出（show / print） */
    public String getOutput() {
        return output;
    }

    /** 错误消息，成功时为 null */
    public String getError() {
        return error;
    }

    /** 出错行号，未知为 0 */
    public int getErrorLine() {
        return errorLine;
    }

    public long getOpCount() {
        return opCount;
    }

    @Override
    public String toString() {
        return success
                ? "RunResult{success, value=" + value + ", ops=" + opCount + "}"
                : "RunResult{error='" + error + "', line=" + errorLine + "}";
    }
}

package tinytalk.runtime.interpreter;

import tinytalk.runtime.ValueFormatter;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 执行计量：操作数、循环迭代数、递归深度与软超时
 */
final class ExecutionMeter {

    private static final Logger LOG = Logger.getLogger(ExecutionMeter.class.getName());

    private final ExecutionBounds bounds;
    private final long timeoutNanos;

    private long opCount;
    private long iterationCount;
    private int recursionDepth;
    private long startNanos;

    ExecutionMeter(ExecutionBounds bounds) {
        this.bounds = bounds;
        this.timeoutNanos = bounds.hasTimeout() ? (long) (bounds.getTimeoutSeconds() * 1_000_000_000L) : Long.MAX_VALUE;
    }

    void reset() {
        opCount = 0;
        iterationCount = 0;
        recursionDepth = 0;
        startNanos = System.nanoTime();
    }

    /**
     * 每次求值分派调用一次
     */
    void tick(int line) {
        if (++opCount > bounds.getMaxOps()) {
            throw exceeded("Exceeded max operations (" + bounds.getMaxOps() + ")", line);
        }
        if (timeoutNanos != Long.MAX_VALUE && System.nanoTime() - startNanos > timeoutNanos) {
            throw exceeded("Exceeded timeout (" + ValueFormatter.formatFloat(bounds.getTimeoutSeconds()) + "s)", line);
        }
    }

    /**
     * 每次循环迭代调用一次
     */
    void iteration(int line) {
        if (++iterationCount > bounds.getMaxIterations()) {
            throw exceeded("Exceeded max iterations (" + bounds.getMaxIterations() + ")", line);
        }
    }

    void enterCall(int line) {
        if (++recursionDepth > bounds.getMaxRecursion()) {
            recursionDepth--;
            throw recursionExceeded(line);
        }
    }

    void exitCall() {
        recursionDepth--;
    }

    BoundsExceededError recursionExceeded(int line) {
        return exceeded("Exceeded max recursion (" + bounds.getMaxRecursion() + ")", line);
    }

    /**
     * 一次性分配的元素数量（如区间）也计入迭代上限
     */
    void checkAllocation(long count, int line) {
        if (count > bounds.getMaxIterations()) {
            throw exceeded("Exceeded max iterations (" + bounds.getMaxIterations() + ")", line);
        }
    }

    long getOpCount() {
        return opCount;
    }

    long getIterationCount() {
        return iterationCount;
    }

    int getRecursionDepth() {
        return recursionDepth;
    }

    private BoundsExceededError exceeded(String message, int line) {
        LOG.log(Level.FINE, "Bounds exceeded at line {0}: {1}", new Object[]{line, message});
        return new BoundsExceededError(message, line);
    }
}

package tinytalk.runtime.interpreter;

/**
 * 执行限制配置
 *
 * <p>使用示例：</p>
 * <pre>
 * // 预定义档位
 * Interpreter interp = new Interpreter(ExecutionBounds.api());
 *
 * // 自定义
 * ExecutionBounds bounds = ExecutionBounds.builder()
 *     .maxOps(10_000)
 *     .timeoutSeconds(2)
 *     .build();
 * </pre>
 */
public final class ExecutionBounds {

    /** 档位 */
    public enum Profile { DEFAULT, API, CUSTOM }

    private final Profile profile;
    private final long maxOps;
    private final long maxIterations;
    private final int maxRecursion;
    private final double timeoutSeconds;

    private ExecutionBounds(Builder builder) {
        this.profile = builder.profile;
        this.maxOps = builder.maxOps;
        this.maxIterations = builder.maxIterations;
        this.maxRecursion = builder.maxRecursion;
        this.timeoutSeconds = builder.timeoutSeconds;
    }

    // ============ 预定义工厂方法 ============

    /** 脚本默认：1 000 000 操作 / 100 000 迭代 / 1000 层递归 / 30 秒 */
    public static ExecutionBounds defaults() {
        return new Builder(Profile.DEFAULT).build();
    }

    /** 服务端执行：500 000 操作 / 50 000 迭代 / 500 层递归 / 10 秒 */
    public static ExecutionBounds api() {
        return new Builder(Profile.API)
                .maxOps(500_000)
                .maxIterations(50_000)
                .maxRecursion(500)
                .timeoutSeconds(10)
                .build();
    }

    /**
     * 按名称取档位：default、api
     */
    public static ExecutionBounds named(String name) {
        switch (name.toLowerCase()) {
            case "default": return defaults();
            case "api":     return api();
            default:
                throw new IllegalArgumentException("Unknown bounds profile: " + name);
        }
    }

    public static Builder builder() {
        return new Builder(Profile.CUSTOM);
    }

    /**
     * 以当前值为起点的 Builder，用于单项覆盖
     */
    public Builder toBuilder() {
        return new Builder(Profile.CUSTOM)
                .maxOps(maxOps)
                .maxIterations(maxIterations)
                .maxRecursion(maxRecursion)
                .timeoutSeconds(timeoutSeconds);
    }

    // ============ 查询方法 ============

    public Profile getProfile() {
        return profile;
    }

    public long getMaxOps() {
        return maxOps;
    }

    public long getMaxIterations() {
        return maxIterations;
    }

    public int getMaxRecursion() {
        return maxRecursion;
    }

    public double getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public boolean hasTimeout() {
        return !Double.isInfinite(timeoutSeconds);
    }

    @Override
    public String toString() {
        return "ExecutionBounds{" + profile.name().toLowerCase()
                + ", maxOps=" + maxOps
                + ", maxIterations=" + maxIterations
                + ", maxRecursion=" + maxRecursion
                + ", timeout=" + timeoutSeconds + "s}";
    }

    // ============ Builder ============

    public static final class Builder {
        private final Profile profile;
        private long maxOps = 1_000_000;
        private long maxIterations = 100_000;
        private int maxRecursion = 1000;
        private double timeoutSeconds = 30.0;

        private Builder(Profile profile) {
            this.profile = profile;
        }

        public Builder maxOps(long maxOps) {
            if (maxOps <= 0) throw new IllegalArgumentException("maxOps must be positive");
            this.maxOps = maxOps;
            return this;
        }

        public Builder maxIterations(long maxIterations) {
            if (maxIterations <= 0) throw new IllegalArgumentException("maxIterations must be positive");
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder maxRecursion(int maxRecursion) {
            if (maxRecursion <= 0) throw new IllegalArgumentException("maxRecursion must be positive");
            this.maxRecursion = maxRecursion;
            return this;
        }

        public Builder timeoutSeconds(double timeoutSeconds) {
            if (!(timeoutSeconds > 0)) throw new IllegalArgumentException("timeoutSeconds must be positive");
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public ExecutionBounds build() {
            return new ExecutionBounds(this);
        }
    }
}

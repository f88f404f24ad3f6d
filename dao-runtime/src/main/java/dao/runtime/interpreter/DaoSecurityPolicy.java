package dao.runtime.interpreter;

/**
 * 安全策略配置类
 *
 * <p>限制解释器的资源使用以及基础 I/O 系统调用。
 * 所有数值限制以 0 表示无限制；超出限制时以 {@code LimitExceeded} 错误抛出。</p>
 *
 * <p>使用示例：</p>
 * <pre>
 * // 预定义级别
 * Interpreter interp = new Interpreter(DaoSecurityPolicy.strict());
 *
 * // 自定义策略
 * DaoSecurityPolicy policy = DaoSecurityPolicy.custom()
 *     .maxEvalSteps(100_000)
 *     .maxCallDepth(64)
 *     .allowStdio(false)
 *     .build();
 * </pre>
 */
public final class DaoSecurityPolicy {

    /** 安全级别 */
    public enum Level { UNRESTRICTED, STANDARD, STRICT, CUSTOM }

    private final Level level;

    // --- 功能开关 ---
    private final boolean allowStdio;

    // --- 资源限制 ---
    private final long maxEvalSteps;         // 0=无限制
    private final int maxCallDepth;          // 0=无限制
    private final long maxExecutionTimeMs;   // 0=无限制
    private final int maxStackDepth;         // 0=无限制

    private DaoSecurityPolicy(Builder builder) {
        this.level = builder.level;
        this.allowStdio = builder.allowStdio;
        this.maxEvalSteps = builder.maxEvalSteps;
        this.maxCallDepth = builder.maxCallDepth;
        this.maxExecutionTimeMs = builder.maxExecutionTimeMs;
        this.maxStackDepth = builder.maxStackDepth;
    }

    // ============ 预定义工厂方法 ============

    /** 无限制模式（默认），零开销 */
    public static DaoSecurityPolicy unrestricted() {
        return new Builder(Level.UNRESTRICTED).build();
    }

    /** 标准模式：限制步数、调用深度与执行时间 */
    public static DaoSecurityPolicy standard() {
        return new Builder(Level.STANDARD)
                .allowStdio(true)
                .maxEvalSteps(50_000_000)
                .maxCallDepth(512)
                .maxExecutionTime(30_000)
                .maxStackDepth(100_000)
                .build();
    }

    /** 严格模式：更小的资源上限，禁止标准输出 */
    public static DaoSecurityPolicy strict() {
        return new Builder(Level.STRICT)
                .allowStdio(false)
                .maxEvalSteps(1_000_000)
                .maxCallDepth(128)
                .maxExecutionTime(10_000)
                .maxStackDepth(10_000)
                .build();
    }

    /** 自定义模式 Builder */
    public static Builder custom() {
        return new Builder(Level.CUSTOM);
    }

    // ============ 查询方法 ============

    public boolean isStdioAllowed() {
        return level == Level.UNRESTRICTED || allowStdio;
    }

    /** 是否存在任何资源限制，无限制时解释器跳过全部检查 */
    public boolean hasLimits() {
        return level != Level.UNRESTRICTED
                && (maxEvalSteps > 0 || maxCallDepth > 0 || maxExecutionTimeMs > 0 || maxStackDepth > 0);
    }

    public Level getLevel() {
        return level;
    }

    public long getMaxEvalSteps() {
        return maxEvalSteps;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public long getMaxExecutionTimeMs() {
        return maxExecutionTimeMs;
    }

    public int getMaxStackDepth() {
        return maxStackDepth;
    }

    // ============ 错误工厂 ============

    /** 创建拒绝访问的 THROW 控制流 */
    public static ControlFlow denied(String action) {
        return VmErrors.error(ErrorKind.SYSTEM_CALL, "Security policy denied: " + action);
    }

    // ============ Builder ============

    public static final class Builder {
        private final Level level;
        private boolean allowStdio = true;
        private long maxEvalSteps = 0;
        private int maxCallDepth = 0;
        private long maxExecutionTimeMs = 0;
        private int maxStackDepth = 0;

        Builder(Level level) {
            this.level = level;
        }

        public Builder allowStdio(boolean allow) {
            this.allowStdio = allow;
            return this;
        }

        public Builder maxEvalSteps(long steps) {
            this.maxEvalSteps = steps;
            return this;
        }

        public Builder maxCallDepth(int depth) {
            this.maxCallDepth = depth;
            return this;
        }

        public Builder maxExecutionTime(long ms) {
            this.maxExecutionTimeMs = ms;
            return this;
        }

        public Builder maxStackDepth(int depth) {
            this.maxStackDepth = depth;
            return this;
        }

        public DaoSecurityPolicy build() {
            return new DaoSecurityPolicy(this);
        }
    }
}

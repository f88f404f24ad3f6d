package dao.runtime;

/**
 * 宿主侧求值结果：成功值或错误值，二者之一。
 *
 * <p>用于不抛异常的宿主 API，错误值即脚本抛出的结构化 Error。</p>
 */
public final class DaoResult {

    private final boolean ok;
    private final DaoValue value;

    private DaoResult(boolean ok, DaoValue value) {
        this.ok = ok;
        this.value = value;
    }

    public static DaoResult ok(DaoValue value) {
        return new DaoResult(true, value);
    }

    public static DaoResult err(DaoValue error) {
        return new DaoResult(false, error);
    }

    public boolean isOk() {
        return ok;
    }

    public boolean isErr() {
        return !ok;
    }

    /**
     * 成功值
     *
     * @throws IllegalStateException 结果是错误
     */
    public DaoValue getValue() {
        if (!ok) throw new IllegalStateException("Result is an error: " + value);
        return value;
    }

    /**
     * 错误值
     *
     * @throws IllegalStateException 结果是成功值
     */
    public DaoValue getError() {
        if (ok) throw new IllegalStateException("Result is not an error: " + value);
        return value;
    }

    /** 成功时返回值，失败时返回 {@code fallback} */
    public DaoValue orElse(DaoValue fallback) {
        return ok ? value : fallback;
    }

    @Override
    public String toString() {
        return (ok ? "Ok(" : "Err(") + value + ")";
    }
}

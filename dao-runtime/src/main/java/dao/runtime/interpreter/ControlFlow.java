package dao.runtime.interpreter;

import dao.runtime.DaoValue;

/**
 * 控制流异常
 *
 * <p>RETURN 与 THROW 共用同一条异常通道，以类型区分。
 * 调用边界只捕获 RETURN 并转为普通结果，THROW 继续向上传播；
 * 它们不是真正的错误，不记录堆栈。</p>
 */
public final class ControlFlow extends RuntimeException {

    /**
     * 控制流类型
     */
    public enum Type {
        RETURN,
        THROW
    }

    private final Type type;
    private final DaoValue value;

    private ControlFlow(Type type, DaoValue value) {
        super(null, null, false, false);  // 禁用堆栈跟踪
        this.type = type;
        this.value = value;
    }

    public Type getType() {
        return type;
    }

    public DaoValue getValue() {
        return value;
    }

    public boolean isReturn() {
        return type == Type.RETURN;
    }

    public boolean isThrow() {
        return type == Type.THROW;
    }

    @Override
    public String getMessage() {
        return type + " " + value;
    }

    // ============ 工厂方法 ============

    public static ControlFlow returnValue(DaoValue value) {
        return new ControlFlow(Type.RETURN, value);
    }

    public static ControlFlow throwError(DaoValue error) {
        return new ControlFlow(Type.THROW, error);
    }
}

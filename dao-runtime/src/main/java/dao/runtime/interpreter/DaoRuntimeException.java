package dao.runtime.interpreter;

import dao.runtime.Address;
import dao.runtime.DaoData;
import dao.runtime.DaoException;
import dao.runtime.DaoValue;

/**
 * 未被捕获的脚本错误到达宿主时抛出。
 *
 * <p>携带结构化错误值，消息取自其 {@code problem} 字段。</p>
 */
public class DaoRuntimeException extends DaoException {

    private final DaoValue errorValue;

    public DaoRuntimeException(DaoValue errorValue) {
        super(describe(errorValue));
        this.errorValue = errorValue;
    }

    public DaoValue getErrorValue() {
        return errorValue;
    }

    /** 错误值是 Data 时返回其标签，否则 null */
    public Address getErrorTag() {
        DaoData data = errorValue.asData();
        return data == null ? null : data.getTag();
    }

    /** 已知错误种类，脚本自定义的错误值返回 null */
    public ErrorKind getErrorKind() {
        Address tag = getErrorTag();
        return tag == null ? null : ErrorKind.fromTag(tag);
    }

    private static String describe(DaoValue error) {
        DaoData data = error.asData();
        if (data != null) {
            DaoValue problem = data.get("problem");
            return problem == null ? data.getTag().toString()
                    : data.getTag() + ": " + problem.toDisplayString();
        }
        return "uncaught error: " + error;
    }
}

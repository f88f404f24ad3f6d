package dao.runtime;

/**
 * Dao 运行时基础异常。
 *
 * <p>所有抛向宿主代码的异常都继承此类：地址解析失败
 * ({@link AddressFormatException}) 以及 {@code dao-runtime} 中携带错误值的
 * {@code DaoRuntimeException}。</p>
 */
public class DaoException extends RuntimeException {

    public DaoException(String message) {
        super(message);
    }

    public DaoException(String message, Throwable cause) {
        super(message, cause);
    }
}

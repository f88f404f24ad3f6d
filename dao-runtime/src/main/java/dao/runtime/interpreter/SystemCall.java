package dao.runtime.interpreter;

import dao.runtime.DaoValue;

/**
 * 系统调用：由宿主安装、经地址从 {@code SYS} 表达式调用的本地函数。
 *
 * <p>调用时栈已替换为求值后的实参（第一个实参在栈底），可通过
 * {@link Interpreter#arguments()}、{@link Interpreter#popArgument()} 读取。
 * 返回值即调用结果（{@code null} 视为 Null）；失败时抛出
 * {@link ControlFlow#throwError}，与脚本代码走同一通道。
 * 无论成败，调用结束后调用方都会恢复原来的栈。</p>
 */
@FunctionalInterface
public interface SystemCall {

    DaoValue call(Interpreter interpreter);
}

package dao.runtime.interpreter.stdlib;

import dao.runtime.Address;
import dao.runtime.DaoString;
import dao.runtime.DaoValue;
import dao.runtime.interpreter.DaoSecurityPolicy;
import dao.runtime.interpreter.Interpreter;

import java.io.PrintStream;

/**
 * print / error 基础输出系统调用
 *
 * <p>按实参顺序拼接各实参的打印形式，末尾换行，返回打印的文本。
 * {@code print} 写标准输出，{@code error} 写标准错误。</p>
 */
public final class BasicIO {

    public static final Address PRINT = Address.of("print");
    public static final Address ERROR = Address.of("error");

    private BasicIO() {}

    private static void checkStdio(Interpreter interp) {
        if (!interp.getSecurityPolicy().isStdioAllowed()) {
            throw DaoSecurityPolicy.denied("standard I/O is not allowed");
        }
    }

    public static void install(Interpreter interp) {
        interp.installSystemCall(PRINT, vm -> write(vm, vm.getStdout()));
        interp.installSystemCall(ERROR, vm -> write(vm, vm.getStderr()));
    }

    private static DaoValue write(Interpreter vm, PrintStream out) {
        checkStdio(vm);
        String text = render(vm);
        out.println(text);
        out.flush();
        return DaoString.of(text);
    }

    static String render(Interpreter vm) {
        StringBuilder sb = new StringBuilder();
        for (DaoValue v : vm.arguments()) {
            sb.append(v.toDisplayString());
        }
        return sb.toString();
    }
}

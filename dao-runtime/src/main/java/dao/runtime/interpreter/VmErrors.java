package dao.runtime.interpreter;

import com.daolang.ir.code.Expression;
import com.daolang.ir.code.Instruction;
import dao.runtime.Address;
import dao.runtime.DaoData;
import dao.runtime.DaoList;
import dao.runtime.DaoPointer;
import dao.runtime.DaoString;
import dao.runtime.DaoValue;
import dao.runtime.Label;

import java.util.ArrayList;
import java.util.List;

/**
 * 运行时错误值工厂。
 *
 * <p>每个方法构造带 {@code problem} 字段的错误 Data，并包装成 THROW 控制流返回，
 * 调用方直接 {@code throw}。</p>
 */
public final class VmErrors {

    private VmErrors() {}

    /** 构造错误值；{@code fields} 为交替的字段名与值 */
    public static DaoData errorValue(ErrorKind kind, String problem, Object... fields) {
        Object[] all = new Object[fields.length + 2];
        all[0] = "problem";
        all[1] = problem != null ? problem : kind.getDefaultProblem();
        System.arraycopy(fields, 0, all, 2, fields.length);
        return DaoData.of(kind.getTag(), all);
    }

    public static ControlFlow error(ErrorKind kind, String problem, Object... fields) {
        return ControlFlow.throwError(errorValue(kind, problem, fields));
    }

    // ── 查找 ──

    static ControlFlow undefinedVariable(Label label) {
        return error(ErrorKind.UNDEFINED_VARIABLE, null, "variableName", label.getName());
    }

    static ControlFlow undefinedModuleVariable(Address module, Label label) {
        if (module == null) {
            return error(ErrorKind.UNDEFINED_MODULE_VARIABLE, null, "variableName", label.getName());
        }
        return error(ErrorKind.UNDEFINED_MODULE_VARIABLE, null,
                "inModule", DaoPointer.of(module), "variableName", label.getName());
    }

    static ControlFlow undefinedModule(Address address) {
        return error(ErrorKind.UNDEFINED_MODULE, null, "moduleName", DaoPointer.of(address));
    }

    static ControlFlow undefinedSystemCall(Address address) {
        return error(ErrorKind.UNDEFINED_SYSTEM_CALL, null, "systemCall", DaoPointer.of(address));
    }

    static ControlFlow undefinedJumpTarget(Label label) {
        return error(ErrorKind.UNDEFINED_JUMP_TARGET, null, "jumpTo", label.getName());
    }

    // ── 栈与参数 ──

    static ControlFlow stackUnderflow() {
        return error(ErrorKind.STACK_UNDERFLOW, null);
    }

    static ControlFlow notEnoughArguments(List<Label> params, List<DaoValue> available) {
        List<DaoValue> names = new ArrayList<>(params.size());
        for (Label p : params) {
            names.add(DaoString.of(p.getName()));
        }
        return error(ErrorKind.NOT_ENOUGH_ARGUMENTS, null,
                "parameters", DaoList.of(names), "arguments", DaoList.of(available));
    }

    static ControlFlow tooManyArguments(String function, List<DaoValue> extraneous) {
        return error(ErrorKind.TOO_MANY_ARGUMENTS, null,
                "function", function, "extraneousArguments", DaoList.of(extraneous));
    }

    // ── 指令 ──

    static ControlFlow noCurrentModule(Instruction instruction) {
        return error(ErrorKind.NO_CURRENT_MODULE, null, "instruction", instruction.toString());
    }

    public static ControlFlow badInstruction(Expression expression, Object... fields) {
        Object[] all = new Object[fields.length + 2];
        all[0] = "instruction";
        all[1] = expression.toString();
        System.arraycopy(fields, 0, all, 2, fields.length);
        return error(ErrorKind.BAD_INSTRUCTION, null, all);
    }

    public static ControlFlow badInstruction(Expression expression, String problem) {
        return error(ErrorKind.BAD_INSTRUCTION, problem, "instruction", expression.toString());
    }

    static ControlFlow operatorFailed(Expression expression, Address dataType, DaoValue exception) {
        return error(ErrorKind.BAD_INSTRUCTION, "operator evaluator failed",
                "instruction", expression.toString(), "dataType", DaoPointer.of(dataType),
                "exception", exception);
    }

    static ControlFlow notCallable(Object target) {
        return error(ErrorKind.NOT_CALLABLE, null, "targetRegister", String.valueOf(target));
    }

    // ── 模块与系统调用 ──

    static ControlFlow moduleAlreadyActive(Address address) {
        return error(ErrorKind.MODULE_ALREADY_ACTIVE, null, "address", DaoPointer.of(address));
    }

    static ControlFlow systemCallFailed(Address address, DaoValue exception) {
        return error(ErrorKind.SYSTEM_CALL, null,
                "systemCall", DaoPointer.of(address), "exception", exception);
    }

    static ControlFlow limitExceeded(String limit, long value) {
        return error(ErrorKind.LIMIT_EXCEEDED, "security policy limit exceeded: " + limit,
                "limit", limit, "value", value);
    }
}

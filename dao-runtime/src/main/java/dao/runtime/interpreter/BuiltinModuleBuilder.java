package dao.runtime.interpreter;

import com.daolang.ir.code.Block;
import com.daolang.ir.code.DaoFunc;
import com.daolang.ir.code.Expression;
import com.daolang.ir.code.Instruction;
import com.daolang.ir.code.Lookup;
import com.daolang.ir.module.DaoModule;
import com.daolang.ir.module.Rule;
import dao.runtime.Address;
import dao.runtime.DaoValue;
import dao.runtime.Label;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内建模块 Builder DSL，供 {@code Dao.installModule(name, module -> { ... })} 使用。
 *
 * <pre>
 * dao.installModule("math", module -> {
 *     module.data("pi", DaoFloat.of(Math.PI));
 *     module.method("abs", interp -> {
 *         DaoInt n = interp.popArgument().asInt();
 *         return DaoInt.of(Math.abs(n.getValue()));
 *     });
 * });
 * </pre>
 *
 * <p>安装到地址 {@code A} 时，每个方法注册为系统调用 {@code A.method}，
 * 并在模块 public 中合成同名函数，函数体为"以当前实参调用该系统调用，然后返回"。</p>
 */
public final class BuiltinModuleBuilder {

    private final Map<Label, SystemCall> methods = new LinkedHashMap<>();
    private final DaoModule.Builder module = DaoModule.builder();
    private OperatorEvaluator evaluator;

    public BuiltinModuleBuilder() {
    }

    // ── 方法注册 ──

    public BuiltinModuleBuilder method(String name, SystemCall function) {
        return method(Label.of(name), function);
    }

    public BuiltinModuleBuilder method(Label name, SystemCall function) {
        if (function == null) throw new NullPointerException("function");
        methods.put(name, function);
        return this;
    }

    // ── 值注册 ──

    /** 模块私有静态数据 */
    public BuiltinModuleBuilder data(String name, DaoValue value) {
        module.privateVar(name, value);
        return this;
    }

    /** 导出的公开值 */
    public BuiltinModuleBuilder export(String name, DaoValue value) {
        module.publicVar(name, value);
        return this;
    }

    public BuiltinModuleBuilder rule(Rule rule) {
        module.rule(rule);
        return this;
    }

    public BuiltinModuleBuilder importModule(Address address) {
        module.importModule(address);
        return this;
    }

    /** 以该模块地址为标签的 Data 值的运算符求值器 */
    public BuiltinModuleBuilder operators(OperatorEvaluator evaluator) {
        this.evaluator = evaluator;
        return this;
    }

    // ── 构建 ──

    Map<Label, SystemCall> getMethods() {
        return Collections.unmodifiableMap(methods);
    }

    OperatorEvaluator getEvaluator() {
        return evaluator;
    }

    /** 生成模块：为每个方法合成转发到系统调用的公开函数 */
    DaoModule build(Address address) {
        DaoModule.Builder b = module.build().toBuilder();
        for (Label name : methods.keySet()) {
            b.publicVar(name, forwardingMethod(address.append(name)));
        }
        return b.build();
    }

    static DaoFunc forwardingMethod(Address systemCall) {
        return DaoFunc.of(Block.of(
                Instruction.eval(Expression.sysForwardingStack(systemCall)),
                Instruction.returnWith(Lookup.result())));
    }
}

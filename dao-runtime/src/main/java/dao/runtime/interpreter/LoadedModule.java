package dao.runtime.interpreter;

import com.daolang.ir.module.DaoModule;

/**
 * 已加载模块：普通模块，或附带可选运算符求值器的内建模块。
 */
public final class LoadedModule {

    private final DaoModule module;
    private final boolean builtin;
    private final OperatorEvaluator evaluator;

    private LoadedModule(DaoModule module, boolean builtin, OperatorEvaluator evaluator) {
        if (module == null) throw new NullPointerException("module");
        this.module = module;
        this.builtin = builtin;
        this.evaluator = evaluator;
    }

    public static LoadedModule plain(DaoModule module) {
        return new LoadedModule(module, false, null);
    }

    public static LoadedModule builtin(DaoModule module, OperatorEvaluator evaluator) {
        return new LoadedModule(module, true, evaluator);
    }

    public DaoModule getModule() {
        return module;
    }

    public boolean isBuiltin() {
        return builtin;
    }

    /** 运算符求值器，可能为 null */
    public OperatorEvaluator getEvaluator() {
        return evaluator;
    }

    @Override
    public String toString() {
        return (builtin ? (evaluator != null ? "builtin+operators " : "builtin ") : "plain ") + module;
    }
}

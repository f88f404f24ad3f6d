package dao.runtime.interpreter;

import com.daolang.ir.module.DaoModule;
import dao.runtime.Address;
import dao.runtime.Label;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 模块与系统调用注册表
 *
 * <p>已加载模块保存在以标签序列为键的前缀树中，既支持精确地址解析，
 * 也支持按前缀查询与整体删除（停用）。系统调用表同样按地址索引。</p>
 *
 * <p>由单个 {@link Interpreter} 独占；多个解释器之间不共享。</p>
 */
public final class ModuleRegistry {

    private static final Logger LOG = Logger.getLogger(ModuleRegistry.class.getName());

    private final LabelTrie<LoadedModule> modules = new LabelTrie<>();
    private final LabelTrie<SystemCall> systemCalls = new LabelTrie<>();

    // ============ 系统调用 ============

    /** 注册（或替换）系统调用，不属于任何模块 */
    public void installSystemCall(Address address, SystemCall function) {
        if (function == null) throw new NullPointerException("function");
        systemCalls.put(address, function);
        LOG.fine("system call installed: " + address);
    }

    /** 未注册返回 null */
    public SystemCall getSystemCall(Address address) {
        return systemCalls.get(address);
    }

    public SystemCall requireSystemCall(Address address) {
        SystemCall fn = systemCalls.get(address);
        if (fn == null) throw VmErrors.undefinedSystemCall(address);
        return fn;
    }

    // ============ 模块 ============

    /**
     * 安装内建模块：每个方法注册为 {@code address.method} 系统调用，
     * 并合成同名公开函数。已存在的同地址模块会被替换，
     * 替换前先删除该地址下的全部系统调用。
     */
    public DaoModule installBuiltin(Address address, BuiltinModuleBuilder builder) {
        DaoModule module = builder.build(address);
        if (modules.contains(address)) {
            int stale = systemCalls.removeUnder(address);
            LOG.fine("builtin module replaced: " + address + " (" + stale + " system calls removed)");
        }
        for (Map.Entry<Label, SystemCall> e : builder.getMethods().entrySet()) {
            systemCalls.put(address.append(e.getKey()), e.getValue());
        }
        modules.put(address, LoadedModule.builtin(module, builder.getEvaluator()));
        LOG.fine("builtin module installed: " + address + " with " + builder.getMethods().size() + " methods");
        return module;
    }

    /**
     * 在地址上激活普通模块
     *
     * @throws ControlFlow 地址已被占用时抛出 {@code ModuleAlreadyActive}
     */
    public void activate(Address address, DaoModule module) {
        if (modules.contains(address)) {
            throw VmErrors.moduleAlreadyActive(address);
        }
        modules.put(address, LoadedModule.plain(module));
        LOG.fine("module activated: " + address);
    }

    /**
     * 停用地址上的模块，同时删除该地址下的全部系统调用
     *
     * @return 是否存在被停用的模块
     */
    public boolean deactivate(Address address) {
        LoadedModule removed = modules.remove(address);
        int calls = systemCalls.removeUnder(address);
        LOG.fine("module deactivated: " + address + " (" + calls + " system calls removed)");
        return removed != null;
    }

    /** 未加载返回 null */
    public LoadedModule getModule(Address address) {
        return modules.get(address);
    }

    public LoadedModule requireModule(Address address) {
        LoadedModule module = modules.get(address);
        if (module == null) throw VmErrors.undefinedModule(address);
        return module;
    }

    public boolean isLoaded(Address address) {
        return modules.contains(address);
    }

    /** 前缀下（含自身）的全部模块，按地址排序 */
    public Map<Address, LoadedModule> modulesUnder(Address prefix) {
        return modules.entriesUnder(prefix);
    }

    public Map<Address, LoadedModule> allModules() {
        return modules.entries();
    }

    public List<Address> systemCallAddresses() {
        return new ArrayList<>(systemCalls.entries().keySet());
    }

    // ============ 诊断 ============

    public String describeModules() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Address, LoadedModule> e : modules.entries().entrySet()) {
            sb.append(e.getKey()).append(": ").append(e.getValue()).append('\n');
        }
        return sb.toString();
    }

    public String describeSystemCalls() {
        StringBuilder sb = new StringBuilder();
        for (Address address : systemCalls.entries().keySet()) {
            sb.append(address).append('\n');
        }
        return sb.toString();
    }
}

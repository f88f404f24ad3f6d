package dao.runtime;

import com.daolang.ir.code.Block;
import com.daolang.ir.module.DaoModule;
import dao.runtime.interpreter.BuiltinModuleBuilder;
import dao.runtime.interpreter.DaoRuntimeException;
import dao.runtime.interpreter.DaoSecurityPolicy;
import dao.runtime.interpreter.Interpreter;
import dao.runtime.interpreter.LoadedModule;
import dao.runtime.interpreter.OperatorEvaluator;
import dao.runtime.interpreter.SystemCall;
import dao.runtime.interpreter.cache.AddressCache;
import dao.runtime.interpreter.stdlib.BasicIO;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dao 宿主 API：嵌入虚拟机的便捷入口。
 *
 * <pre>
 * Dao dao = new Dao().installBasicIO();
 * dao.installModule("math", module -> module
 *         .method("abs", vm -> DaoInt.of(Math.abs(vm.popArgument().asInt().getValue()))));
 * dao.activateModule("greeter", greeterModule);
 * dao.selectModules("greeter");
 * dao.query("my", "name", "is", "Dave");
 * </pre>
 *
 * <p>以字符串给出的地址经有界缓存解析。一个实例只应由一个线程使用。</p>
 */
public final class Dao {

    private static final Logger LOG = Logger.getLogger(Dao.class.getName());

    private final Interpreter interpreter;
    private final AddressCache addresses = new AddressCache(1024);

    /** 规则分派所用的已选模块，按选择顺序 */
    private final List<Address> selected = new ArrayList<>();

    public Dao() {
        this.interpreter = new Interpreter();
    }

    public Dao(DaoSecurityPolicy policy) {
        this.interpreter = new Interpreter(policy);
    }

    // ── IO 重定向 ─────────────────────────────────────────

    public Dao setStdout(PrintStream out) {
        interpreter.setStdout(out);
        return this;
    }

    public Dao setStderr(PrintStream err) {
        interpreter.setStderr(err);
        return this;
    }

    // ── 安装 ─────────────────────────────────────────────

    /** 安装 print / error 系统调用 */
    public Dao installBasicIO() {
        BasicIO.install(interpreter);
        return this;
    }

    public Dao installSystemCall(String address, SystemCall function) {
        interpreter.installSystemCall(addresses.parse(address), function);
        return this;
    }

    /**
     * 安装内建模块
     *
     * <pre>
     * dao.installModule("counter", m -> m.method("next", vm -> ...));
     * </pre>
     */
    public Dao installModule(String address, Consumer<BuiltinModuleBuilder> definition) {
        BuiltinModuleBuilder builder = new BuiltinModuleBuilder();
        definition.accept(builder);
        interpreter.installModule(addresses.parse(address), builder);
        return this;
    }

    /** 安装带运算符求值器的内建模块 */
    public Dao installModule(String address, Consumer<BuiltinModuleBuilder> definition,
                             OperatorEvaluator evaluator) {
        return installModule(address, builder -> {
            definition.accept(builder);
            builder.operators(evaluator);
        });
    }

    /**
     * 在地址上激活普通模块
     *
     * @throws DaoRuntimeException 地址已被占用（{@code ModuleAlreadyActive}）
     */
    public Dao activateModule(String address, DaoModule module) {
        interpreter.activateModule(addresses.parse(address), module);
        return this;
    }

    /** 停用模块并删除其地址下的系统调用，同时从已选列表移除 */
    public boolean deactivateModule(String address) {
        Address addr = addresses.parse(address);
        selected.remove(addr);
        return interpreter.deactivateModule(addr);
    }

    // ── 模块选择与规则分派 ──────────────────────────────

    /**
     * 选择参与规则分派的模块，替换之前的选择。
     * 非法地址或未加载的模块记录警告后跳过。
     *
     * @return 实际选中的地址
     */
    public List<Address> selectModules(String... names) {
        selected.clear();
        for (String name : names) {
            Address address;
            try {
                address = addresses.parse(name);
            } catch (AddressFormatException e) {
                LOG.warning("cannot select module, invalid address: " + e.getMessage());
                continue;
            }
            if (!interpreter.getRegistry().isLoaded(address)) {
                LOG.warning("cannot select module, not loaded: " + address);
                continue;
            }
            if (!selected.contains(address)) {
                selected.add(address);
            }
        }
        return getSelectedModules();
    }

    /** 选择全部已加载模块，按地址排序 */
    public List<Address> selectAllModules() {
        selected.clear();
        selected.addAll(interpreter.getRegistry().allModules().keySet());
        return getSelectedModules();
    }

    public List<Address> getSelectedModules() {
        return Collections.unmodifiableList(new ArrayList<>(selected));
    }

    /**
     * 依次对每个已选模块执行规则分派
     *
     * @return 全部模块中匹配的规则总数
     * @throws DaoRuntimeException 动作抛出未捕获的错误
     */
    public int query(List<String> tokens) {
        int matched = 0;
        for (Address address : selected) {
            LoadedModule module = interpreter.getRegistry().getModule(address);
            if (module == null) continue;
            try {
                matched += interpreter.dispatch(tokens, module.getModule());
            } catch (DaoRuntimeException e) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("rule action in " + address + " failed: " + e.getMessage());
                }
                throw e;
            }
        }
        return matched;
    }

    public int query(String... tokens) {
        return query(Arrays.asList(tokens));
    }

    // ── 求值 ─────────────────────────────────────────────

    /**
     * @throws DaoRuntimeException 未捕获的脚本错误
     */
    public DaoValue eval(Block block) {
        return interpreter.evalBlock(block);
    }

    /** 不抛异常的求值，错误以 Err 返回 */
    public DaoResult tryEval(Block block) {
        try {
            return DaoResult.ok(interpreter.evalBlock(block));
        } catch (DaoRuntimeException e) {
            LOG.fine("evaluation failed: " + e.getMessage());
            return DaoResult.err(e.getErrorValue());
        }
    }

    // ── 诊断 ─────────────────────────────────────────────

    public String describeState() {
        return interpreter.describeState();
    }

    public String describeModules() {
        return interpreter.getRegistry().describeModules();
    }

    public String describeSystemCalls() {
        return interpreter.getRegistry().describeSystemCalls();
    }

    public Map<Address, LoadedModule> modulesUnder(String prefix) {
        return interpreter.modulesUnder(addresses.parse(prefix));
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    public AddressCache getAddressCache() {
        return addresses;
    }
}

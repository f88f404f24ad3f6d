package dao.runtime.interpreter;

import com.daolang.ir.code.Block;
import com.daolang.ir.code.Condition;
import com.daolang.ir.code.Expression;
import com.daolang.ir.code.Instruction;
import com.daolang.ir.code.Lookup;
import com.daolang.ir.module.DaoModule;
import dao.runtime.Address;
import dao.runtime.DaoAtom;
import dao.runtime.DaoList;
import dao.runtime.DaoValue;
import dao.runtime.Label;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Dao 虚拟机解释器
 *
 * <p>单线程、同步执行：一个解释器状态由一个逻辑控制流原地修改。
 * 嵌套调用借助 Java 方法递归实现，不维护显式的帧栈。</p>
 *
 * <p>宿主入口：{@link #evalBlock}、{@link #execute}、{@link #evaluate}、{@link #dispatch}。
 * 脚本中未捕获的错误在这些入口处转换为 {@link DaoRuntimeException}。</p>
 */
public class Interpreter {

    // 每隔多少步检查一次执行时间
    private static final int TIME_CHECK_INTERVAL = 1024;

    /** 步数计数器，仅用于诊断 */
    long evalCounter;

    /** 最近一次产生的值（累加器） */
    DaoValue lastResult = DaoAtom.NULL;

    /** 当前函数的局部变量 */
    Map<Label, DaoValue> registers = new HashMap<>();

    /** 当前块的跳转表，块成为当前块时由其 SET_JUMP 重建 */
    Map<Label, Integer> jumpTable = new HashMap<>();

    /** 求值栈，列表末尾为栈顶 */
    ArrayList<DaoValue> stack = new ArrayList<>();

    /** 当前模块上下文，DEREF 与 UPDATE 作用于它；可能为 null */
    DaoModule currentModule;

    /** 正在执行的块与程序计数器 */
    Block currentBlock = Block.EMPTY;
    int programCounter;

    /** 当前 Call/Local 嵌套深度 */
    int callDepth;

    private final ModuleRegistry registry = new ModuleRegistry();
    private final DaoSecurityPolicy securityPolicy;
    private final boolean limited;

    private final ExpressionEvaluator expressions;
    private final FunctionExecutor functions;
    private final RuleDispatcher rules;

    // 宿主入口嵌套层数，只在最外层重置资源计量
    private int hostDepth;
    private long stepsThisRun;
    private long deadlineNanos;

    private PrintStream stdout = System.out;
    private PrintStream stderr = System.err;

    public Interpreter() {
        this(DaoSecurityPolicy.unrestricted());
    }

    public Interpreter(DaoSecurityPolicy policy) {
        this.securityPolicy = policy;
        this.limited = policy.hasLimits();
        this.expressions = new ExpressionEvaluator(this);
        this.functions = new FunctionExecutor(this);
        this.rules = new RuleDispatcher(this);
    }

    // ============ 宿主入口 ============

    /**
     * 以 {@code block} 为当前块从头执行，返回结束时的 lastResult。
     * 顶层的 RETURN 即为结果。
     *
     * @throws DaoRuntimeException 脚本抛出未捕获的错误
     */
    public DaoValue evalBlock(Block block) {
        enterHost();
        try {
            enterBlock(block);
            return run();
        } catch (ControlFlow cf) {
            return hostResult(cf);
        } finally {
            exitHost();
        }
    }

    /**
     * 针对当前状态执行单条指令，用于更底层的宿主控制
     */
    public DaoValue execute(Instruction instruction) {
        enterHost();
        try {
            evalCounter++;
            step(instruction);
            return lastResult;
        } catch (ControlFlow cf) {
            return hostResult(cf);
        } finally {
            exitHost();
        }
    }

    /**
     * 针对当前状态求值表达式，结果写入 lastResult
     */
    public DaoValue evaluate(Expression expression) {
        enterHost();
        try {
            evalCounter++;
            return setResult(expressions.evaluate(expression));
        } catch (ControlFlow cf) {
            return hostResult(cf);
        } finally {
            exitHost();
        }
    }

    /**
     * 对模块执行规则分派
     *
     * @return 匹配并执行的规则数
     */
    public int dispatch(List<String> input, DaoModule module) {
        enterHost();
        try {
            return rules.dispatch(input, module);
        } catch (ControlFlow cf) {
            hostResult(cf);
            return 0;
        } finally {
            exitHost();
        }
    }

    /** 清空寄存器、栈、跳转表与当前块，模块与系统调用保持不变 */
    public void reset() {
        registers = new HashMap<>();
        stack = new ArrayList<>();
        jumpTable = new HashMap<>();
        currentBlock = Block.EMPTY;
        programCounter = 0;
        currentModule = null;
        lastResult = DaoAtom.NULL;
        callDepth = 0;
    }

    private DaoValue hostResult(ControlFlow cf) {
        if (cf.isReturn()) {
            return setResult(cf.getValue());
        }
        throw new DaoRuntimeException(cf.getValue());
    }

    private void enterHost() {
        if (hostDepth++ == 0 && limited) {
            stepsThisRun = 0;
            long ms = securityPolicy.getMaxExecutionTimeMs();
            deadlineNanos = ms > 0 ? System.nanoTime() + ms * 1_000_000L : 0;
        }
    }

    private void exitHost() {
        hostDepth--;
    }

    // ============ 执行循环 ============

    /** 使 {@code block} 成为当前块：pc 归零并重建跳转表 */
    void enterBlock(Block block) {
        currentBlock = block;
        programCounter = 0;
        jumpTable = block.jumpTargets();
    }

    /**
     * 当 pc 在当前块范围内时逐条执行；越界后返回 lastResult。
     * 每次执行前先递增 evalCounter 与 pc。
     */
    DaoValue run() {
        while (currentBlock.inRange(programCounter)) {
            Instruction inst = currentBlock.get(programCounter);
            evalCounter++;
            programCounter++;
            if (limited) checkStepLimits();
            step(inst);
        }
        return lastResult;
    }

    void step(Instruction inst) {
        switch (inst.getOp()) {
            case LOAD:
                setResult(lookup(inst.getLookup()));
                break;
            case STORE:
                registers.put(inst.getLabel(), lastResult);
                break;
            case UPDATE:
                update(inst);
                break;
            case SET_JUMP:
                break;
            case JUMP:
                jump(inst.getLabel());
                break;
            case PUSH:
                push(lookup(inst.getLookup()));
                break;
            case PEEK:
                setResult(peek());
                break;
            case POP:
                setResult(popArgument());
                break;
            case CLEAR_FORWARD: {
                DaoList all = DaoList.of(stack);
                stack.clear();
                setResult(all);
                break;
            }
            case CLEAR_REVERSE: {
                List<DaoValue> reversed = new ArrayList<>(stack);
                Collections.reverse(reversed);
                stack.clear();
                setResult(DaoList.of(reversed));
                break;
            }
            case EVAL:
                setResult(expressions.evaluate(inst.getExpression()));
                break;
            case DO:
                condition(inst.getCondition());
                break;
            case RETURN:
                throw ControlFlow.returnValue(lookup(inst.getLookup()));
            case THROW:
                throw ControlFlow.throwError(lookup(inst.getLookup()));
            default:
                throw new IllegalStateException("Unknown op: " + inst.getOp());
        }
    }

    private void update(Instruction inst) {
        if (currentModule == null) {
            throw VmErrors.noCurrentModule(inst);
        }
        Label label = inst.getLabel();
        DaoValue old = currentModule.lookupPrivate(label);
        if (old == null) {
            throw VmErrors.undefinedVariable(label);
        }
        DaoValue value = lookup(inst.getLookup());
        currentModule = currentModule.withPrivate(label, value);
        setResult(old);
    }

    private void jump(Label label) {
        Integer target = jumpTable.get(label);
        if (target == null || !currentBlock.inRange(target)) {
            throw VmErrors.undefinedJumpTarget(label);
        }
        programCounter = target;
    }

    private void condition(Condition cond) {
        DaoValue test = lookup(cond.getTest());
        boolean run = cond.getKind() == Condition.Kind.WHEN ? !test.isNull() : test.isNull();
        if (run) {
            evalCounter++;
            step(cond.getCommand());
        }
    }

    // ============ 取值 ============

    DaoValue lookup(Lookup lookup) {
        switch (lookup.getKind()) {
            case RESULT:
                return lastResult;
            case CONST:
                return lookup.getConstant();
            case VAR: {
                DaoValue v = registers.get(lookup.getLabel());
                if (v == null) throw VmErrors.undefinedVariable(lookup.getLabel());
                return v;
            }
            case DEREF: {
                Label label = lookup.getLabel();
                if (currentModule != null) {
                    DaoValue v = currentModule.lookupPrivate(label);
                    if (v == null) v = currentModule.lookupPublic(label);
                    if (v != null) return v;
                }
                throw VmErrors.undefinedModuleVariable(null, label);
            }
            case QUALIFIED: {
                LoadedModule module = registry.requireModule(lookup.getAddress());
                DaoValue v = module.getModule().lookupPublic(lookup.getLabel());
                if (v == null) throw VmErrors.undefinedModuleVariable(lookup.getAddress(), lookup.getLabel());
                return v;
            }
            default:
                throw new IllegalStateException("Unknown lookup: " + lookup.getKind());
        }
    }

    // ============ 资源限制 ============

    private void checkStepLimits() {
        stepsThisRun++;
        long maxSteps = securityPolicy.getMaxEvalSteps();
        if (maxSteps > 0 && stepsThisRun > maxSteps) {
            throw VmErrors.limitExceeded("maxEvalSteps", maxSteps);
        }
        if (deadlineNanos != 0 && stepsThisRun % TIME_CHECK_INTERVAL == 0
                && System.nanoTime() > deadlineNanos) {
            throw VmErrors.limitExceeded("maxExecutionTimeMs", securityPolicy.getMaxExecutionTimeMs());
        }
    }

    void checkCallDepth() {
        int max = securityPolicy.getMaxCallDepth();
        if (limited && max > 0 && callDepth >= max) {
            throw VmErrors.limitExceeded("maxCallDepth", max);
        }
    }

    // ============ 本地函数辅助（供系统调用使用） ============

    /** 栈上全部值，栈底在前 */
    public List<DaoValue> arguments() {
        return new ArrayList<>(stack);
    }

    /**
     * 弹出栈顶并写入 lastResult
     *
     * @throws ControlFlow 栈为空时抛出 {@code StackUnderflow}
     */
    public DaoValue popArgument() {
        if (stack.isEmpty()) throw VmErrors.stackUnderflow();
        return setResult(stack.remove(stack.size() - 1));
    }

    public DaoValue peek() {
        if (stack.isEmpty()) throw VmErrors.stackUnderflow();
        return stack.get(stack.size() - 1);
    }

    public void push(DaoValue value) {
        if (value == null) throw new NullPointerException("value");
        if (limited) {
            int max = securityPolicy.getMaxStackDepth();
            if (max > 0 && stack.size() >= max) {
                throw VmErrors.limitExceeded("maxStackDepth", max);
            }
        }
        stack.add(value);
    }

    /**
     * 要求栈已为空，否则抛出 {@code TooManyArguments}
     */
    public void expectNoArguments(String function) {
        if (!stack.isEmpty()) {
            throw VmErrors.tooManyArguments(function, arguments());
        }
    }

    public DaoValue setResult(DaoValue value) {
        lastResult = value == null ? DaoAtom.NULL : value;
        return lastResult;
    }

    // ============ 访问器 ============

    public DaoValue getLastResult() {
        return lastResult;
    }

    /** 寄存器值，不存在返回 null */
    public DaoValue getRegister(Label label) {
        return registers.get(label);
    }

    public DaoValue getRegister(String label) {
        return getRegister(Label.of(label));
    }

    public void setRegister(Label label, DaoValue value) {
        registers.put(label, value);
    }

    public Map<Label, DaoValue> getRegisters() {
        return Collections.unmodifiableMap(registers);
    }

    /** 栈快照，栈底在前 */
    public List<DaoValue> getStack() {
        return Collections.unmodifiableList(new ArrayList<>(stack));
    }

    public DaoModule getCurrentModule() {
        return currentModule;
    }

    public void setCurrentModule(DaoModule module) {
        this.currentModule = module;
    }

    public Block getCurrentBlock() {
        return currentBlock;
    }

    public int getProgramCounter() {
        return programCounter;
    }

    public long getEvalCounter() {
        return evalCounter;
    }

    public int getCallDepth() {
        return callDepth;
    }

    public ModuleRegistry getRegistry() {
        return registry;
    }

    public DaoSecurityPolicy getSecurityPolicy() {
        return securityPolicy;
    }

    public PrintStream getStdout() {
        return stdout;
    }

    public void setStdout(PrintStream stdout) {
        this.stdout = stdout;
    }

    public PrintStream getStderr() {
        return stderr;
    }

    public void setStderr(PrintStream stderr) {
        this.stderr = stderr;
    }

    // ============ 模块与系统调用 ============

    public void installSystemCall(Address address, SystemCall function) {
        registry.installSystemCall(address, function);
    }

    public DaoModule installModule(Address address, BuiltinModuleBuilder builder) {
        return registry.installBuiltin(address, builder);
    }

    /**
     * @throws DaoRuntimeException 地址已被占用
     */
    public void activateModule(Address address, DaoModule module) {
        try {
            registry.activate(address, module);
        } catch (ControlFlow cf) {
            throw new DaoRuntimeException(cf.getValue());
        }
    }

    public boolean deactivateModule(Address address) {
        return registry.deactivate(address);
    }

    public Map<Address, LoadedModule> modulesUnder(Address prefix) {
        return registry.modulesUnder(prefix);
    }

    // ============ 诊断 ============

    /** 当前块列表、计数器、lastResult、寄存器、跳转表与栈 */
    public String describeState() {
        StringBuilder sb = new StringBuilder();
        sb.append("block:\n");
        for (int i = 0; i < currentBlock.size(); i++) {
            sb.append(i == programCounter ? " -> " : "    ")
              .append(String.format("%4d  ", i)).append(currentBlock.get(i)).append('\n');
        }
        sb.append("programCounter: ").append(programCounter).append('\n');
        sb.append("evalCounter: ").append(evalCounter).append('\n');
        sb.append("lastResult: ").append(lastResult).append('\n');
        sb.append("registers:\n");
        for (Map.Entry<Label, DaoValue> e : new TreeMap<>(registers).entrySet()) {
            sb.append("    ").append(e.getKey()).append(" = ").append(e.getValue()).append('\n');
        }
        sb.append("jumpTable:\n");
        for (Map.Entry<Label, Integer> e : new TreeMap<>(jumpTable).entrySet()) {
            sb.append("    ").append(e.getKey()).append(" -> ").append(e.getValue()).append('\n');
        }
        sb.append("stack (top first):\n");
        for (int i = stack.size() - 1; i >= 0; i--) {
            sb.append("    ").append(stack.get(i)).append('\n');
        }
        return sb.toString();
    }

    ExpressionEvaluator expressions() {
        return expressions;
    }

    FunctionExecutor functions() {
        return functions;
    }
}

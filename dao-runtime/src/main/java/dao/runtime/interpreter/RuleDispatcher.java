package dao.runtime.interpreter;

import com.daolang.ir.code.Block;
import com.daolang.ir.module.DaoModule;
import com.daolang.ir.module.Rule;
import dao.runtime.DaoString;
import dao.runtime.DaoValue;
import dao.runtime.Label;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 规则分派：按声明顺序把输入词序列与模块规则做前缀匹配，执行每一条匹配的动作。
 *
 * <p>匹配后剩余的词以 Str 压栈，首词在栈顶，连续 POP 依次取出；
 * 动作结束后恢复原来的栈。不在第一条匹配处短路，
 * 动作对当前模块 private 的修改在同一次分派内对后续规则可见。</p>
 */
final class RuleDispatcher {

    private final Interpreter interp;

    RuleDispatcher(Interpreter interp) {
        this.interp = interp;
    }

    /**
     * @return 匹配并执行的规则数
     */
    int dispatch(List<String> input, DaoModule module) {
        interp.currentModule = module;
        int matched = 0;
        for (Rule rule : module.getRules()) {
            if (!rule.matches(input)) continue;
            matched++;
            runAction(rule.getAction(), rule.remainder(input));
        }
        return matched;
    }

    private void runAction(Block action, List<String> remainder) {
        ArrayList<DaoValue> savedStack = interp.stack;
        Map<Label, Integer> savedJumps = interp.jumpTable;
        Block savedBlock = interp.currentBlock;
        int savedPc = interp.programCounter;

        ArrayList<DaoValue> tokens = new ArrayList<>(remainder.size());
        for (int i = remainder.size() - 1; i >= 0; i--) {
            tokens.add(DaoString.of(remainder.get(i)));
        }
        interp.stack = tokens;
        interp.enterBlock(action);
        try {
            interp.run();
        } catch (ControlFlow cf) {
            if (!cf.isReturn()) throw cf;
            interp.setResult(cf.getValue());
        } finally {
            interp.stack = savedStack;
            interp.jumpTable = savedJumps;
            interp.currentBlock = savedBlock;
            interp.programCounter = savedPc;
        }
    }
}

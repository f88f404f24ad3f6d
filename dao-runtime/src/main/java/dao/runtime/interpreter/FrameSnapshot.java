package dao.runtime.interpreter;

import com.daolang.ir.code.Block;
import com.daolang.ir.module.DaoModule;
import dao.runtime.DaoValue;
import dao.runtime.Label;

import java.util.ArrayList;
import java.util.Map;

/**
 * 调用方帧快照：寄存器、栈、跳转表、当前块与 pc，以及可选的当前模块。
 *
 * <p>在绑定实参之前捕获，只在被调用方以 RETURN 结束时恢复。
 * CALL 捕获时带上调用方模块，LOCAL 不改变模块因此不带。</p>
 */
final class FrameSnapshot {

    private final Map<Label, DaoValue> registers;
    private final ArrayList<DaoValue> stack;
    private final Map<Label, Integer> jumpTable;
    private final Block block;
    private final int programCounter;
    private final boolean withModule;
    private final DaoModule module;

    private FrameSnapshot(Interpreter interp, boolean withModule) {
        this.registers = interp.registers;
        this.stack = interp.stack;
        this.jumpTable = interp.jumpTable;
        this.block = interp.currentBlock;
        this.programCounter = interp.programCounter;
        this.withModule = withModule;
        this.module = interp.currentModule;
    }

    /**
     * 捕获帧；调用方随后必须为被调用方换上新的寄存器与栈对象
     *
     * @param withModule 恢复时是否一并恢复当前模块
     */
    static FrameSnapshot capture(Interpreter interp, boolean withModule) {
        return new FrameSnapshot(interp, withModule);
    }

    void restore(Interpreter interp) {
        interp.registers = registers;
        interp.stack = stack;
        interp.jumpTable = jumpTable;
        interp.currentBlock = block;
        interp.programCounter = programCounter;
        if (withModule) {
            interp.currentModule = module;
        }
    }
}

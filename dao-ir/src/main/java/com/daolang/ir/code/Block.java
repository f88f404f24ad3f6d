package com.daolang.ir.code;

import dao.runtime.Label;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 指令块：不可变、从 0 开始编号的定长指令数组。长度为 0 的块是合法的空操作。
 */
public final class Block {

    public static final Block EMPTY = new Block(new Instruction[0]);

    private final Instruction[] instructions;

    private Block(Instruction[] instructions) {
        this.instructions = instructions;
    }

    public static Block of(Instruction... instructions) {
        if (instructions.length == 0) return EMPTY;
        Instruction[] copy = instructions.clone();
        for (Instruction inst : copy) {
            if (inst == null) throw new NullPointerException("instruction");
        }
        return new Block(copy);
    }

    public static Block of(List<Instruction> instructions) {
        return of(instructions.toArray(new Instruction[0]));
    }

    public int size() {
        return instructions.length;
    }

    public boolean isEmpty() {
        return instructions.length == 0;
    }

    public Instruction get(int index) {
        return instructions[index];
    }

    public boolean inRange(int pc) {
        return pc >= 0 && pc < instructions.length;
    }

    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(Arrays.asList(instructions));
    }

    /**
     * 由块内每条 SET_JUMP 构造跳转表：标签 → 该指令下标。同名标签以最后一条为准。
     */
    public Map<Label, Integer> jumpTargets() {
        Map<Label, Integer> table = new HashMap<>();
        for (int i = 0; i < instructions.length; i++) {
            if (instructions[i].getOp() == OpCode.SET_JUMP) {
                table.put(instructions[i].getLabel(), i);
            }
        }
        return table;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        return Arrays.equals(instructions, ((Block) o).instructions);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(instructions);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < instructions.length; i++) {
            sb.append(String.format("%4d  ", i)).append(instructions[i]).append('\n');
        }
        return sb.toString();
    }
}

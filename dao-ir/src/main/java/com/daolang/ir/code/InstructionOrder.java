package com.daolang.ir.code;

import dao.runtime.DaoValue;

import java.util.List;

/**
 * 指令的结构全序，与各类的 equals 一致。
 *
 * <p>逐字段比较：操作码、取值、标签、表达式、条件；缺省字段排在前面。
 * 常量按 {@link DaoValue#compareTo} 比较，因此函数值可以作为有序键。</p>
 */
final class InstructionOrder {

    private InstructionOrder() {}

    static int compareBlocks(Block a, Block b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compareInstructions(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    static int compareInstructions(Instruction a, Instruction b) {
        if (a == b) return 0;
        int c = a.getOp().compareTo(b.getOp());
        if (c != 0) return c;
        c = compareLookups(a.getLookup(), b.getLookup());
        if (c != 0) return c;
        c = compareNullable(a.getLabel(), b.getLabel());
        if (c != 0) return c;
        c = compareExpressions(a.getExpression(), b.getExpression());
        if (c != 0) return c;
        return compareConditions(a.getCondition(), b.getCondition());
    }

    static int compareLookups(Lookup a, Lookup b) {
        if (a == b) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        int c = a.getKind().compareTo(b.getKind());
        if (c != 0) return c;
        c = compareNullable(a.getConstant(), b.getConstant());
        if (c != 0) return c;
        c = compareNullable(a.getAddress(), b.getAddress());
        if (c != 0) return c;
        return compareNullable(a.getLabel(), b.getLabel());
    }

    private static int compareExpressions(Expression a, Expression b) {
        if (a == b) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        int c = a.getOp().compareTo(b.getOp());
        if (c != 0) return c;
        c = Boolean.compare(a.isForwardStack(), b.isForwardStack());
        if (c != 0) return c;
        c = compareNullable(a.getAddress(), b.getAddress());
        if (c != 0) return c;
        c = compareLookups(a.getTarget(), b.getTarget());
        if (c != 0) return c;
        return compareOperands(a.getOperands(), b.getOperands());
    }

    private static int compareOperands(List<Lookup> a, List<Lookup> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compareLookups(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private static int compareConditions(Condition a, Condition b) {
        if (a == b) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        int c = a.getKind().compareTo(b.getKind());
        if (c != 0) return c;
        c = compareLookups(a.getTest(), b.getTest());
        if (c != 0) return c;
        return compareInstructions(a.getCommand(), b.getCommand());
    }

    // Label、Address、DaoValue 都自然有序
    private static <T extends Comparable<? super T>> int compareNullable(T a, T b) {
        if (a == b) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        return a.compareTo(b);
    }
}

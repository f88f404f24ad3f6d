package com.daolang.ir.code;

/**
 * 表达式运算符。
 */
public enum ExprOp {
    // 一元
    TAKE(1), NOT(1), SIZE(1),

    // 算术
    ADD(2), SUB(2), MUL(2), DIV(2), MOD(2),

    // 下标
    INDEX(2),

    // 比较
    GT(2), GE(2), LT(2), LE(2), EQ(2), NE(2),

    APPEND(2),

    // 位运算
    AND(2), OR(2), XOR(2), SHIFT_R(2), SHIFT_L(2),

    // 三元
    IF(3), IF_NOT(3),

    // 调用，参数个数可变
    SYS(-1), CALL(-1), LOCAL(-1), GOTO(-1);

    private final int arity;

    ExprOp(int arity) {
        this.arity = arity;
    }

    /** 操作数个数，-1 表示调用类 */
    public int getArity() {
        return arity;
    }

    public boolean isInvocation() {
        return arity < 0;
    }
}

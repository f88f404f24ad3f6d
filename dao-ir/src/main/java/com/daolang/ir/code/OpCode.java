package com.daolang.ir.code;

/**
 * 命令操作码。
 */
public enum OpCode {
    LOAD,           // lastResult = lookup
    STORE,          // registers[label] = lastResult
    UPDATE,         // currentModule.private[label] = lookup
    SET_JUMP,       // 跳转目标，执行时无操作
    JUMP,           // pc = jumpTable[label]
    PUSH,           // stack.push(lookup)
    PEEK,           // lastResult = stack.top
    POP,            // lastResult = stack.pop
    CLEAR_FORWARD,  // lastResult = List(stack)，按入栈顺序
    CLEAR_REVERSE,  // lastResult = List(stack)，按出栈顺序
    EVAL,           // lastResult = expression
    DO,             // 条件命令
    RETURN,         // 抛出 Return 信号
    THROW           // 抛出 Error 信号
}

package com.daolang.ir.code;

import dao.runtime.Label;

import java.util.Objects;

/**
 * 命令：操作码加操作数，纯数据。
 *
 * <p>字段随操作码使用：{@code lookup} 供 LOAD/UPDATE/PUSH/RETURN/THROW，
 * {@code label} 供 STORE/UPDATE/SET_JUMP/JUMP，{@code expression} 供 EVAL，
 * {@code condition} 供 DO。</p>
 */
public final class Instruction {

    private static final Instruction PEEK = new Instruction(OpCode.PEEK, null, null, null, null);
    private static final Instruction POP = new Instruction(OpCode.POP, null, null, null, null);
    private static final Instruction CLEAR_FORWARD = new Instruction(OpCode.CLEAR_FORWARD, null, null, null, null);
    private static final Instruction CLEAR_REVERSE = new Instruction(OpCode.CLEAR_REVERSE, null, null, null, null);

    private final OpCode op;
    private final Lookup lookup;
    private final Label label;
    private final Expression expression;
    private final Condition condition;

    private Instruction(OpCode op, Lookup lookup, Label label, Expression expression, Condition condition) {
        this.op = op;
        this.lookup = lookup;
        this.label = label;
        this.expression = expression;
        this.condition = condition;
    }

    // ============ 工厂方法 ============

    public static Instruction load(Lookup lookup) {
        return new Instruction(OpCode.LOAD, Objects.requireNonNull(lookup), null, null, null);
    }

    public static Instruction store(Label label) {
        return new Instruction(OpCode.STORE, null, Objects.requireNonNull(label), null, null);
    }

    public static Instruction store(String label) {
        return store(Label.of(label));
    }

    public static Instruction update(Lookup lookup, Label label) {
        return new Instruction(OpCode.UPDATE, Objects.requireNonNull(lookup), Objects.requireNonNull(label), null, null);
    }

    public static Instruction setJump(Label label) {
        return new Instruction(OpCode.SET_JUMP, null, Objects.requireNonNull(label), null, null);
    }

    public static Instruction setJump(String label) {
        return setJump(Label.of(label));
    }

    public static Instruction jump(Label label) {
        return new Instruction(OpCode.JUMP, null, Objects.requireNonNull(label), null, null);
    }

    public static Instruction jump(String label) {
        return jump(Label.of(label));
    }

    public static Instruction push(Lookup lookup) {
        return new Instruction(OpCode.PUSH, Objects.requireNonNull(lookup), null, null, null);
    }

    public static Instruction peek() {
        return PEEK;
    }

    public static Instruction pop() {
        return POP;
    }

    public static Instruction clearForward() {
        return CLEAR_FORWARD;
    }

    public static Instruction clearReverse() {
        return CLEAR_REVERSE;
    }

    public static Instruction eval(Expression expression) {
        return new Instruction(OpCode.EVAL, null, null, Objects.requireNonNull(expression), null);
    }

    public static Instruction when(Lookup test, Instruction command) {
        return new Instruction(OpCode.DO, null, null, null, Condition.when(test, command));
    }

    public static Instruction unless(Lookup test, Instruction command) {
        return new Instruction(OpCode.DO, null, null, null, Condition.unless(test, command));
    }

    public static Instruction returnWith(Lookup lookup) {
        return new Instruction(OpCode.RETURN, Objects.requireNonNull(lookup), null, null, null);
    }

    public static Instruction throwWith(Lookup lookup) {
        return new Instruction(OpCode.THROW, Objects.requireNonNull(lookup), null, null, null);
    }

    // ============ 访问器 ============

    public OpCode getOp() {
        return op;
    }

    public Lookup getLookup() {
        return lookup;
    }

    public Label getLabel() {
        return label;
    }

    public Expression getExpression() {
        return expression;
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction other = (Instruction) o;
        return op == other.op
                && Objects.equals(lookup, other.lookup)
                && Objects.equals(label, other.label)
                && Objects.equals(expression, other.expression)
                && Objects.equals(condition, other.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, lookup, label, expression, condition);
    }

    @Override
    public String toString() {
        switch (op) {
            case LOAD:
            case PUSH:
            case RETURN:
            case THROW:
                return op + " (" + lookup + ")";
            case STORE:
            case SET_JUMP:
            case JUMP:
                return op + " " + label;
            case UPDATE:
                return op + " (" + lookup + ") " + label;
            case EVAL:
                return op + " (" + expression + ")";
            case DO:
                return op + " (" + condition + ")";
            default:
                return op.name();
        }
    }
}

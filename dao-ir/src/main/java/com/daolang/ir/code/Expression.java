package com.daolang.ir.code;

import dao.runtime.Address;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code EVAL} 命令的表达式。
 *
 * <p>运算符类表达式的操作数在 {@link #getOperands()} 中；调用类表达式
 * ({@code SYS}/{@code CALL}/{@code LOCAL}/{@code GOTO}) 的显式参数也在其中，
 * 目标地址与目标函数分别在 {@link #getAddress()} 与 {@link #getTarget()}。</p>
 */
public final class Expression {

    private final ExprOp op;
    private final List<Lookup> operands;
    private final Address address;
    private final Lookup target;
    private final boolean forwardStack;

    private Expression(ExprOp op, List<Lookup> operands, Address address, Lookup target, boolean forwardStack) {
        this.op = op;
        this.operands = operands;
        this.address = address;
        this.target = target;
        this.forwardStack = forwardStack;
    }

    // ============ 运算符 ============

    public static Expression unary(ExprOp op, Lookup a) {
        checkArity(op, 1);
        return new Expression(op, Collections.singletonList(a), null, null, false);
    }

    public static Expression binary(ExprOp op, Lookup a, Lookup b) {
        checkArity(op, 2);
        return new Expression(op, Collections.unmodifiableList(Arrays.asList(a, b)), null, null, false);
    }

    /** {@code IF}/{@code IF_NOT}：条件、真分支、假分支 */
    public static Expression ternary(ExprOp op, Lookup cond, Lookup then, Lookup otherwise) {
        checkArity(op, 3);
        return new Expression(op, Collections.unmodifiableList(Arrays.asList(cond, then, otherwise)), null, null, false);
    }

    public static Expression take(Lookup a) {
        return unary(ExprOp.TAKE, a);
    }

    // ============ 调用 ============

    public static Expression sys(Address address, Lookup... args) {
        return new Expression(ExprOp.SYS, copy(args), address, null, false);
    }

    /**
     * 以当前栈原样作为参数的系统调用，用于内建模块的合成方法
     */
    public static Expression sysForwardingStack(Address address) {
        return new Expression(ExprOp.SYS, Collections.<Lookup>emptyList(), address, null, true);
    }

    public static Expression call(Address module, Lookup target, Lookup... args) {
        return new Expression(ExprOp.CALL, copy(args), module, target, false);
    }

    public static Expression local(Lookup target, Lookup... args) {
        return new Expression(ExprOp.LOCAL, copy(args), null, target, false);
    }

    public static Expression goTo(Lookup target, Lookup... args) {
        return new Expression(ExprOp.GOTO, copy(args), null, target, false);
    }

    private static List<Lookup> copy(Lookup[] args) {
        return args.length == 0 ? Collections.<Lookup>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args)));
    }

    private static void checkArity(ExprOp op, int arity) {
        if (op.getArity() != arity) {
            throw new IllegalArgumentException(op + " takes " + op.getArity() + " operands, not " + arity);
        }
    }

    // ============ 访问器 ============

    public ExprOp getOp() {
        return op;
    }

    public List<Lookup> getOperands() {
        return operands;
    }

    public Lookup getOperand(int i) {
        return operands.get(i);
    }

    public Address getAddress() {
        return address;
    }

    public Lookup getTarget() {
        return target;
    }

    public boolean isForwardStack() {
        return forwardStack;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expression)) return false;
        Expression other = (Expression) o;
        return op == other.op && forwardStack == other.forwardStack
                && operands.equals(other.operands)
                && Objects.equals(address, other.address)
                && Objects.equals(target, other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, operands, address, target, forwardStack);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(op.name());
        if (address != null) sb.append(' ').append(address);
        if (target != null) sb.append(" (").append(target).append(')');
        if (forwardStack) sb.append(" <stack>");
        for (Lookup l : operands) {
            sb.append(" (").append(l).append(')');
        }
        return sb.toString();
    }
}

package com.daolang.ir.code;

import dao.runtime.Address;
import dao.runtime.DaoValue;
import dao.runtime.Label;

/**
 * 取值操作数。只读，不修改任何状态。
 */
public final class Lookup {

    public enum Kind {
        /** 读 lastResult */
        RESULT,
        /** 常量 */
        CONST,
        /** 读寄存器 */
        VAR,
        /** 读当前模块的 private，再读 public */
        DEREF,
        /** 按地址解析模块后读其 public */
        QUALIFIED
    }

    private static final Lookup RESULT = new Lookup(Kind.RESULT, null, null, null);

    private final Kind kind;
    private final DaoValue constant;
    private final Address address;
    private final Label label;

    private Lookup(Kind kind, DaoValue constant, Address address, Label label) {
        this.kind = kind;
        this.constant = constant;
        this.address = address;
        this.label = label;
    }

    // ============ 工厂方法 ============

    public static Lookup result() {
        return RESULT;
    }

    public static Lookup constant(DaoValue value) {
        if (value == null) throw new NullPointerException("value");
        return new Lookup(Kind.CONST, value, null, null);
    }

    public static Lookup var(Label label) {
        return new Lookup(Kind.VAR, null, null, label);
    }

    public static Lookup var(String label) {
        return var(Label.of(label));
    }

    public static Lookup deref(Label label) {
        return new Lookup(Kind.DEREF, null, null, label);
    }

    public static Lookup deref(String label) {
        return deref(Label.of(label));
    }

    public static Lookup qualified(Address address, Label label) {
        return new Lookup(Kind.QUALIFIED, null, address, label);
    }

    public static Lookup qualified(String address, String label) {
        return qualified(Address.parse(address), Label.of(label));
    }

    public Kind getKind() {
        return kind;
    }

    public DaoValue getConstant() {
        return constant;
    }

    public Address getAddress() {
        return address;
    }

    public Label getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Lookup)) return false;
        Lookup other = (Lookup) o;
        return kind == other.kind
                && java.util.Objects.equals(constant, other.constant)
                && java.util.Objects.equals(address, other.address)
                && java.util.Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(kind, constant, address, label);
    }

    @Override
    public String toString() {
        switch (kind) {
            case RESULT:    return "RESULT";
            case CONST:     return "CONST " + constant;
            case VAR:       return "VAR " + label;
            case DEREF:     return "DEREF " + label;
            case QUALIFIED: return "LOOKUP " + address + " " + label;
            default:        return kind.name();
        }
    }
}

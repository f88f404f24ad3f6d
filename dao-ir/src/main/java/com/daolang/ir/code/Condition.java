package com.daolang.ir.code;

/**
 * 条件命令：{@code WHEN} 在条件非 Null 时执行命令，{@code UNLESS} 在条件为 Null 时执行。
 */
public final class Condition {

    public enum Kind { WHEN, UNLESS }

    private final Kind kind;
    private final Lookup test;
    private final Instruction command;

    private Condition(Kind kind, Lookup test, Instruction command) {
        if (test == null || command == null) throw new NullPointerException();
        this.kind = kind;
        this.test = test;
        this.command = command;
    }

    public static Condition when(Lookup test, Instruction command) {
        return new Condition(Kind.WHEN, test, command);
    }

    public static Condition unless(Lookup test, Instruction command) {
        return new Condition(Kind.UNLESS, test, command);
    }

    public Kind getKind() {
        return kind;
    }

    public Lookup getTest() {
        return test;
    }

    public Instruction getCommand() {
        return command;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Condition)) return false;
        Condition other = (Condition) o;
        return kind == other.kind && test.equals(other.test) && command.equals(other.command);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(kind, test, command);
    }

    @Override
    public String toString() {
        return kind + " (" + test + ") " + command;
    }
}

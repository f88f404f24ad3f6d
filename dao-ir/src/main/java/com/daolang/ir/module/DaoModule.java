package com.daolang.ir.module;

import dao.runtime.Address;
import dao.runtime.DaoValue;
import dao.runtime.Label;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 模块：导入列表、私有与公开命名空间、规则列表。不可变。
 *
 * <p>{@code private} 保存内部状态，只由 UPDATE 修改（通过 {@link #withPrivate} 产生副本）；
 * {@code public} 保存导出绑定，通常是函数，外部经限定查找访问。</p>
 */
public final class DaoModule {

    public static final DaoModule EMPTY = builder().build();

    private final List<Address> imports;
    private final SortedMap<Label, DaoValue> privateVars;
    private final SortedMap<Label, DaoValue> publicVars;
    private final List<Rule> rules;

    private DaoModule(List<Address> imports, SortedMap<Label, DaoValue> privateVars,
                      SortedMap<Label, DaoValue> publicVars, List<Rule> rules) {
        this.imports = imports;
        this.privateVars = privateVars;
        this.publicVars = publicVars;
        this.rules = rules;
    }

    public List<Address> getImports() {
        return imports;
    }

    public SortedMap<Label, DaoValue> getPrivate() {
        return privateVars;
    }

    public SortedMap<Label, DaoValue> getPublic() {
        return publicVars;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public DaoValue lookupPrivate(Label label) {
        return privateVars.get(label);
    }

    public DaoValue lookupPublic(Label label) {
        return publicVars.get(label);
    }

    /** 返回 private[label] 替换后的副本 */
    public DaoModule withPrivate(Label label, DaoValue value) {
        TreeMap<Label, DaoValue> copy = new TreeMap<>(privateVars);
        copy.put(label, value);
        return new DaoModule(imports, Collections.unmodifiableSortedMap(copy), publicVars, rules);
    }

    /** 返回 public[label] 替换后的副本 */
    public DaoModule withPublic(Label label, DaoValue value) {
        TreeMap<Label, DaoValue> copy = new TreeMap<>(publicVars);
        copy.put(label, value);
        return new DaoModule(imports, privateVars, Collections.unmodifiableSortedMap(copy), rules);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.imports.addAll(imports);
        b.privateVars.putAll(privateVars);
        b.publicVars.putAll(publicVars);
        b.rules.addAll(rules);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DaoModule)) return false;
        DaoModule other = (DaoModule) o;
        return imports.equals(other.imports) && privateVars.equals(other.privateVars)
                && publicVars.equals(other.publicVars) && rules.equals(other.rules);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(imports, privateVars, publicVars, rules);
    }

    @Override
    public String toString() {
        return "module{imports=" + imports + ", private=" + privateVars.keySet()
                + ", public=" + publicVars.keySet() + ", rules=" + rules.size() + "}";
    }

    // ============ Builder ============

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Address> imports = new ArrayList<>();
        private final TreeMap<Label, DaoValue> privateVars = new TreeMap<>();
        private final TreeMap<Label, DaoValue> publicVars = new TreeMap<>();
        private final List<Rule> rules = new ArrayList<>();

        Builder() {
        }

        public Builder importModule(Address address) {
            imports.add(address);
            return this;
        }

        public Builder privateVar(Label label, DaoValue value) {
            privateVars.put(label, value);
            return this;
        }

        public Builder privateVar(String label, DaoValue value) {
            return privateVar(Label.of(label), value);
        }

        public Builder publicVar(Label label, DaoValue value) {
            publicVars.put(label, value);
            return this;
        }

        public Builder publicVar(String label, DaoValue value) {
            return publicVar(Label.of(label), value);
        }

        public Builder rule(Rule rule) {
            rules.add(rule);
            return this;
        }

        public DaoModule build() {
            return new DaoModule(
                    Collections.unmodifiableList(new ArrayList<>(imports)),
                    Collections.unmodifiableSortedMap(new TreeMap<>(privateVars)),
                    Collections.unmodifiableSortedMap(new TreeMap<>(publicVars)),
                    Collections.unmodifiableList(new ArrayList<>(rules)));
        }
    }
}

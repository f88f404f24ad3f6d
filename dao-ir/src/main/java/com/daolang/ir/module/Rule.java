package com.daolang.ir.module;

import com.daolang.ir.code.Block;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 规则：词序列前缀模式 + 动作块。
 *
 * <p>当模式是输入词序列的前缀时匹配，剩余部分交给动作处理。</p>
 */
public final class Rule {

    private final List<String> pattern;
    private final Block action;

    public Rule(List<String> pattern, Block action) {
        if (action == null) throw new NullPointerException("action");
        this.pattern = Collections.unmodifiableList(new ArrayList<>(pattern));
        this.action = action;
    }

    public static Rule of(Block action, String... pattern) {
        return new Rule(Arrays.asList(pattern), action);
    }

    public List<String> getPattern() {
        return pattern;
    }

    public Block getAction() {
        return action;
    }

    public boolean matches(List<String> input) {
        if (pattern.size() > input.size()) return false;
        for (int i = 0; i < pattern.size(); i++) {
            if (!pattern.get(i).equals(input.get(i))) return false;
        }
        return true;
    }

    /** 去掉已匹配前缀后的剩余输入，调用前须先 {@link #matches} */
    public List<String> remainder(List<String> input) {
        return input.subList(pattern.size(), input.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rule)) return false;
        Rule other = (Rule) o;
        return pattern.equals(other.pattern) && action.equals(other.action);
    }

    @Override
    public int hashCode() {
        return 31 * pattern.hashCode() + action.hashCode();
    }

    @Override
    public String toString() {
        return "rule " + pattern;
    }
}

package com.daolang.ir.code;

import dao.runtime.DaoValue;
import dao.runtime.Label;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数值：参数标签列表 + 函数体。
 *
 * <p>不捕获环境，调用时由实参重新建立寄存器。</p>
 */
public final class DaoFunc extends DaoValue {

    private final List<Label> params;
    private final Block body;

    private DaoFunc(List<Label> params, Block body) {
        this.params = params;
        this.body = body;
    }

    public static DaoFunc of(List<Label> params, Block body) {
        if (body == null) throw new NullPointerException("body");
        return new DaoFunc(Collections.unmodifiableList(new ArrayList<>(params)), body);
    }

    public static DaoFunc of(Block body, String... params) {
        List<Label> labels = new ArrayList<>(params.length);
        for (String p : params) {
            labels.add(Label.of(p));
        }
        return of(labels, body);
    }

    public List<Label> getParams() {
        return params;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public String getTypeName() {
        return "Func";
    }

    @Override
    protected int typeRank() {
        return RANK_FUNC;
    }

    @Override
    protected int compareSameType(DaoValue other) {
        DaoFunc o = (DaoFunc) other;
        int n = Math.min(params.size(), o.params.size());
        for (int i = 0; i < n; i++) {
            int c = params.get(i).compareTo(o.params.get(i));
            if (c != 0) return c;
        }
        int c = Integer.compare(params.size(), o.params.size());
        if (c != 0) return c;
        c = Integer.compare(body.size(), o.body.size());
        if (c != 0) return c;
        return InstructionOrder.compareBlocks(body, o.body);
    }

    @Override
    public int hashCode() {
        return 31 * params.hashCode() + body.size();
    }

    @Override
    public String toString() {
        return "func(" + joinParams() + ") {" + body.size() + " instructions}";
    }

    private String joinParams() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i));
        }
        return sb.toString();
    }
}

package dao.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 定长有序列表
 *
 * <p>"没有列表"与"空列表"不可区分，统一由 {@link #EMPTY} 表示，长度为 0。
 * 排序时先比较长度，再逐个比较元素。</p>
 */
public final class DaoList extends DaoValue {

    public static final DaoList EMPTY = new DaoList(Collections.<DaoValue>emptyList());

    private final List<DaoValue> elements;

    private DaoList(List<DaoValue> elements) {
        this.elements = elements;
    }

    public static DaoList of(DaoValue... elements) {
        return of(Arrays.asList(elements));
    }

    public static DaoList of(List<? extends DaoValue> elements) {
        if (elements == null || elements.isEmpty()) return EMPTY;
        for (DaoValue v : elements) {
            if (v == null) throw new NullPointerException("list element");
        }
        return new DaoList(Collections.unmodifiableList(new ArrayList<DaoValue>(elements)));
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /** 越界返回 null */
    public DaoValue get(long index) {
        if (index < 0 || index >= elements.size()) return null;
        return elements.get((int) index);
    }

    public List<DaoValue> getElements() {
        return elements;
    }

    /** 拼接两个列表 */
    public DaoList concat(DaoList other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<DaoValue> all = new ArrayList<>(elements.size() + other.elements.size());
        all.addAll(elements);
        all.addAll(other.elements);
        return new DaoList(Collections.unmodifiableList(all));
    }

    @Override
    public String getTypeName() {
        return "List";
    }

    @Override
    protected int typeRank() {
        return RANK_LIST;
    }

    @Override
    protected int compareSameType(DaoValue other) {
        List<DaoValue> o = ((DaoList) other).elements;
        int c = Integer.compare(elements.size(), o.size());
        if (c != 0) return c;
        for (int i = 0; i < elements.size(); i++) {
            c = elements.get(i).compareTo(o.get(i));
            if (c != 0) return c;
        }
        return 0;
    }

    @Override
    public DaoList asList() {
        return this;
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i).toDisplayString());
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}

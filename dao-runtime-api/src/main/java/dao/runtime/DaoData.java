package dao.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 带地址标签的记录：标签 + (Label → Value) 字段表，键唯一。
 *
 * <p>表示类型为 {@code tag} 的构造实例，错误值也以此形式表示。
 * 排序先比较标签，再按字段顺序比较。</p>
 */
public final class DaoData extends DaoValue {

    private final Address tag;
    private final SortedMap<Label, DaoValue> fields;

    private DaoData(Address tag, SortedMap<Label, DaoValue> fields) {
        this.tag = tag;
        this.fields = fields;
    }

    public static DaoData of(Address tag, Map<Label, ? extends DaoValue> fields) {
        if (tag == null) throw new NullPointerException("tag");
        return new DaoData(tag, Collections.unmodifiableSortedMap(new TreeMap<Label, DaoValue>(fields)));
    }

    /**
     * 以交替的键值对构造，键可以是 {@link Label} 或标签文本，值经 {@link DaoValue#fromJava} 转换
     *
     * <pre>
     * DaoData.of(Address.parse("point.Point"), "x", 1L, "y", 2L)
     * </pre>
     */
    public static DaoData of(Address tag, Object... keyValues) {
        if (tag == null) throw new NullPointerException("tag");
        return new DaoData(tag, Collections.unmodifiableSortedMap(fieldMap(keyValues)));
    }

    public static DaoData of(String tag, Object... keyValues) {
        return of(Address.parse(tag), keyValues);
    }

    public Address getTag() {
        return tag;
    }

    public SortedMap<Label, DaoValue> getFields() {
        return fields;
    }

    public DaoValue get(Label label) {
        return fields.get(label);
    }

    public DaoValue get(String label) {
        return Label.isValid(label) ? fields.get(Label.of(label)) : null;
    }

    /** 返回替换（或新增）一个字段后的副本 */
    public DaoData with(Label label, DaoValue value) {
        TreeMap<Label, DaoValue> copy = new TreeMap<>(fields);
        copy.put(label, value);
        return new DaoData(tag, Collections.unmodifiableSortedMap(copy));
    }

    @Override
    public String getTypeName() {
        return "Data";
    }

    @Override
    protected int typeRank() {
        return RANK_DATA;
    }

    @Override
    protected int compareSameType(DaoValue other) {
        DaoData o = (DaoData) other;
        int c = tag.compareTo(o.tag);
        return c != 0 ? c : compareFields(fields, o.fields);
    }

    @Override
    public DaoData asData() {
        return this;
    }

    @Override
    public DaoValue member(Label label) {
        return fields.get(label);
    }

    @Override
    public int hashCode() {
        return 31 * tag.hashCode() + fields.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(tag.toString()).append('{');
        boolean first = true;
        for (Map.Entry<Label, DaoValue> e : fields.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(e.getKey()).append(": ").append(e.getValue());
        }
        return sb.append('}').toString();
    }
}

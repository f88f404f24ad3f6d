package dao.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Dao 运行时值的基类
 *
 * <p>变体：Null、True、Int、Float、Str、Pointer、List、Data、Func。
 * 相等与排序都是结构化的全序，因此任何值都可以作为有序映射的键。
 * 不同变体之间按 Null &lt; True &lt; Int &lt; Float &lt; Str &lt; Pointer &lt; List &lt; Data &lt; Func 排序。</p>
 *
 * <p>{@code asXxx} 系列是部分转换：形状匹配时返回对应值，否则返回 {@code null} 表示"不适用"。</p>
 */
public abstract class DaoValue implements Comparable<DaoValue> {

    // 变体排序序号
    protected static final int RANK_NULL = 0;
    protected static final int RANK_TRUE = 1;
    protected static final int RANK_INT = 2;
    protected static final int RANK_FLOAT = 3;
    protected static final int RANK_STR = 4;
    protected static final int RANK_POINTER = 5;
    protected static final int RANK_LIST = 6;
    protected static final int RANK_DATA = 7;
    protected static final int RANK_FUNC = 8;

    /**
     * 将 Java 值转换为 DaoValue
     *
     * <p>null / false 映射为 Null，true 为 True，整数为 Int，浮点为 Float，
     * 字符串为 Str，{@link Address} 为 Pointer，List 逐项转换为 List。</p>
     */
    public static DaoValue fromJava(Object javaValue) {
        if (javaValue == null) return DaoAtom.NULL;
        if (javaValue instanceof DaoValue) return (DaoValue) javaValue;
        if (javaValue instanceof Boolean) return DaoAtom.of((Boolean) javaValue);
        if (javaValue instanceof Integer || javaValue instanceof Long
                || javaValue instanceof Short || javaValue instanceof Byte) {
            return DaoInt.of(((Number) javaValue).longValue());
        }
        if (javaValue instanceof Double || javaValue instanceof Float) {
            return DaoFloat.of(((Number) javaValue).doubleValue());
        }
        if (javaValue instanceof CharSequence) return DaoString.of(javaValue.toString());
        if (javaValue instanceof Address) return DaoPointer.of((Address) javaValue);
        if (javaValue instanceof List) {
            List<DaoValue> items = new ArrayList<>();
            for (Object item : (List<?>) javaValue) {
                items.add(fromJava(item));
            }
            return DaoList.of(items);
        }
        throw new DaoException("Cannot convert " + javaValue.getClass().getName() + " to a Dao value");
    }

    /** 类型名，用于诊断输出 */
    public abstract String getTypeName();

    /** 变体排序序号 */
    protected abstract int typeRank();

    /** 同一变体之间的比较，调用时 {@code other} 的序号与本值相同 */
    protected abstract int compareSameType(DaoValue other);

    // ============ 谓词 ============

    /** 除 Null 外都为真 */
    public boolean isTruthy() {
        return true;
    }

    public boolean isNull() {
        return false;
    }

    public boolean isTrue() {
        return false;
    }

    // ============ 部分转换 ============

    public DaoInt asInt() {
        return null;
    }

    public DaoFloat asFloat() {
        return null;
    }

    /** Null 为 FALSE，True 为 TRUE，其余不可转换 */
    public Boolean asBool() {
        return null;
    }

    public DaoString asStr() {
        return null;
    }

    public DaoPointer asPointer() {
        return null;
    }

    public DaoList asList() {
        return null;
    }

    public DaoData asData() {
        return null;
    }

    /** 仅当本值是标签为 {@code tag} 的 Data 时返回 */
    public DaoData asData(Address tag) {
        DaoData data = asData();
        return data != null && data.getTag().equals(tag) ? data : null;
    }

    /** 读取 Data 字段，非 Data 或字段不存在时返回 null */
    public DaoValue member(Label label) {
        return null;
    }

    // ============ 比较与显示 ============

    @Override
    public final int compareTo(DaoValue other) {
        int c = Integer.compare(typeRank(), other.typeRank());
        return c != 0 ? c : compareSameType(other);
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DaoValue)) return false;
        return compareTo((DaoValue) o) == 0;
    }

    @Override
    public abstract int hashCode();

    /** 打印形式：Null 为 FALSE，True 为 TRUE，字符串不带引号 */
    public String toDisplayString() {
        return toString();
    }

    /** 字段表辅助：以字符串为键构造有序映射 */
    static TreeMap<Label, DaoValue> fieldMap(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        TreeMap<Label, DaoValue> map = new TreeMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object key = keyValues[i];
            Label label = key instanceof Label ? (Label) key : Label.of(String.valueOf(key));
            map.put(label, fromJava(keyValues[i + 1]));
        }
        return map;
    }

    static int compareFields(Map<Label, DaoValue> a, Map<Label, DaoValue> b) {
        java.util.Iterator<Map.Entry<Label, DaoValue>> ia = a.entrySet().iterator();
        java.util.Iterator<Map.Entry<Label, DaoValue>> ib = b.entrySet().iterator();
        while (ia.hasNext() && ib.hasNext()) {
            Map.Entry<Label, DaoValue> ea = ia.next();
            Map.Entry<Label, DaoValue> eb = ib.next();
            int c = ea.getKey().compareTo(eb.getKey());
            if (c != 0) return c;
            c = ea.getValue().compareTo(eb.getValue());
            if (c != 0) return c;
        }
        return Boolean.compare(ia.hasNext(), ib.hasNext());
    }
}

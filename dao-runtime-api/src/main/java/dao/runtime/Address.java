package dao.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 地址：非空的标签序列，文本形式以点号连接，例如 {@code math.add}。
 *
 * <p>用作模块、系统调用与数据构造标签的键。按标签序列字典序排序。</p>
 */
public final class Address implements Comparable<Address> {

    private final List<Label> labels;

    private Address(List<Label> labels) {
        this.labels = labels;
    }

    // ============ 工厂方法 ============

    public static Address of(Label first, Label... rest) {
        List<Label> list = new ArrayList<>(rest.length + 1);
        list.add(first);
        list.addAll(Arrays.asList(rest));
        return new Address(Collections.unmodifiableList(list));
    }

    public static Address of(List<Label> labels) {
        if (labels == null || labels.isEmpty()) {
            throw new AddressFormatException(AddressFormatException.Target.ADDRESS, "empty address", "");
        }
        return new Address(Collections.unmodifiableList(new ArrayList<>(labels)));
    }

    /** 由若干标签文本构造，每段必须是合法标签 */
    public static Address of(String first, String... rest) {
        List<Label> list = new ArrayList<>(rest.length + 1);
        list.add(Label.of(first));
        for (String s : rest) {
            list.add(Label.of(s));
        }
        return new Address(Collections.unmodifiableList(list));
    }

    /**
     * 解析点号连接的地址文本
     *
     * @throws AddressFormatException 空文本、空段或非法标签
     */
    public static Address parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new AddressFormatException(AddressFormatException.Target.ADDRESS, "empty address", text);
        }
        List<Label> list = new ArrayList<>();
        int start = 0;
        while (true) {
            int dot = text.indexOf('.', start);
            String part = dot < 0 ? text.substring(start) : text.substring(start, dot);
            String problem = Label.check(part);
            if (problem != null) {
                throw new AddressFormatException(AddressFormatException.Target.ADDRESS,
                        "component " + (list.size() + 1) + ": " + problem, text);
            }
            list.add(Label.of(part));
            if (dot < 0) break;
            start = dot + 1;
        }
        return new Address(Collections.unmodifiableList(list));
    }

    // ============ 查询 ============

    public List<Label> getLabels() {
        return labels;
    }

    public int size() {
        return labels.size();
    }

    public Label first() {
        return labels.get(0);
    }

    public Label last() {
        return labels.get(labels.size() - 1);
    }

    /** 在末尾追加一个标签，返回新地址 */
    public Address append(Label label) {
        List<Label> list = new ArrayList<>(labels);
        list.add(label);
        return new Address(Collections.unmodifiableList(list));
    }

    public boolean startsWith(Address prefix) {
        if (prefix.labels.size() > labels.size()) return false;
        return labels.subList(0, prefix.labels.size()).equals(prefix.labels);
    }

    @Override
    public int compareTo(Address other) {
        int n = Math.min(labels.size(), other.labels.size());
        for (int i = 0; i < n; i++) {
            int c = labels.get(i).compareTo(other.labels.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(labels.size(), other.labels.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        return labels.equals(((Address) o).labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0) sb.append('.');
            sb.append(labels.get(i).getName());
        }
        return sb.toString();
    }
}

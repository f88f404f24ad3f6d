package dao.runtime.interpreter;

import dao.runtime.Address;
import dao.runtime.Label;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 以标签序列为键的前缀树。
 *
 * <p>支持按完整地址查找与插入、按前缀整体删除、按前缀列举。
 * 遍历顺序为标签字典序。非线程安全。</p>
 */
final class LabelTrie<V> {

    private static final class Node<V> {
        V value;
        final TreeMap<Label, Node<V>> children = new TreeMap<>();

        boolean isEmpty() {
            return value == null && children.isEmpty();
        }
    }

    private final Node<V> root = new Node<>();
    private int size;

    public V get(Address address) {
        Node<V> node = find(address.getLabels());
        return node == null ? null : node.value;
    }

    public boolean contains(Address address) {
        return get(address) != null;
    }

    /** 插入或替换，返回旧值 */
    public V put(Address address, V value) {
        if (value == null) throw new NullPointerException("value");
        Node<V> node = root;
        for (Label label : address.getLabels()) {
            Node<V> next = node.children.get(label);
            if (next == null) {
                next = new Node<>();
                node.children.put(label, next);
            }
            node = next;
        }
        V old = node.value;
        node.value = value;
        if (old == null) size++;
        return old;
    }

    /** 删除单个地址上的值，返回旧值 */
    public V remove(Address address) {
        List<Node<V>> path = path(address.getLabels());
        if (path == null) return null;
        Node<V> node = path.get(path.size() - 1);
        V old = node.value;
        if (old == null) return null;
        node.value = null;
        size--;
        prune(path, address.getLabels());
        return old;
    }

    /** 删除前缀及其下所有值，返回删除的条目数 */
    public int removeUnder(Address prefix) {
        List<Node<V>> path = path(prefix.getLabels());
        if (path == null) return 0;
        Node<V> node = path.get(path.size() - 1);
        int removed = count(node);
        Node<V> parent = path.get(path.size() - 2);
        parent.children.remove(prefix.last());
        size -= removed;
        prune(path.subList(0, path.size() - 1), prefix.getLabels().subList(0, prefix.size() - 1));
        return removed;
    }

    /** 前缀下（含前缀本身）所有条目，按地址排序 */
    public Map<Address, V> entriesUnder(Address prefix) {
        Node<V> node = find(prefix.getLabels());
        if (node == null) return Collections.emptyMap();
        Map<Address, V> out = new LinkedHashMap<>();
        collect(node, new ArrayList<>(prefix.getLabels()), out);
        return out;
    }

    /** 全部条目，按地址排序 */
    public Map<Address, V> entries() {
        Map<Address, V> out = new LinkedHashMap<>();
        collect(root, new ArrayList<Label>(), out);
        return out;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    // ── 内部 ──

    private Node<V> find(List<Label> labels) {
        Node<V> node = root;
        for (Label label : labels) {
            node = node.children.get(label);
            if (node == null) return null;
        }
        return node;
    }

    /** 从根到目标的节点路径（含根），不存在返回 null */
    private List<Node<V>> path(List<Label> labels) {
        List<Node<V>> path = new ArrayList<>(labels.size() + 1);
        Node<V> node = root;
        path.add(node);
        for (Label label : labels) {
            node = node.children.get(label);
            if (node == null) return null;
            path.add(node);
        }
        return path;
    }

    // 自底向上删除空节点
    private static <V> void prune(List<Node<V>> path, List<Label> labels) {
        for (int i = path.size() - 1; i > 0; i--) {
            if (!path.get(i).isEmpty()) return;
            path.get(i - 1).children.remove(labels.get(i - 1));
        }
    }

    private static <V> int count(Node<V> node) {
        int n = node.value != null ? 1 : 0;
        for (Node<V> child : node.children.values()) {
            n += count(child);
        }
        return n;
    }

    private static <V> void collect(Node<V> node, List<Label> prefix, Map<Address, V> out) {
        if (node.value != null) out.put(Address.of(prefix), node.value);
        for (Map.Entry<Label, Node<V>> e : node.children.entrySet()) {
            prefix.add(e.getKey());
            collect(e.getValue(), prefix, out);
            prefix.remove(prefix.size() - 1);
        }
    }
}

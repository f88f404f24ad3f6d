package dao.runtime.interpreter;

import dao.runtime.Address;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("标签前缀树")
class LabelTrieTest {

    private LabelTrie<String> trie;

    private static Address a(String text) {
        return Address.parse(text);
    }

    @BeforeEach
    void setUp() {
        trie = new LabelTrie<>();
        trie.put(a("std.io.print"), "print");
        trie.put(a("std.io.error"), "error");
        trie.put(a("std.math"), "math");
        trie.put(a("user"), "user");
    }

    @Test
    @DisplayName("精确查找不匹配前缀")
    void testExactGet() {
        assertEquals("print", trie.get(a("std.io.print")));
        assertNull(trie.get(a("std.io")));
        assertNull(trie.get(a("std.io.print.more")));
        assertFalse(trie.contains(a("std")));
        assertEquals(4, trie.size());
    }

    @Test
    @DisplayName("put 返回被替换的旧值，不改变大小")
    void testReplace() {
        assertEquals("math", trie.put(a("std.math"), "math2"));
        assertEquals(4, trie.size());
        assertNull(trie.put(a("std"), "root"));
        assertEquals(5, trie.size());
    }

    @Test
    @DisplayName("remove 只删除精确地址并保留其子树")
    void testRemove() {
        trie.put(a("std"), "root");
        assertEquals("root", trie.remove(a("std")));
        assertNull(trie.remove(a("std")));
        assertEquals("print", trie.get(a("std.io.print")));
        assertEquals(4, trie.size());
    }

    @Test
    @DisplayName("removeUnder 删除整个子树并返回数量")
    void testRemoveUnder() {
        assertEquals(3, trie.removeUnder(a("std")));
        assertEquals(1, trie.size());
        assertTrue(trie.contains(a("user")));
        assertEquals(0, trie.removeUnder(a("missing.path")));
    }

    @Test
    @DisplayName("entriesUnder 按标签顺序列出前缀下的条目")
    void testEntriesUnder() {
        assertThat(trie.entriesUnder(a("std.io")).keySet())
                .containsExactly(a("std.io.error"), a("std.io.print"));
        assertThat(trie.entriesUnder(a("nothing"))).isEmpty();
        assertThat(trie.entries().values()).containsExactly("error", "print", "math", "user");
    }

    @Test
    @DisplayName("删除后空节点被剪除")
    void testPrune() {
        trie.remove(a("std.io.print"));
        trie.remove(a("std.io.error"));
        assertThat(trie.entriesUnder(a("std.io"))).isEmpty();
        assertThat(trie.entriesUnder(a("std")).keySet()).containsExactly(a("std.math"));
    }
}

package com.daolang.ir.module;

import com.daolang.ir.code.Block;
import com.daolang.ir.code.Instruction;
import dao.runtime.DaoInt;
import dao.runtime.Label;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("模块模型")
class DaoModuleTest {

    @Nested
    @DisplayName("模块")
    class ModuleTests {

        @Test
        @DisplayName("withPrivate 产生副本，原模块不变")
        void testWithPrivate() {
            DaoModule module = DaoModule.builder().privateVar("count", DaoInt.of(0)).build();
            DaoModule updated = module.withPrivate(Label.of("count"), DaoInt.of(5));
            assertEquals(DaoInt.of(0), module.lookupPrivate(Label.of("count")));
            assertEquals(DaoInt.of(5), updated.lookupPrivate(Label.of("count")));
        }

        @Test
        @DisplayName("命名空间不可直接修改")
        void testImmutableNamespaces() {
            DaoModule module = DaoModule.builder().publicVar("x", DaoInt.of(1)).build();
            assertThrows(UnsupportedOperationException.class,
                    () -> module.getPublic().put(Label.of("y"), DaoInt.of(2)));
        }

        @Test
        @DisplayName("toBuilder 保留全部内容")
        void testToBuilder() {
            DaoModule module = DaoModule.builder()
                    .privateVar("a", DaoInt.of(1))
                    .publicVar("b", DaoInt.of(2))
                    .rule(Rule.of(Block.EMPTY, "hi"))
                    .build();
            assertEquals(module, module.toBuilder().build());
        }
    }

    @Nested
    @DisplayName("规则")
    class RuleTests {

        @Test
        @DisplayName("模式是输入前缀时匹配，剩余部分按顺序返回")
        void testPrefixMatch() {
            Rule rule = Rule.of(Block.of(Instruction.pop()), "my", "name", "is");
            List<String> input = Arrays.asList("my", "name", "is", "Dave");
            assertTrue(rule.matches(input));
            assertEquals(Arrays.asList("Dave"), rule.remainder(input));
        }

        @Test
        @DisplayName("输入比模式短或不同则不匹配")
        void testNoMatch() {
            Rule rule = Rule.of(Block.EMPTY, "my", "name");
            assertFalse(rule.matches(Arrays.asList("my")));
            assertFalse(rule.matches(Arrays.asList("your", "name")));
            assertTrue(Rule.of(Block.EMPTY).matches(Arrays.asList("anything")));
        }
    }
}

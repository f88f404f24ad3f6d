package dao.runtime.interpreter;

import com.daolang.ir.code.Block;
import com.daolang.ir.code.ExprOp;
import com.daolang.ir.code.Expression;
import com.daolang.ir.code.Lookup;
import com.daolang.ir.module.DaoModule;
import com.daolang.ir.module.Rule;
import dao.runtime.DaoInt;
import dao.runtime.DaoList;
import dao.runtime.DaoString;
import dao.runtime.Label;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.daolang.ir.code.Instruction.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("规则分派")
class RuleDispatcherTest {

    private static final Label COUNT = Label.of("count");

    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new Interpreter();
    }

    private static List<String> words(String text) {
        return Arrays.asList(text.split(" "));
    }

    private static Block bump() {
        return Block.of(
                eval(Expression.binary(ExprOp.ADD, Lookup.deref(COUNT), Lookup.constant(DaoInt.of(1)))),
                update(Lookup.result(), COUNT));
    }

    @Test
    @DisplayName("剩余的词压栈，POP 得到紧跟在模式后的词")
    void testRemainderOnStack() {
        DaoModule module = DaoModule.builder()
                .rule(Rule.of(Block.of(pop(), store("who")), "my", "name", "is"))
                .build();

        assertEquals(1, interpreter.dispatch(words("my name is Dave"), module));
        assertEquals(DaoString.of("Dave"), interpreter.getRegister("who"));
    }

    @Test
    @DisplayName("多个剩余词按输入顺序依次弹出")
    void testRemainderOrder() {
        DaoModule module = DaoModule.builder()
                .rule(Rule.of(Block.of(pop(), store("first"), clearReverse(), store("rest")), "say"))
                .build();

        interpreter.dispatch(words("say a b c"), module);
        assertEquals(DaoString.of("a"), interpreter.getRegister("first"));
        assertEquals(DaoList.of(DaoString.of("b"), DaoString.of("c")), interpreter.getRegister("rest"));
    }

    @Test
    @DisplayName("所有匹配的规则都执行，对模块的修改在后续规则中可见")
    void testAllRulesRun() {
        DaoModule module = DaoModule.builder()
                .privateVar(COUNT, DaoInt.of(0))
                .rule(Rule.of(bump(), "hello"))
                .rule(Rule.of(bump(), "goodbye"))
                .rule(Rule.of(bump(), "hello", "world"))
                .build();

        assertEquals(2, interpreter.dispatch(words("hello world"), module));
        assertEquals(DaoInt.of(2), interpreter.getCurrentModule().lookupPrivate(COUNT));
        assertEquals(DaoInt.of(0), module.lookupPrivate(COUNT));
    }

    @Test
    @DisplayName("动作结束后恢复原来的栈与当前块")
    void testStackRestored() {
        interpreter.execute(push(Lookup.constant(DaoString.of("keep"))));
        Block before = interpreter.getCurrentBlock();
        DaoModule module = DaoModule.builder()
                .rule(Rule.of(Block.of(push(Lookup.constant(DaoInt.of(1)))), "go"))
                .build();

        interpreter.dispatch(words("go now"), module);
        assertThat(interpreter.getStack()).containsExactly(DaoString.of("keep"));
        assertSame(before, interpreter.getCurrentBlock());
    }

    @Test
    @DisplayName("动作中的 RETURN 只结束该动作")
    void testReturnEndsAction() {
        DaoModule module = DaoModule.builder()
                .privateVar(COUNT, DaoInt.of(0))
                .rule(Rule.of(Block.of(returnWith(Lookup.constant(DaoString.of("early"))), load(Lookup.constant(DaoInt.of(9)))), "x"))
                .rule(Rule.of(bump(), "x"))
                .build();

        assertEquals(2, interpreter.dispatch(words("x"), module));
        assertEquals(DaoInt.of(1), interpreter.getCurrentModule().lookupPrivate(COUNT));
    }

    @Test
    @DisplayName("动作中未捕获的 THROW 到达宿主")
    void testThrowEscapes() {
        DaoModule module = DaoModule.builder()
                .rule(Rule.of(Block.of(throwWith(Lookup.constant(DaoString.of("nope")))), "boom"))
                .build();

        DaoRuntimeException e = assertThrows(DaoRuntimeException.class,
                () -> interpreter.dispatch(words("boom"), module));
        assertEquals(DaoString.of("nope"), e.getErrorValue());
        assertTrue(interpreter.getStack().isEmpty());
    }

    @Test
    @DisplayName("没有匹配的规则时返回 0")
    void testNoMatch() {
        DaoModule module = DaoModule.builder()
                .rule(Rule.of(Block.of(load(Lookup.constant(DaoInt.of(1)))), "my", "name", "is"))
                .build();

        assertEquals(0, interpreter.dispatch(words("my name"), module));
        assertEquals(0, interpreter.dispatch(words("your name is Dave"), module));
    }
}

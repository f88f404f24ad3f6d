package dao.runtime.interpreter;

import com.daolang.ir.code.Block;
import com.daolang.ir.code.DaoFunc;
import com.daolang.ir.code.ExprOp;
import com.daolang.ir.code.Expression;
import com.daolang.ir.code.Lookup;
import com.daolang.ir.module.DaoModule;
import dao.runtime.Address;
import dao.runtime.DaoData;
import dao.runtime.DaoInt;
import dao.runtime.DaoList;
import dao.runtime.DaoString;
import dao.runtime.DaoValue;
import dao.runtime.Label;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.daolang.ir.code.Instruction.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 调用、返回、GOTO 与系统调用协议
 */
@DisplayName("调用协议")
class CallProtocolTest {

    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new Interpreter();
    }

    private static Lookup c(long n) {
        return Lookup.constant(DaoInt.of(n));
    }

    private static Lookup c(String s) {
        return Lookup.constant(DaoString.of(s));
    }

    private static Lookup fn(DaoFunc func) {
        return Lookup.constant(func);
    }

    /** a * 10 + b，以 RETURN 结束 */
    private static DaoFunc combine() {
        return DaoFunc.of(Block.of(
                eval(Expression.binary(ExprOp.MUL, Lookup.var("a"), c(10))),
                eval(Expression.binary(ExprOp.ADD, Lookup.result(), Lookup.var("b"))),
                returnWith(Lookup.result())), "a", "b");
    }

    private ErrorKind errorOf(Block block) {
        DaoRuntimeException e = assertThrows(DaoRuntimeException.class, () -> interpreter.evalBlock(block));
        return e.getErrorKind();
    }

    // ============ LOCAL ============

    @Nested
    @DisplayName("LOCAL 调用")
    class LocalCallTests {

        @Test
        @DisplayName("栈上的实参按入栈顺序绑定参数")
        void testPositionalBinding() {
            DaoValue result = interpreter.evalBlock(Block.of(
                    push(c(1)), push(c(2)),
                    eval(Expression.local(fn(combine())))));
            assertEquals(DaoInt.of(12), result);
        }

        @Test
        @DisplayName("显式实参接在栈上实参之后")
        void testExplicitArgumentsAppended() {
            DaoValue result = interpreter.evalBlock(Block.of(
                    push(c(1)),
                    eval(Expression.local(fn(combine()), c(2)))));
            assertEquals(DaoInt.of(12), result);
        }

        @Test
        @DisplayName("实参不足是 NotEnoughArguments")
        void testNotEnoughArguments() {
            assertEquals(ErrorKind.NOT_ENOUGH_ARGUMENTS, errorOf(Block.of(
                    push(c(1)),
                    eval(Expression.local(fn(combine()))))));
        }

        @Test
        @DisplayName("返回后调用方的栈保持调用前的内容，结果压在其上")
        void testLeftoverPreserved() {
            interpreter.evalBlock(Block.of(
                    push(c(1)), push(c(2)), push(c(3)),
                    eval(Expression.local(fn(combine())))));
            assertThat(interpreter.getStack())
                    .containsExactly(DaoInt.of(1), DaoInt.of(2), DaoInt.of(3), DaoInt.of(12));
        }

        @Test
        @DisplayName("被调用方从绑定后剩余的值开始")
        void testCalleeSeesLeftover() {
            DaoFunc drain = DaoFunc.of(Block.of(clearForward(), returnWith(Lookup.result())), "a");
            DaoValue result = interpreter.evalBlock(Block.of(
                    push(c(1)),
                    eval(Expression.local(fn(drain), c(2), c(3)))));
            assertEquals(DaoList.of(DaoInt.of(2), DaoInt.of(3)), result);
        }

        @Test
        @DisplayName("显式实参不会留在调用方的栈上")
        void testExplicitArgumentsDoNotLeak() {
            DaoFunc five = DaoFunc.of(Block.of(returnWith(c(5))));
            interpreter.evalBlock(Block.of(eval(Expression.local(fn(five), c(7)))));
            assertThat(interpreter.getStack()).containsExactly(DaoInt.of(5));
        }

        @Test
        @DisplayName("调用内建模块方法只留下结果")
        void testBuiltinMethodLeavesOnlyResults() {
            Address m = Address.parse("m");
            interpreter.installModule(m, new BuiltinModuleBuilder().method("id", Interpreter::popArgument));
            Lookup id = Lookup.qualified("m", "id");

            interpreter.evalBlock(Block.of(
                    eval(Expression.local(id, c(7))),
                    eval(Expression.local(id, c(8)))));
            assertThat(interpreter.getStack()).containsExactly(DaoInt.of(7), DaoInt.of(8));

            interpreter.reset();
            DaoValue viaCall = interpreter.evalBlock(Block.of(eval(Expression.call(m, Lookup.deref("id"), c(9)))));
            assertEquals(DaoInt.of(9), viaCall);
            assertTrue(interpreter.getStack().isEmpty());
            assertNull(interpreter.getCurrentModule());
        }

        @Test
        @DisplayName("RETURN 恢复调用方寄存器并继续执行后续指令")
        void testReturnRestoresCaller() {
            DaoFunc clobber = DaoFunc.of(Block.of(
                    load(c(99)), store("x"), returnWith(c(5))));
            DaoValue result = interpreter.evalBlock(Block.of(
                    load(c(1)), store("x"),
                    eval(Expression.local(fn(clobber))),
                    store("fromCall"),
                    load(Lookup.var("x"))));
            assertEquals(DaoInt.of(1), result);
            assertEquals(DaoInt.of(5), interpreter.getRegister("fromCall"));
        }

        @Test
        @DisplayName("没有 RETURN 直接结束时不恢复调用方的寄存器与栈")
        void testFallThroughLeavesCalleeState() {
            DaoFunc noReturn = DaoFunc.of(Block.of(load(c(99)), store("y")), "a");
            DaoValue result = interpreter.evalBlock(Block.of(
                    load(c(1)), store("x"),
                    push(c(10)),
                    eval(Expression.local(fn(noReturn))),
                    load(c("unreached"))));

            assertEquals(DaoInt.of(99), result);
            assertNull(interpreter.getRegister("x"));
            assertEquals(DaoInt.of(10), interpreter.getRegister("a"));
            assertEquals(DaoInt.of(99), interpreter.getRegister("y"));
            assertThat(interpreter.getStack()).containsExactly(DaoInt.of(99));
            assertEquals(noReturn.getBody(), interpreter.getCurrentBlock());
        }

        @Test
        @DisplayName("空函数体返回当前 lastResult")
        void testEmptyBody() {
            DaoValue result = interpreter.evalBlock(Block.of(
                    load(c("before")),
                    eval(Expression.local(fn(DaoFunc.of(Block.EMPTY))))));
            assertEquals(DaoString.of("before"), result);
        }

        @Test
        @DisplayName("THROW 穿过调用边界")
        void testThrowPropagates() {
            DaoFunc thrower = DaoFunc.of(Block.of(throwWith(c("bad"))));
            DaoRuntimeException e = assertThrows(DaoRuntimeException.class, () -> interpreter.evalBlock(Block.of(
                    eval(Expression.local(fn(thrower))),
                    load(c("unreached")))));
            assertEquals(DaoString.of("bad"), e.getErrorValue());
        }

        @Test
        @DisplayName("调用非函数值是 NotCallable")
        void testNotCallable() {
            assertEquals(ErrorKind.NOT_CALLABLE, errorOf(Block.of(eval(Expression.local(c(3))))));
        }

        @Test
        @DisplayName("递归调用借助 Java 调用栈")
        void testRecursion() {
            Lookup self = Lookup.qualified("math", "fact");
            DaoFunc fact = DaoFunc.of(Block.of(
                    eval(Expression.binary(ExprOp.LE, Lookup.var("n"), c(1))),
                    store("base"),
                    when(Lookup.var("base"), returnWith(c(1))),
                    eval(Expression.binary(ExprOp.SUB, Lookup.var("n"), c(1))),
                    store("m"),
                    eval(Expression.local(self, Lookup.var("m"))),
                    eval(Expression.binary(ExprOp.MUL, Lookup.var("n"), Lookup.result())),
                    returnWith(Lookup.result())), "n");
            interpreter.activateModule(Address.parse("math"), DaoModule.builder().publicVar("fact", fact).build());

            assertEquals(DaoInt.of(120), interpreter.evalBlock(Block.of(eval(Expression.local(self, c(5))))));
            assertEquals(0, interpreter.getCallDepth());
        }
    }

    // ============ CALL ============

    @Nested
    @DisplayName("CALL 跨模块调用")
    class ModuleCallTests {

        private final Address counter = Address.parse("counter");

        @BeforeEach
        void activate() {
            interpreter.activateModule(counter, DaoModule.builder()
                    .privateVar("secret", DaoInt.of(42))
                    .publicVar("reveal", DaoFunc.of(Block.of(returnWith(Lookup.deref("secret")))))
                    .publicVar("self", DaoFunc.of(Block.of(returnWith(Lookup.result()))))
                    .publicVar("linger", DaoFunc.of(Block.of(load(Lookup.deref("secret")))))
                    .build());
        }

        @Test
        @DisplayName("在目标模块上下文中解析目标并执行")
        void testCallInTargetContext() {
            DaoValue result = interpreter.evalBlock(Block.of(
                    eval(Expression.call(counter, Lookup.deref("reveal")))));
            assertEquals(DaoInt.of(42), result);
            assertNull(interpreter.getCurrentModule());
        }

        @Test
        @DisplayName("被调用方看到调用前的 lastResult")
        void testSelfValue() {
            DaoValue result = interpreter.evalBlock(Block.of(
                    load(c("me")),
                    eval(Expression.call(counter, Lookup.deref("self")))));
            assertEquals(DaoString.of("me"), result);
        }

        @Test
        @DisplayName("没有 RETURN 时保留目标模块作为当前模块")
        void testFallThroughKeepsModule() {
            interpreter.evalBlock(Block.of(eval(Expression.call(counter, Lookup.deref("linger")))));
            assertNotNull(interpreter.getCurrentModule());
            assertEquals(DaoInt.of(42), interpreter.getCurrentModule().lookupPrivate(Label.of("secret")));
        }

        @Test
        @DisplayName("未加载的模块是 UndefinedModule")
        void testUnknownModule() {
            assertEquals(ErrorKind.UNDEFINED_MODULE, errorOf(Block.of(
                    eval(Expression.call(Address.parse("ghost"), Lookup.deref("x"))))));
        }
    }

    // ============ GOTO ============

    @Nested
    @DisplayName("GOTO")
    class GotoTests {

        @Test
        @DisplayName("替换当前帧，不会返回")
        void testGotoReplacesFrame() {
            DaoFunc target = DaoFunc.of(Block.of(load(Lookup.var("a")), store("y")), "a");
            DaoValue result = interpreter.evalBlock(Block.of(
                    load(c(1)), store("x"),
                    push(c(9)),
                    eval(Expression.goTo(fn(target), c(7))),
                    load(c("unreached"))));
            assertEquals(DaoInt.of(7), result);
            assertNull(interpreter.getRegister("x"));
            assertEquals(DaoInt.of(7), interpreter.getRegister("y"));
            assertTrue(interpreter.getStack().isEmpty());
        }

        @Test
        @DisplayName("GOTO 不使用当前栈作为实参")
        void testGotoIgnoresStack() {
            DaoFunc target = DaoFunc.of(Block.of(load(Lookup.var("a"))), "a");
            assertEquals(ErrorKind.NOT_ENOUGH_ARGUMENTS, errorOf(Block.of(
                    push(c(9)),
                    eval(Expression.goTo(fn(target))))));
        }

        @Test
        @DisplayName("目标不是函数是 BadInstruction")
        void testGotoNonFunction() {
            assertEquals(ErrorKind.BAD_INSTRUCTION, errorOf(Block.of(eval(Expression.goTo(c(1))))));
        }

        @Test
        @DisplayName("被 GOTO 的函数中的 RETURN 由最近的调用边界处理")
        void testReturnAfterGoto() {
            DaoFunc finish = DaoFunc.of(Block.of(returnWith(Lookup.var("v"))), "v");
            DaoFunc start = DaoFunc.of(Block.of(eval(Expression.goTo(fn(finish), c(3)))));
            DaoValue result = interpreter.evalBlock(Block.of(
                    load(c(1)), store("kept"),
                    eval(Expression.local(fn(start))),
                    store("got"),
                    load(Lookup.var("kept"))));
            assertEquals(DaoInt.of(1), result);
            assertEquals(DaoInt.of(3), interpreter.getRegister("got"));
        }
    }

    // ============ SYS ============

    @Nested
    @DisplayName("系统调用")
    class SystemCallTests {

        private final Address sum = Address.parse("sum");
        private final Address args = Address.parse("args");

        @BeforeEach
        void install() {
            interpreter.installSystemCall(sum, vm -> {
                long total = 0;
                for (DaoValue v : vm.arguments()) {
                    total += v.asInt().getValue();
                }
                return DaoInt.of(total);
            });
            interpreter.installSystemCall(args, vm -> DaoList.of(vm.arguments()));
        }

        @Test
        @DisplayName("实参替换栈，调用结束后恢复")
        void testStackReplacedAndRestored() {
            DaoValue result = interpreter.evalBlock(Block.of(
                    push(c("keep")),
                    eval(Expression.sys(sum, c(1), c(2), c(3)))));
            assertEquals(DaoInt.of(6), result);
            assertThat(interpreter.getStack()).containsExactly(DaoString.of("keep"));
        }

        @Test
        @DisplayName("第一个实参在栈底，POP 先取到最后一个实参")
        void testArgumentOrder() {
            assertEquals(DaoList.of(DaoInt.of(1), DaoInt.of(2)),
                    interpreter.evalBlock(Block.of(eval(Expression.sys(args, c(1), c(2))))));
            interpreter.installSystemCall(Address.parse("last"), Interpreter::popArgument);
            assertEquals(DaoInt.of(2),
                    interpreter.evalBlock(Block.of(eval(Expression.sys(Address.parse("last"), c(1), c(2))))));
        }

        @Test
        @DisplayName("本地函数抛出的错误包装为 SystemCall，栈照样恢复")
        void testErrorWrapped() {
            interpreter.installSystemCall(Address.parse("fail"),
                    vm -> { throw VmErrors.error(ErrorKind.BAD_INSTRUCTION, "inner"); });
            DaoRuntimeException e = assertThrows(DaoRuntimeException.class, () -> interpreter.evalBlock(Block.of(
                    push(c("keep")),
                    eval(Expression.sys(Address.parse("fail"), c(1))))));
            assertEquals(ErrorKind.SYSTEM_CALL, e.getErrorKind());
            DaoData inner = ((DaoData) e.getErrorValue()).get("exception").asData();
            assertEquals(ErrorKind.BAD_INSTRUCTION.getTag(), inner.getTag());
            assertThat(interpreter.getStack()).containsExactly(DaoString.of("keep"));
        }

        @Test
        @DisplayName("Java 异常同样包装为 SystemCall 错误")
        void testJavaExceptionWrapped() {
            interpreter.installSystemCall(Address.parse("npe"), vm -> { throw new IllegalStateException("broken"); });
            DaoRuntimeException e = assertThrows(DaoRuntimeException.class, () -> interpreter.evalBlock(Block.of(
                    eval(Expression.sys(Address.parse("npe"))))));
            assertEquals(ErrorKind.SYSTEM_CALL, e.getErrorKind());
            assertThat(((DaoData) e.getErrorValue()).get("exception").toDisplayString()).contains("broken");
        }

        @Test
        @DisplayName("本地函数可以用 RETURN 通道给出结果")
        void testReturnChannel() {
            interpreter.installSystemCall(Address.parse("early"),
                    vm -> { throw ControlFlow.returnValue(DaoString.of("done")); });
            assertEquals(DaoString.of("done"),
                    interpreter.evalBlock(Block.of(eval(Expression.sys(Address.parse("early"))))));
        }

        @Test
        @DisplayName("未注册的系统调用是 UndefinedSystemCall")
        void testUndefined() {
            assertEquals(ErrorKind.UNDEFINED_SYSTEM_CALL,
                    errorOf(Block.of(eval(Expression.sys(Address.parse("nope"))))));
        }

        @Test
        @DisplayName("expectNoArguments 拒绝多余实参")
        void testTooManyArguments() {
            interpreter.installSystemCall(Address.parse("nullary"), vm -> {
                vm.expectNoArguments("nullary");
                return DaoInt.of(0);
            });
            DaoRuntimeException e = assertThrows(DaoRuntimeException.class, () -> interpreter.evalBlock(Block.of(
                    eval(Expression.sys(Address.parse("nullary"), c(1))))));
            DaoData inner = ((DaoData) e.getErrorValue()).get("exception").asData();
            assertEquals(ErrorKind.TOO_MANY_ARGUMENTS.getTag(), inner.getTag());
        }
    }
}

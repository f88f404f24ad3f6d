package dao.runtime.interpreter.stdlib;

import com.daolang.ir.code.Block;
import com.daolang.ir.code.Expression;
import com.daolang.ir.code.Lookup;
import dao.runtime.DaoAtom;
import dao.runtime.DaoData;
import dao.runtime.DaoInt;
import dao.runtime.DaoList;
import dao.runtime.DaoString;
import dao.runtime.DaoValue;
import dao.runtime.interpreter.DaoRuntimeException;
import dao.runtime.interpreter.DaoSecurityPolicy;
import dao.runtime.interpreter.ErrorKind;
import dao.runtime.interpreter.Interpreter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;

import static com.daolang.ir.code.Instruction.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("基础输出")
class BasicIOTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private Interpreter interpreter(DaoSecurityPolicy policy) throws UnsupportedEncodingException {
        Interpreter interp = new Interpreter(policy);
        interp.setStdout(new PrintStream(out, true, "UTF-8"));
        interp.setStderr(new PrintStream(err, true, "UTF-8"));
        BasicIO.install(interp);
        return interp;
    }

    private static String text(ByteArrayOutputStream stream) throws UnsupportedEncodingException {
        return stream.toString("UTF-8");
    }

    @Test
    @DisplayName("print 按实参顺序拼接打印形式")
    void testPrintConcatenates() throws Exception {
        Interpreter interp = interpreter(DaoSecurityPolicy.unrestricted());
        DaoValue result = interp.evalBlock(Block.of(eval(Expression.sys(BasicIO.PRINT,
                Lookup.constant(DaoString.of("n=")),
                Lookup.constant(DaoInt.of(3)),
                Lookup.constant(DaoAtom.NULL),
                Lookup.constant(DaoAtom.TRUE)))));

        assertEquals(DaoString.of("n=3FALSETRUE"), result);
        assertEquals("n=3FALSETRUE" + System.lineSeparator(), text(out));
        assertEquals("", text(err));
    }

    @Test
    @DisplayName("print 可转发当前栈")
    void testPrintForwardsStack() throws Exception {
        Interpreter interp = interpreter(DaoSecurityPolicy.unrestricted());
        interp.evalBlock(Block.of(
                push(Lookup.constant(DaoString.of("a"))),
                push(Lookup.constant(DaoList.of(DaoInt.of(1), DaoInt.of(2)))),
                eval(Expression.sysForwardingStack(BasicIO.PRINT))));
        assertEquals("a[1, 2]" + System.lineSeparator(), text(out));
    }

    @Test
    @DisplayName("error 写标准错误")
    void testErrorWritesStderr() throws Exception {
        Interpreter interp = interpreter(DaoSecurityPolicy.standard());
        interp.evalBlock(Block.of(eval(Expression.sys(BasicIO.ERROR, Lookup.constant(DaoString.of("oops"))))));
        assertEquals("oops" + System.lineSeparator(), text(err));
        assertEquals("", text(out));
    }

    @Test
    @DisplayName("strict 策略下拒绝输出")
    void testDeniedUnderStrict() throws Exception {
        Interpreter interp = interpreter(DaoSecurityPolicy.strict());
        DaoRuntimeException e = assertThrows(DaoRuntimeException.class, () -> interp.evalBlock(Block.of(
                eval(Expression.sys(BasicIO.PRINT, Lookup.constant(DaoString.of("hidden")))))));

        assertEquals(ErrorKind.SYSTEM_CALL, e.getErrorKind());
        DaoData inner = ((DaoData) e.getErrorValue()).get("exception").asData();
        assertEquals(ErrorKind.SYSTEM_CALL.getTag(), inner.getTag());
        assertEquals("", text(out));
    }
}

package dao.runtime.interpreter;

import com.daolang.ir.code.ExprOp;
import com.daolang.ir.code.Expression;
import dao.runtime.Address;
import dao.runtime.DaoAtom;
import dao.runtime.DaoData;
import dao.runtime.DaoFloat;
import dao.runtime.DaoInt;
import dao.runtime.DaoList;
import dao.runtime.DaoPointer;
import dao.runtime.DaoString;
import dao.runtime.DaoValue;
import dao.runtime.Label;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 表达式求值：运算符语义与按类型分派。
 *
 * <p>算术与比较只接受同为 Int 或同为 Float 的操作数对；
 * 操作数中出现 Data 值且标准规则不适用时，交给以其标签为地址的内建模块的运算符求值器。
 * 求值器抛出的 Java 异常转换为 {@code BadInstruction} 错误，附带 {@code exception} 字段。</p>
 */
final class ExpressionEvaluator {

    private static final Logger LOG = Logger.getLogger(ExpressionEvaluator.class.getName());

    private final Interpreter interp;

    ExpressionEvaluator(Interpreter interp) {
        this.interp = interp;
    }

    DaoValue evaluate(Expression expr) {
        switch (expr.getOp()) {
            case SYS:
                return interp.functions().systemCall(expr);
            case CALL:
                return interp.functions().callModule(expr);
            case LOCAL:
                return interp.functions().callLocal(expr);
            case GOTO:
                return interp.functions().goTo(expr);
            case IF:
            case IF_NOT:
                return conditional(expr);
            default:
                break;
        }
        DaoValue a = interp.lookup(expr.getOperand(0));
        if (expr.getOp().getArity() == 1) {
            return unary(expr, a);
        }
        DaoValue b = interp.lookup(expr.getOperand(1));
        return binary(expr, a, b);
    }

    // ============ 一元 ============

    private DaoValue unary(Expression expr, DaoValue a) {
        switch (expr.getOp()) {
            case TAKE:
                return a;
            case NOT:
                if (a.isNull()) return DaoAtom.TRUE;
                if (a.isTrue()) return DaoAtom.NULL;
                if (a.asInt() != null) return DaoInt.of(~a.asInt().getValue());
                break;
            case SIZE:
                if (a.isNull() || a.isTrue()) return a;
                if (a.asInt() != null) return DaoInt.of(Math.abs(a.asInt().getValue()));
                if (a.asFloat() != null) return DaoFloat.of(Math.abs(a.asFloat().getValue()));
                if (a.asList() != null) return DaoInt.of(a.asList().size());
                if (a.asStr() != null) return DaoInt.of(a.asStr().length());
                break;
            default:
                break;
        }
        if (a.asData() != null) {
            return delegate(expr, a.asData(), Arrays.asList(a));
        }
        throw VmErrors.badInstruction(expr);
    }

    // ============ 二元 ============

    private DaoValue binary(Expression expr, DaoValue a, DaoValue b) {
        ExprOp op = expr.getOp();
        switch (op) {
            case EQ:
                return DaoAtom.of(a.equals(b));
            case NE:
                return DaoAtom.of(!a.equals(b));
            case ADD:
            case SUB:
            case MUL:
            case DIV:
                if (a.asInt() != null && b.asInt() != null) {
                    return integer(expr, a.asInt().getValue(), b.asInt().getValue());
                }
                if (a.asFloat() != null && b.asFloat() != null) {
                    return floating(op, a.asFloat().getValue(), b.asFloat().getValue());
                }
                break;
            case MOD:
                if (a.asInt() != null && b.asInt() != null) {
                    return integer(expr, a.asInt().getValue(), b.asInt().getValue());
                }
                break;
            case GT:
            case GE:
            case LT:
            case LE:
                if ((a.asInt() != null && b.asInt() != null) || (a.asFloat() != null && b.asFloat() != null)) {
                    return DaoAtom.of(compare(op, a.compareTo(b)));
                }
                break;
            case INDEX: {
                DaoValue indexed = index(a, b);
                if (indexed != null) return indexed;
                break;
            }
            case APPEND:
                if (a.asStr() != null && b.asStr() != null) {
                    return DaoString.of(a.asStr().getValue() + b.asStr().getValue());
                }
                if (a.asList() != null && b.asList() != null) {
                    return a.asList().concat(b.asList());
                }
                break;
            case AND:
            case OR:
            case XOR:
            case SHIFT_R:
            case SHIFT_L:
                if (a.asInt() != null && b.asInt() != null) {
                    return DaoInt.of(bitwise(op, a.asInt().getValue(), b.asInt().getValue()));
                }
                break;
            default:
                break;
        }
        DaoData data = a.asData() != null ? a.asData() : b.asData();
        if (data != null) {
            return delegate(expr, data, Arrays.asList(a, b));
        }
        throw VmErrors.badInstruction(expr);
    }

    private DaoValue integer(Expression expr, long x, long y) {
        switch (expr.getOp()) {
            case ADD: return DaoInt.of(x + y);
            case SUB: return DaoInt.of(x - y);
            case MUL: return DaoInt.of(x * y);
            case DIV:
                if (y == 0) throw VmErrors.badInstruction(expr, "division by zero");
                return DaoInt.of(Math.floorDiv(x, y));
            case MOD:
                if (y == 0) throw VmErrors.badInstruction(expr, "division by zero");
                return DaoInt.of(Math.floorMod(x, y));
            default:
                throw new IllegalStateException("Not arithmetic: " + expr.getOp());
        }
    }

    private static DaoValue floating(ExprOp op, double x, double y) {
        switch (op) {
            case ADD: return DaoFloat.of(x + y);
            case SUB: return DaoFloat.of(x - y);
            case MUL: return DaoFloat.of(x * y);
            case DIV: return DaoFloat.of(x / y);
            default:
                throw new IllegalStateException("Not arithmetic: " + op);
        }
    }

    private static boolean compare(ExprOp op, int c) {
        switch (op) {
            case GT: return c > 0;
            case GE: return c >= 0;
            case LT: return c < 0;
            case LE: return c <= 0;
            default:
                throw new IllegalStateException("Not a comparison: " + op);
        }
    }

    private static long bitwise(ExprOp op, long x, long y) {
        switch (op) {
            case AND:     return x & y;
            case OR:      return x | y;
            case XOR:     return x ^ y;
            case SHIFT_R: return shiftLeft(x, -Math.max(y, -Long.MAX_VALUE));
            case SHIFT_L: return shiftLeft(x, y);
            default:
                throw new IllegalStateException("Not bitwise: " + op);
        }
    }

    /**
     * 算术移位，{@code n} 为负时右移。移出 64 位以上时左移得 0，右移得 0 或 -1。
     */
    private static long shiftLeft(long x, long n) {
        if (n >= Long.SIZE) return 0;
        if (n >= 0) return x << n;
        if (n <= -Long.SIZE) return x < 0 ? -1 : 0;
        return x >> -n;
    }

    /**
     * (Int, List) 取元素，越界为 Null；(Str, Data) 取字段，不存在为 Null；
     * (True, Data) 取 Data 标签的指针。其余返回 null 表示不适用。
     */
    private static DaoValue index(DaoValue a, DaoValue b) {
        if (a.asInt() != null && b.asList() != null) {
            DaoValue v = b.asList().get(a.asInt().getValue());
            return v == null ? DaoAtom.NULL : v;
        }
        if (a.asStr() != null && b.asData() != null) {
            String key = a.asStr().getValue();
            DaoValue v = Label.isValid(key) ? b.asData().get(Label.of(key)) : null;
            return v == null ? DaoAtom.NULL : v;
        }
        if (a.isTrue() && b.asData() != null) {
            return DaoPointer.of(b.asData().getTag());
        }
        return null;
    }

    // ============ 三元 ============

    private DaoValue conditional(Expression expr) {
        Boolean test = interp.lookup(expr.getOperand(0)).asBool();
        if (test == null) {
            throw VmErrors.badInstruction(expr, "conditional does not evaluate to boolean value");
        }
        boolean takeFirst = expr.getOp() == ExprOp.IF ? test : !test;
        return interp.lookup(expr.getOperand(takeFirst ? 1 : 2));
    }

    // ============ 类型分派 ============

    private DaoValue delegate(Expression expr, DaoData data, List<DaoValue> operands) {
        Address tag = data.getTag();
        LoadedModule module = interp.getRegistry().getModule(tag);
        if (module == null) {
            throw VmErrors.undefinedModule(tag);
        }
        OperatorEvaluator evaluator = module.getEvaluator();
        if (evaluator == null) {
            throw VmErrors.badInstruction(expr, "dataType", DaoPointer.of(tag));
        }
        DaoValue result;
        try {
            result = evaluator.evaluate(interp, expr, operands);
        } catch (ControlFlow cf) {
            throw cf;
        } catch (DaoRuntimeException e) {
            throw VmErrors.operatorFailed(expr, tag, e.getErrorValue());
        } catch (RuntimeException e) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.log(Level.FINE, "operator evaluator for " + tag + " failed", e);
            }
            throw VmErrors.operatorFailed(expr, tag, DaoString.of(e.toString()));
        }
        return result == null ? DaoAtom.NULL : result;
    }
}

package dao.runtime.interpreter;

import com.daolang.ir.code.Expression;
import dao.runtime.DaoValue;

import java.util.List;

/**
 * 内建模块的运算符求值器，实现按类型分派的运算符重载。
 *
 * <p>当一元或二元运算符的操作数是以该模块地址为标签的 Data 值，
 * 且标准运算规则不适用时调用。</p>
 */
@FunctionalInterface
public interface OperatorEvaluator {

    /**
     * @param interpreter 当前解释器
     * @param expression  正在求值的表达式
     * @param operands    已求值的操作数，顺序与表达式一致
     * @return 运算结果
     */
    DaoValue evaluate(Interpreter interpreter, Expression expression, List<DaoValue> operands);
}

package dao.runtime;

/**
 * 标签或地址文本无法解析时抛出。
 *
 * <p>保留原始输入，可通过 {@link #toValue()} 转换为结构化错误值
 * {@code Label.Error} / {@code Address.Error}，字段为 {@code problem} 与 {@code parseInput}。</p>
 */
public class AddressFormatException extends DaoException {

    /** 解析目标 */
    public enum Target { LABEL, ADDRESS }

    private final Target target;
    private final String problem;
    private final String input;

    public AddressFormatException(Target target, String problem, String input) {
        super((target == Target.LABEL ? "Label" : "Address") + " parse error: " + problem + ": \"" + input + "\"");
        this.target = target;
        this.problem = problem;
        this.input = input;
    }

    public Target getTarget() {
        return target;
    }

    public String getProblem() {
        return problem;
    }

    /** 无法解析的原始字符串 */
    public String getInput() {
        return input;
    }

    public DaoData toValue() {
        Address tag = target == Target.LABEL ? Address.of("Label", "Error") : Address.of("Address", "Error");
        return DaoData.of(tag,
                "problem", problem,
                "parseInput", input == null ? "" : input);
    }
}

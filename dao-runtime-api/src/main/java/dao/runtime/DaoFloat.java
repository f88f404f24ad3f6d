package dao.runtime;

/**
 * 双精度浮点数
 */
public final class DaoFloat extends DaoValue {

    private final double value;

    private DaoFloat(double value) {
        this.value = value;
    }

    public static DaoFloat of(double value) {
        return new DaoFloat(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Float";
    }

    @Override
    protected int typeRank() {
        return RANK_FLOAT;
    }

    @Override
    protected int compareSameType(DaoValue other) {
        return Double.compare(value, ((DaoFloat) other).value);
    }

    @Override
    public DaoFloat asFloat() {
        return this;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}

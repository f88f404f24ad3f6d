package dao.runtime;

/**
 * 两个原子值：Null 与 True
 *
 * <p>Null 同时充当"假"，没有其它假值。</p>
 */
public final class DaoAtom extends DaoValue {

    /** 唯一的 Null 实例 */
    public static final DaoAtom NULL = new DaoAtom(false);

    /** 唯一的 True 实例 */
    public static final DaoAtom TRUE = new DaoAtom(true);

    private final boolean truth;

    private DaoAtom(boolean truth) {
        this.truth = truth;
    }

    public static DaoAtom of(boolean truth) {
        return truth ? TRUE : NULL;
    }

    @Override
    public String getTypeName() {
        return truth ? "True" : "Null";
    }

    @Override
    protected int typeRank() {
        return truth ? RANK_TRUE : RANK_NULL;
    }

    @Override
    protected int compareSameType(DaoValue other) {
        return 0;
    }

    @Override
    public boolean isTruthy() {
        return truth;
    }

    @Override
    public boolean isNull() {
        return !truth;
    }

    @Override
    public boolean isTrue() {
        return truth;
    }

    @Override
    public Boolean asBool() {
        return truth;
    }

    @Override
    public int hashCode() {
        return truth ? 1 : 0;
    }

    @Override
    public String toDisplayString() {
        return truth ? "TRUE" : "FALSE";
    }

    @Override
    public String toString() {
        return truth ? "True" : "Null";
    }
}

package dao.runtime;

/**
 * 64 位有符号整数
 */
public final class DaoInt extends DaoValue {

    // 小整数缓存
    private static final int CACHE_LOW = -128;
    private static final int CACHE_HIGH = 1024;
    private static final DaoInt[] CACHE = new DaoInt[CACHE_HIGH - CACHE_LOW + 1];
    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new DaoInt(CACHE_LOW + i);
        }
    }

    /** 获取 DaoInt 实例，优先从缓存取 */
    public static DaoInt of(long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new DaoInt(value);
    }

    private final long value;

    private DaoInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Int";
    }

    @Override
    protected int typeRank() {
        return RANK_INT;
    }

    @Override
    protected int compareSameType(DaoValue other) {
        return Long.compare(value, ((DaoInt) other).value);
    }

    @Override
    public DaoInt asInt() {
        return this;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}

package dao.runtime;

/**
 * 不可变文本
 */
public final class DaoString extends DaoValue {

    public static final DaoString EMPTY = new DaoString("");

    private final String value;

    private DaoString(String value) {
        this.value = value;
    }

    public static DaoString of(String value) {
        if (value == null) throw new NullPointerException("value");
        return value.isEmpty() ? EMPTY : new DaoString(value);
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public String getTypeName() {
        return "Str";
    }

    @Override
    protected int typeRank() {
        return RANK_STR;
    }

    @Override
    protected int compareSameType(DaoValue other) {
        return value.compareTo(((DaoString) other).value);
    }

    @Override
    public DaoString asStr() {
        return this;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toDisplayString() {
        return value;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':  sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                default:   sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}

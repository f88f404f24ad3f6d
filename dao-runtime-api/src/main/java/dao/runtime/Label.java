package dao.runtime;

/**
 * 标签：原子标识符。
 *
 * <p>首字符为字母或下划线，其余为字母、数字或下划线；不可为空，不含分隔符。
 * 按内容比较与排序。</p>
 */
public final class Label implements Comparable<Label> {

    private final String name;

    private Label(String name) {
        this.name = name;
    }

    /**
     * 解析标签
     *
     * @throws AddressFormatException 文本不是合法标签
     */
    public static Label of(String name) {
        String problem = check(name);
        if (problem != null) {
            throw new AddressFormatException(AddressFormatException.Target.LABEL, problem, name);
        }
        return new Label(name);
    }

    public static boolean isValid(String name) {
        return check(name) == null;
    }

    /** 返回问题描述，合法时返回 null */
    static String check(String name) {
        if (name == null || name.isEmpty()) return "empty label";
        char first = name.charAt(0);
        if (!(Character.isLetter(first) || first == '_')) {
            return "label must begin with a letter or underscore";
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_')) {
                return "invalid character '" + c + "' in label";
            }
        }
        return null;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(Label other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Label)) return false;
        return name.equals(((Label) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}

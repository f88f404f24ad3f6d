package dao.runtime;

/**
 * 指针：作为一等值使用的地址，可解引用的符号引用
 */
public final class DaoPointer extends DaoValue {

    private final Address address;

    private DaoPointer(Address address) {
        this.address = address;
    }

    public static DaoPointer of(Address address) {
        if (address == null) throw new NullPointerException("address");
        return new DaoPointer(address);
    }

    public Address getAddress() {
        return address;
    }

    @Override
    public String getTypeName() {
        return "Pointer";
    }

    @Override
    protected int typeRank() {
        return RANK_POINTER;
    }

    @Override
    protected int compareSameType(DaoValue other) {
        return address.compareTo(((DaoPointer) other).address);
    }

    @Override
    public DaoPointer asPointer() {
        return this;
    }

    @Override
    public int hashCode() {
        return 31 * RANK_POINTER + address.hashCode();
    }

    @Override
    public String toString() {
        return "&" + address;
    }
}

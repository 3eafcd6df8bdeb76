package onto.number;

/**
 * 实体种类标签。所有分派（算术、转换、强制转换）都基于此标签的 switch。
 */
public enum Kind {
    NATURE("Nature"),
    BEING("Being"),
    VOID("Void"),
    ZERO("Zero"),
    INFINITE("Infinite"),
    INTEGER("Integer"),
    NATURAL("Natural"),
    REAL("Real"),
    RATIONAL("Rational"),
    IRRATIONAL("Irrational"),
    COMPLEX("Complex"),
    NATURAL_COMPLEX("NaturalComplex");

    private final String typeName;

    Kind(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    public boolean isNumber() {
        switch (this) {
            case NATURE: case BEING: case VOID: return false;
            default: return true;
        }
    }

    /** 有序、有符号、可判零的种类 */
    public boolean isLinear() {
        return isNumber() && !isStructural();
    }

    public boolean isFinite() {
        switch (this) {
            case INTEGER: case NATURAL: case REAL: case RATIONAL: case IRRATIONAL: return true;
            default: return false;
        }
    }

    public boolean isIntegral() {
        return this == INTEGER || this == NATURAL;
    }

    public boolean isRealValued() {
        return this == REAL || this == RATIONAL || this == IRRATIONAL;
    }

    public boolean isStructural() {
        return this == COMPLEX || this == NATURAL_COMPLEX;
    }
}

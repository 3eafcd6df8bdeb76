package onto.number;

/**
 * 无界数（Zero / Infinite）的极性位
 */
public enum Polarity {
    POSITIVE, NEGATIVE;

    public static Polarity of(boolean positive) {
        return positive ? POSITIVE : NEGATIVE;
    }

    public boolean isPositive() {
        return this == POSITIVE;
    }

    /** 取反极性 */
    public Polarity invert() {
        return this == POSITIVE ? NEGATIVE : POSITIVE;
    }

    /** 两个极性相同时为正（乘除法的符号规则） */
    public Polarity times(Polarity other) {
        return of(this == other);
    }

    public String symbol() {
        return this == POSITIVE ? "+" : "-";
    }
}

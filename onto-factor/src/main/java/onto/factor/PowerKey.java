package onto.factor;

import java.math.BigInteger;

/**
 * 幂缓存的键：(底数, 指数)
 */
final class PowerKey {

    private final BigInteger base;
    private final BigInteger exponent;

    PowerKey(BigInteger base, BigInteger exponent) {
        this.base = base;
        this.exponent = exponent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PowerKey)) return false;
        PowerKey other = (PowerKey) o;
        return base.equals(other.base) && exponent.equals(other.exponent);
    }

    @Override
    public int hashCode() {
        return 31 * base.hashCode() + exponent.hashCode();
    }

    @Override
    public String toString() {
        return base + "^" + exponent;
    }
}

package onto.factor;

import onto.number.InvalidArgumentException;

import java.math.BigInteger;

/**
 * 幂因子 P：底数 p ≥ 0，指数本身是一个 {@link FactoredInteger}，值为 p^n。
 *
 * <p>未给出指数时指数为空积（值 1）。相等性按值比较，
 * 因此 {@code [4 ^ (1)]} 与 {@code [2 ^ (2)]} 相等。</p>
 */
public final class Factor {

    private final BigInteger base;
    private final FactoredInteger exponent;

    /** 惰性求得的值，并发下至多重复计算 */
    private volatile BigInteger value;

    public Factor(BigInteger base, FactoredInteger exponent) {
        if (base == null) {
            throw new InvalidArgumentException("factor base must not be null");
        }
        if (base.signum() < 0) {
            throw new InvalidArgumentException("factor base must not be negative: " + base);
        }
        this.base = base;
        this.exponent = exponent == null ? FactoredInteger.ONE : exponent;
    }

    public static Factor of(long base) {
        return of(BigInteger.valueOf(base));
    }

    public static Factor of(BigInteger base) {
        return new Factor(base, FactoredInteger.ONE);
    }

    public static Factor of(long base, long exponent) {
        return of(BigInteger.valueOf(base), BigInteger.valueOf(exponent));
    }

    public static Factor of(BigInteger base, BigInteger exponent) {
        return new Factor(base, FactoredInteger.of(exponent));
    }

    public static Factor of(BigInteger base, FactoredInteger exponent) {
        return new Factor(base, exponent);
    }

    public BigInteger getBase() {
        return base;
    }

    public FactoredInteger getExponent() {
        return exponent;
    }

    public BigInteger value() {
        return value(FullRangePow.getDefault());
    }

    public BigInteger value(FullRangePow pow) {
        if (pow == null) {
            throw new InvalidArgumentException("pow must not be null");
        }
        BigInteger v = value;
        if (v == null) {
            v = pow.pow(base, exponent.value(pow));
            value = v;
        }
        return v;
    }

    /**
     * 两个因子的乘积，结果为包含二者的因数分解整数
     */
    public FactoredInteger times(Factor other) {
        return FactoredInteger.of(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Factor)) return false;
        return value().equals(((Factor) o).value());
    }

    @Override
    public int hashCode() {
        return value().hashCode();
    }

    @Override
    public String toString() {
        return "[" + base + " ^ (" + exponent + ")]";
    }
}

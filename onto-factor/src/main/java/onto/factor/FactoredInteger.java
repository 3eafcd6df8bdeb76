package onto.factor;

import onto.number.InvalidArgumentException;
import onto.number.OntoNatural;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 因数分解整数 N：若干 {@link Factor} 的积，空积为 1。
 *
 * <p>不可变；{@code times} 返回新实例。值在首次求值时计算，
 * 指数可以大到超出 int 范围，幂运算交给 {@link FullRangePow}。</p>
 */
public final class FactoredInteger {

    public static final FactoredInteger ONE = new FactoredInteger(Collections.<Factor>emptyList());

    private final List<Factor> factors;

    private volatile BigInteger value;

    private FactoredInteger(List<Factor> factors) {
        this.factors = factors;
    }

    public static FactoredInteger of(Factor... factors) {
        if (factors == null) {
            throw new InvalidArgumentException("factors must not be null");
        }
        return of(Arrays.asList(factors));
    }

    public static FactoredInteger of(List<Factor> factors) {
        if (factors == null) {
            throw new InvalidArgumentException("factors must not be null");
        }
        List<Factor> copy = new ArrayList<>(factors.size());
        for (Factor f : factors) {
            if (f == null) {
                throw new InvalidArgumentException("factor must not be null");
            }
            copy.add(f);
        }
        if (copy.isEmpty()) return ONE;
        return new FactoredInteger(Collections.unmodifiableList(copy));
    }

    /** 单个因子 [n ^ (1)] */
    public static FactoredInteger of(long n) {
        return of(BigInteger.valueOf(n));
    }

    public static FactoredInteger of(BigInteger n) {
        return new FactoredInteger(Collections.singletonList(Factor.of(n)));
    }

    public List<Factor> getFactors() {
        return factors;
    }

    public boolean isEmpty() {
        return factors.isEmpty();
    }

    public FactoredInteger times(Factor factor) {
        if (factor == null) {
            throw new InvalidArgumentException("factor must not be null");
        }
        List<Factor> combined = new ArrayList<>(factors);
        combined.add(factor);
        return new FactoredInteger(Collections.unmodifiableList(combined));
    }

    public FactoredInteger times(FactoredInteger other) {
        if (other == null) {
            throw new InvalidArgumentException("factored integer must not be null");
        }
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<Factor> combined = new ArrayList<>(factors.size() + other.factors.size());
        combined.addAll(factors);
        combined.addAll(other.factors);
        return new FactoredInteger(Collections.unmodifiableList(combined));
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
            v = BigInteger.ONE;
            for (Factor f : factors) {
                v = v.multiply(f.value(pow));
            }
            value = v;
        }
        return v;
    }

    public OntoNatural toNatural() {
        return OntoNatural.of(value());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FactoredInteger)) return false;
        return value().equals(((FactoredInteger) o).value());
    }

    @Override
    public int hashCode() {
        return value().hashCode();
    }

    @Override
    public String toString() {
        if (factors.isEmpty()) return "1";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < factors.size(); i++) {
            if (i > 0) sb.append(" * ");
            sb.append(factors.get(i));
        }
        return sb.toString();
    }
}

package onto.number;

import java.util.Collection;

/**
 * 实数：有限的双精度值。
 *
 * <p>NaN 与 ±∞ 不是实数（无界值属于 {@link OntoInfinite}），构造时拒绝；
 * {@code -0.0} 归一化为 {@code 0.0}，因此相等性可以直接比较位模式。</p>
 */
@OntoType(kind = Kind.REAL, aliases = {"实数"}, description = "有限双精度实数")
public class OntoReal extends AbstractOntoNumber implements FiniteNumber {

    private final double value;

    public OntoReal(double value, Collection<? extends Existence> members) {
        super(members);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidArgumentException("real value must be finite: " + value);
        }
        this.value = value + 0.0;
    }

    public static OntoReal of(double value, Existence... members) {
        return new OntoReal(value, asMembers(members));
    }

    public double getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.REAL;
    }

    @Override
    public boolean isPositive() {
        return value >= 0;
    }

    @Override
    public boolean isZero() {
        return value == 0.0;
    }

    @Override
    public OntoReal negate() {
        return new OntoReal(-value, getMembers());
    }

    @Override
    public OntoReal withSign(boolean positive) {
        if (isPositive() == positive || isZero()) return this;
        return negate();
    }

    /** 是否为整数值 */
    public boolean isIntegral() {
        return value == Math.rint(value);
    }

    @Override
    public double scalarValue() {
        return value;
    }

    @Override
    public String asString() {
        return String.valueOf(value);
    }

    @Override
    protected boolean sameValue(Existence other) {
        return Double.doubleToLongBits(value) == Double.doubleToLongBits(((OntoReal) other).value);
    }

    @Override
    protected int valueHash() {
        return Double.hashCode(value);
    }
}

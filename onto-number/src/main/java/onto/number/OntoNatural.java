package onto.number;

import java.math.BigInteger;
import java.util.Collection;

/**
 * 自然数：限制为 ≥ 0 的整数。
 *
 * <p>负值构造抛出 {@link InvalidArgumentException}；强制设为负号抛出
 * {@link DomainViolationException}。对非零自然数取反会提升为 {@link OntoInteger}。</p>
 */
@OntoType(kind = Kind.NATURAL, aliases = {"自然数"}, description = "非负整数")
public final class OntoNatural extends OntoInteger {

    public OntoNatural(BigInteger value, Collection<? extends Existence> members) {
        super(checkNonNegative(value), members);
    }

    private static BigInteger checkNonNegative(BigInteger value) {
        if (value != null && value.signum() < 0) {
            throw new InvalidArgumentException("natural number must not be negative: " + value);
        }
        return value;
    }

    public static OntoNatural of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public static OntoNatural of(BigInteger value, Existence... members) {
        return new OntoNatural(value, asMembers(members));
    }

    @Override
    public Kind getKind() {
        return Kind.NATURAL;
    }

    @Override
    public boolean isPositive() {
        return true;
    }

    @Override
    public OntoInteger negate() {
        if (isZero()) return this;
        return new OntoInteger(getValue().negate(), getMembers());
    }

    @Override
    public OntoNatural withSign(boolean positive) {
        if (!positive) {
            throw new DomainViolationException("unable to set natural number to negative");
        }
        return this;
    }
}

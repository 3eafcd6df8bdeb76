package onto.number;

import java.math.BigInteger;
import java.util.Collection;

/**
 * 整数：任意精度有符号整数
 */
@OntoType(kind = Kind.INTEGER, aliases = {"整数"}, description = "任意精度有符号整数")
public class OntoInteger extends AbstractOntoNumber implements FiniteNumber {

    private final BigInteger value;

    public OntoInteger(BigInteger value, Collection<? extends Existence> members) {
        super(members);
        if (value == null) {
            throw new InvalidArgumentException("value must not be null");
        }
        this.value = value;
    }

    public static OntoInteger of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public static OntoInteger of(BigInteger value, Existence... members) {
        return new OntoInteger(value, asMembers(members));
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.INTEGER;
    }

    @Override
    public boolean isPositive() {
        return value.signum() >= 0;
    }

    @Override
    public boolean isZero() {
        return value.signum() == 0;
    }

    @Override
    public OntoInteger negate() {
        return new OntoInteger(value.negate(), getMembers());
    }

    @Override
    public OntoInteger withSign(boolean positive) {
        if (isPositive() == positive || isZero()) return this;
        return new OntoInteger(value.negate(), getMembers());
    }

    @Override
    public double scalarValue() {
        return value.doubleValue();
    }

    @Override
    public String asString() {
        return value.toString();
    }

    @Override
    protected boolean sameValue(Existence other) {
        return value.equals(((OntoInteger) other).value);
    }

    @Override
    protected int valueHash() {
        return value.hashCode();
    }
}

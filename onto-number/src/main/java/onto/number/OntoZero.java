package onto.number;

import java.util.Collection;
import java.util.Collections;

/**
 * 零：带极性的线性数，可以当作虚无看待。
 *
 * <p>与极性相反的 {@link OntoInfinite} 互为倒数对偶，见 {@link Conversions#zeroToInfinite(OntoZero)}。
 * 强制转换为原始类型时得到该类型的零值。</p>
 */
@OntoType(kind = Kind.ZERO, aliases = {"0", "零"}, description = "带极性的零")
public final class OntoZero extends AbstractOntoNumber implements LinearNumber {

    private final Polarity polarity;

    public OntoZero(Polarity polarity, Collection<? extends Existence> members) {
        super(members);
        if (polarity == null) {
            throw new InvalidArgumentException("polarity must not be null");
        }
        this.polarity = polarity;
    }

    public static OntoZero of(Polarity polarity, Existence... members) {
        return new OntoZero(polarity, asMembers(members));
    }

    public static OntoZero positive() {
        return new OntoZero(Polarity.POSITIVE, Collections.<Existence>emptyList());
    }

    public static OntoZero negative() {
        return new OntoZero(Polarity.NEGATIVE, Collections.<Existence>emptyList());
    }

    public Polarity getPolarity() {
        return polarity;
    }

    @Override
    public Kind getKind() {
        return Kind.ZERO;
    }

    @Override
    public boolean isPositive() {
        return polarity.isPositive();
    }

    @Override
    public boolean isZero() {
        return true;
    }

    @Override
    public OntoZero negate() {
        return new OntoZero(polarity.invert(), getMembers());
    }

    @Override
    public OntoZero withSign(boolean positive) {
        return polarity.isPositive() == positive ? this : negate();
    }

    @Override
    public double scalarValue() {
        return 0.0;
    }

    @Override
    public String asString() {
        return polarity.symbol() + "0";
    }

    @Override
    protected boolean sameValue(Existence other) {
        return polarity == ((OntoZero) other).polarity;
    }

    @Override
    protected int valueHash() {
        return polarity.ordinal();
    }
}

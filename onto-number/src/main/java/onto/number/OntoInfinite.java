package onto.number;

import java.util.Collection;
import java.util.Collections;

/**
 * 无穷：带极性的无界线性数。
 *
 * <p>吸收律：{@code ∞ + x = ∞}，{@code ∞ - x = ∞}，{@code ∞ × x = ∞}，极性不变，
 * 见 {@link OntoOps}。强制转换为原始类型时按极性饱和到该类型的最大/最小值。</p>
 */
@OntoType(kind = Kind.INFINITE, aliases = {"无穷", "无穷大"}, description = "带极性的无穷")
public final class OntoInfinite extends AbstractOntoNumber implements LinearNumber {

    private final Polarity polarity;

    public OntoInfinite(Polarity polarity, Collection<? extends Existence> members) {
        super(members);
        if (polarity == null) {
            throw new InvalidArgumentException("polarity must not be null");
        }
        this.polarity = polarity;
    }

    public static OntoInfinite of(Polarity polarity, Existence... members) {
        return new OntoInfinite(polarity, asMembers(members));
    }

    public static OntoInfinite positive() {
        return new OntoInfinite(Polarity.POSITIVE, Collections.<Existence>emptyList());
    }

    public static OntoInfinite negative() {
        return new OntoInfinite(Polarity.NEGATIVE, Collections.<Existence>emptyList());
    }

    public Polarity getPolarity() {
        return polarity;
    }

    @Override
    public Kind getKind() {
        return Kind.INFINITE;
    }

    @Override
    public boolean isPositive() {
        return polarity.isPositive();
    }

    @Override
    public boolean isZero() {
        return false;
    }

    @Override
    public OntoInfinite negate() {
        return new OntoInfinite(polarity.invert(), getMembers());
    }

    @Override
    public OntoInfinite withSign(boolean positive) {
        return polarity.isPositive() == positive ? this : negate();
    }

    @Override
    public double scalarValue() {
        return polarity.isPositive() ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
    }

    @Override
    public String asString() {
        return polarity.symbol() + "∞";
    }

    @Override
    protected boolean sameValue(Existence other) {
        return polarity == ((OntoInfinite) other).polarity;
    }

    @Override
    protected int valueHash() {
        return polarity.ordinal();
    }
}

package onto.number;

import java.util.Collection;

/**
 * 有理数：带分子/分母实数对的实数，值为 numerator / denominator。
 *
 * <p>相等性按商值比较（1/2 与 2/4 相等），分子分母本身不参与。</p>
 */
@OntoType(kind = Kind.RATIONAL, aliases = {"有理数"}, description = "分子/分母实数对")
public final class OntoRational extends OntoReal {

    private final OntoReal numerator;
    private final OntoReal denominator;

    public OntoRational(OntoReal numerator, OntoReal denominator, Collection<? extends Existence> members) {
        super(quotient(numerator, denominator), members);
        this.numerator = numerator;
        this.denominator = denominator;
    }

    private static double quotient(OntoReal numerator, OntoReal denominator) {
        if (numerator == null || denominator == null) {
            throw new InvalidArgumentException("numerator and denominator must not be null");
        }
        if (denominator.isZero()) {
            throw new InvalidArgumentException("denominator must not be zero");
        }
        return numerator.getValue() / denominator.getValue();
    }

    public static OntoRational of(OntoReal numerator, OntoReal denominator, Existence... members) {
        return new OntoRational(numerator, denominator, asMembers(members));
    }

    public static OntoRational of(double numerator, double denominator) {
        return of(OntoReal.of(numerator), OntoReal.of(denominator));
    }

    public OntoReal getNumerator() {
        return numerator;
    }

    public OntoReal getDenominator() {
        return denominator;
    }

    @Override
    public Kind getKind() {
        return Kind.RATIONAL;
    }

    @Override
    public OntoRational negate() {
        return new OntoRational(numerator.negate(), denominator, getMembers());
    }

    @Override
    public OntoRational withSign(boolean positive) {
        if (isPositive() == positive || isZero()) return this;
        return negate();
    }

    @Override
    public String asString() {
        return numerator.asString() + "/" + denominator.asString();
    }
}

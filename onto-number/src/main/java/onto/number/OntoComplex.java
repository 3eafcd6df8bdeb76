package onto.number;

import java.util.Collection;

/**
 * 复数：（实部，虚部）实数对
 */
@OntoType(kind = Kind.COMPLEX, aliases = {"复数", "实复数"}, description = "实数对构成的复数")
public final class OntoComplex extends AbstractOntoNumber implements StructuralNumber {

    /** 实部（低维） */
    private final OntoReal real;
    /** 虚部（高维） */
    private final OntoReal imaginary;

    public OntoComplex(OntoReal real, OntoReal imaginary, Collection<? extends Existence> members) {
        super(members);
        if (real == null || imaginary == null) {
            throw new InvalidArgumentException("complex parts must not be null");
        }
        this.real = real;
        this.imaginary = imaginary;
    }

    public static OntoComplex of(OntoReal real, OntoReal imaginary, Existence... members) {
        return new OntoComplex(real, imaginary, asMembers(members));
    }

    public static OntoComplex of(double real, double imaginary) {
        return of(OntoReal.of(real), OntoReal.of(imaginary));
    }

    public OntoReal getReal() {
        return real;
    }

    public OntoReal getImaginary() {
        return imaginary;
    }

    @Override
    public double realPart() {
        return real.getValue();
    }

    @Override
    public double imaginaryPart() {
        return imaginary.getValue();
    }

    @Override
    public Kind getKind() {
        return Kind.COMPLEX;
    }

    @Override
    public OntoComplex negate() {
        return new OntoComplex(real.negate(), imaginary.negate(), getMembers());
    }

    /** 共轭 */
    public OntoComplex conjugate() {
        return new OntoComplex(real, imaginary.negate(), getMembers());
    }

    @Override
    public String asString() {
        return "(" + real.asString() + ", " + imaginary.asString() + ")";
    }

    @Override
    protected boolean sameValue(Existence other) {
        // 按数值比较部件，Real 与 Rational 部件值相同即相等
        OntoComplex o = (OntoComplex) other;
        return Double.doubleToLongBits(realPart()) == Double.doubleToLongBits(o.realPart())
                && Double.doubleToLongBits(imaginaryPart()) == Double.doubleToLongBits(o.imaginaryPart());
    }

    @Override
    protected int valueHash() {
        return 31 * Double.hashCode(realPart()) + Double.hashCode(imaginaryPart());
    }
}

package onto.number;

import java.util.Collection;

/**
 * 自然复数：（实部，虚部）自然数对。经由自然数→实数提升嵌入 {@link OntoComplex}。
 */
@OntoType(kind = Kind.NATURAL_COMPLEX, aliases = {"自然复数"}, description = "自然数对构成的复数")
public final class OntoNaturalComplex extends AbstractOntoNumber implements StructuralNumber {

    private final OntoNatural real;
    private final OntoNatural imaginary;

    public OntoNaturalComplex(OntoNatural real, OntoNatural imaginary, Collection<? extends Existence> members) {
        super(members);
        if (real == null || imaginary == null) {
            throw new InvalidArgumentException("natural complex parts must not be null");
        }
        this.real = real;
        this.imaginary = imaginary;
    }

    public static OntoNaturalComplex of(OntoNatural real, OntoNatural imaginary, Existence... members) {
        return new OntoNaturalComplex(real, imaginary, asMembers(members));
    }

    public static OntoNaturalComplex of(long real, long imaginary) {
        return of(OntoNatural.of(real), OntoNatural.of(imaginary));
    }

    public OntoNatural getReal() {
        return real;
    }

    public OntoNatural getImaginary() {
        return imaginary;
    }

    @Override
    public double realPart() {
        return real.scalarValue();
    }

    @Override
    public double imaginaryPart() {
        return imaginary.scalarValue();
    }

    @Override
    public Kind getKind() {
        return Kind.NATURAL_COMPLEX;
    }

    @Override
    public String asString() {
        return "(" + real.asString() + ", " + imaginary.asString() + ")";
    }

    @Override
    protected boolean sameValue(Existence other) {
        OntoNaturalComplex o = (OntoNaturalComplex) other;
        return real.getValue().equals(o.real.getValue()) && imaginary.getValue().equals(o.imaginary.getValue());
    }

    @Override
    protected int valueHash() {
        return 31 * real.getValue().hashCode() + imaginary.getValue().hashCode();
    }
}

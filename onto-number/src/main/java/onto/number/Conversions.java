package onto.number;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 种类之间的显式具名转换。
 *
 * <p>每个转换都返回 {@link ConversionResult}：精确时为 Ok，会丢失信息时为 Err，
 * 输入为 null 时为 Absent。转换结果与输入共享成员集合。</p>
 */
public final class Conversions {

    private Conversions() {}

    // ============ Zero ↔ Infinite（极性对偶） ============

    /**
     * Zero(p) → Infinite(¬p)
     */
    public static ConversionResult<OntoInfinite> zeroToInfinite(OntoZero zero) {
        if (zero == null) return ConversionResult.absent();
        return ConversionResult.ok(new OntoInfinite(zero.getPolarity().invert(), zero.getMembers()));
    }

    /**
     * Infinite(p) → Zero(¬p)。与 {@link #zeroToInfinite(OntoZero)} 复合两次为恒等。
     */
    public static ConversionResult<OntoZero> infiniteToZero(OntoInfinite infinite) {
        if (infinite == null) return ConversionResult.absent();
        return ConversionResult.ok(new OntoZero(infinite.getPolarity().invert(), infinite.getMembers()));
    }

    // ============ Zero ↔ Void ============

    /**
     * Zero → Void，保留成员集合；Void 不携带极性
     */
    public static ConversionResult<OntoVoid> zeroToVoid(OntoZero zero) {
        if (zero == null) return ConversionResult.absent();
        return ConversionResult.ok(new OntoVoid(zero.getMembers()));
    }

    /**
     * Void → Zero，保留成员集合，极性为正
     */
    public static ConversionResult<OntoZero> voidToZero(OntoVoid v) {
        if (v == null) return ConversionResult.absent();
        return ConversionResult.ok(new OntoZero(Polarity.POSITIVE, v.getMembers()));
    }

    // ============ Being ↔ Void ============

    public static ConversionResult<OntoVoid> beingToVoid(OntoBeing being) {
        if (being == null) return ConversionResult.absent();
        return ConversionResult.ok(being.negate());
    }

    public static ConversionResult<OntoBeing> voidToBeing(OntoVoid v) {
        if (v == null) return ConversionResult.absent();
        return ConversionResult.ok(v.negate());
    }

    // ============ Integer ↔ Real ============

    /**
     * Integer → Real，仅当值能被 double 精确表示时成功
     */
    public static ConversionResult<OntoReal> integerToReal(OntoInteger integer) {
        if (integer == null) return ConversionResult.absent();
        BigInteger value = integer.getValue();
        double d = value.doubleValue();
        if (Double.isInfinite(d) || !new BigDecimal(d).toBigInteger().equals(value)) {
            return ConversionResult.err("integer " + value + " is not exactly representable as a real");
        }
        return ConversionResult.ok(new OntoReal(d, integer.getMembers()));
    }

    /**
     * Real → Integer，仅当值为整数时成功
     */
    public static ConversionResult<OntoInteger> realToInteger(OntoReal real) {
        if (real == null) return ConversionResult.absent();
        if (!real.isIntegral()) {
            return ConversionResult.err("real " + real.getValue() + " has a fractional part");
        }
        return ConversionResult.ok(new OntoInteger(toBigInteger(real.getValue()), real.getMembers()));
    }

    /**
     * Real → Integer，向零截断。显式的有损版本。
     */
    public static ConversionResult<OntoInteger> truncateToInteger(OntoReal real) {
        if (real == null) return ConversionResult.absent();
        return ConversionResult.ok(new OntoInteger(toBigInteger(real.getValue()), real.getMembers()));
    }

    // ============ Natural ↔ Integer ============

    public static ConversionResult<OntoInteger> naturalToInteger(OntoNatural natural) {
        if (natural == null) return ConversionResult.absent();
        return ConversionResult.ok(new OntoInteger(natural.getValue(), natural.getMembers()));
    }

    public static ConversionResult<OntoNatural> integerToNatural(OntoInteger integer) {
        if (integer == null) return ConversionResult.absent();
        if (integer.getValue().signum() < 0) {
            return ConversionResult.err("integer " + integer.getValue() + " is negative");
        }
        if (integer instanceof OntoNatural) {
            return ConversionResult.ok((OntoNatural) integer);
        }
        return ConversionResult.ok(new OntoNatural(integer.getValue(), integer.getMembers()));
    }

    // ============ NaturalComplex ↔ Complex ============

    /**
     * NaturalComplex → Complex：两个部件经 natural → real 提升
     */
    public static ConversionResult<OntoComplex> naturalComplexToComplex(OntoNaturalComplex nc) {
        if (nc == null) return ConversionResult.absent();
        ConversionResult<OntoReal> re = integerToReal(nc.getReal());
        if (!re.isOk()) return ConversionResult.err("real part: " + re.getError());
        ConversionResult<OntoReal> im = integerToReal(nc.getImaginary());
        if (!im.isOk()) return ConversionResult.err("imaginary part: " + im.getError());
        return ConversionResult.ok(new OntoComplex(re.getValue(), im.getValue(), nc.getMembers()));
    }

    /**
     * Complex → NaturalComplex：仅当两个部件都是非负整数值时成功
     */
    public static ConversionResult<OntoNaturalComplex> complexToNaturalComplex(OntoComplex c) {
        if (c == null) return ConversionResult.absent();
        OntoReal re = c.getReal();
        OntoReal im = c.getImaginary();
        if (!re.isIntegral() || !im.isIntegral() || !re.isPositive() || !im.isPositive()) {
            return ConversionResult.err("complex " + c.asString() + " has no natural components");
        }
        return ConversionResult.ok(new OntoNaturalComplex(
                new OntoNatural(toBigInteger(re.getValue()), re.getMembers()),
                new OntoNatural(toBigInteger(im.getValue()), im.getMembers()),
                c.getMembers()));
    }

    private static BigInteger toBigInteger(double value) {
        return new BigDecimal(value).toBigInteger();
    }
}

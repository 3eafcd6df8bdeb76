package onto.number;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Collections;

/**
 * 基于种类标签分派的算术运算。
 *
 * <p>线性数的分派顺序：</p>
 * <ol>
 *   <li>吸收：左操作数为 Infinite 时结果就是它本身（+ - × ÷ 均如此，极性不变）；
 *       仅右操作数为 Infinite 时 {@code x + ∞ = ∞}，{@code x - ∞ = -∞}，{@code x × ∞ = ∞}，
 *       {@code x ÷ ∞} 为带符号的 Zero</li>
 *   <li>Zero：加减的单位元；乘法得到 Zero；作除数时得到 Infinite；{@code 0 ÷ 0} 为不定式</li>
 *   <li>有限数塔：Natural → Integer → Rational → Real。Integer 与 Rational 之间的运算
 *       按 BigInteger 精确进行，结果约分后才转成 double 对</li>
 * </ol>
 *
 * <p>吸收与单位元分支原样返回操作数（包括其成员）；其余运算结果不带成员。</p>
 */
public final class OntoOps {

    private OntoOps() {}

    // ============ 线性数 ============

    public static LinearNumber add(LinearNumber a, LinearNumber b) {
        requireOperands(a, b);
        if (a.isInfinite()) return a;
        if (b.isInfinite()) return b;
        if (a.getKind() == Kind.ZERO) return b.getKind() == Kind.ZERO ? a : b;
        if (b.getKind() == Kind.ZERO) return a;
        return addFinite((FiniteNumber) a, (FiniteNumber) b);
    }

    public static LinearNumber subtract(LinearNumber a, LinearNumber b) {
        requireOperands(a, b);
        if (a.isInfinite()) return a;
        if (b.isInfinite()) return b.negate();
        if (a.getKind() == Kind.ZERO) return b.getKind() == Kind.ZERO ? a : b.negate();
        if (b.getKind() == Kind.ZERO) return a;
        return subtractFinite((FiniteNumber) a, (FiniteNumber) b);
    }

    public static LinearNumber multiply(LinearNumber a, LinearNumber b) {
        requireOperands(a, b);
        if (a.isInfinite()) return a;
        if (b.isInfinite()) return b;
        if (a.getKind() == Kind.ZERO) return zeroTimes((OntoZero) a, b);
        if (b.getKind() == Kind.ZERO) return zeroTimes((OntoZero) b, a);
        return multiplyFinite((FiniteNumber) a, (FiniteNumber) b);
    }

    public static LinearNumber divide(LinearNumber a, LinearNumber b) {
        requireOperands(a, b);
        if (a.isInfinite()) return a;
        if (a.isZero() && b.isZero()) {
            throw new DomainViolationException("indeterminate form: 0 / 0");
        }
        if (b.isInfinite()) {
            return new OntoZero(polarityOf(a).times(polarityOf(b)), Collections.<Existence>emptyList());
        }
        if (a.getKind() == Kind.ZERO) {
            return new OntoZero(polarityOf(a).times(polarityOf(b)), a.getMembers());
        }
        if (b.isZero()) {
            return new OntoInfinite(polarityOf(a).times(polarityOf(b)), Collections.<Existence>emptyList());
        }
        return divideFinite((FiniteNumber) a, (FiniteNumber) b);
    }

    public static LinearNumber negate(LinearNumber a) {
        requireOperands(a, a);
        return a.negate();
    }

    /**
     * 全序比较：-∞ < 所有有限数与零 < +∞。两个同极性的 Infinite 相等，Zero 的极性不参与比较。
     */
    public static int compare(LinearNumber a, LinearNumber b) {
        requireOperands(a, b);
        int ia = infiniteRank(a);
        int ib = infiniteRank(b);
        if (ia != 0 || ib != 0) {
            return Integer.compare(ia, ib);
        }
        return exactValue(a).compareTo(exactValue(b));
    }

    /**
     * 从 double 构造线性数：±∞ → Infinite，±0.0 → 对应极性的 Zero，其余 → Real
     */
    public static LinearNumber fromDouble(double value) {
        if (Double.isNaN(value)) {
            throw new InvalidArgumentException("NaN is not a number kind");
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? OntoInfinite.positive() : OntoInfinite.negative();
        }
        if (value == 0.0) {
            return Double.doubleToRawLongBits(value) == 0L ? OntoZero.positive() : OntoZero.negative();
        }
        return OntoReal.of(value);
    }

    // ============ 有限数塔 ============

    private static FiniteNumber addFinite(FiniteNumber a, FiniteNumber b) {
        if (bothIntegral(a, b)) {
            BigInteger sum = integerValue(a).add(integerValue(b));
            return bothNatural(a, b) ? OntoNatural.of(sum) : OntoInteger.of(sum);
        }
        if (bothExact(a, b)) {
            BigDecimal[] x = pairOf(a);
            BigDecimal[] y = pairOf(b);
            return rational(x[0].multiply(y[1]).add(y[0].multiply(x[1])), x[1].multiply(y[1]));
        }
        return real(a.scalarValue() + b.scalarValue());
    }

    private static FiniteNumber subtractFinite(FiniteNumber a, FiniteNumber b) {
        if (bothIntegral(a, b)) {
            return OntoInteger.of(integerValue(a).subtract(integerValue(b)));
        }
        if (bothExact(a, b)) {
            BigDecimal[] x = pairOf(a);
            BigDecimal[] y = pairOf(b);
            return rational(x[0].multiply(y[1]).subtract(y[0].multiply(x[1])), x[1].multiply(y[1]));
        }
        return real(a.scalarValue() - b.scalarValue());
    }

    private static FiniteNumber multiplyFinite(FiniteNumber a, FiniteNumber b) {
        if (bothIntegral(a, b)) {
            BigInteger product = integerValue(a).multiply(integerValue(b));
            return bothNatural(a, b) ? OntoNatural.of(product) : OntoInteger.of(product);
        }
        if (bothExact(a, b)) {
            BigDecimal[] x = pairOf(a);
            BigDecimal[] y = pairOf(b);
            return rational(x[0].multiply(y[0]), x[1].multiply(y[1]));
        }
        return real(a.scalarValue() * b.scalarValue());
    }

    /**
     * 整除时 Integer ÷ Integer 仍为 Integer（两个 Natural 得到 Natural），否则为约分后的 Rational
     */
    private static FiniteNumber divideFinite(FiniteNumber a, FiniteNumber b) {
        if (bothIntegral(a, b)) {
            BigInteger[] qr = integerValue(a).divideAndRemainder(integerValue(b));
            if (qr[1].signum() == 0) {
                return bothNatural(a, b) ? OntoNatural.of(qr[0]) : OntoInteger.of(qr[0]);
            }
        }
        if (bothExact(a, b)) {
            BigDecimal[] x = pairOf(a);
            BigDecimal[] y = pairOf(b);
            return rational(x[0].multiply(y[1]), x[1].multiply(y[0]));
        }
        return real(a.scalarValue() / b.scalarValue());
    }

    private static LinearNumber zeroTimes(OntoZero zero, LinearNumber other) {
        return new OntoZero(zero.getPolarity().times(polarityOf(other)), zero.getMembers());
    }

    // ============ 结构数 ============

    /**
     * NaturalComplex + NaturalComplex 仍为 NaturalComplex，其余组合提升为 Complex
     */
    public static StructuralNumber add(StructuralNumber a, StructuralNumber b) {
        requireOperands(a, b);
        if (a.getKind() == Kind.NATURAL_COMPLEX && b.getKind() == Kind.NATURAL_COMPLEX) {
            OntoNaturalComplex x = (OntoNaturalComplex) a;
            OntoNaturalComplex y = (OntoNaturalComplex) b;
            return OntoNaturalComplex.of(
                    OntoNatural.of(x.getReal().getValue().add(y.getReal().getValue())),
                    OntoNatural.of(x.getImaginary().getValue().add(y.getImaginary().getValue())));
        }
        return OntoComplex.of(a.realPart() + b.realPart(), a.imaginaryPart() + b.imaginaryPart());
    }

    public static OntoComplex subtract(StructuralNumber a, StructuralNumber b) {
        requireOperands(a, b);
        return OntoComplex.of(a.realPart() - b.realPart(), a.imaginaryPart() - b.imaginaryPart());
    }

    /**
     * (a + bi)(c + di) = (ac - bd) + (ad + bc)i
     */
    public static OntoComplex multiply(StructuralNumber a, StructuralNumber b) {
        requireOperands(a, b);
        double re = a.realPart() * b.realPart() - a.imaginaryPart() * b.imaginaryPart();
        double im = a.realPart() * b.imaginaryPart() + a.imaginaryPart() * b.realPart();
        return OntoComplex.of(re, im);
    }

    public static OntoComplex negate(StructuralNumber a) {
        requireOperands(a, a);
        return OntoComplex.of(-a.realPart(), -a.imaginaryPart());
    }

    // ============ 辅助 ============

    private static void requireOperands(Object a, Object b) {
        if (a == null || b == null) {
            throw new InvalidArgumentException("operand must not be null");
        }
    }

    private static Polarity polarityOf(LinearNumber n) {
        return Polarity.of(n.isPositive());
    }

    private static int infiniteRank(LinearNumber n) {
        if (!n.isInfinite()) return 0;
        return n.isPositive() ? 1 : -1;
    }

    private static BigDecimal exactValue(LinearNumber n) {
        if (n.getKind().isIntegral()) {
            return new BigDecimal(((OntoInteger) n).getValue());
        }
        if (n.getKind() == Kind.ZERO) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(n.scalarValue());
    }

    private static boolean bothIntegral(FiniteNumber a, FiniteNumber b) {
        return a.getKind().isIntegral() && b.getKind().isIntegral();
    }

    private static boolean bothNatural(FiniteNumber a, FiniteNumber b) {
        return a.getKind() == Kind.NATURAL && b.getKind() == Kind.NATURAL;
    }

    /** Integer、Natural、Rational 都有精确的分子/分母 */
    private static boolean bothExact(FiniteNumber a, FiniteNumber b) {
        return isExact(a) && isExact(b);
    }

    private static boolean isExact(FiniteNumber n) {
        return n.getKind().isIntegral() || n.getKind() == Kind.RATIONAL;
    }

    private static BigInteger integerValue(FiniteNumber n) {
        return ((OntoInteger) n).getValue();
    }

    /** 精确的 (分子, 分母)，Rational 的 double 部件按其精确十进制值展开 */
    private static BigDecimal[] pairOf(FiniteNumber n) {
        if (n.getKind() == Kind.RATIONAL) {
            OntoRational r = (OntoRational) n;
            return new BigDecimal[]{
                    new BigDecimal(r.getNumerator().getValue()),
                    new BigDecimal(r.getDenominator().getValue())};
        }
        return new BigDecimal[]{new BigDecimal(integerValue(n)), BigDecimal.ONE};
    }

    /**
     * 把精确的分子/分母化为互素整数对再构造 Rational。
     * 约分后的分子或分母无法被 double 精确表示时，退化为其商的 Real。
     */
    private static FiniteNumber rational(BigDecimal numerator, BigDecimal denominator) {
        int scale = Math.max(0, Math.max(numerator.scale(), denominator.scale()));
        BigInteger n = numerator.movePointRight(scale).toBigIntegerExact();
        BigInteger d = denominator.movePointRight(scale).toBigIntegerExact();
        if (d.signum() < 0) {
            n = n.negate();
            d = d.negate();
        }
        BigInteger gcd = n.gcd(d);
        if (gcd.signum() != 0 && !gcd.equals(BigInteger.ONE)) {
            n = n.divide(gcd);
            d = d.divide(gcd);
        }
        if (isExactDouble(n) && isExactDouble(d)) {
            return OntoRational.of(n.doubleValue(), d.doubleValue());
        }
        return real(new BigDecimal(n).divide(new BigDecimal(d), MathContext.DECIMAL128).doubleValue());
    }

    private static boolean isExactDouble(BigInteger v) {
        double d = v.doubleValue();
        return !Double.isInfinite(d) && new BigDecimal(d).toBigIntegerExact().equals(v);
    }

    private static FiniteNumber real(double value) {
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            throw new DomainViolationException("finite arithmetic overflowed: " + value);
        }
        return OntoReal.of(value);
    }
}

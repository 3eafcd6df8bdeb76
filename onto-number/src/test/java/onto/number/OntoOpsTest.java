package onto.number;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 算术分派测试
 */
class OntoOpsTest {

    private static List<LinearNumber> samples() {
        return Arrays.<LinearNumber>asList(
                OntoNatural.of(0), OntoNatural.of(7),
                OntoInteger.of(-3), OntoInteger.of(BigInteger.TEN.pow(30)),
                OntoReal.of(2.5), OntoReal.of(-0.25),
                OntoRational.of(1, 3), OntoIrrational.of(Math.E),
                OntoZero.positive(), OntoZero.negative(),
                OntoInfinite.positive(), OntoInfinite.negative());
    }

    @Nested
    @DisplayName("吸收")
    class AbsorptionTest {

        @Test
        @DisplayName("左操作数为 Infinite 时结果为其本身")
        void testLeftInfiniteAbsorbs() {
            for (OntoInfinite inf : Arrays.asList(OntoInfinite.positive(), OntoInfinite.negative())) {
                for (LinearNumber x : samples()) {
                    assertThat(OntoOps.add(inf, x)).as("%s + %s", inf, x).isSameAs(inf);
                    assertThat(OntoOps.subtract(inf, x)).as("%s - %s", inf, x).isSameAs(inf);
                    assertThat(OntoOps.multiply(inf, x)).as("%s * %s", inf, x).isSameAs(inf);
                    assertThat(OntoOps.divide(inf, x)).as("%s / %s", inf, x).isSameAs(inf);
                }
            }
        }

        @Test
        @DisplayName("Integer(2) + Infinite(+) == Infinite(+)")
        void testIntegerPlusInfinite() {
            assertThat(OntoOps.add(OntoInteger.of(2), OntoInfinite.positive()))
                    .isEqualTo(OntoInfinite.positive());
        }

        @Test
        @DisplayName("右操作数为 Infinite")
        void testRightInfinite() {
            assertThat(OntoOps.subtract(OntoInteger.of(1), OntoInfinite.positive()))
                    .isEqualTo(OntoInfinite.negative());
            assertThat(OntoOps.multiply(OntoReal.of(-2), OntoInfinite.positive()))
                    .isEqualTo(OntoInfinite.positive());
            assertThat(OntoOps.divide(OntoInteger.of(3), OntoInfinite.negative()))
                    .isEqualTo(OntoZero.negative());
            assertThat(OntoOps.divide(OntoInteger.of(-3), OntoInfinite.negative()))
                    .isEqualTo(OntoZero.positive());
        }
    }

    @Nested
    @DisplayName("Zero")
    class ZeroTest {

        @Test
        @DisplayName("加减单位元")
        void testIdentity() {
            OntoInteger five = OntoInteger.of(5);
            assertThat(OntoOps.add(OntoZero.negative(), five)).isSameAs(five);
            assertThat(OntoOps.subtract(five, OntoZero.positive())).isSameAs(five);
            assertThat(OntoOps.subtract(OntoZero.positive(), five)).isEqualTo(OntoInteger.of(-5));
        }

        @Test
        @DisplayName("乘以 Zero 得到 Zero")
        void testMultiply() {
            assertThat(OntoOps.multiply(OntoInteger.of(3), OntoZero.positive())).isEqualTo(OntoZero.positive());
            assertThat(OntoOps.multiply(OntoInteger.of(-3), OntoZero.positive())).isEqualTo(OntoZero.negative());
        }

        @Test
        @DisplayName("除以零得到 Infinite")
        void testDivideByZero() {
            assertThat(OntoOps.divide(OntoInteger.of(-3), OntoZero.positive())).isEqualTo(OntoInfinite.negative());
            assertThat(OntoOps.divide(OntoReal.of(2), OntoInteger.of(0))).isEqualTo(OntoInfinite.positive());
        }

        @Test
        @DisplayName("0 / 0 为不定式")
        void testIndeterminate() {
            assertThatThrownBy(() -> OntoOps.divide(OntoZero.positive(), OntoZero.negative()))
                    .isInstanceOf(DomainViolationException.class);
            assertThatThrownBy(() -> OntoOps.divide(OntoInteger.of(0), OntoReal.of(0)))
                    .isInstanceOf(DomainViolationException.class);
        }
    }

    @Nested
    @DisplayName("有限数塔")
    class TowerTest {

        @Test
        @DisplayName("Natural 加乘保持 Natural，减法得到 Integer")
        void testNatural() {
            assertThat(OntoOps.add(OntoNatural.of(2), OntoNatural.of(3))).isEqualTo(OntoNatural.of(5));
            assertThat(OntoOps.multiply(OntoNatural.of(2), OntoNatural.of(3))).isEqualTo(OntoNatural.of(6));
            assertThat(OntoOps.subtract(OntoNatural.of(2), OntoNatural.of(3))).isEqualTo(OntoInteger.of(-1));
        }

        @Test
        @DisplayName("Integer 除法得到 Rational")
        void testIntegerDivide() {
            LinearNumber q = OntoOps.divide(OntoInteger.of(1), OntoInteger.of(2));
            assertThat(q.getKind()).isEqualTo(Kind.RATIONAL);
            assertThat(q.scalarValue()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("大整数整除仍为 Integer")
        void testLargeExactQuotient() {
            BigInteger big = BigInteger.TEN.pow(400);
            LinearNumber q = OntoOps.divide(OntoInteger.of(big), OntoInteger.of(BigInteger.TEN.pow(399)));
            assertThat(q).isEqualTo(OntoInteger.of(10));
            assertThat(OntoOps.divide(OntoNatural.of(big), OntoNatural.of(big))).isEqualTo(OntoNatural.of(1));
            assertThat(OntoOps.divide(OntoInteger.of(-12), OntoNatural.of(4))).isEqualTo(OntoInteger.of(-3));
        }

        @Test
        @DisplayName("超出 double 精度的整数除以 1 不丢失精度")
        void testBeyondDoublePrecision() {
            BigInteger n = BigInteger.ONE.shiftLeft(53).add(BigInteger.ONE);
            LinearNumber q = OntoOps.divide(OntoInteger.of(n), OntoInteger.of(1));
            assertThat(q).isEqualTo(OntoInteger.of(n));
            assertThat(OntoOps.compare(q, OntoInteger.of(n))).isZero();
        }

        @Test
        @DisplayName("不整除的大整数先约分再构造 Rational")
        void testReducedBeforeRational() {
            BigInteger big = BigInteger.TEN.pow(400);
            LinearNumber q = OntoOps.divide(OntoInteger.of(big), OntoInteger.of(big.multiply(BigInteger.valueOf(4))));
            assertThat(q).isInstanceOf(OntoRational.class);
            OntoRational r = (OntoRational) q;
            assertThat(r.getNumerator().getValue()).isEqualTo(1.0);
            assertThat(r.getDenominator().getValue()).isEqualTo(4.0);

            LinearNumber neg = OntoOps.divide(OntoInteger.of(6), OntoInteger.of(-4));
            assertThat(((OntoRational) neg).getNumerator().getValue()).isEqualTo(-3.0);
            assertThat(((OntoRational) neg).getDenominator().getValue()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("约分后无法用 double 对表示时退化为 Real")
        void testUnrepresentablePair() {
            BigInteger n = BigInteger.ONE.shiftLeft(53).add(BigInteger.ONE);
            LinearNumber q = OntoOps.divide(OntoInteger.of(n), OntoInteger.of(2));
            assertThat(q.getKind()).isEqualTo(Kind.REAL);
            assertThat(q.scalarValue()).isEqualTo(n.doubleValue() / 2);

        }

        @Test
        @DisplayName("精确结果超出 Real 的有限范围时抛出 DomainViolationException")
        void testExactResultBeyondRealRange() {
            BigInteger big = BigInteger.TEN.pow(400);
            assertThatThrownBy(() -> OntoOps.add(OntoInteger.of(big), OntoRational.of(1, 2)))
                    .isInstanceOf(DomainViolationException.class)
                    .hasMessageContaining("overflowed");
            assertThat(OntoOps.add(OntoInteger.of(BigInteger.TEN.pow(20)), OntoRational.of(1, 2)).getKind())
                    .isEqualTo(Kind.REAL);
        }

        @Test
        @DisplayName("Rational 运算保持精确分子分母")
        void testRational() {
            LinearNumber sum = OntoOps.add(OntoRational.of(1, 2), OntoRational.of(1, 3));
            assertThat(sum).isInstanceOf(OntoRational.class);
            OntoRational r = (OntoRational) sum;
            assertThat(r.getNumerator().getValue()).isEqualTo(5.0);
            assertThat(r.getDenominator().getValue()).isEqualTo(6.0);

            LinearNumber product = OntoOps.multiply(OntoRational.of(2, 3), OntoInteger.of(3));
            assertThat(product.getKind()).isEqualTo(Kind.RATIONAL);
            assertThat(product.scalarValue()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("含 Real 时得到 Real")
        void testReal() {
            assertThat(OntoOps.add(OntoReal.of(0.5), OntoInteger.of(1))).isEqualTo(OntoReal.of(1.5));
            assertThat(OntoOps.multiply(OntoIrrational.of(2.0), OntoRational.of(1, 2))).isEqualTo(OntoReal.of(1.0));
        }

        @Test
        @DisplayName("溢出抛出 DomainViolationException")
        void testOverflow() {
            assertThatThrownBy(() -> OntoOps.multiply(OntoReal.of(Double.MAX_VALUE), OntoReal.of(2)))
                    .isInstanceOf(DomainViolationException.class);
        }

        @Test
        @DisplayName("null 操作数")
        void testNullOperand() {
            assertThatThrownBy(() -> OntoOps.add((LinearNumber) null, OntoInteger.of(1)))
                    .isInstanceOf(InvalidArgumentException.class);
        }
    }

    @Nested
    @DisplayName("比较")
    class CompareTest {

        @Test
        @DisplayName("无穷位于两端")
        void testInfinities() {
            assertThat(OntoOps.compare(OntoInfinite.negative(), OntoInteger.of(0))).isNegative();
            assertThat(OntoOps.compare(OntoInfinite.positive(), OntoReal.of(1e300))).isPositive();
            assertThat(OntoOps.compare(OntoInfinite.positive(), OntoInfinite.positive())).isZero();
        }

        @Test
        @DisplayName("跨种类精确比较")
        void testAcrossKinds() {
            assertThat(OntoOps.compare(OntoInteger.of(3), OntoRational.of(6, 2))).isZero();
            assertThat(OntoOps.compare(OntoZero.negative(), OntoZero.positive())).isZero();
            assertThat(OntoOps.compare(OntoReal.of(-0.1), OntoZero.positive())).isNegative();
            BigInteger big = BigInteger.ONE.shiftLeft(80);
            assertThat(OntoOps.compare(OntoInteger.of(big.add(BigInteger.ONE)), OntoInteger.of(big))).isPositive();
        }
    }

    @Nested
    @DisplayName("结构数")
    class StructuralTest {

        @Test
        @DisplayName("自然复数相加保持种类")
        void testNaturalComplexAdd() {
            assertThat(OntoOps.add(OntoNaturalComplex.of(1, 2), OntoNaturalComplex.of(3, 4)))
                    .isEqualTo(OntoNaturalComplex.of(4, 6));
            assertThat(OntoOps.add(OntoNaturalComplex.of(1, 0), OntoComplex.of(0.5, 0)))
                    .isEqualTo(OntoComplex.of(1.5, 0));
        }

        @Test
        @DisplayName("i × i = -1")
        void testImaginarySquare() {
            assertThat(OntoOps.multiply(OntoComplex.of(0, 1), OntoComplex.of(0, 1)))
                    .isEqualTo(OntoComplex.of(-1, 0));
            assertThat(OntoOps.subtract(OntoComplex.of(1, 1), OntoNaturalComplex.of(1, 1)))
                    .isEqualTo(OntoComplex.of(0, 0));
        }
    }

    @Test
    @DisplayName("fromDouble")
    void testFromDouble() {
        assertThat(OntoOps.fromDouble(Double.NEGATIVE_INFINITY)).isEqualTo(OntoInfinite.negative());
        assertThat(OntoOps.fromDouble(-0.0)).isEqualTo(OntoZero.negative());
        assertThat(OntoOps.fromDouble(0.0)).isEqualTo(OntoZero.positive());
        assertThat(OntoOps.fromDouble(1.25)).isEqualTo(OntoReal.of(1.25));
        assertThatThrownBy(() -> OntoOps.fromDouble(Double.NaN)).isInstanceOf(InvalidArgumentException.class);
    }
}

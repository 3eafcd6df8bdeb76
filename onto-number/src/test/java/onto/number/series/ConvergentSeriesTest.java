package onto.number.series;

import onto.number.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConvergentSeries 测试")
class ConvergentSeriesTest {

    @Test
    @DisplayName("π")
    void testPi() {
        assertThat(ConvergentSeries.pi()).isCloseTo(Math.PI, within(1e-12));
        assertThat(ConvergentSeries.pi(1)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("e 与 e^x")
    void testE() {
        assertThat(ConvergentSeries.e()).isCloseTo(Math.E, within(1e-12));
        assertThat(ConvergentSeries.e(100, 2.0)).isCloseTo(Math.exp(2.0), within(1e-10));
        assertThat(ConvergentSeries.e(1, 5.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("ζ(2) 部分和")
    void testZeta() {
        assertThat(ConvergentSeries.zeta(2.0, 100000)).isCloseTo(Math.PI * Math.PI / 6, within(1e-4));
        assertThat(ConvergentSeries.zeta(2.0, 1)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("1 ∓ 1/m 链的不动点")
    void testChains() {
        assertThat(ConvergentSeries.oneLess(60, 2)).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(ConvergentSeries.oneMore(60, 2)).isCloseTo(2.0, within(1e-12));
        assertThat(ConvergentSeries.oneMore(0, 2)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("固定系数的变体")
    void testFixedCoefficientVariants() {
        assertThat(ConvergentSeries.piX(100)).isEqualTo(4.0);
        assertThat(ConvergentSeries.piY(100, 10000)).isCloseTo(2.0 * 20001 / 10001, within(1e-12));
        assertThat(ConvergentSeries.piY(1, 2)).isEqualTo(2.5);
        assertThat(ConvergentSeries.em(100, 1.0, 10000)).isCloseTo(1.0 / (1.0 - 1e-4), within(1e-12));
        assertThat(ConvergentSeries.em(1, 1.0, 10)).isEqualTo(1.0);
        assertThatThrownBy(() -> ConvergentSeries.piY(10, 0)).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ConvergentSeries.em(10, 1.0, 0)).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("非法参数")
    void testInvalid() {
        assertThatThrownBy(() -> ConvergentSeries.pi(0)).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ConvergentSeries.zeta(2.0, -1)).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ConvergentSeries.oneLess(10, 0)).isInstanceOf(InvalidArgumentException.class);
    }
}

package onto.number;

/**
 * 结构数：有序数对，轴之间无序（Complex、NaturalComplex）
 */
public interface StructuralNumber extends OntoNumber {

    /** 实部（低维）的标量值 */
    double realPart();

    /** 虚部（高维）的标量值 */
    double imaginaryPart();

    /**
     * 模长
     */
    default double magnitude() {
        return Math.hypot(realPart(), imaginaryPart());
    }

    /**
     * 相位角（弧度）
     */
    default double phase() {
        return Math.atan2(imaginaryPart(), realPart());
    }

    @Override
    default double scalarValue() {
        return magnitude();
    }
}

package onto.number;

/**
 * 有限数：Integer、Natural、Real、Rational、Irrational
 */
public interface FiniteNumber extends LinearNumber {

    @Override
    FiniteNumber negate();

    @Override
    default boolean isInfinite() {
        return false;
    }
}

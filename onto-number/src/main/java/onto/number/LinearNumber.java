package onto.number;

/**
 * 线性数：有序、有符号、可判零。
 *
 * <p>原始类型强制转换统一委托给 {@link PrimitiveCoercions}，越界时饱和。</p>
 */
public interface LinearNumber extends OntoNumber {

    /**
     * 是否为正。与原始实现一致，零值视为正。
     */
    boolean isPositive();

    boolean isZero();

    /**
     * 算术取反
     */
    LinearNumber negate();

    /**
     * 返回符号被设为给定值的新实例。
     *
     * @throws DomainViolationException 种类的符号固定（如 Natural）而要求改变时
     */
    LinearNumber withSign(boolean positive);

    default boolean isInfinite() {
        return getKind() == Kind.INFINITE;
    }

    // ============ 原始类型强制转换 ============

    default byte toByte() {
        return PrimitiveCoercions.toByte(this);
    }

    default short toShort() {
        return PrimitiveCoercions.toShort(this);
    }

    default int toInt() {
        return PrimitiveCoercions.toInt(this);
    }

    default long toLong() {
        return PrimitiveCoercions.toLong(this);
    }

    default int toUnsignedByte() {
        return PrimitiveCoercions.toUnsignedByte(this);
    }

    default int toUnsignedShort() {
        return PrimitiveCoercions.toUnsignedShort(this);
    }

    default long toUnsignedInt() {
        return PrimitiveCoercions.toUnsignedInt(this);
    }

    default long toUnsignedLong() {
        return PrimitiveCoercions.toUnsignedLong(this);
    }

    default float toFloat() {
        return PrimitiveCoercions.toFloat(this);
    }

    default double toDouble() {
        return PrimitiveCoercions.toDouble(this);
    }
}

package onto.number;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 线性数到定宽原始类型的饱和强制转换。
 *
 * <ul>
 *   <li>Infinite：正极性饱和到类型最大值，负极性饱和到最小值（无符号类型为 0），浮点为 ±∞</li>
 *   <li>Zero：类型的零值</li>
 *   <li>有限数：超出范围时饱和；实数先向零截断</li>
 *   <li>null：退回到零值。与转换中 Absent 的传播规则不一致</li>
 * </ul>
 *
 * <p>Java 没有无符号类型，无符号结果放在更宽的有符号类型中；
 * {@link #toUnsignedLong(LinearNumber)} 返回 64 位无符号位模式，
 * 可用 {@link Long#toUnsignedString(long)} 查看。</p>
 */
public final class PrimitiveCoercions {

    private PrimitiveCoercions() {}

    private static final BigInteger UNSIGNED_LONG_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
    private static final double TWO_POW_64 = 18446744073709551616.0;

    public static byte toByte(LinearNumber n) {
        return (byte) clamp(n, Byte.MIN_VALUE, Byte.MAX_VALUE);
    }

    public static short toShort(LinearNumber n) {
        return (short) clamp(n, Short.MIN_VALUE, Short.MAX_VALUE);
    }

    public static int toInt(LinearNumber n) {
        return (int) clamp(n, Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    public static long toLong(LinearNumber n) {
        return clamp(n, Long.MIN_VALUE, Long.MAX_VALUE);
    }

    /** 0..255 */
    public static int toUnsignedByte(LinearNumber n) {
        return (int) clamp(n, 0, 0xFF);
    }

    /** 0..65535 */
    public static int toUnsignedShort(LinearNumber n) {
        return (int) clamp(n, 0, 0xFFFF);
    }

    /** 0..2^32-1 */
    public static long toUnsignedInt(LinearNumber n) {
        return clamp(n, 0, 0xFFFF_FFFFL);
    }

    /**
     * 0..2^64-1，以 long 位模式返回（最大值为 -1L）
     */
    public static long toUnsignedLong(LinearNumber n) {
        if (n == null) return 0L;
        switch (n.getKind()) {
            case ZERO:
                return 0L;
            case INFINITE:
                return n.isPositive() ? -1L : 0L;
            case INTEGER:
            case NATURAL: {
                BigInteger v = ((OntoInteger) n).getValue();
                if (v.signum() <= 0) return 0L;
                return v.min(UNSIGNED_LONG_MAX).longValue();
            }
            default: {
                double d = n.scalarValue();
                if (!(d > 0)) return 0L;
                if (d >= TWO_POW_64) return -1L;
                return new BigDecimal(d).toBigInteger().longValue();
            }
        }
    }

    public static float toFloat(LinearNumber n) {
        if (n == null) return 0.0f;
        switch (n.getKind()) {
            case ZERO:
                return 0.0f;
            case INFINITE:
                return n.isPositive() ? Float.POSITIVE_INFINITY : Float.NEGATIVE_INFINITY;
            default:
                // 超出 float 范围时自然溢出为 ±∞，即饱和
                return (float) n.scalarValue();
        }
    }

    public static double toDouble(LinearNumber n) {
        if (n == null) return 0.0;
        switch (n.getKind()) {
            case ZERO:
                return 0.0;
            case INFINITE:
                return n.isPositive() ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
            default:
                return n.scalarValue();
        }
    }

    /**
     * 饱和到 [min, max]
     */
    static long clamp(LinearNumber n, long min, long max) {
        if (n == null) return 0L;
        switch (n.getKind()) {
            case ZERO:
                return 0L;
            case INFINITE:
                return n.isPositive() ? max : min;
            case INTEGER:
            case NATURAL: {
                BigInteger v = ((OntoInteger) n).getValue();
                if (v.compareTo(BigInteger.valueOf(max)) >= 0) return max;
                if (v.compareTo(BigInteger.valueOf(min)) <= 0) return min;
                return v.longValue();
            }
            default: {
                double d = n.scalarValue();
                if (d >= (double) max) return max;
                if (d <= (double) min) return min;
                long truncated = (long) d;
                return Math.max(min, Math.min(max, truncated));
            }
        }
    }
}

package onto.number;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 饱和强制转换测试
 */
@DisplayName("PrimitiveCoercions 测试")
class PrimitiveCoercionsTest {

    @Test
    @DisplayName("Infinite 饱和到类型边界")
    void testInfiniteSaturates() {
        OntoInfinite pos = OntoInfinite.positive();
        OntoInfinite neg = OntoInfinite.negative();

        assertEquals(Byte.MAX_VALUE, pos.toByte());
        assertEquals(Byte.MIN_VALUE, neg.toByte());
        assertEquals(Short.MIN_VALUE, neg.toShort());
        assertEquals(Integer.MAX_VALUE, pos.toInt());
        assertEquals(Long.MIN_VALUE, neg.toLong());
        assertEquals(255, pos.toUnsignedByte());
        assertEquals(0, neg.toUnsignedByte());
        assertEquals(0xFFFF, pos.toUnsignedShort());
        assertEquals(0xFFFF_FFFFL, pos.toUnsignedInt());
        assertEquals(-1L, pos.toUnsignedLong());
        assertEquals(0L, neg.toUnsignedLong());
        assertEquals(Float.POSITIVE_INFINITY, pos.toFloat());
        assertEquals(Double.NEGATIVE_INFINITY, neg.toDouble());
    }

    @Test
    @DisplayName("Zero 转为类型零值")
    void testZero() {
        OntoZero z = OntoZero.negative();
        assertEquals(0, z.toInt());
        assertEquals(0L, z.toLong());
        assertEquals(0L, z.toUnsignedLong());
        assertEquals(0.0, z.toDouble(), 0.0);
    }

    @Test
    @DisplayName("有限值在边界饱和")
    void testFiniteSaturates() {
        assertEquals(Byte.MAX_VALUE, OntoInteger.of(300).toByte());
        assertEquals(Integer.MAX_VALUE, OntoInteger.of(1L << 40).toInt());
        assertEquals(Short.MAX_VALUE, OntoReal.of(1e10).toShort());
        assertEquals(0L, OntoInteger.of(-5).toUnsignedInt());
        assertEquals(Long.MAX_VALUE, OntoInteger.of(BigInteger.TEN.pow(30)).toLong());
        assertEquals(Float.POSITIVE_INFINITY, OntoReal.of(1e300).toFloat());
    }

    @Test
    @DisplayName("实数向零截断")
    void testTruncation() {
        assertEquals(-3, OntoReal.of(-3.7).toInt());
        assertEquals(3, OntoReal.of(3.7).toInt());
        assertEquals(2, OntoRational.of(5, 2).toByte());
    }

    @Test
    @DisplayName("无符号 long 使用位模式")
    void testUnsignedLong() {
        BigInteger twoPow63 = BigInteger.ONE.shiftLeft(63);
        long bits = OntoInteger.of(twoPow63).toUnsignedLong();
        assertEquals("9223372036854775808", Long.toUnsignedString(bits));
        assertEquals(-1L, OntoInteger.of(BigInteger.ONE.shiftLeft(64).add(BigInteger.TEN)).toUnsignedLong());
        assertEquals(-1L, OntoReal.of(1e20).toUnsignedLong());
        assertEquals(12L, OntoReal.of(12.9).toUnsignedLong());
    }

    @Test
    @DisplayName("null 退回到零值")
    void testNullFallback() {
        assertEquals(0, PrimitiveCoercions.toInt(null));
        assertEquals(0L, PrimitiveCoercions.toUnsignedLong(null));
        assertEquals(0.0f, PrimitiveCoercions.toFloat(null));
        assertEquals(0.0, PrimitiveCoercions.toDouble(null), 0.0);
    }
}

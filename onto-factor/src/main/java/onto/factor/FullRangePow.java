package onto.factor;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import onto.number.DomainViolationException;
import onto.number.InvalidArgumentException;

import java.math.BigInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 全范围幂运算：指数可以超过 {@link BigInteger#pow(int)} 能直接接受的范围。
 *
 * <p>指数不超过上限时直接求幂；否则把指数按上限拆成商和余数，
 * 先求一次 {@code p^ceiling}，再连乘商次，最后乘上 {@code p^余数}。
 * 任何时候都不会以超出上限的指数调用直接求幂。</p>
 *
 * <p>每块的工作量与上限成正比，总工作量随 指数/上限 的块数线性增长。</p>
 *
 * <p>实际上限：BigInteger 的数值最多约 2^31 位。底数为 0 或 1 时任意大的指数都能求值；
 * 底数 ≥ 2 时结果超过这一位数会抛出 {@link DomainViolationException}，
 * 例如底数 2 的指数不能超过约 2^31。</p>
 *
 * <p>求得的幂按 (底数, 指数) 缓存，缓存容量按结果的位数计重。</p>
 */
public final class FullRangePow {

    private static final Logger LOG = Logger.getLogger(FullRangePow.class.getName());

    private static volatile FullRangePow defaultInstance;

    private final int ceiling;
    private final BigInteger ceilingValue;
    private final Cache<PowerKey, BigInteger> cache;

    public FullRangePow(FactorConfig config) {
        if (config == null) {
            throw new InvalidArgumentException("config must not be null");
        }
        this.ceiling = config.getPowerCeiling();
        this.ceilingValue = BigInteger.valueOf(ceiling);
        this.cache = config.isCacheEnabled() ? buildCache(config.getCacheMaximumWeight()) : null;
    }

    /**
     * 同步执行淘汰，缓存大小在每次写入后即确定
     */
    private static Cache<PowerKey, BigInteger> buildCache(long maximumWeight) {
        return Caffeine.newBuilder()
                .maximumWeight(maximumWeight)
                .weigher((PowerKey key, BigInteger value) -> Math.max(1, value.bitLength()))
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    /**
     * 进程级默认实例，配置来自系统属性，首次使用时创建
     */
    public static FullRangePow getDefault() {
        FullRangePow instance = defaultInstance;
        if (instance == null) {
            synchronized (FullRangePow.class) {
                instance = defaultInstance;
                if (instance == null) {
                    instance = new FullRangePow(FactorConfig.fromSystemProperties());
                    defaultInstance = instance;
                }
            }
        }
        return instance;
    }

    public int getCeiling() {
        return ceiling;
    }

    /**
     * 缓存统计，未启用缓存时返回 null
     */
    public CacheStats getCacheStats() {
        return cache == null ? null : cache.stats();
    }

    /**
     * 当前缓存的条目数，未启用缓存时为 0
     */
    public long cachedEntries() {
        if (cache == null) return 0L;
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clearCache() {
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    /**
     * 计算 base^exponent
     *
     * @throws InvalidArgumentException 底数或指数为负
     * @throws DomainViolationException 结果超出 BigInteger 的表示范围
     */
    public BigInteger pow(BigInteger base, BigInteger exponent) {
        if (base == null || exponent == null) {
            throw new InvalidArgumentException("base and exponent must not be null");
        }
        if (base.signum() < 0) {
            throw new InvalidArgumentException("base must not be negative: " + base);
        }
        if (exponent.signum() < 0) {
            throw new InvalidArgumentException("exponent must not be negative: " + exponent);
        }
        if (exponent.signum() == 0 || base.equals(BigInteger.ONE)) {
            return BigInteger.ONE;
        }
        if (base.signum() == 0) {
            return BigInteger.ZERO;
        }
        if (cache == null) {
            return compute(base, exponent);
        }
        return cache.get(new PowerKey(base, exponent), k -> compute(base, exponent));
    }

    public BigInteger pow(long base, long exponent) {
        return pow(BigInteger.valueOf(base), BigInteger.valueOf(exponent));
    }

    private BigInteger compute(BigInteger base, BigInteger exponent) {
        try {
            if (exponent.compareTo(ceilingValue) <= 0) {
                return base.pow(exponent.intValue());
            }
            BigInteger[] qr = exponent.divideAndRemainder(ceilingValue);
            BigInteger quotient = qr[0];
            int remainder = qr[1].intValue();
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("chunked pow: base=" + base + ", exponent=" + exponent
                        + ", chunks=" + quotient + ", remainder=" + remainder);
            }
            BigInteger chunk = base.pow(ceiling);
            BigInteger result = BigInteger.ONE;
            for (BigInteger i = BigInteger.ZERO; i.compareTo(quotient) < 0; i = i.add(BigInteger.ONE)) {
                result = result.multiply(chunk);
            }
            return result.multiply(base.pow(remainder));
        } catch (ArithmeticException e) {
            throw new DomainViolationException(base + "^" + exponent + " exceeds the supported BigInteger range", e);
        }
    }
}

package onto.factor;

import onto.number.InvalidArgumentException;

import java.util.Properties;

/**
 * 因数分解整数的幂运算配置
 */
public class FactorConfig {

    public static final String POWER_CEILING = "onto.factor.powerCeiling";
    public static final String CACHE_ENABLED = "onto.factor.cacheEnabled";
    public static final String CACHE_MAXIMUM_WEIGHT = "onto.factor.cacheMaximumWeight";

    /** 直接调用 BigInteger.pow 允许的最大指数 */
    private int powerCeiling = Integer.MAX_VALUE;
    private boolean cacheEnabled = true;
    /** 缓存中所有幂结果的总位数上限，默认 64 Mbit */
    private long cacheMaximumWeight = 64L * 1024 * 1024;

    public FactorConfig() {
    }

    /**
     * 从系统属性读取，未设置的项保持默认值
     */
    public static FactorConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static FactorConfig fromProperties(Properties props) {
        FactorConfig config = new FactorConfig();
        String ceiling = props.getProperty(POWER_CEILING);
        if (ceiling != null) {
            config.setPowerCeiling(parseInt(POWER_CEILING, ceiling));
        }
        String enabled = props.getProperty(CACHE_ENABLED);
        if (enabled != null) {
            config.setCacheEnabled(Boolean.parseBoolean(enabled.trim()));
        }
        String weight = props.getProperty(CACHE_MAXIMUM_WEIGHT);
        if (weight != null) {
            config.setCacheMaximumWeight(parseLong(CACHE_MAXIMUM_WEIGHT, weight));
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("invalid value for " + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("invalid value for " + key + ": " + value, e);
        }
    }

    public int getPowerCeiling() {
        return powerCeiling;
    }

    public void setPowerCeiling(int powerCeiling) {
        if (powerCeiling < 1) {
            throw new InvalidArgumentException("powerCeiling must be positive: " + powerCeiling);
        }
        this.powerCeiling = powerCeiling;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public long getCacheMaximumWeight() {
        return cacheMaximumWeight;
    }

    public void setCacheMaximumWeight(long cacheMaximumWeight) {
        if (cacheMaximumWeight < 1) {
            throw new InvalidArgumentException("cacheMaximumWeight must be positive: " + cacheMaximumWeight);
        }
        this.cacheMaximumWeight = cacheMaximumWeight;
    }
}

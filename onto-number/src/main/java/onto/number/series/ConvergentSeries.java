package onto.number.series;

import onto.number.InvalidArgumentException;

/**
 * 收敛级数估计，用于初始化无理数常量。
 *
 * <p>每个级数都是嵌套的连分式/连乘式，这里从最内层向外迭代求值，不做深递归。</p>
 */
public final class ConvergentSeries {

    private ConvergentSeries() {}

    /** 默认项数 */
    public static final int DEFAULT_TERMS = 100;

    /**
     * π = 2 + (1/3)(2 + (2/5)(2 + (3/7)(...)))
     * <pre>
     * P(n)   = 2 + n / (2n + 1) · P(n + 1)   (n &lt; max)
     * P(max) = 2·max + 1
     * </pre>
     */
    public static double pi(int max) {
        requirePositive(max, "max");
        double v = 2.0 * max + 1.0;
        for (int n = max - 1; n >= 1; n--) {
            v = 2.0 + (1.0 * n / (2.0 * n + 1.0)) * v;
        }
        return v;
    }

    public static double pi() {
        return pi(DEFAULT_TERMS);
    }

    /**
     * e^x ≈ 1 + x/1 · (1 + x/2 · (1 + x/3 · (...)))
     * <pre>
     * E(n)   = 1 + x / n · E(n + 1)   (n &lt; max)
     * E(max) = 1
     * </pre>
     */
    public static double e(int max, double x) {
        requirePositive(max, "max");
        double v = 1.0;
        for (int n = max - 1; n >= 1; n--) {
            v = 1.0 + x / n * v;
        }
        return v;
    }

    public static double e() {
        return e(DEFAULT_TERMS, 1.0);
    }

    /**
     * 以 1/2 为固定系数的对照链，收敛到 4
     * <pre>
     * X(n)   = 2 + 1/2 · X(n + 1)
     * X(max) = 4
     * </pre>
     */
    public static double piX(int max) {
        requirePositive(max, "max");
        double v = 4.0;
        for (int n = max - 1; n >= 1; n--) {
            v = 2.0 + 0.5 * v;
        }
        return v;
    }

    /**
     * 把 π 级数的系数 n/(2n+1) 固定为 m/(2m+1) 的变体，不动点为 2(2m+1)/(m+1)
     * <pre>
     * Y(n)   = 2 + m / (2m + 1) · Y(n + 1)
     * Y(max) = (2m + 1) / m
     * </pre>
     */
    public static double piY(int max, long m) {
        requirePositive(max, "max");
        requireNonZero(m);
        double k = 1.0 * m / (2.0 * m + 1.0);
        double v = (2.0 * m + 1.0) / m;
        for (int n = max - 1; n >= 1; n--) {
            v = 2.0 + k * v;
        }
        return v;
    }

    /**
     * 把 e^x 级数的除数 n 固定为 m 的变体，不动点为 1 / (1 - x/m)
     * <pre>
     * Em(n)   = 1 + x / m · Em(n + 1)
     * Em(max) = 1
     * </pre>
     */
    public static double em(int max, double x, long m) {
        requirePositive(max, "max");
        requireNonZero(m);
        double v = 1.0;
        for (int n = max - 1; n >= 1; n--) {
            v = 1.0 + x / m * v;
        }
        return v;
    }

    /**
     * ζ(s) 的部分和 Σ t^(-s)，t = 1..max
     */
    public static double zeta(double s, int max) {
        requirePositive(max, "max");
        double sum = 0.0;
        for (int t = 1; t <= max; t++) {
            sum += Math.pow(t, -s);
        }
        return sum;
    }

    /**
     * 1 - (1 - (1 - ...)/m)/m，共 max 层
     */
    public static double oneLess(int max, long m) {
        return chain(max, m, -1.0);
    }

    /**
     * 1 + (1 + (1 + ...)/m)/m，共 max 层
     */
    public static double oneMore(int max, long m) {
        return chain(max, m, 1.0);
    }

    private static double chain(int max, long m, double sign) {
        requireNonZero(m);
        if (max < 0) {
            throw new InvalidArgumentException("max must not be negative: " + max);
        }
        double v = 1.0;
        for (int n = 0; n < max; n++) {
            v = 1.0 + sign * v / m;
        }
        return v;
    }

    private static void requireNonZero(long m) {
        if (m == 0) {
            throw new InvalidArgumentException("m must not be zero");
        }
    }

    private static void requirePositive(int value, String name) {
        if (value < 1) {
            throw new InvalidArgumentException(name + " must be positive: " + value);
        }
    }
}

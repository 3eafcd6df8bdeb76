package onto.number;

import onto.number.series.ConvergentSeries;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 进程级常量注册表。
 *
 * <p>所有常量集中在这一个类里，由 JVM 类初始化保证只初始化一次。
 * 各数值类自身不持有引用其他种类的静态常量，避免循环初始化。字段按以下依赖顺序声明：</p>
 * <ol>
 *   <li>SOLE（空 Nature）</li>
 *   <li>Real：0, 1, -1</li>
 *   <li>Integer：0, 1, -1；Natural：0, 1</li>
 *   <li>Rational.ZERO（依赖 Real 0 与 1）</li>
 *   <li>Irrational：π, e（收敛级数）</li>
 *   <li>Zero, TheInfinite</li>
 *   <li>Complex：0, 1, -1, i, -i；NaturalComplex：0, 1, j, 1+j</li>
 *   <li>旋转常量 I0..I4（依赖 TheInfinite 与 Complex.ONE）</li>
 * </ol>
 */
public final class OntoConstants {

    private static final Logger LOG = Logger.getLogger(OntoConstants.class.getName());

    private OntoConstants() {}

    @OntoConstant(description = "唯一的存在，即自然本身")
    public static final OntoNature SOLE = new OntoNature();

    // ============ Real ============

    @OntoConstant(description = "实数 0")
    public static final OntoReal REAL_ZERO = OntoReal.of(0.0);
    @OntoConstant(description = "实数 1")
    public static final OntoReal REAL_ONE = OntoReal.of(1.0);
    @OntoConstant(description = "实数 -1")
    public static final OntoReal REAL_MINUS_ONE = OntoReal.of(-1.0);

    // ============ Integer / Natural ============

    @OntoConstant(description = "整数 0")
    public static final OntoInteger INTEGER_ZERO = OntoInteger.of(0);
    @OntoConstant(description = "整数 1")
    public static final OntoInteger INTEGER_ONE = OntoInteger.of(1);
    @OntoConstant(description = "整数 -1")
    public static final OntoInteger INTEGER_MINUS_ONE = OntoInteger.of(-1);

    @OntoConstant(description = "自然数 0")
    public static final OntoNatural NATURAL_ZERO = OntoNatural.of(0);
    @OntoConstant(description = "自然数 1")
    public static final OntoNatural NATURAL_ONE = OntoNatural.of(1);

    // ============ Rational / Irrational ============

    @OntoConstant(description = "有理数 0/1")
    public static final OntoRational RATIONAL_ZERO = OntoRational.of(REAL_ZERO, REAL_ONE);

    @OntoConstant(description = "圆周率 π，由收敛级数求得")
    public static final OntoIrrational PI = OntoIrrational.of(ConvergentSeries.pi());
    @OntoConstant(description = "自然常数 e，由收敛级数求得")
    public static final OntoIrrational E = OntoIrrational.of(ConvergentSeries.e());

    // ============ Zero / Infinite ============

    @OntoConstant(description = "正极性的零")
    public static final OntoZero ZERO = OntoZero.positive();
    @OntoConstant(description = "正极性的无穷")
    public static final OntoInfinite THE_INFINITE = OntoInfinite.positive();

    // ============ Complex / NaturalComplex ============

    @OntoConstant(description = "复数 0")
    public static final OntoComplex COMPLEX_ZERO = OntoComplex.of(REAL_ZERO, REAL_ZERO);
    @OntoConstant(description = "复数 1")
    public static final OntoComplex COMPLEX_ONE = OntoComplex.of(REAL_ONE, REAL_ZERO);
    @OntoConstant(description = "复数 -1")
    public static final OntoComplex COMPLEX_MINUS_ONE = OntoComplex.of(REAL_MINUS_ONE, REAL_ZERO);
    @OntoConstant(description = "虚单位 i")
    public static final OntoComplex COMPLEX_I = OntoComplex.of(REAL_ZERO, REAL_ONE);
    @OntoConstant(description = "-i")
    public static final OntoComplex COMPLEX_MINUS_I = OntoComplex.of(REAL_ZERO, REAL_MINUS_ONE);

    @OntoConstant(description = "自然复数 0")
    public static final OntoNaturalComplex NATURAL_COMPLEX_ZERO = OntoNaturalComplex.of(NATURAL_ZERO, NATURAL_ZERO);
    @OntoConstant(description = "自然复数 1")
    public static final OntoNaturalComplex NATURAL_COMPLEX_ONE = OntoNaturalComplex.of(NATURAL_ONE, NATURAL_ZERO);
    @OntoConstant(description = "自然复数单位 j")
    public static final OntoNaturalComplex NATURAL_COMPLEX_J = OntoNaturalComplex.of(NATURAL_ZERO, NATURAL_ONE);
    @OntoConstant(description = "自然复数 1+j")
    public static final OntoNaturalComplex NATURAL_COMPLEX_ONE_J = OntoNaturalComplex.of(NATURAL_ONE, NATURAL_ONE);

    // ============ 旋转轴 ============

    public static final RotationAxis ROTATION = new RotationAxis(THE_INFINITE, COMPLEX_ONE);

    @OntoConstant(description = "旋转 0 次：实单位")
    public static final OntoComplex I0 = ROTATION.power(0);
    @OntoConstant(description = "旋转 1 次：虚单位")
    public static final OntoComplex I1 = ROTATION.power(1);
    @OntoConstant(description = "旋转 2 次：-1")
    public static final OntoComplex I2 = ROTATION.power(2);
    @OntoConstant(description = "旋转 3 次：-i")
    public static final OntoComplex I3 = ROTATION.power(3);
    @OntoConstant(description = "旋转 4 次：回到实单位")
    public static final OntoComplex I4 = ROTATION.power(4);

    private static final Map<String, Object> BY_NAME = scanConstants();

    /**
     * 通过反射扫描本类中带 @OntoConstant 注解的字段，必须在所有常量字段之后初始化。
     */
    private static Map<String, Object> scanConstants() {
        Map<String, Object> byName = new LinkedHashMap<>();
        for (Field f : OntoConstants.class.getDeclaredFields()) {
            if (!Modifier.isStatic(f.getModifiers())) continue;
            if (f.getAnnotation(OntoConstant.class) == null) continue;
            try {
                byName.put(f.getName(), f.get(null));
            } catch (IllegalAccessException e) {
                throw new OntoException("cannot read constant " + f.getName(), e);
            }
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("registered " + byName.size() + " constants, pi=" + PI.getValue() + ", e=" + E.getValue());
        }
        return Collections.unmodifiableMap(byName);
    }

    /**
     * 按字段名查找常量，如 "PI"、"THE_INFINITE"
     *
     * @return 常量，不存在则返回 null
     */
    public static Object lookup(String name) {
        return BY_NAME.get(name);
    }

    /**
     * 常量描述，不存在则返回 null
     */
    public static String describe(String name) {
        if (!BY_NAME.containsKey(name)) return null;
        try {
            return OntoConstants.class.getDeclaredField(name).getAnnotation(OntoConstant.class).description();
        } catch (NoSuchFieldException e) {
            throw new OntoException("constant field disappeared: " + name, e);
        }
    }

    /** 所有常量，按声明顺序 */
    public static Map<String, Object> all() {
        return BY_NAME;
    }
}

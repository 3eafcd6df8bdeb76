package onto.number;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 旋转轴：由单一算子反复作用生成的四元循环 {I0, I1, I2, I3, I4 = I0}。
 *
 * <p>算子定义为 {@code R(n) = (Infinite - I0) × n}，I0 为实单位。
 * 线性数的吸收律不作用于结构数：{@code Infinite - I0} 取为过原点且与 I0 正交的轴上的单位，
 * 方向由 Infinite 的极性决定（正极性为 (0, 1)，负极性为 (0, -1)）。
 * R 即与该生成元做精确的复数乘法，于是 I2 = -I0，I1 × I1 = I2（I² = -1）。</p>
 */
public final class RotationAxis {

    /** 一个完整循环的步数 */
    public static final int PERIOD = 4;

    private final OntoInfinite infinite;
    private final OntoComplex unit;
    private final OntoComplex generator;

    public RotationAxis(OntoInfinite infinite, OntoComplex unit) {
        if (infinite == null || unit == null) {
            throw new InvalidArgumentException("rotation axis needs an infinite and a unit");
        }
        if (unit.imaginaryPart() != 0.0 || unit.realPart() == 0.0) {
            throw new InvalidArgumentException("rotation unit must be a non-zero real value: " + unit.asString());
        }
        // 旋转结果不带成员，带成员的单位无法闭合
        if (unit.hasMembers()) {
            throw new InvalidArgumentException("rotation unit must not carry members: " + unit);
        }
        this.infinite = infinite;
        this.unit = unit;
        this.generator = OntoComplex.of(0.0, infinite.isPositive() ? 1.0 : -1.0);
    }

    /**
     * 以正无穷与实单位 (1, 0) 构造的标准旋转轴
     */
    public static RotationAxis standard() {
        return new RotationAxis(OntoInfinite.positive(), OntoComplex.of(1.0, 0.0));
    }

    public OntoInfinite getInfinite() {
        return infinite;
    }

    /** I0 */
    public OntoComplex getUnit() {
        return unit;
    }

    /** (Infinite - I0) 在本轴上的取值 */
    public OntoComplex getGenerator() {
        return generator;
    }

    /**
     * R(n) = (Infinite - I0) × n
     */
    public OntoComplex rotate(StructuralNumber n) {
        if (n == null) {
            throw new InvalidArgumentException("cannot rotate an absent value");
        }
        return OntoOps.multiply(generator, n);
    }

    /**
     * 从 I0 出发连续旋转 steps 次
     */
    public OntoComplex power(int steps) {
        if (steps < 0) {
            throw new InvalidArgumentException("steps must not be negative: " + steps);
        }
        OntoComplex current = unit;
        for (int i = 0; i < steps; i++) {
            current = rotate(current);
        }
        return current;
    }

    /**
     * [I0, I1, I2, I3, I4]
     */
    public List<OntoComplex> cycle() {
        List<OntoComplex> result = new ArrayList<>(PERIOD + 1);
        OntoComplex current = unit;
        result.add(current);
        for (int i = 0; i < PERIOD; i++) {
            current = rotate(current);
            result.add(current);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 循环闭合检查：I4 = I0 且 I2 = -I0
     */
    public boolean closes() {
        List<OntoComplex> c = cycle();
        return c.get(PERIOD).equals(c.get(0)) && c.get(2).equals(OntoOps.negate(c.get(0)));
    }
}

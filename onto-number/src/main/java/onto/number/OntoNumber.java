package onto.number;

import java.util.Set;

/**
 * Onto 数值能力接口
 *
 * <p>所有数值种类（线性数与结构数）都实现此接口。具体分派基于 {@link #getKind()}。</p>
 */
public interface OntoNumber {

    Kind getKind();

    Set<Existence> getMembers();

    /**
     * 语义标量视图：有限数为其值，Zero 为 0.0，Infinite 为 ±∞，结构数为模长。
     */
    double scalarValue();

    /**
     * 值的渲染（与 toString 的结构渲染不同），如 "42"、"1.0/3.0"、"+∞"、"(1.0, 2.0)"
     */
    String asString();

    default boolean isLinear() {
        return getKind().isLinear();
    }

    default boolean isStructural() {
        return getKind().isStructural();
    }
}

package onto.number;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 存在：所有实体的基类
 *
 * <p>一个实体完全由其有限、无序、去重的成员集合（子实体）定义。
 * 两个实体相等当且仅当种类标签相同、成员集合相等（递归、无序），
 * 且带值的数值种类值相等。</p>
 *
 * <p>成员按首次出现顺序保存，仅用于渲染；相等性与顺序无关。
 * 所有实体构造后不可变。</p>
 */
@OntoType(kind = Kind.NATURE, aliases = {"Existence", "存在"}, description = "仅由子实体集合定义的结构实体")
public abstract class Existence {

    private final Set<Existence> members;

    protected Existence(Collection<? extends Existence> members) {
        this.members = copyMembers(members);
    }

    protected Existence(Existence... members) {
        this(asMembers(members));
    }

    /**
     * 可变参数转成员集合，null 数组保持为 null 以便构造时报错
     */
    protected static List<Existence> asMembers(Existence... members) {
        return members == null ? null : Arrays.asList(members);
    }

    private static Set<Existence> copyMembers(Collection<? extends Existence> members) {
        if (members == null) {
            throw new InvalidArgumentException("members must not be null");
        }
        if (members.isEmpty()) {
            return Collections.emptySet();
        }
        Set<Existence> copy = new LinkedHashSet<>();
        for (Existence member : members) {
            if (member == null) {
                throw new InvalidArgumentException("member must not be null");
            }
            copy.add(member);
        }
        return Collections.unmodifiableSet(copy);
    }

    /**
     * 以给定成员构造一个基础实体（Nature）
     */
    public static Existence of(Existence... members) {
        return new OntoNature(members);
    }

    /**
     * 种类标签
     */
    public abstract Kind getKind();

    /**
     * 种类名，如 "Being"、"Zero"
     */
    public String getTypeName() {
        return getKind().getTypeName();
    }

    /**
     * 不可变的成员集合
     */
    public final Set<Existence> getMembers() {
        return members;
    }

    /** 成员列表快照（首次出现顺序） */
    public final List<Existence> memberList() {
        return new ArrayList<>(members);
    }

    public final boolean hasMembers() {
        return !members.isEmpty();
    }

    /**
     * 抽象的存在并不存在；Nature 及其下所有具体实体覆写为 true。
     */
    public boolean exists() {
        return false;
    }

    /**
     * 不受限
     */
    public boolean isLimited() {
        return false;
    }

    /**
     * 取反。基础实体的相反即自身。
     */
    public Existence negate() {
        return this;
    }

    /**
     * 带值种类比较值部分，调用前已确认种类相同。
     */
    protected boolean sameValue(Existence other) {
        return true;
    }

    /** 带值种类的值哈希 */
    protected int valueHash() {
        return 0;
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Existence)) return false;
        Existence other = (Existence) obj;
        return getKind() == other.getKind()
                && members.equals(other.members)
                && sameValue(other);
    }

    @Override
    public final int hashCode() {
        // Set.hashCode 是成员哈希之和，与顺序无关
        return 31 * (31 * getKind().ordinal() + members.hashCode()) + valueHash();
    }

    @Override
    public String toString() {
        if (members.isEmpty()) {
            return getTypeName();
        }
        StringBuilder sb = new StringBuilder("(");
        boolean first = true;
        for (Existence member : members) {
            if (!first) sb.append(',');
            sb.append(member);
            first = false;
        }
        return sb.append(')').toString();
    }
}

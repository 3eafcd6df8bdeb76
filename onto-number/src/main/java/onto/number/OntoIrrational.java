package onto.number;

import java.util.Collection;

/**
 * 无理数：没有精确分子/分母的实数（π、e），由收敛级数在初始化时求得。
 */
@OntoType(kind = Kind.IRRATIONAL, aliases = {"无理数"}, description = "无精确分数表示的实数")
public final class OntoIrrational extends OntoReal {

    public OntoIrrational(double value, Collection<? extends Existence> members) {
        super(value, members);
    }

    public static OntoIrrational of(double value, Existence... members) {
        return new OntoIrrational(value, asMembers(members));
    }

    @Override
    public Kind getKind() {
        return Kind.IRRATIONAL;
    }

    @Override
    public OntoIrrational negate() {
        return new OntoIrrational(-getValue(), getMembers());
    }

    @Override
    public OntoIrrational withSign(boolean positive) {
        if (isPositive() == positive || isZero()) return this;
        return negate();
    }
}

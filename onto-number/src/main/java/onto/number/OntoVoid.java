package onto.number;

import java.util.Collection;

/**
 * 虚无：Nature 的一种。{@code -Void} 是成员相同的 {@link OntoBeing}。
 * 空的 Void 与空的 {@link OntoZero} 可以互相转换，见 {@link Conversions}。
 */
@OntoType(kind = Kind.VOID, aliases = {"不存在", "虚无"}, description = "虚无，相反为有")
public final class OntoVoid extends Existence {

    public OntoVoid(Existence... members) {
        super(members);
    }

    public OntoVoid(Collection<? extends Existence> members) {
        super(members);
    }

    @Override
    public Kind getKind() {
        return Kind.VOID;
    }

    @Override
    public boolean exists() {
        return true;
    }

    /**
     * 非无即有：返回成员相同的 Being
     */
    @Override
    public OntoBeing negate() {
        return new OntoBeing(getMembers());
    }
}

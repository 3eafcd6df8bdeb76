package onto.number;

import java.util.Collection;

/**
 * 有：Nature 的一种。{@code -Being} 是成员相同的 {@link OntoVoid}。
 */
@OntoType(kind = Kind.BEING, aliases = {"有", "存有"}, description = "有，相反为虚无")
public final class OntoBeing extends Existence {

    public OntoBeing(Existence... members) {
        super(members);
    }

    public OntoBeing(Collection<? extends Existence> members) {
        super(members);
    }

    @Override
    public Kind getKind() {
        return Kind.BEING;
    }

    @Override
    public boolean exists() {
        return true;
    }

    /**
     * 非有即无：返回成员相同的 Void
     */
    @Override
    public OntoVoid negate() {
        return new OntoVoid(getMembers());
    }
}

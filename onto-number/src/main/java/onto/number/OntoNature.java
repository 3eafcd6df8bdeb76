package onto.number;

import java.util.Collection;

/**
 * 自然：自未知起点便存在的实体。唯一的存在（{@link OntoConstants#SOLE}）就是自然本身。
 */
@OntoType(kind = Kind.NATURE,
        aliases = {"自然", "Tao", "道", "Onto", "本体", "Limitless", "无限"},
        description = "存在本身，相反即自身")
public class OntoNature extends Existence {

    public OntoNature(Existence... members) {
        super(members);
    }

    public OntoNature(Collection<? extends Existence> members) {
        super(members);
    }

    @Override
    public Kind getKind() {
        return Kind.NATURE;
    }

    @Override
    public boolean exists() {
        return true;
    }
}

package onto.number;

import java.util.Collection;

/**
 * 数值种类的抽象基类：所有数都是具体存在的实体。
 */
public abstract class AbstractOntoNumber extends Existence implements OntoNumber {

    protected AbstractOntoNumber(Collection<? extends Existence> members) {
        super(members);
    }

    @Override
    public boolean exists() {
        return true;
    }
}

package onto.number;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记 {@link OntoConstants} 中的静态字段为具名常量。
 *
 * <p>{@link OntoConstants#lookup(String)} 通过反射扫描此注解，无需手动注册。</p>
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface OntoConstant {
    /** 描述 */
    String description();
}

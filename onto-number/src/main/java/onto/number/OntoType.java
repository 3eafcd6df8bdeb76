package onto.number;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个 Existence 子类为 Onto 内置种类，附带别名。
 * {@link OntoTypeRegistry} 通过反射读取此注解建立 别名 → 种类 映射。
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface OntoType {
    /** 对应的种类标签 */
    Kind kind();

    /** 别名（中英文），种类名本身自动包含 */
    String[] aliases() default {};

    /** 类型描述 */
    String description() default "";
}

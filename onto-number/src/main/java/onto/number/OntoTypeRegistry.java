package onto.number;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 种类元数据注册表：别名 → 种类。
 *
 * <p>通过反射读取各实体类上的 {@link OntoType} 注解。别名查找不区分大小写。</p>
 */
public final class OntoTypeRegistry {

    /** 内置种类描述 */
    public static final class TypeInfo {
        public final Kind kind;
        public final Class<?> type;
        public final List<String> aliases;
        public final String description;

        public TypeInfo(Kind kind, Class<?> type, List<String> aliases, String description) {
            this.kind = kind;
            this.type = type;
            this.aliases = Collections.unmodifiableList(aliases);
            this.description = description;
        }
    }

    private static final List<Class<?>> BUILTIN_TYPES = Arrays.<Class<?>>asList(
            Existence.class, OntoNature.class, OntoBeing.class, OntoVoid.class,
            OntoZero.class, OntoInfinite.class,
            OntoInteger.class, OntoNatural.class,
            OntoReal.class, OntoRational.class, OntoIrrational.class,
            OntoComplex.class, OntoNaturalComplex.class);

    private static final Map<String, Kind> BY_ALIAS = new LinkedHashMap<>();
    private static final Map<Kind, List<String>> ALIASES = new EnumMap<>(Kind.class);
    private static final List<TypeInfo> TYPES = new ArrayList<>();

    static {
        for (Kind kind : Kind.values()) {
            registerAlias(kind, kind.getTypeName());
        }
        for (Class<?> type : BUILTIN_TYPES) {
            scanAnnotatedClass(type);
        }
    }

    private OntoTypeRegistry() {}

    private static void scanAnnotatedClass(Class<?> clazz) {
        OntoType ann = clazz.getAnnotation(OntoType.class);
        if (ann == null) return;
        for (String alias : ann.aliases()) {
            registerAlias(ann.kind(), alias);
        }
        TYPES.add(new TypeInfo(ann.kind(), clazz, Arrays.asList(ann.aliases()), ann.description()));
    }

    private static void registerAlias(Kind kind, String alias) {
        String key = alias.toLowerCase(Locale.ROOT);
        Kind existing = BY_ALIAS.get(key);
        if (existing != null && existing != kind) {
            throw new IllegalStateException("alias '" + alias + "' already bound to " + existing);
        }
        BY_ALIAS.put(key, kind);
        List<String> list = ALIASES.get(kind);
        if (list == null) {
            list = new ArrayList<>();
            ALIASES.put(kind, list);
        }
        if (!list.contains(alias)) {
            list.add(alias);
        }
    }

    /**
     * 按别名查找种类，如 "整数" → INTEGER，"Tao" → NATURE
     *
     * @return 种类，未知别名返回 null
     */
    public static Kind kindOf(String alias) {
        if (alias == null) return null;
        return BY_ALIAS.get(alias.toLowerCase(Locale.ROOT));
    }

    /**
     * 种类的所有别名，种类名在前
     */
    public static List<String> aliasesOf(Kind kind) {
        List<String> list = ALIASES.get(kind);
        return list == null ? Collections.<String>emptyList() : Collections.unmodifiableList(list);
    }

    public static List<TypeInfo> getBuiltinTypes() {
        return Collections.unmodifiableList(TYPES);
    }
}

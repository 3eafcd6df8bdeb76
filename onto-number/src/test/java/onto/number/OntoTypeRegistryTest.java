package onto.number;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 种类别名注册表测试
 */
class OntoTypeRegistryTest {

    @Test
    @DisplayName("按中英文别名查找")
    void testKindOf() {
        assertEquals(Kind.INTEGER, OntoTypeRegistry.kindOf("整数"));
        assertEquals(Kind.NATURE, OntoTypeRegistry.kindOf("Tao"));
        assertEquals(Kind.NATURE, OntoTypeRegistry.kindOf("道"));
        assertEquals(Kind.NATURE, OntoTypeRegistry.kindOf("Existence"));
        assertEquals(Kind.ZERO, OntoTypeRegistry.kindOf("0"));
        assertEquals(Kind.NATURAL_COMPLEX, OntoTypeRegistry.kindOf("自然复数"));
        assertEquals(Kind.VOID, OntoTypeRegistry.kindOf("虚无"));
    }

    @Test
    @DisplayName("大小写不敏感")
    void testCaseInsensitive() {
        assertEquals(Kind.INFINITE, OntoTypeRegistry.kindOf("INFINITE"));
        assertEquals(Kind.NATURE, OntoTypeRegistry.kindOf("limitless"));
    }

    @Test
    @DisplayName("未知别名返回 null")
    void testUnknown() {
        assertNull(OntoTypeRegistry.kindOf("quaternion"));
        assertNull(OntoTypeRegistry.kindOf(null));
    }

    @Test
    @DisplayName("种类名排在别名前面")
    void testAliasesOf() {
        assertEquals("Integer", OntoTypeRegistry.aliasesOf(Kind.INTEGER).get(0));
        assertTrue(OntoTypeRegistry.aliasesOf(Kind.COMPLEX).contains("实复数"));
        assertThrows(UnsupportedOperationException.class,
                () -> OntoTypeRegistry.aliasesOf(Kind.REAL).add("x"));
    }

    @Test
    @DisplayName("内置类型")
    void testBuiltinTypes() {
        assertEquals(13, OntoTypeRegistry.getBuiltinTypes().size());
        OntoTypeRegistry.TypeInfo first = OntoTypeRegistry.getBuiltinTypes().get(0);
        assertSame(Existence.class, first.type);
        assertEquals(Kind.NATURE, first.kind);
    }
}

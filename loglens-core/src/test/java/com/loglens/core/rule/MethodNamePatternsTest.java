package com.loglens.core.rule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MethodNamePatterns 单元测试")
class MethodNamePatternsTest {

    @Test
    @DisplayName("精确匹配区分大小写")
    void exactMatch() {
        assertTrue(MethodNamePatterns.matches("toString", "toString"));
        assertFalse(MethodNamePatterns.matches("toString", "tostring"));
    }

    @Test
    @DisplayName("前缀、后缀与包含")
    void wildcardForms() {
        assertTrue(MethodNamePatterns.matches("getName", "get*"));
        assertFalse(MethodNamePatterns.matches("forget", "get*"));

        assertTrue(MethodNamePatterns.matches("refreshCache", "*Cache"));
        assertFalse(MethodNamePatterns.matches("cacheSize", "*Cache"));

        assertTrue(MethodNamePatterns.matches("loadUserData", "*User*"));
        assertFalse(MethodNamePatterns.matches("loadOrder", "*User*"));
    }

    @Test
    @DisplayName("单独的 * 匹配任意方法，空模式不匹配")
    void wildcardOnlyAndEmpty() {
        assertTrue(MethodNamePatterns.matches("anything", "*"));
        assertFalse(MethodNamePatterns.matches("anything", ""));
        assertFalse(MethodNamePatterns.matches("anything", null));
    }
}

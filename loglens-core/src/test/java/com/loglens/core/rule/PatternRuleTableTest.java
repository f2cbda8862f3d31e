package com.loglens.core.rule;

import com.loglens.api.interception.InterceptionBehavior;
import com.loglens.api.interception.InterceptionDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PatternRuleTable 单元测试")
class PatternRuleTableTest {

    private static final InterceptionDecision INPUT_INFO = InterceptionDecision.of(InterceptionBehavior.LOG_INPUT, Level.INFO);
    private static final InterceptionDecision OUTPUT_DEBUG = InterceptionDecision.of(InterceptionBehavior.LOG_OUTPUT, Level.DEBUG);
    private static final InterceptionDecision BOTH_WARN = InterceptionDecision.of(InterceptionBehavior.LOG_BOTH, Level.WARN);

    @Nested
    @DisplayName("匹配顺序")
    class MatchOrderTests {

        @Test
        @DisplayName("精确匹配优先于通配规则，与声明顺序无关")
        void exactShouldBeatWildcard() {
            PatternRuleTable table = PatternRuleTable.builder()
                    .rule(PatternRule.of("com.example.*", OUTPUT_DEBUG))
                    .rule(PatternRule.of("com.example.billing.BillingService", INPUT_INFO))
                    .build();

            assertEquals(INPUT_INFO, table.lookup("com.example.billing.BillingService"));
            assertEquals(OUTPUT_DEBUG, table.lookup("com.example.billing.InvoiceService"));
        }

        @Test
        @DisplayName("多个通配规则时先声明者胜，而不是最长前缀")
        void firstDeclaredWildcardShouldWin() {
            PatternRuleTable table = PatternRuleTable.of(
                    PatternRule.of("com.example.*", OUTPUT_DEBUG),
                    PatternRule.of("com.example.orders.*", BOTH_WARN)
            );

            assertEquals(OUTPUT_DEBUG, table.lookup("com.example.orders.OrderService"));
        }

        @Test
        @DisplayName("更具体的通配规则声明在前时生效")
        void specificWildcardDeclaredFirstShouldWin() {
            PatternRuleTable table = PatternRuleTable.of(
                    PatternRule.of("com.example.orders.*", BOTH_WARN),
                    PatternRule.of("com.example.*", OUTPUT_DEBUG)
            );

            assertEquals(BOTH_WARN, table.lookup("com.example.orders.OrderService"));
            assertEquals(OUTPUT_DEBUG, table.lookup("com.example.billing.BillingService"));
        }

        @Test
        @DisplayName("重复的精确模式保留第一个")
        void duplicateExactPatternShouldKeepFirst() {
            PatternRuleTable table = PatternRuleTable.of(
                    PatternRule.of("com.example.A", INPUT_INFO),
                    PatternRule.of("com.example.A", BOTH_WARN)
            );

            assertEquals(INPUT_INFO, table.lookup("com.example.A"));
            assertEquals(2, table.size());
        }

        @Test
        @DisplayName("单独的 * 匹配所有类型")
        void bareWildcardShouldMatchEverything() {
            PatternRuleTable table = PatternRuleTable.of(PatternRule.of("*", INPUT_INFO));

            assertEquals(INPUT_INFO, table.lookup("any.Type"));
        }
    }

    @Nested
    @DisplayName("未命中")
    class NoMatchTests {

        @Test
        @DisplayName("没有匹配规则时返回 null")
        void unmatchedShouldReturnNull() {
            PatternRuleTable table = PatternRuleTable.of(PatternRule.of("com.example.orders.*", INPUT_INFO));

            assertNull(table.lookup("com.other.Service"));
            assertNull(table.match("com.example.ordersX"));
        }

        @Test
        @DisplayName("精确模式不做前缀匹配")
        void exactPatternShouldNotPrefixMatch() {
            PatternRuleTable table = PatternRuleTable.of(PatternRule.of("com.example.Order", INPUT_INFO));

            assertNull(table.lookup("com.example.OrderService"));
        }

        @Test
        @DisplayName("空表与 null 类名")
        void emptyTableAndNullName() {
            assertTrue(PatternRuleTable.empty().isEmpty());
            assertNull(PatternRuleTable.empty().lookup("com.example.A"));
            assertNull(PatternRuleTable.of(PatternRule.of("*", INPUT_INFO)).lookup(null));
        }
    }

    @Nested
    @DisplayName("规则对象")
    class RuleTests {

        @Test
        @DisplayName("规则保留声明顺序且不可修改")
        void rulesShouldBeImmutable() {
            PatternRuleTable table = PatternRuleTable.of(
                    PatternRule.of("b.*", INPUT_INFO),
                    PatternRule.of("a.B", OUTPUT_DEBUG)
            );

            List<PatternRule> rules = table.getRules();
            assertEquals("b.*", rules.get(0).getPattern());
            assertThrows(UnsupportedOperationException.class, () -> rules.add(PatternRule.of("c", INPUT_INFO)));
        }

        @Test
        @DisplayName("通配规则的前缀去掉末尾 *")
        void prefixShouldDropTrailingWildcard() {
            PatternRule rule = PatternRule.of("com.example.*", INPUT_INFO);

            assertTrue(rule.isWildcard());
            assertEquals("com.example.", rule.prefix());
        }

        @Test
        @DisplayName("方法排除模式")
        void excludeMethodPatterns() {
            PatternRule rule = new PatternRule("com.example.*", INPUT_INFO, List.of("get*", "*Internal"));

            assertTrue(rule.excludesMethod("getTotal"));
            assertTrue(rule.excludesMethod("syncInternal"));
            assertFalse(rule.excludesMethod("placeOrder"));
        }

        @Test
        @DisplayName("toString 应包含规则数量")
        void toStringShouldWork() {
            PatternRuleTable table = PatternRuleTable.of(
                    PatternRule.of("a.*", INPUT_INFO),
                    PatternRule.of("a.B", INPUT_INFO)
            );

            assertEquals("PatternRuleTable{exact=1, wildcard=1}", table.toString());
        }
    }
}

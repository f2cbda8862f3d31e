package com.loglens.core.resolver;

import com.loglens.api.interception.InterceptionBehavior;
import com.loglens.api.interception.InterceptionDecision;
import com.loglens.core.marker.InterceptionMarker;
import com.loglens.core.marker.MarkerInspector;
import com.loglens.core.marker.MarkerSource;
import com.loglens.core.rule.PatternRule;
import com.loglens.core.rule.PatternRuleTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.slf4j.event.Level;

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DecisionResolver 单元测试")
class DecisionResolverTest {

    @Mock
    private MarkerSource markerSource;

    private Method placeOrder;

    public static class OrderService {
        public void placeOrder(String id) {
        }
    }

    public static class OrderAudit extends OrderService {
    }

    private static final InterceptionDecision RULE_OUTPUT_DEBUG =
            InterceptionDecision.of(InterceptionBehavior.LOG_OUTPUT, Level.DEBUG);

    @BeforeEach
    void setUp() throws NoSuchMethodException {
        when(markerSource.methodMarkers(any(Method.class))).thenReturn(Collections.emptyList());
        when(markerSource.typeMarkers(any())).thenReturn(Collections.emptyList());
        placeOrder = OrderService.class.getMethod("placeOrder", String.class);
    }

    private DecisionResolver resolver(PatternRuleTable table, boolean autoIntercept) {
        return new DecisionResolver(new MarkerInspector(markerSource), table, autoIntercept);
    }

    private PatternRuleTable ruleForOrderService(InterceptionDecision decision) {
        return PatternRuleTable.of(PatternRule.of(OrderService.class.getName(), decision));
    }

    @Nested
    @DisplayName("优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("关闭标记优先于一切")
        void disableMarkerShouldWin() {
            when(markerSource.methodMarkers(placeOrder)).thenReturn(List.of(InterceptionMarker.disabled()));

            assertNull(resolver(ruleForOrderService(RULE_OUTPUT_DEBUG), true).resolve(placeOrder));
        }

        @Test
        @DisplayName("启用标记优先于配置规则")
        void markerShouldBeatRule() {
            when(markerSource.methodMarkers(placeOrder)).thenReturn(List.of(InterceptionMarker.captureBoth(Level.WARN, null)));

            InterceptionDecision decision = resolver(ruleForOrderService(RULE_OUTPUT_DEBUG), true).resolve(placeOrder);

            assertEquals(InterceptionBehavior.LOG_BOTH, decision.getBehavior());
            assertEquals(Level.WARN, decision.getLevel());
        }

        @Test
        @DisplayName("配置规则优先于自动拦截")
        void ruleShouldBeatAutoIntercept() {
            InterceptionDecision decision = resolver(ruleForOrderService(RULE_OUTPUT_DEBUG), true).resolve(placeOrder);

            assertEquals(RULE_OUTPUT_DEBUG, decision);
        }

        @Test
        @DisplayName("规则按所属类型匹配，而不是声明类型")
        void ruleShouldMatchOwningType() {
            PatternRuleTable table = PatternRuleTable.of(PatternRule.of(OrderAudit.class.getName(), RULE_OUTPUT_DEBUG));
            DecisionResolver resolver = resolver(table, false);

            assertEquals(RULE_OUTPUT_DEBUG, resolver.resolve(placeOrder, OrderAudit.class));
            assertNull(resolver.resolve(placeOrder));
        }

        @Test
        @DisplayName("行为为 NONE 的规则表示不拦截，不回退到自动拦截")
        void noneRuleShouldDisable() {
            InterceptionDecision none = InterceptionDecision.of(InterceptionBehavior.NONE, Level.INFO);

            assertNull(resolver(ruleForOrderService(none), true).resolve(placeOrder));
        }
    }

    @Nested
    @DisplayName("自动拦截")
    class AutoInterceptTests {

        @Test
        @DisplayName("开启时返回默认决策")
        void enabledShouldReturnDefaults() {
            DecisionResolver resolver = resolver(PatternRuleTable.empty(), true);

            assertEquals(InterceptionDecision.defaults(), resolver.resolve(placeOrder));
            assertTrue(resolver.isAutoIntercept());
        }

        @Test
        @DisplayName("关闭时返回 null")
        void disabledShouldReturnNull() {
            assertNull(resolver(PatternRuleTable.empty(), false).resolve(placeOrder));
        }

        @Test
        @DisplayName("类型级关闭标记")
        void typeDisableShouldBeReported() {
            when(markerSource.typeMarkers(OrderService.class)).thenReturn(List.of(InterceptionMarker.disabled()));
            DecisionResolver resolver = resolver(PatternRuleTable.empty(), true);

            assertTrue(resolver.isTypeDisabled(OrderService.class));
            assertNull(resolver.resolve(placeOrder));
        }
    }
}

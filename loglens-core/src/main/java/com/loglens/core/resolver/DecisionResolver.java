package com.loglens.core.resolver;

import com.loglens.api.interception.InterceptionDecision;
import com.loglens.core.marker.MarkerInspector;
import com.loglens.core.rule.PatternRuleTable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Method;

/**
 * 决策解析器
 * <p>
 * 固定优先级，不可调整：
 * <ol>
 *     <li>关闭标记 → 不拦截</li>
 *     <li>启用标记 → 使用标记决策</li>
 *     <li>配置规则 (按所属类型完整类名匹配) → 使用规则决策</li>
 *     <li>自动拦截开启 → 默认决策，否则不拦截</li>
 * </ol>
 */
@Slf4j
public class DecisionResolver {

    private final MarkerInspector markerInspector;
    private final PatternRuleTable ruleTable;
    @Getter
    private final boolean autoIntercept;

    public DecisionResolver(MarkerInspector markerInspector, PatternRuleTable ruleTable, boolean autoIntercept) {
        this.markerInspector = markerInspector;
        this.ruleTable = ruleTable;
        this.autoIntercept = autoIntercept;
    }

    public InterceptionDecision resolve(Method method) {
        return resolve(method, method.getDeclaringClass());
    }

    /**
     * @param owningType 方法所属类型：注册时为具体类，其他情况为声明类
     * @return 不拦截时返回 null
     */
    public InterceptionDecision resolve(Method method, Class<?> owningType) {
        // 1. 关闭标记 (方法级 > 类型级)
        if (markerInspector.isDisabled(method, owningType)) {
            log.debug("{}.{} -> none (source: disable marker)", owningType.getSimpleName(), method.getName());
            return null;
        }

        // 2. 启用标记
        InterceptionDecision markerDecision = markerInspector.resolveDecision(method, owningType);
        if (markerDecision != null) {
            log.debug("{}.{} -> {} (source: marker)", owningType.getSimpleName(), method.getName(), markerDecision);
            return markerDecision;
        }

        // 3. 配置规则
        InterceptionDecision ruleDecision = ruleTable.lookup(owningType.getName());
        if (ruleDecision != null) {
            log.debug("{}.{} -> {} (source: rule)", owningType.getSimpleName(), method.getName(), ruleDecision);
            return ruleDecision.isIntercepting() ? ruleDecision : null;
        }

        // 4. 默认策略
        if (autoIntercept) {
            log.debug("{}.{} -> default (source: auto-intercept)", owningType.getSimpleName(), method.getName());
            return InterceptionDecision.defaults();
        }
        return null;
    }

    public boolean isTypeDisabled(Class<?> type) {
        return markerInspector.isTypeDisabled(type);
    }
}

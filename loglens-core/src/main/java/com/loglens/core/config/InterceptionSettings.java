package com.loglens.core.config;

import com.loglens.core.marker.AnnotationMarkerSource;
import com.loglens.core.marker.MarkerSource;
import com.loglens.core.rule.PatternRuleTable;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Set;

/**
 * 拦截策略配置
 * <p>
 * 显式传入决策缓存，不依赖全局静态状态，不同策略可以在同一进程中并存。
 */
@Getter
@Builder(toBuilder = true)
public class InterceptionSettings {

    /**
     * 既无标记也无规则命中时是否按默认决策拦截
     */
    @Builder.Default
    private boolean autoIntercept = true;

    /**
     * 配置规则表 (已由配置层解析与校验)
     */
    @Builder.Default
    private PatternRuleTable ruleTable = PatternRuleTable.empty();

    /**
     * 标记来源，默认读取注解
     */
    @Builder.Default
    private MarkerSource markerSource = new AnnotationMarkerSource();

    /**
     * 手动日志类型：公共构造器注入了这些类型的服务不参与拦截
     */
    @Singular
    private Set<Class<?>> manualLoggingTypes;

    /**
     * 默认配置：注解 + 自动拦截
     */
    public static InterceptionSettings defaults() {
        return InterceptionSettings.builder().build();
    }

    /**
     * 严格模式：只拦截有标记或规则命中的方法
     */
    public static InterceptionSettings strict() {
        return InterceptionSettings.builder()
                .autoIntercept(false)
                .build();
    }

    @Override
    public String toString() {
        return String.format(
                "InterceptionSettings{autoIntercept=%s, rules=%d, markerSource=%s, manualLoggingTypes=%d}",
                autoIntercept, ruleTable.size(), markerSource.getClass().getSimpleName(), manualLoggingTypes.size()
        );
    }
}

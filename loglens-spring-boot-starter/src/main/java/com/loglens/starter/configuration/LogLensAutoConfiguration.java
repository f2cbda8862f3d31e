package com.loglens.starter.configuration;

import com.loglens.core.cache.InterceptionDecisionCache;
import com.loglens.core.config.InterceptionSettings;
import com.loglens.core.marker.AnnotationMarkerSource;
import com.loglens.core.marker.MarkerSource;
import com.loglens.starter.config.LogLensProperties;
import com.loglens.starter.processor.InterceptionTypeRegistrar;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * LogLens 自动配置
 * <p>
 * 组装顺序：属性 → 规则表 (边界校验) → 策略配置 → 决策缓存 → 类型注册器。
 */
@AutoConfiguration
@EnableConfigurationProperties(LogLensProperties.class)
@ConditionalOnProperty(prefix = "loglens", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LogLensAutoConfiguration {

    // 1. 标记来源可替换 (例如显式登记表)
    @Bean
    @ConditionalOnMissingBean
    public MarkerSource markerSource() {
        return new AnnotationMarkerSource();
    }

    // 2. 属性转换为引擎配置，非法模式在这里被拒绝
    @Bean
    @ConditionalOnMissingBean
    public InterceptionSettings interceptionSettings(LogLensProperties properties, MarkerSource markerSource) {
        return InterceptionSettings.builder()
                .autoIntercept(properties.isAutoIntercept())
                .ruleTable(properties.toRuleTable())
                .markerSource(markerSource)
                .manualLoggingTypes(properties.getManualLoggingTypes())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public InterceptionDecisionCache interceptionDecisionCache(InterceptionSettings interceptionSettings) {
        return InterceptionDecisionCache.create(interceptionSettings);
    }

    // 3. 【关键】容器中的业务 Bean 在初始化前注册到缓存
    @Bean
    public static InterceptionTypeRegistrar interceptionTypeRegistrar(InterceptionDecisionCache interceptionDecisionCache,
                                                                      LogLensProperties properties) {
        return new InterceptionTypeRegistrar(interceptionDecisionCache,
                properties.getBasePackages(), properties.getExcludedPackages());
    }
}

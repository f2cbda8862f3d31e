package com.loglens.starter.config;

import com.loglens.api.interception.InterceptionBehavior;
import com.loglens.api.interception.InterceptionDecision;
import com.loglens.core.rule.PatternRule;
import com.loglens.core.rule.PatternRuleTable;
import com.loglens.starter.exception.InvalidPatternRuleException;
import lombok.Data;
import org.slf4j.event.Level;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LogLens 主配置属性
 * <p>
 * 示例：
 *
 * <pre>
 * loglens:
 *   auto-intercept: false
 *   base-packages:
 *     - com.example.
 *   services:
 *     "[com.example.billing.BillingService]":
 *       log-input: true
 *     "[com.example.orders.*]":
 *       log-output: true
 *       level: DEBUG
 *       exclude-method-patterns: ["get*", "*Internal"]
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "loglens")
public class LogLensProperties {

    /**
     * 是否启用 LogLens
     */
    private boolean enabled = true;

    /**
     * 既无注解也无规则命中的方法是否按默认决策 (记录入参 / INFO) 拦截
     */
    private boolean autoIntercept = true;

    /**
     * 只注册这些包前缀下的 Bean 类型，为空表示不限制
     */
    private List<String> basePackages = new ArrayList<>();

    /**
     * 额外排除的包前缀 (内置已排除 java.*、org.springframework.* 等)
     */
    private List<String> excludedPackages = new ArrayList<>();

    /**
     * 手动日志类型：构造器注入了这些类型的服务自行打日志，不参与拦截
     */
    private List<Class<?>> manualLoggingTypes = new ArrayList<>();

    /**
     * 服务规则表，键为完整类名或以 * 结尾的前缀。
     * 通配规则按声明顺序匹配，先声明者胜。
     */
    private Map<String, ServiceRule> services = new LinkedHashMap<>();

    /**
     * 单条服务规则
     */
    @Data
    public static class ServiceRule {

        /**
         * false 表示命中该规则的类型不拦截
         */
        private boolean enabled = true;

        private boolean logInput;

        private boolean logOutput;

        private Level level = Level.INFO;

        private Level exceptionLevel = Level.ERROR;

        /**
         * 目标输出通道，不配置使用默认通道
         */
        private String target;

        private List<String> excludeMethodPatterns = new ArrayList<>();

        /**
         * 两个开关都没打开时按记录入参处理
         */
        public InterceptionDecision toDecision() {
            InterceptionBehavior behavior;
            if (!enabled) {
                behavior = InterceptionBehavior.NONE;
            } else if (logInput && logOutput) {
                behavior = InterceptionBehavior.LOG_BOTH;
            } else if (logOutput) {
                behavior = InterceptionBehavior.LOG_OUTPUT;
            } else {
                behavior = InterceptionBehavior.LOG_INPUT;
            }
            return InterceptionDecision.builder()
                    .behavior(behavior)
                    .level(level)
                    .exceptionLevel(exceptionLevel)
                    .target(target == null || target.isBlank() ? null : target)
                    .build();
        }
    }

    /**
     * 校验并转换为引擎使用的只读规则表
     *
     * @throws InvalidPatternRuleException 模式为空或通配符不在末尾
     */
    public PatternRuleTable toRuleTable() {
        PatternRuleTable.PatternRuleTableBuilder builder = PatternRuleTable.builder();
        for (Map.Entry<String, ServiceRule> e : services.entrySet()) {
            String pattern = validatePattern(e.getKey());
            ServiceRule rule = e.getValue();
            builder.rule(new PatternRule(pattern, rule.toDecision(), rule.getExcludeMethodPatterns()));
        }
        return builder.build();
    }

    private static String validatePattern(String raw) {
        String pattern = raw == null ? "" : raw.trim();
        if (pattern.isEmpty()) {
            throw new InvalidPatternRuleException(String.valueOf(raw), "Service pattern must not be empty");
        }
        int wildcard = pattern.indexOf(PatternRule.WILDCARD);
        if (wildcard >= 0 && wildcard != pattern.length() - 1) {
            throw new InvalidPatternRuleException(pattern, "Only a single trailing wildcard is supported");
        }
        return pattern;
    }
}

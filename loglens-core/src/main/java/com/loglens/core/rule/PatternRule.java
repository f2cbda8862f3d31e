package com.loglens.core.rule;

import com.loglens.api.interception.InterceptionDecision;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 配置规则：类型名模式 -> 决策
 * <p>
 * 模式为完整类名 (精确匹配) 或以 {@code *} 结尾的前缀。
 * 模式语法由配置边界负责校验，这里假定输入合法。
 */
@Value
public class PatternRule {

    public static final String WILDCARD = "*";

    String pattern;

    InterceptionDecision decision;

    /**
     * 不参与拦截的方法名模式 (精确 / prefix* / *suffix / *contains*)
     */
    List<String> excludeMethodPatterns;

    public PatternRule(String pattern, InterceptionDecision decision, List<String> excludeMethodPatterns) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.decision = Objects.requireNonNull(decision, "decision");
        this.excludeMethodPatterns = excludeMethodPatterns == null
                ? Collections.emptyList()
                : List.copyOf(excludeMethodPatterns);
    }

    public static PatternRule of(String pattern, InterceptionDecision decision) {
        return new PatternRule(pattern, decision, Collections.emptyList());
    }

    public boolean isWildcard() {
        return pattern.endsWith(WILDCARD);
    }

    /**
     * 通配规则的前缀部分
     */
    public String prefix() {
        return isWildcard() ? pattern.substring(0, pattern.length() - 1) : pattern;
    }

    public boolean excludesMethod(String methodName) {
        for (String p : excludeMethodPatterns) {
            if (MethodNamePatterns.matches(methodName, p)) {
                return true;
            }
        }
        return false;
    }
}

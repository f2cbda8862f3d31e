package com.loglens.core.rule;

import com.loglens.api.interception.InterceptionDecision;
import lombok.Builder;
import lombok.Singular;

import java.util.*;

/**
 * 配置规则表 (只读)
 * <p>
 * 查找顺序：先精确匹配类名；未命中时按声明顺序扫描通配规则，第一个前缀匹配的规则生效。
 * 注意是"先声明者胜"而不是"最长前缀胜"，需要最长前缀语义的调用方应自行排列规则顺序。
 */
public class PatternRuleTable {

    private static final PatternRuleTable EMPTY = new PatternRuleTable(Collections.emptyList());

    private final List<PatternRule> rules;
    private final Map<String, PatternRule> exactRules;
    private final List<PatternRule> wildcardRules;

    @Builder
    public PatternRuleTable(@Singular List<PatternRule> rules) {
        this.rules = List.copyOf(rules);

        Map<String, PatternRule> exact = new HashMap<>();
        List<PatternRule> wildcards = new ArrayList<>();
        for (PatternRule rule : this.rules) {
            if (rule.isWildcard()) {
                wildcards.add(rule);
            } else {
                exact.putIfAbsent(rule.getPattern(), rule);
            }
        }
        this.exactRules = Map.copyOf(exact);
        this.wildcardRules = List.copyOf(wildcards);
    }

    public static PatternRuleTable empty() {
        return EMPTY;
    }

    public static PatternRuleTable of(PatternRule... rules) {
        return new PatternRuleTable(Arrays.asList(rules));
    }

    /**
     * 查找匹配给定完整类名的规则
     *
     * @return 未匹配返回 null
     */
    public PatternRule match(String typeName) {
        if (typeName == null || rules.isEmpty()) {
            return null;
        }

        PatternRule exact = exactRules.get(typeName);
        if (exact != null) {
            return exact;
        }

        for (PatternRule rule : wildcardRules) {
            if (typeName.startsWith(rule.prefix())) {
                return rule;
            }
        }
        return null;
    }

    /**
     * 查找匹配规则的决策
     *
     * @return 未匹配返回 null
     */
    public InterceptionDecision lookup(String typeName) {
        PatternRule rule = match(typeName);
        return rule != null ? rule.getDecision() : null;
    }

    public List<PatternRule> getRules() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "PatternRuleTable{exact=" + exactRules.size() + ", wildcard=" + wildcardRules.size() + "}";
    }
}

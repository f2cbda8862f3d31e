package com.loglens.starter.exception;

import com.loglens.api.exception.LogLensException;

/**
 * 配置规则模式非法 (空模式、通配符不在末尾)
 * 在配置边界抛出，规则不会进入决策引擎。
 */
public class InvalidPatternRuleException extends LogLensException {

    private final String pattern;

    public InvalidPatternRuleException(String pattern, String message) {
        super(message + ": '" + pattern + "'");
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}

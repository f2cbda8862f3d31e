package com.loglens.api.interception;

/**
 * 拦截行为：决定一次调用记录哪些内容
 */
public enum InterceptionBehavior {

    /**
     * 不记录（显式关闭）
     */
    NONE,

    /**
     * 记录入参
     */
    LOG_INPUT,

    /**
     * 记录返回值
     */
    LOG_OUTPUT,

    /**
     * 入参与返回值都记录
     */
    LOG_BOTH;

    public boolean capturesInput() {
        return this == LOG_INPUT || this == LOG_BOTH;
    }

    public boolean capturesOutput() {
        return this == LOG_OUTPUT || this == LOG_BOTH;
    }
}

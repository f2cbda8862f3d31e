package com.loglens.core.marker;

/**
 * 声明式标记类型
 */
public enum MarkerKind {
    /**
     * 显式关闭 (@NoLog / @NoAutoLog)
     */
    DISABLED,
    CAPTURE_INPUT,
    CAPTURE_OUTPUT,
    CAPTURE_BOTH
}

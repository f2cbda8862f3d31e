package com.loglens.api.interception;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.slf4j.event.Level;

/**
 * 拦截决策 (不可变值对象)
 * 承载一个方法最终的记录方式：记录什么、正常级别、异常级别、输出通道。
 * <p>
 * 修改通过 {@code withXxx} 产生新实例，已发布的决策永远不会被原地修改。
 */
@Value
@With
@Builder(toBuilder = true)
public class InterceptionDecision {

    @Builder.Default
    InterceptionBehavior behavior = InterceptionBehavior.LOG_INPUT;

    /**
     * 正常完成时的日志级别
     */
    @Builder.Default
    Level level = Level.INFO;

    /**
     * 抛出异常时的日志级别
     */
    @Builder.Default
    Level exceptionLevel = Level.ERROR;

    /**
     * 目标输出通道，null 表示默认通道
     */
    String target;

    /**
     * 自动拦截使用的默认决策：记录入参 / INFO / ERROR / 默认通道
     */
    public static InterceptionDecision defaults() {
        return InterceptionDecision.builder().build();
    }

    public static InterceptionDecision of(InterceptionBehavior behavior, Level level) {
        return InterceptionDecision.builder()
                .behavior(behavior)
                .level(level)
                .build();
    }

    /**
     * 行为为 NONE 的决策等同于"不拦截"
     */
    public boolean isIntercepting() {
        return behavior != InterceptionBehavior.NONE;
    }
}

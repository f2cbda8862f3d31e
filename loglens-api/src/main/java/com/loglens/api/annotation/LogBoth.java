package com.loglens.api.annotation;

import org.slf4j.event.Level;

import java.lang.annotation.*;

/**
 * 入参与返回值同时记录
 * <p>
 * 方法级注解优先于类级注解和配置规则。类级标注时作用于该类所有可拦截的方法，
 * 单个方法可以通过 {@link NoLog} 排除。
 *
 * <pre>
 * &#64;LogBoth
 * public class AuditService {
 *     public AuditResult record(UserAction action) { ... }
 *
 *     &#64;NoLog
 *     public void recordSecurityEvent(SecurityEvent event) { ... }
 * }
 * </pre>
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface LogBoth {

    /**
     * 正常完成时的日志级别
     */
    Level level() default Level.INFO;

    /**
     * 抛出异常时的日志级别
     */
    Level exceptionLevel() default Level.ERROR;

    /**
     * 目标输出通道名称，空字符串表示使用默认通道
     */
    String target() default "";
}

package com.loglens.api.annotation;

import org.slf4j.event.Level;

import java.lang.annotation.*;

/**
 * 入参记录注解
 * 标注在方法或类上，拦截时记录方法入参。
 * <p>
 * 与 {@link LogOutput} 同时出现在同一层级时等价于 {@link LogBoth}，级别取两者中更详细的一个。
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface LogInput {

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

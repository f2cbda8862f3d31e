package com.loglens.api.annotation;

import org.slf4j.event.Level;

import java.lang.annotation.*;

/**
 * 返回值记录注解
 * 标注在方法或类上，拦截时记录方法返回值。
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface LogOutput {

    Level level() default Level.INFO;

    Level exceptionLevel() default Level.ERROR;

    /**
     * 目标输出通道名称，空字符串表示使用默认通道
     */
    String target() default "";
}

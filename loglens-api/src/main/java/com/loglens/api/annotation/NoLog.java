package com.loglens.api.annotation;

import java.lang.annotation.*;

/**
 * 禁止记录
 * 优先级最高：覆盖任何启用注解、配置规则和自动拦截策略。
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface NoLog {
}

package com.loglens.api.annotation;

import java.lang.annotation.*;

/**
 * 关闭自动拦截
 * 与 {@link NoLog} 效果相同，语义上表示方法内部自行打日志，不需要拦截层介入。
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface NoAutoLog {
}

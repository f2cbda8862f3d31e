package com.loglens.core.marker;

import java.lang.reflect.Method;
import java.util.List;

/**
 * 标记来源 SPI
 * <p>
 * 把"标记从哪里来"与优先级计算解耦：默认实现读取注解，
 * 也可以使用启动时显式登记的旁路表 ({@link RegisteredMarkerSource})。
 */
public interface MarkerSource {

    /**
     * 方法自身声明的标记，没有返回空列表
     */
    List<InterceptionMarker> methodMarkers(Method method);

    /**
     * 类型级标记，没有返回空列表
     */
    List<InterceptionMarker> typeMarkers(Class<?> type);
}

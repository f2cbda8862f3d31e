package com.loglens.core.marker;

import com.loglens.api.interception.InterceptionBehavior;
import com.loglens.api.interception.InterceptionDecision;
import lombok.RequiredArgsConstructor;
import org.slf4j.event.Level;

import java.lang.reflect.Method;
import java.util.List;

/**
 * 标记检查器
 * <p>
 * 优先级：方法级关闭 > 类型级关闭 > 方法级启用 > 类型级启用 > 无标记(交给配置)
 * <p>
 * 同一层级同时出现入参与返回值标记时合并为 LOG_BOTH：
 * 级别取更详细的一个 (slf4j {@link Level#toInt()} 更小者)，通道取第一个非空值，
 * 异常级别默认 ERROR，除非任一标记覆盖（入参标记优先）。
 */
@RequiredArgsConstructor
public class MarkerInspector {

    private final MarkerSource markerSource;

    /**
     * 方法级或类型级是否存在关闭标记
     */
    public boolean isDisabled(Method method, Class<?> owningType) {
        return containsDisable(markerSource.methodMarkers(method)) || isTypeDisabled(owningType);
    }

    /**
     * 类型级是否存在关闭标记 (与具体方法无关)
     */
    public boolean isTypeDisabled(Class<?> type) {
        return containsDisable(markerSource.typeMarkers(type));
    }

    /**
     * 解析启用标记产生的决策：方法级优先，其次类型级
     *
     * @return 没有任何启用标记时返回 null
     */
    public InterceptionDecision resolveDecision(Method method, Class<?> owningType) {
        InterceptionDecision methodDecision = combine(markerSource.methodMarkers(method));
        if (methodDecision != null) {
            return methodDecision;
        }
        return combine(markerSource.typeMarkers(owningType));
    }

    /**
     * 合并同一层级的启用标记
     */
    static InterceptionDecision combine(List<InterceptionMarker> markers) {
        if (markers.isEmpty()) {
            return null;
        }

        InterceptionMarker input = null;
        InterceptionMarker output = null;
        for (InterceptionMarker marker : markers) {
            switch (marker.getKind()) {
                case CAPTURE_BOTH:
                    return toDecision(InterceptionBehavior.LOG_BOTH, marker);
                case CAPTURE_INPUT:
                    if (input == null) input = marker;
                    break;
                case CAPTURE_OUTPUT:
                    if (output == null) output = marker;
                    break;
                default:
                    break;
            }
        }

        if (input != null && output != null) {
            return InterceptionDecision.builder()
                    .behavior(InterceptionBehavior.LOG_BOTH)
                    .level(moreVerbose(levelOf(input), levelOf(output)))
                    .exceptionLevel(firstNonNull(input.getExceptionLevel(), output.getExceptionLevel(), Level.ERROR))
                    .target(firstNonNull(input.getTarget(), output.getTarget(), null))
                    .build();
        }
        if (input != null) {
            return toDecision(InterceptionBehavior.LOG_INPUT, input);
        }
        if (output != null) {
            return toDecision(InterceptionBehavior.LOG_OUTPUT, output);
        }
        return null;
    }

    /**
     * 返回更详细的级别 (TRACE < DEBUG < INFO < WARN < ERROR)
     */
    static Level moreVerbose(Level a, Level b) {
        return a.toInt() <= b.toInt() ? a : b;
    }

    private static InterceptionDecision toDecision(InterceptionBehavior behavior, InterceptionMarker marker) {
        return InterceptionDecision.builder()
                .behavior(behavior)
                .level(levelOf(marker))
                .exceptionLevel(marker.getExceptionLevel() != null ? marker.getExceptionLevel() : Level.ERROR)
                .target(marker.getTarget())
                .build();
    }

    private static Level levelOf(InterceptionMarker marker) {
        return marker.getLevel() != null ? marker.getLevel() : Level.INFO;
    }

    private static boolean containsDisable(List<InterceptionMarker> markers) {
        for (InterceptionMarker marker : markers) {
            if (marker.isDisabled()) {
                return true;
            }
        }
        return false;
    }

    private static <T> T firstNonNull(T first, T second, T fallback) {
        if (first != null) return first;
        return second != null ? second : fallback;
    }
}

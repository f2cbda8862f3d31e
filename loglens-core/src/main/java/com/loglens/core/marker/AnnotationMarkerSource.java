package com.loglens.core.marker;

import com.loglens.api.annotation.*;
import org.slf4j.event.Level;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基于注解的标记来源 (默认实现)
 * <p>
 * 类型级注解均为 {@code @Inherited}，子类会继承父类上的标注。
 */
public class AnnotationMarkerSource implements MarkerSource {

    @Override
    public List<InterceptionMarker> methodMarkers(Method method) {
        return read(method);
    }

    @Override
    public List<InterceptionMarker> typeMarkers(Class<?> type) {
        return read(type);
    }

    private List<InterceptionMarker> read(AnnotatedElement element) {
        if (element.getAnnotations().length == 0) {
            return Collections.emptyList();
        }

        List<InterceptionMarker> markers = new ArrayList<>(2);
        if (element.isAnnotationPresent(NoLog.class) || element.isAnnotationPresent(NoAutoLog.class)) {
            markers.add(InterceptionMarker.disabled());
        }

        LogBoth both = element.getAnnotation(LogBoth.class);
        if (both != null) {
            markers.add(toMarker(MarkerKind.CAPTURE_BOTH, both.level(), both.exceptionLevel(), both.target()));
        }

        LogInput input = element.getAnnotation(LogInput.class);
        if (input != null) {
            markers.add(toMarker(MarkerKind.CAPTURE_INPUT, input.level(), input.exceptionLevel(), input.target()));
        }

        LogOutput output = element.getAnnotation(LogOutput.class);
        if (output != null) {
            markers.add(toMarker(MarkerKind.CAPTURE_OUTPUT, output.level(), output.exceptionLevel(), output.target()));
        }
        return markers;
    }

    private InterceptionMarker toMarker(MarkerKind kind, Level level, Level exceptionLevel, String target) {
        return InterceptionMarker.builder()
                .kind(kind)
                .level(level)
                // 注解无法表达 null，ERROR 即视为未覆盖
                .exceptionLevel(exceptionLevel == Level.ERROR ? null : exceptionLevel)
                .target(target == null || target.isEmpty() ? null : target)
                .build();
    }
}

package com.loglens.core.marker;

import lombok.Builder;
import lombok.Value;
import org.slf4j.event.Level;

/**
 * 方法或类型上的一条声明式标记
 * <p>
 * level / exceptionLevel / target 为 null 表示未覆盖，由 {@link MarkerInspector} 套用默认值。
 */
@Value
@Builder
public class InterceptionMarker {

    MarkerKind kind;

    Level level;

    Level exceptionLevel;

    String target;

    public static InterceptionMarker disabled() {
        return InterceptionMarker.builder().kind(MarkerKind.DISABLED).build();
    }

    public static InterceptionMarker captureInput(Level level) {
        return InterceptionMarker.builder().kind(MarkerKind.CAPTURE_INPUT).level(level).build();
    }

    public static InterceptionMarker captureOutput(Level level) {
        return InterceptionMarker.builder().kind(MarkerKind.CAPTURE_OUTPUT).level(level).build();
    }

    public static InterceptionMarker captureBoth(Level level, Level exceptionLevel) {
        return InterceptionMarker.builder()
                .kind(MarkerKind.CAPTURE_BOTH)
                .level(level)
                .exceptionLevel(exceptionLevel)
                .build();
    }

    public boolean isDisabled() {
        return kind == MarkerKind.DISABLED;
    }
}

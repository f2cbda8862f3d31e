package com.loglens.core.marker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RegisteredMarkerSource 单元测试")
class RegisteredMarkerSourceTest {

    static class Overloaded {
        public void send(String message) {
        }

        public void send(String message, int retries) {
        }
    }

    @Test
    @DisplayName("按参数类型区分重载方法")
    void shouldDistinguishOverloads() throws NoSuchMethodException {
        RegisteredMarkerSource source = RegisteredMarkerSource.builder()
                .method(Overloaded.class, "send", new Class<?>[]{String.class}, InterceptionMarker.captureInput(Level.DEBUG))
                .build();

        List<InterceptionMarker> single = source.methodMarkers(Overloaded.class.getMethod("send", String.class));
        List<InterceptionMarker> withRetries = source.methodMarkers(Overloaded.class.getMethod("send", String.class, int.class));

        assertEquals(1, single.size());
        assertTrue(withRetries.isEmpty());
    }

    @Test
    @DisplayName("登记类型标记")
    void shouldRegisterTypeMarkers() {
        RegisteredMarkerSource source = RegisteredMarkerSource.builder()
                .type(Overloaded.class, InterceptionMarker.disabled())
                .build();

        assertTrue(source.typeMarkers(Overloaded.class).get(0).isDisabled());
        assertTrue(source.typeMarkers(String.class).isEmpty());
    }

    @Test
    @DisplayName("登记不存在的方法应失败")
    void unknownMethodShouldFail() {
        RegisteredMarkerSource.Builder builder = RegisteredMarkerSource.builder();

        assertThrows(IllegalArgumentException.class,
                () -> builder.method(Overloaded.class, "missing", new Class<?>[0], InterceptionMarker.disabled()));
    }
}

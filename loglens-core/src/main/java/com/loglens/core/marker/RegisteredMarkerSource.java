package com.loglens.core.marker;

import com.loglens.core.identity.MethodIdentity;

import java.lang.reflect.Method;
import java.util.*;

/**
 * 显式登记的标记旁路表
 * <p>
 * 适用于无法（或不希望）在源码上加注解的场景，例如第三方类、生成代码。
 * 构建完成后不可变。
 */
public class RegisteredMarkerSource implements MarkerSource {

    private final Map<MethodIdentity, List<InterceptionMarker>> methodMarkers;
    private final Map<String, List<InterceptionMarker>> typeMarkers;

    private RegisteredMarkerSource(Map<MethodIdentity, List<InterceptionMarker>> methodMarkers,
                                   Map<String, List<InterceptionMarker>> typeMarkers) {
        this.methodMarkers = Map.copyOf(methodMarkers);
        this.typeMarkers = Map.copyOf(typeMarkers);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<InterceptionMarker> methodMarkers(Method method) {
        return methodMarkers.getOrDefault(MethodIdentity.of(method), Collections.emptyList());
    }

    @Override
    public List<InterceptionMarker> typeMarkers(Class<?> type) {
        return typeMarkers.getOrDefault(type.getName(), Collections.emptyList());
    }

    public static class Builder {

        private final Map<MethodIdentity, List<InterceptionMarker>> methodMarkers = new HashMap<>();
        private final Map<String, List<InterceptionMarker>> typeMarkers = new HashMap<>();

        public Builder method(Class<?> declaringType, String methodName, Class<?>[] parameterTypes,
                              InterceptionMarker... markers) {
            try {
                return method(declaringType.getMethod(methodName, parameterTypes), markers);
            } catch (NoSuchMethodException e) {
                throw new IllegalArgumentException(
                        "No public method " + declaringType.getName() + "." + methodName, e);
            }
        }

        public Builder method(Method method, InterceptionMarker... markers) {
            methodMarkers.computeIfAbsent(MethodIdentity.of(method), k -> new ArrayList<>())
                    .addAll(Arrays.asList(markers));
            return this;
        }

        public Builder type(Class<?> type, InterceptionMarker... markers) {
            typeMarkers.computeIfAbsent(type.getName(), k -> new ArrayList<>())
                    .addAll(Arrays.asList(markers));
            return this;
        }

        public RegisteredMarkerSource build() {
            Map<MethodIdentity, List<InterceptionMarker>> methods = new HashMap<>();
            methodMarkers.forEach((k, v) -> methods.put(k, List.copyOf(v)));
            Map<String, List<InterceptionMarker>> types = new HashMap<>();
            typeMarkers.forEach((k, v) -> types.put(k, List.copyOf(v)));
            return new RegisteredMarkerSource(methods, types);
        }
    }
}

package com.loglens.core.identity;

import com.loglens.core.rule.PatternRule;
import com.loglens.core.rule.PatternRuleTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.BridgeMethodResolver;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * 方法标识解析器
 * <p>
 * 负责三件事：计算方法标识、判断方法是否可拦截、把接口方法定位到已知具体类型上的实现。
 */
@Slf4j
public class MethodIdentityResolver {

    private final PatternRuleTable ruleTable;
    private final Set<Class<?>> manualLoggingTypes;

    public MethodIdentityResolver(PatternRuleTable ruleTable, Set<Class<?>> manualLoggingTypes) {
        this.ruleTable = ruleTable;
        this.manualLoggingTypes = Set.copyOf(manualLoggingTypes);
    }

    public MethodIdentity identity(Method method) {
        return MethodIdentity.of(method);
    }

    public MethodIdentity identity(Method method, Class<?> owningType) {
        return MethodIdentity.of(owningType, method);
    }

    /**
     * 类型上所有可拦截的方法 (包括继承来的公共方法)
     */
    public List<Method> eligibleMethods(Class<?> type) {
        if (hasManualLogging(type)) {
            log.debug("{} injects a manual logger, skipping all methods", type.getName());
            return Collections.emptyList();
        }

        PatternRule rule = ruleTable.match(type.getName());
        List<Method> result = new ArrayList<>();
        for (Method method : type.getMethods()) {
            if (isCandidate(method) && (rule == null || !rule.excludesMethod(method.getName()))) {
                result.add(method);
            }
        }
        return result;
    }

    public boolean isEligible(Method method) {
        return isEligible(method, method.getDeclaringClass());
    }

    /**
     * 可拦截条件：public、非 static 的实例方法；排除编译器生成的桥接/合成方法、
     * Object 上声明的方法、手动打日志的类型以及配置规则排除的方法名
     */
    public boolean isEligible(Method method, Class<?> owningType) {
        if (!isCandidate(method) || hasManualLogging(owningType)) {
            return false;
        }
        PatternRule rule = ruleTable.match(owningType.getName());
        return rule == null || !rule.excludesMethod(method.getName());
    }

    /**
     * 在候选具体类型中查找接口方法的实现
     * <p>
     * 取第一个实现了该接口的具体类型，再按方法名 + 参数类型查找公共方法。
     * 找不到时返回空，调用方应视为"不拦截"而不是错误。
     */
    public Optional<ImplementationTarget> resolveImplementation(Method interfaceMethod,
                                                                Collection<Class<?>> candidateTypes) {
        Class<?> interfaceType = interfaceMethod.getDeclaringClass();
        for (Class<?> candidate : candidateTypes) {
            if (isConcrete(candidate) && interfaceType.isAssignableFrom(candidate)) {
                return findImplementationMethod(interfaceMethod, candidate)
                        .map(m -> new ImplementationTarget(candidate, m));
            }
        }
        log.trace("No registered implementation for {}", interfaceMethod);
        return Optional.empty();
    }

    /**
     * 按接口方法签名查找实现方法
     * <p>
     * 泛型接口按擦除后的签名只能找到编译器生成的桥接方法，这里换成它桥接的实际实现方法。
     */
    public Optional<Method> findImplementationMethod(Method interfaceMethod, Class<?> implementationType) {
        try {
            Method found = implementationType.getMethod(interfaceMethod.getName(), interfaceMethod.getParameterTypes());
            return Optional.of(found.isBridge() ? BridgeMethodResolver.findBridgedMethod(found) : found);
        } catch (NoSuchMethodException e) {
            log.trace("{} has no public member matching {}", implementationType.getName(), interfaceMethod);
            return Optional.empty();
        }
    }

    /**
     * 类型实现的全部接口 (含父类与父接口实现的)，保持发现顺序
     */
    public Set<Class<?>> implementedInterfaces(Class<?> type) {
        Set<Class<?>> interfaces = new LinkedHashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            pending.addAll(Arrays.asList(c.getInterfaces()));
        }
        while (!pending.isEmpty()) {
            Class<?> i = pending.poll();
            if (interfaces.add(i)) {
                pending.addAll(Arrays.asList(i.getInterfaces()));
            }
        }
        return interfaces;
    }

    public static boolean isConcrete(Class<?> type) {
        return !type.isInterface()
                && !type.isArray()
                && !type.isPrimitive()
                && !Modifier.isAbstract(type.getModifiers());
    }

    private boolean isCandidate(Method method) {
        int modifiers = method.getModifiers();
        return Modifier.isPublic(modifiers)
                && !Modifier.isStatic(modifiers)
                && !method.isBridge()
                && !method.isSynthetic()
                && method.getDeclaringClass() != Object.class;
    }

    /**
     * 公共构造器注入了手动日志类型的服务自行负责日志，整体排除
     */
    private boolean hasManualLogging(Class<?> type) {
        if (manualLoggingTypes.isEmpty()) {
            return false;
        }
        for (Constructor<?> constructor : type.getConstructors()) {
            for (Class<?> parameterType : constructor.getParameterTypes()) {
                if (manualLoggingTypes.contains(parameterType)) {
                    return true;
                }
            }
        }
        return false;
    }
}

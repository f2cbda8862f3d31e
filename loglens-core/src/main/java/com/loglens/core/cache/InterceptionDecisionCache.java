package com.loglens.core.cache;

import com.loglens.api.interception.InterceptionDecision;
import com.loglens.core.config.InterceptionSettings;
import com.loglens.core.exception.TypeRegistrationException;
import com.loglens.core.identity.ImplementationTarget;
import com.loglens.core.identity.MethodIdentity;
import com.loglens.core.identity.MethodIdentityResolver;
import com.loglens.core.marker.MarkerInspector;
import com.loglens.core.resolver.DecisionResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.BridgeMethodResolver;

import java.lang.annotation.AnnotationFormatError;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 拦截决策缓存
 * <p>
 * 启动阶段按类型预计算所有可拦截方法的决策，调用阶段只做一次哈希查找：
 * 无反射、无注解解析、无对象分配。
 * <p>
 * 并发模型：每个类型的 {@link TypeDecisions} 在注册线程中完整构建，
 * 然后通过 {@link ConcurrentHashMap#put} 一次性发布；已发布的条目永不修改，重复注册整体替换。
 */
@Slf4j
public class InterceptionDecisionCache {

    private final DecisionResolver decisionResolver;
    private final MethodIdentityResolver identityResolver;

    private final ConcurrentHashMap<Class<?>, TypeDecisions> typeDecisions = new ConcurrentHashMap<>();

    // 接口 -> 已注册实现类 (注册顺序，不可变列表整体替换)
    private final ConcurrentHashMap<Class<?>, List<Class<?>>> implementationIndex = new ConcurrentHashMap<>();

    public InterceptionDecisionCache(DecisionResolver decisionResolver, MethodIdentityResolver identityResolver) {
        this.decisionResolver = decisionResolver;
        this.identityResolver = identityResolver;
    }

    public static InterceptionDecisionCache create(InterceptionSettings settings) {
        MarkerInspector inspector = new MarkerInspector(settings.getMarkerSource());
        DecisionResolver resolver = new DecisionResolver(inspector, settings.getRuleTable(), settings.isAutoIntercept());
        MethodIdentityResolver identityResolver = new MethodIdentityResolver(
                settings.getRuleTable(), settings.getManualLoggingTypes());
        log.info("InterceptionDecisionCache initialized with {}", settings);
        return new InterceptionDecisionCache(resolver, identityResolver);
    }

    // ================= 注册 =================

    /**
     * 预计算具体类型的全部决策并发布
     * <p>
     * 幂等：重复注册同一类型会整体替换旧条目，读线程不会看到构建了一半的条目。
     *
     * @throws TypeRegistrationException 非具体类型或元数据无法读取
     */
    public void registerType(Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (!MethodIdentityResolver.isConcrete(type)) {
            throw new TypeRegistrationException(type, "Only concrete classes can be registered for interception");
        }

        TypeDecisions entry;
        Set<Class<?>> interfaces;
        try {
            interfaces = identityResolver.implementedInterfaces(type);
            entry = buildEntry(type, interfaces);
        } catch (TypeNotPresentException | SecurityException | LinkageError | AnnotationFormatError e) {
            throw new TypeRegistrationException(type, "Unable to read interception metadata", e);
        }

        // 先发布条目，再更新接口索引：经索引找到的实现类一定已有条目
        TypeDecisions previous = typeDecisions.put(type, entry);
        for (Class<?> iface : interfaces) {
            implementationIndex.compute(iface, (k, current) -> append(current, type));
        }

        log.info("{} {} for interception: {} eligible methods, {} intercepted{}",
                previous == null ? "Registered" : "Re-registered",
                type.getName(), entry.size(), entry.interceptedCount(),
                entry.isTypeDisabled() ? " (type disabled)" : "");
    }

    private TypeDecisions buildEntry(Class<?> type, Set<Class<?>> interfaces) {
        boolean typeDisabled = decisionResolver.isTypeDisabled(type);

        Map<Method, InterceptionDecision> byMethod = new HashMap<>();
        Map<MethodIdentity, InterceptionDecision> byIdentity = new HashMap<>();
        for (Method method : identityResolver.eligibleMethods(type)) {
            InterceptionDecision decision = decisionResolver.resolve(method, type);
            byMethod.put(method, decision);
            byIdentity.put(identityResolver.identity(method, type), decision);
        }

        // 接口方法别名：接口方法对象直接映射到实现方法的决策，调用期无需再做反射定位
        for (Class<?> iface : interfaces) {
            for (Method interfaceMethod : iface.getMethods()) {
                if (Modifier.isStatic(interfaceMethod.getModifiers()) || byMethod.containsKey(interfaceMethod)) {
                    continue;
                }
                identityResolver.resolveImplementation(interfaceMethod, List.of(type))
                        .map(ImplementationTarget::getMethod)
                        .filter(byMethod::containsKey)
                        .ifPresent(impl -> byMethod.put(interfaceMethod, byMethod.get(impl)));
            }
        }
        return new TypeDecisions(type, typeDisabled, byMethod, byIdentity);
    }

    private static List<Class<?>> append(List<Class<?>> current, Class<?> type) {
        if (current == null) {
            return List.of(type);
        }
        if (current.contains(type)) {
            return current;
        }
        List<Class<?>> next = new ArrayList<>(current.size() + 1);
        next.addAll(current);
        next.add(type);
        return List.copyOf(next);
    }

    // ================= 查找 =================

    /**
     * 获取方法的拦截决策
     * <ol>
     *     <li>所属类型已注册 → 直接返回预计算结果 (热路径)</li>
     *     <li>所属类型为接口 → 定位已注册的实现类后在其条目中查找，找不到实现视为不拦截</li>
     *     <li>其他情况 → 按同一算法即时计算，不写入缓存</li>
     * </ol>
     *
     * 与按需计算不同，接口方法找不到已注册实现时直接视为不拦截，不会按接口自身的标记与规则计算。
     *
     * @return null 表示不记录本次调用；本方法不会抛出异常
     */
    public InterceptionDecision lookup(Method method) {
        if (method.isBridge()) {
            method = BridgeMethodResolver.findBridgedMethod(method);
        }
        Class<?> owner = method.getDeclaringClass();
        TypeDecisions entry = typeDecisions.get(owner);
        if (entry != null) {
            return entry.get(method);
        }

        if (owner.isInterface()) {
            List<Class<?>> implementors = implementationIndex.get(owner);
            if (implementors == null) {
                log.trace("No registered implementation of {}, not intercepting {}", owner.getName(), method.getName());
                return null;
            }
            return lookupThroughImplementations(method, implementors);
        }
        return resolveOnDemand(method, owner);
    }

    /**
     * 已知目标类的查找 (拦截器通常持有目标对象)
     * <p>
     * 目标类已注册时，继承来的方法和接口方法都能直接命中该类的预计算条目。
     */
    public InterceptionDecision lookup(Method method, Class<?> targetClass) {
        if (method.isBridge()) {
            method = BridgeMethodResolver.findBridgedMethod(method);
        }
        if (targetClass != null) {
            TypeDecisions entry = typeDecisions.get(targetClass);
            if (entry != null) {
                return entry.get(method);
            }
        }
        return lookup(method);
    }

    private InterceptionDecision lookupThroughImplementations(Method method, List<Class<?>> implementors) {
        for (int i = 0; i < implementors.size(); i++) {
            TypeDecisions implEntry = typeDecisions.get(implementors.get(i));
            if (implEntry != null && implEntry.contains(method)) {
                return implEntry.get(method);
            }
        }

        // 没有预建别名 (例如实现方法不可拦截)：按签名定位后在实现类条目中查找
        Optional<ImplementationTarget> target = identityResolver.resolveImplementation(method, implementors);
        if (target.isEmpty()) {
            return null;
        }
        TypeDecisions implEntry = typeDecisions.get(target.get().getType());
        return implEntry != null ? implEntry.get(target.get().getMethod()) : null;
    }

    private InterceptionDecision resolveOnDemand(Method method, Class<?> owner) {
        if (!identityResolver.isEligible(method, owner)) {
            return null;
        }
        return decisionResolver.resolve(method, owner);
    }

    // ================= 查询 =================

    public boolean isRegistered(Class<?> type) {
        return typeDecisions.containsKey(type);
    }

    public Set<Class<?>> registeredTypes() {
        return Collections.unmodifiableSet(typeDecisions.keySet());
    }

    /**
     * @return 未注册返回 null
     */
    public TypeDecisions getTypeDecisions(Class<?> type) {
        return typeDecisions.get(type);
    }
}

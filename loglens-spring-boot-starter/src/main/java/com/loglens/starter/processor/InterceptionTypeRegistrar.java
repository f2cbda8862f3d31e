package com.loglens.starter.processor;

import com.loglens.core.cache.InterceptionDecisionCache;
import com.loglens.core.identity.MethodIdentityResolver;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 拦截类型注册器
 * <p>
 * 容器侧契约：在 Bean 初始化前 (AOP 代理创建之前) 把每个业务 Bean 的用户类注册到决策缓存，
 * 使调用期查找全部命中预计算结果。注册失败直接抛出，中止容器启动。
 */
@Slf4j
public class InterceptionTypeRegistrar implements BeanPostProcessor {

    /**
     * 内置排除的框架包前缀
     */
    private static final List<String> BUILTIN_EXCLUDED_PACKAGES = List.of(
            "java.", "javax.", "jakarta.", "jdk.", "sun.", "com.sun.",
            "org.springframework.", "org.slf4j.", "ch.qos.logback.", "com.loglens."
    );

    private final InterceptionDecisionCache decisionCache;
    private final List<String> basePackages;
    private final List<String> excludedPackages;
    private final Set<Class<?>> registered = ConcurrentHashMap.newKeySet();

    public InterceptionTypeRegistrar(InterceptionDecisionCache decisionCache,
                                     List<String> basePackages,
                                     List<String> excludedPackages) {
        this.decisionCache = decisionCache;
        this.basePackages = List.copyOf(basePackages);
        List<String> excluded = new ArrayList<>(BUILTIN_EXCLUDED_PACKAGES);
        excluded.addAll(excludedPackages);
        this.excludedPackages = List.copyOf(excluded);
        log.info("InterceptionTypeRegistrar initialized, basePackages={}, extra excludes={}",
                this.basePackages, excludedPackages);
    }

    @Override
    public Object postProcessBeforeInitialization(@NonNull Object bean, @NonNull String beanName) throws BeansException {
        Class<?> userClass = ClassUtils.getUserClass(bean);
        if (shouldRegister(userClass) && registered.add(userClass)) {
            log.debug("Registering bean '{}' ({}) for interception", beanName, userClass.getName());
            decisionCache.registerType(userClass);
        }
        return bean;
    }

    /**
     * 是否需要注册该类型
     */
    public boolean shouldRegister(Class<?> type) {
        if (!MethodIdentityResolver.isConcrete(type)
                || type.isSynthetic()
                || type.isAnonymousClass()
                || Proxy.isProxyClass(type)) {
            return false;
        }

        String name = type.getName();
        for (String prefix : excludedPackages) {
            if (name.startsWith(prefix)) {
                return false;
            }
        }
        if (basePackages.isEmpty()) {
            return true;
        }
        for (String prefix : basePackages) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public Set<Class<?>> getRegisteredTypes() {
        return Set.copyOf(registered);
    }
}

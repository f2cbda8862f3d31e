package com.loglens.core.cache;

import com.loglens.api.interception.InterceptionDecision;
import com.loglens.core.identity.MethodIdentity;

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 单个具体类型的决策表 (缓存条目)
 * <p>
 * 在注册线程中完整构建后一次性发布，发布后不可变。值为 null 表示显式"不拦截"。
 */
public final class TypeDecisions {

    private final Class<?> type;
    private final boolean typeDisabled;
    // 热路径：Method 的 hashCode/equals 不产生分配。包含接口方法别名
    private final Map<Method, InterceptionDecision> methodDecisions;
    private final Map<MethodIdentity, InterceptionDecision> identityDecisions;

    TypeDecisions(Class<?> type,
                  boolean typeDisabled,
                  Map<Method, InterceptionDecision> methodDecisions,
                  Map<MethodIdentity, InterceptionDecision> identityDecisions) {
        this.type = type;
        this.typeDisabled = typeDisabled;
        this.methodDecisions = Collections.unmodifiableMap(new HashMap<>(methodDecisions));
        this.identityDecisions = Collections.unmodifiableMap(new HashMap<>(identityDecisions));
    }

    /**
     * @return 不拦截或方法不属于该类型时返回 null
     */
    public InterceptionDecision get(Method method) {
        if (typeDisabled) {
            return null;
        }
        return methodDecisions.get(method);
    }

    public InterceptionDecision get(MethodIdentity identity) {
        if (typeDisabled) {
            return null;
        }
        return identityDecisions.get(identity);
    }

    public boolean contains(Method method) {
        return methodDecisions.containsKey(method);
    }

    public boolean contains(MethodIdentity identity) {
        return identityDecisions.containsKey(identity);
    }

    public Class<?> getType() {
        return type;
    }

    public boolean isTypeDisabled() {
        return typeDisabled;
    }

    public Set<MethodIdentity> identities() {
        return identityDecisions.keySet();
    }

    /**
     * 可拦截方法数量 (不含接口别名)
     */
    public int size() {
        return identityDecisions.size();
    }

    /**
     * 实际会被记录的方法数量
     */
    public long interceptedCount() {
        if (typeDisabled) {
            return 0;
        }
        return identityDecisions.values().stream().filter(Objects::nonNull).count();
    }

    @Override
    public String toString() {
        return "TypeDecisions{" + type.getName() + ", methods=" + size() + ", disabled=" + typeDisabled + "}";
    }
}

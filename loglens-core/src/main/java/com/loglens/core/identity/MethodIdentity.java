package com.loglens.core.identity;

import lombok.Value;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

/**
 * 方法标识：所属类型 + 方法名 + 参数类型列表
 * 参数类型参与比较，因此重载方法永远不会共用同一个标识。
 */
@Value
public class MethodIdentity {

    String typeName;

    String methodName;

    List<String> parameterTypeNames;

    /**
     * 以声明类作为所属类型
     */
    public static MethodIdentity of(Method method) {
        return of(method.getDeclaringClass(), method);
    }

    /**
     * 以指定类型作为所属类型 (例如继承来的方法归属到注册的具体类)
     */
    public static MethodIdentity of(Class<?> owningType, Method method) {
        Class<?>[] parameterTypes = method.getParameterTypes();
        List<String> names = new ArrayList<>(parameterTypes.length);
        for (Class<?> p : parameterTypes) {
            names.add(p.getTypeName());
        }
        return new MethodIdentity(owningType.getName(), method.getName(), List.copyOf(names));
    }

    @Override
    public String toString() {
        return typeName + "#" + methodName + "(" + String.join(", ", parameterTypeNames) + ")";
    }
}

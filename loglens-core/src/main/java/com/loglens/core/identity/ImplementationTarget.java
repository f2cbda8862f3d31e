package com.loglens.core.identity;

import lombok.Value;

import java.lang.reflect.Method;

/**
 * 接口方法在某个具体类型上的实现
 */
@Value
public class ImplementationTarget {

    Class<?> type;

    Method method;
}

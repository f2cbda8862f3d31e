package com.loglens.core.exception;

import com.loglens.api.exception.LogLensException;

/**
 * 类型注册异常
 * <p>
 * 注册了非具体类型，或类型元数据无法读取。属于组装错误，应中止启动而不是重试。
 */
public class TypeRegistrationException extends LogLensException {

    private final Class<?> type;

    public TypeRegistrationException(Class<?> type, String message) {
        super(message + ": " + type.getName());
        this.type = type;
    }

    public TypeRegistrationException(Class<?> type, String message, Throwable cause) {
        super(message + ": " + type.getName(), cause);
        this.type = type;
    }

    public Class<?> getType() {
        return type;
    }
}

package com.loglens.api.exception;

/**
 * LogLens 基础异常
 * 所有框架异常的父类，均为非受检异常。
 */
public class LogLensException extends RuntimeException {

    public LogLensException(String message) {
        super(message);
    }

    public LogLensException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.trafficlens.reporting.core.exception;

/**
 * 报表引擎异常基类
 * clientCorrectable 为 true 的异常由调用方修正请求后可重试，其余视为服务端故障
 */
public abstract class ReportingException extends RuntimeException {

    protected ReportingException(String message) {
        super(message);
    }

    protected ReportingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isClientCorrectable();
}

package com.trafficlens.reporting.core.exception;

/**
 * 底层数据库执行失败（含超时、取消）
 */
public class BackingStoreException extends ReportingException {

    public BackingStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public BackingStoreException(String message) {
        super(message);
    }

    @Override
    public boolean isClientCorrectable() {
        return false;
    }
}

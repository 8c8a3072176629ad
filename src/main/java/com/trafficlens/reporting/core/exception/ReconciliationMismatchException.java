package com.trafficlens.reporting.core.exception;

/**
 * 内部一致性检查失败，属于程序错误：请求整体失败，绝不吞掉
 */
public class ReconciliationMismatchException extends ReportingException {

    public ReconciliationMismatchException(String message) {
        super(message);
    }

    @Override
    public boolean isClientCorrectable() {
        return false;
    }
}

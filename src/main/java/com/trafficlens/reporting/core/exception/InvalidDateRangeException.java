package com.trafficlens.reporting.core.exception;

/**
 * 日期范围无效：结束早于开始，或无法解析，或保存视图缺少日期字段
 */
public class InvalidDateRangeException extends ReportingException {

    public InvalidDateRangeException(String message) {
        super(message);
    }

    public InvalidDateRangeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isClientCorrectable() {
        return true;
    }
}

package com.trafficlens.reporting.core.model;

public enum SortDirection {
    ASC, DESC;

    /**
     * 宽松解析，无法识别时回落到 DESC
     */
    public static SortDirection from(String value) {
        if (value != null && "ASC".equalsIgnoreCase(value.trim())) {
            return ASC;
        }
        return DESC;
    }
}

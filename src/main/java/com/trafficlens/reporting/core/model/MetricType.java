package com.trafficlens.reporting.core.model;

public enum MetricType {
    /** 直接对行求和 / 计数 */
    RAW,
    /** 聚合之后由原始指标重新计算，禁止跨行求和 */
    DERIVED
}

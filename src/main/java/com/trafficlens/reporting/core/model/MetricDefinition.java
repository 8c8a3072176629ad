package com.trafficlens.reporting.core.model;

/**
 * 指标定义
 * 原始指标携带 SQL 聚合表达式；派生指标只声明分子/分母（原始指标ID）和倍数
 */
public record MetricDefinition(
    String id,          // 指标ID，如 cost、approvalRate
    String alias,       // 结果列别名
    MetricType type,
    String expression,  // 原始指标的聚合表达式，如 SUM(m.clicks)
    String numerator,   // 派生指标分子
    String denominator, // 派生指标分母
    int scale,          // 派生指标倍数，如 cpm 为 1000
    int precision       // 派生指标保留小数位
) {

    public static MetricDefinition raw(String id, String alias, String expression) {
        return new MetricDefinition(id, alias, MetricType.RAW, expression, null, null, 1, 0);
    }

    public static MetricDefinition ratio(String id, String alias, String numerator, String denominator, int precision) {
        return new MetricDefinition(id, alias, MetricType.DERIVED, null, numerator, denominator, 1, precision);
    }

    public static MetricDefinition scaledRatio(String id, String alias, String numerator, String denominator,
                                               int scale, int precision) {
        return new MetricDefinition(id, alias, MetricType.DERIVED, null, numerator, denominator, scale, precision);
    }

    public boolean isDerived() {
        return type == MetricType.DERIVED;
    }
}

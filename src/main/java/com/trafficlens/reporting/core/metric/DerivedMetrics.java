package com.trafficlens.reporting.core.metric;

import com.trafficlens.reporting.core.model.MetricDefinition;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 派生指标计算
 * 除零约定只在这里定义一次：分母为 0（含 0/0）或结果非有限数时一律取 0。
 * SQL 侧用 COALESCE(... / NULLIF(den, 0), 0) 表达同一约定。
 */
public final class DerivedMetrics {

    public static final double ZERO_SENTINEL = 0d;

    private DerivedMetrics() {
    }

    public static double ratio(double numerator, double denominator) {
        if (denominator == 0d || !Double.isFinite(numerator) || !Double.isFinite(denominator)) {
            return ZERO_SENTINEL;
        }
        double value = numerator / denominator;
        return Double.isFinite(value) ? value : ZERO_SENTINEL;
    }

    /**
     * 由聚合后的原始指标计算单个派生指标
     */
    public static double compute(MetricDefinition def, Map<String, Number> raw) {
        double numerator = value(raw, def.numerator()) * def.scale();
        double denominator = value(raw, def.denominator());
        double result = ratio(numerator, denominator);
        return BigDecimal.valueOf(result).setScale(def.precision(), RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * 返回原始指标 + 重新计算的派生指标；输入中已有的派生值被覆盖，绝不沿用
     */
    public static Map<String, Number> recompute(Map<String, Number> raw, List<MetricDefinition> derived) {
        Map<String, Number> result = new LinkedHashMap<>(raw);
        for (MetricDefinition def : derived) {
            result.put(def.id(), compute(def, raw));
        }
        return result;
    }

    /**
     * 派生指标的 SQL 表达式，分子分母取原始指标的聚合表达式
     */
    public static String sqlExpression(MetricDefinition def, Map<String, MetricDefinition> rawById) {
        MetricDefinition numerator = rawById.get(def.numerator());
        MetricDefinition denominator = rawById.get(def.denominator());
        if (numerator == null || denominator == null) {
            throw new IllegalStateException("Derived metric " + def.id() + " references an unknown raw metric");
        }
        String scaled = def.scale() == 1 ? "" : " * " + def.scale();
        return "COALESCE(ROUND(CAST(" + numerator.expression() + " AS DECIMAL(20, 6))" + scaled
                + " / NULLIF(" + denominator.expression() + ", 0), " + def.precision() + "), 0)";
    }

    private static double value(Map<String, Number> raw, String id) {
        Number n = raw.get(id);
        return n == null ? 0d : n.doubleValue();
    }
}

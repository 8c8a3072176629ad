package com.trafficlens.reporting.core.reconcile;

import com.trafficlens.reporting.core.metric.DerivedMetrics;
import com.trafficlens.reporting.core.model.AggregateRow;
import com.trafficlens.reporting.core.model.MetricDefinition;
import com.trafficlens.reporting.core.tree.RowKey;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 广告花费与 CRM 聚合结果按维度取值合并
 * 全外连接：只有一侧有数据的取值照样输出，另一侧原始指标补 0；
 * 派生指标（含跨源的 realCpa）只在合并后由原始指标重新计算。
 * 合并键区分大小写，只有 network 维度（CRM 侧由来源映射得到网络名）忽略大小写。
 */
public final class CrossSourceReconciler {

    private CrossSourceReconciler() {
    }

    public static List<AggregateRow> merge(List<AggregateRow> adRows, List<AggregateRow> crmRows,
                                           List<MetricDefinition> adRaw, List<MetricDefinition> crmRaw,
                                           List<MetricDefinition> derived) {
        return merge(adRows, crmRows, adRaw, crmRaw, derived, false);
    }

    /**
     * @param adRows      广告侧行
     * @param crmRows     CRM 侧行
     * @param adRaw       广告侧原始指标
     * @param crmRaw      CRM 侧原始指标
     * @param derived     合并后需要计算的全部派生指标
     * @param ignoreCase  合并键是否忽略大小写
     */
    public static List<AggregateRow> merge(List<AggregateRow> adRows, List<AggregateRow> crmRows,
                                           List<MetricDefinition> adRaw, List<MetricDefinition> crmRaw,
                                           List<MetricDefinition> derived, boolean ignoreCase) {
        Map<String, Builder> merged = new LinkedHashMap<>();
        for (AggregateRow row : adRows) {
            merged.computeIfAbsent(joinKey(row.value(), ignoreCase), k -> new Builder(row.value()))
                    .add(row, adRaw);
        }
        for (AggregateRow row : crmRows) {
            merged.computeIfAbsent(joinKey(row.value(), ignoreCase), k -> new Builder(row.value()))
                    .add(row, crmRaw);
        }
        List<MetricDefinition> allRaw = new ArrayList<>(adRaw);
        allRaw.addAll(crmRaw);
        List<AggregateRow> result = new ArrayList<>(merged.size());
        for (Builder builder : merged.values()) {
            result.add(builder.build(allRaw, derived));
        }
        return result;
    }

    /**
     * 单源结果中规范化后取值相同的行（如 NULL 与空串都显示为 Unknown）合并为一行
     */
    public static List<AggregateRow> collapse(List<AggregateRow> rows, List<MetricDefinition> raw,
                                              List<MetricDefinition> derived) {
        Map<String, List<AggregateRow>> groups = new LinkedHashMap<>();
        for (AggregateRow row : rows) {
            groups.computeIfAbsent(RowKey.normalize(row.value()), k -> new ArrayList<>()).add(row);
        }
        if (groups.size() == rows.size()) {
            return rows;
        }
        List<AggregateRow> result = new ArrayList<>(groups.size());
        for (List<AggregateRow> group : groups.values()) {
            if (group.size() == 1) {
                result.add(group.get(0));
                continue;
            }
            Builder builder = new Builder(group.get(0).value());
            group.forEach(row -> builder.add(row, raw));
            result.add(builder.build(raw, derived));
        }
        return result;
    }

    /**
     * 只保留 keep 中出现过的取值（按合并键比较），顺序不变
     */
    public static List<AggregateRow> retainValues(List<AggregateRow> rows, List<AggregateRow> keep,
                                                  boolean ignoreCase) {
        Set<String> keys = new HashSet<>();
        keep.forEach(row -> keys.add(joinKey(row.value(), ignoreCase)));
        return rows.stream().filter(row -> keys.contains(joinKey(row.value(), ignoreCase))).toList();
    }

    /**
     * 合并键：规范化后的取值
     */
    static String joinKey(Object value, boolean ignoreCase) {
        String normalized = RowKey.normalize(value);
        return ignoreCase ? normalized.toLowerCase(Locale.ROOT) : normalized;
    }

    /**
     * 原始指标相加：整数相加保持整数，否则按 double
     */
    public static Number add(Number a, Number b) {
        if (a == null) {
            return b == null ? 0L : b;
        }
        if (b == null) {
            return a;
        }
        if (isIntegral(a) && isIntegral(b)) {
            return a.longValue() + b.longValue();
        }
        return a.doubleValue() + b.doubleValue();
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof BigInteger
                || (n instanceof BigDecimal d && d.scale() <= 0);
    }

    private static final class Builder {
        private final Object value;
        private String label;
        private final Map<String, Number> raw = new LinkedHashMap<>();

        Builder(Object value) {
            this.value = value;
        }

        void add(AggregateRow row, List<MetricDefinition> rawMetrics) {
            if (label == null && row.label() != null && !row.label().isBlank()) {
                label = row.label();
            }
            for (MetricDefinition def : rawMetrics) {
                raw.merge(def.id(), row.metrics().getOrDefault(def.id(), 0L), CrossSourceReconciler::add);
            }
        }

        AggregateRow build(List<MetricDefinition> allRaw, List<MetricDefinition> derived) {
            Map<String, Number> filled = new LinkedHashMap<>();
            for (MetricDefinition def : allRaw) {
                filled.put(def.id(), raw.getOrDefault(def.id(), 0L));
            }
            return new AggregateRow(value == null ? null : value.toString(), label,
                    DerivedMetrics.recompute(filled, derived));
        }
    }
}

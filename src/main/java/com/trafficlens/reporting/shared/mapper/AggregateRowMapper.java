package com.trafficlens.reporting.shared.mapper;

import com.trafficlens.reporting.core.eligibility.EligibilityRow;
import com.trafficlens.reporting.core.generator.AggregationQueryBuilder;
import com.trafficlens.reporting.core.model.AggregateRow;
import com.trafficlens.reporting.core.model.MetricDefinition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 查询结果行映射
 */
public class AggregateRowMapper {

    private AggregateRowMapper() {
    }

    /**
     * 聚合查询结果 -> AggregateRow，指标按别名取值并换回指标ID
     */
    public static List<AggregateRow> aggregateRows(List<Map<String, Object>> resultList,
                                                   List<MetricDefinition> metrics) {
        List<AggregateRow> rows = new ArrayList<>(resultList.size());
        for (Map<String, Object> row : resultList) {
            Object value = row.get(AggregationQueryBuilder.VALUE_COLUMN);
            Object label = row.get(AggregationQueryBuilder.LABEL_COLUMN);
            Map<String, Number> values = new LinkedHashMap<>();
            for (MetricDefinition def : metrics) {
                values.put(def.id(), metricValue(row.get(def.alias()), def.isDerived()));
            }
            rows.add(new AggregateRow(value == null ? null : value.toString(),
                    label == null ? null : label.toString(), values));
        }
        return rows;
    }

    /**
     * 计数类返回 Long，金额 / 比率返回 Double，NULL 按 0
     */
    static Number metricValue(Object raw, boolean derived) {
        if (raw == null) {
            return derived ? 0d : 0L;
        }
        if (!(raw instanceof Number number)) {
            return Double.parseDouble(raw.toString());
        }
        if (derived) {
            return number.doubleValue();
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short
                || number instanceof BigInteger) {
            return number.longValue();
        }
        if (number instanceof BigDecimal decimal && decimal.scale() <= 0) {
            return decimal.longValue();
        }
        return number.doubleValue();
    }

    /**
     * 扁平化 CRM 行 -> 资格判定输入
     */
    public static EligibilityRow eligibilityRow(Map<String, Object> row) {
        return new EligibilityRow(
                toLong(row.get("subscription_id")),
                toInteger(row.get("subscription_deleted")),
                toLong(row.get("invoice_id")),
                toInteger(row.get("invoice_type")),
                toInteger(row.get("invoice_deleted")),
                toText(row.get("invoice_tag")),
                toText(row.get("campaign_tracking_id")),
                toText(row.get("adset_tracking_id")),
                toText(row.get("ad_tracking_id")),
                toText(row.get("source"))
        );
    }

    private static Long toLong(Object value) {
        return value instanceof Number n ? Long.valueOf(n.longValue()) : null;
    }

    private static Integer toInteger(Object value) {
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        return value instanceof Number n ? Integer.valueOf(n.intValue()) : null;
    }

    private static String toText(Object value) {
        return value == null ? null : value.toString();
    }
}

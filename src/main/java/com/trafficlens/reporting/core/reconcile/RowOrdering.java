package com.trafficlens.reporting.core.reconcile;

import com.trafficlens.reporting.core.model.AggregateRow;
import com.trafficlens.reporting.core.model.SortDirection;
import com.trafficlens.reporting.core.tree.RowKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Java 侧排序，与 SQL 排序规则一致：时间维度按取值倒序，否则按指标，取值作次级排序
 */
public final class RowOrdering {

    private RowOrdering() {
    }

    public static List<AggregateRow> sort(List<AggregateRow> rows, boolean temporal, String metricId,
                                          SortDirection direction) {
        Comparator<AggregateRow> byValue = Comparator.comparing(row -> RowKey.normalize(row.value()));
        Comparator<AggregateRow> comparator;
        if (temporal) {
            comparator = byValue.reversed();
        } else {
            Comparator<AggregateRow> byMetric = Comparator.comparingDouble(row -> metric(row, metricId));
            if (direction != SortDirection.ASC) {
                byMetric = byMetric.reversed();
            }
            comparator = byMetric.thenComparing(byValue);
        }
        List<AggregateRow> sorted = new ArrayList<>(rows);
        sorted.sort(comparator);
        return sorted;
    }

    private static double metric(AggregateRow row, String metricId) {
        Number value = row.metrics().get(metricId);
        return value == null ? 0d : value.doubleValue();
    }
}

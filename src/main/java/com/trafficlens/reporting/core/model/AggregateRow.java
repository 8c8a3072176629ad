package com.trafficlens.reporting.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个数据源一条分组结果：分组值、展示名和指标
 */
public record AggregateRow(String value, String label, Map<String, Number> metrics) {

    public AggregateRow {
        metrics = metrics == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public String displayLabel() {
        return label != null && !label.isBlank() ? label : value;
    }
}

package com.trafficlens.reporting.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单层下钻查询参数
 */
public record QueryOptions(
    ReportFamily family,
    DateRange dateRange,
    List<String> dimensions,         // 维度路径，如 [network, campaign, adset]
    int depth,                       // 当前层（0 起）
    Map<String, String> parentFilters, // 祖先维度ID -> 取值，保持插入顺序
    List<TableFilter> filters,
    String sortBy,
    SortDirection sortDirection,
    Integer limit
) {

    public QueryOptions {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        parentFilters = parentFilters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parentFilters));
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public static QueryOptions of(ReportFamily family, DateRange dateRange, List<String> dimensions, int depth) {
        return new QueryOptions(family, dateRange, dimensions, depth, null, null, null, null, null);
    }

    public QueryOptions withFamily(ReportFamily other) {
        return new QueryOptions(other, dateRange, dimensions, depth, parentFilters, filters, sortBy, sortDirection, limit);
    }

    public QueryOptions withParentFilters(Map<String, String> other) {
        return new QueryOptions(family, dateRange, dimensions, other == null ? 0 : depth, other, filters, sortBy,
                sortDirection, limit);
    }

    public QueryOptions atDepth(int newDepth, Map<String, String> newParentFilters) {
        return new QueryOptions(family, dateRange, dimensions, newDepth, newParentFilters, filters, sortBy,
                sortDirection, limit);
    }

    public QueryOptions withSort(String newSortBy, SortDirection newDirection) {
        return new QueryOptions(family, dateRange, dimensions, depth, parentFilters, filters, newSortBy, newDirection,
                limit);
    }

    public QueryOptions withLimit(Integer newLimit) {
        return new QueryOptions(family, dateRange, dimensions, depth, parentFilters, filters, sortBy, sortDirection,
                newLimit);
    }

    public String currentDimension() {
        return depth >= 0 && depth < dimensions.size() ? dimensions.get(depth) : null;
    }
}

package com.trafficlens.reporting.api.dto;

import com.trafficlens.reporting.core.date.DatePreset;
import com.trafficlens.reporting.core.model.ReportType;
import com.trafficlens.reporting.core.model.TableFilter;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;
import java.util.Map;

/**
 * 报表查询请求
 * 日期二选一：start/end（ISO 日期，均包含）或 datePreset
 */
@RegisterForReflection
public record ReportQueryRequest(
    ReportType reportType,
    List<String> dimensions,
    Integer depth,
    String start,
    String end,
    DatePreset datePreset,
    Map<String, String> parentFilters,
    List<TableFilter> filters,
    String sortBy,
    String sortDirection,
    Integer limit,
    List<String> expandedKeys // 仅 /tree 使用
) {
}

package com.trafficlens.reporting.core.date;

import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.ReportType;
import com.trafficlens.reporting.core.model.SortDirection;
import com.trafficlens.reporting.core.model.TableFilter;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 视图解析结果：可直接作为报表查询参数
 */
@RegisterForReflection
public record ResolvedViewParams(
    ReportType reportType,
    DateRange dateRange,
    List<String> dimensions,
    List<TableFilter> filters,
    String sortBy,
    SortDirection sortDirection
) {
}

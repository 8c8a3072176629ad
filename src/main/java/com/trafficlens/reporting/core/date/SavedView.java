package com.trafficlens.reporting.core.date;

import com.trafficlens.reporting.core.model.ReportType;
import com.trafficlens.reporting.core.model.SortDirection;
import com.trafficlens.reporting.core.model.TableFilter;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * 保存的视图：日期、维度、过滤和排序的组合，使用时重新解析
 */
@RegisterForReflection
public record SavedView(
    Long id,
    String name,
    ReportType reportType,
    DateMode dateMode,
    DatePreset datePreset,   // dateMode = relative 时必填
    LocalDate dateStart,     // dateMode = absolute 时必填
    LocalDate dateEnd,
    List<String> dimensions,
    List<TableFilter> filters,
    String sortBy,
    SortDirection sortDirection,
    String ownerId,
    Instant createdAt
) {

    public SavedView {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public SavedView withIdentity(Long newId, String owner, Instant created) {
        return new SavedView(newId, name, reportType, dateMode, datePreset, dateStart, dateEnd, dimensions, filters,
                sortBy, sortDirection, owner, created);
    }
}

package com.trafficlens.reporting.core.engine;

import com.trafficlens.reporting.core.date.DateMode;
import com.trafficlens.reporting.core.date.DateRangeResolver;
import com.trafficlens.reporting.core.date.ResolvedViewParams;
import com.trafficlens.reporting.core.date.SavedView;
import com.trafficlens.reporting.core.exception.InvalidDateRangeException;
import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.ReportType;
import com.trafficlens.reporting.core.model.TableFilter;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import com.trafficlens.reporting.infra.persistence.SavedViewRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

/**
 * 保存视图：保存前校验，使用时按当天解析日期
 */
@ApplicationScoped
public class SavedViewService {

    @Inject
    SavedViewRepository repository;

    @Inject
    DateRangeResolver resolver;

    @Inject
    DimensionRegistry dimensionRegistry;

    public SavedView create(SavedView view, String ownerId) {
        validate(view);
        return repository.save(view, ownerId);
    }

    public List<SavedView> list(String ownerId, ReportType reportType) {
        return repository.listByReport(ownerId, reportType);
    }

    public Optional<SavedView> find(long id, String ownerId) {
        return repository.findById(id, ownerId);
    }

    public Optional<ResolvedViewParams> resolve(long id, String ownerId) {
        return repository.findById(id, ownerId).map(resolver::resolveView);
    }

    /**
     * 相对视图只校验预设存在，不在保存时计算日期
     */
    void validate(SavedView view) {
        if (view.name() == null || view.name().isBlank()) {
            throw new IllegalArgumentException("Saved view name is required");
        }
        if (view.reportType() == null) {
            throw new IllegalArgumentException("Saved view report type is required");
        }
        DateMode mode = view.dateMode() == null ? DateMode.NONE : view.dateMode();
        if (mode == DateMode.RELATIVE && view.datePreset() == null) {
            throw new InvalidDateRangeException("Relative saved view requires a date preset");
        }
        if (mode == DateMode.ABSOLUTE) {
            DateRange.of(view.dateStart(), view.dateEnd());
        }
        dimensionRegistry.resolveAll(view.reportType().primary(), view.dimensions());
        for (TableFilter filter : view.filters()) {
            dimensionRegistry.resolve(view.reportType().primary(), filter.field());
        }
    }
}

package com.trafficlens.reporting.core.generator;

import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import com.trafficlens.reporting.core.registry.MetricRegistry;

/**
 * 页面浏览行为（PostgreSQL 页面浏览明细）
 */
public class OnPageQueryBuilder extends AggregationQueryBuilder {

    public OnPageQueryBuilder(DimensionRegistry dimensions, MetricRegistry metrics, QueryLimits limits) {
        super(ReportFamily.ON_PAGE, dimensions, metrics, limits);
    }

    @Override
    protected String fromClause() {
        return "FROM remote_session_tracker.event_page_view_enriched_v2 pv";
    }

    @Override
    protected void appendDateRange(DateRange range, WhereClause where) {
        // 半开区间，end 当天全部包含
        where.add("pv.created_at >= ? AND pv.created_at < ?",
                range.start().atStartOfDay(), range.end().plusDays(1).atStartOfDay());
    }
}

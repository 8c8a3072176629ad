package com.trafficlens.reporting.core.generator;

import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import com.trafficlens.reporting.core.registry.MetricRegistry;

/**
 * 会话入口（每个会话一行）
 */
public class SessionQueryBuilder extends AggregationQueryBuilder {

    public SessionQueryBuilder(DimensionRegistry dimensions, MetricRegistry metrics, QueryLimits limits) {
        super(ReportFamily.SESSION, dimensions, metrics, limits);
    }

    @Override
    protected String fromClause() {
        return "FROM remote_session_tracker.session_entries se";
    }

    @Override
    protected void appendDateRange(DateRange range, WhereClause where) {
        where.add("se.session_start >= ? AND se.session_start < ?",
                range.start().atStartOfDay(), range.end().plusDays(1).atStartOfDay());
    }
}

package com.trafficlens.reporting.core.generator;

import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import com.trafficlens.reporting.core.registry.MetricRegistry;

/**
 * 广告花费（PostgreSQL merged_ads_spending）
 */
public class AdsQueryBuilder extends AggregationQueryBuilder {

    public AdsQueryBuilder(DimensionRegistry dimensions, MetricRegistry metrics, QueryLimits limits) {
        super(ReportFamily.ADVERTISING, dimensions, metrics, limits);
    }

    @Override
    protected String fromClause() {
        return "FROM merged_ads_spending m";
    }

    @Override
    protected void appendDateRange(DateRange range, WhereClause where) {
        where.add("m.date BETWEEN ? AND ?", range.start(), range.end());
    }
}

package com.trafficlens.reporting.core.generator;

import com.trafficlens.reporting.common.config.ReportingConfig;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import com.trafficlens.reporting.core.registry.MetricRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 按报表族提供 SQL 生成器，生成器无状态，启动时创建一次
 */
@ApplicationScoped
public class QueryBuilderFactory {

    @Inject
    DimensionRegistry dimensionRegistry;

    @Inject
    MetricRegistry metricRegistry;

    @Inject
    ReportingConfig config;

    private Map<ReportFamily, AggregationQueryBuilder> builders;

    @PostConstruct
    void init() {
        QueryLimits limits = new QueryLimits(config.getDefaultLimit(), config.getMaxLimit());
        Map<ReportFamily, AggregationQueryBuilder> map = new EnumMap<>(ReportFamily.class);
        map.put(ReportFamily.ADVERTISING, new AdsQueryBuilder(dimensionRegistry, metricRegistry, limits));
        map.put(ReportFamily.CRM_GEOGRAPHY,
                new CrmQueryBuilder(ReportFamily.CRM_GEOGRAPHY, dimensionRegistry, metricRegistry, limits));
        map.put(ReportFamily.CRM_TRACKING,
                new CrmQueryBuilder(ReportFamily.CRM_TRACKING, dimensionRegistry, metricRegistry, limits));
        map.put(ReportFamily.ON_PAGE, new OnPageQueryBuilder(dimensionRegistry, metricRegistry, limits));
        map.put(ReportFamily.SESSION, new SessionQueryBuilder(dimensionRegistry, metricRegistry, limits));
        builders = Collections.unmodifiableMap(map);
    }

    public AggregationQueryBuilder forFamily(ReportFamily family) {
        return builders.get(family);
    }

    public CrmQueryBuilder crm(ReportFamily family) {
        return (CrmQueryBuilder) builders.get(family);
    }
}

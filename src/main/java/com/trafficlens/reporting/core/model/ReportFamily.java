package com.trafficlens.reporting.core.model;

/**
 * 报表族：每个族有独立的维度映射和指标目录
 */
public enum ReportFamily {
    ADVERTISING(DataSourceKind.ADS),
    CRM_GEOGRAPHY(DataSourceKind.CRM),
    CRM_TRACKING(DataSourceKind.CRM),
    ON_PAGE(DataSourceKind.ADS),
    SESSION(DataSourceKind.ADS);

    private final DataSourceKind dataSource;

    ReportFamily(DataSourceKind dataSource) {
        this.dataSource = dataSource;
    }

    public DataSourceKind dataSource() {
        return dataSource;
    }
}

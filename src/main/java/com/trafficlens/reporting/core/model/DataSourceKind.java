package com.trafficlens.reporting.core.model;

/**
 * 后端数据源
 */
public enum DataSourceKind {
    /** PostgreSQL: merged_ads_spending, page view / session tracker, saved views */
    ADS("ads"),
    /** MariaDB: subscription / invoice / customer */
    CRM("crm");

    private final String dataSourceName;

    DataSourceKind(String dataSourceName) {
        this.dataSourceName = dataSourceName;
    }

    public String dataSourceName() {
        return dataSourceName;
    }
}

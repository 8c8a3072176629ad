package com.trafficlens.reporting.core.model;

import java.util.Optional;

/**
 * 对外报表：MARKETING 需要广告与 CRM 两个族合并，其余为单源
 */
public enum ReportType {
    MARKETING(ReportFamily.ADVERTISING, ReportFamily.CRM_TRACKING),
    DASHBOARD(ReportFamily.CRM_GEOGRAPHY, null),
    ON_PAGE(ReportFamily.ON_PAGE, null),
    SESSIONS(ReportFamily.SESSION, null);

    private final ReportFamily primary;
    private final ReportFamily secondary;

    ReportType(ReportFamily primary, ReportFamily secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    public ReportFamily primary() {
        return primary;
    }

    public Optional<ReportFamily> secondary() {
        return Optional.ofNullable(secondary);
    }

    public boolean isReconciled() {
        return secondary != null;
    }
}

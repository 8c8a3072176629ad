package com.trafficlens.reporting.core.exception;

import com.trafficlens.reporting.core.model.ReportFamily;

/**
 * 维度ID在当前报表族的注册表中不存在
 */
public class UnknownDimensionException extends ReportingException {

    private final ReportFamily family;
    private final String dimensionId;

    public UnknownDimensionException(ReportFamily family, String dimensionId) {
        super(String.format("Unknown dimension '%s' for report family %s", dimensionId, family));
        this.family = family;
        this.dimensionId = dimensionId;
    }

    public ReportFamily getFamily() {
        return family;
    }

    public String getDimensionId() {
        return dimensionId;
    }

    @Override
    public boolean isClientCorrectable() {
        return true;
    }
}

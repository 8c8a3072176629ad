package com.trafficlens.reporting.core.generator;

/**
 * 返回行数上限：调用方的 limit 只作为建议值，总被收敛到 [1, maxLimit]
 */
public record QueryLimits(int defaultLimit, int maxLimit) {

    public static final QueryLimits DEFAULT = new QueryLimits(1000, 10000);

    public int clamp(Integer requested) {
        int value = requested == null ? defaultLimit : requested;
        return Math.max(1, Math.min(maxLimit, value));
    }
}

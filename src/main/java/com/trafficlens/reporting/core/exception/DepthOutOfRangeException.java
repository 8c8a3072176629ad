package com.trafficlens.reporting.core.exception;

public class DepthOutOfRangeException extends ReportingException {

    private final int depth;
    private final int dimensionCount;

    public DepthOutOfRangeException(int depth, int dimensionCount) {
        super(String.format("Depth %d is out of range, must be 0 to %d", depth, dimensionCount - 1));
        this.depth = depth;
        this.dimensionCount = dimensionCount;
    }

    public DepthOutOfRangeException(int depth, int dimensionCount, String message) {
        super(message);
        this.depth = depth;
        this.dimensionCount = dimensionCount;
    }

    public int getDepth() {
        return depth;
    }

    public int getDimensionCount() {
        return dimensionCount;
    }

    @Override
    public boolean isClientCorrectable() {
        return true;
    }
}

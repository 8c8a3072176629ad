package com.trafficlens.reporting.core.metric;

import com.trafficlens.reporting.core.model.MetricDefinition;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DerivedMetrics 单元测试
 */
class DerivedMetricsTest {

    private static final MetricDefinition CPM = MetricDefinition.scaledRatio("cpm", "cpm", "cost", "impressions", 1000, 2);
    private static final MetricDefinition CTR = MetricDefinition.ratio("ctr", "ctr", "clicks", "impressions", 4);

    @Test
    void testZeroDenominator() {
        assertEquals(0d, DerivedMetrics.ratio(0, 0));
        assertEquals(0d, DerivedMetrics.ratio(5, 0));
        assertEquals(0d, DerivedMetrics.ratio(Double.NaN, 2));
        assertEquals(0d, DerivedMetrics.ratio(Double.MAX_VALUE, Double.MIN_VALUE));
        assertEquals(2.5d, DerivedMetrics.ratio(5, 2));
    }

    @Test
    void testComputeScalesAndRounds() {
        Map<String, Number> raw = Map.of("cost", 12.5, "impressions", 3000L, "clicks", 7L);
        assertEquals(4.17d, DerivedMetrics.compute(CPM, raw));
        assertEquals(0.0023d, DerivedMetrics.compute(CTR, raw));
        assertEquals(0d, DerivedMetrics.compute(CTR, Map.of("clicks", 7L)));
    }

    @Test
    void testRecomputeOverwritesStaleDerived() {
        Map<String, Number> raw = new LinkedHashMap<>();
        raw.put("clicks", 1L);
        raw.put("impressions", 4L);
        raw.put("ctr", 99d);

        Map<String, Number> result = DerivedMetrics.recompute(raw, List.of(CTR));

        assertEquals(0.25d, result.get("ctr"));
        assertEquals(99d, raw.get("ctr"));
    }

    @Test
    void testSqlExpression() {
        Map<String, MetricDefinition> rawById = Map.of(
                "cost", MetricDefinition.raw("cost", "cost", "SUM(m.cost)"),
                "impressions", MetricDefinition.raw("impressions", "impressions", "SUM(m.impressions)"));

        assertEquals("COALESCE(ROUND(CAST(SUM(m.cost) AS DECIMAL(20, 6)) * 1000 / NULLIF(SUM(m.impressions), 0), 2), 0)",
                DerivedMetrics.sqlExpression(CPM, rawById));
        assertThrows(IllegalStateException.class, () -> DerivedMetrics.sqlExpression(CTR, rawById));
    }
}

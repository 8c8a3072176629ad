package com.trafficlens.reporting.core.generator;

import com.trafficlens.reporting.core.exception.InvalidDateRangeException;
import com.trafficlens.reporting.core.exception.UnknownDimensionException;
import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.QueryOptions;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.core.model.SortDirection;
import com.trafficlens.reporting.core.model.SqlRequest;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import com.trafficlens.reporting.core.registry.MetricRegistry;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AdsQueryBuilder 单元测试
 */
class AdsQueryBuilderTest {

    private static final DateRange RANGE = DateRange.of(LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 7));
    private static final List<String> PATH = List.of("network", "campaign", "adset", "ad");

    private final AdsQueryBuilder builder = new AdsQueryBuilder(new DimensionRegistry(), new MetricRegistry(),
            QueryLimits.DEFAULT);

    @Test
    void testRootLevelQuery() {
        SqlRequest request = builder.buildQuery(QueryOptions.of(ReportFamily.ADVERTISING, RANGE, PATH, 0));
        String sql = request.sql();

        assertTrue(sql.startsWith("SELECT\n  m.network AS dimension_value"));
        assertTrue(sql.contains("FROM merged_ads_spending m"));
        assertTrue(sql.contains("WHERE m.date BETWEEN ? AND ?"));
        assertTrue(sql.contains("SUM(m.cost) AS cost"));
        assertTrue(sql.contains("GROUP BY m.network"));
        assertTrue(sql.contains("ORDER BY cost DESC, dimension_value ASC"));
        assertTrue(sql.endsWith("LIMIT ?"));
        assertFalse(sql.contains("dimension_label"));
        assertEquals(List.of(RANGE.start(), RANGE.end(), 1000), request.params());
    }

    @Test
    void testUnboundedQueryHasNoLimit() {
        SqlRequest request = builder.buildQuery(QueryOptions.of(ReportFamily.ADVERTISING, RANGE, PATH, 0), false);
        assertFalse(request.sql().contains("LIMIT"));
        assertTrue(request.sql().endsWith("ORDER BY cost DESC, dimension_value ASC"));
        assertEquals(List.of(RANGE.start(), RANGE.end()), request.params());
    }

    @Test
    void testCampaignLevelGroupsByIdWithNameLabel() {
        QueryOptions options = QueryOptions.of(ReportFamily.ADVERTISING, RANGE, PATH, 1)
                .atDepth(1, Map.of("network", "Google Ads"));
        SqlRequest request = builder.buildQuery(options);

        assertTrue(request.sql().contains("m.campaign_id AS dimension_value"));
        assertTrue(request.sql().contains("MAX(m.campaign_name) AS dimension_label"));
        assertTrue(request.sql().contains("AND m.network = ?"));
        assertTrue(request.sql().contains("GROUP BY m.campaign_id"));
        assertEquals(List.of(RANGE.start(), RANGE.end(), "Google Ads", 1000), request.params());
    }

    @Test
    void testUnknownParentBecomesNullCondition() {
        QueryOptions options = QueryOptions.of(ReportFamily.ADVERTISING, RANGE, PATH, 1)
                .atDepth(1, Map.of("network", "Unknown"));
        SqlRequest request = builder.buildQuery(options);

        assertTrue(request.sql().contains("AND m.network IS NULL"));
        assertEquals(3, request.params().size());
    }

    @Test
    void testDerivedMetricsRecomputedInSql() {
        String sql = builder.buildQuery(QueryOptions.of(ReportFamily.ADVERTISING, RANGE, PATH, 0)).sql();

        assertTrue(sql.contains(
                "COALESCE(ROUND(CAST(SUM(m.clicks) AS DECIMAL(20, 6)) / NULLIF(SUM(m.impressions), 0), 4), 0) AS ctr"));
        assertTrue(sql.contains(
                "COALESCE(ROUND(CAST(SUM(m.cost) AS DECIMAL(20, 6)) * 1000 / NULLIF(SUM(m.impressions), 0), 2), 0) AS cpm"));
    }

    @Test
    void testSortAndLimit() {
        QueryOptions base = QueryOptions.of(ReportFamily.ADVERTISING, RANGE, PATH, 0);

        assertTrue(builder.buildQuery(base.withSort("clicks", SortDirection.ASC)).sql()
                .contains("ORDER BY clicks ASC, dimension_value ASC"));
        // 未注册的排序指标回退到默认指标
        assertTrue(builder.buildQuery(base.withSort("bogus", SortDirection.ASC)).sql()
                .contains("ORDER BY cost ASC, dimension_value ASC"));

        assertEquals(10000, last(builder.buildQuery(base.withLimit(50000))));
        assertEquals(1, last(builder.buildQuery(base.withLimit(0))));
        assertEquals(1, last(builder.buildQuery(base.withLimit(-5))));
        assertEquals(25, last(builder.buildQuery(base.withLimit(25))));
    }

    @Test
    void testTemporalDimensionAlwaysNewestFirst() {
        QueryOptions options = QueryOptions.of(ReportFamily.ADVERTISING, RANGE, List.of("date", "network"), 0)
                .withSort("clicks", SortDirection.ASC);
        String sql = builder.buildQuery(options).sql();
        assertTrue(sql.contains("ORDER BY dimension_value DESC"));
        assertFalse(sql.contains("clicks ASC"));
    }

    @Test
    void testRejectsUnknownDimensionsAndMissingRange() {
        assertThrows(UnknownDimensionException.class, () -> builder.buildQuery(
                QueryOptions.of(ReportFamily.ADVERTISING, RANGE, List.of("network", "country"), 0)));
        assertThrows(UnknownDimensionException.class, () -> builder.buildQuery(
                QueryOptions.of(ReportFamily.ADVERTISING, RANGE, PATH, 1).atDepth(1, Map.of("productGroup", "x"))));
        assertThrows(InvalidDateRangeException.class, () -> builder.buildQuery(
                QueryOptions.of(ReportFamily.ADVERTISING, null, PATH, 0)));
    }

    private static Object last(SqlRequest request) {
        return request.params().get(request.params().size() - 1);
    }
}

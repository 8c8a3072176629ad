package com.trafficlens.reporting.core.generator;

import com.trafficlens.reporting.core.exception.InvalidDateRangeException;
import com.trafficlens.reporting.core.exception.UnknownDimensionException;
import com.trafficlens.reporting.core.model.FilterOperator;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.core.model.TableFilter;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FilterBuilder 单元测试
 */
class FilterBuilderTest {

    private final FilterBuilder pageFilters = new FilterBuilder(new DimensionRegistry(), ReportFamily.ON_PAGE);

    @Test
    void testEachOperator() {
        WhereClause where = new WhereClause();
        pageFilters.appendTableFilters(List.of(
                new TableFilter("utmSource", FilterOperator.EQUALS, "google"),
                new TableFilter("utmSource", FilterOperator.NOT_EQUALS, "bing"),
                new TableFilter("urlPath", FilterOperator.CONTAINS, "Landing"),
                new TableFilter("urlPath", FilterOperator.NOT_CONTAINS, "test")), where);

        assertEquals("WHERE pv.utm_source = ?\n"
                + "  AND (pv.utm_source IS NULL OR pv.utm_source <> ?)\n"
                + "  AND LOWER(CAST(pv.url_path AS TEXT)) LIKE ?\n"
                + "  AND (pv.url_path IS NULL OR LOWER(CAST(pv.url_path AS TEXT)) NOT LIKE ?)", where.toSql());
        assertEquals(List.of("google", "bing", "%landing%", "%test%"), where.params());
    }

    @Test
    void testUnknownValueMapsToNullCondition() {
        WhereClause where = new WhereClause();
        pageFilters.appendTableFilters(List.of(
                new TableFilter("utmSource", FilterOperator.EQUALS, "Unknown"),
                new TableFilter("pageType", FilterOperator.NOT_EQUALS, "Unknown")), where);

        assertEquals("WHERE pv.utm_source IS NULL\n  AND NOT (pv.page_type IS NULL)", where.toSql());
        assertTrue(where.params().isEmpty());
    }

    @Test
    void testTemporalValuesBindAsDates() {
        WhereClause where = new WhereClause();
        pageFilters.appendParentFilters(Map.of("date", "2026-02-03"), where);
        assertEquals(List.of(LocalDate.of(2026, 2, 3)), where.params());

        assertThrows(InvalidDateRangeException.class,
                () -> pageFilters.appendParentFilters(Map.of("date", "03/02/2026"), new WhereClause()));
    }

    @Test
    void testRejectsUnregisteredFieldAndMissingOperator() {
        assertThrows(UnknownDimensionException.class, () -> pageFilters.appendTableFilters(
                List.of(new TableFilter("pv.url_path; --", FilterOperator.EQUALS, "x")), new WhereClause()));
        assertThrows(IllegalArgumentException.class, () -> pageFilters.appendTableFilters(
                List.of(new TableFilter("urlPath", null, "x")), new WhereClause()));
    }

    @Test
    void testLikePatternEscapesWildcards() {
        assertEquals("%50\\%\\_off\\\\x%", FilterBuilder.likePattern("50%_OFF\\x"));
    }
}

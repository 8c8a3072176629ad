package com.trafficlens.reporting.shared.mapper;

import com.trafficlens.reporting.core.eligibility.EligibilityRow;
import com.trafficlens.reporting.core.model.AggregateRow;
import com.trafficlens.reporting.core.model.MetricDefinition;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AggregateRowMapperTest {

    @Test
    void testAggregateRowsMapsAliasesToIds() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("dimension_value", 42);
        raw.put("dimension_label", "Spring Sale");
        raw.put("subscription_count", new BigDecimal("7"));
        raw.put("approval_rate", new BigDecimal("0.4286"));

        List<AggregateRow> rows = AggregateRowMapper.aggregateRows(List.of(raw), List.of(
                MetricDefinition.raw("subscriptions", "subscription_count", "COUNT(DISTINCT s.id)"),
                MetricDefinition.raw("customers", "customer_count", "COUNT(*)"),
                MetricDefinition.ratio("approvalRate", "approval_rate", "trialsApproved", "subscriptions", 4)));

        AggregateRow row = rows.get(0);
        assertEquals("42", row.value());
        assertEquals("Spring Sale", row.displayLabel());
        assertEquals(7L, row.metrics().get("subscriptions"));
        assertEquals(0L, row.metrics().get("customers"));
        assertEquals(0.4286d, row.metrics().get("approvalRate"));
    }

    @Test
    void testMetricValueTypes() {
        assertEquals(3L, AggregateRowMapper.metricValue(3, false));
        assertEquals(12.5d, AggregateRowMapper.metricValue(new BigDecimal("12.50"), false));
        assertEquals(2d, AggregateRowMapper.metricValue(2L, true));
        assertEquals(0d, AggregateRowMapper.metricValue(null, true));
    }

    @Test
    void testEligibilityRow() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("subscription_id", 5L);
        raw.put("subscription_deleted", Boolean.FALSE);
        raw.put("invoice_id", 9);
        raw.put("invoice_tag", null);

        EligibilityRow row = AggregateRowMapper.eligibilityRow(raw);

        assertEquals(5L, row.subscriptionId());
        assertEquals(0, row.subscriptionDeleted());
        assertEquals(9L, row.invoiceId());
        assertNull(row.invoiceDeleted());
        assertNull(row.source());
    }
}

package com.trafficlens.reporting.core.engine;

import com.trafficlens.reporting.core.eligibility.EligibilityFilter;
import com.trafficlens.reporting.core.eligibility.EligibilityRow;
import com.trafficlens.reporting.core.eligibility.EligibilityRule;
import com.trafficlens.reporting.core.exception.ReconciliationMismatchException;
import com.trafficlens.reporting.core.generator.CrmQueryBuilder;
import com.trafficlens.reporting.core.generator.QueryBuilderFactory;
import com.trafficlens.reporting.core.model.DataSourceKind;
import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.infra.persistence.JdbcQueryExecutor;
import com.trafficlens.reporting.shared.mapper.AggregateRowMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 订单资格一致性检查
 * 用 Java 判定对扁平化行重新计数，与 SQL 聚合的计数比较；两者不一致说明规则出现了分叉。
 */
@ApplicationScoped
public class CrmConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(CrmConsistencyChecker.class);

    @Inject
    QueryBuilderFactory builders;

    @Inject
    JdbcQueryExecutor executor;

    public ConsistencyReport check(DateRange range) {
        CrmQueryBuilder geography = builders.crm(ReportFamily.CRM_GEOGRAPHY);
        CrmQueryBuilder tracking = builders.crm(ReportFamily.CRM_TRACKING);

        List<EligibilityRow> rows = executor.execute(DataSourceKind.CRM, geography.buildEligibilityRowsQuery(range))
                .stream()
                .map(AggregateRowMapper::eligibilityRow)
                .toList();
        long sqlBaseline = count(executor.execute(DataSourceKind.CRM, geography.buildEligibleTotalQuery(range)));
        long sqlAttribution = count(executor.execute(DataSourceKind.CRM, tracking.buildEligibleTotalQuery(range)));

        Set<Long> baseline = new HashSet<>();
        Set<Long> attribution = new HashSet<>();
        Map<EligibilityRule, Long> exclusions = new EnumMap<>(EligibilityRule.class);
        for (EligibilityRow row : rows) {
            if (EligibilityFilter.isEligibleForBaseline(row)) {
                baseline.add(row.subscriptionId());
            }
            if (EligibilityFilter.isEligibleForAttribution(row)) {
                attribution.add(row.subscriptionId());
            } else {
                exclusions.merge(EligibilityFilter.ineligibilityReasons(row).get(0), 1L, Long::sum);
            }
        }

        if (!baseline.containsAll(attribution)) {
            throw mismatch("attribution-eligible subscriptions are not a subset of baseline-eligible ones", range);
        }
        if (baseline.size() != sqlBaseline) {
            throw mismatch(String.format("baseline count differs: java=%d, sql=%d", baseline.size(), sqlBaseline),
                    range);
        }
        if (attribution.size() != sqlAttribution) {
            throw mismatch(String.format("attribution count differs: java=%d, sql=%d", attribution.size(),
                    sqlAttribution), range);
        }
        log.info("[Consistency] range={}..{}, rows={}, baseline={}, attribution={}", range.start(), range.end(),
                rows.size(), baseline.size(), attribution.size());
        return new ConsistencyReport(range, rows.size(), baseline.size(), attribution.size(),
                Collections.unmodifiableMap(exclusions));
    }

    private static long count(List<Map<String, Object>> result) {
        if (result.isEmpty()) {
            return 0L;
        }
        Object value = result.get(0).get("subscription_count");
        return value instanceof Number n ? n.longValue() : 0L;
    }

    private static ReconciliationMismatchException mismatch(String detail, DateRange range) {
        log.error("[Consistency] {} (range {}..{})", detail, range.start(), range.end());
        return new ReconciliationMismatchException("CRM eligibility mismatch: " + detail);
    }
}

package com.trafficlens.reporting.core.generator;

import com.trafficlens.reporting.core.eligibility.EligibilityFilter;
import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.core.model.SqlRequest;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import com.trafficlens.reporting.core.registry.MetricRegistry;

import java.time.LocalTime;
import java.util.List;

/**
 * CRM 订阅聚合（MariaDB）
 * 地理报表与追踪报表共用同一组 JOIN，区别只在维度映射和资格条件：
 * 地理报表用基础判定，追踪报表用归因判定。
 */
public class CrmQueryBuilder extends AggregationQueryBuilder {

    static final String FROM_SUBSCRIPTIONS = """
            FROM subscription s
            LEFT JOIN customer c ON s.customer_id = c.id
            LEFT JOIN invoice i ON i.subscription_id = s.id AND i.type = 1
            LEFT JOIN invoice_product ip ON ip.invoice_id = i.id
            LEFT JOIN product p ON p.id = ip.product_id
            LEFT JOIN product p_sub ON p_sub.id = s.product_id
            LEFT JOIN product_group pg ON pg.id = p.product_group_id
            LEFT JOIN product_group pg_sub ON pg_sub.id = p_sub.product_group_id
            LEFT JOIN source sr ON sr.id = i.source_id
            LEFT JOIN source sr_sub ON sr_sub.id = s.source_id
            LEFT JOIN invoice uo ON uo.customer_id = s.customer_id
                AND uo.tag LIKE CONCAT('%parent-sub-id=', s.id, '%')""";

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    public CrmQueryBuilder(ReportFamily family, DimensionRegistry dimensions, MetricRegistry metrics,
                           QueryLimits limits) {
        super(requireCrm(family), dimensions, metrics, limits);
    }

    private static ReportFamily requireCrm(ReportFamily family) {
        if (family != ReportFamily.CRM_GEOGRAPHY && family != ReportFamily.CRM_TRACKING) {
            throw new IllegalArgumentException("Not a CRM report family: " + family);
        }
        return family;
    }

    public boolean isAttribution() {
        return family() == ReportFamily.CRM_TRACKING;
    }

    @Override
    protected String fromClause() {
        return FROM_SUBSCRIPTIONS;
    }

    @Override
    protected void appendDateRange(DateRange range, WhereClause where) {
        where.add("s.date_create BETWEEN ? AND ?", range.start().atStartOfDay(), range.end().atTime(END_OF_DAY));
    }

    @Override
    protected List<String> fixedConditions() {
        return List.of(isAttribution()
                ? EligibilityFilter.attributionSqlCondition()
                : EligibilityFilter.baselineSqlCondition());
    }

    /**
     * 日期范围内合格订阅总数（不分组），用于和 Java 侧判定结果对账
     */
    public SqlRequest buildEligibleTotalQuery(DateRange range) {
        WhereClause where = new WhereClause();
        appendDateRange(range, where);
        fixedConditions().forEach(where::add);
        String sql = "SELECT COUNT(DISTINCT s.id) AS subscription_count\n" + FROM_SUBSCRIPTIONS + "\n" + where.toSql();
        return new SqlRequest(sql, where.params());
    }

    /**
     * 日期范围内未经资格过滤的扁平行，字段与 EligibilityRow 一一对应
     */
    public SqlRequest buildEligibilityRowsQuery(DateRange range) {
        WhereClause where = new WhereClause();
        appendDateRange(range, where);
        String sql = """
                SELECT
                  s.id AS subscription_id,
                  s.deleted AS subscription_deleted,
                  i.id AS invoice_id,
                  i.type AS invoice_type,
                  i.deleted AS invoice_deleted,
                  i.tag AS invoice_tag,
                  s.tracking_id_4 AS campaign_tracking_id,
                  s.tracking_id_2 AS adset_tracking_id,
                  s.tracking_id AS ad_tracking_id,
                  COALESCE(sr.source, sr_sub.source) AS source
                """
                + FROM_SUBSCRIPTIONS + "\n" + where.toSql();
        return new SqlRequest(sql, where.params());
    }
}

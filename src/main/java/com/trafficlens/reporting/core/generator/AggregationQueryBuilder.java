package com.trafficlens.reporting.core.generator;

import com.trafficlens.reporting.core.exception.DepthOutOfRangeException;
import com.trafficlens.reporting.core.exception.InvalidDateRangeException;
import com.trafficlens.reporting.core.metric.DerivedMetrics;
import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.DimensionDef;
import com.trafficlens.reporting.core.model.MetricDefinition;
import com.trafficlens.reporting.core.model.QueryOptions;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.core.model.SortDirection;
import com.trafficlens.reporting.core.model.SqlRequest;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import com.trafficlens.reporting.core.registry.MetricRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单层下钻聚合 SQL 生成器
 *
 * 生成的语句：按 dimensions[depth] 分组，日期范围、父级过滤、表格过滤全部参数化，
 * 原始指标求和，派生指标在同一语句中由原始指标的聚合表达式重新计算。
 * 各数据源只提供 FROM 子句、日期条件和固定的业务条件。
 */
public abstract class AggregationQueryBuilder {

    public static final String VALUE_COLUMN = "dimension_value";
    public static final String LABEL_COLUMN = "dimension_label";

    private final ReportFamily family;
    protected final DimensionRegistry dimensions;
    protected final MetricRegistry metrics;
    protected final QueryLimits limits;
    protected final FilterBuilder filterBuilder;

    protected AggregationQueryBuilder(ReportFamily family, DimensionRegistry dimensions, MetricRegistry metrics,
                                      QueryLimits limits) {
        this.family = family;
        this.dimensions = dimensions;
        this.metrics = metrics;
        this.limits = limits;
        this.filterBuilder = new FilterBuilder(dimensions, family);
    }

    public ReportFamily family() {
        return family;
    }

    public QueryLimits limits() {
        return limits;
    }

    /** FROM 及 JOIN 子句 */
    protected abstract String fromClause();

    /** 日期范围条件，起止均包含 */
    protected abstract void appendDateRange(DateRange range, WhereClause where);

    /** 该数据源固定的业务条件（不含任何请求值） */
    protected List<String> fixedConditions() {
        return List.of();
    }

    public SqlRequest buildQuery(QueryOptions options) {
        return buildQuery(options, true);
    }

    /**
     * @param bounded false 时不加 LIMIT，返回全部分组；
     *                仅用于双源合并中不决定排序的一侧，最终行数由合并后截断保证
     */
    public SqlRequest buildQuery(QueryOptions options, boolean bounded) {
        // 1. 校验层级与维度
        List<String> path = options.dimensions();
        if (options.depth() < 0 || options.depth() >= path.size()) {
            throw new DepthOutOfRangeException(options.depth(), path.size());
        }
        if (options.dateRange() == null) {
            throw new InvalidDateRangeException("Date range is required");
        }
        dimensions.resolveAll(family(), path);
        options.parentFilters().keySet().forEach(id -> dimensions.resolve(family(), id));
        DimensionDef current = dimensions.resolve(family(), path.get(options.depth()));

        // 2. WHERE
        WhereClause where = new WhereClause();
        appendDateRange(options.dateRange(), where);
        fixedConditions().forEach(where::add);
        filterBuilder.appendParentFilters(options.parentFilters(), where);
        filterBuilder.appendTableFilters(options.filters(), where);

        // 3. SELECT
        StringBuilder sql = new StringBuilder("SELECT\n  ")
                .append(current.column()).append(" AS ").append(VALUE_COLUMN);
        if (current.hasLabel()) {
            sql.append(",\n  ").append(current.labelExpression()).append(" AS ").append(LABEL_COLUMN);
        }
        for (String metricColumn : metricColumns()) {
            sql.append(",\n  ").append(metricColumn);
        }
        sql.append("\n").append(fromClause());
        if (!where.isEmpty()) {
            sql.append("\n").append(where.toSql());
        }
        sql.append("\nGROUP BY ").append(current.column());
        sql.append("\nORDER BY ").append(orderBy(current, options));
        List<Object> params = new ArrayList<>(where.params());
        if (bounded) {
            sql.append("\nLIMIT ?");
            params.add(limits.clamp(options.limit()));
        }
        return new SqlRequest(sql.toString(), params);
    }

    /**
     * 时间维度强制按该列倒序（最新在前）；否则按调用方指定指标，缺省为该族默认指标。
     * 维度列作为次级排序，保证结果顺序稳定。
     */
    protected String orderBy(DimensionDef current, QueryOptions options) {
        if (current.temporal()) {
            return VALUE_COLUMN + " DESC";
        }
        MetricDefinition sort = metrics.resolveSort(family(), options.sortBy());
        SortDirection direction = options.sortDirection() == null ? SortDirection.DESC : options.sortDirection();
        return sort.alias() + " " + direction.name() + ", " + VALUE_COLUMN + " ASC";
    }

    protected List<String> metricColumns() {
        Map<String, MetricDefinition> rawById = new LinkedHashMap<>();
        List<String> columns = new ArrayList<>();
        for (MetricDefinition raw : metrics.rawMetrics(family())) {
            rawById.put(raw.id(), raw);
            columns.add(raw.expression() + " AS " + raw.alias());
        }
        for (MetricDefinition derived : metrics.derivedMetrics(family())) {
            columns.add(DerivedMetrics.sqlExpression(derived, rawById) + " AS " + derived.alias());
        }
        return columns;
    }
}

package com.trafficlens.reporting.core.engine;

import com.trafficlens.reporting.common.config.ReportingConfig;
import com.trafficlens.reporting.core.exception.BackingStoreException;
import com.trafficlens.reporting.core.exception.DepthOutOfRangeException;
import com.trafficlens.reporting.core.exception.ReconciliationMismatchException;
import com.trafficlens.reporting.core.exception.ReportingException;
import com.trafficlens.reporting.core.generator.AggregationQueryBuilder;
import com.trafficlens.reporting.core.generator.QueryBuilderFactory;
import com.trafficlens.reporting.core.model.AggregateRow;
import com.trafficlens.reporting.core.model.DimensionDef;
import com.trafficlens.reporting.core.model.MetricDefinition;
import com.trafficlens.reporting.core.model.QueryOptions;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.core.model.ReportRow;
import com.trafficlens.reporting.core.model.ReportType;
import com.trafficlens.reporting.core.model.SortDirection;
import com.trafficlens.reporting.core.model.SqlRequest;
import com.trafficlens.reporting.core.reconcile.CrossSourceReconciler;
import com.trafficlens.reporting.core.reconcile.RowOrdering;
import com.trafficlens.reporting.core.registry.DimensionRegistry;
import com.trafficlens.reporting.core.registry.MetricRegistry;
import com.trafficlens.reporting.core.registry.SourceMapping;
import com.trafficlens.reporting.core.tree.DrillDownTree;
import com.trafficlens.reporting.core.tree.RowKey;
import com.trafficlens.reporting.infra.persistence.JdbcQueryExecutor;
import com.trafficlens.reporting.infra.persistence.RunningQuery;
import com.trafficlens.reporting.shared.mapper.AggregateRowMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 报表引擎
 *
 * 每次请求无状态：校验 -> 生成 SQL -> 执行（双源时并发） -> 合并 -> 排序 -> 截断 -> 组装为树节点。
 * 任一查询失败或超时，两条查询都被取消，整个请求失败，不返回部分结果。
 */
@ApplicationScoped
public class ReportEngine {

    private static final Logger log = LoggerFactory.getLogger(ReportEngine.class);

    @Inject
    QueryBuilderFactory builders;

    @Inject
    JdbcQueryExecutor executor;

    @Inject
    DimensionRegistry dimensionRegistry;

    @Inject
    MetricRegistry metricRegistry;

    @Inject
    ReportingConfig config;

    /**
     * 查询一层下钻结果
     *
     * @param type     报表
     * @param options  维度路径、层级、父级过滤、排序等
     * @param callerId 调用方身份，仅用于审计日志
     */
    public List<ReportRow> query(ReportType type, QueryOptions options, String callerId) {
        log.info("[Report] caller={}, report={}, dims={}, depth={}, range={}..{}", callerId, type,
                options.dimensions(), options.depth(), startOf(options), endOf(options));
        ReportFamily primary = type.primary();

        // 1. 生成全部 SQL（任何校验失败都发生在执行之前）
        AggregationQueryBuilder primaryBuilder = builders.forFamily(primary);
        SqlRequest primarySql = primaryBuilder.buildQuery(options.withFamily(primary));
        DimensionDef current = dimensionRegistry.resolve(primary, options.currentDimension());
        Optional<ReportFamily> secondary = type.secondary();
        LimitSide limitSide = secondary
                .map(other -> current.temporal() ? LimitSide.BOTH : limitSide(primary, other, options.sortBy()))
                .orElse(LimitSide.PRIMARY);
        if (!limitSide.primaryBounded()) {
            primarySql = primaryBuilder.buildQuery(options.withFamily(primary), false);
        }
        SqlRequest secondarySql = secondary
                .map(family -> builders.forFamily(family).buildQuery(options.withFamily(family),
                        limitSide.secondaryBounded()))
                .orElse(null);
        String parentKey = parentKey(options);
        int limit = primaryBuilder.limits().clamp(options.limit());

        // 2. 执行
        List<RunningQuery> running = new ArrayList<>();
        running.add(executor.submit(primary.dataSource(), primarySql));
        if (secondarySql != null) {
            try {
                running.add(executor.submit(secondary.get().dataSource(), secondarySql));
            } catch (RuntimeException e) {
                running.forEach(RunningQuery::cancel);
                throw e;
            }
        }
        List<List<Map<String, Object>>> results = awaitAll(running);

        // 3. 合并
        List<AggregateRow> rows;
        List<MetricDefinition> primaryRaw = metricRegistry.rawMetrics(primary);
        if (secondary.isPresent()) {
            ReportFamily other = secondary.get();
            boolean ignoreCase = SourceMapping.NETWORK_DIMENSION.equals(current.id());
            List<AggregateRow> left = AggregateRowMapper.aggregateRows(results.get(0), metricRegistry.metrics(primary));
            List<AggregateRow> right = AggregateRowMapper.aggregateRows(results.get(1), metricRegistry.metrics(other));
            rows = CrossSourceReconciler.merge(left, right, primaryRaw, metricRegistry.rawMetrics(other),
                    metricRegistry.reconciledDerived(primary, other), ignoreCase);
            // 排序侧被截断时，它没返回的取值排序指标未知，不能以 0 补齐输出
            List<AggregateRow> limitedSide = limitSide == LimitSide.PRIMARY ? left
                    : limitSide == LimitSide.SECONDARY ? right : null;
            if (limitedSide != null && limitedSide.size() >= limit) {
                rows = CrossSourceReconciler.retainValues(rows, limitedSide, ignoreCase);
            }
        } else {
            rows = CrossSourceReconciler.collapse(
                    AggregateRowMapper.aggregateRows(results.get(0), metricRegistry.metrics(primary)),
                    primaryRaw, metricRegistry.derivedMetrics(primary));
        }

        // 4. 排序 + 截断 + 组装
        rows = RowOrdering.sort(rows, current.temporal(), sortMetric(type, options.sortBy()),
                options.sortDirection() == null ? SortDirection.DESC : options.sortDirection());
        if (rows.size() > limit) {
            rows = rows.subList(0, limit);
        }
        List<ReportRow> reportRows = DrillDownTree.toRows(parentKey, options.depth(), options.dimensions().size(), rows);
        log.debug("[Report] report={}, depth={}, limitSide={}, rows={}", type, options.depth(), limitSide,
                reportRows.size());
        return reportRows;
    }

    /**
     * 一次性重建部分展开的树：按层级从浅到深加载，只在已加载的父节点下展开
     */
    public List<ReportRow> restoreTree(ReportType type, QueryOptions options, Collection<String> expandedKeys,
                                       String callerId) {
        List<String> dims = options.dimensions();
        List<ReportRow> tree = query(type, options.atDepth(0, Map.of()), callerId);
        SortedMap<Integer, List<String>> byDepth = DrillDownTree.groupKeysByDepth(expandedKeys);
        for (Map.Entry<Integer, List<String>> level : byDepth.entrySet()) {
            if (level.getKey() >= dims.size() - 1) {
                continue;
            }
            for (String key : level.getValue()) {
                Optional<ReportRow> parent = DrillDownTree.findByKey(tree, key);
                if (parent.isEmpty() || !parent.get().hasChildren()) {
                    log.debug("[Report] skip expanded key not present in loaded tree: {}", key);
                    continue;
                }
                Map<String, String> parentFilters = RowKey.buildParentFilters(key, dims);
                List<ReportRow> children = query(type, options.atDepth(level.getKey() + 1, parentFilters), callerId);
                tree = DrillDownTree.attachChildren(tree, key, children);
            }
        }
        try {
            DrillDownTree.verify(tree);
        } catch (ReconciliationMismatchException e) {
            log.error("[Report] restored tree failed consistency check: {}", e.getMessage());
            throw e;
        }
        return tree;
    }

    /**
     * 父级过滤必须覆盖当前层之前的每个维度，行键由这些取值按层级拼出
     */
    private String parentKey(QueryOptions options) {
        String key = null;
        for (int i = 0; i < options.depth(); i++) {
            String dimension = options.dimensions().get(i);
            if (!options.parentFilters().containsKey(dimension)) {
                throw new DepthOutOfRangeException(options.depth(), options.dimensions().size(), String.format(
                        "Depth %d requires a parent filter for ancestor dimension '%s'", options.depth(), dimension));
            }
            String value = options.parentFilters().get(dimension);
            if (!RowKey.isEncodable(value)) {
                throw new IllegalArgumentException(String.format(
                        "Parent filter value for '%s' must not contain '%s' or start or end with ':'",
                        dimension, RowKey.SEPARATOR));
            }
            key = RowKey.child(key, value);
        }
        return key;
    }

    /**
     * 双源报表中哪一侧带 LIMIT：排序指标所属的一侧截断，另一侧取全部分组；
     * 跨源指标两侧都取全量；时间维度两侧按同一列倒序各自截断。
     * 未知排序指标回落到主侧默认指标。
     */
    LimitSide limitSide(ReportFamily primary, ReportFamily other, String sortBy) {
        if (sortBy == null || metricRegistry.find(primary, sortBy).isPresent()) {
            return LimitSide.PRIMARY;
        }
        if (metricRegistry.find(other, sortBy).isPresent()) {
            return LimitSide.SECONDARY;
        }
        if (metricRegistry.findReconciled(primary, other, sortBy).isPresent()) {
            return LimitSide.NONE;
        }
        return LimitSide.PRIMARY;
    }

    enum LimitSide {
        PRIMARY(true, false),
        SECONDARY(false, true),
        BOTH(true, true),
        NONE(false, false);

        private final boolean primaryBounded;
        private final boolean secondaryBounded;

        LimitSide(boolean primaryBounded, boolean secondaryBounded) {
            this.primaryBounded = primaryBounded;
            this.secondaryBounded = secondaryBounded;
        }

        boolean primaryBounded() {
            return primaryBounded;
        }

        boolean secondaryBounded() {
            return secondaryBounded;
        }
    }

    private String sortMetric(ReportType type, String sortBy) {
        ReportFamily primary = type.primary();
        if (type.isReconciled()) {
            return metricRegistry.findReconciled(primary, type.secondary().get(), sortBy)
                    .map(MetricDefinition::id)
                    .orElse(metricRegistry.defaultSort(primary));
        }
        return metricRegistry.resolveSort(primary, sortBy).id();
    }

    private List<List<Map<String, Object>>> awaitAll(List<RunningQuery> running) {
        CompletableFuture<?>[] futures = running.stream().map(RunningQuery::result).toArray(CompletableFuture[]::new);
        CompletableFuture<Object> firstFailure = new CompletableFuture<>();
        for (CompletableFuture<?> future : futures) {
            future.whenComplete((value, error) -> {
                if (error != null) {
                    firstFailure.completeExceptionally(error);
                }
            });
        }
        long timeout = config.getQueryTimeoutSeconds();
        try {
            CompletableFuture.anyOf(CompletableFuture.allOf(futures), firstFailure).get(timeout, TimeUnit.SECONDS);
            List<List<Map<String, Object>>> results = new ArrayList<>(running.size());
            for (RunningQuery query : running) {
                results.add(query.result().join());
            }
            return results;
        } catch (TimeoutException e) {
            running.forEach(RunningQuery::cancel);
            log.error("[Report] query timed out after {}s, cancelled {} statement(s)", timeout, running.size());
            throw new BackingStoreException("Report query timed out after " + timeout + "s", e);
        } catch (InterruptedException e) {
            running.forEach(RunningQuery::cancel);
            Thread.currentThread().interrupt();
            throw new BackingStoreException("Report query interrupted", e);
        } catch (ExecutionException | CompletionException e) {
            running.forEach(RunningQuery::cancel);
            Throwable cause = unwrap(e);
            if (cause instanceof ReportingException reportingException) {
                throw reportingException;
            }
            log.error("[Report] query failed: {}", cause.getMessage(), cause);
            throw new BackingStoreException("Report query failed: " + cause.getMessage(), cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Object startOf(QueryOptions options) {
        return options.dateRange() == null ? null : options.dateRange().start();
    }

    private static Object endOf(QueryOptions options) {
        return options.dateRange() == null ? null : options.dateRange().end();
    }
}

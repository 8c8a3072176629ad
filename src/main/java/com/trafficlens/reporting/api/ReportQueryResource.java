package com.trafficlens.reporting.api;

import com.trafficlens.reporting.api.dto.ReportQueryRequest;
import com.trafficlens.reporting.api.dto.ReportQueryResult;
import com.trafficlens.reporting.core.date.DateRangeResolver;
import com.trafficlens.reporting.core.engine.ConsistencyReport;
import com.trafficlens.reporting.core.engine.CrmConsistencyChecker;
import com.trafficlens.reporting.core.engine.ReportEngine;
import com.trafficlens.reporting.core.exception.InvalidDateRangeException;
import com.trafficlens.reporting.core.model.DateRange;
import com.trafficlens.reporting.core.model.QueryOptions;
import com.trafficlens.reporting.core.model.ReportRow;
import com.trafficlens.reporting.core.model.SortDirection;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 报表查询REST API
 * 每次展开树的一层调用一次 /query；/tree 用于恢复已展开的树
 */
@ApplicationScoped
@Path("/api/v1/reports")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ReportQueryResource {
    private static final Logger log = LoggerFactory.getLogger(ReportQueryResource.class);

    static final String CALLER_HEADER = "X-User-Id";

    @Inject
    ReportEngine engine;

    @Inject
    CrmConsistencyChecker consistencyChecker;

    @Inject
    DateRangeResolver dateRangeResolver;

    /**
     * 查询一层下钻数据
     */
    @POST
    @Path("/query")
    public ReportQueryResult query(ReportQueryRequest request,
                                   @HeaderParam(CALLER_HEADER) @DefaultValue("anonymous") String callerId) {
        long start = System.currentTimeMillis();
        List<ReportRow> rows = engine.query(request.reportType(), toOptions(request), callerId);
        return ReportQueryResult.success(rows, String.format("查询成功！返回 %d 条记录，耗时 %d ms",
                rows.size(), System.currentTimeMillis() - start));
    }

    /**
     * 恢复部分展开的树
     */
    @POST
    @Path("/tree")
    public ReportQueryResult tree(ReportQueryRequest request,
                                  @HeaderParam(CALLER_HEADER) @DefaultValue("anonymous") String callerId) {
        long start = System.currentTimeMillis();
        List<String> expanded = request.expandedKeys() == null ? List.of() : request.expandedKeys();
        List<ReportRow> tree = engine.restoreTree(request.reportType(), toOptions(request), expanded, callerId);
        return ReportQueryResult.success(tree, String.format("查询成功！展开 %d 个节点，耗时 %d ms",
                expanded.size(), System.currentTimeMillis() - start));
    }

    /**
     * CRM 订单资格一致性检查
     */
    @GET
    @Path("/crm/consistency")
    public ReportQueryResult consistency(@QueryParam("start") String start, @QueryParam("end") String end,
                                        @HeaderParam(CALLER_HEADER) @DefaultValue("anonymous") String callerId) {
        log.info("收到一致性检查请求: caller={}, range={}..{}", callerId, start, end);
        ConsistencyReport report = consistencyChecker.check(DateRange.parse(start, end));
        return ReportQueryResult.success(List.of(report), "一致性检查通过");
    }

    QueryOptions toOptions(ReportQueryRequest request) {
        if (request == null || request.reportType() == null) {
            throw new IllegalArgumentException("reportType is required");
        }
        if (request.dimensions() == null || request.dimensions().isEmpty()) {
            throw new IllegalArgumentException("At least one dimension is required");
        }
        return new QueryOptions(
                request.reportType().primary(),
                dateRange(request),
                request.dimensions(),
                request.depth() == null ? 0 : request.depth(),
                request.parentFilters(),
                request.filters(),
                request.sortBy(),
                SortDirection.from(request.sortDirection()),
                request.limit());
    }

    private DateRange dateRange(ReportQueryRequest request) {
        if (request.start() != null || request.end() != null) {
            return DateRange.parse(request.start(), request.end());
        }
        if (request.datePreset() != null) {
            return dateRangeResolver.resolvePreset(request.datePreset());
        }
        throw new InvalidDateRangeException("Either start/end or datePreset is required");
    }
}

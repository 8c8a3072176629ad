package com.trafficlens.reporting.api;

import com.trafficlens.reporting.api.dto.ReportQueryResult;
import com.trafficlens.reporting.core.date.ResolvedViewParams;
import com.trafficlens.reporting.core.date.SavedView;
import com.trafficlens.reporting.core.engine.SavedViewService;
import com.trafficlens.reporting.core.model.ReportType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

/**
 * 保存视图REST API，视图归属调用方
 */
@ApplicationScoped
@Path("/api/v1/saved-views")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SavedViewResource {

    @Inject
    SavedViewService service;

    @GET
    public ReportQueryResult list(@QueryParam("report") ReportType report,
                                  @HeaderParam(ReportQueryResource.CALLER_HEADER) @DefaultValue("anonymous") String callerId) {
        if (report == null) {
            throw new IllegalArgumentException("report is required");
        }
        List<SavedView> views = service.list(callerId, report);
        return ReportQueryResult.success(views, "查询成功！返回 " + views.size() + " 个视图");
    }

    @POST
    public Response create(SavedView view,
                           @HeaderParam(ReportQueryResource.CALLER_HEADER) @DefaultValue("anonymous") String callerId) {
        if (view == null) {
            throw new IllegalArgumentException("Saved view body is required");
        }
        SavedView saved = service.create(view, callerId);
        return Response.status(Response.Status.CREATED)
                .entity(ReportQueryResult.success(List.of(saved), "保存成功"))
                .build();
    }

    @GET
    @Path("/{id}")
    public Response get(@PathParam("id") long id,
                        @HeaderParam(ReportQueryResource.CALLER_HEADER) @DefaultValue("anonymous") String callerId) {
        return service.find(id, callerId)
                .map(view -> Response.ok(ReportQueryResult.success(List.of(view), "查询成功")).build())
                .orElseGet(() -> notFound(id));
    }

    /**
     * 按当天解析视图的日期，返回可直接用于报表查询的参数
     */
    @GET
    @Path("/{id}/resolved")
    public Response resolved(@PathParam("id") long id,
                             @HeaderParam(ReportQueryResource.CALLER_HEADER) @DefaultValue("anonymous") String callerId) {
        return service.resolve(id, callerId)
                .map(params -> Response.ok(ReportQueryResult.success(List.<ResolvedViewParams>of(params), "解析成功"))
                        .build())
                .orElseGet(() -> notFound(id));
    }

    private static Response notFound(long id) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(ReportQueryResult.clientError("Saved view " + id + " not found"))
                .build();
    }
}

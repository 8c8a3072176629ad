package com.trafficlens.reporting.api;

import com.trafficlens.reporting.api.dto.ReportQueryResult;
import com.trafficlens.reporting.core.exception.ReportingException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 可修正的校验错误 -> 400 / 4000；后端与一致性错误 -> 500 / 9999
 */
@Provider
public class ReportingExceptionMapper implements ExceptionMapper<ReportingException> {

    private static final Logger log = LoggerFactory.getLogger(ReportingExceptionMapper.class);

    @Override
    public Response toResponse(ReportingException e) {
        if (e.isClientCorrectable()) {
            log.info("请求校验失败: {}", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(ReportQueryResult.clientError(e.getMessage()))
                    .build();
        }
        log.error("查询失败: {}", e.getMessage(), e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .type(MediaType.APPLICATION_JSON)
                .entity(ReportQueryResult.error("查询失败: " + e.getMessage()))
                .build();
    }
}

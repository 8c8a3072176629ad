package com.trafficlens.reporting.api.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * 报表接口统一返回
 */
@RegisterForReflection
public record ReportQueryResult(
    List<?> dataArray, // 数据数组
    String status,     // 业务状态码：0000 成功，4000 请求可修正，9999 服务端失败
    String msg         // 如 查询成功！返回 xx 条记录
) {

    public static final String SUCCESS = "0000";
    public static final String CLIENT_ERROR = "4000";
    public static final String SERVER_ERROR = "9999";

    /**
     * 创建成功结果
     */
    public static ReportQueryResult success(List<?> dataArray, String msg) {
        return new ReportQueryResult(dataArray, SUCCESS, msg);
    }

    public static ReportQueryResult clientError(String errorMsg) {
        return new ReportQueryResult(List.of(), CLIENT_ERROR, errorMsg);
    }

    public static ReportQueryResult error(String errorMsg) {
        return new ReportQueryResult(List.of(), SERVER_ERROR, errorMsg);
    }
}

package com.trafficlens.reporting.core.model;

/**
 * 用户自定义的表格过滤条件，字段必须是已注册维度
 */
public record TableFilter(String field, FilterOperator operator, String value) {
}

package com.trafficlens.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 下钻树节点
 * children 为 null 表示尚未展开（不同于展开后为空列表）
 */
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportRow(
    String key,                  // 祖先维度取值以 :: 拼接，含自身取值
    String attribute,            // 当前层展示值
    int depth,
    boolean hasChildren,
    Map<String, Number> metrics,
    List<ReportRow> children
) {

    public ReportRow {
        metrics = metrics == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        children = children == null ? null : List.copyOf(children);
    }

    public ReportRow withChildren(List<ReportRow> newChildren) {
        return new ReportRow(key, attribute, depth, hasChildren, metrics, newChildren);
    }

    public ReportRow withHasChildren(boolean flag) {
        return new ReportRow(key, attribute, depth, flag, metrics, children);
    }

    public boolean isLoaded() {
        return children != null;
    }

    public double metric(String id) {
        Number value = metrics.get(id);
        return value == null ? 0d : value.doubleValue();
    }
}

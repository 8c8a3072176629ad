package com.trafficlens.reporting.core.model;

/**
 * 维度定义
 */
public record DimensionDef(
    String id,              // 逻辑维度ID，如 campaign
    String column,          // 物理列表达式，用于 GROUP BY 和过滤
    String labelExpression, // 展示名表达式（可为空，为空时展示值即分组值）
    String group,           // UI 分组，不参与语义
    boolean temporal,       // 时间维度：排序强制按该列倒序
    String nullCheck        // "Unknown" 对应的空值条件（可为空，默认 column IS NULL）
) {

    public static DimensionDef of(String id, String column, String group) {
        return new DimensionDef(id, column, null, group, false, null);
    }

    public static DimensionDef labelled(String id, String column, String labelExpression, String group) {
        return new DimensionDef(id, column, labelExpression, group, false, null);
    }

    public static DimensionDef temporal(String id, String column) {
        return new DimensionDef(id, column, null, "time", true, null);
    }

    public DimensionDef withNullCheck(String check) {
        return new DimensionDef(id, column, labelExpression, group, temporal, check);
    }

    public boolean hasLabel() {
        return labelExpression != null;
    }

    public String nullCondition() {
        return nullCheck != null ? nullCheck : column + " IS NULL";
    }
}

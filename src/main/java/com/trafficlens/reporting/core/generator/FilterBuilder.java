package com.trafficlens.reporting.core.generator;

import com.trafficlens.reporting.core.exception.InvalidDateRangeException;
import com.trafficlens.reporting.core.model.DimensionDef;
import com.trafficlens.reporting.core.model.ReportFamily;
import com.trafficlens.reporting.core.model.TableFilter;
import com.trafficlens.reporting.core.registry.DimensionRegistry;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 父级过滤与表格过滤
 * 列表达式只来自维度注册表，取值一律绑定参数。
 * "Unknown" 是空分组的展示值，作为过滤值时翻译成该维度的空值条件。
 */
public class FilterBuilder {

    public static final String UNKNOWN = "Unknown";

    private final DimensionRegistry registry;
    private final ReportFamily family;
    private final SqlDialect dialect;

    public FilterBuilder(DimensionRegistry registry, ReportFamily family) {
        this.registry = registry;
        this.family = family;
        this.dialect = SqlDialect.of(family.dataSource());
    }

    public void appendParentFilters(Map<String, String> parentFilters, WhereClause where) {
        for (Map.Entry<String, String> entry : parentFilters.entrySet()) {
            DimensionDef def = registry.resolve(family, entry.getKey());
            String value = entry.getValue();
            if (value == null || UNKNOWN.equals(value)) {
                where.add(def.nullCondition());
            } else {
                where.add(def.column() + " = ?", bindValue(def, value));
            }
        }
    }

    public void appendTableFilters(List<TableFilter> filters, WhereClause where) {
        for (TableFilter filter : filters) {
            DimensionDef def = registry.resolve(family, filter.field());
            String value = filter.value() == null ? "" : filter.value();
            if (filter.operator() == null) {
                throw new IllegalArgumentException("Filter on '" + filter.field() + "' has no operator");
            }
            switch (filter.operator()) {
                case EQUALS -> {
                    if (UNKNOWN.equals(value)) {
                        where.add(def.nullCondition());
                    } else {
                        where.add(def.column() + " = ?", bindValue(def, value));
                    }
                }
                case NOT_EQUALS -> {
                    if (UNKNOWN.equals(value)) {
                        where.add("NOT (" + def.nullCondition() + ")");
                    } else {
                        where.add("(" + def.column() + " IS NULL OR " + def.column() + " <> ?)", bindValue(def, value));
                    }
                }
                case CONTAINS -> where.add("LOWER(" + dialect.asText(def.column()) + ") LIKE ?", likePattern(value));
                case NOT_CONTAINS -> where.add("(" + def.column() + " IS NULL OR LOWER("
                        + dialect.asText(def.column()) + ") NOT LIKE ?)", likePattern(value));
            }
        }
    }

    /**
     * 时间维度的取值按 ISO 日期绑定，其余按字符串
     */
    static Object bindValue(DimensionDef def, String value) {
        if (!def.temporal()) {
            return value;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidDateRangeException("Unparseable date filter value for '" + def.id() + "': " + value, e);
        }
    }

    static String likePattern(String value) {
        String escaped = value.toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}

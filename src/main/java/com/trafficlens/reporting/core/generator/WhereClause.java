package com.trafficlens.reporting.core.generator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * WHERE 条件累加器：条件文本只含列表达式和 ?，取值按出现顺序进入参数列表
 */
public class WhereClause {

    private final List<String> conditions = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    public WhereClause add(String condition, Object... values) {
        conditions.add(condition);
        params.addAll(Arrays.asList(values));
        return this;
    }

    public List<Object> params() {
        return params;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public String toSql() {
        if (conditions.isEmpty()) {
            return "";
        }
        return "WHERE " + String.join("\n  AND ", conditions);
    }
}

package com.trafficlens.reporting.core.model;

import java.util.Collections;
import java.util.List;

/**
 * 参数化 SQL：语句中只有 ? 占位符，所有变量值按占位符顺序放在 params
 */
public record SqlRequest(String sql, List<Object> params) {

    public SqlRequest {
        params = params == null ? Collections.emptyList() : Collections.unmodifiableList(params);
    }

    public SqlRequest(String sql) {
        this(sql, Collections.emptyList());
    }

    public int placeholderCount() {
        int count = 0;
        for (int i = 0; i < sql.length(); i++) {
            if (sql.charAt(i) == '?') {
                count++;
            }
        }
        return count;
    }
}

package com.trafficlens.reporting.core.generator;

import com.trafficlens.reporting.core.model.DataSourceKind;

/**
 * 两个后端的方言差异只有文本类型转换
 */
public enum SqlDialect {
    POSTGRES("TEXT"),
    MARIADB("CHAR");

    private final String textType;

    SqlDialect(String textType) {
        this.textType = textType;
    }

    public String asText(String expression) {
        return "CAST(" + expression + " AS " + textType + ")";
    }

    public static SqlDialect of(DataSourceKind kind) {
        return kind == DataSourceKind.CRM ? MARIADB : POSTGRES;
    }
}

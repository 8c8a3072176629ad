package com.trafficlens.reporting.core.date;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 相对日期预设（封闭枚举）。声明顺序即反查顺序。
 */
public enum DatePreset {
    TODAY("today"),
    YESTERDAY("yesterday"),
    LAST_7_DAYS("last7days"),
    LAST_14_DAYS("last14days"),
    LAST_30_DAYS("last30days"),
    LAST_90_DAYS("last90days"),
    THIS_WEEK("thisWeek"),
    LAST_WEEK("lastWeek"),
    THIS_MONTH("thisMonth"),
    LAST_MONTH("lastMonth");

    private final String id;

    DatePreset(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static DatePreset fromId(String id) {
        return Arrays.stream(values())
                .filter(p -> p.id.equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown date preset: " + id));
    }
}

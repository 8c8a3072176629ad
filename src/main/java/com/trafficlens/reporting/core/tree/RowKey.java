package com.trafficlens.reporting.core.tree;

import com.trafficlens.reporting.core.exception.ReconciliationMismatchException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 行键编解码
 * 行键 = 祖先各层维度取值（含自身）以 "::" 拼接，层级 = 分隔符个数。
 * 空值统一展示为 "Unknown"；取值中不允许出现分隔符，也不允许以 ':' 开头或结尾。
 */
public final class RowKey {

    public static final String SEPARATOR = "::";
    public static final String UNKNOWN = "Unknown";

    private RowKey() {
    }

    public record Decoded(int depth, List<String> values) {
    }

    /**
     * 维度取值规范化：null / 空白 -> Unknown
     */
    public static String normalize(Object value) {
        if (value == null) {
            return UNKNOWN;
        }
        String text = value.toString();
        if (text.isBlank()) {
            return UNKNOWN;
        }
        if (!isEncodable(text)) {
            throw new ReconciliationMismatchException(
                    "Dimension value contains the reserved key separator: " + text);
        }
        return text;
    }

    /**
     * 取值能否放进行键：首尾的 ':' 与分隔符相邻时无法唯一解码
     */
    public static boolean isEncodable(String value) {
        return value == null
                || !(value.contains(SEPARATOR) || value.startsWith(":") || value.endsWith(":"));
    }

    public static String child(String parentKey, Object value) {
        String own = normalize(value);
        return parentKey == null ? own : parentKey + SEPARATOR + own;
    }

    public static Decoded decode(String key) {
        if (key == null || key.isEmpty()) {
            throw new ReconciliationMismatchException("Row key is empty");
        }
        List<String> values = Arrays.asList(key.split(SEPARATOR, -1));
        return new Decoded(values.size() - 1, List.copyOf(values));
    }

    /**
     * 行键 -> 拉取该行子节点所需的父级过滤（维度ID -> 取值，按层级顺序）
     */
    public static Map<String, String> buildParentFilters(String key, List<String> dimensions) {
        List<String> values = decode(key).values();
        if (values.size() > dimensions.size()) {
            throw new ReconciliationMismatchException(String.format(
                    "Row key '%s' has %d levels but only %d dimensions are selected",
                    key, values.size(), dimensions.size()));
        }
        Map<String, String> filters = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            filters.put(dimensions.get(i), values.get(i));
        }
        return filters;
    }

    /**
     * 行上携带的 depth 必须与行键解码结果一致
     */
    public static void verifyDepth(String key, int depth) {
        int decoded = decode(key).depth();
        if (decoded != depth) {
            throw new ReconciliationMismatchException(String.format(
                    "Row key '%s' decodes to depth %d but row carries depth %d", key, decoded, depth));
        }
    }

    public static boolean isChildOf(String key, String parentKey) {
        return key.startsWith(parentKey + SEPARATOR)
                && decode(key).depth() == decode(parentKey).depth() + 1;
    }
}

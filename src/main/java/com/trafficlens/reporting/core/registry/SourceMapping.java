package com.trafficlens.reporting.core.registry;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 广告网络与 CRM 来源的对应关系
 * CRM 追踪报表的 network 维度和跨源合并共用这一份映射
 */
public enum SourceMapping {
    GOOGLE_ADS("Google Ads", List.of("adwords", "google")),
    FACEBOOK("Facebook", List.of("facebook", "meta", "fb"));

    /** 使用本映射的维度，跨源合并时按忽略大小写的网络名对齐 */
    public static final String NETWORK_DIMENSION = "network";

    private final String network;
    private final List<String> sources;

    SourceMapping(String network, List<String> sources) {
        this.network = network;
        this.sources = sources;
    }

    public String network() {
        return network;
    }

    public List<String> sources() {
        return sources;
    }

    /**
     * CRM 来源 -> 广告网络名，未登记的来源返回 empty
     */
    public static Optional<String> networkForSource(String source) {
        if (source == null) {
            return Optional.empty();
        }
        String normalized = source.trim().toLowerCase(Locale.ROOT);
        for (SourceMapping mapping : values()) {
            if (mapping.sources.contains(normalized)) {
                return Optional.of(mapping.network);
            }
        }
        return Optional.empty();
    }

    /**
     * 判断来源是否属于指定网络（忽略大小写）
     */
    public static boolean matches(String network, String source) {
        return network != null
                && networkForSource(source).map(n -> n.equalsIgnoreCase(network.trim())).orElse(false);
    }

    /**
     * 生成把来源列映射为网络名的 CASE 表达式；未登记的来源保留原值
     * 表达式中只有固定常量，不含任何请求值
     */
    public static String caseExpression(String sourceColumn) {
        StringBuilder sql = new StringBuilder("CASE");
        for (SourceMapping mapping : values()) {
            String inList = mapping.sources.stream()
                    .map(s -> "'" + s + "'")
                    .collect(Collectors.joining(", "));
            sql.append(" WHEN LOWER(").append(sourceColumn).append(") IN (").append(inList).append(")")
                    .append(" THEN '").append(mapping.network).append("'");
        }
        sql.append(" ELSE ").append(sourceColumn).append(" END");
        return sql.toString();
    }
}

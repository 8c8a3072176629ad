package com.trafficlens.reporting.core.eligibility;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 订单资格判定的唯一实现
 * 所有统计 CRM 订单的路径（SQL 聚合、Java 侧校验、对账任务）都从这里取规则。
 * 归因判定 = 基础判定 + 追踪ID + 来源，因此归因合格的集合必然是基础合格集合的子集。
 */
public final class EligibilityFilter {

    private EligibilityFilter() {
    }

    /**
     * 基础判定：是否为真实、不重复的订单（规则 1-4）
     */
    public static boolean isEligibleForBaseline(EligibilityRow row) {
        return firstFailure(row, false) == null;
    }

    /**
     * 归因判定：基础判定之上还需具备与广告花费关联所需的字段（规则 1-6）
     */
    public static boolean isEligibleForAttribution(EligibilityRow row) {
        return firstFailure(row, true) == null;
    }

    /**
     * 列出全部不满足的规则（诊断用），为空表示归因合格
     */
    public static List<EligibilityRule> ineligibilityReasons(EligibilityRow row) {
        List<EligibilityRule> reasons = new ArrayList<>();
        for (EligibilityRule rule : EligibilityRule.values()) {
            if (!rule.test(row)) {
                reasons.add(rule);
            }
        }
        return reasons;
    }

    public static String baselineSqlCondition() {
        return sqlCondition(false);
    }

    public static String attributionSqlCondition() {
        return sqlCondition(true);
    }

    private static EligibilityRule firstFailure(EligibilityRow row, boolean attribution) {
        for (EligibilityRule rule : EligibilityRule.values()) {
            if (rule.isAttributionOnly() && !attribution) {
                continue;
            }
            if (!rule.test(row)) {
                return rule;
            }
        }
        return null;
    }

    private static String sqlCondition(boolean attribution) {
        return Arrays.stream(EligibilityRule.values())
                .filter(rule -> attribution || !rule.isAttributionOnly())
                .map(rule -> "(" + rule.sqlCondition() + ")")
                .collect(Collectors.joining(" AND "));
    }
}

package com.trafficlens.reporting.core.engine;

import com.trafficlens.reporting.core.eligibility.EligibilityRule;
import com.trafficlens.reporting.core.model.DateRange;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Map;

/**
 * CRM 订单资格对账结果
 */
@RegisterForReflection
public record ConsistencyReport(
    DateRange dateRange,
    long rowsScanned,
    long baselineSubscriptions,    // Java 判定 = SQL 聚合
    long attributionSubscriptions, // Java 判定 = SQL 聚合
    Map<EligibilityRule, Long> exclusionsByRule // 按首个不满足规则统计的被排除行数（归因口径）
) {
}

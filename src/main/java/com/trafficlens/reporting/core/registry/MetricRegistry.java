package com.trafficlens.reporting.core.registry;

import com.trafficlens.reporting.core.model.MetricDefinition;
import com.trafficlens.reporting.core.model.ReportFamily;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 指标目录
 * 原始指标在 SQL 中求和/计数；派生指标只由原始指标重新计算
 */
@ApplicationScoped
public class MetricRegistry {

    private static final Map<ReportFamily, List<MetricDefinition>> METRICS;
    private static final Map<ReportFamily, String> DEFAULT_SORT;

    /** 广告与 CRM 合并后才能计算的跨源指标 */
    private static final List<MetricDefinition> CROSS_SOURCE = List.of(
            MetricDefinition.ratio("realCpa", "real_cpa", "cost", "trialsApproved", 2)
    );

    static {
        Map<ReportFamily, List<MetricDefinition>> all = new EnumMap<>(ReportFamily.class);
        all.put(ReportFamily.ADVERTISING, List.of(
                MetricDefinition.raw("cost", "cost", "SUM(m.cost)"),
                MetricDefinition.raw("impressions", "impressions", "SUM(m.impressions)"),
                MetricDefinition.raw("clicks", "clicks", "SUM(m.clicks)"),
                MetricDefinition.raw("conversions", "conversions", "SUM(m.conversions)"),
                MetricDefinition.ratio("ctr", "ctr", "clicks", "impressions", 4),
                MetricDefinition.ratio("cpc", "cpc", "cost", "clicks", 2),
                MetricDefinition.scaledRatio("cpm", "cpm", "cost", "impressions", 1000, 2),
                MetricDefinition.ratio("conversionRate", "conversion_rate", "conversions", "impressions", 6)
        ));
        List<MetricDefinition> crm = List.of(
                MetricDefinition.raw("customers", "customer_count",
                        "COUNT(DISTINCT CASE WHEN DATE(c.date_registered) = DATE(s.date_create) THEN s.customer_id END)"),
                MetricDefinition.raw("subscriptions", "subscription_count", "COUNT(DISTINCT s.id)"),
                MetricDefinition.raw("trials", "trial_count", "COUNT(DISTINCT i.id)"),
                MetricDefinition.raw("trialsApproved", "trials_approved_count",
                        "COUNT(DISTINCT CASE WHEN i.is_marked = 1 THEN i.id END)"),
                MetricDefinition.raw("upsells", "upsell_count", "COUNT(DISTINCT uo.id)"),
                MetricDefinition.raw("upsellsApproved", "upsells_approved_count",
                        "COUNT(DISTINCT CASE WHEN uo.is_marked = 1 THEN uo.id END)"),
                MetricDefinition.ratio("approvalRate", "approval_rate", "trialsApproved", "subscriptions", 4),
                MetricDefinition.ratio("upsellApprovalRate", "upsell_approval_rate", "upsellsApproved", "upsells", 4)
        );
        all.put(ReportFamily.CRM_GEOGRAPHY, crm);
        all.put(ReportFamily.CRM_TRACKING, crm);
        all.put(ReportFamily.ON_PAGE, pageBehaviour("pv", "pageViews", "page_views", ""));
        all.put(ReportFamily.SESSION, pageBehaviour("se", "sessions", "sessions", "entry_"));
        METRICS = Collections.unmodifiableMap(all);

        Map<ReportFamily, String> sort = new EnumMap<>(ReportFamily.class);
        sort.put(ReportFamily.ADVERTISING, "cost");
        sort.put(ReportFamily.CRM_GEOGRAPHY, "subscriptions");
        sort.put(ReportFamily.CRM_TRACKING, "subscriptions");
        sort.put(ReportFamily.ON_PAGE, "pageViews");
        sort.put(ReportFamily.SESSION, "sessions");
        DEFAULT_SORT = Collections.unmodifiableMap(sort);
    }

    /**
     * 页面行为指标：页面浏览表与会话入口表列名只差 entry_ 前缀
     */
    private static List<MetricDefinition> pageBehaviour(String alias, String countId, String countAlias, String prefix) {
        String activeTime = alias + "." + prefix + "active_time_s";
        String heroScroll = alias + "." + prefix + "hero_scroll_passed";
        String formView = alias + "." + prefix + "form_view";
        String formStarted = alias + "." + prefix + "form_started";
        return List.of(
                MetricDefinition.raw(countId, countAlias, "COUNT(*)"),
                MetricDefinition.raw("uniqueVisitors", "unique_visitors", "COUNT(DISTINCT " + alias + ".ff_visitor_id)"),
                MetricDefinition.raw("timedViews", "timed_views",
                        "COUNT(CASE WHEN " + activeTime + " IS NOT NULL THEN 1 END)"),
                MetricDefinition.raw("bouncedViews", "bounced_views",
                        "COUNT(CASE WHEN " + activeTime + " IS NOT NULL AND " + activeTime + " < 5 THEN 1 END)"),
                MetricDefinition.raw("activeTimeTotal", "active_time_total", "COALESCE(SUM(" + activeTime + "), 0)"),
                MetricDefinition.raw("scrollPastHero", "scroll_past_hero",
                        "COUNT(CASE WHEN " + heroScroll + " = TRUE THEN 1 END)"),
                MetricDefinition.raw("formViews", "form_views", "COUNT(CASE WHEN " + formView + " = TRUE THEN 1 END)"),
                MetricDefinition.raw("formStarters", "form_starters",
                        "COUNT(CASE WHEN " + formStarted + " = TRUE THEN 1 END)"),
                MetricDefinition.ratio("bounceRate", "bounce_rate", "bouncedViews", "timedViews", 4),
                MetricDefinition.ratio("avgActiveTime", "avg_active_time", "activeTimeTotal", "timedViews", 2),
                MetricDefinition.ratio("scrollRate", "scroll_rate", "scrollPastHero", countId, 4),
                MetricDefinition.ratio("formViewRate", "form_view_rate", "formViews", countId, 4),
                MetricDefinition.ratio("formStartRate", "form_start_rate", "formStarters", "formViews", 4)
        );
    }

    public List<MetricDefinition> metrics(ReportFamily family) {
        return METRICS.get(family);
    }

    public List<MetricDefinition> rawMetrics(ReportFamily family) {
        return METRICS.get(family).stream().filter(m -> !m.isDerived()).toList();
    }

    public List<MetricDefinition> derivedMetrics(ReportFamily family) {
        return METRICS.get(family).stream().filter(MetricDefinition::isDerived).toList();
    }

    public Optional<MetricDefinition> find(ReportFamily family, String metricId) {
        if (metricId == null) {
            return Optional.empty();
        }
        return METRICS.get(family).stream().filter(m -> m.id().equals(metricId)).findFirst();
    }

    public MetricDefinition require(ReportFamily family, String metricId) {
        return find(family, metricId).orElseThrow(() -> new IllegalStateException(
                "Metric " + metricId + " is not registered for " + family));
    }

    public String defaultSort(ReportFamily family) {
        return DEFAULT_SORT.get(family);
    }

    /**
     * 排序指标解析：未知指标回落到该族默认排序指标
     */
    public MetricDefinition resolveSort(ReportFamily family, String sortBy) {
        return find(family, sortBy).orElseGet(() -> require(family, defaultSort(family)));
    }

    /**
     * 两个族合并后需要重新计算的全部派生指标（含跨源指标）
     */
    public List<MetricDefinition> reconciledDerived(ReportFamily left, ReportFamily right) {
        List<MetricDefinition> derived = new ArrayList<>(derivedMetrics(left));
        derived.addAll(derivedMetrics(right));
        derived.addAll(CROSS_SOURCE);
        return Collections.unmodifiableList(derived);
    }

    /**
     * 合并后的排序指标可能来自任一侧，也可能是跨源指标
     */
    public Optional<MetricDefinition> findReconciled(ReportFamily left, ReportFamily right, String metricId) {
        return find(left, metricId)
                .or(() -> find(right, metricId))
                .or(() -> CROSS_SOURCE.stream().filter(m -> m.id().equals(metricId)).findFirst());
    }
}

package com.trafficlens.reporting.core.registry;

import com.trafficlens.reporting.core.exception.UnknownDimensionException;
import com.trafficlens.reporting.core.model.DimensionDef;
import com.trafficlens.reporting.core.model.ReportFamily;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 维度注册表
 * 逻辑维度ID -> 物理列表达式，每个报表族一份，启动后只读。
 * 所有拼进 SQL 的标识符都必须从这里取得。
 */
@ApplicationScoped
public class DimensionRegistry {

    private static final Map<ReportFamily, Map<String, DimensionDef>> DIMENSIONS;

    static {
        Map<ReportFamily, Map<String, DimensionDef>> all = new EnumMap<>(ReportFamily.class);
        all.put(ReportFamily.ADVERTISING, advertising());
        all.put(ReportFamily.CRM_GEOGRAPHY, crmGeography());
        all.put(ReportFamily.CRM_TRACKING, crmTracking());
        all.put(ReportFamily.ON_PAGE, onPage());
        all.put(ReportFamily.SESSION, session());
        DIMENSIONS = Collections.unmodifiableMap(all);
    }

    private static Map<String, DimensionDef> advertising() {
        return freeze(List.of(
                DimensionDef.of("network", "m.network", "advertising"),
                DimensionDef.labelled("campaign", "m.campaign_id", "MAX(m.campaign_name)", "advertising"),
                DimensionDef.labelled("adset", "m.adset_id", "MAX(m.adset_name)", "advertising"),
                DimensionDef.labelled("ad", "m.ad_id", "MAX(m.ad_name)", "advertising"),
                DimensionDef.temporal("date", "m.date")
        ));
    }

    private static Map<String, DimensionDef> crmGeography() {
        return freeze(List.of(
                DimensionDef.of("country", "c.country", "geography")
                        .withNullCheck("(c.country IS NULL OR c.country = '')"),
                DimensionDef.of("productGroup", "COALESCE(pg.group_name, pg_sub.group_name)", "product"),
                DimensionDef.of("product", "COALESCE(p.product_name, p_sub.product_name)", "product"),
                DimensionDef.of("source", "COALESCE(sr.source, sr_sub.source)", "traffic"),
                DimensionDef.temporal("date", "DATE(s.date_create)")
        ));
    }

    private static Map<String, DimensionDef> crmTracking() {
        return freeze(List.of(
                DimensionDef.of("network", SourceMapping.caseExpression("COALESCE(sr.source, sr_sub.source)"), "advertising"),
                DimensionDef.of("campaign", "s.tracking_id_4", "advertising"),
                DimensionDef.of("adset", "s.tracking_id_2", "advertising"),
                DimensionDef.of("ad", "s.tracking_id", "advertising"),
                DimensionDef.temporal("date", "DATE(s.date_create)")
        ));
    }

    private static Map<String, DimensionDef> onPage() {
        return freeze(List.of(
                DimensionDef.of("urlPath", "pv.url_path", "page"),
                DimensionDef.of("pageType", "pv.page_type", "page"),
                DimensionDef.of("utmSource", "pv.utm_source", "utm"),
                DimensionDef.of("campaign", "CAST(pv.utm_campaign AS TEXT)", "utm"),
                DimensionDef.labelled("adset", "CAST(pv.adset_id AS TEXT)", "MAX(pv.adset_name)", "utm"),
                DimensionDef.labelled("ad", "CAST(pv.ad_id AS TEXT)", "MAX(pv.ad_name)", "utm"),
                DimensionDef.of("utmContent", "pv.utm_content", "utm"),
                DimensionDef.of("utmMedium", "pv.utm_medium", "utm"),
                DimensionDef.of("deviceType", "pv.device_type", "device"),
                DimensionDef.of("osName", "pv.os_name", "device"),
                DimensionDef.of("browserName", "pv.browser_name", "device"),
                DimensionDef.of("countryCode", "pv.country_code", "geo"),
                DimensionDef.temporal("date", "CAST(pv.created_at AS DATE)")
        ));
    }

    private static Map<String, DimensionDef> session() {
        return freeze(List.of(
                DimensionDef.of("entryUrlPath", "se.entry_url_path", "entry"),
                DimensionDef.of("entryPageType", "se.entry_page_type", "entry"),
                DimensionDef.of("entryUtmSource", "se.entry_utm_source", "utm"),
                DimensionDef.of("entryCampaign", "se.entry_utm_campaign", "utm"),
                DimensionDef.of("entryAdset", "se.entry_utm_content", "utm"),
                DimensionDef.of("entryAd", "se.entry_utm_medium", "utm"),
                DimensionDef.of("entryUtmTerm", "se.entry_utm_term", "utm"),
                DimensionDef.of("entryKeyword", "se.entry_keyword", "utm"),
                DimensionDef.of("entryPlacement", "se.entry_placement", "utm"),
                DimensionDef.of("entryReferrer", "se.entry_referrer", "entry"),
                DimensionDef.of("funnelId", "se.ff_funnel_id", "entry"),
                DimensionDef.of("entryCountryCode", "se.entry_country_code", "geo"),
                DimensionDef.of("entryDeviceType", "se.entry_device_type", "device"),
                DimensionDef.of("entryOsName", "se.entry_os_name", "device"),
                DimensionDef.of("entryBrowserName", "se.entry_browser_name", "device"),
                DimensionDef.of("visitNumber", "CAST(se.visit_number AS TEXT)", "entry"),
                DimensionDef.temporal("date", "CAST(se.session_start AS DATE)")
        ));
    }

    private static Map<String, DimensionDef> freeze(List<DimensionDef> defs) {
        Map<String, DimensionDef> map = new LinkedHashMap<>();
        for (DimensionDef def : defs) {
            map.put(def.id(), def);
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * 解析维度定义，未注册直接失败，不做静默忽略
     */
    public DimensionDef resolve(ReportFamily family, String dimensionId) {
        DimensionDef def = dimensionId == null ? null : DIMENSIONS.get(family).get(dimensionId);
        if (def == null) {
            throw new UnknownDimensionException(family, dimensionId);
        }
        return def;
    }

    public String resolveColumn(ReportFamily family, String dimensionId) {
        return resolve(family, dimensionId).column();
    }

    public boolean isRegistered(ReportFamily family, String dimensionId) {
        return dimensionId != null && DIMENSIONS.get(family).containsKey(dimensionId);
    }

    /**
     * 校验整条维度路径
     */
    public List<DimensionDef> resolveAll(ReportFamily family, List<String> dimensionIds) {
        return dimensionIds.stream().map(id -> resolve(family, id)).toList();
    }

    public Map<String, DimensionDef> dimensions(ReportFamily family) {
        return DIMENSIONS.get(family);
    }
}

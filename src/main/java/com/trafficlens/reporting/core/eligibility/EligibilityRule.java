package com.trafficlens.reporting.core.eligibility;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * 订单资格规则，按声明顺序判定，第一条不满足的规则即排除原因。
 * 每条规则同时给出 Java 判定和等价的 SQL 条件，两者必须同步修改。
 */
public enum EligibilityRule {

    SUBSCRIPTION_NOT_DELETED(false,
            "s.deleted = 0",
            row -> isZero(row.subscriptionDeleted())),

    INVOICE_NOT_DELETED(false,
            "i.deleted = 0",
            row -> isZero(row.invoiceDeleted())),

    INVOICE_PRESENT(false,
            "i.id IS NOT NULL AND i.type = " + EligibilityRule.TRIAL_INVOICE_TYPE,
            row -> row.invoiceId() != null
                    && (row.invoiceType() == null || row.invoiceType() == EligibilityRule.TRIAL_INVOICE_TYPE)),

    NOT_UPSELL_CHILD(false,
            "(i.tag IS NULL OR i.tag NOT LIKE '%" + EligibilityRule.UPSELL_TAG_MARKER + "%')",
            row -> row.invoiceTag() == null
                    || !row.invoiceTag().toLowerCase(Locale.ROOT).contains(EligibilityRule.UPSELL_TAG_MARKER)),

    HAS_TRACKING_ID(true,
            trackingCondition("s.tracking_id_4") + " AND " + trackingCondition("s.tracking_id_2")
                    + " AND " + trackingCondition("s.tracking_id"),
            row -> isTrackingId(row.campaignTrackingId())
                    && isTrackingId(row.adsetTrackingId())
                    && isTrackingId(row.adTrackingId())),

    HAS_SOURCE(true,
            "COALESCE(sr.source, sr_sub.source) IS NOT NULL AND TRIM(COALESCE(sr.source, sr_sub.source)) <> ''",
            row -> !trimSpaces(row.source()).isEmpty());

    public static final int TRIAL_INVOICE_TYPE = 1;
    public static final String UPSELL_TAG_MARKER = "parent-sub-id=";

    private final boolean attributionOnly;
    private final String sqlCondition;
    private final Predicate<EligibilityRow> predicate;

    EligibilityRule(boolean attributionOnly, String sqlCondition, Predicate<EligibilityRow> predicate) {
        this.attributionOnly = attributionOnly;
        this.sqlCondition = sqlCondition;
        this.predicate = predicate;
    }

    public boolean isAttributionOnly() {
        return attributionOnly;
    }

    public String sqlCondition() {
        return sqlCondition;
    }

    /**
     * 判定不抛异常，判定过程中的任何异常按不满足处理
     */
    public boolean test(EligibilityRow row) {
        if (row == null) {
            return false;
        }
        try {
            return predicate.test(row);
        } catch (RuntimeException e) {
            return false;
        }
    }

    private static boolean isZero(Integer flag) {
        return flag != null && flag == 0;
    }

    private static boolean isTrackingId(String value) {
        String trimmed = trimSpaces(value);
        return !trimmed.isEmpty() && !"null".equalsIgnoreCase(trimmed);
    }

    private static String trackingCondition(String column) {
        return column + " IS NOT NULL AND TRIM(" + column + ") <> '' AND LOWER(TRIM(" + column + ")) <> 'null'";
    }

    /**
     * 与 SQL TRIM 一致：只去掉首尾空格，null 视为空串
     */
    static String trimSpaces(String value) {
        if (value == null) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == ' ') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == ' ') {
            end--;
        }
        return value.substring(start, end);
    }
}

package com.trafficlens.reporting.core.eligibility;

/**
 * 资格判定输入：订阅 / 试用发票 / 来源扁平化后的一行
 * 任何字段都可能缺失（null），缺失按不合格处理
 */
public record EligibilityRow(
    Long subscriptionId,
    Integer subscriptionDeleted,
    Long invoiceId,
    Integer invoiceType,   // 来自试用发票关联，存在时必须为 1
    Integer invoiceDeleted,
    String invoiceTag,
    String campaignTrackingId, // s.tracking_id_4
    String adsetTrackingId,    // s.tracking_id_2
    String adTrackingId,       // s.tracking_id
    String source              // 发票来源优先，其次订阅来源
) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long subscriptionId;
        private Integer subscriptionDeleted;
        private Long invoiceId;
        private Integer invoiceType;
        private Integer invoiceDeleted;
        private String invoiceTag;
        private String campaignTrackingId;
        private String adsetTrackingId;
        private String adTrackingId;
        private String source;

        public Builder subscriptionId(Long value) {
            this.subscriptionId = value;
            return this;
        }

        public Builder subscriptionDeleted(Integer value) {
            this.subscriptionDeleted = value;
            return this;
        }

        public Builder invoiceId(Long value) {
            this.invoiceId = value;
            return this;
        }

        public Builder invoiceType(Integer value) {
            this.invoiceType = value;
            return this;
        }

        public Builder invoiceDeleted(Integer value) {
            this.invoiceDeleted = value;
            return this;
        }

        public Builder invoiceTag(String value) {
            this.invoiceTag = value;
            return this;
        }

        public Builder trackingIds(String campaign, String adset, String ad) {
            this.campaignTrackingId = campaign;
            this.adsetTrackingId = adset;
            this.adTrackingId = ad;
            return this;
        }

        public Builder source(String value) {
            this.source = value;
            return this;
        }

        public EligibilityRow build() {
            return new EligibilityRow(subscriptionId, subscriptionDeleted, invoiceId, invoiceType, invoiceDeleted,
                    invoiceTag, campaignTrackingId, adsetTrackingId, adTrackingId, source);
        }
    }
}

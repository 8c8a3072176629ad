package com.trafficlens.reporting.core.date;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DateMode {
    /** 保存预设，使用时按当天重新计算 */
    @JsonProperty("relative") RELATIVE,
    /** 保存具体日期 */
    @JsonProperty("absolute") ABSOLUTE,
    /** 不保存日期，使用时取今天 */
    @JsonProperty("none") NONE
}

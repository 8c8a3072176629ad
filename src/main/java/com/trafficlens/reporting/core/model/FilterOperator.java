package com.trafficlens.reporting.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FilterOperator {
    @JsonProperty("equals") EQUALS,
    @JsonProperty("not_equals") NOT_EQUALS,
    @JsonProperty("contains") CONTAINS,
    @JsonProperty("not_contains") NOT_CONTAINS
}

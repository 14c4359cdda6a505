package com.spreadtracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * USD → ZAR conversion rate.
 */
public record FxRate(
    @JsonProperty("rate")       double  rate,
    @JsonProperty("observedAt") Instant observedAt
) {}

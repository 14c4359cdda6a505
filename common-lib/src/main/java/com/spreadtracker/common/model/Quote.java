package com.spreadtracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A single BTC price observed on one exchange.
 *
 * <p>Produced by a price source adapter after its response has been parsed and
 * validated: {@code price} is always finite and positive.
 */
public record Quote(
    @JsonProperty("exchangeName") String   exchangeName,
    @JsonProperty("price")        double   price,
    @JsonProperty("currency")     Currency currency,
    @JsonProperty("observedAt")   Instant  observedAt
) {}

package com.spreadtracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * The part of an {@link Opportunity} that feeds spread history: route identity plus
 * the observed spread percentage.
 */
public record SpreadObservation(
    @JsonProperty("route")            String  route,
    @JsonProperty("buyExchange")      String  buyExchange,
    @JsonProperty("sellExchange")     String  sellExchange,
    @JsonProperty("spreadPercentage") double  spreadPercentage,
    @JsonProperty("observedAt")       Instant observedAt
) {

    public static SpreadObservation from(Opportunity opportunity, Instant observedAt) {
        return new SpreadObservation(opportunity.route(), opportunity.buyExchange(),
            opportunity.sellExchange(), opportunity.spreadPercentage(), observedAt);
    }
}

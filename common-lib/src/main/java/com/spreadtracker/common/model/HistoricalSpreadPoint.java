package com.spreadtracker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One day of spread history as served to chart consumers.
 */
public record HistoricalSpreadPoint(
    @JsonProperty("date")          LocalDate date,
    @JsonProperty("highestSpread") double    highestSpread,
    @JsonProperty("lowestSpread")  double    lowestSpread,
    @JsonProperty("route")         String    route
) {

    public HistoricalSpreadPoint withLowestSpread(double correctedLow) {
        return new HistoricalSpreadPoint(date, highestSpread, correctedLow, route);
    }
}

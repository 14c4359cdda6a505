package com.spreadtracker.marketdata.aggregator;

import com.spreadtracker.common.exception.PriceSourceException;
import com.spreadtracker.common.model.Quote;

/**
 * Settled outcome of one adapter call: exactly one of {@code quote} / {@code error} is set.
 */
public record SourceResult(
    String sourceName,
    Quote quote,
    PriceSourceException error
) {

    public static SourceResult success(String sourceName, Quote quote) {
        return new SourceResult(sourceName, quote, null);
    }

    public static SourceResult failure(String sourceName, PriceSourceException error) {
        return new SourceResult(sourceName, null, error);
    }

    public boolean isSuccess() {
        return quote != null;
    }
}

package com.spreadtracker.marketdata.source;

import java.util.List;

/**
 * Adapters polled together for one {@link MarketGroup}. Adapter order is the encounter
 * order used when opportunities tie on spread.
 */
public record PriceSourceGroup(
    MarketGroup group,
    List<PriceSourceAdapter> adapters
) {

    public List<String> exchangeNames() {
        return adapters.stream().map(PriceSourceAdapter::exchangeName).toList();
    }
}

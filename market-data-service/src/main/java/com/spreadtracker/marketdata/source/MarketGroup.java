package com.spreadtracker.marketdata.source;

import com.spreadtracker.common.model.Currency;
import com.spreadtracker.common.model.Quote;
import com.spreadtracker.marketdata.cache.CacheKey;

import java.util.List;

/**
 * The two sides of every opportunity: USD venues to buy on, ZAR venues to sell on.
 */
public enum MarketGroup {

    INTERNATIONAL(Currency.USD, CacheKey.INTERNATIONAL_PRICES),
    LOCAL(Currency.ZAR, CacheKey.LOCAL_PRICES);

    private final Currency currency;
    private final CacheKey<List<Quote>> cacheKey;

    MarketGroup(Currency currency, CacheKey<List<Quote>> cacheKey) {
        this.currency = currency;
        this.cacheKey = cacheKey;
    }

    public Currency currency() {
        return currency;
    }

    public CacheKey<List<Quote>> cacheKey() {
        return cacheKey;
    }
}

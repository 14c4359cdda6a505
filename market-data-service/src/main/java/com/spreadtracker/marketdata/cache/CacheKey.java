package com.spreadtracker.marketdata.cache;

import com.spreadtracker.common.model.FxRate;
import com.spreadtracker.common.model.Quote;

import java.util.List;

/**
 * Typed cache key. The type parameter ties each key to the value stored under it, so a
 * lookup can never return a value of the wrong shape.
 *
 * <p>The full key set is the constants below; instances are not created elsewhere.
 */
public final class CacheKey<T> {

    public static final CacheKey<List<Quote>> INTERNATIONAL_PRICES = new CacheKey<>("international-prices");
    public static final CacheKey<List<Quote>> LOCAL_PRICES         = new CacheKey<>("local-prices");
    public static final CacheKey<FxRate>      EXCHANGE_RATE        = new CacheKey<>("exchange-rate");

    private final String name;

    private CacheKey(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}

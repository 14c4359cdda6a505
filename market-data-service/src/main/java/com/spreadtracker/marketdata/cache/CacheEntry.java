package com.spreadtracker.marketdata.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Value plus the instant of the successful fetch that produced it. Age is measured from
 * {@code fetchedAt}; reads never refresh it.
 */
public record CacheEntry<T>(
    T value,
    Instant fetchedAt
) {

    public boolean isFresh(Duration ttl, Instant now) {
        return now.isBefore(fetchedAt.plus(ttl));
    }
}

package com.spreadtracker.marketdata.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Time-boxed memoisation with stale-on-error fallback, one entry per {@link CacheKey}.
 *
 * <p><strong>Flow of {@link #getOrFetch}:</strong>
 * <ol>
 *   <li>Entry younger than {@code ttl} → returned as-is, fetcher not invoked.</li>
 *   <li>Otherwise the fetcher runs. Success → stored with a new {@code fetchedAt} and returned.</li>
 *   <li>Failure with any entry present (however old) → the stale value is returned and the
 *       error is logged, not raised.</li>
 *   <li>Failure with no entry at all → the error propagates.</li>
 * </ol>
 *
 * <p>Concurrent callers that miss on the same key join a single in-flight fetch instead of
 * each hitting the upstream. The in-flight slot is released as soon as the fetch settles.
 * The shared fetch is not cancelled when a caller goes away, so its result still lands in
 * the cache for the next read.
 */
@Component
public class RateLimitedCache {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedCache.class);

    private final Map<CacheKey<?>, CacheEntry<?>> store    = new ConcurrentHashMap<>();
    private final Map<CacheKey<?>, Mono<?>>       inFlight = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimitedCache(Clock clock) {
        this.clock = clock;
    }

    public <T> Mono<T> getOrFetch(CacheKey<T> key, Duration ttl, Supplier<Mono<T>> fetcher) {
        return Mono.defer(() -> {
            CacheEntry<T> entry = peek(key);
            if (entry != null && entry.isFresh(ttl, clock.instant())) {
                log.debug("CACHE_HIT key={} fetchedAt={}", key, entry.fetchedAt());
                return Mono.just(entry.value());
            }
            log.info("CACHE_MISS key={} stale={}", key, entry != null);
            return joinOrStartFetch(key, fetcher);
        });
    }

    /**
     * Returns the stored entry for {@code key} regardless of age, or {@code null}.
     */
    @SuppressWarnings("unchecked")
    public <T> CacheEntry<T> peek(CacheKey<T> key) {
        return (CacheEntry<T>) store.get(key);
    }

    // ── per-key single flight ─────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private <T> Mono<T> joinOrStartFetch(CacheKey<T> key, Supplier<Mono<T>> fetcher) {
        return (Mono<T>) inFlight.computeIfAbsent(key, k -> startFetch(key, fetcher));
    }

    private <T> Mono<T> startFetch(CacheKey<T> key, Supplier<Mono<T>> fetcher) {
        return Mono.defer(fetcher)
            .doOnNext(value -> {
                store.put(key, new CacheEntry<>(value, clock.instant()));
                log.info("CACHE_REFRESH key={}", key);
            })
            .onErrorResume(e -> {
                CacheEntry<T> stale = peek(key);
                if (stale == null) {
                    log.warn("CACHE_FETCH_FAILED key={} noFallback=true reason={}", key, e.getMessage());
                    return Mono.error(e);
                }
                log.warn("CACHE_STALE_SERVED key={} fetchedAt={} reason={}",
                         key, stale.fetchedAt(), e.getMessage());
                return Mono.just(stale.value());
            })
            .doFinally(signal -> inFlight.remove(key))
            .cache();
    }
}

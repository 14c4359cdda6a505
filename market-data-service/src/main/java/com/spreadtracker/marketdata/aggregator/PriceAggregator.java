package com.spreadtracker.marketdata.aggregator;

import com.spreadtracker.common.exception.InvalidQuoteException;
import com.spreadtracker.common.exception.PriceSourceException;
import com.spreadtracker.common.exception.SourceUnavailableException;
import com.spreadtracker.common.model.Quote;
import com.spreadtracker.marketdata.source.PriceSourceAdapter;
import com.spreadtracker.marketdata.source.PriceSourceGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fans out to every adapter of a group in parallel and settles all of them.
 *
 * <p>Each call is bounded by {@code market-data.source-timeout}; expiry counts as
 * {@link SourceUnavailableException}. A failing adapter never cancels its siblings and
 * never fails the group: {@link #fetchGroup} returns whatever succeeded, possibly nothing.
 * Results keep adapter order regardless of completion order.
 */
@Component
public class PriceAggregator {

    private static final Logger log = LoggerFactory.getLogger(PriceAggregator.class);

    private final Duration sourceTimeout;

    public PriceAggregator(@Value("${market-data.source-timeout:5s}") Duration sourceTimeout) {
        this.sourceTimeout = sourceTimeout;
    }

    /**
     * Settle-all join over {@code adapters}: one {@link SourceResult} per adapter, in adapter order.
     */
    public Mono<List<SourceResult>> fetchAll(List<PriceSourceAdapter> adapters) {
        return Flux.fromIterable(adapters)
            .flatMapSequential(this::settle)
            .collectList();
    }

    /**
     * Successful quotes of {@code group}. Failures are logged with the adapter's name and
     * dropped; an all-failed group yields an empty list, not an error.
     */
    public Mono<List<Quote>> fetchGroup(PriceSourceGroup group) {
        return fetchAll(group.adapters())
            .map(results -> {
                results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.warn("Price source excluded. group={} exchange={} reason={}",
                                           group.group(), r.sourceName(), r.error().getMessage()));
                List<Quote> quotes = results.stream()
                    .filter(SourceResult::isSuccess)
                    .map(SourceResult::quote)
                    .toList();
                if (quotes.isEmpty()) {
                    log.warn("No price source succeeded. group={} sources={}", group.group(), results.size());
                } else {
                    log.info("Group fetched. group={} succeeded={}/{}", group.group(), quotes.size(), results.size());
                }
                return quotes;
            });
    }

    private Mono<SourceResult> settle(PriceSourceAdapter adapter) {
        String name = adapter.exchangeName();
        return Mono.defer(adapter::fetch)
            .timeout(sourceTimeout)
            .map(quote -> SourceResult.success(name, quote))
            .switchIfEmpty(Mono.fromSupplier(() ->
                SourceResult.failure(name, new InvalidQuoteException(name, "source completed without a quote"))))
            .onErrorResume(e -> Mono.just(SourceResult.failure(name, classify(name, e))));
    }

    private PriceSourceException classify(String name, Throwable e) {
        if (e instanceof PriceSourceException pse) {
            return pse;
        }
        if (e instanceof TimeoutException) {
            return new SourceUnavailableException(name, "no response within " + sourceTimeout.toMillis() + "ms", e);
        }
        return new SourceUnavailableException(name, e.getMessage() != null ? e.getMessage() : e.toString(), e);
    }
}

package com.spreadtracker.marketdata.source;

import com.spreadtracker.common.model.Currency;
import com.spreadtracker.common.model.Quote;
import reactor.core.publisher.Mono;

/**
 * One exchange's price feed.
 *
 * <p>{@link #fetch()} emits exactly one validated {@link Quote} or fails with
 * {@link com.spreadtracker.common.exception.SourceUnavailableException} /
 * {@link com.spreadtracker.common.exception.InvalidQuoteException}. Adapters hold no
 * shared state and never retry; the next aggregation cycle is the retry.
 */
public interface PriceSourceAdapter {

    String exchangeName();

    Currency currency();

    Mono<Quote> fetch();
}

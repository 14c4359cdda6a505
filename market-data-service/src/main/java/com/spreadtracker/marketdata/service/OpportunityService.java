package com.spreadtracker.marketdata.service;

import com.spreadtracker.common.calculator.ArbitrageCalculator;
import com.spreadtracker.common.calculator.ProfitCalculator;
import com.spreadtracker.common.exception.NoFxRateException;
import com.spreadtracker.common.exception.UnknownRouteException;
import com.spreadtracker.common.model.FxRate;
import com.spreadtracker.common.model.Opportunity;
import com.spreadtracker.common.model.ProfitCalculation;
import com.spreadtracker.common.model.Quote;
import com.spreadtracker.common.model.SpreadObservation;
import com.spreadtracker.common.publisher.SpreadObservationPublisher;
import com.spreadtracker.marketdata.aggregator.PriceAggregator;
import com.spreadtracker.marketdata.cache.CacheKey;
import com.spreadtracker.marketdata.cache.RateLimitedCache;
import com.spreadtracker.marketdata.client.FxRateClient;
import com.spreadtracker.marketdata.dto.CalculatorRequest;
import com.spreadtracker.marketdata.source.PriceSourceGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Refresh cycle behind "get current opportunities".
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>FX rate, international quotes and local quotes are requested in parallel, each
 *       through {@link RateLimitedCache} (30 s TTL, stale-on-error).</li>
 *   <li>{@link ArbitrageCalculator} cross-joins and ranks them.</li>
 *   <li>Every opportunity is handed to {@link SpreadObservationPublisher} fire-and-forget;
 *       the response never waits on, or fails because of, spread recording.</li>
 * </ol>
 *
 * <p>Missing quotes degrade to fewer (or zero) opportunities. Only total FX unavailability
 * is an error: {@link NoFxRateException}.
 */
@Service
public class OpportunityService {

    private static final Logger log = LoggerFactory.getLogger(OpportunityService.class);

    private final RateLimitedCache cache;
    private final PriceAggregator aggregator;
    private final FxRateClient fxRateClient;
    private final PriceSourceGroup internationalSources;
    private final PriceSourceGroup localSources;
    private final SpreadObservationPublisher observationPublisher;
    private final Clock clock;
    private final Duration cacheTtl;

    public OpportunityService(RateLimitedCache cache,
                              PriceAggregator aggregator,
                              FxRateClient fxRateClient,
                              PriceSourceGroup internationalSources,
                              PriceSourceGroup localSources,
                              SpreadObservationPublisher observationPublisher,
                              Clock clock,
                              @Value("${market-data.cache-ttl:30s}") Duration cacheTtl) {
        this.cache                = cache;
        this.aggregator           = aggregator;
        this.fxRateClient         = fxRateClient;
        this.internationalSources = internationalSources;
        this.localSources         = localSources;
        this.observationPublisher = observationPublisher;
        this.clock                = clock;
        this.cacheTtl             = cacheTtl;
    }

    public Mono<FxRate> getExchangeRate() {
        return cache.getOrFetch(CacheKey.EXCHANGE_RATE, cacheTtl, fxRateClient::fetchRate)
            .onErrorMap(e -> !(e instanceof NoFxRateException),
                        e -> new NoFxRateException("USD/ZAR rate unavailable and nothing cached", e));
    }

    public Mono<List<Quote>> getInternationalPrices() {
        return groupPrices(internationalSources);
    }

    public Mono<List<Quote>> getLocalPrices() {
        return groupPrices(localSources);
    }

    /**
     * Ranked opportunities for the current market; schedules spread recording as a side effect.
     */
    public Mono<List<Opportunity>> getCurrentOpportunities() {
        return computeOpportunities()
            .doOnNext(this::publishObservations);
    }

    public Mono<ProfitCalculation> calculateProfit(CalculatorRequest request) {
        return computeOpportunities()
            .map(opportunities -> opportunities.stream()
                .filter(o -> o.buyExchange().equals(request.buyExchange())
                          && o.sellExchange().equals(request.sellExchange()))
                .findFirst()
                .orElseThrow(() -> new UnknownRouteException("No live quote pair for "
                    + Opportunity.routeOf(request.buyExchange(), request.sellExchange()))))
            .map(opportunity -> ProfitCalculator.calculate(opportunity, request.amount(),
                request.customBuyFee(), request.customSellFee(), request.transferFee()));
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Mono<List<Quote>> groupPrices(PriceSourceGroup group) {
        return cache.getOrFetch(group.group().cacheKey(), cacheTtl, () -> aggregator.fetchGroup(group));
    }

    private Mono<List<Opportunity>> computeOpportunities() {
        return Mono.zip(getExchangeRate(), getInternationalPrices(), getLocalPrices())
            .map(t -> {
                List<Opportunity> opportunities =
                    ArbitrageCalculator.compute(t.getT2(), t.getT3(), t.getT1().rate());
                log.info("Opportunities computed. usdZar={} international={} local={} opportunities={} best={}",
                         t.getT1().rate(), t.getT2().size(), t.getT3().size(), opportunities.size(),
                         opportunities.isEmpty() ? "none" : opportunities.get(0).route());
                return opportunities;
            });
    }

    private void publishObservations(List<Opportunity> opportunities) {
        if (opportunities.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        List<SpreadObservation> observations = opportunities.stream()
            .map(o -> SpreadObservation.from(o, now))
            .toList();
        try {
            observationPublisher.publish(observations);
        } catch (RuntimeException e) {
            log.warn("Spread observation hand-off failed (non-critical). count={}", observations.size(), e);
        }
    }
}

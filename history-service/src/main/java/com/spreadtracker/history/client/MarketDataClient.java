package com.spreadtracker.history.client;

import com.spreadtracker.common.model.Opportunity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Reads live opportunities from market-data-service.
 *
 * <p>Errors are propagated to the caller, which decides how to degrade.
 */
@Component
public class MarketDataClient implements LiveOpportunitySource {

    private static final Logger log = LoggerFactory.getLogger(MarketDataClient.class);

    private final WebClient marketDataWebClient;
    private final Duration timeout;

    public MarketDataClient(WebClient marketDataWebClient,
                            @Value("${services.market-data.timeout:10s}") Duration timeout) {
        this.marketDataWebClient = marketDataWebClient;
        this.timeout             = timeout;
    }

    @Override
    public Mono<List<Opportunity>> currentOpportunities() {
        return marketDataWebClient.get()
            .uri("/api/v1/market/arbitrage")
            .retrieve()
            .bodyToFlux(Opportunity.class)
            .collectList()
            .timeout(timeout)
            .doOnSuccess(list -> log.info("Live opportunities fetched. count={} best={}",
                list.size(), list.isEmpty() ? "none" : list.get(0).route()))
            .doOnError(e -> log.warn("Live opportunity fetch failed. reason={}", e.getMessage()));
    }
}

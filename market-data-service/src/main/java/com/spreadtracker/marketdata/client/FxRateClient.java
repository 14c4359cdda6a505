package com.spreadtracker.marketdata.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadtracker.common.exception.InvalidQuoteException;
import com.spreadtracker.common.exception.PriceSourceException;
import com.spreadtracker.common.exception.SourceUnavailableException;
import com.spreadtracker.common.model.FxRate;
import com.spreadtracker.marketdata.source.ExchangeResponseFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Fetches the USD → ZAR rate. This is the only place the rate is validated: a missing,
 * non-numeric or non-positive rate fails here and never reaches the calculator.
 */
@Component
public class FxRateClient {

    private static final Logger log = LoggerFactory.getLogger(FxRateClient.class);

    static final String SOURCE_NAME = "exchangerate-api";

    private final WebClient exchangeWebClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String url;
    private final Duration timeout;

    public FxRateClient(WebClient exchangeWebClient,
                        ObjectMapper objectMapper,
                        Clock clock,
                        @Value("${exchanges.fx.url:https://api.exchangerate-api.com/v4/latest/USD}") String url,
                        @Value("${market-data.source-timeout:5s}") Duration timeout) {
        this.exchangeWebClient = exchangeWebClient;
        this.objectMapper      = objectMapper;
        this.clock             = clock;
        this.url               = url;
        this.timeout           = timeout;
    }

    public Mono<FxRate> fetchRate() {
        return exchangeWebClient.get()
            .uri(url)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .onErrorMap(e -> !(e instanceof PriceSourceException),
                        e -> new SourceUnavailableException(SOURCE_NAME, "FX request failed: " + e.getMessage(), e))
            .switchIfEmpty(Mono.error(() -> new InvalidQuoteException(SOURCE_NAME, "empty response body")))
            .map(this::parse)
            .doOnSuccess(rate -> log.info("FX rate fetched. usdZar={}", rate.rate()))
            .doOnError(e -> log.warn("FX rate fetch failed. reason={}", e.getMessage()));
    }

    FxRate parse(String body) {
        try {
            double rate = ExchangeResponseFormat.EXCHANGE_RATE_API.parsePrice(SOURCE_NAME, objectMapper.readTree(body));
            return new FxRate(rate, clock.instant());
        } catch (JsonProcessingException e) {
            throw new InvalidQuoteException(SOURCE_NAME, "unparseable FX response", e);
        }
    }
}

package com.spreadtracker.marketdata.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadtracker.common.exception.InvalidQuoteException;
import com.spreadtracker.common.exception.PriceSourceException;
import com.spreadtracker.common.exception.SourceUnavailableException;
import com.spreadtracker.common.model.Currency;
import com.spreadtracker.common.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * {@link PriceSourceAdapter} backed by a public REST ticker endpoint.
 *
 * <p>The body is read as text and parsed with the adapter's {@link ExchangeResponseFormat},
 * so a shape change upstream surfaces as {@link InvalidQuoteException} rather than a
 * Jackson binding error.
 */
public class HttpPriceSourceAdapter implements PriceSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpPriceSourceAdapter.class);

    private final String exchangeName;
    private final Currency currency;
    private final String url;
    private final ExchangeResponseFormat format;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HttpPriceSourceAdapter(String exchangeName, Currency currency, String url,
                                  ExchangeResponseFormat format, WebClient webClient,
                                  ObjectMapper objectMapper, Clock clock) {
        this.exchangeName = exchangeName;
        this.currency     = currency;
        this.url          = url;
        this.format       = format;
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public String exchangeName() {
        return exchangeName;
    }

    @Override
    public Currency currency() {
        return currency;
    }

    @Override
    public Mono<Quote> fetch() {
        return webClient.get()
            .uri(url)
            .retrieve()
            .bodyToMono(String.class)
            .onErrorMap(e -> !(e instanceof PriceSourceException), this::unavailable)
            .switchIfEmpty(Mono.error(() -> new InvalidQuoteException(exchangeName, "empty response body")))
            .map(this::toQuote)
            .doOnNext(q -> log.debug("Price fetched. exchange={} price={} currency={}",
                                     exchangeName, q.price(), currency));
    }

    Quote toQuote(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidQuoteException(exchangeName, "unparseable response body", e);
        }
        double price = format.parsePrice(exchangeName, root);
        return new Quote(exchangeName, price, currency, clock.instant());
    }

    private SourceUnavailableException unavailable(Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            return new SourceUnavailableException(exchangeName,
                "HTTP " + wcre.getStatusCode().value() + " from " + url, e);
        }
        return new SourceUnavailableException(exchangeName, "request to " + url + " failed: " + e.getMessage(), e);
    }
}

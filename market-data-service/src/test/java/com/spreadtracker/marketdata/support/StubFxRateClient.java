package com.spreadtracker.marketdata.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spreadtracker.common.model.FxRate;
import com.spreadtracker.marketdata.client.FxRateClient;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * {@link FxRateClient} whose {@code fetchRate()} answer is set by the test.
 */
public class StubFxRateClient extends FxRateClient {

    private final AtomicInteger calls = new AtomicInteger();
    private volatile Supplier<Mono<FxRate>> behaviour;

    public StubFxRateClient(Clock clock, double rate) {
        super(WebClient.create(), new ObjectMapper(), clock, "http://localhost/unused", Duration.ofSeconds(1));
        respondWith(rate, clock);
    }

    public void respondWith(double rate, Clock clock) {
        this.behaviour = () -> Mono.fromSupplier(() -> new FxRate(rate, clock.instant()));
    }

    public void failWith(RuntimeException error) {
        this.behaviour = () -> Mono.error(error);
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public Mono<FxRate> fetchRate() {
        calls.incrementAndGet();
        return behaviour.get();
    }
}

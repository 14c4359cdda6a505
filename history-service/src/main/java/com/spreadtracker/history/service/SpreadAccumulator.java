package com.spreadtracker.history.service;

import com.spreadtracker.common.model.SpreadObservation;
import com.spreadtracker.history.store.SpreadStatisticsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Folds spread observations into per-day and per-hour running statistics.
 *
 * <p>Keyed by (today, route) and (current hour, route) on the injected UTC clock.
 * Recording is best-effort: store failures are logged at WARN and swallowed, and the
 * returned {@link Mono} always completes normally.
 */
@Service
public class SpreadAccumulator {

    private static final Logger log = LoggerFactory.getLogger(SpreadAccumulator.class);

    private final SpreadStatisticsStore store;
    private final Clock clock;

    public SpreadAccumulator(SpreadStatisticsStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Mono<Void> record(SpreadObservation observation) {
        if (!isRecordable(observation)) {
            log.warn("Spread observation skipped. reason=incomplete observation={}", observation);
            return Mono.empty();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate day = now.toLocalDate();
        LocalDateTime hour = now.truncatedTo(ChronoUnit.HOURS);

        Mono<Void> daily = Mono.defer(() -> store.accumulateDaily(day, observation))
            .onErrorResume(e -> {
                log.warn("Daily spread accumulation failed (non-fatal). date={} route={}",
                         day, observation.route(), e);
                return Mono.empty();
            });

        Mono<Void> hourly = Mono.defer(() -> store.accumulateHourly(hour, observation))
            .onErrorResume(e -> {
                log.warn("Hourly spread accumulation failed (non-fatal). hour={} route={}",
                         hour, observation.route(), e);
                return Mono.empty();
            });

        return Mono.when(daily, hourly);
    }

    /**
     * Records a batch in order. Completes once every observation has been attempted.
     */
    public Mono<Void> recordAll(List<SpreadObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(observations)
            .concatMap(this::record)
            .then()
            .doOnSuccess(v -> log.debug("Spread observations recorded. count={}", observations.size()));
    }

    private static boolean isRecordable(SpreadObservation observation) {
        return observation != null
            && observation.route() != null
            && !observation.route().isBlank()
            && Double.isFinite(observation.spreadPercentage());
    }
}

package com.spreadtracker.history.store;

import com.spreadtracker.common.model.SpreadObservation;
import com.spreadtracker.history.model.DailySpread;
import com.spreadtracker.history.model.HourlySpread;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Persistence seam for running spread statistics.
 *
 * <p>Active implementation is selected by {@code storage.mode}:
 * <ul>
 *   <li>{@code r2dbc} (default): {@link R2dbcSpreadStatisticsStore}, PostgreSQL upserts</li>
 *   <li>{@code memory}: {@link InMemorySpreadStatisticsStore}, process-local maps</li>
 * </ul>
 * Both apply the same per-key fold: create on first observation, then max/min/online-mean.
 */
public interface SpreadStatisticsStore {

    Mono<Void> accumulateDaily(LocalDate date, SpreadObservation observation);

    Mono<Void> accumulateHourly(LocalDateTime hourTimestamp, SpreadObservation observation);

    /** Rows with {@code from <= date <= to}, ordered by date then route. */
    Flux<DailySpread> findDaily(LocalDate from, LocalDate to);

    /** Rows with {@code hourTimestamp >= from}, ordered by hour then route. */
    Flux<HourlySpread> findHourlySince(LocalDateTime from);
}

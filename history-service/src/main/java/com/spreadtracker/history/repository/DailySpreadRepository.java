package com.spreadtracker.history.repository;

import com.spreadtracker.history.model.DailySpread;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface DailySpreadRepository extends ReactiveCrudRepository<DailySpread, Long> {

    Flux<DailySpread> findByDateBetweenOrderByDateAscRouteAsc(LocalDate from, LocalDate to);

    /**
     * Atomic UPSERT: creates the {@code (date, route)} row from a single observation, or
     * folds {@code spread} into the existing running max/min/mean.
     *
     * @param date   UTC calendar day of the observation
     * @param route  "buy → sell" label, part of the natural key
     * @param spread observed spread percentage
     */
    @Modifying
    @Query("""
        INSERT INTO daily_spreads
            (spread_date, route, buy_exchange, sell_exchange,
             highest_spread, lowest_spread, average_spread, data_points, updated_at)
        VALUES
            (:date, :route, :buyExchange, :sellExchange,
             :spread, :spread, :spread, 1, NOW())
        ON CONFLICT (spread_date, route) DO UPDATE SET
            highest_spread = GREATEST(daily_spreads.highest_spread, :spread),
            lowest_spread  = LEAST(daily_spreads.lowest_spread, :spread),
            average_spread = (daily_spreads.average_spread * daily_spreads.data_points + :spread)
                             / (daily_spreads.data_points + 1),
            data_points    = daily_spreads.data_points + 1,
            updated_at     = NOW()
        """)
    Mono<Void> accumulate(LocalDate date, String route, String buyExchange,
                          String sellExchange, double spread);
}

package com.spreadtracker.history.repository;

import com.spreadtracker.history.model.HourlySpread;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface HourlySpreadRepository extends ReactiveCrudRepository<HourlySpread, Long> {

    Flux<HourlySpread> findByHourTimestampGreaterThanEqualOrderByHourTimestampAscRouteAsc(LocalDateTime from);

    /**
     * Hourly counterpart of {@link DailySpreadRepository#accumulate}.
     */
    @Modifying
    @Query("""
        INSERT INTO hourly_spreads
            (hour_timestamp, route, buy_exchange, sell_exchange,
             highest_spread, lowest_spread, average_spread, data_points, updated_at)
        VALUES
            (:hourTimestamp, :route, :buyExchange, :sellExchange,
             :spread, :spread, :spread, 1, NOW())
        ON CONFLICT (hour_timestamp, route) DO UPDATE SET
            highest_spread = GREATEST(hourly_spreads.highest_spread, :spread),
            lowest_spread  = LEAST(hourly_spreads.lowest_spread, :spread),
            average_spread = (hourly_spreads.average_spread * hourly_spreads.data_points + :spread)
                             / (hourly_spreads.data_points + 1),
            data_points    = hourly_spreads.data_points + 1,
            updated_at     = NOW()
        """)
    Mono<Void> accumulate(LocalDateTime hourTimestamp, String route, String buyExchange,
                          String sellExchange, double spread);
}

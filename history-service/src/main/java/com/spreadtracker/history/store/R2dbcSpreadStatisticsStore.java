package com.spreadtracker.history.store;

import com.spreadtracker.common.model.SpreadObservation;
import com.spreadtracker.history.model.DailySpread;
import com.spreadtracker.history.model.HourlySpread;
import com.spreadtracker.history.repository.DailySpreadRepository;
import com.spreadtracker.history.repository.HourlySpreadRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * PostgreSQL-backed store. Each accumulation is a single {@code INSERT ... ON CONFLICT}
 * statement, so concurrent observations of the same route never lose an update.
 */
@Component
@ConditionalOnProperty(name = "storage.mode", havingValue = "r2dbc", matchIfMissing = true)
public class R2dbcSpreadStatisticsStore implements SpreadStatisticsStore {

    private final DailySpreadRepository dailyRepository;
    private final HourlySpreadRepository hourlyRepository;

    public R2dbcSpreadStatisticsStore(DailySpreadRepository dailyRepository,
                                      HourlySpreadRepository hourlyRepository) {
        this.dailyRepository  = dailyRepository;
        this.hourlyRepository = hourlyRepository;
    }

    @Override
    public Mono<Void> accumulateDaily(LocalDate date, SpreadObservation observation) {
        return dailyRepository.accumulate(date, observation.route(), observation.buyExchange(),
            observation.sellExchange(), observation.spreadPercentage());
    }

    @Override
    public Mono<Void> accumulateHourly(LocalDateTime hourTimestamp, SpreadObservation observation) {
        return hourlyRepository.accumulate(hourTimestamp, observation.route(), observation.buyExchange(),
            observation.sellExchange(), observation.spreadPercentage());
    }

    @Override
    public Flux<DailySpread> findDaily(LocalDate from, LocalDate to) {
        return dailyRepository.findByDateBetweenOrderByDateAscRouteAsc(from, to);
    }

    @Override
    public Flux<HourlySpread> findHourlySince(LocalDateTime from) {
        return hourlyRepository.findByHourTimestampGreaterThanEqualOrderByHourTimestampAscRouteAsc(from);
    }
}

package com.spreadtracker.history.service;

import com.spreadtracker.common.exception.InvalidRangeException;
import com.spreadtracker.history.model.HourlySpread;
import com.spreadtracker.history.store.SpreadStatisticsStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Stored hourly buckets for the last N hours, oldest first. Served as stored.
 */
@Service
public class HourlySpreadService {

    public static final int DEFAULT_HOURS = 24;
    public static final int MAX_HOURS     = 168;

    private final SpreadStatisticsStore store;
    private final Clock clock;

    public HourlySpreadService(SpreadStatisticsStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * @param hours window length including the current hour, 1..168
     */
    public Flux<HourlySpread> getHourlySpread(int hours) {
        if (hours < 1 || hours > MAX_HOURS) {
            return Flux.error(new InvalidRangeException("hours must be between 1 and " + MAX_HOURS));
        }
        LocalDateTime from = LocalDateTime.now(clock).truncatedTo(ChronoUnit.HOURS).minusHours(hours - 1L);
        return store.findHourlySince(from);
    }
}

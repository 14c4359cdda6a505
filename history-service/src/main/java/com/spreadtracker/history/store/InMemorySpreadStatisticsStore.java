package com.spreadtracker.history.store;

import com.spreadtracker.common.model.RunningSpreadStats;
import com.spreadtracker.common.model.SpreadObservation;
import com.spreadtracker.history.model.DailySpread;
import com.spreadtracker.history.model.HourlySpread;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store for running without a database. Data is lost on restart.
 *
 * <p>{@link ConcurrentHashMap#compute} serialises updates per key, which gives the same
 * atomicity as the SQL upsert. Stored rows are replaced, never mutated, so readers only
 * ever see complete snapshots.
 */
@Component
@ConditionalOnProperty(name = "storage.mode", havingValue = "memory")
public class InMemorySpreadStatisticsStore implements SpreadStatisticsStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySpreadStatisticsStore.class);

    private record DayKey(LocalDate date, String route) {}

    private record HourKey(LocalDateTime hourTimestamp, String route) {}

    private final Map<DayKey, DailySpread>   daily  = new ConcurrentHashMap<>();
    private final Map<HourKey, HourlySpread> hourly = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Clock clock;

    public InMemorySpreadStatisticsStore(Clock clock) {
        this.clock = clock;
        log.info("Spread statistics held in memory. storage.mode=memory");
    }

    @Override
    public Mono<Void> accumulateDaily(LocalDate date, SpreadObservation observation) {
        return Mono.fromRunnable(() -> daily.compute(new DayKey(date, observation.route()),
            (key, existing) -> foldDaily(existing, date, observation)));
    }

    @Override
    public Mono<Void> accumulateHourly(LocalDateTime hourTimestamp, SpreadObservation observation) {
        return Mono.fromRunnable(() -> hourly.compute(new HourKey(hourTimestamp, observation.route()),
            (key, existing) -> foldHourly(existing, hourTimestamp, observation)));
    }

    @Override
    public Flux<DailySpread> findDaily(LocalDate from, LocalDate to) {
        return Flux.defer(() -> {
            List<DailySpread> rows = daily.values().stream()
                .filter(d -> !d.getDate().isBefore(from) && !d.getDate().isAfter(to))
                .sorted(Comparator.comparing(DailySpread::getDate).thenComparing(DailySpread::getRoute))
                .toList();
            return Flux.fromIterable(rows);
        });
    }

    @Override
    public Flux<HourlySpread> findHourlySince(LocalDateTime from) {
        return Flux.defer(() -> {
            List<HourlySpread> rows = hourly.values().stream()
                .filter(h -> !h.getHourTimestamp().isBefore(from))
                .sorted(Comparator.comparing(HourlySpread::getHourTimestamp).thenComparing(HourlySpread::getRoute))
                .toList();
            return Flux.fromIterable(rows);
        });
    }

    // ── fold ──────────────────────────────────────────────────────────────────

    private DailySpread foldDaily(DailySpread existing, LocalDate date, SpreadObservation obs) {
        RunningSpreadStats stats = existing == null
            ? RunningSpreadStats.first(obs.spreadPercentage())
            : new RunningSpreadStats(existing.getHighestSpread(), existing.getLowestSpread(),
                                     existing.getAverageSpread(), existing.getDataPoints())
                .plus(obs.spreadPercentage());

        DailySpread row = new DailySpread();
        row.setId(existing == null ? ids.incrementAndGet() : existing.getId());
        row.setDate(date);
        row.setRoute(obs.route());
        row.setBuyExchange(obs.buyExchange());
        row.setSellExchange(obs.sellExchange());
        row.setHighestSpread(stats.highestSpread());
        row.setLowestSpread(stats.lowestSpread());
        row.setAverageSpread(stats.averageSpread());
        row.setDataPoints(stats.dataPoints());
        row.setUpdatedAt(LocalDateTime.now(clock));
        return row;
    }

    private HourlySpread foldHourly(HourlySpread existing, LocalDateTime hourTimestamp, SpreadObservation obs) {
        RunningSpreadStats stats = existing == null
            ? RunningSpreadStats.first(obs.spreadPercentage())
            : new RunningSpreadStats(existing.getHighestSpread(), existing.getLowestSpread(),
                                     existing.getAverageSpread(), existing.getDataPoints())
                .plus(obs.spreadPercentage());

        HourlySpread row = new HourlySpread();
        row.setId(existing == null ? ids.incrementAndGet() : existing.getId());
        row.setHourTimestamp(hourTimestamp);
        row.setRoute(obs.route());
        row.setBuyExchange(obs.buyExchange());
        row.setSellExchange(obs.sellExchange());
        row.setHighestSpread(stats.highestSpread());
        row.setLowestSpread(stats.lowestSpread());
        row.setAverageSpread(stats.averageSpread());
        row.setDataPoints(stats.dataPoints());
        row.setUpdatedAt(LocalDateTime.now(clock));
        return row;
    }
}

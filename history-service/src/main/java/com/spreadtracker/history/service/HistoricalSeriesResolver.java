package com.spreadtracker.history.service;

import com.spreadtracker.common.model.HistoricalSpreadPoint;
import com.spreadtracker.history.client.LiveOpportunitySource;
import com.spreadtracker.history.model.DailySpread;
import com.spreadtracker.history.store.SpreadStatisticsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Answers "N days of spread history" from stored daily records, synthesizing when they
 * are too sparse.
 *
 * <p><strong>Resolution order:</strong>
 * <ol>
 *   <li>Load stored records for the range; {@code coverage = distinct dates / requested days}.</li>
 *   <li>Coverage at or above {@code history.coverage-threshold} with at least one record:
 *       return the stored records, each repaired if {@code lowestSpread >= highestSpread}.</li>
 *   <li>Otherwise ask market-data for live opportunities and synthesize around the best one,
 *       or around the fixed baseline when there are none.</li>
 *   <li>Live call failed: synthesize the flatter fallback series.</li>
 * </ol>
 * The result never errors for a valid range and every point satisfies
 * {@code lowestSpread <= highestSpread}.
 */
@Service
public class HistoricalSeriesResolver {

    private static final Logger log = LoggerFactory.getLogger(HistoricalSeriesResolver.class);

    static final double REPAIRED_LOW_FLOOR = 0.5;
    static final double REPAIR_GAP         = 0.2;

    private final SpreadStatisticsStore store;
    private final LiveOpportunitySource liveOpportunities;
    private final SyntheticSpreadGenerator generator;
    private final Clock clock;
    private final double coverageThreshold;

    public HistoricalSeriesResolver(SpreadStatisticsStore store,
                                    LiveOpportunitySource liveOpportunities,
                                    SyntheticSpreadGenerator generator,
                                    Clock clock,
                                    @Value("${history.coverage-threshold:0.3}") double coverageThreshold) {
        this.store             = store;
        this.liveOpportunities = liveOpportunities;
        this.generator         = generator;
        this.clock             = clock;
        this.coverageThreshold = coverageThreshold;
    }

    public Mono<HistoricalSeries> resolve(HistoryPeriod period) {
        return Mono.defer(() -> resolve(DateRange.lastDays(period, LocalDate.now(clock))));
    }

    public Mono<HistoricalSeries> resolve(DateRange range) {
        return store.findDaily(range.start(), range.end())
            .collectList()
            .flatMap(records -> {
                long distinctDates = records.stream().map(DailySpread::getDate).distinct().count();
                double coverage = (double) distinctDates / range.requestedDays();
                log.info("Historical coverage. start={} end={} datesWithData={} requestedDays={} coverage={}",
                         range.start(), range.end(), distinctDates, range.requestedDays(),
                         String.format("%.3f", coverage));

                if (!records.isEmpty() && coverage >= coverageThreshold) {
                    List<HistoricalSpreadPoint> points = records.stream()
                        .map(HistoricalSeriesResolver::toPoint)
                        .map(HistoricalSeriesResolver::repair)
                        .toList();
                    return Mono.just(new HistoricalSeries(points, HistoricalSeries.Source.STORED, coverage));
                }
                return synthesize(range, coverage);
            })
            .doOnSuccess(series -> log.info("Historical series resolved. start={} end={} source={} points={}",
                range.start(), range.end(), series.source(), series.points().size()));
    }

    private Mono<HistoricalSeries> synthesize(DateRange range, double coverage) {
        return Mono.defer(liveOpportunities::currentOpportunities)
            .map(opportunities -> opportunities.isEmpty()
                ? new HistoricalSeries(validated(generator.aroundBaseline(range)),
                                       HistoricalSeries.Source.SYNTHETIC_BASELINE, coverage)
                : new HistoricalSeries(validated(generator.aroundOpportunity(range, opportunities.get(0))),
                                       HistoricalSeries.Source.SYNTHETIC_LIVE, coverage))
            .onErrorResume(e -> {
                log.warn("Live opportunities unavailable, using fallback series. start={} end={} reason={}",
                         range.start(), range.end(), e.getMessage());
                return Mono.just(new HistoricalSeries(validated(generator.fallback(range)),
                                                      HistoricalSeries.Source.SYNTHETIC_FALLBACK, coverage));
            });
    }

    private static List<HistoricalSpreadPoint> validated(List<HistoricalSpreadPoint> points) {
        return points.stream()
            .map(p -> p.lowestSpread() < p.highestSpread()
                ? p
                : corrected(p, Math.min(p.highestSpread(), SyntheticSpreadGenerator.round2(repairedLow(p)))))
            .toList();
    }

    /**
     * {@code low >= high} is corrupt: low becomes {@code max(0.5, high - 0.2)}, capped at
     * {@code high}. Stored values are not rounded.
     */
    static HistoricalSpreadPoint repair(HistoricalSpreadPoint point) {
        if (point.lowestSpread() < point.highestSpread()) {
            return point;
        }
        return corrected(point, Math.min(point.highestSpread(), repairedLow(point)));
    }

    private static double repairedLow(HistoricalSpreadPoint point) {
        return Math.max(REPAIRED_LOW_FLOOR, point.highestSpread() - REPAIR_GAP);
    }

    private static HistoricalSpreadPoint corrected(HistoricalSpreadPoint point, double low) {
        log.warn("Corrected invalid spread data. date={} route={} low={} high={} correctedLow={}",
                 point.date(), point.route(), point.lowestSpread(), point.highestSpread(), low);
        return point.withLowestSpread(low);
    }

    private static HistoricalSpreadPoint toPoint(DailySpread record) {
        return new HistoricalSpreadPoint(record.getDate(), record.getHighestSpread(),
                                         record.getLowestSpread(), record.getRoute());
    }
}

package com.spreadtracker.history.service;

import com.spreadtracker.common.model.SpreadObservation;
import com.spreadtracker.history.model.DailySpread;
import com.spreadtracker.history.model.HourlySpread;
import com.spreadtracker.history.store.InMemorySpreadStatisticsStore;
import com.spreadtracker.history.support.CannedSpreadStatisticsStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpreadAccumulatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:42:17Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 1);

    private static SpreadObservation obs(String route, double spread) {
        String[] legs = route.split(" → ");
        return new SpreadObservation(route, legs[0], legs[1], spread, NOW);
    }

    @Nested
    @DisplayName("Online fold")
    class OnlineFold {

        private final InMemorySpreadStatisticsStore store = new InMemorySpreadStatisticsStore(CLOCK);
        private final SpreadAccumulator accumulator = new SpreadAccumulator(store, CLOCK);

        @Test
        @DisplayName("[1.0, 3.0, 2.0] on one route → high 3.0, low 1.0, avg 2.0, 3 points")
        void extremaAndMean() {
            accumulator.record(obs("Binance → VALR", 1.0)).block();
            accumulator.record(obs("Binance → VALR", 3.0)).block();
            accumulator.record(obs("Binance → VALR", 2.0)).block();

            List<DailySpread> rows = store.findDaily(TODAY, TODAY).collectList().block();
            assertEquals(1, rows.size());
            DailySpread row = rows.get(0);
            assertEquals(3.0, row.getHighestSpread(), 1e-9);
            assertEquals(1.0, row.getLowestSpread(), 1e-9);
            assertEquals(2.0, row.getAverageSpread(), 1e-9);
            assertEquals(3, row.getDataPoints());
            assertEquals("Binance", row.getBuyExchange());
            assertEquals("VALR", row.getSellExchange());
        }

        @Test
        @DisplayName("first observation creates the row with high = low = avg")
        void firstObservation() {
            accumulator.record(obs("Kraken → LUNO", 0.75)).block();

            DailySpread row = store.findDaily(TODAY, TODAY).blockFirst();
            assertEquals(0.75, row.getHighestSpread(), 1e-9);
            assertEquals(0.75, row.getLowestSpread(), 1e-9);
            assertEquals(0.75, row.getAverageSpread(), 1e-9);
            assertEquals(1, row.getDataPoints());
        }

        @Test
        @DisplayName("routes are accumulated independently")
        void routesIndependent() {
            accumulator.recordAll(List.of(
                obs("Binance → VALR", 1.0),
                obs("Kraken → LUNO", 5.0),
                obs("Binance → VALR", 2.0)
            )).block();

            List<DailySpread> rows = store.findDaily(TODAY, TODAY).collectList().block();
            assertEquals(2, rows.size());
            assertEquals(2, rows.get(0).getDataPoints());
            assertEquals(1, rows.get(1).getDataPoints());
            assertEquals(5.0, rows.get(1).getHighestSpread(), 1e-9);
        }

        @Test
        @DisplayName("the same observation is folded into the current hour bucket")
        void hourlyBucket() {
            accumulator.record(obs("Binance → VALR", 1.0)).block();
            accumulator.record(obs("Binance → VALR", 3.0)).block();

            List<HourlySpread> hours = store.findHourlySince(LocalDateTime.of(2024, 5, 1, 0, 0))
                .collectList().block();
            assertEquals(1, hours.size());
            assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0), hours.get(0).getHourTimestamp());
            assertEquals(2, hours.get(0).getDataPoints());
            assertEquals(2.0, hours.get(0).getAverageSpread(), 1e-9);
        }

        @Test
        @DisplayName("a new UTC day starts a new row")
        void dayRollover() {
            accumulator.record(obs("Binance → VALR", 1.0)).block();
            Clock tomorrow = Clock.fixed(Instant.parse("2024-05-02T00:00:01Z"), ZoneOffset.UTC);
            new SpreadAccumulator(store, tomorrow).record(obs("Binance → VALR", 4.0)).block();

            List<DailySpread> rows = store.findDaily(TODAY, TODAY.plusDays(1)).collectList().block();
            assertEquals(2, rows.size());
            assertEquals(1.0, rows.get(0).getHighestSpread(), 1e-9);
            assertEquals(4.0, rows.get(1).getHighestSpread(), 1e-9);
        }

        @Test
        @DisplayName("observation without a route or with a non-finite spread is skipped")
        void incompleteSkipped() {
            StepVerifier.create(accumulator.record(new SpreadObservation(null, "A", "B", 1.0, NOW)))
                .verifyComplete();
            StepVerifier.create(accumulator.record(obs("Binance → VALR", Double.NaN)))
                .verifyComplete();

            assertEquals(0L, store.findDaily(TODAY, TODAY).count().block());
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureIsolation {

        private final CannedSpreadStatisticsStore store = new CannedSpreadStatisticsStore();
        private final SpreadAccumulator accumulator = new SpreadAccumulator(store, CLOCK);

        @Test
        @DisplayName("store error signal is logged, not propagated")
        void asyncFailure() {
            store.failWritesWith(new IllegalStateException("connection refused"), false);

            StepVerifier.create(accumulator.record(obs("Binance → VALR", 1.0)))
                .verifyComplete();
            assertEquals(2, store.writes());
        }

        @Test
        @DisplayName("store throwing on call is logged, not propagated")
        void syncFailure() {
            store.failWritesWith(new IllegalStateException("pool exhausted"), true);

            StepVerifier.create(accumulator.recordAll(List.of(
                    obs("Binance → VALR", 1.0),
                    obs("Kraken → LUNO", 2.0))))
                .verifyComplete();
            assertEquals(4, store.writes());
        }
    }
}

package com.spreadtracker.history.service;

import com.spreadtracker.common.model.HistoricalSpreadPoint;
import com.spreadtracker.common.model.Opportunity;
import com.spreadtracker.history.support.CannedSpreadStatisticsStore;
import com.spreadtracker.history.support.StubLiveOpportunities;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.spreadtracker.history.support.CannedSpreadStatisticsStore.row;
import static org.junit.jupiter.api.Assertions.*;

class HistoricalSeriesResolverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 1);
    private static final String ROUTE = "Binance → VALR";
    private static final Opportunity BEST = Opportunity.of("Binance", "VALR", 1_140_000, 1_150_000);

    private static HistoricalSeriesResolver resolver(CannedSpreadStatisticsStore store, StubLiveOpportunities live) {
        return new HistoricalSeriesResolver(store, live, new SyntheticSpreadGenerator(), CLOCK, 0.3);
    }

    private static void assertWellFormed(List<HistoricalSpreadPoint> points) {
        for (HistoricalSpreadPoint p : points) {
            assertTrue(p.lowestSpread() <= p.highestSpread(),
                () -> p.date() + ": low " + p.lowestSpread() + " > high " + p.highestSpread());
        }
    }

    @Nested
    @DisplayName("Coverage threshold")
    class Coverage {

        @Test
        @DisplayName("3 of 7 days stored (0.43) → stored rows returned, live never consulted")
        void sufficientCoverage() {
            CannedSpreadStatisticsStore store = new CannedSpreadStatisticsStore()
                .with(row(TODAY, ROUTE, 1.2, 0.8))
                .with(row(TODAY.minusDays(2), ROUTE, 1.1, 0.9))
                .with(row(TODAY.minusDays(4), ROUTE, 1.4, 1.0));
            StubLiveOpportunities live = StubLiveOpportunities.returning(BEST);

            HistoricalSeries series = resolver(store, live).resolve(HistoryPeriod.SEVEN_DAYS).block();

            assertEquals(HistoricalSeries.Source.STORED, series.source());
            assertEquals(3, series.points().size());
            assertEquals(3.0 / 7, series.coverageRatio(), 1e-9);
            assertEquals(0, live.calls());
        }

        @Test
        @DisplayName("2 of 7 days stored (0.29) → synthesized, one point per day")
        void insufficientCoverage() {
            CannedSpreadStatisticsStore store = new CannedSpreadStatisticsStore()
                .with(row(TODAY, ROUTE, 1.2, 0.8))
                .with(row(TODAY.minusDays(1), ROUTE, 1.1, 0.9));

            HistoricalSeries series = resolver(store, StubLiveOpportunities.returning(BEST))
                .resolve(HistoryPeriod.SEVEN_DAYS).block();

            assertEquals(HistoricalSeries.Source.SYNTHETIC_LIVE, series.source());
            assertEquals(7, series.points().size());
            assertEquals(TODAY.minusDays(6), series.points().get(0).date());
            assertEquals(TODAY, series.points().get(6).date());
            assertTrue(series.points().stream().allMatch(p -> p.route().equals(ROUTE)));
        }

        @Test
        @DisplayName("exactly at the threshold (9 of 30 days) counts as sufficient")
        void boundaryIsInclusive() {
            CannedSpreadStatisticsStore store = new CannedSpreadStatisticsStore();
            for (int i = 0; i < 9; i++) {
                store.with(row(TODAY.minusDays(i * 3L), ROUTE, 1.0, 0.5));
            }

            HistoricalSeries series = resolver(store, StubLiveOpportunities.returning(BEST))
                .resolve(HistoryPeriod.THIRTY_DAYS).block();

            assertEquals(HistoricalSeries.Source.STORED, series.source());
            assertEquals(9, series.points().size());
        }

        @Test
        @DisplayName("several routes on the same date count as one covered day")
        void distinctDates() {
            CannedSpreadStatisticsStore store = new CannedSpreadStatisticsStore()
                .with(row(TODAY, ROUTE, 1.2, 0.8))
                .with(row(TODAY, "Kraken → LUNO", 1.5, 0.7))
                .with(row(TODAY, "Bitstamp → AltcoinTrader", 0.9, 0.2));

            HistoricalSeries series = resolver(store, StubLiveOpportunities.returning(BEST))
                .resolve(HistoryPeriod.SEVEN_DAYS).block();

            assertEquals(1.0 / 7, series.coverageRatio(), 1e-9);
            assertNotEquals(HistoricalSeries.Source.STORED, series.source());
        }

        @Test
        @DisplayName("1d with a row for today is full coverage")
        void oneDay() {
            CannedSpreadStatisticsStore store = new CannedSpreadStatisticsStore()
                .with(row(TODAY, ROUTE, 1.2, 0.8));

            HistoricalSeries series = resolver(store, StubLiveOpportunities.returning(BEST))
                .resolve(HistoryPeriod.ONE_DAY).block();

            assertEquals(HistoricalSeries.Source.STORED, series.source());
            assertEquals(1.0, series.coverageRatio(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Stored record repair")
    class Repair {

        @Test
        @DisplayName("low 5.0 / high 4.0 → low corrected to max(0.5, 4.0 - 0.2) = 3.8")
        void corruptRowRepaired() {
            CannedSpreadStatisticsStore store = new CannedSpreadStatisticsStore()
                .with(row(TODAY, ROUTE, 4.0, 5.0))
                .with(row(TODAY.minusDays(1), ROUTE, 1.0, 0.5))
                .with(row(TODAY.minusDays(2), ROUTE, 1.0, 0.5));

            HistoricalSeries series = resolver(store, StubLiveOpportunities.returning(BEST))
                .resolve(HistoryPeriod.SEVEN_DAYS).block();

            HistoricalSpreadPoint repaired = series.points().stream()
                .filter(p -> p.date().equals(TODAY)).findFirst().orElseThrow();
            assertEquals(4.0, repaired.highestSpread(), 1e-9);
            assertEquals(3.8, repaired.lowestSpread(), 1e-9);
            assertWellFormed(series.points());
        }

        @Test
        @DisplayName("valid rows pass through untouched")
        void validRowUntouched() {
            HistoricalSpreadPoint point = new HistoricalSpreadPoint(TODAY, 1.3, 0.4, ROUTE);
            assertSame(point, HistoricalSeriesResolver.repair(point));
        }

        @Test
        @DisplayName("stored high with four decimals → corrected low keeps full precision")
        void storedRepairIsNotRounded() {
            HistoricalSpreadPoint repaired =
                HistoricalSeriesResolver.repair(new HistoricalSpreadPoint(TODAY, 1.2345, 1.2345, ROUTE));

            assertEquals(1.2345, repaired.highestSpread(), 1e-9);
            assertEquals(1.0345, repaired.lowestSpread(), 1e-9);
        }

        @Test
        @DisplayName("low-valued corrupt row never ends up with low above high")
        void repairNeverInverts() {
            HistoricalSpreadPoint repaired =
                HistoricalSeriesResolver.repair(new HistoricalSpreadPoint(TODAY, 0.3, 0.3, ROUTE));
            assertTrue(repaired.lowestSpread() <= repaired.highestSpread());
        }
    }

    @Nested
    @DisplayName("Synthesis")
    class Synthesis {

        @Test
        @DisplayName("resolving 7d twice gives the same series")
        void idempotent() {
            HistoricalSeriesResolver resolver =
                resolver(new CannedSpreadStatisticsStore(), StubLiveOpportunities.returning(BEST));

            HistoricalSeries first  = resolver.resolve(HistoryPeriod.SEVEN_DAYS).block();
            HistoricalSeries second = resolver.resolve(HistoryPeriod.SEVEN_DAYS).block();

            assertEquals(first.points(), second.points());
        }

        @Test
        @DisplayName("live call succeeds with no opportunities → baseline series")
        void baselineWhenMarketEmpty() {
            HistoricalSeries series = resolver(new CannedSpreadStatisticsStore(), StubLiveOpportunities.returning())
                .resolve(HistoryPeriod.THIRTY_DAYS).block();

            assertEquals(HistoricalSeries.Source.SYNTHETIC_BASELINE, series.source());
            assertEquals(30, series.points().size());
            assertTrue(series.points().stream().allMatch(p -> p.route().equals("Binance → AltcoinTrader")));
            assertWellFormed(series.points());
        }

        @Test
        @DisplayName("live call fails → fallback series, never an error")
        void fallbackWhenLiveFails() {
            HistoricalSeries series = resolver(new CannedSpreadStatisticsStore(),
                    StubLiveOpportunities.failing(new IllegalStateException("market-data down")))
                .resolve(new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31))).block();

            assertEquals(HistoricalSeries.Source.SYNTHETIC_FALLBACK, series.source());
            assertEquals(91, series.points().size());
            assertWellFormed(series.points());
        }

        @Test
        @DisplayName("every synthesized point across a full year satisfies low <= high")
        void invariantOverYear() {
            HistoricalSeries series = resolver(new CannedSpreadStatisticsStore(), StubLiveOpportunities.returning(BEST))
                .resolve(HistoryPeriod.ONE_YEAR).block();

            assertEquals(365, series.points().size());
            assertWellFormed(series.points());
        }
    }
}

package com.spreadtracker.history.controller;

import com.spreadtracker.common.model.Opportunity;
import com.spreadtracker.history.service.HistoricalSeriesResolver;
import com.spreadtracker.history.service.HourlySpreadService;
import com.spreadtracker.history.service.SpreadAccumulator;
import com.spreadtracker.history.service.SyntheticSpreadGenerator;
import com.spreadtracker.history.store.InMemorySpreadStatisticsStore;
import com.spreadtracker.history.support.StubLiveOpportunities;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

class SpreadHistoryControllerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:30:00Z"), ZoneOffset.UTC);

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        InMemorySpreadStatisticsStore store = new InMemorySpreadStatisticsStore(CLOCK);
        StubLiveOpportunities live =
            StubLiveOpportunities.returning(Opportunity.of("Binance", "VALR", 1_140_000, 1_150_000));
        SpreadHistoryController controller = new SpreadHistoryController(
            new SpreadAccumulator(store, CLOCK),
            new HistoricalSeriesResolver(store, live, new SyntheticSpreadGenerator(), CLOCK, 0.3),
            new HourlySpreadService(store, CLOCK));
        client = WebTestClient.bindToController(controller).build();
    }

    private void post(String json) {
        client.post().uri("/api/v1/spreads/observations")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(json)
            .exchange()
            .expectStatus().isAccepted();
    }

    @Nested
    @DisplayName("POST /observations")
    class Observations {

        @Test
        @DisplayName("accepted observations show up in the hourly series")
        void recordedAndServedHourly() {
            post("""
                [{"route":"Binance → VALR","buyExchange":"Binance","sellExchange":"VALR",
                  "spreadPercentage":1.0,"observedAt":"2024-05-01T10:29:00Z"},
                 {"route":"Binance → VALR","buyExchange":"Binance","sellExchange":"VALR",
                  "spreadPercentage":3.0,"observedAt":"2024-05-01T10:29:30Z"}]
                """);

            client.get().uri("/api/v1/spreads/hourly")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].route").isEqualTo("Binance → VALR")
                .jsonPath("$[0].highestSpread").isEqualTo(3.0)
                .jsonPath("$[0].lowestSpread").isEqualTo(1.0)
                .jsonPath("$[0].dataPoints").isEqualTo(2);
        }

        @Test
        void emptyBatchAccepted() {
            post("[]");
        }
    }

    @Nested
    @DisplayName("GET /historical")
    class Historical {

        @Test
        @DisplayName("no parameters → last 7 days")
        void defaultPeriod() {
            client.get().uri("/api/v1/spreads/historical")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(7)
                .jsonPath("$[0].date").isEqualTo("2024-04-25")
                .jsonPath("$[6].date").isEqualTo("2024-05-01")
                .jsonPath("$[0].route").isEqualTo("Binance → VALR");
        }

        @Test
        void explicitDateRange() {
            client.get().uri("/api/v1/spreads/historical?startDate=2024-03-01&endDate=2024-03-31")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(31);
        }

        @Test
        @DisplayName("today's stored row is enough for 1d")
        void storedOneDay() {
            post("""
                [{"route":"Kraken → LUNO","buyExchange":"Kraken","sellExchange":"LUNO",
                  "spreadPercentage":2.5,"observedAt":"2024-05-01T10:29:00Z"},
                 {"route":"Kraken → LUNO","buyExchange":"Kraken","sellExchange":"LUNO",
                  "spreadPercentage":1.5,"observedAt":"2024-05-01T10:29:30Z"}]
                """);

            client.get().uri("/api/v1/spreads/historical?period=1d")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].route").isEqualTo("Kraken → LUNO")
                .jsonPath("$[0].highestSpread").isEqualTo(2.5)
                .jsonPath("$[0].lowestSpread").isEqualTo(1.5);
        }

        @Test
        void unknownPeriodIs400() {
            client.get().uri("/api/v1/spreads/historical?period=2w")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").exists();
        }

        @Test
        void startAfterEndIs400() {
            client.get().uri("/api/v1/spreads/historical?startDate=2024-05-01&endDate=2024-04-01")
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        void rangeOverTwoYearsIs400() {
            client.get().uri("/api/v1/spreads/historical?startDate=2022-01-01&endDate=2024-05-01")
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        void malformedDateIs400() {
            client.get().uri("/api/v1/spreads/historical?startDate=01/03/2024&endDate=2024-03-31")
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        void onlyOneBoundIs400() {
            client.get().uri("/api/v1/spreads/historical?startDate=2024-03-01")
                .exchange()
                .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("GET /hourly")
    class Hourly {

        @Test
        void outOfRangeIs400() {
            client.get().uri("/api/v1/spreads/hourly?hours=0")
                .exchange()
                .expectStatus().isBadRequest();
            client.get().uri("/api/v1/spreads/hourly?hours=169")
                .exchange()
                .expectStatus().isBadRequest();
        }

        @Test
        void emptyWhenNothingRecorded() {
            client.get().uri("/api/v1/spreads/hourly?hours=168")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(0);
        }
    }

    @Test
    void health() {
        client.get().uri("/api/v1/spreads/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}

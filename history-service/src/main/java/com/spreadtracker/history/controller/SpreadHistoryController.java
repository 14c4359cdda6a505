package com.spreadtracker.history.controller;

import com.spreadtracker.common.exception.InvalidRangeException;
import com.spreadtracker.common.model.HistoricalSpreadPoint;
import com.spreadtracker.common.model.SpreadObservation;
import com.spreadtracker.history.dto.ApiError;
import com.spreadtracker.history.model.HourlySpread;
import com.spreadtracker.history.service.DateRange;
import com.spreadtracker.history.service.HistoricalSeries;
import com.spreadtracker.history.service.HistoricalSeriesResolver;
import com.spreadtracker.history.service.HistoryPeriod;
import com.spreadtracker.history.service.HourlySpreadService;
import com.spreadtracker.history.service.SpreadAccumulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

@RestController
@RequestMapping("/api/v1/spreads")
public class SpreadHistoryController {

    private static final Logger log = LoggerFactory.getLogger(SpreadHistoryController.class);

    private final SpreadAccumulator accumulator;
    private final HistoricalSeriesResolver resolver;
    private final HourlySpreadService hourlySpreadService;

    public SpreadHistoryController(SpreadAccumulator accumulator,
                                   HistoricalSeriesResolver resolver,
                                   HourlySpreadService hourlySpreadService) {
        this.accumulator         = accumulator;
        this.resolver            = resolver;
        this.hourlySpreadService = hourlySpreadService;
    }

    @PostMapping("/observations")
    public Mono<ResponseEntity<Void>> observations(@RequestBody List<SpreadObservation> observations) {
        log.debug("Spread observations received. count={}", observations.size());
        return accumulator.recordAll(observations)
            .then(Mono.just(ResponseEntity.accepted().<Void>build()));
    }

    /**
     * {@code ?period=7d} or {@code ?startDate=YYYY-MM-DD&endDate=YYYY-MM-DD}; the date pair
     * wins when both forms are given. No parameters means the last 7 days.
     */
    @GetMapping("/historical")
    public Mono<List<HistoricalSpreadPoint>> historical(@RequestParam(required = false) String period,
                                                        @RequestParam(required = false) String startDate,
                                                        @RequestParam(required = false) String endDate) {
        log.info("Historical spread query received. period={} startDate={} endDate={}", period, startDate, endDate);
        Mono<HistoricalSeries> series;
        if (startDate != null || endDate != null) {
            series = Mono.fromCallable(() -> new DateRange(parseDate(startDate), parseDate(endDate)))
                .flatMap(resolver::resolve);
        } else {
            series = Mono.fromCallable(() -> period == null ? HistoryPeriod.DEFAULT : HistoryPeriod.fromCode(period))
                .flatMap(resolver::resolve);
        }
        return series.map(HistoricalSeries::points);
    }

    @GetMapping("/hourly")
    public Flux<HourlySpread> hourly(@RequestParam(defaultValue = "24") int hours) {
        log.info("Hourly spread query received. hours={}", hours);
        return hourlySpreadService.getHourlySpread(hours);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(InvalidRangeException.class)
    public ResponseEntity<ApiError> invalidRange(InvalidRangeException e) {
        log.warn("Historical query rejected. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(new ApiError(e.getMessage()));
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidRangeException("Invalid date format '" + value + "'. Use YYYY-MM-DD format.");
        }
    }
}

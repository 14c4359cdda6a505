package com.spreadtracker.marketdata.controller;

import com.spreadtracker.common.calculator.ExchangeFeeSchedule;
import com.spreadtracker.common.exception.InvalidCalculatorRequestException;
import com.spreadtracker.common.exception.NoFxRateException;
import com.spreadtracker.common.exception.UnknownRouteException;
import com.spreadtracker.common.model.ExchangeFee;
import com.spreadtracker.common.model.FxRate;
import com.spreadtracker.common.model.Opportunity;
import com.spreadtracker.common.model.ProfitCalculation;
import com.spreadtracker.common.model.Quote;
import com.spreadtracker.marketdata.dto.ApiError;
import com.spreadtracker.marketdata.dto.CalculatorRequest;
import com.spreadtracker.marketdata.service.OpportunityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/market")
public class MarketDataController {

    private static final Logger log = LoggerFactory.getLogger(MarketDataController.class);

    private final OpportunityService opportunityService;

    public MarketDataController(OpportunityService opportunityService) {
        this.opportunityService = opportunityService;
    }

    @GetMapping("/exchange-rate")
    public Mono<FxRate> exchangeRate() {
        return opportunityService.getExchangeRate();
    }

    @GetMapping("/prices/international")
    public Mono<List<Quote>> internationalPrices() {
        return opportunityService.getInternationalPrices();
    }

    @GetMapping("/prices/local")
    public Mono<List<Quote>> localPrices() {
        return opportunityService.getLocalPrices();
    }

    @GetMapping("/arbitrage")
    public Mono<List<Opportunity>> arbitrage() {
        return opportunityService.getCurrentOpportunities();
    }

    @GetMapping("/exchange-fees")
    public List<ExchangeFee> exchangeFees() {
        return ExchangeFeeSchedule.all();
    }

    @PostMapping("/calculate")
    public Mono<ProfitCalculation> calculate(@RequestBody CalculatorRequest request) {
        if (request.amount() <= 0) {
            return Mono.error(new InvalidCalculatorRequestException("amount must be positive"));
        }
        return opportunityService.calculateProfit(request);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── error mapping ─────────────────────────────────────────────────────────

    @ExceptionHandler(NoFxRateException.class)
    public ResponseEntity<ApiError> noFxRate(NoFxRateException e) {
        log.error("Request failed: no FX rate available", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ApiError(e.getMessage()));
    }

    @ExceptionHandler(UnknownRouteException.class)
    public ResponseEntity<ApiError> unknownRoute(UnknownRouteException e) {
        log.warn("Calculator request rejected. reason={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError(e.getMessage()));
    }

    @ExceptionHandler(InvalidCalculatorRequestException.class)
    public ResponseEntity<ApiError> badRequest(InvalidCalculatorRequestException e) {
        log.warn("Calculator request rejected. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(new ApiError(e.getMessage()));
    }
}

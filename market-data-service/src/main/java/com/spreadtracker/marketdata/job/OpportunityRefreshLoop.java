package com.spreadtracker.marketdata.job;

import com.spreadtracker.marketdata.service.OpportunityService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Optional timer trigger: runs one refresh cycle every {@code refresh.interval} so spread
 * history accumulates even when nobody is polling the API.
 *
 * <p>Each cycle is a fresh {@link Mono} whose terminal callback schedules the next one;
 * {@code Mono.delay()} holds no thread while waiting. A failed cycle is logged and the
 * loop carries on.
 */
@Component
@ConditionalOnProperty(name = "refresh.enabled", havingValue = "true")
public class OpportunityRefreshLoop {

    private static final Logger log = LoggerFactory.getLogger(OpportunityRefreshLoop.class);

    private final OpportunityService opportunityService;
    private final Duration interval;

    private volatile boolean running;
    private volatile Disposable pending;

    public OpportunityRefreshLoop(OpportunityService opportunityService,
                                  @Value("${refresh.interval:60s}") Duration interval) {
        this.opportunityService = opportunityService;
        this.interval           = interval;
    }

    @PostConstruct
    public void start() {
        running = true;
        log.info("Opportunity refresh loop started. intervalSeconds={}", interval.toSeconds());
        scheduleNextCycle();
    }

    @PreDestroy
    public void stop() {
        running = false;
        Disposable current = pending;
        if (current != null) {
            current.dispose();
        }
        log.info("Opportunity refresh loop stopped");
    }

    private void scheduleNextCycle() {
        if (!running) {
            return;
        }
        pending = Mono.delay(interval)
            .then(opportunityService.getCurrentOpportunities())
            .subscribe(
                opportunities -> {
                    log.info("Refresh cycle complete. opportunities={}", opportunities.size());
                    scheduleNextCycle();
                },
                err -> {
                    log.error("Refresh cycle failed, continuing. reason={}", err.getMessage());
                    scheduleNextCycle();
                }
            );
    }
}

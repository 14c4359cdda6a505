package com.spreadtracker.marketdata.publisher;

import com.spreadtracker.common.model.SpreadObservation;
import com.spreadtracker.common.publisher.SpreadObservationPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * REST-based implementation of {@link SpreadObservationPublisher}.
 *
 * <p>POSTs the batch to history-service and subscribes without returning anything to the
 * caller. Failures are logged and dropped: spread history is best-effort telemetry.
 */
@Component
public class RestSpreadObservationPublisher implements SpreadObservationPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestSpreadObservationPublisher.class);

    private final WebClient historyClient;

    public RestSpreadObservationPublisher(WebClient historyClient) {
        this.historyClient = historyClient;
    }

    @Override
    public void publish(List<SpreadObservation> observations) {
        historyClient.post()
            .uri("/api/v1/spreads/observations")
            .bodyValue(observations)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.debug("Spread observations published. count={} status={}",
                                 observations.size(), r.getStatusCode()),
                err -> log.warn("Spread observation publish failed (non-critical). count={} reason={}",
                                observations.size(), err.getMessage())
            );
    }
}

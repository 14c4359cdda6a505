package com.spreadtracker.common.publisher;

import com.spreadtracker.common.model.SpreadObservation;

import java.util.List;

/**
 * Hands freshly computed spread observations to the history pipeline.
 *
 * <p>Implementations MUST be fire-and-forget: the caller has already computed its
 * response and never waits for, or learns about, the outcome. No {@code .block()}.
 */
public interface SpreadObservationPublisher {

    void publish(List<SpreadObservation> observations);
}

package com.spreadtracker.history.client;

import com.spreadtracker.common.model.Opportunity;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Current ranked opportunities, best first. Consulted only when stored history is too
 * sparse and a synthetic series has to be anchored to today's market.
 */
public interface LiveOpportunitySource {

    Mono<List<Opportunity>> currentOpportunities();
}

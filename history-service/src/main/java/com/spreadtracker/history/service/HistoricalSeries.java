package com.spreadtracker.history.service;

import com.spreadtracker.common.model.HistoricalSpreadPoint;

import java.util.List;

/**
 * Resolved series plus where it came from.
 *
 * @param coverageRatio distinct stored dates / requested days, before any synthesis
 */
public record HistoricalSeries(List<HistoricalSpreadPoint> points, Source source, double coverageRatio) {

    public enum Source {
        /** Stored daily records, repaired where needed. */
        STORED,
        /** Synthesized around the best live opportunity. */
        SYNTHETIC_LIVE,
        /** Synthesized around the fixed baseline; live call succeeded with no opportunities. */
        SYNTHETIC_BASELINE,
        /** Synthesized without live data; the live call failed. */
        SYNTHETIC_FALLBACK
    }
}

package com.spreadtracker.common.model;

/**
 * Streaming high/low/mean over spread observations.
 *
 * <p>{@link #plus(double)} is the O(1) online update; history is never re-scanned:
 * <pre>
 *   high' = max(high, x)
 *   low'  = min(low, x)
 *   n'    = n + 1
 *   avg'  = (avg * n + x) / n'
 * </pre>
 * Invariants: {@code dataPoints >= 1} and {@code lowestSpread <= highestSpread}.
 */
public record RunningSpreadStats(
    double highestSpread,
    double lowestSpread,
    double averageSpread,
    int    dataPoints
) {

    public static RunningSpreadStats first(double spreadPercentage) {
        return new RunningSpreadStats(spreadPercentage, spreadPercentage, spreadPercentage, 1);
    }

    public RunningSpreadStats plus(double spreadPercentage) {
        int next = dataPoints + 1;
        return new RunningSpreadStats(
            Math.max(highestSpread, spreadPercentage),
            Math.min(lowestSpread, spreadPercentage),
            (averageSpread * dataPoints + spreadPercentage) / next,
            next);
    }
}

package com.spreadtracker.history.service;

import com.spreadtracker.common.model.HistoricalSpreadPoint;
import com.spreadtracker.common.model.Opportunity;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic stand-in series for date ranges without enough stored data.
 *
 * <p>Every random draw comes from {@link #seededRandom(long, long)}, seeded by the
 * day's position in the range and its epoch day, so regenerating the same range always
 * yields the same points. The shaping constants are display tuning values; they do not
 * model the market.
 *
 * <p>Three shapes:
 * <ul>
 *   <li>{@link #aroundOpportunity}: centred on today's best live spread, 14-day trend,
 *       day noise, weekend dampening</li>
 *   <li>{@link #aroundBaseline}: same idea around a fixed 0.6% when the market has no
 *       opportunities</li>
 *   <li>{@link #fallback}: a flatter series around 2.0% for when live data is unreachable</li>
 * </ul>
 */
@Component
public class SyntheticSpreadGenerator {

    static final String BASELINE_ROUTE = Opportunity.routeOf("Binance", "AltcoinTrader");

    // around the live opportunity
    static final double LIVE_TREND_AMPLITUDE  = 0.3;
    static final double LIVE_TREND_PERIOD     = 14.0;
    static final double LIVE_NOISE_BAND       = 0.6;
    static final double LIVE_HIGH_BAND        = 0.4;
    static final double LIVE_LOW_BAND         = 0.3;
    static final double LIVE_BASE_FLOOR       = 0.3;
    static final double WEEKEND_EFFECT        = -0.2;

    // around the fixed baseline
    static final double BASELINE_SPREAD       = 0.6;
    static final double BASELINE_TREND_AMPLITUDE = 0.2;
    static final double BASELINE_TREND_PERIOD = 10.0;
    static final double BASELINE_NOISE_BAND   = 0.3;
    static final double BASELINE_HIGH_BAND    = 0.3;
    static final double BASELINE_LOW_BAND     = 0.2;

    // without live data
    static final double FALLBACK_SPREAD       = 2.0;
    static final double FALLBACK_WAVE         = 0.8;
    static final double FALLBACK_NOISE_BAND   = 1.5;
    static final double FALLBACK_HIGH_BAND    = 1.2;
    static final double FALLBACK_LOW_BAND     = 0.7;
    static final double FALLBACK_LOW_FLOOR    = 0.3;
    static final double FALLBACK_MIN_GAP      = 0.1;

    static final double WEEKEND_MULTIPLIER    = 0.8;
    static final double MIN_HIGH_ABOVE_BASE   = 0.1;
    static final double MIN_GAP               = 0.05;
    static final double SPREAD_FLOOR          = 0.1;

    public List<HistoricalSpreadPoint> aroundOpportunity(DateRange range, Opportunity best) {
        double base = best.spreadPercentage();
        List<HistoricalSpreadPoint> points = new ArrayList<>(range.requestedDays());
        int dayIndex = 0;
        for (LocalDate date : range.days()) {
            long epochDay = date.toEpochDay();
            boolean weekend = isWeekend(date);
            double multiplier = weekend ? WEEKEND_MULTIPLIER : 1.0;

            double trend = Math.sin(dayIndex / LIVE_TREND_PERIOD * Math.PI) * LIVE_TREND_AMPLITUDE;
            double noise = (seededRandom(dayIndex, epochDay) - 0.5) * LIVE_NOISE_BAND;
            double weekendEffect = weekend ? WEEKEND_EFFECT : 0.0;

            double adjustedBase = Math.max(LIVE_BASE_FLOOR, base + (trend + noise + weekendEffect) * multiplier);
            double high = adjustedBase + seededRandom(dayIndex + 100, epochDay) * LIVE_HIGH_BAND;
            double low = Math.max(SPREAD_FLOOR, adjustedBase - seededRandom(dayIndex + 200, epochDay) * LIVE_LOW_BAND);

            points.add(separated(date, adjustedBase, high, low, best.route()));
            dayIndex++;
        }
        return points;
    }

    public List<HistoricalSpreadPoint> aroundBaseline(DateRange range) {
        List<HistoricalSpreadPoint> points = new ArrayList<>(range.requestedDays());
        int dayIndex = 0;
        for (LocalDate date : range.days()) {
            long epochDay = date.toEpochDay();
            double multiplier = isWeekend(date) ? WEEKEND_MULTIPLIER : 1.0;

            double trend = Math.sin(dayIndex / BASELINE_TREND_PERIOD * Math.PI) * BASELINE_TREND_AMPLITUDE;
            double base = BASELINE_SPREAD + trend + seededRandom(dayIndex, epochDay) * BASELINE_NOISE_BAND;
            double high = (base + seededRandom(dayIndex + 50, epochDay) * BASELINE_HIGH_BAND) * multiplier;
            double low = (base - seededRandom(dayIndex + 150, epochDay) * BASELINE_LOW_BAND) * multiplier;

            points.add(separated(date, base, high, low, BASELINE_ROUTE));
            dayIndex++;
        }
        return points;
    }

    /**
     * Days are indexed backwards from the end of the range, so the most recent day is 0.
     */
    public List<HistoricalSpreadPoint> fallback(DateRange range) {
        List<HistoricalSpreadPoint> points = new ArrayList<>(range.requestedDays());
        for (LocalDate date : range.days()) {
            long epochDay = date.toEpochDay();
            long daysBack = ChronoUnit.DAYS.between(date, range.end());

            double base = FALLBACK_SPREAD + Math.sin(daysBack / 3.0) * FALLBACK_WAVE
                        + seededRandom(daysBack, epochDay) * FALLBACK_NOISE_BAND;
            double high = base + seededRandom(daysBack + 50, epochDay) * FALLBACK_HIGH_BAND;
            double low = Math.max(FALLBACK_LOW_FLOOR, base - seededRandom(daysBack + 150, epochDay) * FALLBACK_LOW_BAND);
            low = Math.min(low, high - FALLBACK_MIN_GAP);

            points.add(new HistoricalSpreadPoint(date, round2(high), round2(low), BASELINE_ROUTE));
        }
        return points;
    }

    /**
     * Fractional part of {@code sin(seed + epochDay) * 10000}; uniform enough on [0, 1)
     * for display purposes and fully reproducible.
     */
    static double seededRandom(long seed, long epochDay) {
        double x = Math.sin(seed + epochDay) * 10000;
        return x - Math.floor(x);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static HistoricalSpreadPoint separated(LocalDate date, double base, double high, double low, String route) {
        double dailyHigh = Math.max(base + MIN_HIGH_ABOVE_BASE, high);
        double dailyLow = Math.max(SPREAD_FLOOR, Math.min(low, dailyHigh - MIN_GAP));
        return new HistoricalSpreadPoint(date, round2(dailyHigh), round2(dailyLow), route);
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}

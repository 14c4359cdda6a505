package com.spreadtracker.history.service;

import com.spreadtracker.common.exception.InvalidRangeException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Inclusive calendar-day range. Construction validates, so every instance satisfies
 * {@code start <= end} and spans at most {@link #MAX_SPAN_DAYS} days.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public static final long MAX_SPAN_DAYS = 730;

    public DateRange {
        if (start == null || end == null) {
            throw new InvalidRangeException("Both startDate and endDate are required.");
        }
        if (start.isAfter(end)) {
            throw new InvalidRangeException("Start date must be before end date.");
        }
        if (ChronoUnit.DAYS.between(start, end) > MAX_SPAN_DAYS) {
            throw new InvalidRangeException("Date range cannot exceed " + MAX_SPAN_DAYS + " days.");
        }
    }

    /** The {@code period.days()} days ending with {@code today}. */
    public static DateRange lastDays(HistoryPeriod period, LocalDate today) {
        return new DateRange(today.minusDays(period.days() - 1L), today);
    }

    public int requestedDays() {
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }

    public List<LocalDate> days() {
        return start.datesUntil(end.plusDays(1)).toList();
    }
}

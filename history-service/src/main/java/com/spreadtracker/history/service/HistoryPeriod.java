package com.spreadtracker.history.service;

import com.spreadtracker.common.exception.InvalidRangeException;

import java.util.Arrays;

/**
 * Named look-back windows accepted by the historical endpoint.
 */
public enum HistoryPeriod {

    ONE_DAY("1d", 1),
    SEVEN_DAYS("7d", 7),
    THIRTY_DAYS("30d", 30),
    NINETY_DAYS("90d", 90),
    SIX_MONTHS("6m", 180),
    ONE_YEAR("1y", 365);

    public static final HistoryPeriod DEFAULT = SEVEN_DAYS;

    private final String code;
    private final int days;

    HistoryPeriod(String code, int days) {
        this.code = code;
        this.days = days;
    }

    public int days() {
        return days;
    }

    /**
     * @throws InvalidRangeException for anything other than the listed codes
     */
    public static HistoryPeriod fromCode(String code) {
        return Arrays.stream(values())
            .filter(p -> p.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new InvalidRangeException(
                "Unknown period '" + code + "'. Expected one of 1d, 7d, 30d, 90d, 6m, 1y."));
    }
}

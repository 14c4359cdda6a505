package com.spreadtracker.common.exception;

/**
 * A price source produced nothing usable this cycle. Callers treat every subtype the
 * same way: the source is excluded from the current result.
 */
public abstract class PriceSourceException extends SpreadTrackerException {

    private final String sourceName;

    protected PriceSourceException(String sourceName, String message) {
        super("[" + sourceName + "] " + message);
        this.sourceName = sourceName;
    }

    protected PriceSourceException(String sourceName, String message, Throwable cause) {
        super("[" + sourceName + "] " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}

package com.spreadtracker.common.exception;

/**
 * Network failure, non-2xx response or timeout while calling a price source.
 */
public class SourceUnavailableException extends PriceSourceException {

    public SourceUnavailableException(String sourceName, String message) {
        super(sourceName, message);
    }

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }
}

package com.spreadtracker.common.exception;

/**
 * No USD → ZAR rate is available: the fetch failed and nothing was cached before.
 */
public class NoFxRateException extends SpreadTrackerException {

    public NoFxRateException(String message, Throwable cause) {
        super(message, cause);
    }
}

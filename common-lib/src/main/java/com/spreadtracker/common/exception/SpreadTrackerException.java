package com.spreadtracker.common.exception;

/**
 * Root of the tracker's unchecked exception hierarchy.
 */
public class SpreadTrackerException extends RuntimeException {

    public SpreadTrackerException(String message) {
        super(message);
    }

    public SpreadTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}

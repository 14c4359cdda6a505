package com.spreadtracker.common.exception;

/**
 * Rejected history request: unknown period, unparseable date, start after end, or a
 * range longer than the allowed maximum.
 */
public class InvalidRangeException extends SpreadTrackerException {

    public InvalidRangeException(String message) {
        super(message);
    }
}

package com.spreadtracker.common.exception;

/**
 * A profit calculation request that cannot be evaluated, such as a non-positive amount.
 */
public class InvalidCalculatorRequestException extends SpreadTrackerException {

    public InvalidCalculatorRequestException(String message) {
        super(message);
    }
}

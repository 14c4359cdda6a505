package com.spreadtracker.common.exception;

/**
 * A calculation referenced an exchange or buy/sell pairing that is not known or not
 * currently quoted.
 */
public class UnknownRouteException extends SpreadTrackerException {

    public UnknownRouteException(String message) {
        super(message);
    }
}

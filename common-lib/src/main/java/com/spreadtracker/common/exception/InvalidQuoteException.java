package com.spreadtracker.common.exception;

/**
 * The source answered but the payload could not be turned into a positive price
 * (missing field, non-numeric or non-positive value, unparseable body).
 */
public class InvalidQuoteException extends PriceSourceException {

    public InvalidQuoteException(String sourceName, String message) {
        super(sourceName, message);
    }

    public InvalidQuoteException(String sourceName, String message, Throwable cause) {
        super(sourceName, message, cause);
    }
}

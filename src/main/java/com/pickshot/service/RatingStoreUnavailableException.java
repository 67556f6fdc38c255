package com.pickshot.service;

/**
 * The ratings database could not be opened. The application cannot start
 * without it, and this is reported separately from ordinary I/O failures.
 */
public class RatingStoreUnavailableException extends RuntimeException {

    public RatingStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

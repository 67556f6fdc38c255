package com.pickshot.service;

/**
 * The metadata tool did not answer in time, or its process went away while a
 * call was running. Retried, and never counted against the tool's health.
 */
public class MetadataTimeoutException extends MetadataToolException {

    public MetadataTimeoutException(String message) {
        super(message);
    }

    public MetadataTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

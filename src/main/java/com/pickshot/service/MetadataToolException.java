package com.pickshot.service;

import java.io.IOException;

/**
 * A call to the external metadata tool failed.
 */
public class MetadataToolException extends IOException {

    public MetadataToolException(String message) {
        super(message);
    }

    public MetadataToolException(String message, Throwable cause) {
        super(message, cause);
    }
}

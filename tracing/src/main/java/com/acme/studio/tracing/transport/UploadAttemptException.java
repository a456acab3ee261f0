package com.acme.studio.tracing.transport;

/**
 * A single upload attempt failed and must not be retried.
 */
public class UploadAttemptException extends Exception {
    public UploadAttemptException(String message) {
        super(message);
    }

    public UploadAttemptException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}

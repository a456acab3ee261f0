package com.acme.studio.tracing.transport;

/**
 * A single upload attempt failed for a transient reason (I/O failure or server error).
 */
public final class RetryableUploadAttemptException extends UploadAttemptException {
    public RetryableUploadAttemptException(String message) {
        super(message);
    }

    public RetryableUploadAttemptException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

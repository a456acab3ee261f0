package com.acme.studio.tracing.util;

/**
 * HTTP status classes the upload path distinguishes: success, retryable server error, and
 * everything else.
 */
public final class HttpStatusCodes {
    private HttpStatusCodes() {
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    public static boolean isServerError(int status) {
        return status >= 500 && status < 600;
    }
}

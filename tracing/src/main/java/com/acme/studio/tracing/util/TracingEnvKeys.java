package com.acme.studio.tracing.util;

/**
 * Canonical environment variable names read by the tracing runtime.
 */
public final class TracingEnvKeys {
    // ---- API key lookup, in priority order ----
    public static final String ENGINE_API_KEY = "ENGINE_API_KEY";
    public static final String APOLLO_KEY = "APOLLO_KEY";

    public static final String STUDIO_TRACING_ENDPOINT = "STUDIO_TRACING_ENDPOINT";
    public static final String STUDIO_TRACING_COMPRESS = "STUDIO_TRACING_COMPRESS";
    public static final String STUDIO_TRACING_REPORTING_INTERVAL_MS = "STUDIO_TRACING_REPORTING_INTERVAL_MS";
    public static final String STUDIO_TRACING_MAX_REPORT_BYTES = "STUDIO_TRACING_MAX_REPORT_BYTES";
    public static final String STUDIO_TRACING_MAX_QUEUE_BYTES = "STUDIO_TRACING_MAX_QUEUE_BYTES";
    public static final String STUDIO_TRACING_MAX_UPLOAD_ATTEMPTS = "STUDIO_TRACING_MAX_UPLOAD_ATTEMPTS";
    public static final String STUDIO_TRACING_MIN_RETRY_DELAY_MS = "STUDIO_TRACING_MIN_RETRY_DELAY_MS";
    public static final String STUDIO_TRACING_DEBUG_REPORTS = "STUDIO_TRACING_DEBUG_REPORTS";

    private TracingEnvKeys() {
    }
}

package com.acme.studio.tracing.util;

/**
 * Default capacity, timeout, and tuning constants for the tracing runtime.
 * <p>
 * These values are used when neither the caller nor the environment supplies one.
 */
public final class TracingDefaults {

    // ---- Ingress endpoint ----
    public static final String DEFAULT_ENDPOINT = "https://engine-report.apollodata.com/api/ingress/traces";
    public static final String NO_API_KEY = "NO_API_KEY";
    public static final String API_KEY_HEADER = "X-Api-Key";
    public static final String CONTENT_ENCODING_GZIP = "gzip";

    // ---- Channel ----
    public static final boolean DEFAULT_COMPRESS = true;
    public static final long DEFAULT_REPORTING_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_MAX_UNCOMPRESSED_REPORT_BYTES = 4L * 1024 * 1024;
    public static final long QUEUE_BYTES_PER_REPORT_MULTIPLIER = 10L;
    public static final boolean DEFAULT_DEBUG_REPORTS = false;
    public static final long FLUSH_POLL_INTERVAL_MS = 100L;

    // ---- Upload retry ----
    public static final int DEFAULT_MAX_UPLOAD_ATTEMPTS = 5;
    public static final long DEFAULT_MIN_RETRY_DELAY_MS = 100L;

    // ---- Transport ----
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_RESPONSE_TIMEOUT_MS = 10_000;
    public static final int HTTPS_DEFAULT_PORT = 443;
    public static final int HTTP_DEFAULT_PORT = 80;
    public static final int DEFAULT_TRANSPORT_IO_THREADS = 1;
    public static final int TRANSPORT_RESPONSE_LIMIT = 2 * 1024 * 1024;

    private TracingDefaults() {
    }
}

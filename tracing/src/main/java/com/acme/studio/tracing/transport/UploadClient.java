package com.acme.studio.tracing.transport;

import com.acme.studio.tracing.util.HttpStatusCodes;
import com.acme.studio.tracing.util.TracingDefaults;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.zip.GZIPOutputStream;

/**
 * Posts encoded reports to the ingress endpoint with bounded exponential-backoff retry.
 *
 * <p>I/O failures and 5xx responses are retried; the delay before retry {@code n} is
 * {@code minRetryDelay * 2^n}. Any other non-2xx response drops the report immediately.
 * Failures are logged and never thrown: losing a report must not affect the caller.</p>
 */
public final class UploadClient {
    private static final Logger DEFAULT_LOG = Logger.getLogger(UploadClient.class.getName());

    private final ReportTransport transport;
    private final Sleeper sleeper;
    private final Logger log;

    public UploadClient(ReportTransport transport) {
        this(transport, Sleeper.SYSTEM, DEFAULT_LOG);
    }

    public UploadClient(ReportTransport transport, Sleeper sleeper, Logger log) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * @return {@code true} if the report was accepted, {@code false} if it was dropped
     */
    public boolean upload(byte[] reportBytes,
                          String apiKey,
                          boolean compress,
                          int maxAttempts,
                          Duration minRetryDelay) {
        Objects.requireNonNull(reportBytes, "reportBytes");
        // every attempt resends the same body
        byte[] body = compress ? gzip(reportBytes) : reportBytes;
        Map<String, String> headers = new HashMap<>();
        headers.put(TracingDefaults.API_KEY_HEADER, apiKey);
        if (compress) {
            headers.put("Content-Encoding", TracingDefaults.CONTENT_ENCODING_GZIP);
        }
        int attempt = 0;
        while (true) {
            try {
                attemptUpload(body, headers);
                return true;
            } catch (UploadAttemptException e) {
                attempt++;
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    log.warning("Failed to send trace report: " + e.getMessage());
                    return false;
                }
                Duration delay = retryDelay(minRetryDelay, attempt);
                log.warning("Attempt to send trace report failed and will be retried in "
                    + delay.toMillis() + " ms: " + e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warning("Interrupted while waiting to retry; trace report dropped");
                    return false;
                }
            }
        }
    }

    static Duration retryDelay(Duration minRetryDelay, int attempt) {
        int shift = Math.min(attempt, 30);
        return minRetryDelay.multipliedBy(1L << shift);
    }

    private void attemptUpload(byte[] body, Map<String, String> headers) throws UploadAttemptException {
        TransportResponse response;
        try {
            response = transport.post(body, headers);
        } catch (IOException e) {
            throw new RetryableUploadAttemptException(e.getClass().getSimpleName() + " - " + e.getMessage(), e);
        }

        int status = response.status();
        if (HttpStatusCodes.isServerError(status)) {
            throw new RetryableUploadAttemptException(status + " - " + response.body());
        }
        if (!HttpStatusCodes.isSuccess(status)) {
            throw new UploadAttemptException("(" + status + ") - " + response.body());
        }
    }

    static byte[] gzip(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 4));
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException("gzip of in-memory buffer failed", e);
        }
        return out.toByteArray();
    }
}

package com.acme.studio.tracing.channel;

import com.acme.studio.tracing.util.EnvVars;
import com.acme.studio.tracing.util.TracingDefaults;
import com.acme.studio.tracing.util.TracingEnvKeys;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings of one {@link ReportChannel}.
 *
 * <p>Use {@link #builder()}: values set on the builder win, then the environment
 * ({@link TracingEnvKeys}), then {@link TracingDefaults}. The API key falls back to
 * {@code ENGINE_API_KEY}, then {@code APOLLO_KEY}, then a {@code NO_API_KEY} sentinel.</p>
 */
public record ChannelConfig(
    URI endpoint,
    boolean compress,
    String apiKey,
    Duration reportingInterval,
    long maxUncompressedReportSize,
    long maxQueueBytes,
    int maxUploadAttempts,
    Duration minUploadRetryDelay,
    boolean debugReports
) {
    public ChannelConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(reportingInterval, "reportingInterval");
        Objects.requireNonNull(minUploadRetryDelay, "minUploadRetryDelay");
        if (reportingInterval.isNegative() || reportingInterval.isZero()) {
            throw new IllegalArgumentException("reportingInterval must be positive");
        }
        if (maxUncompressedReportSize <= 0) {
            throw new IllegalArgumentException("maxUncompressedReportSize must be positive");
        }
        if (maxQueueBytes <= 0) {
            throw new IllegalArgumentException("maxQueueBytes must be positive");
        }
        if (maxUploadAttempts < 1) {
            throw new IllegalArgumentException("maxUploadAttempts must be >= 1");
        }
        if (minUploadRetryDelay.isNegative()) {
            throw new IllegalArgumentException("minUploadRetryDelay must be >= 0");
        }
    }

    public static ChannelConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ChannelConfig[endpoint=" + endpoint
            + ", compress=" + compress
            + ", apiKey=" + maskedApiKey()
            + ", reportingInterval=" + reportingInterval
            + ", maxUncompressedReportSize=" + maxUncompressedReportSize
            + ", maxQueueBytes=" + maxQueueBytes
            + ", maxUploadAttempts=" + maxUploadAttempts
            + ", minUploadRetryDelay=" + minUploadRetryDelay
            + ", debugReports=" + debugReports + "]";
    }

    private String maskedApiKey() {
        if (apiKey.length() <= 4) {
            return "****";
        }
        return apiKey.substring(0, 4) + "****";
    }

    public static final class Builder {
        private URI endpoint;
        private Boolean compress;
        private String apiKey;
        private Duration reportingInterval;
        private Long maxUncompressedReportSize;
        private Long maxQueueBytes;
        private Integer maxUploadAttempts;
        private Duration minUploadRetryDelay;
        private Boolean debugReports;

        private Builder() {
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder compress(boolean compress) {
            this.compress = compress;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder reportingInterval(Duration reportingInterval) {
            this.reportingInterval = reportingInterval;
            return this;
        }

        public Builder maxUncompressedReportSize(long bytes) {
            this.maxUncompressedReportSize = bytes;
            return this;
        }

        public Builder maxQueueBytes(long bytes) {
            this.maxQueueBytes = bytes;
            return this;
        }

        public Builder maxUploadAttempts(int attempts) {
            this.maxUploadAttempts = attempts;
            return this;
        }

        public Builder minUploadRetryDelay(Duration delay) {
            this.minUploadRetryDelay = delay;
            return this;
        }

        public Builder debugReports(boolean debugReports) {
            this.debugReports = debugReports;
            return this;
        }

        public ChannelConfig build() {
            return build(System.getenv());
        }

        public ChannelConfig build(Map<String, String> env) {
            URI resolvedEndpoint = endpoint != null
                ? endpoint
                : URI.create(EnvVars.getOrDefault(env, TracingEnvKeys.STUDIO_TRACING_ENDPOINT, TracingDefaults.DEFAULT_ENDPOINT));
            boolean resolvedCompress = compress != null
                ? compress
                : EnvVars.getBoolean(env, TracingEnvKeys.STUDIO_TRACING_COMPRESS, TracingDefaults.DEFAULT_COMPRESS);
            String resolvedApiKey = apiKey != null && !apiKey.isBlank()
                ? apiKey
                : EnvVars.firstNonBlank(env, TracingDefaults.NO_API_KEY, TracingEnvKeys.ENGINE_API_KEY, TracingEnvKeys.APOLLO_KEY);
            Duration resolvedInterval = reportingInterval != null
                ? reportingInterval
                : Duration.ofMillis(EnvVars.getLongClamped(env, TracingEnvKeys.STUDIO_TRACING_REPORTING_INTERVAL_MS,
                    TracingDefaults.DEFAULT_REPORTING_INTERVAL_MS, 10L, 3_600_000L));
            long resolvedReportSize = maxUncompressedReportSize != null
                ? maxUncompressedReportSize
                : EnvVars.getLongClamped(env, TracingEnvKeys.STUDIO_TRACING_MAX_REPORT_BYTES,
                    TracingDefaults.DEFAULT_MAX_UNCOMPRESSED_REPORT_BYTES, 1L, 1L << 30);
            long resolvedQueueBytes = maxQueueBytes != null
                ? maxQueueBytes
                : EnvVars.getLongClamped(env, TracingEnvKeys.STUDIO_TRACING_MAX_QUEUE_BYTES,
                    resolvedReportSize * TracingDefaults.QUEUE_BYTES_PER_REPORT_MULTIPLIER, 1L, Long.MAX_VALUE);
            int resolvedAttempts = maxUploadAttempts != null
                ? maxUploadAttempts
                : EnvVars.getIntClamped(env, TracingEnvKeys.STUDIO_TRACING_MAX_UPLOAD_ATTEMPTS,
                    TracingDefaults.DEFAULT_MAX_UPLOAD_ATTEMPTS, 1, 100);
            Duration resolvedDelay = minUploadRetryDelay != null
                ? minUploadRetryDelay
                : Duration.ofMillis(EnvVars.getLongClamped(env, TracingEnvKeys.STUDIO_TRACING_MIN_RETRY_DELAY_MS,
                    TracingDefaults.DEFAULT_MIN_RETRY_DELAY_MS, 0L, 60_000L));
            boolean resolvedDebug = debugReports != null
                ? debugReports
                : EnvVars.getBoolean(env, TracingEnvKeys.STUDIO_TRACING_DEBUG_REPORTS, TracingDefaults.DEFAULT_DEBUG_REPORTS);

            return new ChannelConfig(
                resolvedEndpoint,
                resolvedCompress,
                resolvedApiKey,
                resolvedInterval,
                resolvedReportSize,
                resolvedQueueBytes,
                resolvedAttempts,
                resolvedDelay,
                resolvedDebug
            );
        }
    }
}

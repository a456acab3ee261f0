package com.acme.studio.tracing.channel;

import com.acme.studio.tracing.util.TracingDefaults;
import com.acme.studio.tracing.util.TracingEnvKeys;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelConfigTest {

    @Test
    void usesDefaultsWhenNothingIsConfigured() {
        ChannelConfig config = ChannelConfig.builder().build(Map.of());

        assertEquals(URI.create(TracingDefaults.DEFAULT_ENDPOINT), config.endpoint());
        assertTrue(config.compress());
        assertEquals(TracingDefaults.NO_API_KEY, config.apiKey());
        assertEquals(Duration.ofSeconds(5), config.reportingInterval());
        assertEquals(4L * 1024 * 1024, config.maxUncompressedReportSize());
        assertEquals(40L * 1024 * 1024, config.maxQueueBytes());
        assertEquals(5, config.maxUploadAttempts());
        assertEquals(Duration.ofMillis(100), config.minUploadRetryDelay());
        assertFalse(config.debugReports());
    }

    @Test
    void fallsBackFromEngineKeyToApolloKey() {
        ChannelConfig engine = ChannelConfig.builder().build(Map.of(
            TracingEnvKeys.ENGINE_API_KEY, "service:engine",
            TracingEnvKeys.APOLLO_KEY, "service:apollo"));
        ChannelConfig apollo = ChannelConfig.builder().build(Map.of(
            TracingEnvKeys.APOLLO_KEY, "service:apollo"));

        assertEquals("service:engine", engine.apiKey());
        assertEquals("service:apollo", apollo.apiKey());
    }

    @Test
    void readsTuningFromEnvironment() {
        ChannelConfig config = ChannelConfig.builder().build(Map.of(
            TracingEnvKeys.STUDIO_TRACING_ENDPOINT, "http://localhost:4000/traces",
            TracingEnvKeys.STUDIO_TRACING_COMPRESS, "false",
            TracingEnvKeys.STUDIO_TRACING_REPORTING_INTERVAL_MS, "250",
            TracingEnvKeys.STUDIO_TRACING_MAX_REPORT_BYTES, "1000",
            TracingEnvKeys.STUDIO_TRACING_MAX_UPLOAD_ATTEMPTS, "2",
            TracingEnvKeys.STUDIO_TRACING_MIN_RETRY_DELAY_MS, "5",
            TracingEnvKeys.STUDIO_TRACING_DEBUG_REPORTS, "true"));

        assertEquals(URI.create("http://localhost:4000/traces"), config.endpoint());
        assertFalse(config.compress());
        assertEquals(Duration.ofMillis(250), config.reportingInterval());
        assertEquals(1000L, config.maxUncompressedReportSize());
        assertEquals(10_000L, config.maxQueueBytes(), "queue budget follows the report size");
        assertEquals(2, config.maxUploadAttempts());
        assertEquals(Duration.ofMillis(5), config.minUploadRetryDelay());
        assertTrue(config.debugReports());
    }

    @Test
    void explicitValuesWinOverEnvironment() {
        ChannelConfig config = ChannelConfig.builder()
            .apiKey("service:explicit")
            .compress(true)
            .maxQueueBytes(123)
            .build(Map.of(
                TracingEnvKeys.ENGINE_API_KEY, "service:env",
                TracingEnvKeys.STUDIO_TRACING_COMPRESS, "false",
                TracingEnvKeys.STUDIO_TRACING_MAX_QUEUE_BYTES, "999"));

        assertEquals("service:explicit", config.apiKey());
        assertTrue(config.compress());
        assertEquals(123L, config.maxQueueBytes());
    }

    @Test
    void toStringMasksApiKey() {
        ChannelConfig config = ChannelConfig.builder().apiKey("service:secret-token").build(Map.of());

        String rendered = config.toString();

        assertFalse(rendered.contains("secret-token"));
        assertTrue(rendered.contains("apiKey=serv****"));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> ChannelConfig.builder().maxUploadAttempts(0).build(Map.of()));
        assertThrows(IllegalArgumentException.class,
            () -> ChannelConfig.builder().reportingInterval(Duration.ZERO).build(Map.of()));
        assertThrows(IllegalArgumentException.class,
            () -> ChannelConfig.builder().maxQueueBytes(0).build(Map.of()));
        assertThrows(IllegalArgumentException.class,
            () -> ChannelConfig.builder().minUploadRetryDelay(Duration.ofMillis(-1)).build(Map.of()));
    }
}

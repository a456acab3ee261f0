package com.acme.studio.tracing.channel;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One encoded trace waiting in a {@link ReportChannel}, with the byte cost it is charged
 * against the queue budget (payload plus UTF-8 key length).
 */
record QueueEntry(String key, byte[] payload, long encodedSize) {
    static QueueEntry of(String key, byte[] payload) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
        return new QueueEntry(key, payload, (long) payload.length + key.getBytes(StandardCharsets.UTF_8).length);
    }
}

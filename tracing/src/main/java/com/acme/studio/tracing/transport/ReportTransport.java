package com.acme.studio.tracing.transport;

import java.io.IOException;
import java.util.Map;

/**
 * Sends one report body to the ingress endpoint and returns the response.
 *
 * <p>Every transport-level failure (connect, TLS, timeout, broken connection) is reported as an
 * {@link IOException}; any HTTP response, whatever its status, is returned normally.</p>
 */
public interface ReportTransport extends AutoCloseable {
    TransportResponse post(byte[] body, Map<String, String> headers) throws IOException;

    @Override
    default void close() {
    }
}

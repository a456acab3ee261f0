package com.acme.studio.tracing.transport;

/**
 * Status line and body text of an ingress response.
 */
public record TransportResponse(int status, String body) {
    public TransportResponse {
        body = body == null ? "" : body;
    }
}

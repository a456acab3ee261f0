package com.acme.studio.tracing.channel;

/**
 * Accepts encoded traces from request threads. Implementations never block beyond a short
 * critical section and never throw into the request path.
 */
@FunctionalInterface
public interface TraceSubmitter {
    SubmitResult submit(String queryKey, byte[] encodedTrace);
}

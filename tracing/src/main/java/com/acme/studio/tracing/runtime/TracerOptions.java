package com.acme.studio.tracing.runtime;

import com.acme.studio.tracing.channel.ChannelConfig;
import com.acme.studio.tracing.collector.ExecutionQuery;

import java.util.Objects;
import java.util.function.Function;

/**
 * Options for one tracer installed through {@link StudioTracing#use(TracerOptions)}.
 *
 * @param querySignature maps a query to the signature used in its report key; defaults to
 *                       the raw query string
 */
public record TracerOptions(
    boolean enabled,
    String graphRef,
    String executableSchemaId,
    String serviceVersion,
    Function<ExecutionQuery, String> querySignature,
    ChannelConfig channelConfig
) {
    public TracerOptions {
        querySignature = querySignature == null ? ExecutionQuery::queryString : querySignature;
        Objects.requireNonNull(channelConfig, "channelConfig");
    }

    public static TracerOptions of(ChannelConfig channelConfig) {
        return new TracerOptions(true, null, null, null, null, channelConfig);
    }

    public TracerOptions withEnabled(boolean enabled) {
        return new TracerOptions(enabled, graphRef, executableSchemaId, serviceVersion, querySignature, channelConfig);
    }

    public TracerOptions withGraphRef(String graphRef) {
        return new TracerOptions(enabled, graphRef, executableSchemaId, serviceVersion, querySignature, channelConfig);
    }

    public TracerOptions withExecutableSchemaId(String executableSchemaId) {
        return new TracerOptions(enabled, graphRef, executableSchemaId, serviceVersion, querySignature, channelConfig);
    }

    public TracerOptions withServiceVersion(String serviceVersion) {
        return new TracerOptions(enabled, graphRef, executableSchemaId, serviceVersion, querySignature, channelConfig);
    }

    public TracerOptions withQuerySignature(Function<ExecutionQuery, String> querySignature) {
        return new TracerOptions(enabled, graphRef, executableSchemaId, serviceVersion, querySignature, channelConfig);
    }
}

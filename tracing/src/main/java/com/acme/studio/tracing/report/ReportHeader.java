package com.acme.studio.tracing.report;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-process metadata sent with every report.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportHeader(
    String hostname,
    String agentVersion,
    String serviceVersion,
    String runtimeVersion,
    String uname,
    String graphRef,
    String executableSchemaId
) {}

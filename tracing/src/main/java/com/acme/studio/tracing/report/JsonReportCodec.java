package com.acme.studio.tracing.report;

import com.acme.studio.tracing.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Jackson-backed {@link ReportCodec} producing UTF-8 JSON.
 */
public final class JsonReportCodec implements ReportCodec {
    public static final JsonReportCodec INSTANCE = new JsonReportCodec();

    private final ObjectMapper mapper = JsonCodec.mapper();

    private JsonReportCodec() {
    }

    @Override
    public byte[] encodeTrace(Trace trace) throws IOException {
        return mapper.writeValueAsBytes(trace);
    }

    @Override
    public Trace decodeTrace(byte[] encoded) throws IOException {
        return mapper.readValue(encoded, Trace.class);
    }

    @Override
    public byte[] encodeReport(Report report) throws IOException {
        return mapper.writeValueAsBytes(report);
    }

    @Override
    public String renderReport(Report report) {
        try {
            return JsonCodec.writePrettyString(report);
        } catch (JsonProcessingException e) {
            return report.toString();
        }
    }
}

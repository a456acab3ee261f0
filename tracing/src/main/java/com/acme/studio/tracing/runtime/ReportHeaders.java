package com.acme.studio.tracing.runtime;

import com.acme.studio.tracing.report.ReportHeader;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Builds the per-process {@link ReportHeader} from host and JVM properties.
 */
public final class ReportHeaders {
    static final String AGENT_NAME = "studio-tracing";
    static final String FALLBACK_VERSION = "0.1.0";

    private ReportHeaders() {
    }

    public static ReportHeader create(String serviceVersion, String graphRef, String executableSchemaId) {
        return new ReportHeader(
            hostname(),
            agentVersion(),
            serviceVersion,
            runtimeVersion(),
            uname(),
            graphRef,
            executableSchemaId
        );
    }

    static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fromEnv = System.getenv("HOSTNAME");
            return fromEnv == null || fromEnv.isBlank() ? "unknown" : fromEnv;
        }
    }

    static String agentVersion() {
        String version = ReportHeaders.class.getPackage().getImplementationVersion();
        return AGENT_NAME + " " + (version == null ? FALLBACK_VERSION : version);
    }

    static String runtimeVersion() {
        return "Java " + Runtime.version() + " (" + System.getProperty("java.vm.name", "unknown VM") + ")";
    }

    static String uname() {
        return System.getProperty("os.name", "unknown")
            + " " + System.getProperty("os.version", "")
            + " " + System.getProperty("os.arch", "");
    }
}

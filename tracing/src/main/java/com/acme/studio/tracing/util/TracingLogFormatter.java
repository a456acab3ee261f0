package com.acme.studio.tracing.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Single-line log format that tags every record as coming from the tracing runtime:
 * {@code [2026-01-01T00:00:00.000Z] WARNING com.acme...ReportChannel: [Studio Tracing] message}.
 */
public final class TracingLogFormatter extends Formatter {
    public static final String TAG = "[Studio Tracing]";
    private static final DateTimeFormatter TS_FMT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    /**
     * Replaces any console handler previously installed on {@code logger} with one using this
     * format, and stops propagation to parent handlers.
     */
    public static void installConsoleHandler(Logger logger, Level level) {
        for (Handler existing : logger.getHandlers()) {
            if (existing instanceof ConsoleHandler) {
                logger.removeHandler(existing);
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new TracingLogFormatter());
        handler.setLevel(level);
        logger.addHandler(handler);
        logger.setLevel(level);
        logger.setUseParentHandlers(false);
    }

    @Override
    public String format(LogRecord record) {
        StringBuilder sb = new StringBuilder(128);
        sb.append('[').append(TS_FMT.format(Instant.ofEpochMilli(record.getMillis()))).append("] ")
            .append(record.getLevel().getName()).append(' ')
            .append(record.getLoggerName()).append(": ")
            .append(TAG).append(' ')
            .append(formatMessage(record))
            .append(System.lineSeparator());
        Throwable thrown = record.getThrown();
        if (thrown != null) {
            StringWriter sw = new StringWriter();
            thrown.printStackTrace(new PrintWriter(sw));
            sb.append(sw);
        }
        return sb.toString();
    }
}

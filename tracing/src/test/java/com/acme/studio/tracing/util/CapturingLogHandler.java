package com.acme.studio.tracing.util;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Collects log records of a private logger so tests can assert on them.
 */
public final class CapturingLogHandler extends Handler {
    private final List<LogRecord> records = new ArrayList<>();

    /** Returns a fresh logger that only reports to this handler. */
    public Logger newLogger() {
        Logger logger = Logger.getAnonymousLogger();
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        logger.addHandler(this);
        return logger;
    }

    @Override
    public synchronized void publish(LogRecord record) {
        records.add(record);
    }

    public synchronized long count(Level level, String text) {
        return records.stream()
            .filter(r -> r.getLevel() == level && r.getMessage() != null && r.getMessage().contains(text))
            .count();
    }

    public boolean hasWarningContaining(String text) {
        return count(Level.WARNING, text) > 0;
    }

    public synchronized List<LogRecord> records() {
        return List.copyOf(records);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }
}

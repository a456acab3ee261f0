package com.acme.studio.tracing.channel;

import com.acme.studio.tracing.report.Report;
import com.acme.studio.tracing.report.ReportCodec;
import com.acme.studio.tracing.report.ReportHeader;
import com.acme.studio.tracing.report.Trace;
import com.acme.studio.tracing.transport.UploadClient;
import com.acme.studio.tracing.util.TracingDefaults;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Byte-budgeted queue of encoded traces drained by a single background uploader thread.
 *
 * <p>Request threads {@link #submit} under one short lock; once the queued bytes reach
 * {@link ChannelConfig#maxQueueBytes()} new traces are dropped until a drain frees space.
 * Every {@link ChannelConfig#reportingInterval()} the uploader drains the queue into reports
 * of roughly {@link ChannelConfig#maxUncompressedReportSize()} bytes and uploads each one.
 * {@link #stop()} fires the shutdown barrier, lets the uploader perform one final drain and
 * waits for it to exit.</p>
 *
 * <p>The uploader starts lazily on the first accepted trace and is restarted by the next
 * submission if it died on an unexpected failure.</p>
 */
public final class ReportChannel implements TraceSubmitter, AutoCloseable {
    private static final Logger DEFAULT_LOG = Logger.getLogger(ReportChannel.class.getName());
    private static final String UPLOADER_THREAD_NAME = "trace-report-uploader";

    private final ChannelConfig config;
    private final ReportHeader header;
    private final ReportCodec codec;
    private final UploadClient uploadClient;
    private final Logger log;

    private final ConcurrentLinkedQueue<QueueEntry> queue = new ConcurrentLinkedQueue<>();
    private final AtomicLong queueBytes = new AtomicLong();
    private final ReentrantLock enqueueLock = new ReentrantLock();
    private final ShutdownBarrier shutdownBarrier = new ShutdownBarrier();

    // guarded by enqueueLock
    private boolean queueFull;
    private volatile Thread uploaderThread;

    public ReportChannel(ChannelConfig config, ReportHeader header, ReportCodec codec, UploadClient uploadClient) {
        this(config, header, codec, uploadClient, DEFAULT_LOG);
    }

    public ReportChannel(ChannelConfig config,
                         ReportHeader header,
                         ReportCodec codec,
                         UploadClient uploadClient,
                         Logger log) {
        this.config = Objects.requireNonNull(config, "config");
        this.header = Objects.requireNonNull(header, "header");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.uploadClient = Objects.requireNonNull(uploadClient, "uploadClient");
        this.log = Objects.requireNonNull(log, "log");
    }

    public ChannelConfig config() {
        return config;
    }

    @Override
    public SubmitResult submit(String queryKey, byte[] encodedTrace) {
        enqueueLock.lock();
        try {
            long current = queueBytes.get();
            if (current >= config.maxQueueBytes()) {
                if (!queueFull) {
                    log.warning("Trace queue is above the threshold of " + config.maxQueueBytes()
                        + " bytes and trace collection will be paused.");
                    queueFull = true;
                }
                return new SubmitResult.Dropped(current, config.maxQueueBytes());
            }
            if (queueFull) {
                log.info("Trace queue is below the threshold of " + config.maxQueueBytes()
                    + " bytes and trace collection will resume.");
                queueFull = false;
            }
            if (config.debugReports()) {
                log.info(() -> "Queueing a trace for " + queryKey);
            }

            QueueEntry entry = QueueEntry.of(queryKey, encodedTrace);
            queue.add(entry);
            long total = queueBytes.addAndGet(entry.encodedSize());
            ensureUploaderStarted();
            return new SubmitResult.Accepted(total);
        } finally {
            enqueueLock.unlock();
        }
    }

    /**
     * Starts the uploader thread if it is not already running.
     */
    public void start() {
        ensureUploaderStarted();
    }

    /**
     * Waits until the queue is empty. Returns early if the uploader is not running, since
     * nothing would drain it.
     */
    public void flush() {
        while (!queue.isEmpty()) {
            Thread t = uploaderThread;
            if (t == null || !t.isAlive()) {
                return;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(TracingDefaults.FLUSH_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Fires the shutdown barrier and blocks until the uploader has drained the queue one last
     * time and exited. No-op if the uploader was never started.
     *
     * <p>If the uploader died with traces still queued, the final drain runs on the calling
     * thread instead.</p>
     */
    public void stop() {
        Thread current = uploaderThread;
        if (current == null) {
            return;
        }
        log.info("Shutting down trace channel...");
        shutdownBarrier.fire();
        Thread joined = null;
        try {
            while (current != null && current != joined) {
                current.join();
                joined = current;
                current = uploaderThread;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (!queue.isEmpty()) {
            log.warning("Trace uploader exited with " + queue.size() + " traces queued; draining on shutdown thread");
            try {
                drainQueue();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Final drain of trace queue failed", e);
            }
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        Thread t = uploaderThread;
        return t != null && t.isAlive();
    }

    public long queueBytes() {
        return queueBytes.get();
    }

    public int queueSize() {
        return queue.size();
    }

    private void ensureUploaderStarted() {
        enqueueLock.lock();
        try {
            Thread t = uploaderThread;
            if (t != null && t.isAlive()) {
                return;
            }
            Thread next = new Thread(this::runUploader, UPLOADER_THREAD_NAME);
            next.setDaemon(true);
            uploaderThread = next;
            next.start();
        } finally {
            enqueueLock.unlock();
        }
    }

    private void runUploader() {
        log.info("Trace uploader starting");
        try {
            while (!shutdownBarrier.await(config.reportingInterval())) {
                drainQueue();
            }
            log.info("Draining queue before shutdown...");
            drainQueue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warning("Trace uploader interrupted with " + queue.size() + " traces queued");
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Exception thrown in trace uploader", e);
            throw e;
        } finally {
            log.info("Trace uploader exiting");
        }
    }

    /**
     * Moves every queued trace into reports, cutting a report as soon as its accumulated size
     * reaches the configured maximum.
     *
     * @return number of reports handed to the upload client
     */
    int drainQueue() {
        Map<String, List<byte[]>> tracesPerQuery = new LinkedHashMap<>();
        long reportSize = 0L;
        int reports = 0;
        QueueEntry entry;
        while ((entry = queue.poll()) != null) {
            queueBytes.addAndGet(-entry.encodedSize());
            tracesPerQuery.computeIfAbsent(entry.key(), k -> new ArrayList<>()).add(entry.payload());
            reportSize += entry.encodedSize();

            if (reportSize >= config.maxUncompressedReportSize()) {
                if (sendReport(tracesPerQuery)) {
                    reports++;
                }
                tracesPerQuery = new LinkedHashMap<>();
                reportSize = 0L;
            }
        }
        if (!tracesPerQuery.isEmpty() && sendReport(tracesPerQuery)) {
            reports++;
        }
        return reports;
    }

    private boolean sendReport(Map<String, List<byte[]>> tracesPerQuery) {
        Map<String, Report.TracesAndStats> grouped = new LinkedHashMap<>();
        for (Map.Entry<String, List<byte[]>> e : tracesPerQuery.entrySet()) {
            List<Trace> traces = new ArrayList<>(e.getValue().size());
            for (byte[] encoded : e.getValue()) {
                try {
                    traces.add(codec.decodeTrace(encoded));
                } catch (IOException ex) {
                    log.warning("Skipping undecodable trace for " + e.getKey() + ": " + ex.getMessage());
                }
            }
            if (!traces.isEmpty()) {
                grouped.put(e.getKey(), new Report.TracesAndStats(traces));
            }
        }
        if (grouped.isEmpty()) {
            return false;
        }
        Report report = new Report(header, grouped);

        if (config.debugReports()) {
            log.info(() -> "Sending trace report:\n" + codec.renderReport(report));
        }

        byte[] encodedReport;
        try {
            encodedReport = codec.encodeReport(report);
        } catch (IOException e) {
            log.warning("Failed to encode trace report with " + report.traceCount() + " traces: " + e.getMessage());
            return false;
        }
        uploadClient.upload(
            encodedReport,
            config.apiKey(),
            config.compress(),
            config.maxUploadAttempts(),
            config.minUploadRetryDelay()
        );
        return true;
    }
}

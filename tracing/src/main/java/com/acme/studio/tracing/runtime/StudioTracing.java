package com.acme.studio.tracing.runtime;

import com.acme.studio.tracing.channel.ChannelConfig;
import com.acme.studio.tracing.channel.ReportChannel;
import com.acme.studio.tracing.collector.Tracer;
import com.acme.studio.tracing.report.JsonReportCodec;
import com.acme.studio.tracing.report.ReportCodec;
import com.acme.studio.tracing.report.ReportHeader;
import com.acme.studio.tracing.transport.NettyReportTransport;
import com.acme.studio.tracing.transport.ReportTransport;
import com.acme.studio.tracing.transport.UploadClient;
import com.acme.studio.tracing.util.TracingLogFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-level owner of every tracer's report channel.
 *
 * <p>Each {@link #use(TracerOptions)} builds a channel with its own transport and starts it.
 * {@link #shutdown()} stops every owned channel (each performing a final drain) and closes the
 * transports; {@link #installShutdownHook()} runs it at JVM exit.</p>
 */
public final class StudioTracing implements AutoCloseable {
    public static final String LOGGER_NAMESPACE = "com.acme.studio.tracing";
    private static final Logger LOG = Logger.getLogger(StudioTracing.class.getName());

    private final Function<ChannelConfig, ReportTransport> transportFactory;
    private final ReportCodec codec;
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicBoolean shutdown = new AtomicBoolean();
    private final AtomicReference<Thread> shutdownHook = new AtomicReference<>();

    public StudioTracing() {
        this(config -> new NettyReportTransport(config.endpoint()));
    }

    public StudioTracing(Function<ChannelConfig, ReportTransport> transportFactory) {
        this(transportFactory, JsonReportCodec.INSTANCE);
    }

    public StudioTracing(Function<ChannelConfig, ReportTransport> transportFactory, ReportCodec codec) {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Creates a tracer reporting through a new, started channel.
     *
     * @return empty when {@code options} disable tracing
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public Optional<Tracer> use(TracerOptions options) {
        if (!options.enabled()) {
            return Optional.empty();
        }
        if (shutdown.get()) {
            throw new IllegalStateException("studio tracing has been shut down");
        }
        ChannelConfig config = options.channelConfig();
        ReportHeader header = ReportHeaders.create(
            options.serviceVersion(),
            options.graphRef(),
            options.executableSchemaId()
        );
        ReportTransport transport = transportFactory.apply(config);
        ReportChannel channel = new ReportChannel(config, header, codec, new UploadClient(transport));
        Tracer tracer = new Tracer(channel, codec, options.querySignature());
        registrations.add(new Registration(channel, transport));
        channel.start();
        LOG.info(() -> "Trace reporting enabled " + config);
        return Optional.of(tracer);
    }

    /** Waits for every channel's queue to drain. */
    public void flush() {
        for (Registration registration : registrations) {
            registration.channel().flush();
        }
    }

    /** Stops every channel and closes its transport. Only the first call has an effect. */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        for (Registration registration : registrations) {
            registration.channel().stop();
            try {
                registration.transport().close();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to close report transport", e);
            }
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Routes the runtime's log records to stderr in the {@link TracingLogFormatter} format
     * instead of the JVM's root handlers.
     */
    public static Logger installConsoleLogging(Level level) {
        Logger packageLogger = Logger.getLogger(LOGGER_NAMESPACE);
        TracingLogFormatter.installConsoleHandler(packageLogger, level);
        return packageLogger;
    }

    /** Registers a JVM exit hook running {@link #shutdown()}; repeated calls are no-ops. */
    public void installShutdownHook() {
        Thread hook = new Thread(this::shutdown, "studio-tracing-shutdown-hook");
        if (shutdownHook.compareAndSet(null, hook)) {
            Runtime.getRuntime().addShutdownHook(hook);
        }
    }

    public List<ReportChannel> channels() {
        List<ReportChannel> out = new ArrayList<>(registrations.size());
        for (Registration registration : registrations) {
            out.add(registration.channel());
        }
        return out;
    }

    @Override
    public void close() {
        Thread hook = shutdownHook.getAndSet(null);
        if (hook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                LOG.fine("JVM shutdown in progress; shutdown hook already running");
            }
        }
        shutdown();
    }

    private record Registration(ReportChannel channel, ReportTransport transport) {}
}

package com.acme.studio.tracing.collector;

import com.acme.studio.tracing.channel.TraceSubmitter;
import com.acme.studio.tracing.report.ReportCodec;
import com.acme.studio.tracing.report.Trace;
import com.acme.studio.tracing.tree.ExecutionError;
import com.acme.studio.tracing.tree.PathSegment;
import com.acme.studio.tracing.tree.ResponsePath;
import com.acme.studio.tracing.tree.TraceNode;
import com.acme.studio.tracing.tree.TraceTree;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives execution engine callbacks and turns each traced request into an encoded
 * {@link Trace} submitted to a {@link TraceSubmitter}.
 *
 * <p>Callbacks nest as follows for one execution:</p>
 * <pre>
 * executeMultiplex
 *   executeField            (per field, wraps the resolver)
 *   executeQueryLazy        (always fires; records request end times)
 *     executeFieldLazy      (only for lazy fields; pushes the field's end time out)
 * </pre>
 *
 * <p>Tracing never changes a request's outcome: resolver failures are handed back in the
 * {@link FieldResult}, and failures while recording or submitting a trace are logged.</p>
 */
public final class Tracer {
    private static final Logger DEFAULT_LOG = Logger.getLogger(Tracer.class.getName());

    private final TraceSubmitter submitter;
    private final ReportCodec codec;
    private final Function<ExecutionQuery, String> querySignature;
    private final LongSupplier nanoClock;
    private final Clock wallClock;
    private final Logger log;

    public Tracer(TraceSubmitter submitter, ReportCodec codec) {
        this(submitter, codec, ExecutionQuery::queryString);
    }

    public Tracer(TraceSubmitter submitter, ReportCodec codec, Function<ExecutionQuery, String> querySignature) {
        this(submitter, codec, querySignature, System::nanoTime, Clock.systemUTC(), DEFAULT_LOG);
    }

    public Tracer(TraceSubmitter submitter,
                  ReportCodec codec,
                  Function<ExecutionQuery, String> querySignature,
                  LongSupplier nanoClock,
                  Clock wallClock,
                  Logger log) {
        this.submitter = Objects.requireNonNull(submitter, "submitter");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.querySignature = querySignature == null ? ExecutionQuery::queryString : querySignature;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.log = Objects.requireNonNull(log, "log");
    }

    public boolean tracingEnabled(RequestContext context) {
        return context != null && context.tracingEnabled();
    }

    /**
     * Starts a trace on every traced query, runs the execution, then submits the finished
     * traces. Returns the execution's results unchanged.
     */
    public <R extends ExecutionResult> List<R> executeMultiplex(List<? extends ExecutionQuery> queries,
                                                                Supplier<List<R>> execution) {
        for (ExecutionQuery query : queries) {
            startTrace(query);
        }
        List<R> results = execution.get();
        for (R result : results) {
            submitTrace(result);
        }
        return results;
    }

    /**
     * Times one field resolver and records it as a node of the request's trace.
     */
    public <T> FieldResult<T> executeField(RequestContext context, FieldEvent field, Supplier<FieldResult<T>> resolver) {
        Optional<TraceState> trace = activeTrace(context);
        if (trace.isEmpty()) {
            return resolve(resolver);
        }
        long startNanos = nanoClock.getAsLong();
        FieldResult<T> result = resolve(resolver);
        long endNanos = nanoClock.getAsLong();

        TraceState state = trace.get();
        try {
            TraceNode node = state.tree().add(field.path());
            if (isAliased(field)) {
                node.setOriginalFieldName(field.fieldName());
            }
            node.setType(field.fieldType());
            node.setParentType(field.parentType());
            node.recordStart(state.offsetOf(startNanos));
            node.recordEnd(state.offsetOf(endNanos));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Failed to record field timing for " + field.path(), e);
        }
        return result;
    }

    /**
     * Runs a lazy field's deferred resolution and moves the field's end time to its completion.
     * For each element of a list of lazy values the engine reports the element path; the
     * list field's own node is updated instead, so the last element to finish wins.
     */
    public <T> FieldResult<T> executeFieldLazy(RequestContext context,
                                               FieldEvent field,
                                               Supplier<FieldResult<T>> resolver) {
        Optional<TraceState> trace = activeTrace(context);
        if (trace.isEmpty()) {
            return resolve(resolver);
        }
        FieldResult<T> result = resolve(resolver);
        long endNanos = nanoClock.getAsLong();

        TraceState state = trace.get();
        ResponsePath path = field.path();
        if (field.listType() && path.endsWithIndex()) {
            path = path.parent();
        }
        try {
            state.tree().nodeFor(path).recordEnd(state.offsetOf(endNanos));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Failed to record lazy field timing for " + path, e);
        }
        return result;
    }

    /**
     * Runs the lazy phase of the execution and records the end time of every traced query.
     */
    public <R> R executeQueryLazy(List<? extends ExecutionQuery> queries, Supplier<R> execution) {
        R result = execution.get();
        for (ExecutionQuery query : queries) {
            activeTrace(query.context()).ifPresent(state -> state.recordEnd(wallClock.instant(), nanoClock.getAsLong()));
        }
        return result;
    }

    /** Key under which a query's traces are grouped in reports. */
    public String queryKey(ExecutionQuery query) {
        String operationName = query.operationName() == null ? "-" : query.operationName();
        return "# " + operationName + "\n" + querySignature.apply(query);
    }

    private void startTrace(ExecutionQuery query) {
        RequestContext context = query.context();
        if (!tracingEnabled(context)) {
            return;
        }
        context.attachTrace(new TraceState(wallClock.instant(), nanoClock.getAsLong(), new TraceTree()));
    }

    private void submitTrace(ExecutionResult result) {
        ExecutionQuery query = result.query();
        RequestContext context = query.context();
        Optional<TraceState> trace = activeTrace(context);
        if (trace.isEmpty()) {
            return;
        }
        TraceState state = trace.get();
        try {
            TraceTree tree = state.tree();
            List<ExecutionError> errors = result.errors();
            if (errors != null) {
                for (ExecutionError error : errors) {
                    tree.addError(error);
                }
            }
            tree.seal();
            if (!state.hasEnded()) {
                state.recordEnd(wallClock.instant(), nanoClock.getAsLong());
            }
            Trace finished = state.toTrace(context.clientName(), context.clientVersion());
            submitter.submit(queryKey(query), codec.encodeTrace(finished));
        } catch (IOException | RuntimeException e) {
            log.log(Level.WARNING, "Failed to submit trace for operation " + query.operationName(), e);
        } finally {
            context.attachTrace(null);
        }
    }

    private Optional<TraceState> activeTrace(RequestContext context) {
        if (!tracingEnabled(context)) {
            return Optional.empty();
        }
        return context.trace();
    }

    private static boolean isAliased(FieldEvent field) {
        ResponsePath path = field.path();
        if (path.isRoot()) {
            return false;
        }
        PathSegment last = path.last();
        return last instanceof PathSegment.Field f && !f.name().equals(field.fieldName());
    }

    private static <T> FieldResult<T> resolve(Supplier<FieldResult<T>> resolver) {
        try {
            FieldResult<T> result = resolver.get();
            return result == null ? FieldResult.success(null) : result;
        } catch (RuntimeException e) {
            return FieldResult.failure(e);
        }
    }
}

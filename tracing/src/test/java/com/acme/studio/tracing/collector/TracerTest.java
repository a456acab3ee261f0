package com.acme.studio.tracing.collector;

import com.acme.studio.tracing.channel.SubmitResult;
import com.acme.studio.tracing.channel.TraceSubmitter;
import com.acme.studio.tracing.report.JsonReportCodec;
import com.acme.studio.tracing.report.Timestamp;
import com.acme.studio.tracing.report.Trace;
import com.acme.studio.tracing.report.TraceNodeData;
import com.acme.studio.tracing.tree.ExecutionError;
import com.acme.studio.tracing.tree.ResponsePath;
import com.acme.studio.tracing.util.CapturingLogHandler;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TracerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00.250Z");

    private final ManualNanoClock nanos = new ManualNanoClock(1_000L);
    private final CapturingSubmitter submitter = new CapturingSubmitter();
    private final CapturingLogHandler logs = new CapturingLogHandler();
    private final Tracer tracer = new Tracer(
        submitter, JsonReportCodec.INSTANCE, ExecutionQuery::queryString,
        nanos, Clock.fixed(NOW, ZoneOffset.UTC), logs.newLogger());

    @Test
    void recordsNestedFieldTimingsAndSubmitsUnderQueryKey() throws Exception {
        RequestContext ctx = new RequestContext(true, "ios-app", "2.4.0");
        TestQuery query = new TestQuery("GetUser", "query GetUser{user{name}}", ctx);

        List<TestResult> results = tracer.executeMultiplex(List.of(query), () -> {
            nanos.set(1_100L);
            tracer.executeField(ctx, field(ResponsePath.of("user"), "user", "User", "Query"),
                () -> resolvedAt(1_400L, "u1"));
            nanos.set(1_500L);
            tracer.executeField(ctx, field(ResponsePath.of("user", "name"), "name", "String!", "User"),
                () -> resolvedAt(1_700L, "Ada"));
            tracer.executeQueryLazy(List.of(query), () -> {
                nanos.set(2_000L);
                return null;
            });
            return List.of(new TestResult(query, List.of()));
        });

        assertEquals(1, results.size());
        assertEquals(1, submitter.keys.size());
        assertEquals("# GetUser\nquery GetUser{user{name}}", submitter.keys.get(0));

        Trace trace = submitter.trace(0);
        assertEquals(Timestamp.of(NOW), trace.startTime());
        assertEquals(Timestamp.of(NOW), trace.endTime());
        assertEquals(1_000L, trace.durationNs());
        assertEquals("ios-app", trace.clientName());
        assertEquals("2.4.0", trace.clientVersion());

        TraceNodeData user = trace.root().child().get(0);
        assertEquals("user", user.responseName());
        assertEquals("User", user.type());
        assertEquals("Query", user.parentType());
        assertNull(user.originalFieldName());
        assertEquals(100L, user.startTime());
        assertEquals(400L, user.endTime());

        TraceNodeData name = user.child().get(0);
        assertEquals("name", name.responseName());
        assertEquals(500L, name.startTime());
        assertEquals(700L, name.endTime());
        assertTrue(ctx.trace().isEmpty(), "trace should be detached once submitted");
    }

    @Test
    void recordsOriginalFieldNameForAliases() throws Exception {
        RequestContext ctx = RequestContext.traced();
        TestQuery query = new TestQuery(null, "{me: user{id}}", ctx);

        tracer.executeMultiplex(List.of(query), () -> {
            tracer.executeField(ctx, field(ResponsePath.of("me"), "user", "User", "Query"),
                () -> FieldResult.success("u1"));
            return List.of(new TestResult(query, List.of()));
        });

        assertEquals("# -\n{me: user{id}}", submitter.keys.get(0));
        TraceNodeData me = submitter.trace(0).root().child().get(0);
        assertEquals("me", me.responseName());
        assertEquals("user", me.originalFieldName());
    }

    @Test
    void lazyListElementsExtendTheListFieldNode() throws Exception {
        RequestContext ctx = RequestContext.traced();
        TestQuery query = new TestQuery("Feed", "{posts{title}}", ctx);
        FieldEvent posts = new FieldEvent(ResponsePath.of("posts"), "posts", "[Post!]!", "Query", true);

        tracer.executeMultiplex(List.of(query), () -> {
            nanos.set(1_100L);
            tracer.executeField(ctx, posts, () -> resolvedAt(1_200L, List.of()));
            tracer.executeQueryLazy(List.of(query), () -> {
                nanos.set(1_500L);
                tracer.executeFieldLazy(ctx, posts.withPath(ResponsePath.of("posts", 0)), () -> FieldResult.success("p0"));
                nanos.set(1_800L);
                tracer.executeFieldLazy(ctx, posts.withPath(ResponsePath.of("posts", 1)), () -> FieldResult.success("p1"));
                nanos.set(1_900L);
                return null;
            });
            return List.of(new TestResult(query, List.of()));
        });

        TraceNodeData root = submitter.trace(0).root();
        assertEquals(1, root.child().size(), "elements must not become nodes of their own");
        TraceNodeData postsNode = root.child().get(0);
        assertEquals(100L, postsNode.startTime());
        assertEquals(800L, postsNode.endTime());
        assertTrue(postsNode.child().isEmpty());
    }

    @Test
    void lazyScalarFieldMovesItsOwnEndTime() throws Exception {
        RequestContext ctx = RequestContext.traced();
        TestQuery query = new TestQuery("Author", "{author}", ctx);
        FieldEvent author = field(ResponsePath.of("author"), "author", "String", "Query");

        tracer.executeMultiplex(List.of(query), () -> {
            nanos.set(1_050L);
            tracer.executeField(ctx, author, () -> resolvedAt(1_060L, "promise"));
            tracer.executeQueryLazy(List.of(query), () -> {
                nanos.set(1_300L);
                tracer.executeFieldLazy(ctx, author, () -> FieldResult.success("Ada"));
                return null;
            });
            return List.of(new TestResult(query, List.of()));
        });

        TraceNodeData node = submitter.trace(0).root().child().get(0);
        assertEquals(50L, node.startTime());
        assertEquals(300L, node.endTime());
    }

    @Test
    void attachesResultErrorsToNodesOrNearestAncestor() throws Exception {
        RequestContext ctx = RequestContext.traced();
        TestQuery query = new TestQuery("GetUser", "{user{name}}", ctx);

        tracer.executeMultiplex(List.of(query), () -> {
            tracer.executeField(ctx, field(ResponsePath.of("user"), "user", "User", "Query"),
                () -> FieldResult.success("u1"));
            return List.of(new TestResult(query, List.of(
                new ExecutionError("user lookup failed", ResponsePath.of("user")),
                new ExecutionError("no such field", ResponsePath.of("user", "friends", 3)),
                new ExecutionError("rate limited", null))));
        });

        TraceNodeData root = submitter.trace(0).root();
        assertEquals(List.of("rate limited"), messages(root));
        assertEquals(List.of("user lookup failed", "no such field"), messages(root.child().get(0)));
        assertTrue(root.child().get(0).error().get(0).json().contains("\"path\":[\"user\"]"));
    }

    @Test
    void capturesResolverFailureWithoutLosingTiming() throws Exception {
        RequestContext ctx = RequestContext.traced();
        TestQuery query = new TestQuery("Boom", "{boom}", ctx);
        List<FieldResult<String>> seen = new ArrayList<>();

        tracer.executeMultiplex(List.of(query), () -> {
            nanos.set(1_010L);
            seen.add(tracer.executeField(ctx, field(ResponsePath.of("boom"), "boom", "String", "Query"), () -> {
                nanos.set(1_090L);
                throw new IllegalStateException("resolver exploded");
            }));
            return List.of(new TestResult(query, List.of()));
        });

        FieldResult<String> result = seen.get(0);
        assertFalse(result.isSuccess());
        IllegalStateException thrown = assertThrows(IllegalStateException.class, result::getOrThrow);
        assertEquals("resolver exploded", thrown.getMessage());

        TraceNodeData boom = submitter.trace(0).root().child().get(0);
        assertEquals(10L, boom.startTime());
        assertEquals(90L, boom.endTime());
    }

    @Test
    void untracedRequestsRunResolversWithoutSubmitting() {
        RequestContext ctx = RequestContext.untraced();
        TestQuery query = new TestQuery("Quiet", "{quiet}", ctx);
        List<FieldResult<String>> seen = new ArrayList<>();

        tracer.executeMultiplex(List.of(query), () -> {
            seen.add(tracer.executeField(ctx, field(ResponsePath.of("quiet"), "quiet", "String", "Query"),
                () -> FieldResult.success("shh")));
            tracer.executeQueryLazy(List.of(query), () -> null);
            return List.of(new TestResult(query, List.of()));
        });

        assertEquals("shh", seen.get(0).getOrThrow());
        assertTrue(submitter.keys.isEmpty());
        assertTrue(ctx.trace().isEmpty());
        assertFalse(tracer.tracingEnabled(ctx));
        assertFalse(tracer.tracingEnabled(null));
    }

    @Test
    void tracesEachQueryOfMultiplexSeparately() throws Exception {
        RequestContext traced = RequestContext.traced();
        RequestContext untraced = RequestContext.untraced();
        TestQuery first = new TestQuery("A", "{a}", traced);
        TestQuery second = new TestQuery("B", "{b}", untraced);

        tracer.executeMultiplex(List.of(first, second), () -> {
            tracer.executeField(traced, field(ResponsePath.of("a"), "a", "Int", "Query"), () -> FieldResult.success(1));
            tracer.executeField(untraced, field(ResponsePath.of("b"), "b", "Int", "Query"), () -> FieldResult.success(2));
            return List.of(new TestResult(first, List.of()), new TestResult(second, List.of()));
        });

        assertEquals(List.of("# A\n{a}"), submitter.keys);
    }

    @Test
    void usesCustomQuerySignature() {
        Tracer normalizing = new Tracer(submitter, JsonReportCodec.INSTANCE,
            q -> q.queryString().replaceAll("\\s+", " ").trim());

        assertEquals("# Op\nquery Op { a }",
            normalizing.queryKey(new TestQuery("Op", "query  Op {\n  a\n}", RequestContext.traced())));
    }

    @Test
    void submitFailureIsLoggedAndDoesNotReachCaller() {
        Tracer failing = new Tracer(
            (key, bytes) -> {
                throw new IllegalStateException("channel closed");
            },
            JsonReportCodec.INSTANCE, ExecutionQuery::queryString, nanos, Clock.fixed(NOW, ZoneOffset.UTC),
            logs.newLogger());
        RequestContext ctx = RequestContext.traced();
        TestQuery query = new TestQuery("Op", "{a}", ctx);
        List<TestResult> expected = List.of(new TestResult(query, List.of()));

        List<TestResult> results = failing.executeMultiplex(List.of(query), () -> expected);

        assertSame(expected, results);
        assertTrue(logs.hasWarningContaining("Failed to submit trace for operation Op"));
        assertTrue(ctx.trace().isEmpty());
    }

    @Test
    void lazyFieldWithoutNodeIsLoggedNotThrown() {
        RequestContext ctx = RequestContext.traced();
        TestQuery query = new TestQuery("Op", "{a}", ctx);
        List<FieldResult<String>> seen = new ArrayList<>();

        tracer.executeMultiplex(List.of(query), () -> {
            seen.add(tracer.executeFieldLazy(ctx, field(ResponsePath.of("ghost"), "ghost", "String", "Query"),
                () -> FieldResult.success("boo")));
            return List.of(new TestResult(query, List.of()));
        });

        assertInstanceOf(FieldResult.Success.class, seen.get(0));
        assertTrue(logs.hasWarningContaining("Failed to record lazy field timing for [ghost]"));
        assertEquals(1, submitter.keys.size());
    }

    private FieldResult<Object> resolvedAt(long nanosAtEnd, Object value) {
        nanos.set(nanosAtEnd);
        return FieldResult.success(value);
    }

    private static FieldEvent field(ResponsePath path, String fieldName, String type, String parentType) {
        return new FieldEvent(path, fieldName, type, parentType, false);
    }

    private static List<String> messages(TraceNodeData node) {
        List<String> out = new ArrayList<>();
        node.error().forEach(e -> out.add(e.message()));
        return out;
    }

    private record TestQuery(String operationName, String queryString, RequestContext context)
        implements ExecutionQuery {}

    private record TestResult(ExecutionQuery query, List<ExecutionError> errors) implements ExecutionResult {}

    private static final class ManualNanoClock implements LongSupplier {
        private long now;

        private ManualNanoClock(long start) {
            this.now = start;
        }

        void set(long value) {
            now = value;
        }

        @Override
        public long getAsLong() {
            return now;
        }
    }

    private static final class CapturingSubmitter implements TraceSubmitter {
        private final List<String> keys = new ArrayList<>();
        private final List<byte[]> payloads = new ArrayList<>();

        @Override
        public SubmitResult submit(String queryKey, byte[] encodedTrace) {
            keys.add(queryKey);
            payloads.add(encodedTrace);
            return new SubmitResult.Accepted(encodedTrace.length);
        }

        Trace trace(int i) throws IOException {
            return JsonReportCodec.INSTANCE.decodeTrace(payloads.get(i));
        }
    }
}

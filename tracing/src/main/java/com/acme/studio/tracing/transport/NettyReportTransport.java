package com.acme.studio.tracing.transport;

import com.acme.studio.tracing.util.TracingDefaults;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.pool.ChannelPoolHandler;
import io.netty.channel.pool.SimpleChannelPool;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.FutureListener;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Netty HTTP/1.1 client posting report bodies to a single ingress URI over a pooled,
 * keep-alive connection. {@link #post} blocks the calling thread until the response arrives
 * or the response timeout fires.
 */
public final class NettyReportTransport implements ReportTransport {
    private static final int RESPONSE_LIMIT = TracingDefaults.TRANSPORT_RESPONSE_LIMIT;
    private static final String RESPONSE_HANDLER = "report-response";

    private final URI target;
    private final String host;
    private final int port;
    private final boolean https;
    private final int responseTimeoutMillis;
    private final EventLoopGroup ioGroup;
    private final SslContext sslContext;
    private final SimpleChannelPool pool;

    public NettyReportTransport(URI target) {
        this(target, TracingDefaults.DEFAULT_CONNECT_TIMEOUT_MS, TracingDefaults.DEFAULT_RESPONSE_TIMEOUT_MS);
    }

    public NettyReportTransport(URI target, int connectTimeoutMillis, int responseTimeoutMillis) {
        this.target = Objects.requireNonNull(target, "target");
        this.host = Objects.requireNonNull(target.getHost(), "target host required");
        this.https = isHttps(target);
        this.port = resolvePort(target);
        this.responseTimeoutMillis = Math.max(1, responseTimeoutMillis);
        try {
            this.sslContext = https ? SslContextBuilder.forClient().build() : null;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build TLS context", e);
        }

        this.ioGroup = new NioEventLoopGroup(
            TracingDefaults.DEFAULT_TRANSPORT_IO_THREADS,
            new DefaultThreadFactory("trace-report-io", true)
        );
        Bootstrap bootstrap = new Bootstrap()
            .group(ioGroup)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(1, connectTimeoutMillis))
            .remoteAddress(host, port);
        this.pool = new SimpleChannelPool(bootstrap, new ReportChannelPoolHandler());
    }

    @Override
    public TransportResponse post(byte[] body, Map<String, String> headers) throws IOException {
        CompletableFuture<TransportResponse> result = postAsync(body, headers);
        try {
            // the pool timeout completes the future; the extra second only covers connect time
            return result.get(responseTimeoutMillis + 1_000L, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.cancel(false);
            throw new InterruptedIOException("interrupted while waiting for ingress response");
        } catch (TimeoutException e) {
            result.cancel(false);
            throw new IOException("ingress response timeout", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    /**
     * Sends one report on a pooled connection. The returned future completes with the ingress
     * response, or exceptionally on connect, write, TLS or timeout failure.
     */
    CompletableFuture<TransportResponse> postAsync(byte[] body, Map<String, String> headers) {
        CompletableFuture<TransportResponse> result = new CompletableFuture<>();
        AtomicReference<ScheduledFuture<?>> timeoutRef = new AtomicReference<>();
        result.whenComplete((response, error) -> {
            ScheduledFuture<?> pending = timeoutRef.getAndSet(null);
            if (pending != null) {
                pending.cancel(false);
            }
        });

        pool.acquire().addListener((FutureListener<Channel>) acquired -> {
            if (!acquired.isSuccess()) {
                result.completeExceptionally(acquired.cause());
                return;
            }
            Channel ch = acquired.getNow();
            ch.pipeline().addLast(RESPONSE_HANDLER, new ReportResponseHandler(result, pool, ch));
            armResponseTimeout(ch, result, timeoutRef);

            FullHttpRequest request = reportRequest(body, headers);
            ch.writeAndFlush(request).addListener((ChannelFutureListener) written -> {
                if (!written.isSuccess()) {
                    ReferenceCountUtil.safeRelease(request);
                    result.completeExceptionally(written.cause());
                    written.channel().close();
                }
            });
        });
        return result;
    }

    /**
     * A late response would otherwise be read by the next report sent on this connection, so a
     * timed-out channel is closed and never handed back to the pool; the pool opens a fresh one
     * on the next acquire.
     */
    private void armResponseTimeout(Channel ch,
                                    CompletableFuture<TransportResponse> result,
                                    AtomicReference<ScheduledFuture<?>> timeoutRef) {
        ScheduledFuture<?> timeout = ch.eventLoop().schedule(() -> {
            if (result.completeExceptionally(new TimeoutException("ingress response timeout"))) {
                ch.close();
            }
        }, responseTimeoutMillis, TimeUnit.MILLISECONDS);
        timeoutRef.set(timeout);
        // the response may already have arrived while the timer was being scheduled
        if (result.isDone() && timeoutRef.compareAndSet(timeout, null)) {
            timeout.cancel(false);
        }
    }

    private FullHttpRequest reportRequest(byte[] body, Map<String, String> headers) {
        FullHttpRequest request = new DefaultFullHttpRequest(
            HttpVersion.HTTP_1_1,
            HttpMethod.POST,
            pathAndQuery(target),
            Unpooled.wrappedBuffer(body)
        );
        request.headers()
            .set(HttpHeaderNames.HOST, hostHeader())
            .set(HttpHeaderNames.CONNECTION, "keep-alive")
            .set(HttpHeaderNames.CONTENT_TYPE, "application/json")
            .setInt(HttpHeaderNames.CONTENT_LENGTH, body.length)
            .set(HttpHeaderNames.USER_AGENT, "studio-tracing/1");
        // X-Api-Key and Content-Encoding come from the upload client
        for (Map.Entry<String, String> e : headers.entrySet()) {
            request.headers().set(e.getKey(), e.getValue());
        }
        return request;
    }

    @Override
    public void close() {
        pool.close();
        ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private final class ReportChannelPoolHandler implements ChannelPoolHandler {
        @Override
        public void channelCreated(Channel ch) {
            ChannelPipeline p = ch.pipeline();
            if (https) {
                p.addLast(sslContext.newHandler(ch.alloc(), host, port));
            }
            p.addLast(new HttpClientCodec());
            p.addLast(new HttpObjectAggregator(RESPONSE_LIMIT));
        }

        @Override
        public void channelAcquired(Channel ch) {
            // response handler is attached per report in postAsync
        }

        /** Detaches the finished report's handler so the next report starts clean. */
        @Override
        public void channelReleased(Channel ch) {
            if (ch.pipeline().get(RESPONSE_HANDLER) != null) {
                ch.pipeline().remove(RESPONSE_HANDLER);
            }
        }
    }

    private static final class ReportResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<TransportResponse> result;
        private final SimpleChannelPool pool;
        private final Channel channel;

        private ReportResponseHandler(CompletableFuture<TransportResponse> result,
                                      SimpleChannelPool pool,
                                      Channel channel) {
            this.result = result;
            this.pool = pool;
            this.channel = channel;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            TransportResponse response = new TransportResponse(
                msg.status().code(),
                msg.content().toString(StandardCharsets.UTF_8)
            );
            // back in the pool before the caller can issue the next request
            pool.release(channel);
            result.complete(response);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }

        /** Ingress closed a keep-alive connection while a report was in flight. */
        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!result.isDone()) {
                result.completeExceptionally(new IOException("ingress closed connection before response"));
            }
            ctx.fireChannelInactive();
        }
    }

    private static boolean isHttps(URI uri) {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    private static int resolvePort(URI uri) {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return isHttps(uri) ? TracingDefaults.HTTPS_DEFAULT_PORT : TracingDefaults.HTTP_DEFAULT_PORT;
    }

    private static String pathAndQuery(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            return path + "?" + uri.getRawQuery();
        }
        return path;
    }

    private String hostHeader() {
        if ((https && port == TracingDefaults.HTTPS_DEFAULT_PORT) || (!https && port == TracingDefaults.HTTP_DEFAULT_PORT)) {
            return host;
        }
        return host + ":" + port;
    }
}

package com.acme.furfolio.eventlog.transport;

import com.acme.furfolio.eventlog.audit.AnalyticsDelivery;
import com.acme.furfolio.eventlog.audit.EventRecord;
import com.acme.furfolio.eventlog.render.DiagnosticsRenderer;
import com.acme.furfolio.eventlog.util.EventLogDefaults;
import com.acme.furfolio.eventlog.util.HttpStatusCodes;
import com.acme.furfolio.eventlog.util.JsonCodec;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
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
import io.netty.channel.pool.FixedChannelPool;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.FutureListener;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remote analytics sink that POSTs each record as a JSON document.
 *
 * <p>Connections to the endpoint are pooled and kept alive. {@link #deliver(EventRecord)}
 * waits for the response up to the response timeout and throws on transport failure,
 * timeout, in-flight saturation or a non-2xx status, so the recorder can count the
 * failure. {@link #deliverAsync(EventRecord)} exposes the raw status future.</p>
 */
public final class HttpAnalyticsDelivery implements AnalyticsDelivery, AutoCloseable {
    private static final String RESPONSE_HANDLER = "delivery-response";
    private static final String USER_AGENT = "furfolio-eventlog/1";

    private final URI target;
    private final Map<String, String> staticHeaders;
    private final EventLoopGroup ioGroup;
    private final FixedChannelPool pool;
    private final SslContext sslContext;
    private final Semaphore inFlight;
    private final int responseTimeoutMillis;

    public HttpAnalyticsDelivery(URI target, Map<String, String> staticHeaders) {
        this(target, staticHeaders, EventLogDefaults.DEFAULT_MAX_INFLIGHT, EventLogDefaults.DEFAULT_RESPONSE_TIMEOUT_MS);
    }

    public HttpAnalyticsDelivery(URI target,
                                 Map<String, String> staticHeaders,
                                 int maxInFlight,
                                 int responseTimeoutMillis) {
        this(target, staticHeaders, maxInFlight, responseTimeoutMillis,
            EventLogDefaults.DEFAULT_HTTP_IO_THREADS, EventLogDefaults.DEFAULT_HTTP_POOL_SIZE);
    }

    public HttpAnalyticsDelivery(URI target,
                                 Map<String, String> staticHeaders,
                                 int maxInFlight,
                                 int responseTimeoutMillis,
                                 int ioThreads,
                                 int poolSize) {
        this.target = Objects.requireNonNull(target, "target");
        String host = Objects.requireNonNull(target.getHost(), "target host required");
        this.staticHeaders = Map.copyOf(staticHeaders == null ? Map.of() : staticHeaders);
        this.inFlight = new Semaphore(Math.max(1, maxInFlight));
        this.responseTimeoutMillis = Math.max(1, responseTimeoutMillis);

        boolean https = isHttps(target);
        try {
            this.sslContext = https ? SslContextBuilder.forClient().build() : null;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build TLS context", e);
        }

        int threads = ioThreads > 0 ? ioThreads : Math.max(2, Runtime.getRuntime().availableProcessors());
        this.ioGroup = new NioEventLoopGroup(threads);
        int port = resolvePort(target);
        Bootstrap bootstrap = new Bootstrap()
            .group(ioGroup)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, EventLogDefaults.DEFAULT_CONNECT_TIMEOUT_MS)
            .remoteAddress(host, port);
        this.pool = new FixedChannelPool(bootstrap, new DeliveryChannelPoolHandler(host, port, https), Math.max(1, poolSize));
    }

    public URI target() {
        return target;
    }

    @Override
    public void deliver(EventRecord record) throws Exception {
        CompletableFuture<Integer> response = deliverAsync(record);
        int status;
        try {
            // the future carries its own response timeout; the extra second covers connect and pool acquire
            status = response.get(responseTimeoutMillis + 1_000L, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
        if (!HttpStatusCodes.isSuccess(status)) {
            throw new IllegalStateException("analytics endpoint returned status " + status);
        }
    }

    public CompletableFuture<Integer> deliverAsync(EventRecord record) {
        Objects.requireNonNull(record, "record");
        CompletableFuture<Integer> result = new CompletableFuture<>();
        byte[] body;
        try {
            body = JsonCodec.writeBytes(DiagnosticsRenderer.toJsonMap(record));
        } catch (Exception e) {
            result.completeExceptionally(e);
            return result;
        }
        if (!inFlight.tryAcquire()) {
            result.completeExceptionally(new IllegalStateException("too many in-flight deliveries"));
            return result;
        }
        ByteBuf payload = Unpooled.wrappedBuffer(body);
        AtomicReference<ScheduledFuture<?>> timeoutFutureRef = new AtomicReference<>();

        result.whenComplete((ignored, error) -> {
            ScheduledFuture<?> timeoutFuture = timeoutFutureRef.getAndSet(null);
            if (timeoutFuture != null) {
                timeoutFuture.cancel(false);
            }
            inFlight.release();
        });

        pool.acquire().addListener((FutureListener<Channel>) acquireFuture -> {
            if (!acquireFuture.isSuccess()) {
                payload.release();
                result.completeExceptionally(acquireFuture.cause());
                return;
            }
            Channel ch = acquireFuture.getNow();
            ch.pipeline().addLast(RESPONSE_HANDLER, new DeliveryResponseHandler(result, pool, ch));

            ScheduledFuture<?> timeoutFuture = ch.eventLoop().schedule(() -> {
                if (result.completeExceptionally(new TimeoutException("analytics endpoint response timeout"))) {
                    ch.close();
                    pool.release(ch);
                }
            }, responseTimeoutMillis, TimeUnit.MILLISECONDS);
            timeoutFutureRef.set(timeoutFuture);
            if (result.isDone() && timeoutFutureRef.compareAndSet(timeoutFuture, null)) {
                timeoutFuture.cancel(false);
            }

            FullHttpRequest req = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1,
                HttpMethod.POST,
                pathAndQuery(target),
                payload
            );
            req.headers().set(HttpHeaderNames.HOST, hostHeader(target));
            req.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            req.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
            req.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
            req.headers().set(HttpHeaderNames.USER_AGENT, USER_AGENT);
            for (Map.Entry<String, String> e : staticHeaders.entrySet()) {
                req.headers().set(e.getKey(), e.getValue());
            }
            ch.writeAndFlush(req).addListener((ChannelFutureListener) writeFuture -> {
                if (!writeFuture.isSuccess()) {
                    ReferenceCountUtil.safeRelease(req);
                    if (result.completeExceptionally(writeFuture.cause())) {
                        writeFuture.channel().close();
                        pool.release(writeFuture.channel());
                    }
                }
            });
        });

        return result;
    }

    @Override
    public void close() {
        pool.close();
        ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private final class DeliveryChannelPoolHandler implements ChannelPoolHandler {
        private final String host;
        private final int port;
        private final boolean https;

        DeliveryChannelPoolHandler(String host, int port, boolean https) {
            this.host = host;
            this.port = port;
            this.https = https;
        }

        @Override
        public void channelCreated(Channel ch) {
            ChannelPipeline p = ch.pipeline();
            if (https) {
                p.addLast(sslContext.newHandler(ch.alloc(), host, port));
            }
            p.addLast(new HttpClientCodec());
            p.addLast(new HttpObjectAggregator(EventLogDefaults.HTTP_RESPONSE_LIMIT));
        }

        @Override
        public void channelAcquired(Channel ch) {
            // no-op
        }

        @Override
        public void channelReleased(Channel ch) {
            if (ch.pipeline().get(RESPONSE_HANDLER) != null) {
                ch.pipeline().remove(RESPONSE_HANDLER);
            }
        }
    }

    private static final class DeliveryResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<Integer> result;
        private final FixedChannelPool pool;
        private final Channel channel;

        private DeliveryResponseHandler(CompletableFuture<Integer> result, FixedChannelPool pool, Channel channel) {
            this.result = result;
            this.pool = pool;
            this.channel = channel;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            if (result.complete(msg.status().code())) {
                pool.release(channel);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (result.completeExceptionally(cause)) {
                ctx.close();
                pool.release(channel);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (result.completeExceptionally(new IllegalStateException("analytics endpoint closed before response"))) {
                pool.release(channel);
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
        return isHttps(uri) ? EventLogDefaults.HTTPS_DEFAULT_PORT : EventLogDefaults.HTTP_DEFAULT_PORT;
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

    private static String hostHeader(URI uri) {
        int port = resolvePort(uri);
        if ((isHttps(uri) && port == EventLogDefaults.HTTPS_DEFAULT_PORT)
            || (!isHttps(uri) && port == EventLogDefaults.HTTP_DEFAULT_PORT)) {
            return uri.getHost();
        }
        return uri.getHost() + ":" + port;
    }
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http2.DefaultHttp2GoAwayFrame;
import io.netty.handler.codec.http2.DefaultHttp2PingFrame;
import io.netty.handler.codec.http2.Http2Error;
import io.netty.handler.codec.http2.Http2GoAwayFrame;
import io.netty.handler.codec.http2.Http2PingFrame;
import io.netty.handler.codec.http2.Http2SettingsFrame;
import io.netty.util.concurrent.ScheduledFuture;

import io.rpclink.transport.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Netty handler observing one physical HTTP/2 connection on behalf of a
 * {@link ConnectionLifecycle}, usually the {@link ConnectionManager}.
 *
 * <p>This handler:</p>
 * <ul>
 *   <li>reports the transport coming up and going down;</li>
 *   <li>reports the connection ready on the peer's first SETTINGS frame;</li>
 *   <li>counts open streams from {@link StreamLifecycleEvent}s and, once it has had no streams
 *   for the idle timeout, sends a GOAWAY and closes the connection;</li>
 *   <li>closes the connection on a GOAWAY from the peer if no streams are open. With streams open
 *   the GOAWAY is not acted on: the streams drain and the last one closing starts the idle
 *   timer;</li>
 *   <li>runs HTTP/2 keepalive per its {@link ConnectionKeepalive}: from the first stream on it
 *   pings every interval and closes the connection when an ack does not arrive within the
 *   timeout. Pings from the peer are acked here, so the HTTP/2 codec must not ack them
 *   itself.</li>
 * </ul>
 *
 * <p>Without a lifecycle (server side) only the idle, GOAWAY and keepalive closing is
 * performed.</p>
 */
public class ConnectionIdleHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionIdleHandler.class);

    @VisibleForTesting
    static final long KEEPALIVE_PING_CONTENT = 5L;

    private final @Nullable ConnectionLifecycle lifecycle;
    private final Duration idleTimeout;
    private final ConnectionKeepalive keepalive;
    private final Counter idleCloseCounter;

    private IdleHandlerState state = IdleHandlerState.NotReady.INSTANCE;
    private int activeStreams;
    private @Nullable ScheduledFuture<?> scheduledIdleTimeout;
    private @Nullable ChannelHandlerContext ctx;

    // Keepalive
    private boolean pingStarted;
    private int sentPingsWithoutData;
    private long lastSentPingNanos;
    private @Nullable ScheduledFuture<?> scheduledPing;
    private @Nullable ScheduledFuture<?> scheduledPingTimeout;

    public ConnectionIdleHandler(@Nullable ConnectionLifecycle lifecycle, Duration idleTimeout, ConnectionKeepalive keepalive, Counter idleCloseCounter) {
        this.lifecycle = lifecycle;
        this.idleTimeout = Objects.requireNonNull(idleTimeout);
        this.keepalive = Objects.requireNonNull(keepalive);
        this.idleCloseCounter = Objects.requireNonNull(idleCloseCounter);
    }

    // ==================== Accessors ====================

    @VisibleForTesting
    IdleHandlerState state() {
        return state;
    }

    @VisibleForTesting
    int activeStreams() {
        return activeStreams;
    }

    @VisibleForTesting
    @Nullable
    ScheduledFuture<?> scheduledIdleTimeout() {
        return scheduledIdleTimeout;
    }

    @VisibleForTesting
    @Nullable
    ScheduledFuture<?> scheduledPing() {
        return scheduledPing;
    }

    @VisibleForTesting
    @Nullable
    ScheduledFuture<?> scheduledPingTimeout() {
        return scheduledPingTimeout;
    }

    // ==================== Netty callbacks ====================

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        cancelIdleTimeout();
        cancelKeepalive();
        this.ctx = null;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        if (state instanceof IdleHandlerState.NotReady && lifecycle != null) {
            lifecycle.channelActive(ctx.channel());
        }
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cancelIdleTimeout();
        cancelKeepalive();
        if (!(state instanceof IdleHandlerState.Closed)) {
            LOGGER.debug("{}: channel inactive in state {}", ctx.channel(), state);
            state = toClosed();
            if (lifecycle != null) {
                lifecycle.channelInactive();
            }
        }
        super.channelInactive(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object event) throws Exception {
        if (event instanceof StreamLifecycleEvent.StreamCreated created) {
            streamCreated(created.streamId());
        }
        else if (event instanceof StreamLifecycleEvent.StreamClosed closed) {
            streamClosed(closed.streamId());
        }
        super.userEventTriggered(ctx, event);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof Http2SettingsFrame) {
            settingsReceived();
        }
        else if (msg instanceof Http2GoAwayFrame goAway) {
            goAwayReceived(goAway);
        }
        else if (msg instanceof Http2PingFrame ping) {
            pingReceived(ctx, ping);
        }
        super.channelRead(ctx, msg);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        LOGGER.debug("{}: closing connection after error: {}", ctx.channel(), cause.getMessage());
        ctx.close();
        super.exceptionCaught(ctx, cause);
    }

    // ==================== State transitions ====================

    private void streamCreated(int streamId) {
        if (isClosingOrClosed()) {
            return;
        }
        cancelIdleTimeout();
        activeStreams++;
        sentPingsWithoutData = 0;
        LOGGER.trace("Stream {} created, {} active", streamId, activeStreams);
        if (!pingStarted) {
            pingStarted = true;
            schedulePing();
        }
    }

    private void streamClosed(int streamId) {
        if (isClosingOrClosed()) {
            return;
        }
        if (activeStreams == 0) {
            LOGGER.warn("Stream {} closed but no streams are active", streamId);
            return;
        }
        activeStreams--;
        LOGGER.trace("Stream {} closed, {} active", streamId, activeStreams);
        scheduleIdleTimeoutIfIdle();
    }

    private void settingsReceived() {
        if (state instanceof IdleHandlerState.NotReady notReady) {
            state = notReady.toReady();
            scheduleIdleTimeoutIfIdle();
            if (lifecycle != null) {
                lifecycle.ready();
            }
        }
    }

    private void goAwayReceived(Http2GoAwayFrame goAway) {
        if (isClosingOrClosed()) {
            return;
        }
        if (activeStreams == 0) {
            LOGGER.debug("GOAWAY (error code {}) received with no active streams, closing", goAway.errorCode());
            closeIdleConnection(false);
        }
        else {
            LOGGER.debug("GOAWAY (error code {}) received with {} active streams, letting them drain", goAway.errorCode(), activeStreams);
        }
    }

    private void pingReceived(ChannelHandlerContext ctx, Http2PingFrame ping) {
        if (ping.ack()) {
            if (ping.content() == KEEPALIVE_PING_CONTENT && scheduledPingTimeout != null) {
                LOGGER.trace("{}: keepalive ping acked", ctx.channel());
                scheduledPingTimeout.cancel(false);
                scheduledPingTimeout = null;
            }
        }
        else {
            ctx.writeAndFlush(new DefaultHttp2PingFrame(ping.content(), true));
        }
    }

    private void idleTimeoutFired() {
        scheduledIdleTimeout = null;
        if (activeStreams == 0 && !isClosingOrClosed()) {
            LOGGER.debug("Connection idle for {}, closing", idleTimeout);
            closeIdleConnection(true);
        }
    }

    private void pingFired() {
        ChannelHandlerContext context = ctx;
        if (context == null || isClosingOrClosed() || shouldBlockPing()) {
            return;
        }
        if (activeStreams == 0) {
            sentPingsWithoutData++;
        }
        lastSentPingNanos = System.nanoTime();
        context.writeAndFlush(new DefaultHttp2PingFrame(KEEPALIVE_PING_CONTENT));
        if (scheduledPingTimeout == null) {
            scheduledPingTimeout = context.executor().schedule(this::pingTimeoutFired, keepalive.timeout().toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    private void pingTimeoutFired() {
        scheduledPingTimeout = null;
        ChannelHandlerContext context = ctx;
        if (isClosingOrClosed() || context == null) {
            return;
        }
        LOGGER.debug("{}: keepalive ping not acked within {}, closing", context.channel(), keepalive.timeout());
        state = toClosing();
        cancelIdleTimeout();
        cancelKeepalive();
        context.writeAndFlush(new DefaultHttp2GoAwayFrame(Http2Error.NO_ERROR));
        context.executor().execute(() -> context.close());
    }

    private boolean shouldBlockPing() {
        if (activeStreams > 0) {
            return false;
        }
        if (!keepalive.permitWithoutCalls()) {
            return true;
        }
        if (sentPingsWithoutData >= keepalive.maximumPingsWithoutData()) {
            return true;
        }
        return sentPingsWithoutData > 0
                && System.nanoTime() - lastSentPingNanos < keepalive.minimumSentPingIntervalWithoutData().toNanos();
    }

    private void closeIdleConnection(boolean sendGoAway) {
        cancelIdleTimeout();
        cancelKeepalive();
        state = toClosed();
        idleCloseCounter.increment();
        if (lifecycle != null) {
            lifecycle.idle();
        }
        ChannelHandlerContext context = ctx;
        if (context != null) {
            if (sendGoAway) {
                context.writeAndFlush(new DefaultHttp2GoAwayFrame(Http2Error.NO_ERROR));
            }
            // close on the next tick so events currently in flight are not dropped
            context.executor().execute(() -> context.close());
        }
    }

    private IdleHandlerState.Closing toClosing() {
        if (state instanceof IdleHandlerState.NotReady notReady) {
            return notReady.toClosing();
        }
        else if (state instanceof IdleHandlerState.Ready ready) {
            return ready.toClosing();
        }
        throw new IllegalStateException("Cannot start closing from " + state);
    }

    private IdleHandlerState.Closed toClosed() {
        if (state instanceof IdleHandlerState.NotReady notReady) {
            return notReady.toClosed();
        }
        else if (state instanceof IdleHandlerState.Ready ready) {
            return ready.toClosed();
        }
        else if (state instanceof IdleHandlerState.Closing closing) {
            return closing.toClosed();
        }
        throw new IllegalStateException("Already closed");
    }

    private boolean isClosingOrClosed() {
        return state instanceof IdleHandlerState.Closing || state instanceof IdleHandlerState.Closed;
    }

    private void scheduleIdleTimeoutIfIdle() {
        ChannelHandlerContext context = ctx;
        if (activeStreams != 0 || context == null) {
            return;
        }
        cancelIdleTimeout();
        scheduledIdleTimeout = context.executor().schedule(this::idleTimeoutFired, idleTimeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void schedulePing() {
        ChannelHandlerContext context = ctx;
        Duration interval = keepalive.interval();
        if (interval == null || context == null) {
            return;
        }
        scheduledPing = context.executor().scheduleAtFixedRate(this::pingFired, interval.toNanos(), interval.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void cancelIdleTimeout() {
        if (scheduledIdleTimeout != null) {
            scheduledIdleTimeout.cancel(false);
            scheduledIdleTimeout = null;
        }
    }

    private void cancelKeepalive() {
        if (scheduledPing != null) {
            scheduledPing.cancel(false);
            scheduledPing = null;
        }
        if (scheduledPingTimeout != null) {
            scheduledPingTimeout.cancel(false);
            scheduledPingTimeout = null;
        }
    }
}

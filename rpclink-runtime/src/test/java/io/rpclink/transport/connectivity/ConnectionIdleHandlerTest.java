/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http2.DefaultHttp2GoAwayFrame;
import io.netty.handler.codec.http2.DefaultHttp2PingFrame;
import io.netty.handler.codec.http2.DefaultHttp2SettingsFrame;
import io.netty.handler.codec.http2.Http2Error;
import io.netty.handler.codec.http2.Http2GoAwayFrame;
import io.netty.handler.codec.http2.Http2PingFrame;
import io.netty.handler.codec.http2.Http2Settings;
import io.netty.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionIdleHandlerTest {

    private static final Duration LONG_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration SHORT_TIMEOUT = Duration.ofMillis(1);

    private final RecordingLifecycle lifecycle = new RecordingLifecycle();
    private final Counter idleCloses = new SimpleMeterRegistry().counter("idle_closes");

    private ConnectionIdleHandler handler;
    private EmbeddedChannel channel;

    @AfterEach
    void tearDown() {
        if (channel != null) {
            channel.finishAndReleaseAll();
        }
    }

    private EmbeddedChannel channel(ConnectionLifecycle lifecycle, Duration idleTimeout) {
        return channel(lifecycle, idleTimeout, ConnectionKeepalive.CLIENT_DEFAULT);
    }

    private EmbeddedChannel channel(ConnectionLifecycle lifecycle, Duration idleTimeout, ConnectionKeepalive keepalive) {
        handler = new ConnectionIdleHandler(lifecycle, idleTimeout, keepalive, idleCloses);
        channel = new EmbeddedChannel(handler);
        return channel;
    }

    private static DefaultHttp2SettingsFrame settings() {
        return new DefaultHttp2SettingsFrame(Http2Settings.defaultSettings());
    }

    private void streamCreated(int streamId) {
        channel.pipeline().fireUserEventTriggered(new StreamLifecycleEvent.StreamCreated(streamId));
    }

    private void streamClosed(int streamId) {
        channel.pipeline().fireUserEventTriggered(new StreamLifecycleEvent.StreamClosed(streamId));
    }

    private void awaitIdleTimeout() throws InterruptedException {
        Thread.sleep(SHORT_TIMEOUT.toMillis() + 50);
        channel.runScheduledPendingTasks();
        channel.runPendingTasks();
    }

    // ==================== Handshake ====================

    @Nested
    @DisplayName("Handshake")
    class Handshake {

        @Test
        @DisplayName("Channel becoming active is reported")
        void channelActiveReported() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);

            assertEquals(List.of("channelActive"), lifecycle.calls);
            assertSame(channel, lifecycle.activeChannel);
            assertInstanceOf(IdleHandlerState.NotReady.class, handler.state());
        }

        @Test
        @DisplayName("First SETTINGS frame makes the connection ready and starts the idle timer")
        void settingsMakesReady() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);

            channel.writeInbound(settings());

            assertEquals(List.of("channelActive", "ready"), lifecycle.calls);
            assertInstanceOf(IdleHandlerState.Ready.class, handler.state());
            assertNotNull(handler.scheduledIdleTimeout());
        }

        @Test
        @DisplayName("Later SETTINGS frames are ignored")
        void laterSettingsIgnored() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);

            channel.writeInbound(settings());
            channel.writeInbound(settings());

            assertEquals(List.of("channelActive", "ready"), lifecycle.calls);
        }

        @Test
        @DisplayName("Frames are passed on to the next handler")
        void framesPassedOn() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);
            DefaultHttp2SettingsFrame frame = settings();

            channel.writeInbound(frame);

            assertSame(frame, channel.readInbound());
        }
    }

    // ==================== Stream accounting ====================

    @Nested
    @DisplayName("Stream accounting")
    class StreamAccounting {

        @Test
        @DisplayName("Opening a stream cancels the idle timer")
        void streamCreatedCancelsTimer() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);
            channel.writeInbound(settings());
            ScheduledFuture<?> timer = handler.scheduledIdleTimeout();

            streamCreated(1);

            assertTrue(timer.isCancelled());
            assertNull(handler.scheduledIdleTimeout());
            assertEquals(1, handler.activeStreams());
        }

        @Test
        @DisplayName("Closing the last stream starts the idle timer")
        void lastStreamClosedSchedulesTimer() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);
            channel.writeInbound(settings());
            streamCreated(1);
            streamCreated(3);

            streamClosed(1);
            assertNull(handler.scheduledIdleTimeout());
            assertEquals(1, handler.activeStreams());

            streamClosed(3);
            assertNotNull(handler.scheduledIdleTimeout());
            assertEquals(0, handler.activeStreams());
        }

        @Test
        @DisplayName("A stream closing without any open is ignored")
        void unmatchedStreamClosed() {
            channel(lifecycle, LONG_TIMEOUT);

            streamClosed(1);

            assertEquals(0, handler.activeStreams());
        }
    }

    // ==================== Idle timeout ====================

    @Nested
    @DisplayName("Idle timeout")
    class IdleTimeout {

        @Test
        @DisplayName("An idle connection is closed once the timeout elapses")
        void idleConnectionClosed() throws InterruptedException {
            EmbeddedChannel channel = channel(lifecycle, SHORT_TIMEOUT);
            channel.writeInbound(settings());

            awaitIdleTimeout();

            assertFalse(channel.isOpen());
            assertEquals(List.of("channelActive", "ready", "idle"), lifecycle.calls);
            assertEquals(1.0, idleCloses.count());
            assertInstanceOf(IdleHandlerState.Closed.class, handler.state());
            Http2GoAwayFrame goAway = assertInstanceOf(Http2GoAwayFrame.class, channel.readOutbound());
            assertEquals(Http2Error.NO_ERROR.code(), goAway.errorCode());
            goAway.release();
        }

        @Test
        @DisplayName("A connection with an open stream is not closed")
        void busyConnectionKept() throws InterruptedException {
            EmbeddedChannel channel = channel(lifecycle, SHORT_TIMEOUT);
            streamCreated(1);
            channel.writeInbound(settings());
            assertNull(handler.scheduledIdleTimeout());

            awaitIdleTimeout();

            assertTrue(channel.isOpen());
            assertEquals(List.of("channelActive", "ready"), lifecycle.calls);
            assertEquals(0.0, idleCloses.count());
        }

        @Test
        @DisplayName("The timer restarts once the connection is idle again")
        void timerRestarts() throws InterruptedException {
            EmbeddedChannel channel = channel(lifecycle, SHORT_TIMEOUT);
            streamCreated(1);
            channel.writeInbound(settings());
            awaitIdleTimeout();
            streamClosed(1);

            awaitIdleTimeout();

            assertFalse(channel.isOpen());
            assertEquals(List.of("channelActive", "ready", "idle"), lifecycle.calls);
        }
    }

    // ==================== GOAWAY ====================

    @Nested
    @DisplayName("GOAWAY")
    class GoAway {

        @Test
        @DisplayName("GOAWAY with no open streams closes the connection")
        void goAwayWhileIdle() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);
            channel.writeInbound(settings());

            channel.writeInbound(new DefaultHttp2GoAwayFrame(Http2Error.NO_ERROR));
            channel.runPendingTasks();

            assertFalse(channel.isOpen());
            assertEquals(List.of("channelActive", "ready", "idle"), lifecycle.calls);
            assertEquals(1.0, idleCloses.count());
        }

        @Test
        @DisplayName("GOAWAY with open streams lets them drain")
        void goAwayWhileBusy() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);
            channel.writeInbound(settings());
            streamCreated(1);

            channel.writeInbound(new DefaultHttp2GoAwayFrame(Http2Error.NO_ERROR));
            channel.runPendingTasks();

            assertTrue(channel.isOpen());
            assertEquals(List.of("channelActive", "ready"), lifecycle.calls);

            streamClosed(1);
            assertNotNull(handler.scheduledIdleTimeout());
        }
    }

    // ==================== Teardown ====================

    @Nested
    @DisplayName("Teardown")
    class Teardown {

        @Test
        @DisplayName("Transport going down is reported once")
        void channelInactiveReported() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);
            channel.writeInbound(settings());
            ScheduledFuture<?> timer = handler.scheduledIdleTimeout();

            channel.close();

            assertEquals(List.of("channelActive", "ready", "channelInactive"), lifecycle.calls);
            assertTrue(timer.isCancelled());
            assertInstanceOf(IdleHandlerState.Closed.class, handler.state());
        }

        @Test
        @DisplayName("Closing after an idle close does not report the transport going down")
        void noInactiveAfterIdleClose() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);
            channel.writeInbound(new DefaultHttp2GoAwayFrame(Http2Error.NO_ERROR));
            channel.runPendingTasks();

            assertFalse(channel.isOpen());
            assertEquals(List.of("channelActive", "idle"), lifecycle.calls);
        }

        @Test
        @DisplayName("An exception closes the connection and is passed on")
        void exceptionClosesConnection() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT);
            IOException cause = new IOException("connection reset");

            channel.pipeline().fireExceptionCaught(cause);

            assertFalse(channel.isOpen());
            assertEquals(List.of("channelActive", "channelInactive"), lifecycle.calls);
            IOException thrown = assertThrows(IOException.class, channel::checkException);
            assertSame(cause, thrown);
        }

        @Test
        @DisplayName("Server side handler without a lifecycle still closes idle connections")
        void serverSide() throws InterruptedException {
            handler = new ConnectionIdleHandler(null, SHORT_TIMEOUT, ConnectionKeepalive.SERVER_DEFAULT, idleCloses);
            channel = new EmbeddedChannel(handler);
            channel.writeInbound(settings());

            awaitIdleTimeout();

            assertFalse(channel.isOpen());
            assertEquals(1.0, idleCloses.count());
            Http2GoAwayFrame goAway = assertInstanceOf(Http2GoAwayFrame.class, channel.readOutbound());
            goAway.release();
        }
    }

    // ==================== Keepalive ====================

    @Nested
    @DisplayName("Keepalive")
    class Keepalive {

        private static final Duration PING_INTERVAL = Duration.ofMillis(200);
        private static final Duration PING_TIMEOUT = Duration.ofMillis(20);

        private final ConnectionKeepalive keepalive = ConnectionKeepalive.CLIENT_DEFAULT
                .withTimeout(PING_TIMEOUT)
                .withInterval(PING_INTERVAL);

        private void awaitPing() throws InterruptedException {
            Thread.sleep(PING_INTERVAL.toMillis() + 20);
            channel.runScheduledPendingTasks();
        }

        private void awaitPingTimeout() throws InterruptedException {
            Thread.sleep(PING_TIMEOUT.toMillis() + 20);
            channel.runScheduledPendingTasks();
            channel.runPendingTasks();
        }

        private Http2PingFrame readPing() {
            return assertInstanceOf(Http2PingFrame.class, channel.readOutbound());
        }

        @Test
        @DisplayName("No pings are scheduled before the first stream")
        void noPingBeforeFirstStream() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT, keepalive);
            channel.writeInbound(settings());

            assertNull(handler.scheduledPing());
        }

        @Test
        @DisplayName("A ping is sent every interval once a stream has been created")
        void pingSent() throws InterruptedException {
            channel(lifecycle, LONG_TIMEOUT, keepalive);
            streamCreated(1);
            assertNotNull(handler.scheduledPing());

            awaitPing();

            Http2PingFrame ping = readPing();
            assertFalse(ping.ack());
            assertEquals(ConnectionIdleHandler.KEEPALIVE_PING_CONTENT, ping.content());
            assertNotNull(handler.scheduledPingTimeout());
        }

        @Test
        @DisplayName("An ack for the keepalive ping cancels the close")
        void ackCancelsClose() throws InterruptedException {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT, keepalive);
            channel.writeInbound(settings());
            streamCreated(1);
            awaitPing();
            readPing();
            ScheduledFuture<?> close = handler.scheduledPingTimeout();

            channel.writeInbound(new DefaultHttp2PingFrame(ConnectionIdleHandler.KEEPALIVE_PING_CONTENT, true));
            awaitPingTimeout();

            assertTrue(close.isCancelled());
            assertNull(handler.scheduledPingTimeout());
            assertTrue(channel.isOpen());
            assertEquals(List.of("channelActive", "ready"), lifecycle.calls);
        }

        @Test
        @DisplayName("An ack carrying other data leaves the close pending")
        void unrelatedAckIgnored() throws InterruptedException {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT, keepalive);
            streamCreated(1);
            awaitPing();
            readPing();

            channel.writeInbound(new DefaultHttp2PingFrame(42L, true));

            assertNotNull(handler.scheduledPingTimeout());
        }

        @Test
        @DisplayName("A missing ack closes the connection without idling it")
        void missingAckCloses() throws InterruptedException {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT, keepalive);
            channel.writeInbound(settings());
            streamCreated(1);
            awaitPing();
            readPing();

            awaitPingTimeout();

            assertFalse(channel.isOpen());
            assertEquals(List.of("channelActive", "ready", "channelInactive"), lifecycle.calls);
            assertEquals(0.0, idleCloses.count());
            assertInstanceOf(IdleHandlerState.Closed.class, handler.state());
            assertNull(handler.scheduledPing());
            Http2GoAwayFrame goAway = assertInstanceOf(Http2GoAwayFrame.class, channel.readOutbound());
            goAway.release();
        }

        @Test
        @DisplayName("A ping from the peer is acked with the same data")
        void peerPingAcked() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT, keepalive);

            channel.writeInbound(new DefaultHttp2PingFrame(1234L));

            Http2PingFrame ack = readPing();
            assertTrue(ack.ack());
            assertEquals(1234L, ack.content());
        }

        @Test
        @DisplayName("No ping is sent without open streams unless permitted")
        void noPingWithoutCalls() throws InterruptedException {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT, keepalive);
            streamCreated(1);
            streamClosed(1);

            awaitPing();

            assertNull(channel.readOutbound());
            assertNull(handler.scheduledPingTimeout());
            assertTrue(channel.isOpen());
        }

        @Test
        @DisplayName("Pings without open streams are sent when permitted")
        void pingWithoutCallsPermitted() throws InterruptedException {
            channel(lifecycle, LONG_TIMEOUT, keepalive.withPermitWithoutCalls(true));
            streamCreated(1);
            streamClosed(1);

            awaitPing();

            assertFalse(readPing().ack());
        }

        @Test
        @DisplayName("Pings without open streams stop at the configured maximum")
        void pingsWithoutDataLimited() throws InterruptedException {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT, keepalive.withPermitWithoutCalls(true).withMaximumPingsWithoutData(0));
            streamCreated(1);
            streamClosed(1);

            awaitPing();

            assertNull(channel.readOutbound());
        }

        @Test
        @DisplayName("Closing the channel cancels the keepalive timers")
        void channelInactiveCancelsPing() {
            EmbeddedChannel channel = channel(lifecycle, LONG_TIMEOUT, keepalive);
            streamCreated(1);
            ScheduledFuture<?> ping = handler.scheduledPing();

            channel.close();

            assertTrue(ping.isCancelled());
            assertNull(handler.scheduledPing());
        }

        @Test
        @DisplayName("An interval not above the timeout is rejected")
        void invalidKeepalive() {
            assertThrows(IllegalArgumentException.class, () -> keepalive.withInterval(PING_TIMEOUT));
        }
    }
}

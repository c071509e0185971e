/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.EventLoop;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.PromiseNotifier;
import io.netty.util.concurrent.ScheduledFuture;

import io.rpclink.transport.backoff.ConnectionBackoff;
import io.rpclink.transport.backoff.ConnectionBackoffIterator;
import io.rpclink.transport.backoff.TimeoutAndBackoff;
import io.rpclink.transport.connectivity.ConnectionManagerState.Active;
import io.rpclink.transport.connectivity.ConnectionManagerState.Connecting;
import io.rpclink.transport.connectivity.ConnectionManagerState.Idle;
import io.rpclink.transport.connectivity.ConnectionManagerState.Ready;
import io.rpclink.transport.connectivity.ConnectionManagerState.Reconnect;
import io.rpclink.transport.connectivity.ConnectionManagerState.Shutdown;
import io.rpclink.transport.connectivity.ConnectionManagerState.TransientFailure;
import io.rpclink.transport.internal.util.TransportMetrics;
import io.rpclink.transport.status.RpcStatus;
import io.rpclink.transport.status.RpcStatusException;
import io.rpclink.transport.status.StatusCode;
import io.rpclink.transport.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Owns the logical connection to one target: creates physical connections on demand, tracks
 * their lifecycle and reconnects after failures following a {@link ConnectionBackoff}.
 *
 * <p>The lifecycle methods ({@link #channelActive(Channel)}, {@link #channelInactive()},
 * {@link #ready()} and {@link #idle()}) are driven by the {@link ConnectionIdleHandler} on the
 * current channel and must be called on the manager's event loop. {@link #getChannel()} and
 * {@link #shutdown()} may be called from any thread.</p>
 *
 * <p>Every state change is published through the {@link ConnectivityStateMonitor}. When a
 * bounded retry budget runs out the next failure moves the manager to
 * {@link ConnectivityState#SHUTDOWN} and fails any caller waiting for a channel.</p>
 */
public class ConnectionManager implements ConnectionLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

    /**
     * Connection manager settings.
     *
     * @param connectionBackoff reconnection policy; {@code null} disables reconnection
     * @param idleTimeout how long a connection may stay without streams before it is closed
     * @param keepalive HTTP/2 keepalive applied to each connection
     * @param delegate told about every connectivity state change
     */
    public record Configuration(
                                @Nullable ConnectionBackoff connectionBackoff,
                                Duration idleTimeout,
                                ConnectionKeepalive keepalive,
                                @Nullable ConnectivityStateDelegate delegate) {

        public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(5);

        public Configuration {
            Objects.requireNonNull(idleTimeout);
            Objects.requireNonNull(keepalive);
            if (idleTimeout.isNegative() || idleTimeout.isZero()) {
                throw new IllegalArgumentException("idleTimeout must be positive: " + idleTimeout);
            }
        }

        public static Configuration defaults() {
            return new Configuration(ConnectionBackoff.DEFAULT, DEFAULT_IDLE_TIMEOUT, ConnectionKeepalive.CLIENT_DEFAULT, null);
        }

        public Configuration withConnectionBackoff(@Nullable ConnectionBackoff connectionBackoff) {
            return new Configuration(connectionBackoff, idleTimeout, keepalive, delegate);
        }

        public Configuration withIdleTimeout(Duration idleTimeout) {
            return new Configuration(connectionBackoff, idleTimeout, keepalive, delegate);
        }

        public Configuration withKeepalive(ConnectionKeepalive keepalive) {
            return new Configuration(connectionBackoff, idleTimeout, keepalive, delegate);
        }

        public Configuration withDelegate(@Nullable ConnectivityStateDelegate delegate) {
            return new Configuration(connectionBackoff, idleTimeout, keepalive, delegate);
        }
    }

    private final EventLoop eventLoop;
    private final Configuration configuration;
    private final ChannelProvider channelProvider;
    private final ConnectivityStateMonitor monitor;
    private final String connectionId = UUID.randomUUID().toString();

    // Metrics
    private final Counter connectionAttemptCounter;
    private final Counter transientFailureCounter;

    private ConnectionManagerState state = Idle.INSTANCE;
    private long channelNumber;

    public ConnectionManager(
                             EventLoop eventLoop,
                             Configuration configuration,
                             ChannelProvider channelProvider,
                             Counter connectionAttemptCounter,
                             Counter transientFailureCounter) {
        this.eventLoop = Objects.requireNonNull(eventLoop);
        this.configuration = Objects.requireNonNull(configuration);
        this.channelProvider = Objects.requireNonNull(channelProvider);
        this.connectionAttemptCounter = Objects.requireNonNull(connectionAttemptCounter);
        this.transientFailureCounter = Objects.requireNonNull(transientFailureCounter);
        this.monitor = new ConnectivityStateMonitor(configuration.delegate());
    }

    /**
     * Creates a manager whose counters are registered with the global meter registry, tagged
     * with {@code target}.
     */
    public static ConnectionManager create(EventLoop eventLoop, Configuration configuration, ChannelProvider channelProvider, String target) {
        return new ConnectionManager(
                eventLoop,
                configuration,
                channelProvider,
                TransportMetrics.connectionAttemptCounter().withTags(TransportMetrics.TARGET_LABEL, target),
                TransportMetrics.transientFailureCounter().withTags(TransportMetrics.TARGET_LABEL, target));
    }

    // ==================== Accessors ====================

    public EventLoop eventLoop() {
        return eventLoop;
    }

    public Configuration configuration() {
        return configuration;
    }

    public ConnectivityStateMonitor monitor() {
        return monitor;
    }

    @VisibleForTesting
    ConnectionManagerState state() {
        return state;
    }

    /**
     * Identifies the manager and the physical connection it is on in log messages.
     */
    public String logId() {
        return connectionId + "/" + channelNumber;
    }

    // ==================== Public API ====================

    /**
     * Returns a future completed with a ready channel. Starts connecting if the manager is idle.
     * The future fails with {@link StatusCode#UNAVAILABLE} once the manager is shut down or
     * gives up reconnecting.
     */
    public Future<Channel> getChannel() {
        if (eventLoop.inEventLoop()) {
            return getChannel0();
        }
        Promise<Channel> result = eventLoop.newPromise();
        eventLoop.execute(() -> getChannel0().addListener(new PromiseNotifier<Channel, Future<Channel>>(result)));
        return result;
    }

    /**
     * Shuts the manager down, closing any channel it holds. The returned future completes once
     * the channel, if any, has closed. Idempotent.
     */
    public Future<Void> shutdown() {
        if (eventLoop.inEventLoop()) {
            return shutdown0();
        }
        Promise<Void> result = eventLoop.newPromise();
        eventLoop.execute(() -> shutdown0().addListener(new PromiseNotifier<Void, Future<Void>>(result)));
        return result;
    }

    // ==================== Lifecycle (from ConnectionIdleHandler) ====================

    @Override
    public void channelActive(Channel channel) {
        checkInEventLoop();
        if (state instanceof Connecting connecting) {
            LOGGER.debug("{}: channel {} active", logId(), channel);
            setState(connecting.toActive(channel));
        }
        else if (state instanceof Shutdown) {
            LOGGER.debug("{}: channel {} became active after shutdown, closing it", logId(), channel);
            channel.close();
        }
        else {
            invalidState("channelActive");
        }
    }

    @Override
    public void channelInactive() {
        checkInEventLoop();
        if (state instanceof Active active) {
            if (active.reconnect() instanceof Reconnect.After after) {
                setState(active.toTransientFailure(scheduleReconnect(after.delay())));
            }
            else {
                setState(new Shutdown(eventLoop.newSucceededFuture(null)));
                active.readyChannelPromise().tryFailure(unavailable("connection closed before becoming ready; no retries remaining"));
            }
        }
        else if (state instanceof Ready ready) {
            if (configuration.connectionBackoff() == null) {
                setState(new Shutdown(ready.channel().closeFuture()));
            }
            else {
                setState(ready.toTransientFailure(newBackoffIterator(), eventLoop.newPromise(), scheduleReconnect(Duration.ZERO)));
            }
        }
        else if (state instanceof Idle || state instanceof Shutdown) {
            LOGGER.trace("{}: channel inactive in state {}", logId(), state);
        }
        else {
            invalidState("channelInactive");
        }
    }

    @Override
    public void ready() {
        checkInEventLoop();
        if (state instanceof Active active) {
            LOGGER.info("{}: connection ready on {}", logId(), active.candidate());
            setState(active.toReady());
            active.readyChannelPromise().trySuccess(active.candidate());
        }
        else if (state instanceof Shutdown) {
            LOGGER.trace("{}: ready after shutdown", logId());
        }
        else {
            invalidState("ready");
        }
    }

    @Override
    public void idle() {
        checkInEventLoop();
        if (state instanceof Ready ready) {
            setState(ready.toIdle());
        }
        else if (state instanceof Active active) {
            // the peer went away before the handshake completed
            setState(Idle.INSTANCE);
            active.readyChannelPromise().tryFailure(unavailable("connection closed before becoming ready"));
        }
        else if (state instanceof Shutdown) {
            LOGGER.trace("{}: idle after shutdown", logId());
        }
        else {
            invalidState("idle");
        }
    }

    /**
     * The candidate channel could not be connected.
     */
    void connectionFailed(Throwable cause) {
        checkInEventLoop();
        if (state instanceof Connecting connecting) {
            if (connecting.reconnect() instanceof Reconnect.After after) {
                LOGGER.debug("{}: connection attempt failed, reconnecting in {}: {}", logId(), after.delay(), cause.getMessage());
                setState(connecting.toTransientFailure(scheduleReconnect(after.delay())));
            }
            else {
                LOGGER.warn("{}: connection attempt failed and no retries remain: {}", logId(), cause.getMessage());
                setState(new Shutdown(eventLoop.newSucceededFuture(null)));
                connecting.readyChannelPromise().tryFailure(cause);
            }
        }
        else if (state instanceof Shutdown) {
            LOGGER.trace("{}: connection attempt failed after shutdown: {}", logId(), cause.getMessage());
        }
        else {
            invalidState("connectionFailed");
        }
    }

    // ==================== Internals ====================

    private Future<Channel> getChannel0() {
        if (state instanceof Idle) {
            startConnecting();
            if (state instanceof Connecting connecting) {
                return connecting.readyChannelPromise();
            }
            throw invalidState("getChannel");
        }
        else if (state instanceof Connecting connecting) {
            return connecting.readyChannelPromise();
        }
        else if (state instanceof Active active) {
            return active.readyChannelPromise();
        }
        else if (state instanceof Ready ready) {
            return eventLoop.newSucceededFuture(ready.channel());
        }
        else if (state instanceof TransientFailure transientFailure) {
            return transientFailure.readyChannelPromise();
        }
        else {
            return eventLoop.newFailedFuture(unavailable("connection manager is shut down"));
        }
    }

    private Future<Void> shutdown0() {
        ConnectionManagerState current = state;
        if (current instanceof Shutdown shutdown) {
            return shutdown.closeFuture();
        }

        LOGGER.debug("{}: shutting down from {}", logId(), current);
        if (current instanceof Ready ready) {
            setState(new Shutdown(ready.channel().closeFuture()));
            ready.channel().close();
        }
        else {
            setState(new Shutdown(eventLoop.newSucceededFuture(null)));
            if (current instanceof Connecting connecting) {
                connecting.readyChannelPromise().tryFailure(unavailable("connection manager shut down"));
                connecting.candidate().addListener(future -> {
                    if (future.isSuccess()) {
                        ((Channel) future.getNow()).close();
                    }
                });
            }
            else if (current instanceof Active active) {
                active.readyChannelPromise().tryFailure(unavailable("connection manager shut down"));
                active.candidate().close();
            }
            else if (current instanceof TransientFailure transientFailure) {
                transientFailure.scheduledReconnect().cancel(false);
                transientFailure.readyChannelPromise().tryFailure(unavailable("connection manager shut down"));
            }
        }
        return ((Shutdown) state).closeFuture();
    }

    private void startConnecting() {
        if (state instanceof Idle idle) {
            Promise<Channel> readyChannelPromise = eventLoop.newPromise();
            ConnectionBackoffIterator backoffIterator = newBackoffIterator();
            TimeoutAndBackoff timeoutAndBackoff = nextBackoff(backoffIterator);
            setState(idle.toConnecting(backoffIterator, reconnectFor(timeoutAndBackoff), readyChannelPromise, connect(timeoutAndBackoff)));
        }
        else if (state instanceof TransientFailure transientFailure) {
            TimeoutAndBackoff timeoutAndBackoff = nextBackoff(transientFailure.backoffIterator());
            setState(transientFailure.toConnecting(reconnectFor(timeoutAndBackoff), connect(timeoutAndBackoff)));
        }
        else if (state instanceof Shutdown) {
            LOGGER.trace("{}: not connecting, already shut down", logId());
        }
        else {
            invalidState("startConnecting");
        }
    }

    /**
     * Creates the candidate channel on the next event loop tick so that events it fires arrive
     * after the manager has entered {@link Connecting}.
     */
    private Future<Channel> connect(@Nullable TimeoutAndBackoff timeoutAndBackoff) {
        Duration connectTimeout = timeoutAndBackoff == null ? null : timeoutAndBackoff.timeout();
        Promise<Channel> candidate = eventLoop.newPromise();
        connectionAttemptCounter.increment();
        eventLoop.execute(() -> {
            ChannelFuture connectFuture;
            try {
                connectFuture = channelProvider.makeChannel(this, connectTimeout);
            }
            catch (RuntimeException e) {
                candidate.tryFailure(e);
                connectionFailed(e);
                return;
            }
            connectFuture.addListener((ChannelFuture future) -> {
                if (future.isSuccess()) {
                    candidate.trySuccess(future.channel());
                }
                else {
                    candidate.tryFailure(future.cause());
                    execute(() -> connectionFailed(future.cause()));
                }
            });
        });
        return candidate;
    }

    private ScheduledFuture<?> scheduleReconnect(Duration delay) {
        transientFailureCounter.increment();
        return eventLoop.schedule(this::startConnecting, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Nullable
    private ConnectionBackoffIterator newBackoffIterator() {
        ConnectionBackoff backoff = configuration.connectionBackoff();
        return backoff == null ? null : backoff.iterator();
    }

    @Nullable
    private static TimeoutAndBackoff nextBackoff(@Nullable ConnectionBackoffIterator backoffIterator) {
        return backoffIterator != null && backoffIterator.hasNext() ? backoffIterator.next() : null;
    }

    private static Reconnect reconnectFor(@Nullable TimeoutAndBackoff timeoutAndBackoff) {
        return timeoutAndBackoff == null ? Reconnect.None.INSTANCE : new Reconnect.After(timeoutAndBackoff.backoff());
    }

    private void setState(ConnectionManagerState newState) {
        LOGGER.trace("{}: {} -> {}", logId(), state, newState);
        state = newState;
        if (newState instanceof Idle) {
            channelNumber++;
        }
        monitor.updateState(newState.connectivityState());
    }

    private void execute(Runnable task) {
        if (eventLoop.inEventLoop()) {
            task.run();
        }
        else {
            eventLoop.execute(task);
        }
    }

    private void checkInEventLoop() {
        if (!eventLoop.inEventLoop()) {
            throw new IllegalStateException(logId() + ": must be called on the connection manager's event loop");
        }
    }

    private IllegalStateException invalidState(String operation) {
        throw new IllegalStateException(logId() + ": invalid state " + state + " for " + operation);
    }

    private static RpcStatusException unavailable(String message) {
        return new RpcStatusException(RpcStatus.of(StatusCode.UNAVAILABLE, message));
    }

    @Override
    public String toString() {
        return "ConnectionManager{"
                + "id=" + logId()
                + ", state=" + state
                + '}';
    }
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

import java.time.Duration;
import java.util.Objects;

import io.netty.channel.Channel;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;

import io.rpclink.transport.backoff.ConnectionBackoffIterator;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Internal states of a {@link ConnectionManager}.
 *
 * <pre>
 *   Idle ──► Connecting ──► Active ──► Ready ──► Idle
 *              │   ▲          │          │
 *              ▼   │          ▼          │
 *          TransientFailure ◄────────────┘
 *
 *   any state ──► Shutdown
 * </pre>
 *
 * <p>{@link Active} is reported to the {@link ConnectivityStateMonitor} as
 * {@link ConnectivityState#CONNECTING}: the transport is up but the handshake has not completed.
 * {@link Shutdown} offers no transitions.</p>
 */
public sealed interface ConnectionManagerState permits
        ConnectionManagerState.Idle,
        ConnectionManagerState.Connecting,
        ConnectionManagerState.Active,
        ConnectionManagerState.Ready,
        ConnectionManagerState.TransientFailure,
        ConnectionManagerState.Shutdown {

    ConnectivityState connectivityState();

    /**
     * What to do if the current connection attempt fails.
     */
    sealed interface Reconnect permits Reconnect.None, Reconnect.After {

        /**
         * Give up: the backoff sequence is exhausted or reconnection is disabled.
         */
        record None() implements Reconnect {
            public static final None INSTANCE = new None();
        }

        record After(Duration delay) implements Reconnect {
            public After {
                Objects.requireNonNull(delay);
            }
        }
    }

    /**
     * No connection and no attempt in progress.
     */
    record Idle() implements ConnectionManagerState {
        public static final Idle INSTANCE = new Idle();

        @Override
        public ConnectivityState connectivityState() {
            return ConnectivityState.IDLE;
        }

        public Connecting toConnecting(@Nullable ConnectionBackoffIterator backoffIterator,
                                       Reconnect reconnect,
                                       Promise<Channel> readyChannelPromise,
                                       Future<Channel> candidate) {
            return new Connecting(backoffIterator, reconnect, readyChannelPromise, candidate);
        }
    }

    /**
     * Waiting for the transport of {@code candidate} to come up.
     */
    record Connecting(
                      @Nullable ConnectionBackoffIterator backoffIterator,
                      Reconnect reconnect,
                      Promise<Channel> readyChannelPromise,
                      Future<Channel> candidate)
            implements ConnectionManagerState {

        @Override
        public ConnectivityState connectivityState() {
            return ConnectivityState.CONNECTING;
        }

        public Active toActive(Channel channel) {
            return new Active(backoffIterator, reconnect, readyChannelPromise, channel);
        }

        public TransientFailure toTransientFailure(ScheduledFuture<?> scheduledReconnect) {
            return new TransientFailure(backoffIterator, readyChannelPromise, scheduledReconnect);
        }
    }

    /**
     * Transport up, waiting for the peer's handshake.
     */
    record Active(
                  @Nullable ConnectionBackoffIterator backoffIterator,
                  Reconnect reconnect,
                  Promise<Channel> readyChannelPromise,
                  Channel candidate)
            implements ConnectionManagerState {

        @Override
        public ConnectivityState connectivityState() {
            return ConnectivityState.CONNECTING;
        }

        public Ready toReady() {
            return new Ready(candidate);
        }

        public TransientFailure toTransientFailure(ScheduledFuture<?> scheduledReconnect) {
            return new TransientFailure(backoffIterator, readyChannelPromise, scheduledReconnect);
        }
    }

    /**
     * The connection is usable.
     */
    record Ready(Channel channel) implements ConnectionManagerState {

        @Override
        public ConnectivityState connectivityState() {
            return ConnectivityState.READY;
        }

        public Idle toIdle() {
            return Idle.INSTANCE;
        }

        /**
         * A ready connection that drops starts a fresh backoff sequence.
         */
        public TransientFailure toTransientFailure(@Nullable ConnectionBackoffIterator freshIterator,
                                                   Promise<Channel> freshPromise,
                                                   ScheduledFuture<?> scheduledReconnect) {
            return new TransientFailure(freshIterator, freshPromise, scheduledReconnect);
        }
    }

    /**
     * A reconnect is scheduled.
     */
    record TransientFailure(
                            @Nullable ConnectionBackoffIterator backoffIterator,
                            Promise<Channel> readyChannelPromise,
                            ScheduledFuture<?> scheduledReconnect)
            implements ConnectionManagerState {

        @Override
        public ConnectivityState connectivityState() {
            return ConnectivityState.TRANSIENT_FAILURE;
        }

        public Connecting toConnecting(Reconnect reconnect, Future<Channel> candidate) {
            return new Connecting(backoffIterator, reconnect, readyChannelPromise, candidate);
        }
    }

    /**
     * Terminal.
     */
    record Shutdown(Future<Void> closeFuture) implements ConnectionManagerState {

        @Override
        public ConnectivityState connectivityState() {
            return ConnectivityState.SHUTDOWN;
        }
    }
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Holds the {@link ConnectivityState} of a connection and tells interested parties about
 * changes to it.
 *
 * <p>Two kinds of observer are supported: a persistent {@link ConnectivityStateDelegate},
 * told about every change, and one-shot callbacks registered with
 * {@link #onNext(ConnectivityState, Runnable)} which run the next time the given state is
 * entered and are then forgotten.</p>
 *
 * <p>State updates come from the connection's event loop; {@link #state()} and
 * {@link #onNext(ConnectivityState, Runnable)} may be used from any thread.</p>
 */
public class ConnectivityStateMonitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectivityStateMonitor.class);

    private final @Nullable ConnectivityStateDelegate delegate;
    private final Map<ConnectivityState, Runnable> oneShotCallbacks = new ConcurrentHashMap<>();

    private volatile ConnectivityState state = ConnectivityState.IDLE;

    public ConnectivityStateMonitor(@Nullable ConnectivityStateDelegate delegate) {
        this.delegate = delegate;
    }

    public ConnectivityState state() {
        return state;
    }

    /**
     * Registers {@code callback} to run the next time {@code state} is entered. A callback
     * already registered for that state is replaced.
     */
    public void onNext(ConnectivityState state, Runnable callback) {
        oneShotCallbacks.put(Objects.requireNonNull(state), Objects.requireNonNull(callback));
    }

    /**
     * Moves to {@code newState}. Nothing happens if the state is unchanged; once
     * {@link ConnectivityState#SHUTDOWN} has been entered no other state is accepted.
     */
    void updateState(ConnectivityState newState) {
        ConnectivityState oldState = state;
        if (oldState == newState) {
            return;
        }
        if (oldState == ConnectivityState.SHUTDOWN) {
            LOGGER.warn("Ignoring connectivity state change from {} to {}", oldState, newState);
            return;
        }

        LOGGER.debug("Connectivity state change: {} -> {}", oldState, newState);
        state = newState;

        if (delegate != null) {
            try {
                delegate.connectivityStateDidChange(oldState, newState);
            }
            catch (RuntimeException e) {
                LOGGER.warn("Connectivity state delegate threw on {} -> {}", oldState, newState, e);
            }
        }

        Runnable callback = oneShotCallbacks.remove(newState);
        if (callback != null) {
            try {
                callback.run();
            }
            catch (RuntimeException e) {
                LOGGER.warn("Connectivity state callback for {} threw", newState, e);
            }
        }
    }
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

/**
 * Notified on every change of {@link ConnectivityState}. Called on the connection's event loop,
 * so implementations must not block.
 */
@FunctionalInterface
public interface ConnectivityStateDelegate {

    void connectivityStateDidChange(ConnectivityState oldState, ConnectivityState newState);
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

/**
 * The externally visible state of a logical connection.
 *
 * <pre>
 *   IDLE ◄──► CONNECTING ◄──► READY
 *               ▲  │            │
 *               │  ▼            │
 *         TRANSIENT_FAILURE ◄───┘
 *
 *   any state ──► SHUTDOWN (terminal)
 * </pre>
 */
public enum ConnectivityState {
    /** No connection exists and none is being attempted. */
    IDLE,
    /** A connection attempt is in progress. */
    CONNECTING,
    /** The connection is established and usable. */
    READY,
    /** The last attempt failed or the connection dropped; a reconnect is scheduled. */
    TRANSIENT_FAILURE,
    /** The connection has been shut down and will never be used again. */
    SHUTDOWN
}

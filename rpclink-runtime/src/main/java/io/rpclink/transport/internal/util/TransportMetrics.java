/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.internal.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;

import static io.micrometer.core.instrument.Metrics.globalRegistry;

/**
 * Meters published by the transport, registered with the global registry.
 */
public final class TransportMetrics {

    public static final String TARGET_LABEL = "target";

    public static final String CLIENT_CONNECTION_ATTEMPTS = "rpclink_client_connection_attempts";
    public static final String CLIENT_TRANSIENT_FAILURES = "rpclink_client_transient_failures";
    public static final String CONNECTION_IDLE_CLOSES = "rpclink_connection_idle_closes";

    private TransportMetrics() {
    }

    public static Meter.MeterProvider<Counter> connectionAttemptCounter() {
        return Counter.builder(CLIENT_CONNECTION_ATTEMPTS)
                .description("Number of connection attempts made by a client connection manager")
                .withRegistry(globalRegistry);
    }

    public static Meter.MeterProvider<Counter> transientFailureCounter() {
        return Counter.builder(CLIENT_TRANSIENT_FAILURES)
                .description("Number of times a client connection entered transient failure")
                .withRegistry(globalRegistry);
    }

    public static Meter.MeterProvider<Counter> idleCloseCounter() {
        return Counter.builder(CONNECTION_IDLE_CLOSES)
                .description("Number of connections closed because they were idle or the peer was going away")
                .withRegistry(globalRegistry);
    }
}

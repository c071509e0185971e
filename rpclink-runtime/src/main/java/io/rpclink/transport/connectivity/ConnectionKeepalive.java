/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

import java.time.Duration;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * HTTP/2 keepalive settings applied by the {@link ConnectionIdleHandler}.
 *
 * @param interval time between keepalive pings; {@code null} never pings
 * @param timeout how long to wait for a ping ack before closing the connection, shorter than {@code interval}
 * @param permitWithoutCalls whether to ping while no streams are open
 * @param maximumPingsWithoutData pings allowed while no streams are open before pinging stops
 * @param minimumSentPingIntervalWithoutData least time between two pings while no streams are open
 */
public record ConnectionKeepalive(
                                  @Nullable Duration interval,
                                  Duration timeout,
                                  boolean permitWithoutCalls,
                                  int maximumPingsWithoutData,
                                  Duration minimumSentPingIntervalWithoutData) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);
    public static final int DEFAULT_MAXIMUM_PINGS_WITHOUT_DATA = 2;
    public static final Duration DEFAULT_MINIMUM_SENT_PING_INTERVAL_WITHOUT_DATA = Duration.ofMinutes(5);

    /**
     * Clients do not ping unless asked to.
     */
    public static final ConnectionKeepalive CLIENT_DEFAULT = new ConnectionKeepalive(
            null,
            DEFAULT_TIMEOUT,
            false,
            DEFAULT_MAXIMUM_PINGS_WITHOUT_DATA,
            DEFAULT_MINIMUM_SENT_PING_INTERVAL_WITHOUT_DATA);

    public static final ConnectionKeepalive SERVER_DEFAULT = new ConnectionKeepalive(
            Duration.ofHours(2),
            DEFAULT_TIMEOUT,
            false,
            DEFAULT_MAXIMUM_PINGS_WITHOUT_DATA,
            DEFAULT_MINIMUM_SENT_PING_INTERVAL_WITHOUT_DATA);

    public ConnectionKeepalive {
        Objects.requireNonNull(timeout);
        Objects.requireNonNull(minimumSentPingIntervalWithoutData);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (interval != null && interval.compareTo(timeout) <= 0) {
            throw new IllegalArgumentException("interval (" + interval + ") must be greater than timeout (" + timeout + ")");
        }
        if (maximumPingsWithoutData < 0) {
            throw new IllegalArgumentException("maximumPingsWithoutData must not be negative: " + maximumPingsWithoutData);
        }
        if (minimumSentPingIntervalWithoutData.isNegative()) {
            throw new IllegalArgumentException("minimumSentPingIntervalWithoutData must not be negative: " + minimumSentPingIntervalWithoutData);
        }
    }

    public ConnectionKeepalive withInterval(@Nullable Duration interval) {
        return new ConnectionKeepalive(interval, timeout, permitWithoutCalls, maximumPingsWithoutData, minimumSentPingIntervalWithoutData);
    }

    public ConnectionKeepalive withTimeout(Duration timeout) {
        return new ConnectionKeepalive(interval, timeout, permitWithoutCalls, maximumPingsWithoutData, minimumSentPingIntervalWithoutData);
    }

    public ConnectionKeepalive withPermitWithoutCalls(boolean permitWithoutCalls) {
        return new ConnectionKeepalive(interval, timeout, permitWithoutCalls, maximumPingsWithoutData, minimumSentPingIntervalWithoutData);
    }

    public ConnectionKeepalive withMaximumPingsWithoutData(int maximumPingsWithoutData) {
        return new ConnectionKeepalive(interval, timeout, permitWithoutCalls, maximumPingsWithoutData, minimumSentPingIntervalWithoutData);
    }

    public ConnectionKeepalive withMinimumSentPingIntervalWithoutData(Duration minimumSentPingIntervalWithoutData) {
        return new ConnectionKeepalive(interval, timeout, permitWithoutCalls, maximumPingsWithoutData, minimumSentPingIntervalWithoutData);
    }
}

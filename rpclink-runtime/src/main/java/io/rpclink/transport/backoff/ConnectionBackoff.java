/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.backoff;

import java.time.Duration;
import java.util.Objects;

/**
 * Reconnection backoff configuration.
 *
 * <p>Iterating a {@code ConnectionBackoff} yields the {@link TimeoutAndBackoff} pairs for
 * successive connection attempts. Each call to {@link #iterator()} starts a fresh sequence.</p>
 *
 * @param initialBackoff backoff before the first retry
 * @param maximumBackoff upper bound of the unjittered backoff
 * @param multiplier growth factor applied between attempts
 * @param jitter fraction (0 to 1) of the unjittered backoff used as symmetric random jitter
 * @param minimumConnectionTimeout lower bound of every connection timeout
 * @param retries how many elements the sequence yields
 */
public record ConnectionBackoff(
                                Duration initialBackoff,
                                Duration maximumBackoff,
                                double multiplier,
                                double jitter,
                                Duration minimumConnectionTimeout,
                                Retries retries)
        implements Iterable<TimeoutAndBackoff> {

    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAXIMUM_BACKOFF = Duration.ofSeconds(120);
    public static final double DEFAULT_MULTIPLIER = 1.6;
    public static final double DEFAULT_JITTER = 0.2;
    public static final Duration DEFAULT_MINIMUM_CONNECTION_TIMEOUT = Duration.ofSeconds(20);

    public static final ConnectionBackoff DEFAULT = new ConnectionBackoff(
            DEFAULT_INITIAL_BACKOFF,
            DEFAULT_MAXIMUM_BACKOFF,
            DEFAULT_MULTIPLIER,
            DEFAULT_JITTER,
            DEFAULT_MINIMUM_CONNECTION_TIMEOUT,
            Retries.unlimited());

    public ConnectionBackoff {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maximumBackoff, "maximumBackoff");
        Objects.requireNonNull(minimumConnectionTimeout, "minimumConnectionTimeout");
        Objects.requireNonNull(retries, "retries");
        if (initialBackoff.isNegative() || maximumBackoff.isNegative() || minimumConnectionTimeout.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
        if (!(multiplier >= 1.0)) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
        if (!(jitter >= 0.0 && jitter <= 1.0)) {
            throw new IllegalArgumentException("jitter must be within [0, 1]: " + jitter);
        }
    }

    public ConnectionBackoff withInitialBackoff(Duration initialBackoff) {
        return new ConnectionBackoff(initialBackoff, maximumBackoff, multiplier, jitter, minimumConnectionTimeout, retries);
    }

    public ConnectionBackoff withMaximumBackoff(Duration maximumBackoff) {
        return new ConnectionBackoff(initialBackoff, maximumBackoff, multiplier, jitter, minimumConnectionTimeout, retries);
    }

    public ConnectionBackoff withMultiplier(double multiplier) {
        return new ConnectionBackoff(initialBackoff, maximumBackoff, multiplier, jitter, minimumConnectionTimeout, retries);
    }

    public ConnectionBackoff withJitter(double jitter) {
        return new ConnectionBackoff(initialBackoff, maximumBackoff, multiplier, jitter, minimumConnectionTimeout, retries);
    }

    public ConnectionBackoff withMinimumConnectionTimeout(Duration minimumConnectionTimeout) {
        return new ConnectionBackoff(initialBackoff, maximumBackoff, multiplier, jitter, minimumConnectionTimeout, retries);
    }

    public ConnectionBackoff withRetries(Retries retries) {
        return new ConnectionBackoff(initialBackoff, maximumBackoff, multiplier, jitter, minimumConnectionTimeout, retries);
    }

    @Override
    public ConnectionBackoffIterator iterator() {
        return new ConnectionBackoffIterator(this);
    }
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.backoff;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleBinaryOperator;

import io.rpclink.transport.tag.VisibleForTesting;

/**
 * Produces the successive {@link TimeoutAndBackoff} elements of a {@link ConnectionBackoff}.
 *
 * <p>The first element is based on {@code min(initialBackoff, maximumBackoff)}; every later
 * element multiplies the previous unjittered value, clamped to {@code maximumBackoff}. Jitter is
 * applied to every element and the returned timeout is never below the minimum connection
 * timeout.</p>
 *
 * <p>Not thread safe: advance only from the context driving reconnection.</p>
 */
public final class ConnectionBackoffIterator implements Iterator<TimeoutAndBackoff> {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final ConnectionBackoff backoff;
    private final DoubleBinaryOperator random;

    private final double initialSeconds;
    private final double maximumSeconds;
    private final double minimumConnectionTimeoutSeconds;

    // -1 means unlimited
    private int remaining;
    private double unjitteredSeconds;
    private boolean started;

    ConnectionBackoffIterator(ConnectionBackoff backoff) {
        this(backoff, (origin, bound) -> ThreadLocalRandom.current().nextDouble(origin, bound));
    }

    @VisibleForTesting
    ConnectionBackoffIterator(ConnectionBackoff backoff, DoubleBinaryOperator random) {
        this.backoff = Objects.requireNonNull(backoff);
        this.random = Objects.requireNonNull(random);
        this.initialSeconds = toSeconds(backoff.initialBackoff());
        this.maximumSeconds = toSeconds(backoff.maximumBackoff());
        this.minimumConnectionTimeoutSeconds = toSeconds(backoff.minimumConnectionTimeout());
        this.remaining = backoff.retries() instanceof Retries.UpTo upTo ? upTo.limit() : -1;
    }

    @Override
    public boolean hasNext() {
        return remaining != 0;
    }

    @Override
    public TimeoutAndBackoff next() {
        if (remaining == 0) {
            throw new NoSuchElementException("retry budget of " + backoff.retries() + " exhausted");
        }
        if (remaining > 0) {
            remaining--;
        }

        if (started) {
            unjitteredSeconds = Math.min(unjitteredSeconds * backoff.multiplier(), maximumSeconds);
        }
        else {
            unjitteredSeconds = Math.min(initialSeconds, maximumSeconds);
            started = true;
        }

        double jitteredSeconds = jittered(unjitteredSeconds);
        double timeoutSeconds = Math.max(jitteredSeconds, minimumConnectionTimeoutSeconds);
        return new TimeoutAndBackoff(toDuration(timeoutSeconds), toDuration(jitteredSeconds));
    }

    /**
     * The current unjittered backoff, zero before the first element has been produced.
     */
    public Duration unjitteredBackoff() {
        return toDuration(unjitteredSeconds);
    }

    private double jittered(double value) {
        double range = value * backoff.jitter();
        if (range <= 0) {
            return value;
        }
        return value + random.applyAsDouble(-range, range);
    }

    private static double toSeconds(Duration duration) {
        return duration.toNanos() / NANOS_PER_SECOND;
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * NANOS_PER_SECOND));
    }

    @Override
    public String toString() {
        return "ConnectionBackoffIterator{"
                + "retries=" + backoff.retries()
                + ", remaining=" + (remaining < 0 ? "unlimited" : remaining)
                + ", unjitteredSeconds=" + unjitteredSeconds
                + '}';
    }
}

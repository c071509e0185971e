/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.backoff;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionBackoffTest {

    private static final double DELTA = 1e-6;

    private static final ConnectionBackoff NO_JITTER = ConnectionBackoff.DEFAULT.withJitter(0.0);

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1e9;
    }

    // ==================== Configuration ====================

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Defaults match the interoperable constants")
        void defaults() {
            ConnectionBackoff backoff = ConnectionBackoff.DEFAULT;
            assertEquals(Duration.ofSeconds(1), backoff.initialBackoff());
            assertEquals(Duration.ofSeconds(120), backoff.maximumBackoff());
            assertEquals(1.6, backoff.multiplier());
            assertEquals(0.2, backoff.jitter());
            assertEquals(Duration.ofSeconds(20), backoff.minimumConnectionTimeout());
            assertEquals(Retries.unlimited(), backoff.retries());
        }

        @Test
        @DisplayName("Multiplier below one is rejected")
        void rejectsShrinkingMultiplier() {
            assertThrows(IllegalArgumentException.class, () -> ConnectionBackoff.DEFAULT.withMultiplier(0.5));
        }

        @ParameterizedTest
        @ValueSource(doubles = { -0.1, 1.1, Double.NaN })
        @DisplayName("Jitter outside [0, 1] is rejected")
        void rejectsInvalidJitter(double jitter) {
            assertThrows(IllegalArgumentException.class, () -> ConnectionBackoff.DEFAULT.withJitter(jitter));
        }

        @Test
        @DisplayName("Negative retry limit is rejected")
        void rejectsNegativeRetries() {
            assertThrows(IllegalArgumentException.class, () -> Retries.upTo(-1));
        }
    }

    // ==================== Sequence ====================

    @Nested
    @DisplayName("Sequence")
    class Sequence {

        @Test
        @DisplayName("Unjittered sequence grows by the multiplier and is clamped at the maximum")
        void growsAndClamps() {
            double[] expected = { 1.0, 1.6, 2.56, 4.096, 6.5536, 10.48576, 16.777216, 26.8435456,
                    42.94967296, 68.719476736, 109.9511627776, 120.0, 120.0, 120.0 };

            ConnectionBackoffIterator iterator = NO_JITTER.iterator();
            for (double value : expected) {
                TimeoutAndBackoff next = iterator.next();
                assertEquals(value, seconds(next.backoff()), DELTA);
                assertEquals(Math.max(value, 20.0), seconds(next.timeout()), DELTA);
            }
        }

        @Test
        @DisplayName("Initial backoff above the maximum starts at the maximum")
        void initialClampedToMaximum() {
            ConnectionBackoff backoff = NO_JITTER.withInitialBackoff(Duration.ofSeconds(200));
            ConnectionBackoffIterator iterator = backoff.iterator();
            assertEquals(120.0, seconds(iterator.next().backoff()), DELTA);
            assertEquals(120.0, seconds(iterator.next().backoff()), DELTA);
        }

        @Test
        @DisplayName("Timeout is never below the minimum connection timeout")
        void timeoutAtLeastMinimum() {
            ConnectionBackoffIterator iterator = ConnectionBackoff.DEFAULT.iterator();
            for (int i = 0; i < 50; i++) {
                TimeoutAndBackoff next = iterator.next();
                assertTrue(next.timeout().compareTo(Duration.ofSeconds(20)) >= 0, next::toString);
                assertTrue(next.timeout().compareTo(next.backoff()) >= 0, next::toString);
            }
        }

        @Test
        @DisplayName("Jittered backoff stays within the jitter fraction of the unjittered value")
        void jitterWithinBounds() {
            ConnectionBackoffIterator iterator = ConnectionBackoff.DEFAULT.iterator();
            for (int i = 0; i < 100; i++) {
                double jittered = seconds(iterator.next().backoff());
                double unjittered = seconds(iterator.unjitteredBackoff());
                assertTrue(jittered >= unjittered * 0.8 - DELTA, () -> jittered + " below " + unjittered);
                assertTrue(jittered <= unjittered * 1.2 + DELTA, () -> jittered + " above " + unjittered);
            }
        }

        @Test
        @DisplayName("Jitter is applied symmetrically around the unjittered value, first element included")
        void jitterIsSymmetric() {
            List<Double> ranges = new ArrayList<>();
            ConnectionBackoffIterator iterator = new ConnectionBackoffIterator(ConnectionBackoff.DEFAULT, (origin, bound) -> {
                assertEquals(-origin, bound, DELTA);
                ranges.add(bound);
                return bound;
            });

            assertEquals(1.2, seconds(iterator.next().backoff()), DELTA);
            assertEquals(1.6 * 1.2, seconds(iterator.next().backoff()), DELTA);
            assertEquals(List.of(0.2, 1.6 * 0.2), ranges.stream().map(r -> Math.round(r * 1e6) / 1e6).toList());
        }

        @Test
        @DisplayName("Each iteration starts a fresh sequence")
        void iterationsAreIndependent() {
            ConnectionBackoffIterator first = NO_JITTER.iterator();
            first.next();
            first.next();
            assertEquals(1.0, seconds(NO_JITTER.iterator().next().backoff()), DELTA);
        }
    }

    // ==================== Retries ====================

    @Nested
    @DisplayName("Retries")
    class RetryBudget {

        @Test
        @DisplayName("upTo(0) yields no elements")
        void zeroRetries() {
            ConnectionBackoffIterator iterator = NO_JITTER.withRetries(Retries.upTo(0)).iterator();
            assertFalse(iterator.hasNext());
            assertThrows(NoSuchElementException.class, iterator::next);
        }

        @Test
        @DisplayName("upTo(3) yields exactly three elements")
        void threeRetries() {
            List<TimeoutAndBackoff> elements = new ArrayList<>();
            NO_JITTER.withRetries(Retries.upTo(3)).forEach(elements::add);

            assertEquals(3, elements.size());
            assertEquals(1.0, seconds(elements.get(0).backoff()), DELTA);
            assertEquals(1.6, seconds(elements.get(1).backoff()), DELTA);
            assertEquals(2.56, seconds(elements.get(2).backoff()), DELTA);
        }

        @Test
        @DisplayName("Unlimited retries never end")
        void unlimited() {
            ConnectionBackoffIterator iterator = NO_JITTER.iterator();
            for (int i = 0; i < 1000; i++) {
                assertTrue(iterator.hasNext());
                iterator.next();
            }
            assertTrue(iterator.hasNext());
        }
    }
}

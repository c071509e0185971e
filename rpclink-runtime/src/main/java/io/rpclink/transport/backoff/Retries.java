/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.backoff;

/**
 * How many connection attempts a {@link ConnectionBackoff} permits.
 */
public sealed interface Retries permits Retries.Unlimited, Retries.UpTo {

    static Retries unlimited() {
        return Unlimited.INSTANCE;
    }

    static Retries upTo(int limit) {
        return new UpTo(limit);
    }

    /**
     * No limit: the backoff sequence never ends.
     */
    record Unlimited() implements Retries {
        public static final Unlimited INSTANCE = new Unlimited();

        @Override
        public String toString() {
            return "unlimited";
        }
    }

    /**
     * The backoff sequence yields exactly {@code limit} elements.
     */
    record UpTo(int limit) implements Retries {
        public UpTo {
            if (limit < 0) {
                throw new IllegalArgumentException("retry limit must not be negative: " + limit);
            }
        }

        @Override
        public String toString() {
            return "upTo(" + limit + ")";
        }
    }
}

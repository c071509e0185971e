/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.backoff;

import java.time.Duration;
import java.util.Objects;

/**
 * One element of a backoff sequence.
 *
 * @param timeout how long the connection attempt may take
 * @param backoff how long to wait after a failed attempt before the next one
 */
public record TimeoutAndBackoff(Duration timeout, Duration backoff) {
    public TimeoutAndBackoff {
        Objects.requireNonNull(timeout);
        Objects.requireNonNull(backoff);
    }
}

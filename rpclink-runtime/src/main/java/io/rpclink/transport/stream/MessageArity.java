/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.stream;

/**
 * The number of messages a stream direction may carry.
 */
public enum MessageArity {
    /** Exactly one message, as for the request of a unary or server-streaming call. */
    ONE,
    /** Any number of messages. */
    MANY
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.stream;

import java.util.Objects;

import io.rpclink.transport.framing.LengthPrefixedMessageReader;

/**
 * Read side of a stream.
 *
 * <pre>
 *   Reading(ONE)  ── 0 messages ──► Reading(ONE)
 *   Reading(ONE)  ── 1 message ───► NotReading
 *   Reading(ONE)  ── 2+ messages ─► NotReading (cardinality violation)
 *   Reading(MANY) ── n messages ──► Reading(MANY)
 *   Reading(*)    ── failure ─────► NotReading
 * </pre>
 *
 * {@link NotReading} has no transitions.
 */
public sealed interface ReadState permits ReadState.Reading, ReadState.NotReading {

    record Reading(MessageArity arity, LengthPrefixedMessageReader reader) implements ReadState {
        public Reading {
            Objects.requireNonNull(arity);
            Objects.requireNonNull(reader);
        }

        public NotReading toNotReading() {
            return NotReading.INSTANCE;
        }
    }

    /**
     * Terminal: no more messages may be read.
     */
    record NotReading() implements ReadState {
        public static final NotReading INSTANCE = new NotReading();
    }

    default boolean isReading() {
        return this instanceof Reading;
    }
}

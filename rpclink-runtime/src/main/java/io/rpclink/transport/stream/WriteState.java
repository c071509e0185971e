/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.stream;

import java.util.Objects;

import io.rpclink.transport.framing.CoalescingLengthPrefixedMessageWriter;

/**
 * Write side of a stream.
 *
 * <pre>
 *   Writing(ONE)  ── write ──► NotWriting
 *   Writing(MANY) ── write ──► Writing(MANY)
 *   Writing(*)    ── serialization failure ──► NotWriting
 * </pre>
 *
 * {@link NotWriting} has no transitions.
 */
public sealed interface WriteState permits WriteState.Writing, WriteState.NotWriting {

    record Writing(MessageArity arity, CoalescingLengthPrefixedMessageWriter writer) implements WriteState {
        public Writing {
            Objects.requireNonNull(arity);
            Objects.requireNonNull(writer);
        }

        /**
         * The state after a message has been successfully framed.
         */
        public WriteState afterWrite() {
            return arity == MessageArity.ONE ? NotWriting.INSTANCE : this;
        }

        public NotWriting toNotWriting() {
            return NotWriting.INSTANCE;
        }
    }

    /**
     * Terminal: no more messages may be written.
     */
    record NotWriting() implements WriteState {
        public static final NotWriting INSTANCE = new NotWriting();
    }

    default boolean isWriting() {
        return this instanceof Writing;
    }
}

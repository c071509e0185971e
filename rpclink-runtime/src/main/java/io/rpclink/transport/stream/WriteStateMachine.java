/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.stream;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.ChannelPromise;

import io.rpclink.transport.framing.CoalescingLengthPrefixedMessageWriter;
import io.rpclink.transport.framing.MessageEncoding;
import io.rpclink.transport.framing.MessageWriteException;
import io.rpclink.transport.framing.OutboundFrame;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Serializes and frames the outbound messages of one stream, enforcing its {@link MessageArity}.
 *
 * <p>A stream of arity {@link MessageArity#ONE} accepts exactly one message; a second write is a
 * cardinality violation. A serialization failure closes the write side for good. Messages that
 * were accepted stay queued in the framer and are drained with {@link #next()} regardless of
 * the write state.</p>
 *
 * @param <T> the message type
 */
public class WriteStateMachine<T> implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WriteStateMachine.class);

    private final String streamName;
    private final MessageSerializer<T> serializer;
    private final ByteBufAllocator allocator;
    private final CoalescingLengthPrefixedMessageWriter writer;

    private WriteState state;
    private boolean closed;

    public WriteStateMachine(
                             String streamName,
                             MessageArity arity,
                             MessageSerializer<T> serializer,
                             MessageEncoding encoding,
                             ByteBufAllocator allocator) {
        this.streamName = Objects.requireNonNull(streamName);
        this.serializer = Objects.requireNonNull(serializer);
        this.allocator = Objects.requireNonNull(allocator);
        this.writer = new CoalescingLengthPrefixedMessageWriter(encoding.outbound(), allocator);
        this.state = new WriteState.Writing(arity, writer);
    }

    public WriteState state() {
        return state;
    }

    /**
     * Serializes {@code message} and queues it for framing.
     *
     * @param compress whether the message should be compressed, if compression is configured
     * @param promise completed once the frame carrying the message has been written
     * @throws MessageWriteException if the write side is closed, the machine has been closed or
     * the message cannot be serialized
     */
    public void write(T message, boolean compress, @Nullable ChannelPromise promise) {
        if (closed) {
            throw MessageWriteException.invalidState(streamName + ": write attempted after the stream was closed");
        }
        if (state instanceof WriteState.Writing writing) {
            ByteBuf serialized;
            try {
                serialized = serializer.serialize(message, allocator);
            }
            catch (Exception e) {
                setState(writing.toNotWriting());
                throw MessageWriteException.serializationFailed(e);
            }
            writing.writer().append(serialized, compress, promise);
            setState(writing.afterWrite());
        }
        else {
            throw MessageWriteException.cardinalityViolation(streamName + ": write attempted after the write side was closed");
        }
    }

    /**
     * The next unit to put on the wire, or {@code null} once the framer is drained.
     */
    @Nullable
    public OutboundFrame next() {
        return writer.next();
    }

    public boolean hasPending() {
        return writer.hasPending();
    }

    /**
     * Drops any framed-but-unwritten messages, failing their promises.
     */
    public void discardPending(Throwable cause) {
        writer.discardPending(cause);
    }

    @Override
    public void close() {
        closed = true;
        writer.close();
    }

    private void setState(WriteState newState) {
        if (newState != state) {
            LOGGER.trace("{}: write state {} -> {}", streamName, state, newState);
            state = newState;
        }
    }
}

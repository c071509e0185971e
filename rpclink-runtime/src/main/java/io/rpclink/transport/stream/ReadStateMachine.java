/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import io.rpclink.transport.framing.LengthPrefixedMessageReader;
import io.rpclink.transport.framing.MessageEncoding;
import io.rpclink.transport.framing.MessageReadException;

/**
 * Parses and deserializes the inbound messages of one stream, enforcing its {@link MessageArity}.
 *
 * <p>Any failure, including a cardinality violation, closes the read side for good.</p>
 *
 * @param <T> the message type
 */
public class ReadStateMachine<T> implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReadStateMachine.class);

    private final String streamName;
    private final MessageDeserializer<T> deserializer;
    private final int maximumMessageLength;

    private ReadState state;
    private boolean closed;

    public ReadStateMachine(
                            String streamName,
                            MessageArity arity,
                            MessageDeserializer<T> deserializer,
                            MessageEncoding encoding,
                            ByteBufAllocator allocator) {
        this.streamName = Objects.requireNonNull(streamName);
        this.deserializer = Objects.requireNonNull(deserializer);
        this.maximumMessageLength = encoding.maximumMessageLength();
        this.state = new ReadState.Reading(arity,
                new LengthPrefixedMessageReader(allocator, encoding.inbound(), encoding.decompressionLimit()));
    }

    public ReadState state() {
        return state;
    }

    /**
     * Appends the readable bytes of {@code buffer} and returns every message completed by them.
     * The caller keeps ownership of {@code buffer}.
     *
     * @return the decoded messages, possibly none
     * @throws MessageReadException if the read side is closed, the stream's arity is violated,
     * bytes follow the single message of an arity {@link MessageArity#ONE} stream, or a message
     * cannot be parsed, decompressed or deserialized, or if the machine has been closed
     */
    public List<T> readMessages(ByteBuf buffer) {
        if (closed) {
            throw MessageReadException.invalidState(streamName + ": read attempted after the stream was closed");
        }
        if (!(state instanceof ReadState.Reading reading)) {
            throw MessageReadException.cardinalityViolation(streamName + ": read attempted after the read side was closed");
        }

        LengthPrefixedMessageReader reader = reading.reader();
        reader.append(buffer);

        List<T> messages = new ArrayList<>(1);
        try {
            ByteBuf payload;
            while ((payload = reader.nextMessage(maximumMessageLength)) != null) {
                messages.add(deserialize(payload));
            }
        }
        catch (MessageReadException e) {
            toNotReading(reading);
            throw e;
        }

        if (reading.arity() == MessageArity.MANY || messages.isEmpty()) {
            return messages;
        }
        else if (messages.size() == 1) {
            int unprocessed = reader.unprocessedBytes();
            boolean partialFrame = reader.isReading();
            toNotReading(reading);
            if (unprocessed != 0 || partialFrame) {
                throw MessageReadException.leftOverBytes(unprocessed);
            }
            return messages;
        }
        else {
            toNotReading(reading);
            throw MessageReadException.cardinalityViolation(
                    streamName + ": expected a single message but received " + messages.size());
        }
    }

    @Override
    public void close() {
        closed = true;
        if (state instanceof ReadState.Reading reading) {
            toNotReading(reading);
        }
    }

    private T deserialize(ByteBuf payload) {
        try {
            return deserializer.deserialize(payload);
        }
        catch (Exception e) {
            throw MessageReadException.deserializationFailed(e);
        }
        finally {
            payload.release();
        }
    }

    private void toNotReading(ReadState.Reading reading) {
        LOGGER.trace("{}: read state {} -> NotReading", streamName, reading);
        reading.reader().close();
        state = reading.toNotReading();
    }
}

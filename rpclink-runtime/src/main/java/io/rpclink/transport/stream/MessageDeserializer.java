/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.stream;

import io.netty.buffer.ByteBuf;

/**
 * Turns payload bytes back into an application message.
 *
 * @param <T> the message type
 */
@FunctionalInterface
public interface MessageDeserializer<T> {

    /**
     * @param payload the message bytes; released by the caller once this method returns
     * @throws Exception if the bytes are not a valid message
     */
    T deserialize(ByteBuf payload) throws Exception;
}

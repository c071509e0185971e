/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.stream;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

/**
 * Turns an application message into its payload bytes.
 *
 * @param <T> the message type
 */
@FunctionalInterface
public interface MessageSerializer<T> {

    /**
     * @return a buffer owned by the caller
     * @throws Exception if the message cannot be serialized
     */
    ByteBuf serialize(T message, ByteBufAllocator allocator) throws Exception;
}

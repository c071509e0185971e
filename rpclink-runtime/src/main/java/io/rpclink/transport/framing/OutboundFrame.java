/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.framing;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelPromise;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A unit produced by {@link CoalescingLengthPrefixedMessageWriter#next()}.
 */
public sealed interface OutboundFrame permits OutboundFrame.Frame, OutboundFrame.Failure {

    /**
     * The promise to complete once this unit has been written, if any.
     */
    @Nullable
    ChannelPromise promise();

    /**
     * Bytes ready for the wire. Ownership of {@code buffer} passes to the caller.
     */
    record Frame(ByteBuf buffer, @Nullable ChannelPromise promise) implements OutboundFrame {}

    /**
     * Encoding the batch failed; the messages in it have been dropped.
     */
    record Failure(Throwable cause, @Nullable ChannelPromise promise) implements OutboundFrame {}
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

import java.time.Duration;

import io.netty.channel.ChannelFuture;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Creates the physical connections of a {@link ConnectionManager}.
 *
 * <p>The channel's pipeline must contain a {@link ConnectionIdleHandler} bound to the manager
 * so that the manager learns about the channel's lifecycle.</p>
 */
@FunctionalInterface
public interface ChannelProvider {

    /**
     * Starts connecting a new channel.
     *
     * @param connectionManager the manager the channel reports to
     * @param connectTimeout how long the attempt may take, or {@code null} for the transport default
     * @return a future completed once the channel is connected
     */
    ChannelFuture makeChannel(ConnectionManager connectionManager, @Nullable Duration connectTimeout);
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

import io.netty.channel.Channel;

/**
 * Lifecycle entry points called by {@link ConnectionIdleHandler} as a physical connection
 * progresses. All methods are called on the connection's event loop.
 */
public interface ConnectionLifecycle {

    /**
     * The transport of {@code channel} is up; the protocol handshake has not completed yet.
     */
    void channelActive(Channel channel);

    /**
     * The transport went down.
     */
    void channelInactive();

    /**
     * The peer's handshake completed: the connection can carry streams.
     */
    void ready();

    /**
     * The connection is being closed because it was idle or the peer is going away.
     */
    void idle();
}

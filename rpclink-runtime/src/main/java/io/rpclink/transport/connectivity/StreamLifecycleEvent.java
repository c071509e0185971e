/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

/**
 * User events fired down a connection's pipeline by the stream multiplexer as logical streams
 * open and close.
 */
public sealed interface StreamLifecycleEvent permits StreamLifecycleEvent.StreamCreated, StreamLifecycleEvent.StreamClosed {

    int streamId();

    record StreamCreated(int streamId) implements StreamLifecycleEvent {}

    record StreamClosed(int streamId) implements StreamLifecycleEvent {}
}

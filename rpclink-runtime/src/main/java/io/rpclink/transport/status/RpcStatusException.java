/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.status;

import java.util.Objects;

/**
 * Failure carrying an {@link RpcStatus}, used to fail futures handed to callers.
 */
public class RpcStatusException extends RuntimeException {

    private final RpcStatus status;

    public RpcStatusException(RpcStatus status) {
        super(status.toString());
        this.status = Objects.requireNonNull(status);
    }

    public RpcStatusException(RpcStatus status, Throwable cause) {
        super(status.toString(), cause);
        this.status = Objects.requireNonNull(status);
    }

    public RpcStatus status() {
        return status;
    }
}

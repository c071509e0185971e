/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.status;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The outcome of an RPC: a code and an optional human readable message.
 */
public record RpcStatus(StatusCode code, @Nullable String message) {

    public static final RpcStatus OK = new RpcStatus(StatusCode.OK, null);

    public RpcStatus {
        Objects.requireNonNull(code);
    }

    public static RpcStatus of(StatusCode code) {
        return code == StatusCode.OK ? OK : new RpcStatus(code, null);
    }

    public static RpcStatus of(StatusCode code, @Nullable String message) {
        return new RpcStatus(code, message);
    }

    public boolean isOk() {
        return code == StatusCode.OK;
    }

    @Override
    public String toString() {
        return message == null ? code.name() : code.name() + ": " + message;
    }
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.framing;

import java.util.Objects;

import io.rpclink.transport.status.RpcStatus;
import io.rpclink.transport.status.StatusCode;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Failure writing a message to a stream. Once raised the stream's write path is closed.
 */
public class MessageWriteException extends RuntimeException {

    public enum Reason {
        CARDINALITY_VIOLATION,
        SERIALIZATION_FAILED,
        INVALID_STATE
    }

    private final Reason reason;

    private MessageWriteException(Reason reason, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason);
    }

    public static MessageWriteException cardinalityViolation(String message) {
        return new MessageWriteException(Reason.CARDINALITY_VIOLATION, message, null);
    }

    public static MessageWriteException serializationFailed(Throwable cause) {
        return new MessageWriteException(Reason.SERIALIZATION_FAILED, "failed to serialize message: " + cause.getMessage(), cause);
    }

    public static MessageWriteException invalidState(String message) {
        return new MessageWriteException(Reason.INVALID_STATE, message, null);
    }

    public Reason reason() {
        return reason;
    }

    public RpcStatus toStatus() {
        return RpcStatus.of(StatusCode.INTERNAL, getMessage());
    }
}

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
 * Failure reading messages from a stream. The failure is scoped to that stream: its read
 * path stops but the connection and the other streams carry on.
 */
public class MessageReadException extends RuntimeException {

    public enum Reason {
        CARDINALITY_VIOLATION(StatusCode.INTERNAL),
        LEFT_OVER_BYTES(StatusCode.INTERNAL),
        DESERIALIZATION_FAILED(StatusCode.INTERNAL),
        DECOMPRESSION_FAILED(StatusCode.INTERNAL),
        DECOMPRESSION_LIMIT_EXCEEDED(StatusCode.RESOURCE_EXHAUSTED),
        COMPRESSION_UNSUPPORTED(StatusCode.UNIMPLEMENTED),
        PAYLOAD_LENGTH_LIMIT_EXCEEDED(StatusCode.RESOURCE_EXHAUSTED),
        INVALID_STATE(StatusCode.INTERNAL);

        private final StatusCode statusCode;

        Reason(StatusCode statusCode) {
            this.statusCode = statusCode;
        }

        public StatusCode statusCode() {
            return statusCode;
        }
    }

    private final Reason reason;
    private final int compressedSize;

    private MessageReadException(Reason reason, String message, @Nullable Throwable cause, int compressedSize) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason);
        this.compressedSize = compressedSize;
    }

    public static MessageReadException cardinalityViolation(String message) {
        return new MessageReadException(Reason.CARDINALITY_VIOLATION, message, null, -1);
    }

    public static MessageReadException leftOverBytes(int unprocessedBytes) {
        return new MessageReadException(Reason.LEFT_OVER_BYTES,
                "unexpected data after the single expected message (" + unprocessedBytes + " unprocessed bytes)", null, -1);
    }

    public static MessageReadException deserializationFailed(Throwable cause) {
        return new MessageReadException(Reason.DESERIALIZATION_FAILED, "failed to deserialize message: " + cause.getMessage(), cause, -1);
    }

    public static MessageReadException decompressionFailed(Throwable cause) {
        return new MessageReadException(Reason.DECOMPRESSION_FAILED, "failed to decompress message: " + cause.getMessage(), cause, -1);
    }

    public static MessageReadException decompressionLimitExceeded(int compressedSize) {
        return new MessageReadException(Reason.DECOMPRESSION_LIMIT_EXCEEDED,
                "decompression limit exceeded by message with compressed size " + compressedSize, null, compressedSize);
    }

    public static MessageReadException compressionUnsupported() {
        return new MessageReadException(Reason.COMPRESSION_UNSUPPORTED, "received a compressed message but no decompressor is configured", null, -1);
    }

    public static MessageReadException payloadLengthLimitExceeded(long actualLength, int limit) {
        return new MessageReadException(Reason.PAYLOAD_LENGTH_LIMIT_EXCEEDED,
                "message length " + actualLength + " exceeds the limit of " + limit, null, -1);
    }

    public static MessageReadException invalidState(String message) {
        return new MessageReadException(Reason.INVALID_STATE, message, null, -1);
    }

    public Reason reason() {
        return reason;
    }

    /**
     * The compressed size of the offending message when the reason is
     * {@link Reason#DECOMPRESSION_LIMIT_EXCEEDED}, otherwise {@code -1}.
     */
    public int compressedSize() {
        return compressedSize;
    }

    public RpcStatus toStatus() {
        return RpcStatus.of(reason.statusCode(), getMessage());
    }
}

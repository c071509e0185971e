/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.status;

import java.util.Objects;

import io.netty.handler.codec.http2.DefaultHttp2Headers;
import io.netty.handler.codec.http2.Http2Headers;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The status of a completed call together with any trailing metadata. The trailers are copied
 * on the way in and out, so neither the caller's headers nor the returned ones alias this
 * value.
 */
public record StatusAndTrailers(RpcStatus status, @Nullable Http2Headers trailers) {

    public static final String STATUS_HEADER = "grpc-status";
    public static final String MESSAGE_HEADER = "grpc-message";

    public StatusAndTrailers {
        Objects.requireNonNull(status);
        trailers = copyOf(trailers);
    }

    @Override
    @Nullable
    public Http2Headers trailers() {
        return copyOf(trailers);
    }

    public static StatusAndTrailers of(RpcStatus status) {
        return new StatusAndTrailers(status, null);
    }

    /**
     * Builds the trailer block for this status: any trailing metadata followed by the status
     * code and, when present, the percent-encoded status message.
     */
    public Http2Headers toHeaders() {
        Http2Headers headers = new DefaultHttp2Headers();
        if (trailers != null) {
            headers.add(trailers);
        }
        headers.set(STATUS_HEADER, Integer.toString(status.code().value()));
        if (status.message() != null) {
            headers.set(MESSAGE_HEADER, StatusMessageMarshaller.marshall(status.message()));
        }
        else {
            headers.remove(MESSAGE_HEADER);
        }
        return headers;
    }

    /**
     * Extracts the status from a received trailer block. A missing or unparseable status code
     * is reported as {@link StatusCode#UNKNOWN}.
     */
    public static StatusAndTrailers fromHeaders(Http2Headers headers) {
        CharSequence code = headers.get(STATUS_HEADER);
        CharSequence message = headers.get(MESSAGE_HEADER);
        StatusCode statusCode = parseCode(code);
        String unmarshalled = message == null ? null : StatusMessageMarshaller.unmarshall(message.toString());
        if (code == null && unmarshalled == null) {
            unmarshalled = "missing " + STATUS_HEADER + " trailer";
        }
        return new StatusAndTrailers(new RpcStatus(statusCode, unmarshalled), headers);
    }

    @Nullable
    private static Http2Headers copyOf(@Nullable Http2Headers headers) {
        return headers == null ? null : new DefaultHttp2Headers().add(headers);
    }

    private static StatusCode parseCode(@Nullable CharSequence code) {
        if (code == null) {
            return StatusCode.UNKNOWN;
        }
        try {
            return StatusCode.fromValue(Integer.parseInt(code.toString().trim()));
        }
        catch (NumberFormatException e) {
            return StatusCode.UNKNOWN;
        }
    }
}

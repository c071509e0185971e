/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.status;

import java.util.Locale;
import java.util.Optional;

/**
 * The content-type tokens recognised for RPC requests and responses.
 */
public enum ContentType {
    PROTOBUF("application/grpc", Framing.BINARY),
    PROTOBUF_EXPLICIT("application/grpc+proto", Framing.BINARY),
    WEB_PROTOBUF("application/grpc-web", Framing.WEB),
    WEB_PROTOBUF_EXPLICIT("application/grpc-web+proto", Framing.WEB),
    WEB_TEXT_PROTOBUF("application/grpc-web-text", Framing.WEB_TEXT),
    WEB_TEXT_PROTOBUF_EXPLICIT("application/grpc-web-text+proto", Framing.WEB_TEXT);

    /**
     * How message frames are carried for a content type. Base64 handling of web-text is done
     * outside this package.
     */
    public enum Framing {
        BINARY,
        WEB,
        WEB_TEXT
    }

    private final String token;
    private final Framing framing;

    ContentType(String token, Framing framing) {
        this.token = token;
        this.framing = framing;
    }

    public String token() {
        return token;
    }

    public Framing framing() {
        return framing;
    }

    /**
     * The token used when sending a message of this framing, the short form of each pair.
     */
    public String canonicalToken() {
        return switch (framing) {
            case BINARY -> PROTOBUF.token;
            case WEB -> WEB_PROTOBUF.token;
            case WEB_TEXT -> WEB_TEXT_PROTOBUF.token;
        };
    }

    /**
     * Parses a content-type header value. Parameters following {@code ';'} are ignored.
     */
    public static Optional<ContentType> fromHeaderValue(CharSequence value) {
        String mediaType = value.toString();
        int parameters = mediaType.indexOf(';');
        if (parameters >= 0) {
            mediaType = mediaType.substring(0, parameters);
        }
        mediaType = mediaType.trim().toLowerCase(Locale.ROOT);
        for (ContentType contentType : values()) {
            if (contentType.token.equals(mediaType)) {
                return Optional.of(contentType);
            }
        }
        return Optional.empty();
    }
}

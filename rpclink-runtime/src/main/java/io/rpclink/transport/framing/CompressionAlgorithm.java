/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.framing;

import java.util.Locale;
import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Message compression algorithms, named as they appear in the message-encoding headers.
 */
public enum CompressionAlgorithm {
    IDENTITY("identity", null),
    DEFLATE("deflate", Zlib.Format.DEFLATE),
    GZIP("gzip", Zlib.Format.GZIP);

    private final String headerName;
    private final @Nullable Zlib.Format format;

    CompressionAlgorithm(String headerName, @Nullable Zlib.Format format) {
        this.headerName = headerName;
        this.format = format;
    }

    public String headerName() {
        return headerName;
    }

    /**
     * The zlib format backing this algorithm, or {@code null} for {@link #IDENTITY}.
     */
    @Nullable
    public Zlib.Format format() {
        return format;
    }

    public static Optional<CompressionAlgorithm> fromHeaderName(String name) {
        String normalised = name.trim().toLowerCase(Locale.ROOT);
        for (CompressionAlgorithm algorithm : values()) {
            if (algorithm.headerName.equals(normalised)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }
}

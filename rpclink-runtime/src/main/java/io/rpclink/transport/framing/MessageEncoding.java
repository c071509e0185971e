/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.framing;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Compression and size settings for the messages of one call.
 *
 * @param outbound algorithm used to compress outbound messages, {@code null} to never compress
 * @param inbound algorithm expected on compressed inbound messages, {@code null} to reject them
 * @param decompressionLimit bound on the decompressed size of inbound messages
 * @param maximumMessageLength largest accepted inbound length prefix
 */
public record MessageEncoding(
                              @Nullable CompressionAlgorithm outbound,
                              @Nullable CompressionAlgorithm inbound,
                              DecompressionLimit decompressionLimit,
                              int maximumMessageLength) {

    public static final int DEFAULT_MAXIMUM_MESSAGE_LENGTH = 4 * 1024 * 1024;
    public static final DecompressionLimit DEFAULT_DECOMPRESSION_LIMIT = DecompressionLimit.ratio(20);

    public static final MessageEncoding DISABLED = new MessageEncoding(null, null, DEFAULT_DECOMPRESSION_LIMIT, DEFAULT_MAXIMUM_MESSAGE_LENGTH);

    public MessageEncoding {
        Objects.requireNonNull(decompressionLimit);
        if (maximumMessageLength < 0) {
            throw new IllegalArgumentException("maximumMessageLength must not be negative: " + maximumMessageLength);
        }
    }

    public static MessageEncoding compressed(CompressionAlgorithm algorithm) {
        return new MessageEncoding(algorithm, algorithm, DEFAULT_DECOMPRESSION_LIMIT, DEFAULT_MAXIMUM_MESSAGE_LENGTH);
    }

    public MessageEncoding withDecompressionLimit(DecompressionLimit decompressionLimit) {
        return new MessageEncoding(outbound, inbound, decompressionLimit, maximumMessageLength);
    }

    public MessageEncoding withMaximumMessageLength(int maximumMessageLength) {
        return new MessageEncoding(outbound, inbound, decompressionLimit, maximumMessageLength);
    }
}

/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.framing;

/**
 * Upper bound on the size of a decompressed message.
 */
public sealed interface DecompressionLimit permits DecompressionLimit.Absolute, DecompressionLimit.Ratio {

    static DecompressionLimit absolute(long limit) {
        return new Absolute(limit);
    }

    static DecompressionLimit ratio(int ratio) {
        return new Ratio(ratio);
    }

    /**
     * The largest permitted decompressed size for a message of the given compressed size.
     */
    long maximumDecompressedSize(int compressedSize);

    /**
     * A fixed number of bytes, whatever the compressed size.
     */
    record Absolute(long limit) implements DecompressionLimit {
        public Absolute {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must not be negative: " + limit);
            }
        }

        @Override
        public long maximumDecompressedSize(int compressedSize) {
            return limit;
        }
    }

    /**
     * A multiple of the compressed size.
     */
    record Ratio(int ratio) implements DecompressionLimit {
        public Ratio {
            if (ratio <= 0) {
                throw new IllegalArgumentException("ratio must be positive: " + ratio);
            }
        }

        @Override
        public long maximumDecompressedSize(int compressedSize) {
            return (long) ratio * compressedSize;
        }
    }
}

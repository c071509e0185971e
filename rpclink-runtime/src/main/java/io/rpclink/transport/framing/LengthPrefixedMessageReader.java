/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.framing;

import java.util.Objects;
import java.util.zip.ZipException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Incrementally parses length-prefixed frames out of the bytes of one stream.
 *
 * <p>Bytes are {@link #append(ByteBuf) appended} as they arrive, in whatever chunks the
 * transport delivers them, and complete messages are pulled out with
 * {@link #nextMessage(int)}.</p>
 *
 * <pre>
 *   ExpectingCompressedFlag ──► ExpectingMessageLength ──► ExpectingMessage
 *            ▲                                                    │
 *            └────────────────────────────────────────────────────┘
 * </pre>
 */
public final class LengthPrefixedMessageReader implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LengthPrefixedMessageReader.class);

    private static final int DISCARD_READ_BYTES_THRESHOLD = 1024;

    private sealed interface ParseState permits ExpectingCompressedFlag, ExpectingMessageLength, ExpectingMessage {}

    private record ExpectingCompressedFlag() implements ParseState {
        static final ExpectingCompressedFlag INSTANCE = new ExpectingCompressedFlag();
    }

    private record ExpectingMessageLength(boolean compressed) implements ParseState {}

    private record ExpectingMessage(int length, boolean compressed) implements ParseState {}

    private final ByteBufAllocator allocator;
    private final @Nullable CompressionAlgorithm compression;
    private final @Nullable Zlib.Inflate decompressor;

    private @Nullable ByteBuf buffer;
    private ParseState state = ExpectingCompressedFlag.INSTANCE;

    /**
     * A reader that rejects compressed messages.
     */
    public LengthPrefixedMessageReader(ByteBufAllocator allocator) {
        this(allocator, null, MessageEncoding.DEFAULT_DECOMPRESSION_LIMIT);
    }

    public LengthPrefixedMessageReader(ByteBufAllocator allocator, @Nullable CompressionAlgorithm compression, DecompressionLimit decompressionLimit) {
        this.allocator = Objects.requireNonNull(allocator);
        Objects.requireNonNull(decompressionLimit);
        Zlib.Format format = compression == null ? null : compression.format();
        this.compression = format == null ? null : compression;
        this.decompressor = format == null ? null : new Zlib.Inflate(format, decompressionLimit);
    }

    // ==================== Accessors ====================

    @Nullable
    public CompressionAlgorithm compression() {
        return compression;
    }

    /**
     * Bytes appended but not yet consumed by a returned message.
     */
    public int unprocessedBytes() {
        return buffer == null ? 0 : buffer.readableBytes();
    }

    /**
     * Whether part of a frame has been consumed, that is the parser is past the compression
     * flag of a frame it has not finished.
     */
    public boolean isReading() {
        return !(state instanceof ExpectingCompressedFlag);
    }

    // ==================== Parsing ====================

    /**
     * Appends the readable bytes of {@code data}, advancing its reader index. The caller keeps
     * ownership of {@code data}.
     */
    public void append(ByteBuf data) {
        int readable = data.readableBytes();
        if (readable == 0) {
            return;
        }
        if (buffer == null) {
            buffer = allocator.buffer(readable);
        }
        else if (state instanceof ExpectingMessage expecting) {
            int remainingMessageBytes = expecting.length() - buffer.readableBytes();
            buffer.ensureWritable(Math.max(remainingMessageBytes, readable));
        }
        buffer.writeBytes(data);
    }

    /**
     * Returns the next complete message, decompressed if necessary, or {@code null} if more
     * bytes are needed. The caller owns the returned buffer.
     *
     * @param maximumLength largest accepted length prefix
     * @throws MessageReadException if the frame is compressed but no decompressor is configured,
     * its length exceeds {@code maximumLength}, or it cannot be decompressed
     */
    @Nullable
    public ByteBuf nextMessage(int maximumLength) {
        while (buffer != null) {
            if (state instanceof ExpectingCompressedFlag) {
                if (!buffer.isReadable()) {
                    break;
                }
                boolean compressed = buffer.readByte() != 0;
                if (compressed && decompressor == null) {
                    throw MessageReadException.compressionUnsupported();
                }
                state = new ExpectingMessageLength(compressed);
            }
            else if (state instanceof ExpectingMessageLength expectingLength) {
                if (buffer.readableBytes() < Integer.BYTES) {
                    break;
                }
                long length = buffer.readUnsignedInt();
                if (length > maximumLength) {
                    throw MessageReadException.payloadLengthLimitExceeded(length, maximumLength);
                }
                state = new ExpectingMessage((int) length, expectingLength.compressed());
            }
            else if (state instanceof ExpectingMessage expecting) {
                if (buffer.readableBytes() < expecting.length()) {
                    break;
                }
                ByteBuf message = expecting.compressed()
                        ? decompress(buffer.readSlice(expecting.length()))
                        : buffer.readBytes(expecting.length());
                state = ExpectingCompressedFlag.INSTANCE;
                releaseBufferIfPossible();
                return message;
            }
        }
        releaseBufferIfPossible();
        return null;
    }

    @Override
    public void close() {
        if (buffer != null) {
            buffer.release();
            buffer = null;
        }
        if (decompressor != null) {
            decompressor.end();
        }
    }

    private ByteBuf decompress(ByteBuf compressed) {
        Zlib.Inflate inflate = Objects.requireNonNull(decompressor);
        ByteBuf decompressed = allocator.buffer(compressed.readableBytes() * 2);
        try {
            inflate.inflate(compressed, decompressed);
            return decompressed;
        }
        catch (ZipException e) {
            decompressed.release();
            throw MessageReadException.decompressionFailed(e);
        }
        catch (RuntimeException e) {
            decompressed.release();
            throw e;
        }
        finally {
            inflate.reset();
        }
    }

    private void releaseBufferIfPossible() {
        if (buffer == null) {
            return;
        }
        if (!buffer.isReadable()) {
            buffer.release();
            buffer = null;
        }
        else if (buffer.readerIndex() > DISCARD_READ_BYTES_THRESHOLD && buffer.readerIndex() > buffer.capacity() / 2) {
            LOGGER.trace("Discarding {} read bytes", buffer.readerIndex());
            buffer.discardReadBytes();
        }
    }

    @Override
    public String toString() {
        return "LengthPrefixedMessageReader{"
                + "compression=" + compression
                + ", state=" + state
                + ", unprocessedBytes=" + unprocessedBytes()
                + '}';
    }
}

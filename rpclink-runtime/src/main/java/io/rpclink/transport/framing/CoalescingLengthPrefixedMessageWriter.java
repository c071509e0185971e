/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.framing;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelPromise;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.PromiseNotifier;

import io.rpclink.transport.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Encodes serialized messages into length-prefixed frames, coalescing adjacent small or
 * compressible messages into a single buffer.
 *
 * <p>Each frame is a one byte compression flag, a four byte big-endian length and the payload.
 * {@link #next()} drains the pending messages in insertion order:</p>
 * <ul>
 *   <li>a run of messages that are small enough ({@value #SINGLE_BUFFER_SIZE_LIMIT} bytes or less)
 *   or are to be compressed is encoded into one buffer and their promises are combined into one;</li>
 *   <li>a large uncompressed message at the front is emitted as two units: its header on its own
 *   with no promise, then its untouched body with its promise.</li>
 * </ul>
 *
 * <p>Not thread safe: use from the channel's event loop only.</p>
 */
public final class CoalescingLengthPrefixedMessageWriter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoalescingLengthPrefixedMessageWriter.class);

    /** Length of the frame header: the compression flag and the payload length. */
    public static final int METADATA_LENGTH = 5;

    /**
     * Payload size above which a message is sent as a separate header and body instead of being
     * copied into the coalescing buffer. Sized so a header and body fit one default DATA frame.
     */
    public static final int SINGLE_BUFFER_SIZE_LIMIT = 16384 - METADATA_LENGTH;

    private static final byte UNCOMPRESSED = 0;
    private static final byte COMPRESSED = 1;

    private final ByteBufAllocator allocator;
    private final @Nullable Zlib.Deflate compressor;
    private final OneOrManyQueue<Pending> pending = new OneOrManyQueue<>();

    private ByteBuf scratch;
    // Body of a large frame whose header has already been emitted.
    private @Nullable Pending largeFrameBody;
    private boolean closed;

    public CoalescingLengthPrefixedMessageWriter(@Nullable CompressionAlgorithm compression, ByteBufAllocator allocator) {
        this.allocator = Objects.requireNonNull(allocator);
        this.scratch = allocator.buffer(0);
        Zlib.Format format = compression == null ? null : compression.format();
        this.compressor = format == null ? null : new Zlib.Deflate(format);
    }

    private record Pending(ByteBuf buffer, boolean compress, @Nullable ChannelPromise promise) {

        boolean isSmallEnoughToCoalesce() {
            return buffer.readableBytes() <= SINGLE_BUFFER_SIZE_LIMIT;
        }

        boolean shouldCoalesce() {
            return isSmallEnoughToCoalesce() || compress;
        }
    }

    // ==================== Accessors ====================

    public boolean supportsCompression() {
        return compressor != null;
    }

    public boolean hasPending() {
        return largeFrameBody != null || !pending.isEmpty();
    }

    @VisibleForTesting
    int pendingCount() {
        return pending.size() + (largeFrameBody == null ? 0 : 1);
    }

    // ==================== Writing ====================

    /**
     * Queues a serialized message. The writer takes ownership of {@code message}.
     *
     * @param message the serialized payload
     * @param compress whether to compress the payload; ignored when no compressor is configured
     * @param promise completed once the frame holding this message has been written
     */
    public void append(ByteBuf message, boolean compress, @Nullable ChannelPromise promise) {
        if (closed) {
            ReferenceCountUtil.release(message);
            throw new IllegalStateException("writer is closed");
        }
        pending.append(new Pending(message, compress && compressor != null, promise));
    }

    /**
     * Returns the next unit to write, or {@code null} if nothing is pending.
     */
    @Nullable
    public OutboundFrame next() {
        if (largeFrameBody != null) {
            Pending body = largeFrameBody;
            largeFrameBody = null;
            return new OutboundFrame.Frame(body.buffer(), body.promise());
        }

        if (pending.isEmpty()) {
            return null;
        }

        int messagesToCoalesce = 0;
        int requiredCapacity = 0;
        ChannelPromise promise = null;
        for (Pending element : pending) {
            if (!element.shouldCoalesce()) {
                break;
            }
            messagesToCoalesce++;
            requiredCapacity += element.buffer().readableBytes() + METADATA_LENGTH;
            if (promise == null) {
                promise = element.promise();
            }
            else if (element.promise() != null) {
                promise.addListener(new PromiseNotifier<Void, ChannelFuture>(element.promise()));
            }
        }

        if (messagesToCoalesce == 0) {
            Pending large = Objects.requireNonNull(pending.pop());
            ByteBuf header = clearScratch(METADATA_LENGTH);
            header.writeByte(UNCOMPRESSED);
            header.writeInt(large.buffer().readableBytes());
            largeFrameBody = large;
            LOGGER.trace("Emitting header for large message of {} bytes", large.buffer().readableBytes());
            return new OutboundFrame.Frame(header.retain(), null);
        }

        ByteBuf out = clearScratch(requiredCapacity);
        int coalesced = messagesToCoalesce;
        while (messagesToCoalesce > 0) {
            Pending next = Objects.requireNonNull(pending.pop());
            messagesToCoalesce--;
            try {
                encode(out, next);
            }
            catch (RuntimeException e) {
                LOGGER.debug("Failed to encode message {} of a batch of {}, dropping the batch", coalesced - messagesToCoalesce, coalesced, e);
                while (messagesToCoalesce > 0) {
                    Pending dropped = Objects.requireNonNull(pending.pop());
                    messagesToCoalesce--;
                    ReferenceCountUtil.release(dropped.buffer());
                }
                out.clear();
                return new OutboundFrame.Failure(e, promise);
            }
        }
        LOGGER.trace("Coalesced {} messages into {} bytes", coalesced, out.readableBytes());
        return new OutboundFrame.Frame(out.retain(), promise);
    }

    /**
     * Drops every pending message, failing their promises with {@code cause}.
     */
    public void discardPending(Throwable cause) {
        if (largeFrameBody != null) {
            fail(largeFrameBody, cause);
            largeFrameBody = null;
        }
        Pending element;
        while ((element = pending.pop()) != null) {
            fail(element, cause);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        discardPending(new IllegalStateException("writer closed"));
        scratch.release();
        if (compressor != null) {
            compressor.end();
        }
    }

    private static void fail(Pending element, Throwable cause) {
        ReferenceCountUtil.release(element.buffer());
        if (element.promise() != null) {
            element.promise().tryFailure(cause);
        }
    }

    // The scratch buffer is handed out retained; it can be reused only once every holder has released it.
    private ByteBuf clearScratch(int minimumCapacity) {
        if (scratch.refCnt() == 1) {
            scratch.clear();
            scratch.ensureWritable(minimumCapacity);
        }
        else {
            scratch.release();
            scratch = allocator.buffer(minimumCapacity);
        }
        return scratch;
    }

    private void encode(ByteBuf out, Pending element) {
        ByteBuf message = element.buffer();
        try {
            if (element.compress() && compressor != null) {
                out.writeByte(COMPRESSED);
                int lengthIndex = out.writerIndex();
                out.writeInt(0);
                int written;
                try {
                    written = compressor.deflate(message, out);
                }
                finally {
                    compressor.reset();
                }
                out.setInt(lengthIndex, written);
            }
            else {
                out.writeByte(UNCOMPRESSED);
                out.writeInt(message.readableBytes());
                out.writeBytes(message, message.readerIndex(), message.readableBytes());
            }
        }
        finally {
            ReferenceCountUtil.release(message);
        }
    }
}

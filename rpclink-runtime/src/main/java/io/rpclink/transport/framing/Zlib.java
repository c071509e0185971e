/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.framing;

import java.util.Objects;
import java.util.zip.CRC32;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;
import java.util.zip.ZipException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

/**
 * Per-message zlib and gzip compression on top of {@link Deflater} and {@link Inflater}.
 *
 * <p>Both codecs are stateful and must be {@link Deflate#reset() reset} between messages and
 * {@link Deflate#end() ended} once the owning stream is done with them.</p>
 */
public final class Zlib {

    public enum Format {
        DEFLATE,
        GZIP
    }

    private static final int CHUNK_SIZE = 8192;

    private static final int GZIP_MAGIC = 0x8b1f;
    private static final int GZIP_HEADER_LENGTH = 10;
    private static final int GZIP_TRAILER_LENGTH = 8;
    private static final int FHCRC = 2;
    private static final int FEXTRA = 4;
    private static final int FNAME = 8;
    private static final int FCOMMENT = 16;

    private Zlib() {
    }

    /**
     * Compresses whole messages.
     */
    public static final class Deflate {
        private final Format format;
        private final Deflater deflater;
        private final CRC32 crc = new CRC32();
        private final byte[] chunk = new byte[CHUNK_SIZE];

        public Deflate(Format format) {
            this.format = Objects.requireNonNull(format);
            this.deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, format == Format.GZIP);
        }

        /**
         * Compresses the readable bytes of {@code input} into {@code output}.
         *
         * @return the number of bytes written to {@code output}
         */
        public int deflate(ByteBuf input, ByteBuf output) {
            int start = output.writerIndex();
            byte[] bytes = ByteBufUtil.getBytes(input);
            input.skipBytes(bytes.length);

            if (format == Format.GZIP) {
                writeGzipHeader(output);
                crc.update(bytes);
            }

            deflater.setInput(bytes);
            deflater.finish();
            while (!deflater.finished()) {
                int n = deflater.deflate(chunk);
                output.writeBytes(chunk, 0, n);
            }

            if (format == Format.GZIP) {
                output.writeIntLE((int) crc.getValue());
                output.writeIntLE(bytes.length);
            }
            return output.writerIndex() - start;
        }

        public void reset() {
            deflater.reset();
            crc.reset();
        }

        public void end() {
            deflater.end();
        }

        private static void writeGzipHeader(ByteBuf output) {
            output.writeShortLE(GZIP_MAGIC);
            output.writeByte(Deflater.DEFLATED);
            // flags, mtime (4 bytes), extra flags
            output.writeByte(0);
            output.writeInt(0);
            output.writeByte(0);
            // unknown OS
            output.writeByte(0xff);
        }
    }

    /**
     * Decompresses whole messages, bounded by a {@link DecompressionLimit}.
     */
    public static final class Inflate {
        private final Format format;
        private final DecompressionLimit limit;
        private final Inflater inflater;
        private final CRC32 crc = new CRC32();
        private final byte[] chunk = new byte[CHUNK_SIZE];

        public Inflate(Format format, DecompressionLimit limit) {
            this.format = Objects.requireNonNull(format);
            this.limit = Objects.requireNonNull(limit);
            this.inflater = new Inflater(format == Format.GZIP);
        }

        /**
         * Decompresses the readable bytes of {@code input} into {@code output}.
         *
         * @return the number of bytes written to {@code output}
         * @throws MessageReadException if the decompressed size exceeds the limit
         * @throws ZipException if the input is not valid compressed data
         */
        public int inflate(ByteBuf input, ByteBuf output) throws ZipException {
            int compressedSize = input.readableBytes();
            long maximum = limit.maximumDecompressedSize(compressedSize);
            byte[] bytes = ByteBufUtil.getBytes(input);
            input.skipBytes(bytes.length);

            int offset = 0;
            if (format == Format.GZIP) {
                offset = gzipHeaderLength(bytes);
            }
            inflater.setInput(bytes, offset, bytes.length - offset);

            long written = 0;
            try {
                while (!inflater.finished()) {
                    int n = inflater.inflate(chunk);
                    if (n == 0 && !inflater.finished()) {
                        if (inflater.needsDictionary()) {
                            throw new ZipException("preset dictionaries are not supported");
                        }
                        if (inflater.needsInput()) {
                            throw new ZipException("truncated compressed message");
                        }
                    }
                    written += n;
                    if (written > maximum) {
                        throw MessageReadException.decompressionLimitExceeded(compressedSize);
                    }
                    output.writeBytes(chunk, 0, n);
                    if (format == Format.GZIP) {
                        crc.update(chunk, 0, n);
                    }
                }
            }
            catch (DataFormatException e) {
                ZipException zipException = new ZipException(e.getMessage());
                zipException.initCause(e);
                throw zipException;
            }

            if (format == Format.GZIP) {
                verifyGzipTrailer(bytes, bytes.length - inflater.getRemaining(), written);
            }
            return (int) written;
        }

        public void reset() {
            inflater.reset();
            crc.reset();
        }

        public void end() {
            inflater.end();
        }

        private void verifyGzipTrailer(byte[] bytes, int trailerStart, long written) throws ZipException {
            if (bytes.length - trailerStart < GZIP_TRAILER_LENGTH) {
                throw new ZipException("truncated gzip trailer");
            }
            long expectedCrc = readIntLE(bytes, trailerStart) & 0xffffffffL;
            long expectedSize = readIntLE(bytes, trailerStart + 4) & 0xffffffffL;
            if (expectedCrc != crc.getValue()) {
                throw new ZipException("gzip CRC mismatch");
            }
            if (expectedSize != (written & 0xffffffffL)) {
                throw new ZipException("gzip size mismatch");
            }
        }

        private static int gzipHeaderLength(byte[] bytes) throws ZipException {
            if (bytes.length < GZIP_HEADER_LENGTH) {
                throw new ZipException("truncated gzip header");
            }
            if ((bytes[0] & 0xff | (bytes[1] & 0xff) << 8) != GZIP_MAGIC) {
                throw new ZipException("not in gzip format");
            }
            if ((bytes[2] & 0xff) != Deflater.DEFLATED) {
                throw new ZipException("unsupported gzip compression method");
            }
            int flags = bytes[3] & 0xff;
            int offset = GZIP_HEADER_LENGTH;
            if ((flags & FEXTRA) != 0) {
                if (bytes.length < offset + 2) {
                    throw new ZipException("truncated gzip header");
                }
                offset += 2 + ((bytes[offset] & 0xff) | (bytes[offset + 1] & 0xff) << 8);
            }
            if ((flags & FNAME) != 0) {
                offset = skipZeroTerminated(bytes, offset);
            }
            if ((flags & FCOMMENT) != 0) {
                offset = skipZeroTerminated(bytes, offset);
            }
            if ((flags & FHCRC) != 0) {
                offset += 2;
            }
            if (offset > bytes.length) {
                throw new ZipException("truncated gzip header");
            }
            return offset;
        }

        private static int skipZeroTerminated(byte[] bytes, int offset) throws ZipException {
            int i = offset;
            while (i < bytes.length && bytes[i] != 0) {
                i++;
            }
            if (i == bytes.length) {
                throw new ZipException("truncated gzip header");
            }
            return i + 1;
        }

        private static int readIntLE(byte[] bytes, int offset) {
            return (bytes[offset] & 0xff)
                    | (bytes[offset + 1] & 0xff) << 8
                    | (bytes[offset + 2] & 0xff) << 16
                    | (bytes[offset + 3] & 0xff) << 24;
        }
    }
}

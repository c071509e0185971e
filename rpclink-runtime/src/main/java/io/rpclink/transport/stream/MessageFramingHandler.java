/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.stream;

import java.nio.channels.ClosedChannelException;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;

import io.rpclink.transport.framing.MessageEncoding;
import io.rpclink.transport.framing.MessageReadException;
import io.rpclink.transport.framing.MessageWriteException;
import io.rpclink.transport.framing.OutboundFrame;
import io.rpclink.transport.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Netty handler placed on the channel of a single stream that turns inbound bytes into messages
 * and outbound messages into length-prefixed frames.
 *
 * <p>Outbound messages of type {@code O} are framed on {@code write} and reach the wire on
 * {@code flush}, small ones coalesced into a single buffer. Inbound {@link ByteBuf}s are parsed
 * and each decoded {@code I} is fired on. Read and write failures are scoped to the stream:
 * a read failure is fired as an exception, a write failure fails the write's promise.</p>
 *
 * <p>Frames written but not yet flushed when the channel goes inactive are discarded.</p>
 *
 * @param <I> inbound message type
 * @param <O> outbound message type
 */
public class MessageFramingHandler<I, O> extends ChannelDuplexHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageFramingHandler.class);

    private final String streamName;
    private final Class<O> outboundType;
    private final MessageArity inboundArity;
    private final MessageDeserializer<I> deserializer;
    private final MessageArity outboundArity;
    private final MessageSerializer<O> serializer;
    private final MessageEncoding encoding;
    private final boolean compressOutbound;

    @VisibleForTesting
    @Nullable
    ReadStateMachine<I> readStateMachine;

    @VisibleForTesting
    @Nullable
    WriteStateMachine<O> writeStateMachine;

    public MessageFramingHandler(
                                 String streamName,
                                 MessageArity inboundArity,
                                 MessageDeserializer<I> deserializer,
                                 MessageArity outboundArity,
                                 Class<O> outboundType,
                                 MessageSerializer<O> serializer,
                                 MessageEncoding encoding,
                                 boolean compressOutbound) {
        this.streamName = Objects.requireNonNull(streamName);
        this.inboundArity = Objects.requireNonNull(inboundArity);
        this.deserializer = Objects.requireNonNull(deserializer);
        this.outboundArity = Objects.requireNonNull(outboundArity);
        this.outboundType = Objects.requireNonNull(outboundType);
        this.serializer = Objects.requireNonNull(serializer);
        this.encoding = Objects.requireNonNull(encoding);
        this.compressOutbound = compressOutbound;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        readStateMachine = new ReadStateMachine<>(streamName, inboundArity, deserializer, encoding, ctx.alloc());
        writeStateMachine = new WriteStateMachine<>(streamName, outboundArity, serializer, encoding, ctx.alloc());
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        if (writeStateMachine != null) {
            writeStateMachine.close();
            writeStateMachine = null;
        }
        if (readStateMachine != null) {
            readStateMachine.close();
            readStateMachine = null;
        }
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ByteBuf buffer)) {
            ctx.fireChannelRead(msg);
            return;
        }
        ReadStateMachine<I> reader = readStateMachine;
        List<I> messages;
        try {
            if (reader == null) {
                throw MessageReadException.invalidState(streamName + ": read while the handler is not in a pipeline");
            }
            messages = reader.readMessages(buffer);
        }
        catch (MessageReadException e) {
            LOGGER.debug("{}: read failed with {}: {}", streamName, e.reason(), e.getMessage());
            ctx.fireExceptionCaught(e);
            return;
        }
        finally {
            buffer.release();
        }
        for (I message : messages) {
            ctx.fireChannelRead(message);
        }
    }

    @Override
    public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
        if (!outboundType.isInstance(msg)) {
            ctx.write(msg, promise);
            return;
        }
        WriteStateMachine<O> writer = writeStateMachine;
        try {
            if (writer == null) {
                throw MessageWriteException.invalidState(streamName + ": write while the handler is not in a pipeline");
            }
            writer.write(outboundType.cast(msg), compressOutbound, promise.isVoid() ? null : promise);
        }
        catch (MessageWriteException e) {
            LOGGER.debug("{}: write failed with {}: {}", streamName, e.reason(), e.getMessage());
            promise.tryFailure(e);
        }
    }

    @Override
    public void flush(ChannelHandlerContext ctx) {
        WriteStateMachine<O> writer = writeStateMachine;
        if (writer != null) {
            OutboundFrame frame;
            while ((frame = writer.next()) != null) {
                if (frame instanceof OutboundFrame.Frame ready) {
                    ctx.write(ready.buffer(), ready.promise() == null ? ctx.voidPromise() : ready.promise());
                }
                else if (frame.promise() != null) {
                    frame.promise().tryFailure(((OutboundFrame.Failure) frame).cause());
                }
                else {
                    LOGGER.warn("{}: dropped a batch of messages that failed to encode", streamName,
                            ((OutboundFrame.Failure) frame).cause());
                }
            }
        }
        ctx.flush();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (writeStateMachine != null && writeStateMachine.hasPending()) {
            LOGGER.debug("{}: channel inactive, discarding unflushed messages", streamName);
            writeStateMachine.discardPending(new ClosedChannelException());
        }
        super.channelInactive(ctx);
    }
}

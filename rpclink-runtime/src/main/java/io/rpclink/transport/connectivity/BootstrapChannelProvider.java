/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;

import io.rpclink.transport.internal.util.TransportMetrics;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Connects channels with a Netty {@link Bootstrap} on the manager's event loop and installs the
 * HTTP/2 frame codec and the {@link ConnectionIdleHandler} that reports back to the manager.
 */
public class BootstrapChannelProvider implements ChannelProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(BootstrapChannelProvider.class);

    public static final String HTTP2_CODEC_HANDLER = "http2Codec";
    public static final String IDLE_HANDLER = "connectionIdleHandler";

    private final SocketAddress remoteAddress;
    private final Class<? extends Channel> channelType;
    private final Counter idleCloseCounter;

    public BootstrapChannelProvider(SocketAddress remoteAddress, Class<? extends Channel> channelType, Counter idleCloseCounter) {
        this.remoteAddress = Objects.requireNonNull(remoteAddress);
        this.channelType = Objects.requireNonNull(channelType);
        this.idleCloseCounter = Objects.requireNonNull(idleCloseCounter);
    }

    /**
     * Creates a provider whose idle close counter is registered with the global meter registry,
     * tagged with {@code target}.
     */
    public static BootstrapChannelProvider create(SocketAddress remoteAddress, Class<? extends Channel> channelType, String target) {
        return new BootstrapChannelProvider(
                remoteAddress,
                channelType,
                TransportMetrics.idleCloseCounter().withTags(TransportMetrics.TARGET_LABEL, target));
    }

    @Override
    public ChannelFuture makeChannel(ConnectionManager connectionManager, @Nullable Duration connectTimeout) {
        LOGGER.debug("{}: connecting to {} (timeout {})", connectionManager.logId(), remoteAddress, connectTimeout);
        Bootstrap bootstrap = new Bootstrap()
                .group(connectionManager.eventLoop())
                .channel(channelType)
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        configurePipeline(ch.pipeline(), connectionManager);
                    }
                });

        if (SocketChannel.class.isAssignableFrom(channelType)) {
            bootstrap.option(ChannelOption.TCP_NODELAY, true);
            bootstrap.option(ChannelOption.SO_REUSEADDR, true);
        }
        if (connectTimeout != null) {
            bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()));
        }
        return bootstrap.connect(remoteAddress);
    }

    private void configurePipeline(ChannelPipeline pipeline, ConnectionManager connectionManager) {
        // pings are acked by the idle handler
        pipeline.addLast(HTTP2_CODEC_HANDLER, Http2FrameCodecBuilder.forClient().autoAckPingFrame(false).build());
        pipeline.addLast(IDLE_HANDLER, new ConnectionIdleHandler(
                connectionManager,
                connectionManager.configuration().idleTimeout(),
                connectionManager.configuration().keepalive(),
                idleCloseCounter));
    }

    @Override
    public String toString() {
        return "BootstrapChannelProvider{"
                + "remoteAddress=" + remoteAddress
                + ", channelType=" + channelType.getSimpleName()
                + '}';
    }
}

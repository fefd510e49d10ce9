package io.trading.replica.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.trading.replica.transport.StreamConnection;
import io.trading.replica.transport.StreamConnectionException;
import io.trading.replica.transport.StreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Netty-based WebSocket transport for exchange streaming APIs.
 * All connections share one event loop group.
 */
public class NettyStreamTransport implements StreamTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyStreamTransport.class);

    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final int MAX_HANDSHAKE_RESPONSE_LENGTH = 8192;

    private final EventLoopGroup eventLoopGroup;
    private final boolean enableCompression;

    /**
     * @param ioThreads         Number of event loop threads shared by all connections
     * @param enableCompression Whether to negotiate permessage-deflate
     */
    public NettyStreamTransport(int ioThreads, boolean enableCompression) {
        this.eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(ioThreads, "stream-io");
        this.enableCompression = enableCompression;
    }

    @Override
    public CompletableFuture<StreamConnection> connect(URI uri, String name) {
        CompletableFuture<StreamConnection> result = new CompletableFuture<>();
        NettyStreamConnection connection = new NettyStreamConnection(name);

        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<Channel>() {
                @Override
                protected void initChannel(Channel ch) throws Exception {
                    connection.attach(ch);
                    ChannelPipeline pipeline = ch.pipeline();

                    if (NettySslContexts.isSecure(uri)) {
                        pipeline.addLast(NettySslContexts.newHandler(ch, uri));
                    }

                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(MAX_HANDSHAKE_RESPONSE_LENGTH));

                    if (enableCompression) {
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                    }

                    pipeline.addLast(new WebSocketFrameAggregator(WebSocketClientHandler.MAX_FRAME_PAYLOAD_LENGTH));
                    pipeline.addLast(new WebSocketClientHandler(
                        uri,
                        name,
                        connection::onFrame,
                        cause -> {
                            result.completeExceptionally(
                                new StreamConnectionException(name + ": handshake failed", cause));
                            connection.onError(cause);
                        },
                        () -> {
                            LOGGER.info("{}: Connected to {}", name, uri);
                            result.complete(connection);
                        },
                        () -> {
                            result.completeExceptionally(
                                new StreamConnectionException(name + ": disconnected before handshake"));
                            connection.onDisconnected();
                        }
                    ));
                }
            });

        String host = uri.getHost();
        int port = NettySslContexts.port(uri);
        LOGGER.info("{}: Connecting to {}:{}...", name, host, port);

        bootstrap.connect(host, port).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                LOGGER.error("{}: Failed to connect", name, future.cause());
                result.completeExceptionally(
                    new StreamConnectionException(name + ": failed to connect to " + uri, future.cause()));
            }
        });

        return result;
    }

    @Override
    public void close() {
        eventLoopGroup.shutdownGracefully();
        LOGGER.info("Stream transport closed");
    }
}

package io.trading.replica.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpContentDecompressor;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.trading.replica.transport.RestClient;
import io.trading.replica.transport.RestResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot HTTP/1.1 client built on Netty. Each request opens its own connection
 * ({@code Connection: close}) and blocks the caller until the full response arrives.
 */
public class NettyRestClient implements RestClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyRestClient.class);

    private static final int MAX_CONTENT_LENGTH = 16 * 1024 * 1024;

    private final EventLoopGroup eventLoopGroup;
    private final Duration timeout;

    /**
     * @param timeout Upper bound for connect plus full response
     */
    public NettyRestClient(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, "rest-io");
        this.timeout = timeout;
    }

    @Override
    public RestResponse get(URI uri) throws IOException {
        CompletableFuture<RestResponse> result = new CompletableFuture<>();

        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .handler(new ChannelInitializer<Channel>() {
                @Override
                protected void initChannel(Channel ch) throws Exception {
                    ChannelPipeline pipeline = ch.pipeline();
                    if (NettySslContexts.isSecure(uri)) {
                        pipeline.addLast(NettySslContexts.newHandler(ch, uri));
                    }
                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpContentDecompressor());
                    pipeline.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                    pipeline.addLast(new ResponseHandler(result));
                }
            });

        Channel channel = null;
        try {
            ChannelFuture connectFuture = bootstrap.connect(uri.getHost(), NettySslContexts.port(uri));
            if (!connectFuture.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                connectFuture.cancel(true);
                throw new IOException("Timed out connecting to " + uri.getHost());
            }
            if (!connectFuture.isSuccess()) {
                throw new IOException("Failed to connect to " + uri.getHost(), connectFuture.cause());
            }

            channel = connectFuture.channel();
            channel.writeAndFlush(newRequest(uri));
            LOGGER.debug("GET {}", uri);

            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + uri);
        } catch (TimeoutException e) {
            throw new IOException("Timed out waiting for response from " + uri, e);
        } catch (ExecutionException e) {
            throw new IOException("Request to " + uri + " failed", e.getCause());
        } finally {
            if (channel != null) {
                channel.close();
            }
        }
    }

    @Override
    public void close() {
        eventLoopGroup.shutdownGracefully();
    }

    private static FullHttpRequest newRequest(URI uri) {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }

        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, path);
        request.headers()
            .set(HttpHeaderNames.HOST, uri.getHost())
            .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON)
            .set(HttpHeaderNames.ACCEPT_ENCODING, HttpHeaderValues.GZIP)
            .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        return request;
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

        private final CompletableFuture<RestResponse> result;

        ResponseHandler(CompletableFuture<RestResponse> result) {
            this.result = result;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
            String body = response.content().toString(StandardCharsets.UTF_8);
            result.complete(new RestResponse(response.status().code(), body));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            result.completeExceptionally(new IOException("Connection closed before response"));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }
    }
}

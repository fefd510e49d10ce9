package io.trading.replica.netty;

import io.netty.channel.Channel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SslProvider;

import javax.net.ssl.SSLException;
import java.net.URI;

/**
 * Shared client-side TLS context for wss:// and https:// endpoints.
 */
final class NettySslContexts {

    private static volatile SslContext clientContext;

    private NettySslContexts() {
    }

    /**
     * Returns whether the URI scheme requires TLS.
     */
    static boolean isSecure(URI uri) {
        String scheme = uri.getScheme();
        return "wss".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    /**
     * Resolves the port, falling back to the scheme's default.
     */
    static int port(URI uri) {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return isSecure(uri) ? 443 : 80;
    }

    /**
     * Creates an SslHandler with SNI set to the URI host.
     */
    static SslHandler newHandler(Channel channel, URI uri) throws SSLException {
        return clientContext().newHandler(channel.alloc(), uri.getHost(), port(uri));
    }

    private static SslContext clientContext() throws SSLException {
        SslContext context = clientContext;
        if (context == null) {
            synchronized (NettySslContexts.class) {
                context = clientContext;
                if (context == null) {
                    context = SslContextBuilder.forClient()
                        .sslProvider(SslProvider.JDK)
                        .protocols("TLSv1.2", "TLSv1.3")
                        .build();
                    clientContext = context;
                }
            }
        }
        return context;
    }
}

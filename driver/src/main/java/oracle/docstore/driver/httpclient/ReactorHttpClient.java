/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.httpclient;

import static oracle.docstore.driver.util.LogUtil.logFine;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.logging.Logger;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.ssl.SslContext;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * Internal use only, not meant for public usage can change in the future.
 * <p>
 * An HTTP client for a single service endpoint built on the reactor netty
 * {@link HttpClient}. Requests are asynchronous and return a {@link Mono}
 * of the fully received response; the driver blocks on it at its own
 * boundary.
 * <p>
 * The client shares the default netty event loop with other reactor netty
 * clients in the process. It owns its connection pool, which is released by
 * {@link #shutdown}. A pool configured with a single connection is replaced
 * by a new connection per request.
 */
public class ReactorHttpClient {
    static final int DEFAULT_HANDSHAKE_TIMEOUT_MS = 3000;
    static final int DEFAULT_MAX_INITIAL_LINE_LENGTH = 4096;
    static final int DEFAULT_MAX_HEADER_SIZE = 8192;

    private final Logger logger;
    private final String host;
    private final int port;
    private final SslContext sslContext;
    private final ConnectionPoolConfig connectionPoolConfig;
    private final ConnectionProvider connectionProvider;
    private final HttpClient httpClient;

    private ReactorHttpClient(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.connectionPoolConfig = builder.config;
        this.sslContext = builder.sslContext;
        this.logger = builder.logger;

        ConnectionPoolConfig pool = connectionPoolConfig;
        connectionProvider = (pool.getMaxConnections() == 1) ?
            ConnectionProvider.newConnection() :
            ConnectionProvider
            .builder(host + ":" + port + "-pool")
            .maxConnections(pool.getMaxConnections())
            .pendingAcquireTimeout(
                Duration.ofMillis(pool.getPendingAcquireTimeout()))
            .pendingAcquireMaxCount(pool.getMaxPendingAcquires())
            .maxIdleTime(Duration.ofMillis(pool.getMaxIdleTime()))
            .maxLifeTime(Duration.ofMillis(pool.getMaxLifetime()))
            .build();

        HttpClient client = HttpClient
            .create(connectionProvider)
            .host(host)
            .port(port)
            .httpResponseDecoder(spec -> spec
                .maxHeaderSize(builder.maxHeaderSize)
                .maxInitialLineLength(builder.maxInitialLineLength))
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.TCP_NODELAY, true);

        if (sslContext != null) {
            client = client.secure(spec -> spec
                .sslContext(sslContext)
                .handshakeTimeoutMillis(builder.sslHandshakeTimeoutMs));
        }
        httpClient = client;
        logFine(logger, "Created HTTP client for " + host + ":" + port +
                ", " + pool);
    }

    /**
     * Sends a request and receives the whole response.
     *
     * @param uri the request path, starting with /
     * @param headers the request headers
     * @param method the request method
     * @param body the request body, or null for none
     * @return Mono of the response from the server
     */
    public Mono<HttpResponse> sendRequest(String uri,
                                          HttpHeaders headers,
                                          HttpMethod method,
                                          byte[] body) {
        HttpClient.RequestSender sender = httpClient
            .headers(h -> h.set(headers))
            .request(method)
            .uri(uri);
        HttpClient.ResponseReceiver<?> receiver = (body == null) ? sender :
            sender.send(Mono.fromCallable(() -> Unpooled.wrappedBuffer(body)));
        return receiver.responseSingle((response, content) -> content
            .asString(StandardCharsets.UTF_8)
            .defaultIfEmpty("")
            .map(text -> new HttpResponse(response.status().code(),
                                          response.responseHeaders(),
                                          text)));
    }

    /**
     * Sends a POST request.
     *
     * @param uri the request path
     * @param headers the request headers
     * @param body the request body
     * @return Mono of the response from the server
     */
    public Mono<HttpResponse> postRequest(String uri,
                                          HttpHeaders headers,
                                          byte[] body) {
        return sendRequest(uri, headers, HttpMethod.POST, body);
    }

    /**
     * Releases the connection pool. The client must not be used
     * afterwards.
     */
    public void shutdown() {
        logFine(logger, "Shutting down HTTP client for " + host + ":" + port);
        connectionProvider.dispose();
    }

    /**
     * @hidden
     * For testing only
     */
    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Logger getLogger() {
        return logger;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public SslContext getSslContext() {
        return sslContext;
    }

    public ConnectionPoolConfig getConnectionPoolConfig() {
        return connectionPoolConfig;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private String host = "localhost";
        private int port = 80;
        private int maxInitialLineLength = DEFAULT_MAX_INITIAL_LINE_LENGTH;
        private int maxHeaderSize = DEFAULT_MAX_HEADER_SIZE;
        private int sslHandshakeTimeoutMs = DEFAULT_HANDSHAKE_TIMEOUT_MS;
        private ConnectionPoolConfig config =
            ConnectionPoolConfig.builder().build();
        private SslContext sslContext;
        private Logger logger =
            Logger.getLogger(ReactorHttpClient.class.getName());

        /**
         * Sets the host name for the HTTP server.
         * Default to localhost.
         *
         * @param host the host name for the HTTP server
         * @return this
         * @throws IllegalArgumentException If host is null or empty
         */
        public Builder host(String host) {
            if (host == null || host.isEmpty()) {
                throw new IllegalArgumentException("host is either null or " +
                    "empty");
            }
            this.host = host;
            return this;
        }

        /**
         * Set the port for the HTTP server.
         * Default to 80
         *
         * @param port port for the HTTP server.
         * @return this
         * @throws IllegalArgumentException If port is not positive
         */
        public Builder port(int port) {
            if (port <= 0) {
                throw new IllegalArgumentException("port must be positive");
            }
            this.port = port;
            return this;
        }

        /**
         * Set the maximum length of the status line of a response. If zero
         * the default is used.
         *
         * @param maxInitialLineLength the maximum initial line length
         * @return this
         * @throws IllegalArgumentException If maxInitialLineLength is negative
         */
        public Builder maxInitialLineLength(int maxInitialLineLength) {
            if (maxInitialLineLength < 0) {
                throw new IllegalArgumentException("maxInitialLineLength is " +
                    "negative");
            }
            if (maxInitialLineLength != 0) {
                this.maxInitialLineLength = maxInitialLineLength;
            }
            return this;
        }

        /**
         * Set the maximum size of the headers of a response. If zero the
         * default is used.
         *
         * @param maxHeaderSize the maximum header size
         * @return this
         * @throws IllegalArgumentException If maxHeaderSize is negative
         */
        public Builder maxHeaderSize(int maxHeaderSize) {
            if (maxHeaderSize < 0) {
                throw new IllegalArgumentException("maxHeaderSize is negative");
            }
            if (maxHeaderSize != 0) {
                this.maxHeaderSize = maxHeaderSize;
            }
            return this;
        }

        /**
         * Set the SSL handshake timeout. If zero the default is used.
         *
         * @param sslHandshakeTimeoutMs the timeout in milliseconds
         * @return this
         * @throws IllegalArgumentException If sslHandshakeTimeoutMs is
         * negative
         */
        public Builder sslHandshakeTimeoutMs(int sslHandshakeTimeoutMs) {
            if (sslHandshakeTimeoutMs < 0) {
                throw new IllegalArgumentException("sslHandshakeTimeoutMs is " +
                    "negative");
            }
            if (sslHandshakeTimeoutMs != 0) {
                this.sslHandshakeTimeoutMs = sslHandshakeTimeoutMs;
            }
            return this;
        }

        public Builder connectionPoolConfig(ConnectionPoolConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Set the ssl context. If null, plain http is used.
         *
         * @param sslContext the ssl context
         * @return this
         */
        public Builder sslContext(SslContext sslContext) {
            this.sslContext = sslContext;
            return this;
        }

        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public ReactorHttpClient build() {
            if (config == null) {
                config = ConnectionPoolConfig.builder().build();
            }
            return new ReactorHttpClient(this);
        }
    }
}

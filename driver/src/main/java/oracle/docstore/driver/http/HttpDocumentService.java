/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.http;

import static oracle.docstore.driver.util.LogUtil.isFineEnabled;
import static oracle.docstore.driver.util.LogUtil.logFine;
import static oracle.docstore.driver.util.LogUtil.logWarning;

import java.net.URL;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import javax.net.ssl.SSLException;

import oracle.docstore.driver.DocStoreConfig;
import oracle.docstore.driver.DocumentService;
import oracle.docstore.driver.NotConnectedException;
import oracle.docstore.driver.RequestTimeoutException;
import oracle.docstore.driver.ServiceUnavailableException;
import oracle.docstore.driver.TransportException;
import oracle.docstore.driver.httpclient.HttpResponse;
import oracle.docstore.driver.httpclient.ReactorHttpClient;
import oracle.docstore.driver.ops.DocumentPath;
import oracle.docstore.driver.ops.DocumentSnapshot;
import oracle.docstore.driver.ops.FieldMask;
import oracle.docstore.driver.ops.Query;
import oracle.docstore.driver.ops.ResultPage;
import oracle.docstore.driver.ops.TransactionOptions;
import oracle.docstore.driver.ops.Write;
import oracle.docstore.driver.ops.serde.JsonProtocol;
import oracle.docstore.driver.ops.serde.JsonProtocol.ServiceError;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.netty.util.internal.logging.JdkLoggerFactory;
import reactor.core.Exceptions;

/**
 * The HTTP implementation of {@link DocumentService}. Each call is a JSON
 * POST to {@code /v1/<resource>:<method>} and blocks until the response
 * arrives or the request timeout from {@link DocStoreConfig} expires.
 * Failures are never retried.
 * @hidden
 */
public class HttpDocumentService implements DocumentService {

    static final String USER_AGENT = "DocStoreJavaSDK";
    static final String CONTENT_TYPE = "application/json; charset=utf-8";
    static final String UNAVAILABLE = "UNAVAILABLE";

    private final Logger logger;
    private final String databasePath;
    private final int timeoutMs;
    private final int maxContentLength;
    private final ReactorHttpClient httpClient;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HttpDocumentService(DocStoreConfig config) {
        configNettyLogging();
        this.logger = DocStoreHandleImpl.getLogger(config);
        this.databasePath = DocumentPath.databasePath(config.getProjectId(),
                                                      config.getDatabaseId());
        this.timeoutMs = config.getRequestTimeout();
        this.maxContentLength = config.getMaxContentLength();

        URL url = config.getServiceURL();
        logFine(logger, "Document service URL: " + url);
        this.httpClient = ReactorHttpClient.builder()
            .host(url.getHost())
            .port(url.getPort())
            .sslContext(createSslContext(url))
            .sslHandshakeTimeoutMs(config.getSSLHandshakeTimeout())
            .connectionPoolConfig(config.getConnectionPoolConfig())
            .logger(logger)
            .build();
    }

    /**
     * Configures the logging of Netty library.
     */
    private void configNettyLogging() {
        /*
         * Configure default Netty logging using Jdk Logger.
         */
        InternalLoggerFactory.setDefaultFactory(JdkLoggerFactory.INSTANCE);
    }

    private static SslContext createSslContext(URL url) {
        if (!"https".equalsIgnoreCase(url.getProtocol())) {
            return null;
        }
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException se) {
            throw new IllegalStateException(
                "Unable to start handle with SSL", se);
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }

    /**
     * @hidden
     * For testing only
     */
    public ReactorHttpClient getHttpClient() {
        return httpClient;
    }

    @Override
    public ResultPage runQuery(String parentName,
                               Query query,
                               byte[] transactionId) {
        String body = execute(parentName, JsonProtocol.RUN_QUERY,
                              JsonProtocol.encodeRunQuery(query,
                                                          transactionId));
        ResultPage page = JsonProtocol.decodeRunQuery(body);
        if (isFineEnabled(logger)) {
            logFine(logger, "runQuery on " + query.getCollectionId() +
                    " returned " + page.size() + " documents, " +
                    page.getMoreResults());
        }
        return page;
    }

    @Override
    public byte[] beginTransaction(TransactionOptions options) {
        String body = execute(databasePath, JsonProtocol.BEGIN_TRANSACTION,
                              JsonProtocol.encodeBeginTransaction(options));
        return JsonProtocol.decodeBeginTransaction(body);
    }

    @Override
    public void rollback(byte[] transactionId) {
        execute(databasePath, JsonProtocol.ROLLBACK,
                JsonProtocol.encodeRollback(transactionId));
    }

    @Override
    public List<DocumentSnapshot> batchGet(List<String> documentNames,
                                           FieldMask mask,
                                           byte[] transactionId) {
        if (documentNames.isEmpty()) {
            return Collections.emptyList();
        }
        String body = execute(databasePath, JsonProtocol.BATCH_GET,
                              JsonProtocol.encodeBatchGet(documentNames,
                                                          mask,
                                                          transactionId));
        return JsonProtocol.decodeBatchGet(body);
    }

    @Override
    public List<String> listCollectionIds(String parentName) {
        String body = execute(parentName, JsonProtocol.LIST_COLLECTION_IDS,
                              JsonProtocol.encodeListCollectionIds());
        return JsonProtocol.decodeListCollectionIds(body);
    }

    @Override
    public Instant commit(List<Write> writes) {
        String body = execute(databasePath, JsonProtocol.COMMIT,
                              JsonProtocol.encodeCommit(writes));
        return JsonProtocol.decodeCommit(body);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        httpClient.shutdown();
    }

    /**
     * Sends one request and returns the body of a successful response.
     */
    private String execute(String resourceName, String method, byte[] body) {
        if (closed.get()) {
            throw new NotConnectedException("The document service is closed");
        }
        String path = JsonProtocol.requestPath(resourceName, method);
        logFine(logger, "Sending " + method + " to " + path);

        HttpHeaders headers = new DefaultHttpHeaders()
            .set(HttpHeaderNames.CONTENT_TYPE, CONTENT_TYPE)
            .set(HttpHeaderNames.ACCEPT, "application/json")
            .set(HttpHeaderNames.USER_AGENT, USER_AGENT);

        HttpResponse response;
        try {
            response = httpClient.postRequest(path, headers, body)
                .timeout(Duration.ofMillis(timeoutMs))
                .block();
        } catch (RuntimeException re) {
            Throwable cause = Exceptions.unwrap(re);
            if (cause instanceof TimeoutException) {
                logWarning(logger, method + " timed out after " +
                           timeoutMs + "ms");
                throw new RequestTimeoutException(
                    timeoutMs, method + " timed out", cause);
            }
            logWarning(logger, method + " failed: " + cause, cause);
            throw new TransportException(
                method + " failed: " + cause.getMessage(), cause);
        }
        if (response == null) {
            throw new TransportException(method + " received no response");
        }

        String text = response.getBody();
        if (text.length() > maxContentLength) {
            throw new TransportException(
                method + " response exceeds the maximum content length of " +
                maxContentLength, response.getStatusCode(), null, null);
        }
        if (!response.isSuccess()) {
            throw createServiceException(method, response.getStatusCode(),
                                         text);
        }
        return text;
    }

    private TransportException createServiceException(String method,
                                                      int statusCode,
                                                      String body) {
        ServiceError error = JsonProtocol.decodeError(body);
        String status = (error == null ? null : error.getStatus());
        String msg = method + " failed with HTTP status " + statusCode +
            (error == null ? "" : ": " + error);
        logWarning(logger, msg);
        if (statusCode == HttpResponseStatus.SERVICE_UNAVAILABLE.code() ||
            UNAVAILABLE.equals(status)) {
            return new ServiceUnavailableException(msg, statusCode, status);
        }
        return new TransportException(msg, statusCode, status, null);
    }
}

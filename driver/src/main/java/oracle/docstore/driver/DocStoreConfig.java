/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver;

import static oracle.docstore.driver.util.CheckNull.requireNonEmpty;
import static oracle.docstore.driver.util.CheckNull.requireNonNull;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.logging.Logger;

import oracle.docstore.driver.httpclient.ConnectionPoolConfig;

/**
 * DocStoreConfig groups parameters used to configure a
 * {@link DocStoreHandle}. It also provides defaults for the operations of
 * the handle.
 * <p>
 * The only required parameters are the service endpoint, given to the
 * constructor, and the project id. The endpoint may be given as
 * <ul>
 * <li>{@code host}, using https on port 443</li>
 * <li>{@code host:port}, using http unless the port is 443</li>
 * <li>{@code protocol://host}, using port 8080 for http and 443 for
 * https</li>
 * <li>{@code protocol://host:port}</li>
 * </ul>
 * <p>
 * The default request timeout may be overridden with the system property
 * {@value #REQUEST_TIMEOUT_PROPERTY}, in milliseconds.
 */
public class DocStoreConfig implements Cloneable {

    /**
     * System property that overrides the default request timeout
     */
    public static final String REQUEST_TIMEOUT_PROPERTY =
        "oracle.docstore.requestTimeout";

    /**
     * The database used when none is set
     */
    public static final String DEFAULT_DATABASE = "(default)";

    private static final int DEFAULT_TIMEOUT = 5000;
    private static final int DEFAULT_MAX_CONTENT_LENGTH = 32 * 1024 * 1024;
    private static final int DEFAULT_HANDSHAKE_TIMEOUT_MS = 3000;

    private final URL serviceURL;

    private String projectId;

    private String databaseId = DEFAULT_DATABASE;

    /*
     * 0 means the default, possibly overridden by system property
     */
    private int timeout;

    private int maxContentLength;

    private int sslHandshakeTimeoutMs;

    private ConnectionPoolConfig connectionPoolConfig;

    /*
     * The Logger used by the driver, or null if not configured by the user.
     */
    private Logger logger;

    /**
     * Specify an endpoint to use to connect to the service.
     *
     * @param endpoint the endpoint
     * @throws IllegalArgumentException if the endpoint is malformed
     */
    public DocStoreConfig(String endpoint) {
        this.serviceURL = createURL(endpoint, "/");
    }

    /**
     * Parses an endpoint string into a URL.
     *
     * @param endpoint the endpoint
     * @param path the path part of the URL
     * @return the URL
     * @throws IllegalArgumentException if the endpoint is malformed
     */
    public static URL createURL(String endpoint, String path) {
        requireNonEmpty(endpoint, "Endpoint must be non-empty");

        String protocol = "https";
        int port = 443;
        String host;

        String[] parts = endpoint.split(":");
        switch (parts.length) {
        case 1:
            host = parts[0];
            break;
        case 2:
            /* <protocol>://<host> or <host>:<port> */
            if (parts[0].toLowerCase().startsWith("http")) {
                protocol = parts[0].toLowerCase();
                host = parts[1];
                if (protocol.equals("http")) {
                    port = 8080;
                }
            } else {
                host = parts[0];
                port = validatePort(parts[1], endpoint);
                if (port != 443) {
                    protocol = "http";
                }
            }
            break;
        case 3:
            protocol = parts[0].toLowerCase();
            host = parts[1];
            port = validatePort(parts[2], endpoint);
            break;
        default:
            throw new IllegalArgumentException("Invalid endpoint: " +
                                               endpoint);
        }

        if (host.startsWith("//")) {
            host = host.substring(2);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("Invalid endpoint, no host: " +
                                               endpoint);
        }

        try {
            return new URL(protocol, host, port, path);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static int validatePort(String portString, String endpoint) {
        try {
            int port = Integer.parseInt(portString);
            if (port < 0) {
                throw new IllegalArgumentException(
                    "Invalid port in endpoint: " + endpoint);
            }
            return port;
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(
                "Invalid port in endpoint: " + endpoint);
        }
    }

    /**
     * Returns the URL of the service.
     *
     * @return the URL
     */
    public URL getServiceURL() {
        return serviceURL;
    }

    /**
     * Sets the project that owns the database. This is required.
     *
     * @param projectId the project id
     * @return this
     */
    public DocStoreConfig setProjectId(String projectId) {
        requireNonEmpty(projectId,
                        "DocStoreConfig.setProjectId: must be non-empty");
        this.projectId = projectId;
        return this;
    }

    public String getProjectId() {
        return projectId;
    }

    /**
     * Sets the database to use. Defaults to {@value #DEFAULT_DATABASE}.
     *
     * @param databaseId the database id
     * @return this
     */
    public DocStoreConfig setDatabaseId(String databaseId) {
        requireNonEmpty(databaseId,
                        "DocStoreConfig.setDatabaseId: must be non-empty");
        this.databaseId = databaseId;
        return this;
    }

    public String getDatabaseId() {
        return databaseId;
    }

    /**
     * Sets the timeout for each request, in milliseconds.
     *
     * @param timeout the timeout, must be positive
     * @return this
     */
    public DocStoreConfig setRequestTimeout(int timeout) {
        if (timeout <= 0) {
            throw new IllegalArgumentException(
                "DocStoreConfig.setRequestTimeout: timeout must be > 0");
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * Returns the request timeout that is in effect: the value set with
     * {@link #setRequestTimeout}, else the system property
     * {@value #REQUEST_TIMEOUT_PROPERTY}, else 5000.
     *
     * @return the timeout in milliseconds
     */
    public int getRequestTimeout() {
        if (timeout != 0) {
            return timeout;
        }
        String prop = System.getProperty(REQUEST_TIMEOUT_PROPERTY);
        if (prop != null) {
            try {
                int value = Integer.parseInt(prop.trim());
                if (value > 0) {
                    return value;
                }
            } catch (NumberFormatException nfe) {
                if (logger != null) {
                    logger.warning("Invalid value for " +
                                   REQUEST_TIMEOUT_PROPERTY + ": " + prop);
                }
            }
        }
        return DEFAULT_TIMEOUT;
    }

    /**
     * Sets the maximum size of a response, in bytes. 0 means the default of
     * 32MB.
     *
     * @param maxContentLength the maximum size
     * @return this
     */
    public DocStoreConfig setMaxContentLength(int maxContentLength) {
        if (maxContentLength < 0) {
            throw new IllegalArgumentException(
                "DocStoreConfig.setMaxContentLength: must be >= 0");
        }
        this.maxContentLength = maxContentLength;
        return this;
    }

    public int getMaxContentLength() {
        return maxContentLength == 0 ?
            DEFAULT_MAX_CONTENT_LENGTH : maxContentLength;
    }

    /**
     * Sets the SSL handshake timeout, in milliseconds. 0 means the default
     * of 3000.
     *
     * @param timeoutMs the timeout
     * @return this
     */
    public DocStoreConfig setSSLHandshakeTimeout(int timeoutMs) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException(
                "DocStoreConfig.setSSLHandshakeTimeout: must be >= 0");
        }
        this.sslHandshakeTimeoutMs = timeoutMs;
        return this;
    }

    public int getSSLHandshakeTimeout() {
        return sslHandshakeTimeoutMs == 0 ?
            DEFAULT_HANDSHAKE_TIMEOUT_MS : sslHandshakeTimeoutMs;
    }

    /**
     * Sets the configuration of the HTTP connection pool.
     *
     * @param config the pool configuration
     * @return this
     */
    public DocStoreConfig setConnectionPoolConfig(ConnectionPoolConfig config) {
        requireNonNull(config,
                       "DocStoreConfig.setConnectionPoolConfig: " +
                       "config must be non-null");
        this.connectionPoolConfig = config;
        return this;
    }

    /**
     * @return the pool configuration, or a default one if not set
     */
    public ConnectionPoolConfig getConnectionPoolConfig() {
        return connectionPoolConfig == null ?
            ConnectionPoolConfig.builder().build() : connectionPoolConfig;
    }

    /**
     * Sets the Logger used for the driver.
     *
     * @param logger the Logger.
     * @return this
     */
    public DocStoreConfig setLogger(Logger logger) {
        requireNonNull(logger,
                       "DocStoreConfig.setLogger: logger must be non-null");
        this.logger = logger;
        return this;
    }

    /**
     * Returns the Logger, or null if not configured by user.
     *
     * @return the Logger
     */
    public Logger getLogger() {
        return logger;
    }

    /**
     * @hidden
     */
    @Override
    public DocStoreConfig clone() {
        try {
            return (DocStoreConfig) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException(e);
        }
    }
}

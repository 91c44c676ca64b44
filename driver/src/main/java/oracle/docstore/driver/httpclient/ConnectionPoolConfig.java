/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.httpclient;

/**
 * Settings of the HTTP connection pool used by the driver. All times are
 * in milliseconds. Instances are immutable and created with
 * {@link #builder()}.
 */
public class ConnectionPoolConfig {

    static final int DEFAULT_MAX_CONNECTIONS = 100;
    static final int DEFAULT_MAX_PENDING_ACQUIRES = -1;
    static final long DEFAULT_PENDING_ACQUIRE_TIMEOUT = 45_000;
    static final long DEFAULT_MAX_IDLE_TIME = 60_000;
    static final long DEFAULT_MAX_LIFETIME = 300_000;

    private final int maxConnections;
    private final int maxPendingAcquires;
    private final long pendingAcquireTimeout;
    private final long maxIdleTime;
    private final long maxLifetime;

    private ConnectionPoolConfig(Builder builder) {
        this.maxConnections = builder.maxConnections;
        this.maxPendingAcquires = builder.maxPendingAcquires;
        this.pendingAcquireTimeout = builder.pendingAcquireTimeout;
        this.maxIdleTime = builder.maxIdleTime;
        this.maxLifetime = builder.maxLifetime;
    }

    /**
     * @return the maximum number of open connections
     */
    public int getMaxConnections() {
        return maxConnections;
    }

    /**
     * @return the maximum number of requests waiting for a connection, -1
     * for no limit
     */
    public int getMaxPendingAcquires() {
        return maxPendingAcquires;
    }

    /**
     * @return how long a request waits for a connection
     */
    public long getPendingAcquireTimeout() {
        return pendingAcquireTimeout;
    }

    /**
     * @return how long a connection may stay idle before it is closed
     */
    public long getMaxIdleTime() {
        return maxIdleTime;
    }

    /**
     * @return how long a connection may live before it is closed
     */
    public long getMaxLifetime() {
        return maxLifetime;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ConnectionPoolConfig: [maxConnections=" + maxConnections +
            ", maxPendingAcquires=" + maxPendingAcquires +
            ", pendingAcquireTimeout=" + pendingAcquireTimeout +
            ", maxIdleTime=" + maxIdleTime +
            ", maxLifetime=" + maxLifetime + "]";
    }

    public static class Builder {
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private int maxPendingAcquires = DEFAULT_MAX_PENDING_ACQUIRES;
        private long pendingAcquireTimeout = DEFAULT_PENDING_ACQUIRE_TIMEOUT;
        private long maxIdleTime = DEFAULT_MAX_IDLE_TIME;
        private long maxLifetime = DEFAULT_MAX_LIFETIME;

        /**
         * Sets the maximum number of open connections. A value of 1
         * disables pooling: each request uses a new connection.
         * Default to {@value ConnectionPoolConfig#DEFAULT_MAX_CONNECTIONS}.
         *
         * @param maxConnections the maximum, must be positive
         * @return this
         */
        public Builder maxConnections(int maxConnections) {
            if (maxConnections <= 0) {
                throw new IllegalArgumentException("maxConnections must be " +
                    "positive, provided value is " + maxConnections);
            }
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * Sets the maximum number of requests waiting for a connection.
         * Default to -1, no limit.
         *
         * @param maxPendingAcquires the maximum, positive or -1
         * @return this
         */
        public Builder maxPendingAcquires(int maxPendingAcquires) {
            if (maxPendingAcquires != -1 && maxPendingAcquires <= 0) {
                throw new IllegalArgumentException("maxPendingAcquires must " +
                    "be positive or -1, provided value is " +
                    maxPendingAcquires);
            }
            this.maxPendingAcquires = maxPendingAcquires;
            return this;
        }

        /**
         * Sets how long a request waits for a connection before failing.
         *
         * @param pendingAcquireTimeout the time, must be positive
         * @return this
         */
        public Builder pendingAcquireTimeout(long pendingAcquireTimeout) {
            if (pendingAcquireTimeout <= 0) {
                throw new IllegalArgumentException("pendingAcquireTimeout " +
                    "must be positive, provided value is " +
                    pendingAcquireTimeout);
            }
            this.pendingAcquireTimeout = pendingAcquireTimeout;
            return this;
        }

        /**
         * Sets how long a connection may stay idle. The check is made when
         * the connection is selected for use.
         *
         * @param maxIdleTime the time, must be positive
         * @return this
         */
        public Builder maxIdleTime(long maxIdleTime) {
            if (maxIdleTime <= 0) {
                throw new IllegalArgumentException("maxIdleTime must be " +
                    "positive, provided value is " + maxIdleTime);
            }
            this.maxIdleTime = maxIdleTime;
            return this;
        }

        /**
         * Sets how long a connection may live. The check is made when the
         * connection is selected for use.
         *
         * @param maxLifetime the time, must be positive
         * @return this
         */
        public Builder maxLifetime(long maxLifetime) {
            if (maxLifetime <= 0) {
                throw new IllegalArgumentException("maxLifetime must be " +
                    "positive, provided value is " + maxLifetime);
            }
            this.maxLifetime = maxLifetime;
            return this;
        }

        public ConnectionPoolConfig build() {
            return new ConnectionPoolConfig(this);
        }
    }
}

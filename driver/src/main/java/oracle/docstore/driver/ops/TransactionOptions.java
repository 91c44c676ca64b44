/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import java.time.Instant;

/**
 * Options used to begin a transaction. Only read-only transactions are
 * supported: reads within the transaction observe the database at a single
 * point in time, either the time the transaction began or a fixed read time
 * chosen by the caller.
 */
public final class TransactionOptions {

    private final Instant readTime;

    private TransactionOptions(Instant readTime) {
        this.readTime = readTime;
    }

    /**
     * Options for a read-only transaction at the current time.
     *
     * @return the options
     */
    public static TransactionOptions readOnly() {
        return new TransactionOptions(null);
    }

    /**
     * Options for a read-only transaction at a fixed time in the past.
     *
     * @param readTime the read time, or null for the current time
     * @return the options
     */
    public static TransactionOptions readOnly(Instant readTime) {
        return new TransactionOptions(readTime);
    }

    public boolean isReadOnly() {
        return true;
    }

    /**
     * @return the fixed read time, or null to read at the current time
     */
    public Instant getReadTime() {
        return readTime;
    }

    @Override
    public String toString() {
        return "TransactionOptions: [readOnly, readTime=" + readTime + "]";
    }
}

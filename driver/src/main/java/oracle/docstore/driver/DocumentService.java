/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver;

import java.time.Instant;
import java.util.List;

import oracle.docstore.driver.ops.DocumentSnapshot;
import oracle.docstore.driver.ops.FieldMask;
import oracle.docstore.driver.ops.Query;
import oracle.docstore.driver.ops.ResultPage;
import oracle.docstore.driver.ops.TransactionOptions;
import oracle.docstore.driver.ops.Write;

/**
 * The remote procedures of the document service. Each method is one
 * synchronous request: the calling thread blocks until the response
 * arrives or the request fails.
 * <p>
 * Implementations must be safe for concurrent use; a single instance is
 * shared by every handle operation, result sequence and transaction created
 * from a {@link DocStoreHandle}. Failures are reported as
 * {@link TransportException} and are never retried by the callers in this
 * driver.
 * <p>
 * Transaction ids are opaque byte strings issued by
 * {@link #beginTransaction}. Methods that accept one treat null as "no
 * transaction".
 */
public interface DocumentService {

    /**
     * Runs one batch of a query.
     *
     * @param parentName the resource name under which the query runs
     * @param query the query, including its start cursor if resuming
     * @param transactionId the transaction to read in, or null
     * @return the page of results
     */
    ResultPage runQuery(String parentName,
                        Query query,
                        byte[] transactionId);

    /**
     * Begins a transaction.
     *
     * @param options the transaction options
     * @return the new transaction id
     */
    byte[] beginTransaction(TransactionOptions options);

    /**
     * Rolls back a transaction, releasing it on the service.
     *
     * @param transactionId the transaction id
     */
    void rollback(byte[] transactionId);

    /**
     * Reads documents by resource name. Results are returned in the order
     * the service returns them; documents that do not exist are returned as
     * snapshots for which {@link DocumentSnapshot#exists} is false.
     *
     * @param documentNames full resource names of the documents
     * @param mask the fields to return, or null for all fields
     * @param transactionId the transaction to read in, or null
     * @return the snapshots
     */
    List<DocumentSnapshot> batchGet(List<String> documentNames,
                                    FieldMask mask,
                                    byte[] transactionId);

    /**
     * Lists the ids of the collections directly under a parent.
     *
     * @param parentName the documents root or a document resource name
     * @return the collection ids
     */
    List<String> listCollectionIds(String parentName);

    /**
     * Applies writes atomically.
     *
     * @param writes the writes
     * @return the commit time
     */
    Instant commit(List<Write> writes);

    /**
     * Releases resources held by the service client.
     */
    void close();
}

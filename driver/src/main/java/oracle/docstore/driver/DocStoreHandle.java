/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

import oracle.docstore.driver.ops.CollectionReference;
import oracle.docstore.driver.ops.DocumentReference;
import oracle.docstore.driver.ops.DocumentSnapshot;
import oracle.docstore.driver.ops.FieldMask;
import oracle.docstore.driver.ops.GetTarget;
import oracle.docstore.driver.ops.Query;
import oracle.docstore.driver.ops.ReadSnapshot;
import oracle.docstore.driver.ops.ResultSequence;
import oracle.docstore.driver.ops.WriteBatch;

/**
 * DocStoreHandle is a handle to one database of the document service. It
 * is the entry point for reads, queries, write batches and read-only
 * transactions. Handles are created using
 * {@link DocStoreHandleFactory#createHandle}.
 * <p>
 * A handle is thread-safe and is intended to be shared. It holds the
 * transport to the service; call {@link #close} when done to release it.
 * After close every operation fails with {@link NotConnectedException}.
 * <p>
 * Paths passed to the handle are relative to the documents root of the
 * database and are {@code /}-delimited. A collection path has an odd number
 * of segments ({@code users}, {@code users/mike/messages}); a document path
 * has an even number ({@code users/mike}). Methods that need one kind fail
 * with {@link IllegalArgumentException} when given the other.
 * <p>
 * Example:
 * <pre>
 * DocStoreConfig config = new DocStoreConfig("http://localhost:8080")
 *     .setProjectId("my-project");
 * try (DocStoreHandle handle = DocStoreHandleFactory.createHandle(config);
 *      ReadSnapshot snapshot = handle.readOnlyTransaction()) {
 *     DocumentSnapshot sf = snapshot.getDocument("cities/SF");
 *     Iterator&lt;DocumentSnapshot&gt; users = snapshot.get("users");
 * }
 * </pre>
 */
public interface DocStoreHandle extends AutoCloseable {

    /**
     * @return the project id
     */
    String getProjectId();

    /**
     * @return the database id
     */
    String getDatabaseId();

    /**
     * Returns the resource name of the database,
     * {@code projects/{project}/databases/{database}}.
     *
     * @return the database path
     */
    String getPath();

    /**
     * Returns a reference to a collection.
     *
     * @param collectionPath a collection path
     * @return the reference
     * @throws IllegalArgumentException if the path refers to a document
     */
    CollectionReference col(String collectionPath);

    /**
     * Returns a reference to a document.
     *
     * @param documentPath a document path
     * @return the reference
     * @throws IllegalArgumentException if the path refers to a collection
     */
    DocumentReference doc(String documentPath);

    /**
     * Lists the top level collections of the database.
     *
     * @return the collections
     * @throws TransportException if the request fails
     */
    List<CollectionReference> cols();

    /**
     * Reads a target outside of any transaction. The returned iterator is
     * lazy: no request is made until it is first used. A single document
     * target yields exactly one snapshot, which may not exist.
     *
     * @param target the target
     * @return the documents
     */
    Iterator<DocumentSnapshot> get(GetTarget target);

    /**
     * Reads a single document outside of any transaction.
     *
     * @param documentPath a document path
     * @return the snapshot
     * @throws IllegalArgumentException if the path refers to a collection
     * @throws TransportException if the request fails
     */
    DocumentSnapshot getDocument(String documentPath);

    /**
     * Runs the first page of a query outside of any transaction. Use the
     * returned sequence to page through the results.
     *
     * @param query the query
     * @return the first page
     * @throws TransportException if the request fails
     */
    ResultSequence runQuery(Query query);

    /**
     * Reads several documents in one request outside of any transaction.
     *
     * @param documentPaths document paths
     * @return a lazy iterator over the snapshots
     * @throws IllegalArgumentException if any path refers to a collection
     */
    Iterator<DocumentSnapshot> getAll(String... documentPaths);

    /**
     * Reads several documents in one request outside of any transaction.
     *
     * @param documents the documents
     * @param mask the fields to return, or null for all fields
     * @return a lazy iterator over the snapshots
     */
    Iterator<DocumentSnapshot> getAll(List<DocumentReference> documents,
                                      FieldMask mask);

    /**
     * Creates a write batch.
     *
     * @return the batch
     */
    WriteBatch batch();

    /**
     * Creates a read-only transaction that reads at the time of its first
     * read. No request is made until then.
     *
     * @return the transaction
     */
    ReadSnapshot readOnlyTransaction();

    /**
     * Creates a read-only transaction that reads at a fixed time.
     *
     * @param readTime the read time, or null for the current time
     * @return the transaction
     */
    ReadSnapshot readOnlyTransaction(Instant readTime);

    /**
     * Internal use only
     *
     * Returns the service this handle talks to.
     *
     * @return the service
     * @throws NotConnectedException if the handle has been closed
     * @hidden
     */
    DocumentService getService();

    /**
     * @return the logger used by the handle
     */
    Logger getLogger();

    /**
     * @return true if {@link #close} has been called
     */
    boolean isClosed();

    /**
     * Closes the handle and releases the transport. Calling close more than
     * once has no further effect.
     */
    @Override
    void close();
}

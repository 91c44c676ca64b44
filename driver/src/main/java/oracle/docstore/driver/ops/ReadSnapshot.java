/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.util.CheckNull.requireNonNullIAE;
import static oracle.docstore.driver.util.LogUtil.logFine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

import oracle.docstore.driver.ClosedTransactionException;
import oracle.docstore.driver.DocStoreHandle;
import oracle.docstore.driver.DocumentService;
import oracle.docstore.driver.NotConnectedException;
import oracle.docstore.driver.TransportException;
import oracle.docstore.driver.util.LazyIterator;

/**
 * A read-only transaction: a set of reads that observe the database at a
 * single logical point in time.
 * <p>
 * A ReadSnapshot moves through three states. It is created
 * {@link State#UNINITIALIZED}, without a transaction on the service. The
 * first read begins a read-only transaction, at the current time or at the
 * read time given when the snapshot was created, and the snapshot becomes
 * {@link State#ACTIVE}. Every later read reuses that transaction id; a
 * snapshot never begins a second transaction. {@link #rollback} moves the
 * snapshot to {@link State#CLOSED}, releasing the transaction if one was
 * begun. Any read on a closed snapshot fails with
 * {@link ClosedTransactionException}, including pulling further pages from
 * an iterator obtained before the rollback.
 * <p>
 * Changes to data are not supported.
 * <p>
 * Example:
 * <pre>
 * try (ReadSnapshot rtx = handle.readOnlyTransaction()) {
 *     DocumentSnapshot nyc = rtx.getDocument("cities/NYC");
 *     DocumentSnapshot sf = rtx.getDocument("cities/SF");
 *     Iterator&lt;DocumentSnapshot&gt; users = rtx.get("users");
 * }
 * </pre>
 * Note: a ReadSnapshot and the iterators it returns can only be used safely
 * by one thread at a time.
 */
public class ReadSnapshot implements AutoCloseable {

    /**
     * The lifecycle of a snapshot.
     */
    public enum State {
        /** no transaction has been begun yet */
        UNINITIALIZED,
        /** a transaction id has been assigned */
        ACTIVE,
        /** rolled back, no further reads are allowed */
        CLOSED
    }

    private final DocStoreHandle handle;
    private final Instant readTime;
    private final Logger logger;

    private State state = State.UNINITIALIZED;

    /* assigned once, on the transition to ACTIVE */
    private byte[] transactionId;

    /**
     * Internal use only
     *
     * @param handle the owning handle, may be null in which case every read
     * fails with {@link NotConnectedException}
     * @param readTime the fixed read time, or null for the current time
     * @hidden
     */
    public ReadSnapshot(DocStoreHandle handle, Instant readTime) {
        this.handle = handle;
        this.readTime = readTime;
        this.logger = (handle == null ? null : handle.getLogger());
    }

    public State getState() {
        return state;
    }

    /**
     * Returns true once the snapshot has been rolled back.
     *
     * @return true if closed
     */
    public boolean isClosed() {
        return state == State.CLOSED;
    }

    /**
     * Returns the transaction id, or null if no read has happened yet.
     *
     * @return a copy of the transaction id, or null
     */
    public byte[] getTransactionId() {
        return (transactionId == null ? null : transactionId.clone());
    }

    /**
     * Returns the fixed read time of the snapshot.
     *
     * @return the read time, or null if reading at the current time
     */
    public Instant getReadTime() {
        return readTime;
    }

    /**
     * @return the owning handle
     * @throws NotConnectedException if there is no handle
     */
    public DocStoreHandle getHandle() {
        ensureHandle();
        return handle;
    }

    /**
     * @return the resource name of the database
     */
    public String getPath() {
        return getHandle().getPath();
    }

    /**
     * Returns a reference to a collection.
     *
     * @param collectionPath a collection path
     * @return the reference
     * @throws IllegalArgumentException if the path refers to a document
     */
    public CollectionReference col(String collectionPath) {
        return new CollectionReference(
            DocumentPath.parseCollection(getPath(), collectionPath));
    }

    /**
     * Returns a reference to a document.
     *
     * @param documentPath a document path
     * @return the reference
     * @throws IllegalArgumentException if the path refers to a collection
     */
    public DocumentReference doc(String documentPath) {
        return new DocumentReference(
            DocumentPath.parseDocument(getPath(), documentPath));
    }

    /**
     * Returns a query over every document of a collection.
     *
     * @param collectionPath a collection path
     * @return the query
     */
    public Query query(String collectionPath) {
        return col(collectionPath).query();
    }

    /**
     * Lists the top level collections of the database.
     *
     * @return the collections
     */
    public List<CollectionReference> cols() {
        checkNotClosed();
        String root = DocumentPath.documentsRoot(getPath());
        List<CollectionReference> cols = new ArrayList<>();
        for (String id : service().listCollectionIds(root)) {
            cols.add(col(id));
        }
        return cols;
    }

    /**
     * Reads every document of a collection within this transaction.
     *
     * @param collectionPath a collection path
     * @return a lazy iterator over the documents
     */
    public Iterator<DocumentSnapshot> docs(String collectionPath) {
        return get(col(collectionPath));
    }

    /**
     * Reads a target within this transaction.
     * <p>
     * The result is always a lazy iterator: no request is made until it is
     * first used. A document target yields exactly one snapshot, which may
     * not exist; a collection or query target yields every matching
     * document across all pages.
     *
     * @param target what to read
     * @return the documents
     * @throws IllegalArgumentException if the target is null
     * @throws ClosedTransactionException if the snapshot is closed
     * @throws NotConnectedException if there is no live handle
     */
    public Iterator<DocumentSnapshot> get(GetTarget target) {
        requireNonNullIAE(target, "get: target must be non-null");
        checkNotClosed();
        ensureHandle();
        switch (target.getKind()) {
        case DOCUMENT_PATH:
        case DOCUMENT:
            return getAll(
                Collections.singletonList(target.toDocument(getPath())),
                null);
        case COLLECTION_PATH:
        case COLLECTION:
        case QUERY:
            final Query query = target.toQuery(getPath());
            return new LazyIterator<>(() -> runQuery(query).exhaustAll());
        default:
            throw new IllegalStateException("Unknown target: " + target);
        }
    }

    /**
     * Reads a path within this transaction. A path with an even number of
     * segments is read as a document, one with an odd number as every
     * document of the collection.
     *
     * @param path a document or collection path
     * @return a lazy iterator over the documents
     */
    public Iterator<DocumentSnapshot> get(String path) {
        return get(GetTarget.of(path));
    }

    /**
     * Reads every document of a collection within this transaction.
     *
     * @param collection the collection
     * @return a lazy iterator over the documents
     */
    public Iterator<DocumentSnapshot> get(CollectionReference collection) {
        return get(GetTarget.of(collection));
    }

    /**
     * Runs a query within this transaction.
     *
     * @param query the query
     * @return a lazy iterator over the documents of all pages
     */
    public Iterator<DocumentSnapshot> get(Query query) {
        return get(GetTarget.of(query));
    }

    /**
     * Reads a single document within this transaction.
     *
     * @param document the document
     * @return the snapshot, which may not exist
     */
    public DocumentSnapshot get(DocumentReference document) {
        Iterator<DocumentSnapshot> iter = get(GetTarget.of(document));
        if (!iter.hasNext()) {
            return DocumentSnapshot.missing(document, null);
        }
        return iter.next();
    }

    /**
     * Reads a single document within this transaction.
     *
     * @param documentPath a document path
     * @return the snapshot, which may not exist
     * @throws IllegalArgumentException if the path refers to a collection
     */
    public DocumentSnapshot getDocument(String documentPath) {
        return get(doc(documentPath));
    }

    /**
     * Runs the first page of a query within this transaction. Following
     * pages fetched from the returned sequence read in the same
     * transaction.
     *
     * @param query the query
     * @return the first page
     * @throws TransportException if the request fails
     */
    public ResultSequence runQuery(Query query) {
        checkNotClosed();
        byte[] txn = ensureTransactionId();
        return ResultSequence.run(service(), query, txn, this, logger);
    }

    /**
     * Reads several documents in one request within this transaction.
     *
     * @param documentPaths document paths
     * @return a lazy iterator over the snapshots
     * @throws IllegalArgumentException if any path refers to a collection
     */
    public Iterator<DocumentSnapshot> getAll(String... documentPaths) {
        checkNotClosed();
        List<DocumentReference> refs = new ArrayList<>();
        for (String path : documentPaths) {
            refs.add(doc(path));
        }
        return getAll(refs, null);
    }

    /**
     * Reads several documents in one request within this transaction. All
     * documents are read under the same transaction id, begun by this call
     * if no earlier read has begun it.
     *
     * @param documents the documents
     * @param mask the fields to return, or null for all fields
     * @return a lazy iterator over the snapshots
     */
    public Iterator<DocumentSnapshot> getAll(List<DocumentReference> documents,
                                             FieldMask mask) {
        checkNotClosed();
        ensureHandle();
        final List<String> names = new ArrayList<>(documents.size());
        for (DocumentReference ref : documents) {
            names.add(ref.getName());
        }
        return new LazyIterator<>(() -> {
            checkNotClosed();
            byte[] txn = ensureTransactionId();
            return service().batchGet(names, mask, txn).iterator();
        });
    }

    /**
     * Ends the transaction. If a transaction was begun it is rolled back on
     * the service; otherwise no request is made.
     *
     * @throws ClosedTransactionException if already closed
     * @throws TransportException if the rollback request fails; the
     * snapshot is closed regardless
     */
    public void rollback() {
        checkNotClosed();
        state = State.CLOSED;
        if (transactionId == null) {
            return;
        }
        logFine(logger, "Rolling back read-only transaction");
        service().rollback(transactionId);
    }

    /**
     * Rolls back the transaction unless it is already closed.
     */
    @Override
    public void close() {
        if (state != State.CLOSED) {
            rollback();
        }
    }

    /**
     * Returns the transaction id, beginning the transaction if this is the
     * first read. This is the only place a transaction is begun.
     *
     * @return the transaction id
     */
    byte[] ensureTransactionId() {
        checkNotClosed();
        if (state == State.ACTIVE) {
            return transactionId;
        }
        byte[] id = service().beginTransaction(
            TransactionOptions.readOnly(readTime));
        if (id == null || id.length == 0) {
            throw new TransportException(
                "Service returned an empty transaction id");
        }
        transactionId = id;
        state = State.ACTIVE;
        logFine(logger, "Began read-only transaction" +
                (readTime == null ? "" : " at " + readTime));
        return transactionId;
    }

    void checkNotClosed() {
        if (state == State.CLOSED) {
            throw new ClosedTransactionException("transaction is closed");
        }
    }

    private void ensureHandle() {
        if (handle == null) {
            throw new NotConnectedException(
                "Must have active connection to service");
        }
    }

    private DocumentService service() {
        ensureHandle();
        return handle.getService();
    }

    @Override
    public String toString() {
        return "ReadSnapshot: [state=" + state +
            ", readTime=" + readTime + "]";
    }
}

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
import java.util.List;
import java.util.Map;

import oracle.docstore.driver.DocStoreHandle;
import oracle.docstore.driver.NotConnectedException;
import oracle.docstore.driver.TransportException;

/**
 * Accumulates writes and applies them atomically with a single commit
 * request. Nothing is sent to the service until {@link #commit}.
 * <p>
 * A batch can be committed once. Adding writes to, or committing, a batch
 * that has already been committed fails with {@link IllegalStateException}.
 * <p>
 * Example:
 * <pre>
 * WriteBatch batch = handle.batch();
 * batch.set(batch.doc("cities/SF"), sfData)
 *      .update(batch.doc("cities/LA"), Collections.singletonMap("pop", 4L))
 *      .delete(batch.doc("cities/NYC"));
 * Instant commitTime = batch.commit();
 * </pre>
 * Note: a WriteBatch is not thread-safe.
 */
public class WriteBatch {

    private final DocStoreHandle handle;
    private final List<Write> writes = new ArrayList<>();
    private boolean committed;

    /**
     * Internal use only
     *
     * @param handle the owning handle
     * @hidden
     */
    public WriteBatch(DocStoreHandle handle) {
        this.handle = handle;
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
     * Creates a document. The commit fails if the document exists.
     *
     * @param ref the document
     * @param data the fields
     * @return this
     */
    public WriteBatch create(DocumentReference ref, Map<String, Object> data) {
        requireNonNullIAE(data, "WriteBatch.create: data must be non-null");
        return add(new Write(Write.Type.CREATE, ref, data, false));
    }

    /**
     * Writes a document, replacing it if it exists.
     *
     * @param ref the document
     * @param data the fields
     * @return this
     */
    public WriteBatch set(DocumentReference ref, Map<String, Object> data) {
        return set(ref, data, false);
    }

    /**
     * Writes a document. With merge, the given fields are merged into an
     * existing document instead of replacing it.
     *
     * @param ref the document
     * @param data the fields
     * @param merge true to merge
     * @return this
     */
    public WriteBatch set(DocumentReference ref,
                          Map<String, Object> data,
                          boolean merge) {
        requireNonNullIAE(data, "WriteBatch.set: data must be non-null");
        return add(new Write(Write.Type.SET, ref, data, merge));
    }

    /**
     * Updates fields of an existing document. The commit fails if the
     * document does not exist.
     *
     * @param ref the document
     * @param data the fields to update, must not be empty
     * @return this
     */
    public WriteBatch update(DocumentReference ref, Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException(
                "WriteBatch.update: data must be non-empty");
        }
        return add(new Write(Write.Type.UPDATE, ref, data, true));
    }

    /**
     * Deletes a document. Deleting a missing document is not an error.
     *
     * @param ref the document
     * @return this
     */
    public WriteBatch delete(DocumentReference ref) {
        return add(new Write(Write.Type.DELETE, ref, null, false));
    }

    /**
     * Sends all writes in one request.
     *
     * The batch is marked committed only once the request succeeds. If it
     * fails the batch keeps its writes and may be committed again.
     *
     * @return the commit time, or null if the batch was empty and nothing
     * was sent
     * @throws IllegalStateException if the batch was already committed
     * @throws TransportException if the request fails
     * @throws NotConnectedException if there is no live handle
     */
    public Instant commit() {
        checkNotCommitted();
        if (writes.isEmpty()) {
            committed = true;
            return null;
        }
        if (handle == null) {
            throw new NotConnectedException(
                "Must have active connection to service");
        }
        logFine(handle.getLogger(),
                "Committing batch of " + writes.size() + " writes");
        Instant commitTime = handle.getService().commit(getWrites());
        committed = true;
        return commitTime;
    }

    /**
     * @return the writes added so far
     */
    public List<Write> getWrites() {
        return Collections.unmodifiableList(writes);
    }

    public boolean isCommitted() {
        return committed;
    }

    private WriteBatch add(Write write) {
        requireNonNullIAE(write.getReference(),
                          "WriteBatch: document must be non-null");
        checkNotCommitted();
        writes.add(write);
        return this;
    }

    private void checkNotCommitted() {
        if (committed) {
            throw new IllegalStateException("batch is already committed");
        }
    }

    private String getPath() {
        if (handle == null) {
            throw new NotConnectedException(
                "Must have active connection to service");
        }
        return handle.getPath();
    }
}

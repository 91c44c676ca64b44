/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.http;

import static oracle.docstore.driver.util.CheckNull.requireNonNullIAE;
import static oracle.docstore.driver.util.LogUtil.logFine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

import oracle.docstore.driver.DocStoreConfig;
import oracle.docstore.driver.DocStoreHandle;
import oracle.docstore.driver.DocumentService;
import oracle.docstore.driver.NotConnectedException;
import oracle.docstore.driver.ops.CollectionReference;
import oracle.docstore.driver.ops.DocumentPath;
import oracle.docstore.driver.ops.DocumentReference;
import oracle.docstore.driver.ops.DocumentSnapshot;
import oracle.docstore.driver.ops.FieldMask;
import oracle.docstore.driver.ops.GetTarget;
import oracle.docstore.driver.ops.Query;
import oracle.docstore.driver.ops.ReadSnapshot;
import oracle.docstore.driver.ops.ResultSequence;
import oracle.docstore.driver.ops.WriteBatch;
import oracle.docstore.driver.util.LazyIterator;

/**
 * The handle implementation. Reads made directly on the handle run outside
 * of any transaction; reads that need a consistent view go through a
 * {@link ReadSnapshot}.
 */
public class DocStoreHandleImpl implements DocStoreHandle {

    private final String projectId;
    private final String databaseId;
    private final String databasePath;
    private final Logger logger;

    /*
     * Set to null on close so that later use fails with
     * NotConnectedException rather than reaching a released transport.
     */
    private volatile DocumentService service;

    public DocStoreHandleImpl(DocStoreConfig config, DocumentService service) {
        this.projectId = config.getProjectId();
        this.databaseId = config.getDatabaseId();
        this.databasePath = DocumentPath.databasePath(projectId, databaseId);
        this.logger = getLogger(config);
        this.service = service;
        logFine(logger, "Created handle for " + databasePath);
    }

    /**
     * Returns the logger used for the driver. If no logger is specified
     * create one based on the package name.
     */
    static Logger getLogger(DocStoreConfig config) {
        if (config.getLogger() != null) {
            return config.getLogger();
        }
        return Logger.getLogger("oracle.docstore.driver");
    }

    @Override
    public String getProjectId() {
        return projectId;
    }

    @Override
    public String getDatabaseId() {
        return databaseId;
    }

    @Override
    public String getPath() {
        return databasePath;
    }

    @Override
    public CollectionReference col(String collectionPath) {
        return new CollectionReference(
            DocumentPath.parseCollection(databasePath, collectionPath));
    }

    @Override
    public DocumentReference doc(String documentPath) {
        return new DocumentReference(
            DocumentPath.parseDocument(databasePath, documentPath));
    }

    @Override
    public List<CollectionReference> cols() {
        List<CollectionReference> cols = new ArrayList<>();
        String root = DocumentPath.documentsRoot(databasePath);
        for (String id : getService().listCollectionIds(root)) {
            cols.add(col(id));
        }
        return cols;
    }

    @Override
    public Iterator<DocumentSnapshot> get(GetTarget target) {
        requireNonNullIAE(target, "get: target must be non-null");
        final DocumentService svc = getService();
        if (target.isSingleDocument()) {
            return getAll(
                Collections.singletonList(target.toDocument(databasePath)),
                null);
        }
        final Query query = target.toQuery(databasePath);
        return new LazyIterator<>(
            () -> ResultSequence.run(svc, query, null, logger).exhaustAll());
    }

    @Override
    public DocumentSnapshot getDocument(String documentPath) {
        DocumentReference ref = doc(documentPath);
        Iterator<DocumentSnapshot> iter = get(GetTarget.of(ref));
        return iter.hasNext() ? iter.next() :
            DocumentSnapshot.missing(ref, null);
    }

    @Override
    public ResultSequence runQuery(Query query) {
        requireNonNullIAE(query, "runQuery: query must be non-null");
        return ResultSequence.run(getService(), query, null, logger);
    }

    @Override
    public Iterator<DocumentSnapshot> getAll(String... documentPaths) {
        List<DocumentReference> refs = new ArrayList<>();
        for (String path : documentPaths) {
            refs.add(doc(path));
        }
        return getAll(refs, null);
    }

    @Override
    public Iterator<DocumentSnapshot> getAll(List<DocumentReference> documents,
                                             FieldMask mask) {
        requireNonNullIAE(documents, "getAll: documents must be non-null");
        final DocumentService svc = getService();
        final List<String> names = new ArrayList<>(documents.size());
        for (DocumentReference ref : documents) {
            names.add(ref.getName());
        }
        return new LazyIterator<>(
            () -> svc.batchGet(names, mask, null).iterator());
    }

    @Override
    public WriteBatch batch() {
        getService();
        return new WriteBatch(this);
    }

    @Override
    public ReadSnapshot readOnlyTransaction() {
        return readOnlyTransaction(null);
    }

    @Override
    public ReadSnapshot readOnlyTransaction(Instant readTime) {
        getService();
        return new ReadSnapshot(this, readTime);
    }

    @Override
    public DocumentService getService() {
        DocumentService svc = service;
        if (svc == null) {
            throw new NotConnectedException(
                "Must have active connection to service");
        }
        return svc;
    }

    @Override
    public Logger getLogger() {
        return logger;
    }

    @Override
    public boolean isClosed() {
        return service == null;
    }

    @Override
    public synchronized void close() {
        DocumentService svc = service;
        if (svc == null) {
            return;
        }
        service = null;
        logFine(logger, "Closing handle for " + databasePath);
        svc.close();
    }
}

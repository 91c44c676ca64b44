/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.util.CheckNull.requireNonNullIAE;

/**
 * The thing to read in {@link ReadSnapshot#get(GetTarget)} and
 * {@link oracle.docstore.driver.DocStoreHandle#get(GetTarget)}: a path
 * string, a document or collection reference, or a query. Exactly one of
 * the accessors matching {@link #getKind} returns a value.
 * <p>
 * A path string is classified when the target is created: an even number
 * of segments is a document path, an odd number a collection path.
 */
public final class GetTarget {

    /**
     * The variants of a target.
     */
    public enum Kind {
        /** a relative path with an even number of segments */
        DOCUMENT_PATH,
        /** a relative path with an odd number of segments */
        COLLECTION_PATH,
        /** a {@link DocumentReference} */
        DOCUMENT,
        /** a {@link CollectionReference} */
        COLLECTION,
        /** a {@link Query} */
        QUERY
    }

    private final Kind kind;
    private final String path;
    private final DocumentReference document;
    private final CollectionReference collection;
    private final Query query;

    private GetTarget(Kind kind,
                      String path,
                      DocumentReference document,
                      CollectionReference collection,
                      Query query) {
        this.kind = kind;
        this.path = path;
        this.document = document;
        this.collection = collection;
        this.query = query;
    }

    /**
     * Creates a target from a path relative to the documents root.
     *
     * @param path the path
     * @return the target, of kind DOCUMENT_PATH or COLLECTION_PATH
     * @throws IllegalArgumentException if the path is null, empty or has an
     * empty segment
     */
    public static GetTarget of(String path) {
        Kind kind = DocumentPath.isDocumentPath(path) ?
            Kind.DOCUMENT_PATH : Kind.COLLECTION_PATH;
        return new GetTarget(kind, path, null, null, null);
    }

    public static GetTarget of(DocumentReference document) {
        requireNonNullIAE(document, "GetTarget: document must be non-null");
        return new GetTarget(Kind.DOCUMENT, null, document, null, null);
    }

    public static GetTarget of(CollectionReference collection) {
        requireNonNullIAE(collection,
                          "GetTarget: collection must be non-null");
        return new GetTarget(Kind.COLLECTION, null, null, collection, null);
    }

    public static GetTarget of(Query query) {
        requireNonNullIAE(query, "GetTarget: query must be non-null");
        return new GetTarget(Kind.QUERY, null, null, null, query);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the path for DOCUMENT_PATH and COLLECTION_PATH, else null
     */
    public String getPath() {
        return path;
    }

    public DocumentReference getDocument() {
        return document;
    }

    public CollectionReference getCollection() {
        return collection;
    }

    public Query getQuery() {
        return query;
    }

    /**
     * Returns true if the target names a single document.
     *
     * @return true for DOCUMENT_PATH and DOCUMENT
     */
    public boolean isSingleDocument() {
        return kind == Kind.DOCUMENT_PATH || kind == Kind.DOCUMENT;
    }

    /**
     * Resolves a single document target within a database.
     *
     * @param databasePath the database resource name
     * @return the document reference
     * @throws IllegalStateException if the target is not a single document
     * @hidden
     */
    public DocumentReference toDocument(String databasePath) {
        switch (kind) {
        case DOCUMENT_PATH:
            return new DocumentReference(
                DocumentPath.parseDocument(databasePath, path));
        case DOCUMENT:
            return document;
        default:
            throw new IllegalStateException(kind + " is not a document");
        }
    }

    /**
     * Resolves a multi document target within a database.
     *
     * @param databasePath the database resource name
     * @return the query to run
     * @throws IllegalStateException if the target is a single document
     * @hidden
     */
    public Query toQuery(String databasePath) {
        switch (kind) {
        case COLLECTION_PATH:
            return new CollectionReference(
                DocumentPath.parseCollection(databasePath, path)).query();
        case COLLECTION:
            return collection.query();
        case QUERY:
            return query;
        default:
            throw new IllegalStateException(kind + " is not a query");
        }
    }

    @Override
    public String toString() {
        switch (kind) {
        case DOCUMENT_PATH:
        case COLLECTION_PATH:
            return "GetTarget: [" + kind + " " + path + "]";
        case DOCUMENT:
            return "GetTarget: [" + document + "]";
        case COLLECTION:
            return "GetTarget: [" + collection + "]";
        default:
            return "GetTarget: [" + query + "]";
        }
    }
}

/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.util.CheckNull.requireNonNull;

/**
 * A reference to a collection in a database. Like
 * {@link DocumentReference} it is a location only and does not go remote.
 */
public final class CollectionReference {

    private final DocumentPath path;

    /**
     * @hidden
     * @param path a collection path
     */
    public CollectionReference(DocumentPath path) {
        requireNonNull(path, "CollectionReference: path must be non-null");
        if (path.isDocument()) {
            throw new IllegalArgumentException(
                "collection_path must refer to a collection.");
        }
        this.path = path;
    }

    /**
     * Returns the id of the collection, the last segment of its path.
     *
     * @return the id
     */
    public String getCollectionId() {
        return path.getId();
    }

    /**
     * Returns the path of the collection relative to the documents root.
     *
     * @return the relative path
     */
    public String getCollectionPath() {
        return path.getRelativePath();
    }

    /**
     * Returns the full resource name of the collection.
     *
     * @return the resource name
     */
    public String getName() {
        return path.getName();
    }

    public DocumentPath getPath() {
        return path;
    }

    /**
     * Returns the resource name under which queries on this collection run:
     * the enclosing document, or the documents root.
     *
     * @return the parent resource name
     */
    public String getParentName() {
        return path.getParentName();
    }

    /**
     * Returns the document that contains this collection, or null for a top
     * level collection.
     *
     * @return the parent document or null
     */
    public DocumentReference getParent() {
        DocumentPath parent = path.getParent();
        return (parent == null ? null : new DocumentReference(parent));
    }

    /**
     * Returns a reference to a document in this collection.
     *
     * @param documentPath a relative document path
     * @return the document reference
     * @throws IllegalArgumentException if the resulting path is not a
     * document
     */
    public DocumentReference doc(String documentPath) {
        DocumentPath child = path.append(documentPath);
        if (!child.isDocument()) {
            throw new IllegalArgumentException(
                "document_path must refer to a document.");
        }
        return new DocumentReference(child);
    }

    /**
     * Returns a query that selects every document in this collection.
     *
     * @return the query
     */
    public Query query() {
        return Query.from(this);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CollectionReference &&
            path.equals(((CollectionReference) other).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return "CollectionReference: [" + path.getName() + "]";
    }
}

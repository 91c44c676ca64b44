/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.util.CheckNull.requireNonNull;

/**
 * A reference to a document location in a database. The document may or
 * may not exist. A reference does not go remote; use it with
 * {@link ReadSnapshot#get(DocumentReference)},
 * {@link oracle.docstore.driver.DocStoreHandle#get(GetTarget)} or a
 * {@link WriteBatch}.
 */
public final class DocumentReference {

    private final DocumentPath path;

    /**
     * @hidden
     * @param path a document path
     */
    public DocumentReference(DocumentPath path) {
        requireNonNull(path, "DocumentReference: path must be non-null");
        if (!path.isDocument()) {
            throw new IllegalArgumentException(
                "document_path must refer to a document.");
        }
        this.path = path;
    }

    /**
     * Returns the id of the document, the last segment of its path.
     *
     * @return the id
     */
    public String getDocumentId() {
        return path.getId();
    }

    /**
     * Returns the path of the document relative to the documents root.
     *
     * @return the relative path
     */
    public String getDocumentPath() {
        return path.getRelativePath();
    }

    /**
     * Returns the full resource name of the document.
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
     * Returns the collection that contains this document.
     *
     * @return the parent collection
     */
    public CollectionReference getParent() {
        return new CollectionReference(path.getParent());
    }

    /**
     * Returns a reference to a subcollection of this document.
     *
     * @param collectionPath a relative collection path
     * @return the collection reference
     * @throws IllegalArgumentException if the resulting path is not a
     * collection
     */
    public CollectionReference col(String collectionPath) {
        DocumentPath child = path.append(collectionPath);
        if (child.isDocument()) {
            throw new IllegalArgumentException(
                "collection_path must refer to a collection.");
        }
        return new CollectionReference(child);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof DocumentReference &&
            path.equals(((DocumentReference) other).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentReference: [" + path.getName() + "]";
    }
}

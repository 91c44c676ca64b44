/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.util.CheckNull.requireNonEmpty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A path to a document or collection within a database. Paths are
 * {@code /}-delimited and relative to the documents root of the database,
 * for example {@code users/mike/messages}.
 * <p>
 * The number of segments determines what a path refers to: an odd number of
 * segments is a collection, an even number is a document. Methods that
 * require one or the other fail with {@link IllegalArgumentException}.
 * <p>
 * Instances are immutable.
 */
public final class DocumentPath {

    private static final String DOCUMENTS = "/documents";

    /* projects/{project}/databases/{database} */
    private final String databasePath;

    private final List<String> segments;

    private DocumentPath(String databasePath, List<String> segments) {
        this.databasePath = databasePath;
        this.segments = Collections.unmodifiableList(segments);
    }

    /**
     * Returns the resource name of a database.
     *
     * @param projectId the project id
     * @param databaseId the database id
     * @return the database path
     */
    public static String databasePath(String projectId, String databaseId) {
        return "projects/" + projectId + "/databases/" + databaseId;
    }

    /**
     * Parses a relative path within the given database.
     *
     * @param databasePath the database resource name
     * @param relativePath the relative path
     * @return the path
     * @throws IllegalArgumentException if the path is null, empty or
     * contains an empty segment
     */
    public static DocumentPath parse(String databasePath,
                                     String relativePath) {
        requireNonEmpty(databasePath, "databasePath must be non-empty");
        return new DocumentPath(databasePath,
                                Arrays.asList(splitSegments(relativePath)));
    }

    /**
     * Returns true if a relative path has an even number of segments and
     * so refers to a document.
     *
     * @param relativePath the relative path
     * @return true for a document path
     * @throws IllegalArgumentException if the path is null, empty or
     * contains an empty segment
     */
    public static boolean isDocumentPath(String relativePath) {
        return splitSegments(relativePath).length % 2 == 0;
    }

    private static String[] splitSegments(String relativePath) {
        if (relativePath == null || relativePath.isEmpty()) {
            throw new IllegalArgumentException(
                "path must be non-null and non-empty");
        }
        String[] parts = relativePath.split("/", -1);
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException(
                    "path must not contain empty segments: " + relativePath);
            }
        }
        return parts;
    }

    /**
     * Parses a relative path that must refer to a collection.
     *
     * @param databasePath the database resource name
     * @param collectionPath the relative path
     * @return the path
     * @throws IllegalArgumentException if the path refers to a document
     */
    public static DocumentPath parseCollection(String databasePath,
                                               String collectionPath) {
        DocumentPath path = parse(databasePath, collectionPath);
        if (path.isDocument()) {
            throw new IllegalArgumentException(
                "collection_path must refer to a collection.");
        }
        return path;
    }

    /**
     * Parses a relative path that must refer to a document.
     *
     * @param databasePath the database resource name
     * @param documentPath the relative path
     * @return the path
     * @throws IllegalArgumentException if the path refers to a collection
     */
    public static DocumentPath parseDocument(String databasePath,
                                             String documentPath) {
        DocumentPath path = parse(databasePath, documentPath);
        if (!path.isDocument()) {
            throw new IllegalArgumentException(
                "document_path must refer to a document.");
        }
        return path;
    }

    /**
     * Parses a full resource name such as
     * {@code projects/p/databases/d/documents/users/mike}, as returned by
     * the service.
     *
     * @param name the resource name
     * @return the path
     * @throws IllegalArgumentException if the name is not a resource name
     * below a documents root
     */
    public static DocumentPath fromName(String name) {
        int idx = (name == null ? -1 : name.indexOf(DOCUMENTS + "/"));
        if (idx <= 0) {
            throw new IllegalArgumentException(
                "Not a document resource name: " + name);
        }
        return parse(name.substring(0, idx),
                     name.substring(idx + DOCUMENTS.length() + 1));
    }

    /**
     * Returns true if an even number of segments: the path is a document.
     *
     * @return true for a document path
     */
    public boolean isDocument() {
        return segments.size() % 2 == 0;
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public List<String> getSegments() {
        return segments;
    }

    /**
     * Returns the last segment, the id of the document or collection.
     *
     * @return the id
     */
    public String getId() {
        return segments.get(segments.size() - 1);
    }

    /**
     * Returns the path relative to the documents root.
     *
     * @return the relative path
     */
    public String getRelativePath() {
        return String.join("/", segments);
    }

    /**
     * Returns the full resource name.
     *
     * @return the resource name
     */
    public String getName() {
        return documentsRoot(databasePath) + "/" + getRelativePath();
    }

    /**
     * Returns the resource name of the parent of this path: the enclosing
     * document for a collection, or the documents root for a top level
     * collection. For a document it is the name of its collection.
     *
     * @return the parent resource name
     */
    public String getParentName() {
        if (segments.size() == 1) {
            return documentsRoot(databasePath);
        }
        return documentsRoot(databasePath) + "/" +
            String.join("/", segments.subList(0, segments.size() - 1));
    }

    /**
     * Returns the parent path, or null for a top level collection.
     *
     * @return the parent or null
     */
    public DocumentPath getParent() {
        if (segments.size() == 1) {
            return null;
        }
        return new DocumentPath(databasePath,
                                segments.subList(0, segments.size() - 1));
    }

    /**
     * Appends one or more segments.
     *
     * @param relativePath the path to append
     * @return the new path
     */
    public DocumentPath append(String relativePath) {
        DocumentPath child = parse(databasePath, relativePath);
        List<String> all = new ArrayList<>(segments);
        all.addAll(child.segments);
        return new DocumentPath(databasePath, all);
    }

    /**
     * Returns the documents root of a database, the parent of all top level
     * collections.
     *
     * @param databasePath the database resource name
     * @return the documents root
     */
    public static String documentsRoot(String databasePath) {
        return databasePath + DOCUMENTS;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DocumentPath)) {
            return false;
        }
        DocumentPath o = (DocumentPath) other;
        return databasePath.equals(o.databasePath) &&
            segments.equals(o.segments);
    }

    @Override
    public int hashCode() {
        return 31 * databasePath.hashCode() + segments.hashCode();
    }

    @Override
    public String toString() {
        return getName();
    }
}

/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One batch of query results, as returned by a single runQuery request.
 * <p>
 * Documents and their cursors are kept as two parallel lists in the order
 * the service returned them; the lists always have the same length. The
 * end cursor marks the position after the last document of the batch and
 * is the point from which the query continues. A page may hold zero
 * documents and still report {@link MoreResultsType#NOT_FINISHED}.
 */
public final class ResultPage {

    private final List<DocumentSnapshot> documents;
    private final List<Cursor> cursors;
    private final Cursor endCursor;
    private final MoreResultsType moreResults;
    private final int skippedResults;
    private final Instant readTime;

    /**
     * Creates a page.
     *
     * @param documents the documents, in result order
     * @param cursors the cursor of each document, same length as documents
     * @param endCursor the end cursor, null if the service sent none
     * @param moreResults the query state after this page
     * @param skippedResults the number of results skipped due to an offset
     * @param readTime the time the results were read, may be null
     * @throws IllegalArgumentException if the lists differ in length or the
     * status is null
     */
    public ResultPage(List<DocumentSnapshot> documents,
                      List<Cursor> cursors,
                      Cursor endCursor,
                      MoreResultsType moreResults,
                      int skippedResults,
                      Instant readTime) {
        if (documents == null || cursors == null) {
            throw new IllegalArgumentException(
                "ResultPage: documents and cursors must be non-null");
        }
        if (documents.size() != cursors.size()) {
            throw new IllegalArgumentException(
                "ResultPage: " + documents.size() + " documents but " +
                cursors.size() + " cursors");
        }
        if (moreResults == null) {
            throw new IllegalArgumentException(
                "ResultPage: moreResults must be non-null");
        }
        this.documents = Collections.unmodifiableList(
            new ArrayList<>(documents));
        this.cursors = Collections.unmodifiableList(new ArrayList<>(cursors));
        this.endCursor = endCursor;
        this.moreResults = moreResults;
        this.skippedResults = skippedResults;
        this.readTime = readTime;
    }

    public List<DocumentSnapshot> getDocuments() {
        return documents;
    }

    public List<Cursor> getCursors() {
        return cursors;
    }

    /**
     * @return the end cursor, or null if the service did not send one
     */
    public Cursor getEndCursor() {
        return endCursor;
    }

    public MoreResultsType getMoreResults() {
        return moreResults;
    }

    public int getSkippedResults() {
        return skippedResults;
    }

    public Instant getReadTime() {
        return readTime;
    }

    public int size() {
        return documents.size();
    }

    @Override
    public String toString() {
        return "ResultPage: [size=" + documents.size() +
            ", moreResults=" + moreResults +
            ", endCursor=" + endCursor + "]";
    }
}

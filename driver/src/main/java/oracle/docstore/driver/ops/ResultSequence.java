/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.util.LogUtil.isFineEnabled;
import static oracle.docstore.driver.util.LogUtil.logFine;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiConsumer;
import java.util.logging.Logger;

import oracle.docstore.driver.DocumentService;
import oracle.docstore.driver.NotConnectedException;
import oracle.docstore.driver.TransportException;

/**
 * ResultSequence represents one page of query results together with the
 * means to continue the query from where the page ended.
 * <p>
 * Iterating a ResultSequence visits the documents of the current page only.
 * To move on, call {@link #fetchNext}, which returns a new ResultSequence
 * for the following page and leaves this one untouched, so earlier pages
 * remain valid for callers that hold them. {@link #exhaustAll} wraps that
 * loop in a lazy iterator over every remaining document.
 * <p>
 * Continuation is cursor based: the next request is the original query with
 * its start cursor set to the end cursor of this page. Unlike an offset, a
 * cursor position stays stable when documents are written between requests,
 * so pages neither skip nor repeat documents.
 * <p>
 * Example:
 * <pre>
 * ResultSequence results = handle.runQuery(query);
 * while (results != null) {
 *     for (DocumentSnapshot doc : results) {
 *         // do something with doc
 *     }
 *     results = results.fetchNext();
 * }
 * </pre>
 * Instances are immutable, but the iterators returned by
 * {@link #exhaustAll} can only be used by one thread at a time.
 */
public class ResultSequence implements Iterable<DocumentSnapshot> {

    private final ResultPage page;
    private final Query query;
    private final DocumentService service;
    private final String parentName;
    private final byte[] transactionId;

    /* set when the sequence was produced inside a read-only transaction */
    private final ReadSnapshot snapshot;

    private final Logger logger;

    /**
     * Internal use only
     *
     * @param page the current page
     * @param query the query that produced the page, without regard to its
     * start cursor
     * @param service the service used to fetch following pages
     * @param parentName the resource name under which the query runs
     * @param transactionId the transaction the query reads in, or null
     * @param logger the logger, may be null
     * @hidden
     */
    public ResultSequence(ResultPage page,
                          Query query,
                          DocumentService service,
                          String parentName,
                          byte[] transactionId,
                          Logger logger) {
        this(page, query, service, parentName, transactionId, null, logger);
    }

    ResultSequence(ResultPage page,
                   Query query,
                   DocumentService service,
                   String parentName,
                   byte[] transactionId,
                   ReadSnapshot snapshot,
                   Logger logger) {
        if (page == null) {
            throw new IllegalArgumentException(
                "ResultSequence: page must be non-null");
        }
        this.page = page;
        this.query = query;
        this.service = service;
        this.parentName = parentName;
        this.transactionId = transactionId;
        this.snapshot = snapshot;
        this.logger = logger;
    }

    /**
     * Runs the first page of a query.
     *
     * @param service the service
     * @param query the query
     * @param transactionId the transaction to read in, or null
     * @param logger the logger, may be null
     * @return the first page
     * @throws TransportException if the request fails
     * @hidden
     */
    public static ResultSequence run(DocumentService service,
                                     Query query,
                                     byte[] transactionId,
                                     Logger logger) {
        return run(service, query, transactionId, null, logger);
    }

    static ResultSequence run(DocumentService service,
                              Query query,
                              byte[] transactionId,
                              ReadSnapshot snapshot,
                              Logger logger) {
        if (service == null) {
            throw new NotConnectedException(
                "Must have active connection to service");
        }
        String parent = query.getParentName();
        logFine(logger, "Running query on " + parent);
        ResultPage first = service.runQuery(parent, query, transactionId);
        return new ResultSequence(first, query, service, parent,
                                  transactionId, snapshot, logger);
    }

    /**
     * Returns true unless the service reported that the query has no more
     * results. A true value does not guarantee that {@link #fetchNext} will
     * return more documents.
     *
     * @return true if the query may have more results
     */
    public boolean hasMore() {
        return page.getMoreResults() != MoreResultsType.NO_MORE_RESULTS;
    }

    /**
     * Fetches the page that follows this one.
     * <p>
     * Returns null without contacting the service if {@link #hasMore} is
     * false, or if this page has no end cursor to continue from. The
     * latter can happen when the service reports
     * {@link MoreResultsType#NOT_FINISHED} but sends no cursor; there is no
     * position to resume from so the sequence ends there.
     * <p>
     * This sequence is not modified.
     *
     * @return the next sequence, or null
     * @throws TransportException if the request fails; it is not retried
     * @throws NotConnectedException if the sequence has no service
     * @throws oracle.docstore.driver.ClosedTransactionException if the
     * sequence belongs to a read-only transaction that has been rolled back
     */
    public ResultSequence fetchNext() {
        if (!hasMore()) {
            return null;
        }
        Cursor endCursor = page.getEndCursor();
        if (endCursor == null) {
            logFine(logger, "Page reports " + page.getMoreResults() +
                    " without an end cursor, not continuing");
            return null;
        }
        if (service == null || query == null) {
            throw new NotConnectedException(
                "Must have active connection to service to get next");
        }
        if (snapshot != null) {
            snapshot.checkNotClosed();
        }
        Query next = query.withStartCursor(endCursor);
        if (isFineEnabled(logger)) {
            logFine(logger, "Fetching next page of " + parentName +
                    " from " + endCursor);
        }
        ResultPage nextPage =
            service.runQuery(parentName, next, transactionId);
        return new ResultSequence(nextPage, next, service, parentName,
                                  transactionId, snapshot, logger);
    }

    /**
     * Returns a lazy iterator over the documents of this page followed by
     * the documents of every following page, in the order the service
     * returned them. A following page is fetched only when the caller pulls
     * past the end of the previous one, so abandoning the iterator stops
     * all further requests. Pages with no documents do not end the
     * iteration as long as the query is not finished.
     * <p>
     * The iterator is forward only. Calling this method again starts a new
     * iteration from this page.
     *
     * @return the iterator
     */
    public Iterator<DocumentSnapshot> exhaustAll() {
        return new AllResultsIterator(this);
    }

    /**
     * Returns the cursor paired with a document of the current page.
     *
     * @param document the document
     * @return the cursor, or null if the document is not in this page
     */
    public Cursor cursorFor(DocumentSnapshot document) {
        int index = page.getDocuments().indexOf(document);
        if (index < 0) {
            return null;
        }
        return page.getCursors().get(index);
    }

    /**
     * Calls the action with each document of the current page and its
     * cursor.
     *
     * @param action the action
     */
    public void forEachWithCursor(
        BiConsumer<DocumentSnapshot, Cursor> action) {
        List<DocumentSnapshot> docs = page.getDocuments();
        List<Cursor> cursors = page.getCursors();
        for (int i = 0; i < docs.size(); i++) {
            action.accept(docs.get(i), cursors.get(i));
        }
    }

    /**
     * Returns an iterator over the documents of the current page.
     */
    @Override
    public Iterator<DocumentSnapshot> iterator() {
        return page.getDocuments().iterator();
    }

    public List<DocumentSnapshot> getDocuments() {
        return page.getDocuments();
    }

    public List<Cursor> getCursors() {
        return page.getCursors();
    }

    public Cursor getEndCursor() {
        return page.getEndCursor();
    }

    public MoreResultsType getMoreResults() {
        return page.getMoreResults();
    }

    public boolean isNotFinished() {
        return page.getMoreResults() == MoreResultsType.NOT_FINISHED;
    }

    public boolean isMoreAfterLimit() {
        return page.getMoreResults() ==
            MoreResultsType.MORE_RESULTS_AFTER_LIMIT;
    }

    public boolean isMoreAfterCursor() {
        return page.getMoreResults() ==
            MoreResultsType.MORE_RESULTS_AFTER_CURSOR;
    }

    public boolean isNoMore() {
        return page.getMoreResults() == MoreResultsType.NO_MORE_RESULTS;
    }

    public int size() {
        return page.size();
    }

    public ResultPage getPage() {
        return page;
    }

    /**
     * Returns the query that produced this page, including the start cursor
     * it was resumed from.
     *
     * @return the query
     */
    public Query getQuery() {
        return query;
    }

    public String getParentName() {
        return parentName;
    }

    /**
     * Walks the pages of a sequence. Holds only the current sequence, so
     * pages already consumed can be collected.
     */
    private static class AllResultsIterator
        implements Iterator<DocumentSnapshot> {

        private ResultSequence current;
        private int index;

        AllResultsIterator(ResultSequence first) {
            this.current = first;
        }

        @Override
        public boolean hasNext() {
            while (current != null && index >= current.size()) {
                current = current.fetchNext();
                index = 0;
            }
            return current != null;
        }

        @Override
        public DocumentSnapshot next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more query results");
            }
            return current.getDocuments().get(index++);
        }
    }
}

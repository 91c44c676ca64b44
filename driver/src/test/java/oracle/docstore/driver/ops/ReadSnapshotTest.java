/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.MockDocumentService.PROJECT;
import static oracle.docstore.driver.MockDocumentService.bytes;
import static oracle.docstore.driver.MockDocumentService.cursor;
import static oracle.docstore.driver.MockDocumentService.page;
import static oracle.docstore.driver.MockDocumentService.sameId;
import static oracle.docstore.driver.MockDocumentService.usersQuery;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import oracle.docstore.driver.ClosedTransactionException;
import oracle.docstore.driver.DocStoreConfig;
import oracle.docstore.driver.DocStoreHandle;
import oracle.docstore.driver.DocStoreHandleFactory;
import oracle.docstore.driver.MockDocumentService;
import oracle.docstore.driver.NotConnectedException;
import oracle.docstore.driver.TransportException;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

/**
 * Lifecycle of read-only transactions
 */
public class ReadSnapshotTest {

    private MockDocumentService service;
    private DocStoreHandle handle;

    @Before
    public void setUp() {
        service = new MockDocumentService();
        service.putDocument("users/a", Collections.singletonMap("n", 1L));
        service.putDocument("users/b", Collections.singletonMap("n", 2L));
        DocStoreConfig config = new DocStoreConfig("localhost:8080")
            .setProjectId(PROJECT);
        handle = DocStoreHandleFactory.createHandle(config, service);
    }

    @After
    public void tearDown() {
        handle.close();
    }

    @Test
    public void testBeginsOnce() {
        service.addPage(page(MoreResultsType.NOT_FINISHED, cursor("e1"), "a"))
               .addPage(page(MoreResultsType.NO_MORE_RESULTS, null, "b"));

        ReadSnapshot snapshot = handle.readOnlyTransaction();
        assertTrue(snapshot.getDocument("users/a").exists());
        Iterator<DocumentSnapshot> all = snapshot.getAll("users/a", "users/b");
        assertTrue(all.hasNext());
        all.next();
        all.next();
        ResultSequence seq = snapshot.runQuery(usersQuery());
        seq.fetchNext();
        assertFalse(snapshot.get(snapshot.doc("users/zzz")).exists());

        assertEquals(1, service.beginCount());
        assertEquals(ReadSnapshot.State.ACTIVE, snapshot.getState());
        byte[] txn = snapshot.getTransactionId();
        assertTrue(sameId(bytes("txn-1"), txn));
        for (byte[] used : service.batchGetTxns) {
            assertTrue(sameId(txn, used));
        }
        assertEquals(2, service.queryTxns.size());
        for (byte[] used : service.queryTxns) {
            assertTrue(sameId(txn, used));
        }
    }

    @Test
    public void testBeginIsLazy() {
        service.addPage(page(MoreResultsType.NO_MORE_RESULTS, null, "a", "b"));

        ReadSnapshot snapshot = handle.readOnlyTransaction();
        assertEquals(ReadSnapshot.State.UNINITIALIZED, snapshot.getState());
        assertNull(snapshot.getTransactionId());

        Iterator<DocumentSnapshot> users = snapshot.get("users");
        Iterator<DocumentSnapshot> docs = snapshot.getAll("users/a");
        assertEquals(0, service.beginCount());
        assertEquals(0, service.queryCount());

        int count = 0;
        while (users.hasNext()) {
            users.next();
            count++;
        }
        assertEquals(2, count);
        assertTrue(docs.hasNext());
        assertEquals(1, service.beginCount());
        assertEquals(ReadSnapshot.State.ACTIVE, snapshot.getState());
    }

    @Test
    public void testReadsAfterRollback() {
        ReadSnapshot snapshot = handle.readOnlyTransaction();
        snapshot.getDocument("users/a");
        snapshot.rollback();
        assertEquals(ReadSnapshot.State.CLOSED, snapshot.getState());
        assertTrue(snapshot.isClosed());

        expectClosed(() -> snapshot.getDocument("users/a"));
        expectClosed(() -> snapshot.getAll("users/a", "users/b"));
        expectClosed(() -> snapshot.get("users"));
        expectClosed(() -> snapshot.runQuery(usersQuery()));
        expectClosed(() -> snapshot.cols());
        expectClosed(() -> snapshot.rollback());

        /* close on a closed snapshot is a no-op */
        snapshot.close();
        assertEquals(1, service.beginCount());
        assertEquals(1, service.rollbacks.size());
    }

    @Test
    public void testIteratorsAfterRollback() {
        service.addPage(page(MoreResultsType.NOT_FINISHED, cursor("e1"), "a"));

        ReadSnapshot snapshot = handle.readOnlyTransaction();
        Iterator<DocumentSnapshot> users = snapshot.get("users");
        Iterator<DocumentSnapshot> docs = snapshot.getAll("users/a");
        assertEquals("a", users.next().getDocumentId());
        snapshot.rollback();

        expectClosed(() -> users.hasNext());
        expectClosed(() -> docs.hasNext());
        assertEquals(1, service.queryCount());
    }

    @Test
    public void testRollbackWithoutReads() {
        ReadSnapshot snapshot = handle.readOnlyTransaction();
        snapshot.rollback();
        assertEquals(ReadSnapshot.State.CLOSED, snapshot.getState());
        assertEquals(0, service.beginCount());
        assertEquals(0, service.rollbacks.size());
    }

    @Test
    public void testRollbackReleasesTransaction() {
        try (ReadSnapshot snapshot = handle.readOnlyTransaction()) {
            snapshot.getDocument("users/b");
        }
        assertEquals(1, service.rollbacks.size());
        assertTrue(sameId(bytes("txn-1"), service.rollbacks.get(0)));
    }

    @Test
    public void testReadTime() {
        Instant readTime = Instant.parse("2024-01-02T03:04:05Z");
        ReadSnapshot snapshot = handle.readOnlyTransaction(readTime);
        assertEquals(readTime, snapshot.getReadTime());
        snapshot.getDocument("users/a");
        assertEquals(readTime, service.beginOptions.get(0).getReadTime());
        assertTrue(service.beginOptions.get(0).isReadOnly());

        handle.readOnlyTransaction().getDocument("users/a");
        assertNull(service.beginOptions.get(1).getReadTime());
    }

    @Test
    public void testEmptyTransactionId() {
        service.nextTransactionId = new byte[0];
        ReadSnapshot snapshot = handle.readOnlyTransaction();
        try {
            snapshot.getDocument("users/a");
            fail("an empty transaction id should have failed");
        } catch (TransportException te) {
            // expected
        }
        assertEquals(ReadSnapshot.State.UNINITIALIZED, snapshot.getState());
    }

    @Test
    public void testMissingDocument() {
        ReadSnapshot snapshot = handle.readOnlyTransaction();
        DocumentSnapshot missing = snapshot.getDocument("users/nobody");
        assertFalse(missing.exists());
        assertNull(missing.getData());
        assertEquals("nobody", missing.getDocumentId());
    }

    @Test
    public void testDocumentPath() {
        ReadSnapshot snapshot = handle.readOnlyTransaction();
        Iterator<DocumentSnapshot> iter = snapshot.get("users/a");
        assertEquals(0, service.beginCount());

        DocumentSnapshot doc = iter.next();
        assertFalse(iter.hasNext());
        assertTrue(doc.exists());
        assertEquals("a", doc.getDocumentId());
        assertEquals(1L, doc.get("n"));

        /* read with a batch get, not a query, under the transaction */
        assertEquals(0, service.queryCount());
        assertEquals(1, service.batchGets.size());
        assertEquals(1, service.batchGets.get(0).size());
        assertEquals(1, service.beginCount());
        assertTrue(sameId(snapshot.getTransactionId(),
                          service.batchGetTxns.get(0)));
    }

    @Test
    public void testNullTarget() {
        ReadSnapshot snapshot = handle.readOnlyTransaction();
        try {
            snapshot.get((GetTarget) null);
            fail("a null target should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        assertEquals(ReadSnapshot.State.UNINITIALIZED, snapshot.getState());
    }

    @Test
    public void testCols() {
        service.collectionIds.add("users");
        service.collectionIds.add("cities");
        ReadSnapshot snapshot = handle.readOnlyTransaction();
        List<CollectionReference> cols = snapshot.cols();
        assertEquals(2, cols.size());
        assertEquals("cities", cols.get(1).getCollectionId());
        assertEquals(0, service.beginCount());
    }

    @Test
    public void testPathParity() {
        ReadSnapshot snapshot = handle.readOnlyTransaction();
        assertEquals("users", snapshot.col("users").getCollectionId());
        assertEquals("messages",
                     snapshot.col("users/mike/messages").getCollectionId());
        assertEquals("mike", snapshot.doc("users/mike").getDocumentId());
        try {
            snapshot.col("users/mike");
            fail("a document path is not a collection");
        } catch (IllegalArgumentException iae) {
            assertEquals("collection_path must refer to a collection.",
                         iae.getMessage());
        }
        try {
            snapshot.doc("users");
            fail("a collection path is not a document");
        } catch (IllegalArgumentException iae) {
            assertEquals("document_path must refer to a document.",
                         iae.getMessage());
        }
    }

    @Test
    public void testNotConnected() {
        ReadSnapshot detached = new ReadSnapshot(null, null);
        try {
            detached.runQuery(usersQuery());
            fail("a snapshot without a handle cannot read");
        } catch (NotConnectedException nce) {
            // expected
        }

        ReadSnapshot snapshot = handle.readOnlyTransaction();
        handle.close();
        try {
            snapshot.getDocument("users/a");
            fail("a snapshot of a closed handle cannot read");
        } catch (NotConnectedException nce) {
            // expected
        }
    }

    @Test
    public void testQueryThroughSnapshot() {
        service.addPage(page(MoreResultsType.NO_MORE_RESULTS, null, "a"));
        ReadSnapshot snapshot = handle.readOnlyTransaction();
        Query query = snapshot.query("users").where("n",
                                                    Query.Operator.EQUAL, 1L);
        Iterator<DocumentSnapshot> iter = snapshot.get(query);
        assertEquals("a", iter.next().getDocumentId());
        assertSame(query, service.queries.get(0));
    }

    private interface Action {
        void run();
    }

    private static void expectClosed(Action action) {
        try {
            action.run();
            fail("operation on a closed snapshot should have failed");
        } catch (ClosedTransactionException cte) {
            assertEquals("transaction is closed", cte.getMessage());
        }
    }
}

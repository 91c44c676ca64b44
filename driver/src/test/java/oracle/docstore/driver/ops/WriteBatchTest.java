/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.MockDocumentService.COMMIT_TIME;
import static oracle.docstore.driver.MockDocumentService.PROJECT;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import oracle.docstore.driver.DocStoreConfig;
import oracle.docstore.driver.DocStoreHandle;
import oracle.docstore.driver.DocStoreHandleFactory;
import oracle.docstore.driver.MockDocumentService;
import oracle.docstore.driver.NotConnectedException;
import oracle.docstore.driver.ServiceUnavailableException;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class WriteBatchTest {

    private MockDocumentService service;
    private DocStoreHandle handle;

    @Before
    public void setUp() {
        service = new MockDocumentService();
        handle = DocStoreHandleFactory.createHandle(
            new DocStoreConfig("localhost:8080").setProjectId(PROJECT),
            service);
    }

    @After
    public void tearDown() {
        handle.close();
    }

    @Test
    public void testPathParity() {
        WriteBatch batch = handle.batch();
        assertEquals("users", batch.col("users").getCollectionId());
        assertEquals("mike", batch.doc("users/mike").getDocumentId());
        assertEquals("messages",
                     batch.col("users/mike/messages").getCollectionId());
        try {
            batch.col("users/mike");
            fail("a document path is not a collection");
        } catch (IllegalArgumentException iae) {
            assertEquals("collection_path must refer to a collection.",
                         iae.getMessage());
        }
        try {
            batch.doc("users");
            fail("a collection path is not a document");
        } catch (IllegalArgumentException iae) {
            assertEquals("document_path must refer to a document.",
                         iae.getMessage());
        }
    }

    @Test
    public void testCommit() {
        Map<String, Object> data = new HashMap<>();
        data.put("name", "Mike");

        WriteBatch batch = handle.batch();
        DocumentReference mike = batch.doc("users/mike");
        batch.create(mike, data)
             .set(batch.doc("users/tracy"), data, true)
             .update(mike, Collections.singletonMap("age", 30L))
             .delete(batch.doc("users/old"));
        assertFalse(batch.isCommitted());

        assertEquals(COMMIT_TIME, batch.commit());
        assertTrue(batch.isCommitted());
        assertEquals(1, service.commits.size());

        List<Write> writes = service.commits.get(0);
        assertEquals(4, writes.size());
        assertEquals(Write.Type.CREATE, writes.get(0).getType());
        assertEquals(mike, writes.get(0).getReference());
        assertEquals(Write.Type.SET, writes.get(1).getType());
        assertTrue(writes.get(1).isMerge());
        assertEquals(Write.Type.UPDATE, writes.get(2).getType());
        assertEquals(Write.Type.DELETE, writes.get(3).getType());
        assertNull(writes.get(3).getData());
    }

    @Test
    public void testEmptyCommit() {
        WriteBatch batch = handle.batch();
        assertNull(batch.commit());
        assertTrue(service.commits.isEmpty());
    }

    @Test
    public void testCommitOnce() {
        WriteBatch batch = handle.batch();
        DocumentReference ref = batch.doc("users/a");
        batch.delete(ref);
        batch.commit();
        try {
            batch.commit();
            fail("second commit should have failed");
        } catch (IllegalStateException ise) {
            // expected
        }
        try {
            batch.delete(ref);
            fail("write after commit should have failed");
        } catch (IllegalStateException ise) {
            // expected
        }
        assertEquals(1, service.commits.size());
    }

    @Test
    public void testFailedCommit() {
        WriteBatch batch = handle.batch();
        batch.delete(batch.doc("users/a"));
        service.commitFailure =
            new ServiceUnavailableException("unavailable", 503, "UNAVAILABLE");
        try {
            batch.commit();
            fail("commit should have failed");
        } catch (ServiceUnavailableException sue) {
            // expected
        }
        assertFalse(batch.isCommitted());
        assertEquals(1, batch.getWrites().size());

        /* the same batch can be sent again */
        assertEquals(COMMIT_TIME, batch.commit());
        assertTrue(batch.isCommitted());
        assertEquals(1, service.commits.size());
    }

    @Test
    public void testInvalidWrites() {
        WriteBatch batch = handle.batch();
        DocumentReference ref = batch.doc("users/a");
        try {
            batch.update(ref, Collections.emptyMap());
            fail("empty update should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            batch.set(ref, null);
            fail("null data should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            batch.delete(null);
            fail("null reference should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        assertTrue(batch.getWrites().isEmpty());
    }

    @Test
    public void testClosedHandle() {
        WriteBatch batch = handle.batch();
        batch.delete(batch.doc("users/a"));
        handle.close();
        try {
            batch.commit();
            fail("commit on a closed handle should have failed");
        } catch (NotConnectedException nce) {
            // expected
        }
        assertFalse(batch.isCommitted());
        try {
            handle.batch();
            fail("batch on a closed handle should have failed");
        } catch (NotConnectedException nce) {
            // expected
        }
    }
}

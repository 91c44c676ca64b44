/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;

import org.junit.Test;

/**
 * Query building, read targets and result status names
 */
public class QueryTest {

    private static final String DB =
        DocumentPath.databasePath("p", "(default)");

    private static CollectionReference col(String path) {
        return new CollectionReference(DocumentPath.parse(DB, path));
    }

    @Test
    public void testBuild() {
        Query base = col("users/mike/messages").query();
        assertEquals(DB + "/documents/users/mike", base.getParentName());
        assertEquals("messages", base.getCollectionId());
        assertTrue(base.getFilters().isEmpty());
        assertNull(base.getLimit());

        Query q = base.select("title")
            .where("read", Query.Operator.EQUAL, false)
            .where("size", Query.Operator.GREATER_THAN, 10L)
            .orderBy("size", Query.Direction.DESCENDING)
            .limit(5)
            .offset(2);
        assertEquals(1, q.getSelect().size());
        assertEquals(2, q.getFilters().size());
        assertEquals(Query.Operator.GREATER_THAN,
                     q.getFilters().get(1).getOperator());
        assertEquals(Query.Direction.DESCENDING,
                     q.getOrders().get(0).getDirection());
        assertEquals(Integer.valueOf(5), q.getLimit());
        assertEquals(Integer.valueOf(2), q.getOffset());

        /* the base query is not modified */
        assertTrue(base.getFilters().isEmpty());
        assertTrue(base.getSelect().isEmpty());
    }

    @Test
    public void testCursors() {
        Query q = col("users").query().orderBy("name");
        Cursor c = Cursor.fromBytes("c1".getBytes(StandardCharsets.UTF_8));
        Query resumed = q.withStartCursor(c);
        assertSame(c, resumed.getStartCursor());
        assertNull(q.getStartCursor());
        assertEquals(q.getOrders(), resumed.getOrders());
        assertFalse(q.equals(resumed));
        assertEquals(q, resumed.withStartCursor(null));
        assertSame(c, q.withEndCursor(c).getEndCursor());
    }

    @Test
    public void testInvalid() {
        Query q = col("users").query();
        try {
            q.limit(-1);
            fail("negative limit should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            q.offset(-1);
            fail("negative offset should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            q.where("", Query.Operator.EQUAL, 1L);
            fail("empty field should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }

    @Test
    public void testGetTarget() {
        GetTarget doc = GetTarget.of("users/mike");
        assertEquals(GetTarget.Kind.DOCUMENT_PATH, doc.getKind());
        assertTrue(doc.isSingleDocument());
        assertEquals("mike", doc.toDocument(DB).getDocumentId());

        GetTarget coll = GetTarget.of("users/mike/messages");
        assertEquals(GetTarget.Kind.COLLECTION_PATH, coll.getKind());
        assertFalse(coll.isSingleDocument());
        assertEquals("messages", coll.toQuery(DB).getCollectionId());

        Query q = col("users").query().limit(1);
        assertSame(q, GetTarget.of(q).toQuery(DB));
        assertEquals(GetTarget.Kind.COLLECTION,
                     GetTarget.of(col("users")).getKind());

        try {
            doc.toQuery(DB);
            fail("a document target is not a query");
        } catch (IllegalStateException ise) {
            // expected
        }
        try {
            GetTarget.of("users//x");
            fail("empty segment should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }

    @Test
    public void testMoreResultsNames() {
        assertEquals(MoreResultsType.NO_MORE_RESULTS,
                     MoreResultsType.fromName("NO_MORE_RESULTS"));
        assertEquals(MoreResultsType.MORE_RESULTS_AFTER_LIMIT,
                     MoreResultsType.fromName("MORE_RESULTS_AFTER_LIMIT"));
        assertEquals(MoreResultsType.NOT_FINISHED,
                     MoreResultsType.fromName("MORE_RESULTS_TYPE_UNSPECIFIED"));
        assertEquals(MoreResultsType.NOT_FINISHED,
                     MoreResultsType.fromName(null));
    }
}

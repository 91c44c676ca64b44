/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
import java.util.Iterator;

import oracle.docstore.driver.DocStoreHandle;
import oracle.docstore.driver.ops.Cursor;
import oracle.docstore.driver.ops.DocumentSnapshot;
import oracle.docstore.driver.ops.Query;
import oracle.docstore.driver.ops.ResultSequence;

/**
 * Reads a collection one page at a time.
 * <p>
 * The first part walks the pages explicitly with {@link
 * ResultSequence#fetchNext}, printing the cursor of each document. A
 * cursor can be saved and used later to resume the query after that
 * document. The second part lets {@link ResultSequence#exhaustAll} do the
 * paging.
 */
public class PaginationExample {

    private static final String COLLECTION = "users";

    public static void main(String[] args) throws Exception {
        Common common = new Common("PaginationExample");
        common.parseArgs(args);

        try (DocStoreHandle handle = common.getHandle()) {
            pageByPage(handle);
            allAtOnce(handle);
        }
    }

    private static void pageByPage(DocStoreHandle handle) {
        Query query = handle.col(COLLECTION).query()
            .orderBy("name")
            .limit(10);

        int pageNum = 0;
        Cursor last = null;
        ResultSequence results = handle.runQuery(query);
        while (results != null) {
            System.out.println("Page " + (++pageNum) + ": " +
                               results.size() + " documents, " +
                               results.getMoreResults());
            for (DocumentSnapshot doc : results) {
                last = results.cursorFor(doc);
                System.out.println("  " + doc.getDocumentId() +
                                   " cursor=" + last.toBase64());
            }
            results = results.fetchNext();
        }

        if (last != null) {
            /* resume after the last document seen */
            ResultSequence resumed =
                handle.runQuery(query.withStartCursor(last));
            System.out.println("Resumed query has " + resumed.size() +
                               " documents");
        }
    }

    private static void allAtOnce(DocStoreHandle handle) {
        int count = 0;
        Iterator<DocumentSnapshot> iter =
            handle.runQuery(handle.col(COLLECTION).query()).exhaustAll();
        while (iter.hasNext()) {
            iter.next();
            count++;
        }
        System.out.println("Collection " + COLLECTION + " has " + count +
                           " documents");
    }
}

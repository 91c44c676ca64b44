/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
import java.util.Iterator;

import oracle.docstore.driver.DocStoreHandle;
import oracle.docstore.driver.ops.CollectionReference;
import oracle.docstore.driver.ops.DocumentSnapshot;
import oracle.docstore.driver.ops.ReadSnapshot;

/**
 * Reads several documents and a collection at one consistent point in time
 * using a read-only transaction. The transaction is begun on the first read
 * and released by rollback when the snapshot is closed.
 */
public class ReadOnlyTransactionExample {

    public static void main(String[] args) throws Exception {
        Common common = new Common("ReadOnlyTransactionExample");
        common.parseArgs(args);

        try (DocStoreHandle handle = common.getHandle()) {
            readConsistently(handle);
        }
    }

    private static void readConsistently(DocStoreHandle handle) {
        try (ReadSnapshot snapshot = handle.readOnlyTransaction()) {
            for (CollectionReference col : snapshot.cols()) {
                System.out.println("Collection " + col.getCollectionId());
            }

            Iterator<DocumentSnapshot> docs =
                snapshot.getAll("users/tracy", "users/mike");
            while (docs.hasNext()) {
                DocumentSnapshot doc = docs.next();
                System.out.println(doc.getDocumentId() + ": " +
                                   (doc.exists() ? doc.getData() : "missing"));
            }

            Iterator<DocumentSnapshot> users = snapshot.get("users");
            while (users.hasNext()) {
                System.out.println("User " + users.next().getDocumentId());
            }
        }
    }
}

/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
import java.util.HashMap;
import java.util.Map;

import oracle.docstore.driver.DocStoreHandle;
import oracle.docstore.driver.ops.DocumentReference;
import oracle.docstore.driver.ops.DocumentSnapshot;
import oracle.docstore.driver.ops.WriteBatch;

/**
 * Writes a document with a batch and reads it back.
 */
public class HelloWorld {

    public static void main(String[] args) throws Exception {
        Common common = new Common("HelloWorld");
        common.parseArgs(args);

        try (DocStoreHandle handle = common.getHandle()) {
            helloWorld(handle);
        }
    }

    private static void helloWorld(DocStoreHandle handle) {

        /* Make a document and write it */
        DocumentReference ref = handle.doc("users/tracy");
        Map<String, Object> data = new HashMap<>();
        data.put("name", "Tracy");
        data.put("age", 29L);

        WriteBatch batch = handle.batch();
        batch.set(ref, data);
        System.out.println("Committed at " + batch.commit());

        /* Read it back */
        DocumentSnapshot snapshot = handle.getDocument("users/tracy");
        if (snapshot.exists()) {
            System.out.println("Read " + snapshot.getData());
        } else {
            System.out.println("Document " + ref + " not found");
        }
    }
}

/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver;

/**
 * Thrown when a read is attempted on a read-only transaction that has
 * already been rolled back.
 */
public class ClosedTransactionException extends DocStoreException {

    private static final long serialVersionUID = 1L;

    public ClosedTransactionException(String msg) {
        super(msg);
    }
}

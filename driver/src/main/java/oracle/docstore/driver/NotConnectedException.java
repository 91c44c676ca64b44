/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver;

/**
 * Thrown when an operation requires a live connection to the service and
 * there is none, either because the object was never associated with a
 * {@link DocStoreHandle} or because the handle has been closed.
 */
public class NotConnectedException extends DocStoreException {

    private static final long serialVersionUID = 1L;

    public NotConnectedException(String msg) {
        super(msg);
    }
}

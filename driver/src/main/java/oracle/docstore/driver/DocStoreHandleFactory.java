/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver;

import static oracle.docstore.driver.util.CheckNull.requireNonNull;

import oracle.docstore.driver.http.DocStoreHandleImpl;
import oracle.docstore.driver.http.HttpDocumentService;

/**
 * Factory class used to produce handles to operate on a database.
 */
public class DocStoreHandleFactory {

    /**
     * Creates a handle that talks to the service over HTTP. The application
     * must invoke {@link DocStoreHandle#close} when it is done accessing the
     * database to free up resources associated with the handle.
     *
     * @param config the configuration
     * @return a handle, ready for use
     * @throws IllegalArgumentException if an illegal configuration parameter
     * is specified
     */
    public static DocStoreHandle createHandle(DocStoreConfig config) {
        requireNonNull(config,
                       "DocStoreHandleFactory.createHandle: config " +
                       "cannot be null");
        DocStoreConfig configCopy = config.clone();
        if (configCopy.getProjectId() == null) {
            throw new IllegalArgumentException(
                "DocStoreHandleFactory.createHandle: project id is required");
        }
        return new DocStoreHandleImpl(configCopy,
                                      new HttpDocumentService(configCopy));
    }

    /**
     * Creates a handle over a caller supplied service, for example a
     * service backed by a different transport. The handle owns the service
     * and closes it when the handle is closed.
     *
     * @param config the configuration, for project, database and logger
     * @param service the service
     * @return a handle, ready for use
     */
    public static DocStoreHandle createHandle(DocStoreConfig config,
                                              DocumentService service) {
        requireNonNull(config,
                       "DocStoreHandleFactory.createHandle: config " +
                       "cannot be null");
        requireNonNull(service,
                       "DocStoreHandleFactory.createHandle: service " +
                       "cannot be null");
        DocStoreConfig configCopy = config.clone();
        if (configCopy.getProjectId() == null) {
            throw new IllegalArgumentException(
                "DocStoreHandleFactory.createHandle: project id is required");
        }
        return new DocStoreHandleImpl(configCopy, service);
    }
}

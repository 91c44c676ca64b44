/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver;

/**
 * The service is temporarily unable to handle the request. The request may
 * succeed if retried by the application after a delay.
 */
public class ServiceUnavailableException extends TransportException {

    private static final long serialVersionUID = 1L;

    public ServiceUnavailableException(String msg,
                                       int httpStatus,
                                       String serviceStatus) {
        super(msg, httpStatus, serviceStatus, null);
    }

    @Override
    public boolean okToRetry() {
        return true;
    }
}

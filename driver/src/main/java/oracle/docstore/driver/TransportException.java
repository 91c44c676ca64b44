/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver;

/**
 * Wraps a failure of the transport layer or an error status returned by the
 * service. The driver does not retry these; see {@link #okToRetry}.
 */
public class TransportException extends DocStoreException {

    private static final long serialVersionUID = 1L;

    /*
     * HTTP status code, 0 if the request never got a response
     */
    private final int httpStatus;

    /*
     * service status text such as NOT_FOUND, may be null
     */
    private final String serviceStatus;

    public TransportException(String msg) {
        this(msg, 0, null, null);
    }

    public TransportException(String msg, Throwable cause) {
        this(msg, 0, null, cause);
    }

    public TransportException(String msg,
                              int httpStatus,
                              String serviceStatus,
                              Throwable cause) {
        super(msg, cause);
        this.httpStatus = httpStatus;
        this.serviceStatus = serviceStatus;
    }

    /**
     * Returns the HTTP status of the failed request.
     *
     * @return the status, or 0 if no response was received
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * Returns the status name reported by the service, if any.
     *
     * @return the status name or null
     */
    public String getServiceStatus() {
        return serviceStatus;
    }
}

/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver;

/**
 * Thrown when a request does not complete within the configured request
 * timeout. The outcome of the request on the service side is unknown.
 */
public class RequestTimeoutException extends TransportException {

    private static final long serialVersionUID = 1L;

    private final int timeoutMs;

    public RequestTimeoutException(int timeoutMs, String msg, Throwable cause) {
        super(msg + " (timeout=" + timeoutMs + "ms)", cause);
        this.timeoutMs = timeoutMs;
    }

    /**
     * Returns the timeout that was in effect for the request.
     *
     * @return the timeout, in milliseconds
     */
    public int getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public boolean okToRetry() {
        return true;
    }
}

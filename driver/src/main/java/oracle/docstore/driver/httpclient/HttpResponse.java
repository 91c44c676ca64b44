/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.httpclient;

import io.netty.handler.codec.http.HttpHeaders;

/**
 * A fully received HTTP response. The body has been read and decoded as
 * UTF-8, so the response holds no network resources.
 */
public class HttpResponse {

    private final int statusCode;
    private final HttpHeaders headers;
    private final String body;

    HttpResponse(int statusCode, HttpHeaders headers, String body) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return true for a 2xx status
     */
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public HttpHeaders getHeaders() {
        return headers;
    }

    /**
     * @return the body, empty if the response had none
     */
    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "HttpResponse: [status=" + statusCode +
            ", length=" + body.length() + "]";
    }
}

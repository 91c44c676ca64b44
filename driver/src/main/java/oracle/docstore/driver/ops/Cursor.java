/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.core.Base64Variants;

/**
 * An opaque position within the ordered results of a query. A cursor is
 * returned for each document in a {@link ResultPage} and for the end of the
 * page. Passing a cursor back as the start cursor of a {@link Query}
 * resumes the query immediately after that position.
 * <p>
 * The token bytes are interpreted only by the service. Equality is defined
 * on the token bytes; the optional ordering values are informational and
 * are not sent back to the service.
 * <p>
 * Cursors are immutable.
 */
public final class Cursor {

    private final byte[] token;

    private final List<Object> values;

    private Cursor(byte[] token, List<Object> values) {
        if (token == null || token.length == 0) {
            throw new IllegalArgumentException(
                "Cursor token must be non-null and non-empty");
        }
        this.token = token.clone();
        this.values = (values == null ? Collections.emptyList() :
                       Collections.unmodifiableList(new ArrayList<>(values)));
    }

    /**
     * Creates a cursor from the raw token bytes returned by the service.
     *
     * @param token the token
     * @return the cursor
     * @throws IllegalArgumentException if the token is null or empty
     */
    public static Cursor fromBytes(byte[] token) {
        return new Cursor(token, null);
    }

    /**
     * Creates a cursor from the raw token bytes and the values of the
     * ordering fields at that position.
     *
     * @param token the token
     * @param values the ordering values, may be null
     * @return the cursor
     */
    public static Cursor fromBytes(byte[] token, List<Object> values) {
        return new Cursor(token, values);
    }

    /**
     * Parses a cursor previously produced by {@link #toBase64}.
     *
     * @param encoded the base64 form
     * @return the cursor
     * @throws IllegalArgumentException if the string is not valid base64
     * or decodes to an empty token
     */
    public static Cursor fromBase64(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new IllegalArgumentException(
                "Encoded cursor must be non-null and non-empty");
        }
        return new Cursor(Base64Variants.MIME_NO_LINEFEEDS.decode(encoded),
                          null);
    }

    /**
     * Returns a copy of the token bytes.
     *
     * @return the token
     */
    public byte[] toBytes() {
        return token.clone();
    }

    /**
     * Returns the token in base64 form, suitable for storing or handing to
     * a client that will later resume the query.
     *
     * @return the encoded token
     */
    public String toBase64() {
        return Base64Variants.MIME_NO_LINEFEEDS.encode(token);
    }

    /**
     * Returns the values of the ordering fields at this position, if the
     * service reported them.
     *
     * @return the values, possibly empty
     */
    public List<Object> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Cursor)) {
            return false;
        }
        return Arrays.equals(token, ((Cursor) other).token);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(token);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Cursor: [")
            .append(toBase64());
        if (!values.isEmpty()) {
            sb.append(", values=").append(values);
        }
        return sb.append("]").toString();
    }
}

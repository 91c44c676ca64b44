/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver;

import com.fasterxml.jackson.core.JsonLocation;

/**
 * An exception indicating that a response from the service could not be
 * decoded, either because it is not valid JSON or because it does not have
 * the expected shape. If available the location in the JSON document is
 * provided.
 */
public class JsonParseException extends TransportException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     */
    private transient JsonLocation location;

    /**
     * @hidden
     * @param msg the exception message
     */
    public JsonParseException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     * @param msg the exception message
     * @param location the exception location in the input
     */
    public JsonParseException(String msg, JsonLocation location) {
        super(msg);
        this.location = location;
    }

    /**
     * Returns the column number of the error within a line if available,
     * otherwise a negative number is returned.
     *
     * @return the column, or -1
     */
    public int getColumn() {
        if (location != null && location != JsonLocation.NA) {
            return location.getColumnNr();
        }
        return -1;
    }

    /**
     * Returns the line number of the error if available, otherwise a
     * negative number is returned.
     *
     * @return the line, or -1
     */
    public int getLine() {
        if (location != null && location != JsonLocation.NA) {
            return location.getLineNr();
        }
        return -1;
    }
}

/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

/**
 * The state of a query after a {@link ResultPage} has been returned.
 */
public enum MoreResultsType {
    /**
     * There may be additional results after the end cursor of the page.
     */
    NOT_FINISHED,

    /**
     * The query limit was reached; more results exist after the limit.
     */
    MORE_RESULTS_AFTER_LIMIT,

    /**
     * The query end cursor was reached; more results exist after it.
     */
    MORE_RESULTS_AFTER_CURSOR,

    /**
     * The query is finished and there are no more results.
     */
    NO_MORE_RESULTS;

    /**
     * Maps the status name used on the wire to the enum value. Unknown or
     * missing names map to {@link #NOT_FINISHED}, which is the conservative
     * choice: the caller may still try to continue from the end cursor.
     *
     * @param name the status name, may be null
     * @return the value
     */
    public static MoreResultsType fromName(String name) {
        if (name == null) {
            return NOT_FINISHED;
        }
        for (MoreResultsType type : values()) {
            if (type.name().equals(name)) {
                return type;
            }
        }
        return NOT_FINISHED;
    }
}

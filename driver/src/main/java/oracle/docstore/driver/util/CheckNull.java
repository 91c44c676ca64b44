/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.docstore.driver.util;

import java.util.Objects;

/**
 * @hidden
 * Wrapper for calls to Objects.requireNonNull
 */
public class CheckNull {

    public static void requireNonNull(Object value, String message) {
        Objects.requireNonNull(value, message);
    }

    /*
     * throws IAE instead of NPE
     */
    public static void requireNonNullIAE(Object value, String message) {
        if (value == null) {
            throw new IllegalArgumentException(message);
        }
    }

    /*
     * throws IAE for a null or empty string
     */
    public static void requireNonEmpty(String value, String message) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
    }
}

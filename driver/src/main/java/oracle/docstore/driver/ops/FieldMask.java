/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.util.CheckNull.requireNonEmpty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A set of field paths used to restrict the fields returned for a document.
 */
public final class FieldMask {

    private final List<String> fieldPaths;

    private FieldMask(List<String> fieldPaths) {
        this.fieldPaths = Collections.unmodifiableList(fieldPaths);
    }

    /**
     * Creates a mask from one or more field paths.
     *
     * @param fieldPaths the field paths
     * @return the mask
     */
    public static FieldMask of(String... fieldPaths) {
        List<String> list = new ArrayList<>();
        for (String path : fieldPaths) {
            requireNonEmpty(path, "FieldMask: field path must be non-empty");
            list.add(path);
        }
        return new FieldMask(list);
    }

    public List<String> getFieldPaths() {
        return fieldPaths;
    }

    @Override
    public String toString() {
        return "FieldMask: " + fieldPaths;
    }
}

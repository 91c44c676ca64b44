/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single mutation sent as part of a {@link WriteBatch} commit.
 */
public final class Write {

    /**
     * The kind of mutation.
     */
    public enum Type {
        /** Create the document, failing if it exists */
        CREATE,
        /** Overwrite the document, or merge fields into it */
        SET,
        /** Update fields of an existing document */
        UPDATE,
        /** Delete the document */
        DELETE
    }

    private final Type type;
    private final DocumentReference ref;
    private final Map<String, Object> data;
    private final boolean merge;

    Write(Type type,
          DocumentReference ref,
          Map<String, Object> data,
          boolean merge) {
        this.type = type;
        this.ref = ref;
        this.data = (data == null ? null :
                     Collections.unmodifiableMap(new LinkedHashMap<>(data)));
        this.merge = merge;
    }

    public Type getType() {
        return type;
    }

    public DocumentReference getReference() {
        return ref;
    }

    /**
     * @return the fields to write, null for a delete
     */
    public Map<String, Object> getData() {
        return data;
    }

    /**
     * Returns true if a SET merges into the existing document instead of
     * replacing it. UPDATE writes always merge.
     *
     * @return true if merging
     */
    public boolean isMerge() {
        return merge;
    }

    @Override
    public String toString() {
        return "Write: [" + type + " " + ref.getDocumentPath() +
            (merge ? ", merge" : "") + "]";
    }
}

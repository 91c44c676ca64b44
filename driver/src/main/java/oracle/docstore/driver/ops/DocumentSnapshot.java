/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static oracle.docstore.driver.util.CheckNull.requireNonNull;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The contents of a document as read from the service. A snapshot for a
 * document that does not exist has no data and {@link #exists} returns
 * false.
 * <p>
 * Field values are plain Java objects: null, {@link Boolean}, {@link Long},
 * {@link Double}, {@link String}, {@code byte[]}, {@link Instant},
 * {@link DocumentReference}, {@link java.util.List} and
 * {@link java.util.Map} of those.
 * <p>
 * Two snapshots are equal if they refer to the same document with the same
 * data and versions; the read time is not considered.
 */
public final class DocumentSnapshot {

    private final DocumentReference ref;
    private final Map<String, Object> data;
    private final Instant createTime;
    private final Instant updateTime;
    private final Instant readTime;

    private DocumentSnapshot(DocumentReference ref,
                             Map<String, Object> data,
                             Instant createTime,
                             Instant updateTime,
                             Instant readTime) {
        requireNonNull(ref, "DocumentSnapshot: reference must be non-null");
        this.ref = ref;
        this.data = (data == null ? null :
                     Collections.unmodifiableMap(new LinkedHashMap<>(data)));
        this.createTime = createTime;
        this.updateTime = updateTime;
        this.readTime = readTime;
    }

    /**
     * @hidden
     */
    public static DocumentSnapshot found(DocumentReference ref,
                                         Map<String, Object> data,
                                         Instant createTime,
                                         Instant updateTime,
                                         Instant readTime) {
        return new DocumentSnapshot(ref,
                                    (data == null ?
                                     Collections.emptyMap() : data),
                                    createTime, updateTime, readTime);
    }

    /**
     * @hidden
     */
    public static DocumentSnapshot missing(DocumentReference ref,
                                           Instant readTime) {
        return new DocumentSnapshot(ref, null, null, null, readTime);
    }

    public DocumentReference getReference() {
        return ref;
    }

    /**
     * Returns the id of the document.
     *
     * @return the id
     */
    public String getDocumentId() {
        return ref.getDocumentId();
    }

    /**
     * Returns true if the document existed at the read time.
     *
     * @return true if the document exists
     */
    public boolean exists() {
        return data != null;
    }

    /**
     * Returns the fields of the document.
     *
     * @return the fields, or null if the document does not exist
     */
    public Map<String, Object> getData() {
        return data;
    }

    /**
     * Returns the value of a top level field.
     *
     * @param field the field name
     * @return the value, or null if absent or the document does not exist
     */
    public Object get(String field) {
        return (data == null ? null : data.get(field));
    }

    public Instant getCreateTime() {
        return createTime;
    }

    public Instant getUpdateTime() {
        return updateTime;
    }

    /**
     * Returns the time at which the document was read.
     *
     * @return the read time, may be null
     */
    public Instant getReadTime() {
        return readTime;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DocumentSnapshot)) {
            return false;
        }
        DocumentSnapshot o = (DocumentSnapshot) other;
        return ref.equals(o.ref) &&
            Objects.equals(data, o.data) &&
            Objects.equals(createTime, o.createTime) &&
            Objects.equals(updateTime, o.updateTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ref, createTime, updateTime);
    }

    @Override
    public String toString() {
        return "DocumentSnapshot: [" + ref.getDocumentPath() +
            ", exists=" + exists() + ", updateTime=" + updateTime + "]";
    }
}

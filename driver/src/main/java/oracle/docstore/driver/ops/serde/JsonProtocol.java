/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops.serde;

import static oracle.docstore.driver.values.ValueCodec.createParseException;
import static oracle.docstore.driver.values.ValueCodec.expect;
import static oracle.docstore.driver.values.ValueCodec.parseTimestamp;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import oracle.docstore.driver.JsonParseException;
import oracle.docstore.driver.TransportException;
import oracle.docstore.driver.ops.Cursor;
import oracle.docstore.driver.ops.DocumentPath;
import oracle.docstore.driver.ops.DocumentReference;
import oracle.docstore.driver.ops.DocumentSnapshot;
import oracle.docstore.driver.ops.FieldMask;
import oracle.docstore.driver.ops.MoreResultsType;
import oracle.docstore.driver.ops.Query;
import oracle.docstore.driver.ops.ResultPage;
import oracle.docstore.driver.ops.TransactionOptions;
import oracle.docstore.driver.ops.Write;
import oracle.docstore.driver.values.ValueCodec;

import com.fasterxml.jackson.core.Base64Variants;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;

/**
 * JSON encoding of the document service requests and responses.
 * <p>
 * Requests are encoded to UTF-8 bytes, responses are decoded from the
 * response text. Members of a response that are not recognized are
 * skipped. A response that is not valid JSON, or that lacks a required
 * member, results in a {@link JsonParseException}.
 * @hidden
 */
public class JsonProtocol {

    /* methods, used as the suffix of the request path */
    public static final String RUN_QUERY = "runQuery";
    public static final String BEGIN_TRANSACTION = "beginTransaction";
    public static final String ROLLBACK = "rollback";
    public static final String BATCH_GET = "batchGet";
    public static final String LIST_COLLECTION_IDS = "listCollectionIds";
    public static final String COMMIT = "commit";

    /* request and response members */
    public static final String BATCH = "batch";
    public static final String CODE = "code";
    public static final String COLLECTION_ID = "collectionId";
    public static final String COLLECTION_IDS = "collectionIds";
    public static final String COMMIT_TIME = "commitTime";
    public static final String COMPOSITE_FILTER = "compositeFilter";
    public static final String CREATE_TIME = "createTime";
    public static final String CURRENT_DOCUMENT = "currentDocument";
    public static final String CURSOR = "cursor";
    public static final String DELETE = "delete";
    public static final String DIRECTION = "direction";
    public static final String DOCUMENT = "document";
    public static final String DOCUMENTS = "documents";
    public static final String END_CURSOR = "endCursor";
    public static final String ERROR = "error";
    public static final String EXISTS = "exists";
    public static final String FIELD = "field";
    public static final String FIELD_FILTER = "fieldFilter";
    public static final String FIELD_PATH = "fieldPath";
    public static final String FIELD_PATHS = "fieldPaths";
    public static final String FIELDS = "fields";
    public static final String FILTERS = "filters";
    public static final String FOUND = "found";
    public static final String FROM = "from";
    public static final String LIMIT = "limit";
    public static final String MASK = "mask";
    public static final String MESSAGE = "message";
    public static final String MISSING = "missing";
    public static final String MORE_RESULTS = "moreResults";
    public static final String NAME = "name";
    public static final String OFFSET = "offset";
    public static final String OP = "op";
    public static final String OPTIONS = "options";
    public static final String ORDER_BY = "orderBy";
    public static final String READ_ONLY = "readOnly";
    public static final String READ_TIME = "readTime";
    public static final String RESULTS = "results";
    public static final String SELECT = "select";
    public static final String SKIPPED_RESULTS = "skippedResults";
    public static final String START_CURSOR = "startCursor";
    public static final String STATUS = "status";
    public static final String STRUCTURED_QUERY = "structuredQuery";
    public static final String TRANSACTION = "transaction";
    public static final String UPDATE = "update";
    public static final String UPDATE_MASK = "updateMask";
    public static final String UPDATE_TIME = "updateTime";
    public static final String VALUE = "value";
    public static final String WHERE = "where";
    public static final String WRITES = "writes";

    private static final JsonFactory factory = new JsonFactory();

    private JsonProtocol() {}

    /**
     * Returns the request path of a method on a resource.
     *
     * @param resourceName the database or parent resource name
     * @param method the method
     * @return the path, for example /v1/projects/p/databases/d:beginTransaction
     */
    public static String requestPath(String resourceName, String method) {
        return "/v1/" + resourceName + ":" + method;
    }

    /*
     * Requests
     */

    public static byte[] encodeRunQuery(Query query, byte[] transactionId) {
        return encode(gen -> {
            gen.writeStartObject();
            gen.writeFieldName(STRUCTURED_QUERY);
            writeStructuredQuery(gen, query);
            writeTransaction(gen, transactionId);
            gen.writeEndObject();
        });
    }

    public static byte[] encodeBeginTransaction(TransactionOptions options) {
        return encode(gen -> {
            gen.writeStartObject();
            gen.writeObjectFieldStart(OPTIONS);
            gen.writeObjectFieldStart(READ_ONLY);
            if (options.getReadTime() != null) {
                gen.writeStringField(READ_TIME,
                                     options.getReadTime().toString());
            }
            gen.writeEndObject();
            gen.writeEndObject();
            gen.writeEndObject();
        });
    }

    public static byte[] encodeRollback(byte[] transactionId) {
        return encode(gen -> {
            gen.writeStartObject();
            writeTransaction(gen, transactionId);
            gen.writeEndObject();
        });
    }

    public static byte[] encodeBatchGet(List<String> documentNames,
                                        FieldMask mask,
                                        byte[] transactionId) {
        return encode(gen -> {
            gen.writeStartObject();
            gen.writeArrayFieldStart(DOCUMENTS);
            for (String name : documentNames) {
                gen.writeString(name);
            }
            gen.writeEndArray();
            if (mask != null) {
                gen.writeFieldName(MASK);
                writeFieldPaths(gen, mask.getFieldPaths());
            }
            writeTransaction(gen, transactionId);
            gen.writeEndObject();
        });
    }

    public static byte[] encodeListCollectionIds() {
        return encode(gen -> {
            gen.writeStartObject();
            gen.writeEndObject();
        });
    }

    /**
     * Encodes a commit. A create is an update that requires the document
     * to be absent, an update one that requires it to exist; a merging set
     * and an update carry the written field names as their update mask.
     */
    public static byte[] encodeCommit(List<Write> writes) {
        return encode(gen -> {
            gen.writeStartObject();
            gen.writeArrayFieldStart(WRITES);
            for (Write write : writes) {
                writeWrite(gen, write);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        });
    }

    /*
     * Responses
     */

    /**
     * Decodes one batch of query results.
     *
     * @param body the response text
     * @return the page
     */
    public static ResultPage decodeRunQuery(String body) {
        return decode(body, jp -> {
            expect(jp, jp.nextToken(), JsonToken.START_OBJECT);
            List<DocParts> docs = new ArrayList<>();
            List<Cursor> cursors = new ArrayList<>();
            Cursor endCursor = null;
            MoreResultsType moreResults = null;
            int skipped = 0;
            Instant readTime = null;

            JsonToken token;
            while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
                String name = fieldName(jp, token);
                token = jp.nextToken();
                if (READ_TIME.equals(name)) {
                    readTime = readTimestamp(jp, token);
                } else if (BATCH.equals(name)) {
                    expect(jp, token, JsonToken.START_OBJECT);
                    while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
                        String bname = fieldName(jp, token);
                        token = jp.nextToken();
                        if (RESULTS.equals(bname)) {
                            readResults(jp, token, docs, cursors);
                        } else if (END_CURSOR.equals(bname)) {
                            endCursor = readCursor(jp, token);
                        } else if (MORE_RESULTS.equals(bname)) {
                            expect(jp, token, JsonToken.VALUE_STRING);
                            moreResults =
                                MoreResultsType.fromName(jp.getText());
                        } else if (SKIPPED_RESULTS.equals(bname)) {
                            skipped = readInt(jp, token);
                        } else {
                            jp.skipChildren();
                        }
                    }
                } else {
                    jp.skipChildren();
                }
            }
            if (moreResults == null) {
                throw createParseException(
                    "Query response is missing " + MORE_RESULTS, jp);
            }
            List<DocumentSnapshot> snapshots = new ArrayList<>(docs.size());
            for (DocParts doc : docs) {
                snapshots.add(doc.toSnapshot(readTime));
            }
            return new ResultPage(snapshots, cursors, endCursor,
                                  moreResults, skipped, readTime);
        });
    }

    /**
     * Decodes the id of a new transaction.
     *
     * @param body the response text
     * @return the transaction id, possibly empty if the service sent none
     */
    public static byte[] decodeBeginTransaction(String body) {
        return decode(body, jp -> {
            expect(jp, jp.nextToken(), JsonToken.START_OBJECT);
            byte[] txn = new byte[0];
            JsonToken token;
            while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
                String name = fieldName(jp, token);
                token = jp.nextToken();
                if (TRANSACTION.equals(name)) {
                    expect(jp, token, JsonToken.VALUE_STRING);
                    txn = jp.getBinaryValue(Base64Variants.MIME_NO_LINEFEEDS);
                } else {
                    jp.skipChildren();
                }
            }
            return txn;
        });
    }

    /**
     * Decodes the results of a batch get, found and missing documents in
     * the order the service sent them.
     *
     * @param body the response text
     * @return the snapshots
     */
    public static List<DocumentSnapshot> decodeBatchGet(String body) {
        return decode(body, jp -> {
            expect(jp, jp.nextToken(), JsonToken.START_ARRAY);
            List<DocumentSnapshot> result = new ArrayList<>();
            while (jp.nextToken() != JsonToken.END_ARRAY) {
                expect(jp, jp.currentToken(), JsonToken.START_OBJECT);
                DocParts found = null;
                DocumentReference missing = null;
                Instant readTime = null;
                JsonToken token;
                while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
                    String name = fieldName(jp, token);
                    token = jp.nextToken();
                    if (FOUND.equals(name)) {
                        found = readDocument(jp, token);
                    } else if (MISSING.equals(name)) {
                        expect(jp, token, JsonToken.VALUE_STRING);
                        missing = toReference(jp.getText(), jp);
                    } else if (READ_TIME.equals(name)) {
                        readTime = readTimestamp(jp, token);
                    } else {
                        jp.skipChildren();
                    }
                }
                if (found != null) {
                    result.add(found.toSnapshot(readTime));
                } else if (missing != null) {
                    result.add(DocumentSnapshot.missing(missing, readTime));
                } else {
                    throw createParseException(
                        "Batch get result has neither " + FOUND + " nor " +
                        MISSING, jp);
                }
            }
            return result;
        });
    }

    public static List<String> decodeListCollectionIds(String body) {
        return decode(body, jp -> {
            expect(jp, jp.nextToken(), JsonToken.START_OBJECT);
            List<String> ids = new ArrayList<>();
            JsonToken token;
            while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
                String name = fieldName(jp, token);
                token = jp.nextToken();
                if (COLLECTION_IDS.equals(name)) {
                    expect(jp, token, JsonToken.START_ARRAY);
                    while ((token = jp.nextToken()) != JsonToken.END_ARRAY) {
                        expect(jp, token, JsonToken.VALUE_STRING);
                        ids.add(jp.getText());
                    }
                } else {
                    jp.skipChildren();
                }
            }
            return ids;
        });
    }

    /**
     * @return the commit time, or null if the service sent none
     */
    public static Instant decodeCommit(String body) {
        return decode(body, jp -> {
            expect(jp, jp.nextToken(), JsonToken.START_OBJECT);
            Instant commitTime = null;
            JsonToken token;
            while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
                String name = fieldName(jp, token);
                token = jp.nextToken();
                if (COMMIT_TIME.equals(name)) {
                    commitTime = readTimestamp(jp, token);
                } else {
                    jp.skipChildren();
                }
            }
            return commitTime;
        });
    }

    /**
     * Decodes an error response. Error bodies come from proxies as well as
     * from the service, so a body that is not a JSON error object yields
     * null rather than an exception.
     *
     * @param body the response text
     * @return the error, or null if the body does not hold one
     */
    public static ServiceError decodeError(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        try (JsonParser jp = factory.createParser(body)) {
            if (jp.nextToken() != JsonToken.START_OBJECT) {
                return null;
            }
            ServiceError error = null;
            JsonToken token;
            while ((token = jp.nextToken()) == JsonToken.FIELD_NAME) {
                String name = jp.getCurrentName();
                token = jp.nextToken();
                if (ERROR.equals(name) && token == JsonToken.START_OBJECT) {
                    error = readError(jp);
                } else {
                    jp.skipChildren();
                }
            }
            return error;
        } catch (IOException ioe) {
            return null;
        }
    }

    /**
     * The contents of an error response.
     */
    public static final class ServiceError {
        private final int code;
        private final String message;
        private final String status;

        ServiceError(int code, String message, String status) {
            this.code = code;
            this.message = message;
            this.status = status;
        }

        public int getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        /**
         * @return the status name, for example NOT_FOUND, or null
         */
        public String getStatus() {
            return status;
        }

        @Override
        public String toString() {
            return status + " (" + code + "): " + message;
        }
    }

    /*
     * Encoding helpers
     */

    private interface Encoder {
        void write(JsonGenerator gen) throws IOException;
    }

    private interface Decoder<T> {
        T read(JsonParser jp) throws IOException;
    }

    private static byte[] encode(Encoder encoder) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator gen = factory.createGenerator(out,
                                                         JsonEncoding.UTF8)) {
            encoder.write(gen);
        } catch (IOException ioe) {
            throw new TransportException(
                "Failed to encode request: " + ioe.getMessage(), ioe);
        }
        return out.toByteArray();
    }

    private static <T> T decode(String body, Decoder<T> decoder) {
        try (JsonParser jp = factory.createParser(body)) {
            return decoder.read(jp);
        } catch (JsonProcessingException jpe) {
            throw new JsonParseException(
                "Failed to parse response: " + jpe.getOriginalMessage(),
                jpe.getLocation());
        } catch (IOException ioe) {
            throw new JsonParseException(
                "Failed to parse response: " + ioe.getMessage());
        }
    }

    private static void writeTransaction(JsonGenerator gen,
                                         byte[] transactionId)
        throws IOException {

        if (transactionId != null) {
            gen.writeFieldName(TRANSACTION);
            gen.writeBinary(Base64Variants.MIME_NO_LINEFEEDS,
                            transactionId, 0, transactionId.length);
        }
    }

    private static void writeFieldPaths(JsonGenerator gen, List<String> paths)
        throws IOException {

        gen.writeStartObject();
        gen.writeArrayFieldStart(FIELD_PATHS);
        for (String path : paths) {
            gen.writeString(path);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeFieldReference(JsonGenerator gen, String field)
        throws IOException {

        gen.writeStartObject();
        gen.writeStringField(FIELD_PATH, field);
        gen.writeEndObject();
    }

    private static void writeStructuredQuery(JsonGenerator gen, Query query)
        throws IOException {

        gen.writeStartObject();
        if (!query.getSelect().isEmpty()) {
            gen.writeObjectFieldStart(SELECT);
            gen.writeArrayFieldStart(FIELDS);
            for (String field : query.getSelect()) {
                writeFieldReference(gen, field);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }

        gen.writeArrayFieldStart(FROM);
        gen.writeStartObject();
        gen.writeStringField(COLLECTION_ID, query.getCollectionId());
        gen.writeEndObject();
        gen.writeEndArray();

        List<Query.Filter> filters = query.getFilters();
        if (filters.size() == 1) {
            gen.writeFieldName(WHERE);
            writeFieldFilter(gen, filters.get(0));
        } else if (filters.size() > 1) {
            gen.writeObjectFieldStart(WHERE);
            gen.writeObjectFieldStart(COMPOSITE_FILTER);
            gen.writeStringField(OP, "AND");
            gen.writeArrayFieldStart(FILTERS);
            for (Query.Filter filter : filters) {
                writeFieldFilter(gen, filter);
            }
            gen.writeEndArray();
            gen.writeEndObject();
            gen.writeEndObject();
        }

        if (!query.getOrders().isEmpty()) {
            gen.writeArrayFieldStart(ORDER_BY);
            for (Query.Order order : query.getOrders()) {
                gen.writeStartObject();
                gen.writeFieldName(FIELD);
                writeFieldReference(gen, order.getField());
                gen.writeStringField(DIRECTION, order.getDirection().name());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }

        if (query.getStartCursor() != null) {
            gen.writeStringField(START_CURSOR,
                                 query.getStartCursor().toBase64());
        }
        if (query.getEndCursor() != null) {
            gen.writeStringField(END_CURSOR, query.getEndCursor().toBase64());
        }
        if (query.getOffset() != null) {
            gen.writeNumberField(OFFSET, query.getOffset());
        }
        if (query.getLimit() != null) {
            gen.writeNumberField(LIMIT, query.getLimit());
        }
        gen.writeEndObject();
    }

    private static void writeFieldFilter(JsonGenerator gen,
                                         Query.Filter filter)
        throws IOException {

        gen.writeStartObject();
        gen.writeObjectFieldStart(FIELD_FILTER);
        gen.writeFieldName(FIELD);
        writeFieldReference(gen, filter.getField());
        gen.writeStringField(OP, filter.getOperator().name());
        gen.writeFieldName(VALUE);
        ValueCodec.writeValue(gen, filter.getValue());
        gen.writeEndObject();
        gen.writeEndObject();
    }

    private static void writeWrite(JsonGenerator gen, Write write)
        throws IOException {

        gen.writeStartObject();
        if (write.getType() == Write.Type.DELETE) {
            gen.writeStringField(DELETE, write.getReference().getName());
            gen.writeEndObject();
            return;
        }

        Map<String, Object> data = write.getData();
        gen.writeObjectFieldStart(UPDATE);
        gen.writeStringField(NAME, write.getReference().getName());
        gen.writeFieldName(FIELDS);
        ValueCodec.writeFields(gen, data);
        gen.writeEndObject();

        if (write.getType() == Write.Type.UPDATE ||
            (write.getType() == Write.Type.SET && write.isMerge())) {
            gen.writeFieldName(UPDATE_MASK);
            writeFieldPaths(gen, new ArrayList<>(data.keySet()));
        }
        if (write.getType() == Write.Type.CREATE ||
            write.getType() == Write.Type.UPDATE) {
            gen.writeObjectFieldStart(CURRENT_DOCUMENT);
            gen.writeBooleanField(EXISTS,
                                  write.getType() == Write.Type.UPDATE);
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }

    /*
     * Decoding helpers
     */

    /*
     * A document as sent by the service, before the read time of the
     * response is known.
     */
    private static final class DocParts {
        DocumentReference ref;
        Map<String, Object> fields;
        Instant createTime;
        Instant updateTime;

        DocumentSnapshot toSnapshot(Instant readTime) {
            return DocumentSnapshot.found(ref, fields, createTime,
                                          updateTime, readTime);
        }
    }

    private static String fieldName(JsonParser jp, JsonToken token) {
        expect(jp, token, JsonToken.FIELD_NAME);
        try {
            return jp.getCurrentName();
        } catch (IOException ioe) {
            throw createParseException(ioe.getMessage(), jp);
        }
    }

    private static void readResults(JsonParser jp,
                                    JsonToken token,
                                    List<DocParts> docs,
                                    List<Cursor> cursors)
        throws IOException {

        expect(jp, token, JsonToken.START_ARRAY);
        while ((token = jp.nextToken()) != JsonToken.END_ARRAY) {
            expect(jp, token, JsonToken.START_OBJECT);
            DocParts doc = null;
            Cursor cursor = null;
            while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
                String name = fieldName(jp, token);
                token = jp.nextToken();
                if (DOCUMENT.equals(name)) {
                    doc = readDocument(jp, token);
                } else if (CURSOR.equals(name)) {
                    cursor = readCursor(jp, token);
                } else {
                    jp.skipChildren();
                }
            }
            if (doc == null) {
                /* a result without a document only reports progress */
                continue;
            }
            if (cursor == null) {
                throw createParseException(
                    "Query result for " + doc.ref.getName() +
                    " has no " + CURSOR, jp);
            }
            docs.add(doc);
            cursors.add(cursor);
        }
    }

    private static DocParts readDocument(JsonParser jp, JsonToken token)
        throws IOException {

        expect(jp, token, JsonToken.START_OBJECT);
        DocParts doc = new DocParts();
        while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
            String name = fieldName(jp, token);
            token = jp.nextToken();
            if (NAME.equals(name)) {
                expect(jp, token, JsonToken.VALUE_STRING);
                doc.ref = toReference(jp.getText(), jp);
            } else if (FIELDS.equals(name)) {
                doc.fields = ValueCodec.readFields(jp);
            } else if (CREATE_TIME.equals(name)) {
                doc.createTime = readTimestamp(jp, token);
            } else if (UPDATE_TIME.equals(name)) {
                doc.updateTime = readTimestamp(jp, token);
            } else {
                jp.skipChildren();
            }
        }
        if (doc.ref == null) {
            throw createParseException("Document has no " + NAME, jp);
        }
        if (doc.fields == null) {
            doc.fields = new LinkedHashMap<>();
        }
        return doc;
    }

    private static ServiceError readError(JsonParser jp) throws IOException {
        int code = 0;
        String message = null;
        String status = null;
        JsonToken token;
        while ((token = jp.nextToken()) == JsonToken.FIELD_NAME) {
            String name = jp.getCurrentName();
            token = jp.nextToken();
            if (CODE.equals(name) && token == JsonToken.VALUE_NUMBER_INT) {
                code = jp.getIntValue();
            } else if (MESSAGE.equals(name) &&
                       token == JsonToken.VALUE_STRING) {
                message = jp.getText();
            } else if (STATUS.equals(name) &&
                       token == JsonToken.VALUE_STRING) {
                status = jp.getText();
            } else {
                jp.skipChildren();
            }
        }
        return new ServiceError(code, message, status);
    }

    private static DocumentReference toReference(String name, JsonParser jp) {
        try {
            DocumentPath path = DocumentPath.fromName(name);
            if (!path.isDocument()) {
                throw createParseException("Not a document name: " + name,
                                           jp);
            }
            return new DocumentReference(path);
        } catch (IllegalArgumentException iae) {
            throw createParseException(iae.getMessage(), jp);
        }
    }

    private static Cursor readCursor(JsonParser jp, JsonToken token)
        throws IOException {

        expect(jp, token, JsonToken.VALUE_STRING);
        byte[] bytes = jp.getBinaryValue(Base64Variants.MIME_NO_LINEFEEDS);
        if (bytes.length == 0) {
            return null;
        }
        return Cursor.fromBytes(bytes);
    }

    private static Instant readTimestamp(JsonParser jp, JsonToken token)
        throws IOException {

        expect(jp, token, JsonToken.VALUE_STRING);
        return parseTimestamp(jp.getText(), jp);
    }

    private static int readInt(JsonParser jp, JsonToken token)
        throws IOException {

        if (token == JsonToken.VALUE_NUMBER_INT) {
            return jp.getIntValue();
        }
        expect(jp, token, JsonToken.VALUE_STRING);
        try {
            return Integer.parseInt(jp.getText());
        } catch (NumberFormatException nfe) {
            throw createParseException("Invalid integer: " + jp.getText(), jp);
        }
    }
}

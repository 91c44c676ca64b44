/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.values;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import oracle.docstore.driver.JsonParseException;
import oracle.docstore.driver.ops.DocumentPath;
import oracle.docstore.driver.ops.DocumentReference;

import com.fasterxml.jackson.core.Base64Variants;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

/**
 * Internal use only
 * <p>
 * Encodes document field values to and from their tagged JSON form, in
 * which every value is an object with exactly one member naming its type:
 * <pre>
 *   {"stringValue":"abc"}
 *   {"integerValue":"42"}
 *   {"mapValue":{"fields":{"a":{"booleanValue":true}}}}
 * </pre>
 * On the Java side values are plain objects: null, {@link Boolean},
 * {@link Long}, {@link Double}, {@link String}, {@code byte[]},
 * {@link Instant}, {@link DocumentReference}, {@link List} and {@link Map}.
 * Integer and Float arguments are widened when written.
 * @hidden
 */
public class ValueCodec {

    public static final String NULL_VALUE = "nullValue";
    public static final String BOOLEAN_VALUE = "booleanValue";
    public static final String INTEGER_VALUE = "integerValue";
    public static final String DOUBLE_VALUE = "doubleValue";
    public static final String TIMESTAMP_VALUE = "timestampValue";
    public static final String STRING_VALUE = "stringValue";
    public static final String BYTES_VALUE = "bytesValue";
    public static final String REFERENCE_VALUE = "referenceValue";
    public static final String ARRAY_VALUE = "arrayValue";
    public static final String MAP_VALUE = "mapValue";

    static final String VALUES = "values";
    static final String FIELDS = "fields";

    private ValueCodec() {}

    /**
     * Writes a map of field values as a JSON object of tagged values.
     *
     * @param gen the generator
     * @param fields the fields, in iteration order
     * @throws IOException on a generator failure
     * @throws IllegalArgumentException if a value has an unsupported type
     */
    public static void writeFields(JsonGenerator gen,
                                   Map<String, Object> fields)
        throws IOException {

        gen.writeStartObject();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            gen.writeFieldName(entry.getKey());
            writeValue(gen, entry.getValue());
        }
        gen.writeEndObject();
    }

    /**
     * Writes a single tagged value.
     *
     * @param gen the generator
     * @param value the value
     * @throws IOException on a generator failure
     * @throws IllegalArgumentException if the value has an unsupported type
     */
    @SuppressWarnings("unchecked")
    public static void writeValue(JsonGenerator gen, Object value)
        throws IOException {

        gen.writeStartObject();
        if (value == null) {
            gen.writeNullField(NULL_VALUE);
        } else if (value instanceof Boolean) {
            gen.writeBooleanField(BOOLEAN_VALUE, (Boolean) value);
        } else if (value instanceof Long || value instanceof Integer ||
                   value instanceof Short || value instanceof Byte) {
            gen.writeStringField(INTEGER_VALUE,
                                 Long.toString(((Number) value).longValue()));
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                gen.writeStringField(DOUBLE_VALUE, Double.toString(d));
            } else {
                gen.writeNumberField(DOUBLE_VALUE, d);
            }
        } else if (value instanceof String) {
            gen.writeStringField(STRING_VALUE, (String) value);
        } else if (value instanceof byte[]) {
            byte[] bytes = (byte[]) value;
            gen.writeFieldName(BYTES_VALUE);
            gen.writeBinary(Base64Variants.MIME_NO_LINEFEEDS,
                            bytes, 0, bytes.length);
        } else if (value instanceof Instant) {
            gen.writeStringField(TIMESTAMP_VALUE, value.toString());
        } else if (value instanceof DocumentReference) {
            gen.writeStringField(REFERENCE_VALUE,
                                 ((DocumentReference) value).getName());
        } else if (value instanceof List) {
            gen.writeObjectFieldStart(ARRAY_VALUE);
            gen.writeArrayFieldStart(VALUES);
            for (Object element : (List<Object>) value) {
                writeValue(gen, element);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        } else if (value instanceof Map) {
            gen.writeObjectFieldStart(MAP_VALUE);
            gen.writeFieldName(FIELDS);
            writeFields(gen, (Map<String, Object>) value);
            gen.writeEndObject();
        } else {
            throw new IllegalArgumentException(
                "Unsupported value type: " + value.getClass().getName());
        }
        gen.writeEndObject();
    }

    /**
     * Reads a JSON object of tagged values. The parser must be positioned
     * on the START_OBJECT token; on return it is positioned on the matching
     * END_OBJECT.
     *
     * @param jp the parser
     * @return the fields in document order
     * @throws IOException on a parser failure
     * @throws JsonParseException if the input is not a map of tagged values
     */
    public static Map<String, Object> readFields(JsonParser jp)
        throws IOException {

        expect(jp, jp.currentToken(), JsonToken.START_OBJECT);
        Map<String, Object> fields = new LinkedHashMap<>();
        JsonToken token;
        while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
            expect(jp, token, JsonToken.FIELD_NAME);
            String name = jp.getCurrentName();
            jp.nextToken();
            fields.put(name, readValue(jp));
        }
        return fields;
    }

    /**
     * Reads one tagged value. The parser must be positioned on its
     * START_OBJECT token; on return it is positioned on the matching
     * END_OBJECT.
     *
     * @param jp the parser
     * @return the value
     * @throws IOException on a parser failure
     * @throws JsonParseException if the input is not a tagged value
     */
    public static Object readValue(JsonParser jp) throws IOException {
        expect(jp, jp.currentToken(), JsonToken.START_OBJECT);
        JsonToken token = jp.nextToken();
        expect(jp, token, JsonToken.FIELD_NAME);
        String tag = jp.getCurrentName();
        token = jp.nextToken();

        Object result;
        switch (tag) {
        case NULL_VALUE:
            result = null;
            break;
        case BOOLEAN_VALUE:
            if (token != JsonToken.VALUE_TRUE &&
                token != JsonToken.VALUE_FALSE) {
                throw createParseException("Expected boolean for " + tag, jp);
            }
            result = jp.getBooleanValue();
            break;
        case INTEGER_VALUE:
            result = readLong(jp, token);
            break;
        case DOUBLE_VALUE:
            result = readDouble(jp, token);
            break;
        case TIMESTAMP_VALUE:
            expect(jp, token, JsonToken.VALUE_STRING);
            result = parseTimestamp(jp.getText(), jp);
            break;
        case STRING_VALUE:
            expect(jp, token, JsonToken.VALUE_STRING);
            result = jp.getText();
            break;
        case BYTES_VALUE:
            expect(jp, token, JsonToken.VALUE_STRING);
            result = jp.getBinaryValue(Base64Variants.MIME_NO_LINEFEEDS);
            break;
        case REFERENCE_VALUE:
            expect(jp, token, JsonToken.VALUE_STRING);
            try {
                result = new DocumentReference(
                    DocumentPath.fromName(jp.getText()));
            } catch (IllegalArgumentException iae) {
                throw createParseException(iae.getMessage(), jp);
            }
            break;
        case ARRAY_VALUE:
            result = readArray(jp);
            break;
        case MAP_VALUE:
            result = readMap(jp);
            break;
        default:
            throw createParseException("Unknown value type: " + tag, jp);
        }

        token = jp.nextToken();
        if (token != JsonToken.END_OBJECT) {
            throw createParseException(
                "Value must have exactly one type member", jp);
        }
        return result;
    }

    /**
     * Parses an RFC 3339 timestamp as used on the wire.
     *
     * @param text the timestamp text
     * @param jp the parser, used for the error location
     * @return the instant
     */
    public static Instant parseTimestamp(String text, JsonParser jp) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException dtpe) {
            throw createParseException("Invalid timestamp: " + text, jp);
        }
    }

    /**
     * Creates a parse exception that carries the parser's location, when a
     * parser is available.
     */
    public static JsonParseException createParseException(String msg,
                                                          JsonParser jp) {
        if (jp == null) {
            return new JsonParseException(msg);
        }
        return new JsonParseException(msg, jp.getTokenLocation());
    }

    /**
     * Throws unless the token is the expected one.
     */
    public static void expect(JsonParser jp,
                              JsonToken token,
                              JsonToken expected) {
        if (token != expected) {
            throw createParseException(
                "Expected " + expected + ", found " + token, jp);
        }
    }

    private static Long readLong(JsonParser jp, JsonToken token)
        throws IOException {

        if (token == JsonToken.VALUE_NUMBER_INT) {
            return jp.getLongValue();
        }
        expect(jp, token, JsonToken.VALUE_STRING);
        try {
            return Long.parseLong(jp.getText());
        } catch (NumberFormatException nfe) {
            throw createParseException("Invalid integer: " + jp.getText(), jp);
        }
    }

    private static Double readDouble(JsonParser jp, JsonToken token)
        throws IOException {

        if (token == JsonToken.VALUE_NUMBER_INT ||
            token == JsonToken.VALUE_NUMBER_FLOAT) {
            return jp.getDoubleValue();
        }
        /* NaN and the infinities are sent as strings */
        expect(jp, token, JsonToken.VALUE_STRING);
        try {
            return Double.parseDouble(jp.getText());
        } catch (NumberFormatException nfe) {
            throw createParseException("Invalid double: " + jp.getText(), jp);
        }
    }

    /*
     * {"values":[...]}, where values may be absent for an empty array
     */
    private static List<Object> readArray(JsonParser jp) throws IOException {
        expect(jp, jp.currentToken(), JsonToken.START_OBJECT);
        List<Object> list = new ArrayList<>();
        JsonToken token;
        while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
            expect(jp, token, JsonToken.FIELD_NAME);
            String name = jp.getCurrentName();
            token = jp.nextToken();
            if (!VALUES.equals(name)) {
                jp.skipChildren();
                continue;
            }
            expect(jp, token, JsonToken.START_ARRAY);
            while (jp.nextToken() != JsonToken.END_ARRAY) {
                list.add(readValue(jp));
            }
        }
        return list;
    }

    /*
     * {"fields":{...}}, where fields may be absent for an empty map
     */
    private static Map<String, Object> readMap(JsonParser jp)
        throws IOException {

        expect(jp, jp.currentToken(), JsonToken.START_OBJECT);
        Map<String, Object> map = new LinkedHashMap<>();
        JsonToken token;
        while ((token = jp.nextToken()) != JsonToken.END_OBJECT) {
            expect(jp, token, JsonToken.FIELD_NAME);
            String name = jp.getCurrentName();
            jp.nextToken();
            if (FIELDS.equals(name)) {
                map.putAll(readFields(jp));
            } else {
                jp.skipChildren();
            }
        }
        return map;
    }
}

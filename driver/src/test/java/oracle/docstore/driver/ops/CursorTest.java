/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.ops;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class CursorTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testEquality() {
        Cursor a = Cursor.fromBytes(bytes("abc"));
        Cursor b = Cursor.fromBytes(bytes("abc"), Arrays.asList("x", 1L));
        Cursor c = Cursor.fromBytes(bytes("abd"));

        /* ordering values are not part of identity */
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertTrue(a.getValues().isEmpty());
        assertEquals(2, b.getValues().size());
    }

    @Test
    public void testBase64() {
        Cursor a = Cursor.fromBytes(bytes("hello"));
        assertEquals("aGVsbG8=", a.toBase64());
        assertEquals(a, Cursor.fromBase64("aGVsbG8="));
    }

    @Test
    public void testImmutable() {
        byte[] token = bytes("abc");
        Cursor a = Cursor.fromBytes(token);
        token[0] = 'z';
        a.toBytes()[1] = 'z';
        assertArrayEquals(bytes("abc"), a.toBytes());
    }

    @Test
    public void testValuesCopied() {
        List<Object> values = new ArrayList<>();
        values.add("x");
        Cursor a = Cursor.fromBytes(bytes("abc"), values);
        String before = a.toString();

        values.add("y");
        assertEquals(1, a.getValues().size());
        assertEquals("x", a.getValues().get(0));
        assertEquals(before, a.toString());
        try {
            a.getValues().add("z");
            fail("values should be read only");
        } catch (UnsupportedOperationException uoe) {
            // expected
        }
    }

    @Test
    public void testInvalid() {
        try {
            Cursor.fromBytes(new byte[0]);
            fail("an empty token should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            Cursor.fromBytes(null);
            fail("a null token should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            Cursor.fromBase64("");
            fail("an empty string should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            Cursor.fromBase64("not base64!");
            fail("invalid base64 should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }
}

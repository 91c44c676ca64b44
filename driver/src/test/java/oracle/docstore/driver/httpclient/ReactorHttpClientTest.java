/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.httpclient;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;

import com.sun.net.httpserver.HttpServer;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import reactor.test.StepVerifier;

/**
 * Tests for ReactorHttpClient and ConnectionPoolConfig
 */
public class ReactorHttpClientTest {

    private static HttpServer server;

    @BeforeClass
    public static void staticSetUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        /* echoes the request body and the x-test header */
        server.createContext("/echo", exchange -> {
            byte[] body = exchange.getRequestBody().readAllBytes();
            exchange.getResponseHeaders().set(
                "x-test", exchange.getRequestHeaders().getFirst("x-test"));
            exchange.sendResponseHeaders(200, body.length == 0 ? -1 :
                                         body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.createContext("/missing", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterClass
    public static void staticTearDown() {
        server.stop(0);
    }

    private static ReactorHttpClient client(ConnectionPoolConfig pool) {
        return ReactorHttpClient.builder()
            .host("localhost")
            .port(server.getAddress().getPort())
            .connectionPoolConfig(pool)
            .build();
    }

    @Test
    public void testPost() {
        ReactorHttpClient client =
            client(ConnectionPoolConfig.builder().build());
        try {
            HttpHeaders headers = new DefaultHttpHeaders().set("x-test", "42");
            StepVerifier.create(client.postRequest(
                    "/echo", headers,
                    "{\"a\":1}".getBytes(StandardCharsets.UTF_8)))
                .assertNext(response -> {
                    assertEquals(200, response.getStatusCode());
                    assertTrue(response.isSuccess());
                    assertEquals("{\"a\":1}", response.getBody());
                    assertEquals("42", response.getHeaders().get("x-test"));
                })
                .verifyComplete();
        } finally {
            client.shutdown();
        }
    }

    @Test
    public void testEmptyResponse() {
        /* a single connection pool opens a connection per request */
        ReactorHttpClient client = client(
            ConnectionPoolConfig.builder().maxConnections(1).build());
        try {
            StepVerifier.create(client.postRequest(
                    "/missing", new DefaultHttpHeaders(), new byte[0]))
                .assertNext(response -> {
                    assertEquals(404, response.getStatusCode());
                    assertFalse(response.isSuccess());
                    assertEquals("", response.getBody());
                })
                .verifyComplete();
        } finally {
            client.shutdown();
        }
    }

    @Test
    public void testBuilder() {
        ReactorHttpClient client = ReactorHttpClient.builder()
            .host("example.com")
            .port(9000)
            .maxHeaderSize(0)
            .build();
        assertEquals("example.com", client.getHost());
        assertEquals(9000, client.getPort());
        assertNull(client.getSslContext());
        assertEquals(ConnectionPoolConfig.DEFAULT_MAX_CONNECTIONS,
                     client.getConnectionPoolConfig().getMaxConnections());
        client.shutdown();

        try {
            ReactorHttpClient.builder().port(0);
            fail("port 0 should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            ReactorHttpClient.builder().host("");
            fail("an empty host should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            ReactorHttpClient.builder().maxInitialLineLength(-1);
            fail("a negative length should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }

    @Test
    public void testPoolConfig() {
        ConnectionPoolConfig defaults = ConnectionPoolConfig.builder().build();
        assertEquals(100, defaults.getMaxConnections());
        assertEquals(-1, defaults.getMaxPendingAcquires());
        assertEquals(45_000, defaults.getPendingAcquireTimeout());
        assertEquals(60_000, defaults.getMaxIdleTime());
        assertEquals(300_000, defaults.getMaxLifetime());

        ConnectionPoolConfig custom = ConnectionPoolConfig.builder()
            .maxConnections(5)
            .maxPendingAcquires(10)
            .pendingAcquireTimeout(1000)
            .maxIdleTime(2000)
            .maxLifetime(3000)
            .build();
        assertEquals(5, custom.getMaxConnections());
        assertEquals(10, custom.getMaxPendingAcquires());
        assertEquals(3000, custom.getMaxLifetime());

        ConnectionPoolConfig.Builder builder = ConnectionPoolConfig.builder();
        try {
            builder.maxConnections(0);
            fail("zero connections should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            builder.maxPendingAcquires(0);
            fail("zero pending acquires should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
        try {
            builder.maxIdleTime(-5);
            fail("a negative idle time should have failed");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }
}

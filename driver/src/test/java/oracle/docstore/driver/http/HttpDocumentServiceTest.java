/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
package oracle.docstore.driver.http;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import oracle.docstore.driver.DocStoreConfig;
import oracle.docstore.driver.DocStoreHandle;
import oracle.docstore.driver.DocStoreHandleFactory;
import oracle.docstore.driver.NotConnectedException;
import oracle.docstore.driver.RequestTimeoutException;
import oracle.docstore.driver.ServiceUnavailableException;
import oracle.docstore.driver.TransportException;
import oracle.docstore.driver.ops.CollectionReference;
import oracle.docstore.driver.ops.DocumentSnapshot;
import oracle.docstore.driver.ops.ReadSnapshot;
import oracle.docstore.driver.ops.ResultSequence;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

/**
 * The HTTP transport against a local fake service
 */
public class HttpDocumentServiceTest {

    private static final String DB = "projects/p/databases/testdb";
    private static final String ROOT = DB + "/documents";

    private static HttpServer server;
    private static ExecutorService executor;

    /* requests seen by the server, as "path body" */
    private static final List<String> requests =
        Collections.synchronizedList(new ArrayList<>());

    /* if set, every response has this status and body */
    private static volatile int errorStatus;
    private static volatile String errorBody;

    private DocStoreHandle handle;

    @BeforeClass
    public static void staticSetUp() throws Exception {
        executor = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.setExecutor(executor);
        server.createContext("/v1/", HttpDocumentServiceTest::handle);
        server.start();
    }

    @AfterClass
    public static void staticTearDown() throws Exception {
        server.stop(0);
        executor.shutdownNow();
    }

    @Before
    public void setUp() {
        requests.clear();
        errorStatus = 0;
        errorBody = null;
        handle = DocStoreHandleFactory.createHandle(config(2000));
    }

    @After
    public void tearDown() {
        handle.close();
    }

    private static DocStoreConfig config(int timeoutMs) {
        return new DocStoreConfig("http://localhost:" +
                                  server.getAddress().getPort())
            .setProjectId("p")
            .setDatabaseId("testdb")
            .setRequestTimeout(timeoutMs);
    }

    private static void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String body = new String(exchange.getRequestBody().readAllBytes(),
                                 StandardCharsets.UTF_8);
        requests.add(path + " " + body);

        int status = 200;
        String response;
        if (errorStatus != 0) {
            status = errorStatus;
            response = errorBody;
        } else if (path.endsWith(":runQuery")) {
            response = body.contains("startCursor") ?
                page("b", null, "NO_MORE_RESULTS") :
                page("a", "ZW5k", "NOT_FINISHED");
        } else if (path.endsWith(":beginTransaction")) {
            response = "{\"transaction\":\"dDE=\"}";
        } else if (path.endsWith(":batchGet")) {
            response = "[{\"found\":{\"name\":\"" + ROOT + "/users/a\"," +
                "\"fields\":{\"n\":{\"integerValue\":\"1\"}}}," +
                "\"readTime\":\"2024-01-01T00:00:00Z\"}]";
        } else if (path.endsWith(":rollback")) {
            response = "{}";
        } else if (path.endsWith(":listCollectionIds")) {
            if (path.contains("slow")) {
                try {
                    Thread.sleep(3000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
            response = "{\"collectionIds\":[\"users\"]}";
        } else if (path.endsWith(":commit")) {
            response = "{\"commitTime\":\"2024-01-01T00:00:00Z\"}";
        } else {
            status = 404;
            response = "";
        }

        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status,
                                     bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static String page(String id, String endCursor, String status) {
        return "{\"batch\":{\"results\":[{\"document\":{\"name\":\"" +
            ROOT + "/users/" + id + "\"},\"cursor\":\"YzE=\"}]," +
            (endCursor == null ? "" : "\"endCursor\":\"" + endCursor + "\",") +
            "\"moreResults\":\"" + status + "\"}}";
    }

    private static int count(String method) {
        int n = 0;
        synchronized (requests) {
            for (String r : requests) {
                if (r.contains(":" + method + " ")) {
                    n++;
                }
            }
        }
        return n;
    }

    @Test
    public void testPaging() {
        CollectionReference users = handle.col("users");
        ResultSequence first = handle.runQuery(users.query());
        assertEquals(1, first.size());
        assertTrue(first.hasMore());
        assertEquals("/v1/" + ROOT + ":runQuery " +
                     "{\"structuredQuery\":{\"from\":" +
                     "[{\"collectionId\":\"users\"}]}}",
                     requests.get(0));

        ResultSequence second = first.fetchNext();
        assertFalse(second.hasMore());
        assertEquals("b", second.getDocuments().get(0).getDocumentId());
        assertTrue(requests.get(1).contains("\"startCursor\":\"ZW5k\""));
        assertNull(second.fetchNext());
        assertEquals(2, count("runQuery"));
    }

    @Test
    public void testReadOnlyTransaction() {
        try (ReadSnapshot snapshot = handle.readOnlyTransaction()) {
            DocumentSnapshot a = snapshot.getDocument("users/a");
            assertEquals(1L, a.get("n"));
            Iterator<DocumentSnapshot> users = snapshot.get("users");
            int n = 0;
            while (users.hasNext()) {
                users.next();
                n++;
            }
            assertEquals(2, n);
        }
        assertEquals(1, count("beginTransaction"));
        assertEquals(1, count("rollback"));
        synchronized (requests) {
            for (String r : requests) {
                if (r.contains(":batchGet ") || r.contains(":runQuery ") ||
                    r.contains(":rollback ")) {
                    assertTrue(r, r.contains("\"transaction\":\"dDE=\""));
                }
            }
        }
    }

    @Test
    public void testCommitAndCols() {
        assertEquals(1, handle.cols().size());
        assertTrue(requests.get(0).startsWith(
                       "/v1/" + ROOT + ":listCollectionIds"));
        assertEquals("2024-01-01T00:00:00Z",
                     handle.batch().delete(handle.doc("users/a"))
                     .commit().toString());
        assertTrue(requests.get(1).contains(
                       "{\"writes\":[{\"delete\":\"" + ROOT + "/users/a\"}]}"));
    }

    @Test
    public void testServiceError() {
        errorStatus = 404;
        errorBody = "{\"error\":{\"code\":404,\"message\":\"no database\"," +
            "\"status\":\"NOT_FOUND\"}}";
        try {
            handle.runQuery(handle.col("users").query());
            fail("a 404 should have failed");
        } catch (TransportException te) {
            assertFalse(te instanceof ServiceUnavailableException);
            assertEquals(404, te.getHttpStatus());
            assertEquals("NOT_FOUND", te.getServiceStatus());
            assertTrue(te.getMessage().contains("no database"));
            assertFalse(te.okToRetry());
        }
    }

    @Test
    public void testUnavailable() {
        errorStatus = 503;
        errorBody = "Service Unavailable";
        try {
            handle.cols();
            fail("a 503 should have failed");
        } catch (ServiceUnavailableException sue) {
            assertEquals(503, sue.getHttpStatus());
            assertNull(sue.getServiceStatus());
            assertTrue(sue.okToRetry());
        }

        errorStatus = 500;
        errorBody = "{\"error\":{\"code\":14,\"message\":\"try later\"," +
            "\"status\":\"UNAVAILABLE\"}}";
        try {
            handle.cols();
            fail("an UNAVAILABLE status should have failed");
        } catch (ServiceUnavailableException sue) {
            assertEquals("UNAVAILABLE", sue.getServiceStatus());
        }
    }

    @Test
    public void testMalformedResponse() {
        errorStatus = 200;
        errorBody = "{\"batch\":";
        try {
            handle.runQuery(handle.col("users").query());
            fail("a truncated response should have failed");
        } catch (TransportException te) {
            // expected
        }
    }

    @Test
    public void testTimeout() {
        try (DocStoreHandle slow = DocStoreHandleFactory.createHandle(
                 config(300))) {
            slow.getService().listCollectionIds(ROOT + "/slow/doc");
            fail("the request should have timed out");
        } catch (RequestTimeoutException rte) {
            assertEquals(300, rte.getTimeoutMs());
            assertTrue(rte.okToRetry());
        }
    }

    @Test
    public void testConnectionFailure() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        DocStoreConfig config = new DocStoreConfig("http://localhost:" + port)
            .setProjectId("p")
            .setRequestTimeout(2000);
        try (DocStoreHandle unreachable =
                 DocStoreHandleFactory.createHandle(config)) {
            unreachable.cols();
            fail("connecting to a closed port should have failed");
        } catch (TransportException te) {
            assertEquals(0, te.getHttpStatus());
        }
    }

    @Test
    public void testClosedHandle() {
        handle.close();
        assertTrue(handle.isClosed());
        try {
            handle.runQuery(handle.col("users").query());
            fail("a closed handle cannot run queries");
        } catch (NotConnectedException nce) {
            // expected
        }
        handle.close();
    }
}

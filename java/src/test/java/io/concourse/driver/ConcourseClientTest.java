package io.concourse.driver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.concourse.driver.internal.Json;
import io.concourse.driver.resolve.CallArguments;
import io.concourse.driver.transaction.TransactionState;
import io.concourse.driver.transport.Credential;
import io.concourse.driver.transport.JsonValueCodec;
import io.concourse.driver.transport.SessionHandshake;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import static org.junit.jupiter.api.Assertions.*;

class ConcourseClientTest {

    private HttpServer server;
    private URI baseUri;

    private final List<CapturedRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, HttpHandler> operations = new ConcurrentHashMap<>();

    private final DelegatingHandler loginHandler = new DelegatingHandler();
    private final DelegatingHandler logoutHandler = new DelegatingHandler();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        loginHandler.delegate = exchange -> {
            capture(exchange);
            respond(exchange, 200, "{\"token\":\"tok-1\"}");
        };
        logoutHandler.delegate = exchange -> {
            capture(exchange);
            respond(exchange, 200, "{}");
        };

        server.createContext("/login", loginHandler);
        server.createContext("/logout", logoutHandler);
        server.createContext("/rpc/", new RpcHandler());
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        requests.clear();
        operations.clear();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void getSendsKeyAndRecordWithSessionCredential() throws Exception {
        operations.put("getKeyRecord", exchange -> respond(exchange, 200,
            "{\"result\":{\"type\":\"STRING\",\"data\":\"Jeff Nelson\"}}"));

        try (ConcourseClient client = ConcourseClient.connect(config())) {
            assertEquals("Jeff Nelson", client.get("name", 1));
        }

        CapturedRequest login = request("/login");
        assertEquals("admin", login.body().path("username").asText());
        assertEquals("admin", login.body().path("password").asText());

        CapturedRequest get = request("/rpc/getKeyRecord");
        assertEquals("[\"name\",1]", get.body().path("params").toString());
        assertEquals("tok-1", get.body().path("credential").asText());
        assertFalse(get.body().has("transaction"));
    }

    @Test
    void selectWithPhraseTimestampUsesTimestrVariant() throws Exception {
        operations.put("selectCclTimestr", exchange -> respond(exchange, 200,
            "{\"result\":{\"1\":{\"age\":[{\"type\":\"INTEGER\",\"data\":31}]}}}"));

        try (ConcourseClient client = ConcourseClient.connect(config())) {
            Object result = client.select(CallArguments.builder()
                .criteria("age > 30")
                .timestamp("last month")
                .build());

            assertEquals(Map.of(1L, Map.of("age", List.of(31))), result);
        }

        CapturedRequest select = request("/rpc/selectCclTimestr");
        assertEquals("[\"age > 30\",\"last month\"]", select.body().path("params").toString());
    }

    @Test
    void stagedWritesCarryTokenAndConflictReturnsToAutocommit() throws Exception {
        AtomicInteger stages = new AtomicInteger();
        operations.put("stage", exchange -> respond(exchange, 200, "{\"result\":\"txn-" + stages.incrementAndGet() + "\"}"));
        operations.put("addKeyValueRecord", exchange -> respond(exchange, 200, "{\"result\":true}"));
        operations.put("commit", exchange -> respond(exchange, 409,
            "{\"code\":\"TRANSACTION_CONFLICT\",\"message\":\"record 1 changed\"}"));
        operations.put("getKeyRecord", exchange -> respond(exchange, 200, "{\"result\":null}"));
        operations.put("abort", exchange -> respond(exchange, 200, "{\"result\":null}"));

        try (ConcourseClient client = ConcourseClient.connect(config())) {
            client.stage();
            assertEquals(TransactionState.STAGED, client.transactionState());
            assertEquals(Boolean.TRUE, client.add("name", "Jeff", 1));
            assertEquals(Boolean.TRUE, client.add("age", 31L, 1));

            TransactionConflictException ex = assertThrows(TransactionConflictException.class, client::commit);
            assertEquals("record 1 changed", ex.getMessage());
            assertEquals(TransactionState.AUTOCOMMIT, client.transactionState());

            assertNull(client.get("name", 1));

            client.stage();
            client.add("name", "Jeff", 1);
            client.abort();
        }

        List<CapturedRequest> writes = requests("/rpc/addKeyValueRecord");
        assertEquals(3, writes.size());
        assertEquals("txn-1", writes.get(0).body().path("transaction").asText());
        assertEquals("txn-1", writes.get(1).body().path("transaction").asText());
        assertEquals("txn-2", writes.get(2).body().path("transaction").asText());
        assertEquals("txn-1", request("/rpc/commit").body().path("transaction").asText());
        assertEquals("STRING", writes.get(0).body().path("params").get(1).path("type").asText());
        assertEquals("LONG", writes.get(1).body().path("params").get(1).path("type").asText());
        assertFalse(request("/rpc/getKeyRecord").body().has("transaction"));
    }

    @Test
    void connectFailsWhenCredentialsAreRejected() {
        loginHandler.delegate = exchange -> respond(exchange, 401,
            "{\"code\":\"AUTHENTICATION_FAILED\",\"message\":\"invalid username/password\"}");

        AuthenticationException ex = assertThrows(AuthenticationException.class, () -> ConcourseClient.connect(config()));
        assertEquals(401, ex.getStatusCode());
        assertEquals("invalid username/password", ex.getMessage());
    }

    @Test
    void invalidArgumentsNeverReachTheServer() throws Exception {
        try (ConcourseClient client = ConcourseClient.connect(config())) {
            assertThrows(AmbiguousArgumentsException.class, () -> client.get(CallArguments.builder()
                .key("name")
                .record(1)
                .records(1, 2)
                .build()));
            assertThrows(AmbiguousArgumentsException.class, () -> client.set(CallArguments.builder()
                .key("name")
                .value("Jeff")
                .record(1)
                .records(1, 2)
                .build()));
            MissingRequiredArgumentsException missing = assertThrows(MissingRequiredArgumentsException.class,
                () -> client.select(CallArguments.empty()));
            assertEquals("criteria or record", missing.getRequired());
        }

        assertTrue(requests.stream().noneMatch(r -> r.path().startsWith("/rpc/")), paths());
    }

    @Test
    void transportFailureMakesClientUnusable() throws Exception {
        ConcourseClient client = ConcourseClient.connect(config());
        server.stop(0);
        server = null;

        assertThrows(TransportException.class, client::time);
        TransportException again = assertThrows(TransportException.class, client::getServerVersion);
        assertTrue(again.getMessage().contains("unusable"));

        client.close();
        assertTrue(client.isClosed());
    }

    @Test
    void closeAbortsStagedTransactionAndLogsOut() throws Exception {
        operations.put("stage", exchange -> respond(exchange, 200, "{\"result\":\"txn-3\"}"));
        operations.put("abort", exchange -> respond(exchange, 200, "{\"result\":null}"));

        ConcourseClient client = ConcourseClient.connect(config());
        client.stage();
        client.close();
        client.close();

        assertEquals("txn-3", request("/rpc/abort").body().path("transaction").asText());
        assertEquals("tok-1", request("/logout").body().path("credential").asText());
        assertEquals(1, requests.stream().filter(r -> r.path().equals("/logout")).count());

        TransportException ex = assertThrows(TransportException.class, client::time);
        assertTrue(ex.getMessage().contains("closed"));
    }

    @Test
    void closeSkipsLogoutWhenDisabled() throws Exception {
        Config config = Config.builder()
            .baseUrl(baseUri.toString())
            .httpClient(HttpClient.newHttpClient())
            .logoutOnClose(false)
            .build();

        ConcourseClient.connect(config).close();

        assertTrue(requests.stream().noneMatch(r -> r.path().equals("/logout")), paths());
    }

    @Test
    void timeAndServerMetadata() throws Exception {
        operations.put("time", exchange -> respond(exchange, 200, "{\"result\":1609459200000000}"));
        operations.put("timePhrase", exchange -> respond(exchange, 200, "{\"result\":1608854400000000}"));
        operations.put("getServerVersion", exchange -> respond(exchange, 200, "{\"result\":\"0.11.0\"}"));

        try (ConcourseClient client = ConcourseClient.connect(config())) {
            assertEquals(1609459200000000L, client.time());
            assertEquals(1608854400000000L, client.resolvePhrase("1 week ago"));
            assertEquals("0.11.0", client.getServerVersion());
        }

        assertEquals("[\"1 week ago\"]", request("/rpc/timePhrase").body().path("params").toString());
    }

    @Test
    void transportFailureDuringCommitIsFatalToTheConnection() throws Exception {
        RecordingInvoker invoker = new RecordingInvoker()
            .respondWith("stage", TextNode.valueOf("txn-7"))
            .respond("commit", call -> {
                throw new TransportException("connection reset");
            });
        RecordingHandshake handshake = new RecordingHandshake();

        ConcourseClient client = ConcourseClient.connect(Config.builder().build(), handshake, invoker, new JsonValueCodec());
        client.stage();

        assertThrows(TransportException.class, client::commit);
        assertEquals(TransactionState.AUTOCOMMIT, client.transactionState());
        assertThrows(TransportException.class, client::stage);
        assertEquals(2, invoker.calls().size());

        client.close();
        assertTrue(invoker.isClosed());
        assertEquals(0, handshake.logouts.get());
    }

    @Test
    void abortOnBrokenConnectionStillReturnsToAutocommit() throws Exception {
        RecordingInvoker invoker = new RecordingInvoker()
            .respondWith("stage", TextNode.valueOf("txn-9"))
            .respond("getKeyRecord", call -> {
                throw new TransportException("connection reset");
            });

        ConcourseClient client = ConcourseClient.connect(Config.builder().build(), new RecordingHandshake(), invoker,
            new JsonValueCodec());
        client.stage();
        assertThrows(TransportException.class, () -> client.get("name", 1));
        assertEquals(TransactionState.STAGED, client.transactionState());

        assertThrows(TransportException.class, client::abort);
        assertEquals(TransactionState.AUTOCOMMIT, client.transactionState());
        assertEquals(List.of("stage", "getKeyRecord"),
            invoker.calls().stream().map(RecordingInvoker.Call::name).collect(Collectors.toList()));

        client.close();
    }

    @Test
    void commitOnBrokenConnectionStillReturnsToAutocommit() throws Exception {
        RecordingInvoker invoker = new RecordingInvoker()
            .respondWith("stage", TextNode.valueOf("txn-9"))
            .respond("addKeyValueRecord", call -> {
                throw new TransportException("connection reset");
            });

        ConcourseClient client = ConcourseClient.connect(Config.builder().build(), new RecordingHandshake(), invoker,
            new JsonValueCodec());
        client.stage();
        assertThrows(TransportException.class, () -> client.add("name", "Jeff", 1));

        TransportException ex = assertThrows(TransportException.class, client::commit);
        assertTrue(ex.getMessage().contains("unusable"));
        assertEquals(TransactionState.AUTOCOMMIT, client.transactionState());
        assertEquals(2, invoker.calls().size());

        client.close();
    }

    @Test
    void failedLoginReleasesTheInvoker() {
        RecordingInvoker invoker = new RecordingInvoker();
        SessionHandshake rejecting = new SessionHandshake() {
            @Override
            public Credential login(String username, String password, String environment) throws ConcourseException {
                throw new AuthenticationException(401, "invalid username/password");
            }

            @Override
            public void logout(Credential credential, String environment) {
                fail("logout must not be called");
            }
        };

        assertThrows(AuthenticationException.class,
            () -> ConcourseClient.connect(Config.builder().build(), rejecting, invoker, new JsonValueCodec()));
        assertTrue(invoker.isClosed());
    }

    private Config config() {
        return Config.builder()
            .baseUrl(baseUri.toString())
            .httpClient(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build())
            .httpTimeout(Duration.ofSeconds(5))
            .build();
    }

    private CapturedRequest request(String path) {
        return requests.stream()
            .filter(r -> r.path().equals(path))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no request to " + path + " in " + paths()));
    }

    private List<CapturedRequest> requests(String path) {
        return requests.stream().filter(r -> r.path().equals(path)).collect(Collectors.toList());
    }

    private String paths() {
        return requests.stream().map(CapturedRequest::path).collect(Collectors.joining(", "));
    }

    private void capture(HttpExchange exchange) throws IOException {
        byte[] body = exchange.getRequestBody().readAllBytes();
        JsonNode node = Json.mapper().readTree(new String(body, StandardCharsets.UTF_8));
        requests.add(new CapturedRequest(exchange.getRequestURI().getPath(), node));
    }

    private static final class RecordingHandshake implements SessionHandshake {
        final AtomicInteger logouts = new AtomicInteger();

        @Override
        public Credential login(String username, String password, String environment) {
            return new Credential("tok-" + username);
        }

        @Override
        public void logout(Credential credential, String environment) {
            logouts.incrementAndGet();
        }
    }

    private record CapturedRequest(String path, JsonNode body) {
    }

    private class RpcHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            capture(exchange);
            String name = exchange.getRequestURI().getPath().substring("/rpc/".length());
            HttpHandler operation = operations.get(name);
            if (operation == null) {
                respond(exchange, 500, "{\"code\":\"UNKNOWN_OPERATION\",\"message\":\"" + name + "\"}");
            } else {
                operation.handle(exchange);
            }
        }
    }

    private static class DelegatingHandler implements HttpHandler {
        volatile HttpHandler delegate;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (delegate == null) {
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            } else {
                delegate.handle(exchange);
            }
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}

package ru.aritmos.clusterreceiver.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.credential.ActingIdentity;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpActionEngineClientTest {

    private static final ActingIdentity ACTOR = new ActingIdentity("u1", "p1", "trust-token-1", true);

    private static HttpActionEngineClient client(String baseUrl) {
        ClusterReceiverProperties props = new ClusterReceiverProperties();
        props.getActionEngine().setBaseUrl(baseUrl);
        props.getActionEngine().setTimeoutMs(2000);
        return new HttpActionEngineClient(props, new ObjectMapper());
    }

    private static ActionRequest request() {
        return new ActionRequest(ClusterAction.CLUSTER_SCALE_OUT, "c0ffee00-1111-2222-3333-444455556666",
                Map.of("count", "2"), ACTOR, "Receiver r-1", "req-1");
    }

    @Test
    void shouldSubmitActionWithActorTokenAndInputs() throws Exception {
        AtomicReference<String> body = new AtomicReference<>();
        AtomicReference<String> token = new AtomicReference<>();
        AtomicReference<String> requestId = new AtomicReference<>();
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/actions", exchange -> {
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            token.set(exchange.getRequestHeaders().getFirst("X-Auth-Token"));
            requestId.set(exchange.getRequestHeaders().getFirst("X-OpenStack-Request-Id"));
            byte[] bytes = "{\"action\":\"act-42\"}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(202, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        try {
            ActionHandle handle = client("http://localhost:" + server.getAddress().getPort()).submit(request());

            assertEquals("act-42", handle.actionId());
            assertEquals("trust-token-1", token.get());
            assertEquals("req-1", requestId.get());
            JsonNode action = new ObjectMapper().readTree(body.get()).path("action");
            assertEquals("CLUSTER_SCALE_OUT", action.path("action").asText());
            assertEquals("c0ffee00-1111-2222-3333-444455556666", action.path("target").asText());
            assertEquals("2", action.path("inputs").path("count").asText());
            assertEquals("Receiver r-1", action.path("cause").asText());
            assertEquals("cluster_scale_out_c0ffee00", action.path("name").asText());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void shouldReadActionIdFromLocationWhenBodyEmpty() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/actions", exchange -> {
            exchange.getResponseHeaders().add("Location", "/v1/actions/act-7");
            exchange.sendResponseHeaders(202, -1);
            exchange.close();
        });
        server.start();
        try {
            assertEquals("act-7", client("http://localhost:" + server.getAddress().getPort()).submit(request()).actionId());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void shouldMapClientErrorToDispatchRejectedAndServerErrorToUnavailable() throws Exception {
        AtomicInteger status = new AtomicInteger(400);
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/actions", exchange -> {
            exchange.sendResponseHeaders(status.get(), -1);
            exchange.close();
        });
        server.start();
        try {
            HttpActionEngineClient client = client("http://localhost:" + server.getAddress().getPort());

            ReceiverException rejected = assertThrows(ReceiverException.class, () -> client.submit(request()));
            assertEquals(ReceiverException.ErrorKind.DISPATCH_REJECTED, rejected.kind());

            status.set(503);
            ReceiverException unavailable = assertThrows(ReceiverException.class, () -> client.submit(request()));
            assertEquals(ReceiverException.ErrorKind.UNAVAILABLE, unavailable.kind());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void refusedTokenShouldBeUnauthorized() throws Exception {
        AtomicInteger status = new AtomicInteger(401);
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/actions", exchange -> {
            exchange.sendResponseHeaders(status.get(), -1);
            exchange.close();
        });
        server.start();
        try {
            HttpActionEngineClient client = client("http://localhost:" + server.getAddress().getPort());

            ReceiverException unauthorized = assertThrows(ReceiverException.class, () -> client.submit(request()));
            assertEquals(ReceiverException.ErrorKind.UNAUTHORIZED, unauthorized.kind());

            status.set(403);
            ReceiverException forbidden = assertThrows(ReceiverException.class, () -> client.submit(request()));
            assertEquals(ReceiverException.ErrorKind.UNAUTHORIZED, forbidden.kind());

            status.set(409);
            ReceiverException conflict = assertThrows(ReceiverException.class, () -> client.submit(request()));
            assertEquals(ReceiverException.ErrorKind.DISPATCH_REJECTED, conflict.kind());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void missingBaseUrlShouldBeUnavailable() {
        HttpActionEngineClient client = client(null);

        ReceiverException e = assertThrows(ReceiverException.class, () -> client.submit(request()));
        assertEquals(ReceiverException.ErrorKind.UNAVAILABLE, e.kind());
    }
}

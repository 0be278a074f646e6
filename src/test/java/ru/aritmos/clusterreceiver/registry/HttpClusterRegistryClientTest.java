package ru.aritmos.clusterreceiver.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.security.RequesterIdentity;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpClusterRegistryClientTest {

    private static final RequesterIdentity REQUESTER = new RequesterIdentity("u1", "p1", null, List.of("member"), "user-good");

    @Test
    void shouldResolveClusterByNameAndForwardRequesterToken() throws Exception {
        AtomicReference<String> token = new AtomicReference<>();
        AtomicReference<String> project = new AtomicReference<>();
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/clusters/", exchange -> {
            token.set(exchange.getRequestHeaders().getFirst("X-Auth-Token"));
            project.set(exchange.getRequestHeaders().getFirst("X-Project-Id"));
            String path = exchange.getRequestURI().getPath();
            if (!path.endsWith("/web-tier")) {
                exchange.sendResponseHeaders(404, -1);
                exchange.close();
                return;
            }
            byte[] bytes = "{\"cluster\":{\"id\":\"c-123\",\"name\":\"web-tier\",\"project\":\"p1\"}}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        try {
            ClusterReceiverProperties props = new ClusterReceiverProperties();
            props.getClusterRegistry().setBaseUrl("http://localhost:" + server.getAddress().getPort());
            HttpClusterRegistryClient client = new HttpClusterRegistryClient(props, new ObjectMapper());

            Optional<ClusterRef> found = client.find("web-tier", REQUESTER);
            Optional<ClusterRef> missing = client.find("db-tier", REQUESTER);

            assertEquals(new ClusterRef("c-123", "web-tier", "p1"), found.orElseThrow());
            assertTrue(missing.isEmpty());
            assertEquals("user-good", token.get());
            assertEquals("p1", project.get());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void serverErrorShouldBeUnavailable() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/clusters/", exchange -> {
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        server.start();
        try {
            ClusterReceiverProperties props = new ClusterReceiverProperties();
            props.getClusterRegistry().setBaseUrl("http://localhost:" + server.getAddress().getPort());
            HttpClusterRegistryClient client = new HttpClusterRegistryClient(props, new ObjectMapper());

            ReceiverException e = assertThrows(ReceiverException.class, () -> client.find("web-tier", REQUESTER));
            assertEquals(ReceiverException.ErrorKind.UNAVAILABLE, e.kind());
        } finally {
            server.stop(0);
        }
    }
}

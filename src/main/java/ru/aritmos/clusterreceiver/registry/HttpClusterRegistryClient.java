package ru.aritmos.clusterreceiver.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.security.RequesterIdentity;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * HTTP-клиент реестра кластеров: {@code GET {base}/v1/clusters/{ref}} с токеном запрашивающего.
 * <p>
 * 404 и 403 означают, что кластер не найден или невидим запрашивающему.
 */
@Singleton
public class HttpClusterRegistryClient implements ClusterRegistryClient {

    private static final Logger log = LoggerFactory.getLogger(HttpClusterRegistryClient.class);

    private final ClusterReceiverProperties.ClusterRegistry cfg;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public HttpClusterRegistryClient(ClusterReceiverProperties properties, ObjectMapper objectMapper) {
        this.cfg = properties.getClusterRegistry();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .build();
    }

    @Override
    public Optional<ClusterRef> find(String clusterRef, RequesterIdentity requester) {
        if (clusterRef == null || clusterRef.isBlank()) {
            return Optional.empty();
        }
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + "/v1/clusters/" + URLEncoder.encode(clusterRef.trim(), StandardCharsets.UTF_8)))
                .timeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .header("Accept", "application/json")
                .GET();
        if (requester != null && requester.token() != null) {
            b.header("X-Auth-Token", requester.token());
        }
        if (requester != null && requester.projectId() != null) {
            b.header("X-Project-Id", requester.projectId());
        }

        HttpResponse<String> resp = send(b.build());
        int status = resp.statusCode();
        if (status == 404 || status == 403) {
            log.debug("[REGISTRY] Кластер {} не найден: статус={}", clusterRef, status);
            return Optional.empty();
        }
        if (status < 200 || status >= 300) {
            throw ReceiverException.unavailable("Реестр кластеров вернул статус=" + status, null);
        }

        JsonNode cluster;
        try {
            cluster = objectMapper.readTree(resp.body()).path("cluster");
        } catch (IOException e) {
            throw ReceiverException.unavailable("Некорректный ответ реестра кластеров", e);
        }
        String id = cluster.path("id").asText(null);
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ClusterRef(id, cluster.path("name").asText(null), cluster.path("project").asText(null)));
    }

    @Override
    public void ping() {
        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + "/"))
                .timeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .GET()
                .build());
        if (resp.statusCode() >= 500) {
            throw ReceiverException.unavailable("Реестр кластеров вернул статус=" + resp.statusCode(), null);
        }
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw ReceiverException.unavailable("Таймаут обращения к реестру кластеров", e);
        } catch (IOException e) {
            throw ReceiverException.unavailable("Реестр кластеров недоступен: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ReceiverException.unavailable("Обращение к реестру кластеров прервано", e);
        }
    }

    private String baseUrl() {
        String base = cfg.getBaseUrl();
        if (base == null) {
            throw ReceiverException.unavailable("Не задан clusterreceiver.cluster-registry.base-url", null);
        }
        return base;
    }
}

package ru.aritmos.clusterreceiver.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.core.CorrelationContext;
import ru.aritmos.clusterreceiver.core.ReceiverException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * HTTP-клиент action engine на базе стандартного JDK {@link HttpClient}.
 * <p>
 * Протокол:
 * <ul>
 *   <li>{@code POST {base}/v1/actions}, тело {@code {"action": {...}}}, токен действующей идентичности в {@code X-Auth-Token};</li>
 *   <li>ответ 2xx содержит {@code {"action": "<id>"}} или {@code {"action": {"id": "<id>"}}};</li>
 *   <li>4xx трактуется как отказ engine ({@code DISPATCH_REJECTED}), 5xx и транспортные ошибки как недоступность.</li>
 * </ul>
 */
@Singleton
public class HttpActionEngineClient implements ActionEngineClient {

    private static final Logger log = LoggerFactory.getLogger(HttpActionEngineClient.class);

    private final ClusterReceiverProperties.ActionEngine cfg;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public HttpActionEngineClient(ClusterReceiverProperties properties, ObjectMapper objectMapper) {
        this.cfg = properties.getActionEngine();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .build();
    }

    @Override
    public ActionHandle submit(ActionRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode action = root.putObject("action");
        action.put("name", request.action().name().toLowerCase(Locale.ROOT) + "_" + shortTarget(request.clusterId()));
        action.put("action", request.action().name());
        action.put("target", request.clusterId());
        action.put("cause", request.cause());
        action.set("inputs", objectMapper.valueToTree(request.params()));
        if (request.actor() != null) {
            action.put("user", request.actor().userId());
            action.put("project", request.actor().projectId());
        }

        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + "/v1/actions"))
                .timeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(root.toString(), StandardCharsets.UTF_8));
        if (request.actor() != null && request.actor().token() != null) {
            b.header("X-Auth-Token", request.actor().token());
        }
        if (request.requestId() != null) {
            b.header(CorrelationContext.REQUEST_ID_HEADER, request.requestId());
        }

        HttpResponse<String> resp = send(b.build());
        int status = resp.statusCode();
        if (status == 401 || status == 403) {
            log.warn("[ENGINE] Action engine не принял токен для действия {}: статус={}", request.action(), status);
            throw ReceiverException.unauthorized("Action engine не принял токен вызова: статус=" + status);
        }
        if (status >= 400 && status < 500) {
            log.warn("[ENGINE] Action engine отклонил действие {} для кластера {}: статус={}", request.action(), request.clusterId(), status);
            throw new ReceiverException(ReceiverException.ErrorKind.DISPATCH_REJECTED,
                    "Action engine отклонил действие: статус=" + status);
        }
        if (status < 200 || status >= 300) {
            throw ReceiverException.unavailable("Action engine вернул статус=" + status, null);
        }

        String actionId = readActionId(resp.body());
        if (actionId == null) {
            actionId = resp.headers().firstValue("Location")
                    .map(l -> l.substring(l.lastIndexOf('/') + 1))
                    .filter(s -> !s.isBlank())
                    .orElseThrow(() -> new ReceiverException(ReceiverException.ErrorKind.INTERNAL,
                            "Ответ action engine не содержит идентификатор действия"));
        }
        log.info("[ENGINE] Действие {} поставлено: action={} cluster={}", actionId, request.action(), request.clusterId());
        return new ActionHandle(actionId);
    }

    @Override
    public void ping() {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + "/"))
                .timeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .GET()
                .build();
        HttpResponse<String> resp = send(req);
        if (resp.statusCode() >= 500) {
            throw ReceiverException.unavailable("Action engine вернул статус=" + resp.statusCode(), null);
        }
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw ReceiverException.unavailable("Таймаут обращения к action engine", e);
        } catch (IOException e) {
            throw ReceiverException.unavailable("Action engine недоступен: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ReceiverException.unavailable("Обращение к action engine прервано", e);
        }
    }

    private String readActionId(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body).path("action");
            String id = node.isTextual() ? node.asText() : node.path("id").asText(null);
            return id == null || id.isBlank() ? null : id;
        } catch (IOException e) {
            log.debug("[ENGINE] Ответ action engine не JSON: {}", e.getMessage());
            return null;
        }
    }

    private String baseUrl() {
        String base = cfg.getBaseUrl();
        if (base == null) {
            throw ReceiverException.unavailable("Не задан clusterreceiver.action-engine.base-url", null);
        }
        return base;
    }

    private static String shortTarget(String clusterId) {
        if (clusterId == null) {
            return "";
        }
        return clusterId.length() <= 8 ? clusterId : clusterId.substring(0, 8);
    }
}

package ru.aritmos.clusterreceiver.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP-клиент identity-сервиса (Keystone v3 совместимый API).
 * <p>
 * Реализация на стандартном JDK {@link HttpClient}: каждый вызов ограничен таймаутом
 * {@code clusterreceiver.identity.timeout-ms}, токены передаются только в рамках конкретного вызова
 * и никогда не логируются.
 */
@Singleton
public class IdentityServiceClient implements TokenValidator {

    private final ClusterReceiverProperties.Identity cfg;
    private final ServiceTokenProvider serviceTokens;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public IdentityServiceClient(ClusterReceiverProperties properties,
                                 ServiceTokenProvider serviceTokens,
                                 ObjectMapper objectMapper) {
        this.cfg = properties.getIdentity();
        this.serviceTokens = serviceTokens;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .build();
    }

    /**
     * Создать trust от имени пользователя (trustor) на сервисную учётную запись (trustee).
     * <p>
     * Trust создаётся с impersonation и без срока действия: он живёт, пока его явно не удалят.
     *
     * @param trustorToken токен пользователя, создающего receiver
     * @param trustorUserId пользователь
     * @param projectId проект
     * @param roles делегируемые роли
     * @return идентификатор trust
     */
    public String createTrust(String trustorToken, String trustorUserId, String projectId, List<String> roles) {
        if (trustorToken == null || trustorToken.isBlank()) {
            throw new IdentityCallException(401, "Для делегирования требуется токен пользователя");
        }
        String trusteeUserId = serviceTokens.serviceToken().userId();

        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode trust = root.putObject("trust");
        trust.put("trustor_user_id", trustorUserId);
        trust.put("trustee_user_id", trusteeUserId);
        trust.put("project_id", projectId);
        trust.put("impersonation", true);
        trust.putNull("expires_at");
        ArrayNode roleArray = trust.putArray("roles");
        if (roles != null) {
            for (String r : roles) {
                roleArray.addObject().put("name", r);
            }
        }

        HttpResponse<String> resp = exchange("POST", "/v3/OS-TRUST/trusts", root.toString(), Map.of("X-Auth-Token", trustorToken));
        requireSuccess(resp, "создание trust");
        String id = readTree(resp.body()).path("trust").path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new IdentityCallException(502, "Ответ identity-сервиса не содержит trust.id");
        }
        return id;
    }

    /**
     * Удалить trust.
     *
     * @throws IdentityCallException с 404, если trust уже удалён
     */
    public void deleteTrust(String trustId) {
        String path = "/v3/OS-TRUST/trusts/" + URLEncoder.encode(trustId, StandardCharsets.UTF_8);
        HttpResponse<String> resp = exchange("DELETE", path, null, Map.of("X-Auth-Token", serviceTokens.serviceToken().token()));
        if (resp.statusCode() == 401) {
            serviceTokens.invalidate();
        }
        requireSuccess(resp, "удаление trust");
    }

    /**
     * Получить trust-scoped токен (impersonation владельца trust).
     */
    public TokenInfo trustToken(String trustId) {
        return serviceTokens.trustScopedToken(trustId);
    }

    /**
     * Проверить пользовательский токен.
     *
     * @return разобранный токен или empty, если токен недействителен
     * @throws IdentityCallException если identity-сервис недоступен
     */
    @Override
    public Optional<TokenInfo> validateToken(String subjectToken) {
        if (subjectToken == null || subjectToken.isBlank()) {
            return Optional.empty();
        }
        HttpResponse<String> resp = exchange("GET", "/v3/auth/tokens", null, Map.of(
                "X-Auth-Token", serviceTokens.serviceToken().token(),
                "X-Subject-Token", subjectToken
        ));
        int status = resp.statusCode();
        if (status == 401 || status == 404) {
            return Optional.empty();
        }
        requireSuccess(resp, "проверка токена");
        return Optional.of(TokenInfo.fromTokenBody(subjectToken, readTree(resp.body())));
    }

    /**
     * Проверка доступности identity-сервиса (для стартовых проверок).
     */
    public void ping() {
        HttpResponse<String> resp = exchange("GET", "/v3", null, Map.of());
        if (resp.statusCode() >= 500) {
            throw new IdentityCallException(resp.statusCode(), "Identity-сервис вернул статус=" + resp.statusCode());
        }
    }

    private HttpResponse<String> exchange(String method, String path, String body, Map<String, String> headers) {
        String baseUrl = cfg.getBaseUrl();
        if (baseUrl == null) {
            throw new IdentityCallException(-1, "Не задан clusterreceiver.identity.base-url");
        }

        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .header("Accept", "application/json");
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getValue() != null && !e.getValue().isBlank()) {
                b.header(e.getKey(), e.getValue());
            }
        }
        if (body == null) {
            b.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            b.header("Content-Type", "application/json");
            b.method(method, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        }

        try {
            return httpClient.send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new IdentityCallException("Таймаут обращения к identity-сервису: " + method + " " + path, e);
        } catch (IOException e) {
            throw new IdentityCallException("Identity-сервис недоступен: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdentityCallException("Обращение к identity-сервису прервано", e);
        }
    }

    private void requireSuccess(HttpResponse<String> resp, String operation) {
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new IdentityCallException(status, "Identity-сервис: " + operation + " завершилось статусом " + status);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (IOException e) {
            throw new IdentityCallException(502, "Некорректный JSON в ответе identity-сервиса");
        }
    }
}

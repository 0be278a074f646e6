package ru.aritmos.clusterreceiver.identity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Получение токена сервисной учётной записи (password-аутентификация) с in-memory кэшем.
 * <p>
 * Сервисная учётная запись: trustee для всех делегированных trust'ов; её токен нужен для валидации
 * пользовательских токенов и для удаления trust'ов при удалении receiver'а.
 */
@Singleton
public class ServiceTokenProvider {

    /** Токен обновляется заранее, за 30 секунд до истечения. */
    private static final long REFRESH_MARGIN_MS = 30_000;

    private final ClusterReceiverProperties.Identity cfg;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Clock clock;
    private final AtomicReference<TokenInfo> cached = new AtomicReference<>();

    @Inject
    public ServiceTokenProvider(ClusterReceiverProperties properties, ObjectMapper objectMapper) {
        this(properties.getIdentity(), objectMapper, Clock.systemUTC());
    }

    ServiceTokenProvider(ClusterReceiverProperties.Identity cfg, ObjectMapper objectMapper, Clock clock) {
        this.cfg = cfg;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .build();
    }

    /**
     * @return действующий токен сервисной учётной записи
     * @throws IdentityCallException при ошибке аутентификации или недоступности identity-сервиса
     */
    public TokenInfo serviceToken() {
        TokenInfo existing = cached.get();
        if (existing != null && !existing.expiresWithin(clock.instant(), REFRESH_MARGIN_MS)) {
            return existing;
        }
        TokenInfo fresh = authenticate(null);
        cached.set(fresh);
        return fresh;
    }

    /**
     * Получить trust-scoped токен: сервисная учётная запись аутентифицируется паролем
     * и запрашивает область действия {@code OS-TRUST:trust}.
     */
    public TokenInfo trustScopedToken(String trustId) {
        if (trustId == null || trustId.isBlank()) {
            throw new IdentityCallException(404, "Пустой идентификатор trust");
        }
        return authenticate(trustId);
    }

    /**
     * Сбросить кэш (например, после ответа 401 на сервисный токен).
     */
    public void invalidate() {
        cached.set(null);
    }

    private TokenInfo authenticate(String trustId) {
        String baseUrl = cfg.getBaseUrl();
        if (baseUrl == null) {
            throw new IdentityCallException(-1, "Не задан clusterreceiver.identity.base-url");
        }

        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode auth = root.putObject("auth");
        ObjectNode identity = auth.putObject("identity");
        identity.putArray("methods").add("password");
        ObjectNode user = identity.putObject("password").putObject("user");
        user.put("name", cfg.getServiceUser());
        user.put("password", cfg.getServicePassword() == null ? "" : cfg.getServicePassword());
        user.putObject("domain").put("name", cfg.getServiceDomain());

        ObjectNode scope = auth.putObject("scope");
        if (trustId != null) {
            scope.putObject("OS-TRUST:trust").put("id", trustId);
        } else {
            ObjectNode project = scope.putObject("project");
            project.put("name", cfg.getServiceProject());
            project.putObject("domain").put("name", cfg.getServiceDomain());
        }

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v3/auth/tokens"))
                .timeout(Duration.ofMillis(cfg.getTimeoutMs()))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(root.toString(), StandardCharsets.UTF_8))
                .build();

        try {
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new IdentityCallException(resp.statusCode(), "Аутентификация в identity-сервисе отклонена: статус=" + resp.statusCode());
            }
            String subjectToken = resp.headers().firstValue("X-Subject-Token").orElse(null);
            if (subjectToken == null || subjectToken.isBlank()) {
                throw new IdentityCallException(502, "Ответ identity-сервиса не содержит X-Subject-Token");
            }
            TokenInfo info = TokenInfo.fromTokenBody(subjectToken, objectMapper.readTree(resp.body()));
            if (info.expiresAt() == null) {
                return new TokenInfo(info.token(), info.userId(), info.projectId(), info.domainId(), info.roles(),
                        info.trustId(), Instant.now(clock).plusSeconds(cfg.getTokenCacheTtlSeconds()));
            }
            return info;
        } catch (HttpTimeoutException e) {
            throw new IdentityCallException("Таймаут обращения к identity-сервису", e);
        } catch (IOException e) {
            throw new IdentityCallException("Identity-сервис недоступен: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdentityCallException("Обращение к identity-сервису прервано", e);
        }
    }
}

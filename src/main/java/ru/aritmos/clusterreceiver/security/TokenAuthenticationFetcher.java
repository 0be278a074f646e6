package ru.aritmos.clusterreceiver.security;

import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.http.HttpRequest;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.filters.AuthenticationFetcher;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.core.TtlCache;
import ru.aritmos.clusterreceiver.identity.IdentityCallException;
import ru.aritmos.clusterreceiver.identity.TokenInfo;
import ru.aritmos.clusterreceiver.identity.TokenValidator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Аутентификация запросов API по заголовку {@code X-Auth-Token}.
 * <p>
 * Токен проверяется в identity-сервисе, результат кэшируется в {@link TtlCache} по SHA-256 токена
 * (сам токен ключом кэша не является). Сетевой вызов выполняется на blocking-пуле, а не на event loop.
 */
@Singleton
public class TokenAuthenticationFetcher implements AuthenticationFetcher<HttpRequest<?>> {

    public static final String AUTH_TOKEN_HEADER = "X-Auth-Token";
    public static final String ATTR_PROJECT_ID = "project_id";
    public static final String ATTR_DOMAIN_ID = "domain_id";
    public static final String ATTR_TOKEN = "auth_token";

    private static final Logger log = LoggerFactory.getLogger(TokenAuthenticationFetcher.class);

    private final TokenValidator tokenValidator;
    private final ExecutorService executor;
    private final TtlCache<String, Authentication> cache;
    private final long cacheTtlMs;
    private final Clock clock = Clock.systemUTC();

    public TokenAuthenticationFetcher(TokenValidator tokenValidator,
                                      ClusterReceiverProperties properties,
                                      @Named(TaskExecutors.BLOCKING) ExecutorService executor) {
        this.tokenValidator = tokenValidator;
        this.executor = executor;
        ClusterReceiverProperties.Identity cfg = properties.getIdentity();
        this.cache = new TtlCache<>(clock, cfg.getTokenCacheMaxEntries());
        this.cacheTtlMs = Duration.ofSeconds(cfg.getTokenCacheTtlSeconds()).toMillis();
    }

    @Override
    public Publisher<Authentication> fetchAuthentication(HttpRequest<?> request) {
        String token = request.getHeaders().get(AUTH_TOKEN_HEADER);
        if (token == null || token.isBlank()) {
            return Publishers.empty();
        }
        String key = digest(token.trim());
        Optional<Authentication> cached = cache.get(key);
        if (cached.isPresent()) {
            return Publishers.just(cached.get());
        }
        return Publishers.fromCompletableFuture(() -> CompletableFuture.supplyAsync(() -> authenticate(token.trim(), key), executor));
    }

    private Authentication authenticate(String token, String key) {
        try {
            Optional<TokenInfo> info = tokenValidator.validateToken(token);
            if (info.isEmpty()) {
                log.info("[AUTH] токен отклонён identity-сервисом");
                return null;
            }
            Authentication authentication = toAuthentication(info.get());
            cache.put(key, authentication, ttlFor(info.get()));
            return authentication;
        } catch (IdentityCallException e) {
            log.warn("[AUTH] не удалось проверить токен: {}", e.getMessage());
            return null;
        }
    }

    static Authentication toAuthentication(TokenInfo info) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (info.projectId() != null) {
            attributes.put(ATTR_PROJECT_ID, info.projectId());
        }
        if (info.domainId() != null) {
            attributes.put(ATTR_DOMAIN_ID, info.domainId());
        }
        attributes.put(ATTR_TOKEN, info.token());
        return Authentication.build(info.userId(), info.roles(), attributes);
    }

    private long ttlFor(TokenInfo info) {
        if (info.expiresAt() == null) {
            return cacheTtlMs;
        }
        long untilExpiry = info.expiresAt().toEpochMilli() - Instant.now(clock).toEpochMilli();
        return Math.min(cacheTtlMs, Math.max(0, untilExpiry));
    }

    private static String digest(String token) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен", e);
        }
    }
}

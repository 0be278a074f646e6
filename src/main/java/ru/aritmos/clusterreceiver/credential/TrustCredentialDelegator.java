package ru.aritmos.clusterreceiver.credential;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.core.SensitiveDataSanitizer;
import ru.aritmos.clusterreceiver.core.TtlCache;
import ru.aritmos.clusterreceiver.identity.IdentityCallException;
import ru.aritmos.clusterreceiver.identity.IdentityServiceClient;
import ru.aritmos.clusterreceiver.identity.TokenInfo;
import ru.aritmos.clusterreceiver.security.RequesterIdentity;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Делегирование через trust'ы identity-сервиса.
 * <p>
 * Trust-scoped токены кэшируются до момента «за 30 секунд до истечения», при отзыве запись из кэша удаляется.
 * Идентификаторы trust в логах сокращаются до первых символов.
 */
@Singleton
public class TrustCredentialDelegator implements CredentialDelegator {

    private static final Logger log = LoggerFactory.getLogger(TrustCredentialDelegator.class);

    static final long EXPIRY_SKEW_MS = 30_000L;

    private final IdentityServiceClient identity;
    private final TtlCache<String, TokenInfo> trustTokens;
    private final Clock clock;

    @Inject
    public TrustCredentialDelegator(IdentityServiceClient identity, ClusterReceiverProperties properties) {
        this(identity, Clock.systemUTC(), properties.getIdentity().getTokenCacheMaxEntries());
    }

    TrustCredentialDelegator(IdentityServiceClient identity, Clock clock, int cacheMaxEntries) {
        this.identity = identity;
        this.clock = clock;
        this.trustTokens = new TtlCache<>(clock, cacheMaxEntries);
    }

    @Override
    public CredentialHandle issue(RequesterIdentity requester, DelegationScope scope) {
        List<String> roles = scope.roles().isEmpty() ? requester.roles() : scope.roles();
        try {
            String trustId = identity.createTrust(requester.token(), requester.userId(), requester.projectId(), roles);
            log.info("[TRUST] Выпущен trust {} для user={} project={} cluster={} action={}",
                    SensitiveDataSanitizer.shortId(trustId), requester.userId(), requester.projectId(),
                    scope.clusterId(), scope.action());
            return new CredentialHandle(trustId);
        } catch (IdentityCallException e) {
            throw new ReceiverException(ReceiverException.ErrorKind.DELEGATION_FAILED,
                    "Не удалось делегировать права: " + e.getMessage(), e);
        }
    }

    @Override
    public void revoke(CredentialHandle handle) {
        trustTokens.invalidate(handle.trustId());
        try {
            identity.deleteTrust(handle.trustId());
            log.info("[TRUST] Trust {} отозван", SensitiveDataSanitizer.shortId(handle.trustId()));
        } catch (IdentityCallException e) {
            if (e.isNotFound()) {
                throw new ReceiverException(ReceiverException.ErrorKind.ALREADY_REVOKED, "Trust уже отозван", e);
            }
            throw new ReceiverException(ReceiverException.ErrorKind.REVOCATION_FAILED,
                    "Не удалось отозвать trust: " + e.getMessage(), e);
        }
    }

    @Override
    public ActingIdentity impersonate(CredentialHandle handle) {
        TokenInfo token = trustTokens.get(handle.trustId()).orElse(null);
        if (token == null) {
            token = fetch(handle);
            long ttl = token.expiresAt() == null
                    ? 0L
                    : token.expiresAt().toEpochMilli() - clock.millis() - EXPIRY_SKEW_MS;
            trustTokens.put(handle.trustId(), token, ttl);
        }
        return new ActingIdentity(token.userId(), token.projectId(), token.token(), true);
    }

    @Override
    public void evict(CredentialHandle handle) {
        trustTokens.invalidate(handle.trustId());
        log.info("[TRUST] Токен trust {} удалён из кэша после отказа", SensitiveDataSanitizer.shortId(handle.trustId()));
    }

    private TokenInfo fetch(CredentialHandle handle) {
        try {
            TokenInfo token = identity.trustToken(handle.trustId());
            if (token.expiresAt() != null && !token.expiresAt().isAfter(Instant.now(clock))) {
                throw new ReceiverException(ReceiverException.ErrorKind.CREDENTIAL_INVALID, "Делегированный токен истёк");
            }
            return token;
        } catch (IdentityCallException e) {
            if (e.isTransport() || e.httpStatus() >= 500) {
                throw ReceiverException.unavailable("Identity-сервис недоступен: " + e.getMessage(), e);
            }
            if (e.isAuthRejected() || e.isNotFound()) {
                log.debug("[TRUST] Trust {} недействителен: статус={}", SensitiveDataSanitizer.shortId(handle.trustId()), e.httpStatus());
                throw new ReceiverException(ReceiverException.ErrorKind.CREDENTIAL_INVALID,
                        "Делегированные права отозваны или истекли", e);
            }
            throw new ReceiverException(ReceiverException.ErrorKind.CREDENTIAL_INVALID,
                    "Не удалось получить делегированный токен: " + e.getMessage(), e);
        }
    }
}

package ru.aritmos.clusterreceiver.trigger;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.config.ClusterReceiverSecurityProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.credential.ActingIdentity;
import ru.aritmos.clusterreceiver.identity.IdentityCallException;
import ru.aritmos.clusterreceiver.identity.TokenInfo;
import ru.aritmos.clusterreceiver.identity.TokenValidator;
import ru.aritmos.clusterreceiver.receiver.Receiver;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;
import ru.aritmos.clusterreceiver.security.RequesterIdentity;

/**
 * Signal: вызывающий предъявляет собственный токен, который должен относиться к проекту receiver'а
 * и нести роль member или admin.
 */
@Singleton
public class SignalTriggerAuthenticator implements TriggerAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(SignalTriggerAuthenticator.class);

    private final TokenValidator tokenValidator;
    private final ClusterReceiverSecurityProperties.Rbac rbac;

    @Inject
    public SignalTriggerAuthenticator(TokenValidator tokenValidator, ClusterReceiverSecurityProperties security) {
        this(tokenValidator, security.getRbac());
    }

    public SignalTriggerAuthenticator(TokenValidator tokenValidator, ClusterReceiverSecurityProperties.Rbac rbac) {
        this.tokenValidator = tokenValidator;
        this.rbac = rbac;
    }

    @Override
    public ReceiverType type() {
        return ReceiverType.SIGNAL;
    }

    @Override
    public ActingIdentity authenticate(Receiver receiver, InvocationCredentials credentials) {
        if (credentials == null || !credentials.hasToken()) {
            throw ReceiverException.unauthorized("Для signal-receiver'а требуется X-Auth-Token");
        }
        TokenInfo info;
        try {
            info = tokenValidator.validateToken(credentials.token().trim())
                    .orElseThrow(() -> ReceiverException.unauthorized("Токен недействителен"));
        } catch (IdentityCallException e) {
            throw ReceiverException.unavailable("Не удалось проверить токен: " + e.getMessage(), e);
        }
        if (info.projectId() == null || !info.projectId().equals(receiver.project())) {
            log.info("[TRIGGER] Токен пользователя {} не относится к проекту receiver'а {}", info.userId(), receiver.id());
            throw ReceiverException.unauthorized("Токен не относится к проекту receiver'а");
        }
        RequesterIdentity caller = new RequesterIdentity(info.userId(), info.projectId(), info.domainId(), info.roles(), null);
        if (!caller.canWrite(rbac)) {
            log.info("[TRIGGER] У пользователя {} нет роли для вызова receiver'а {}: roles={}", info.userId(), receiver.id(), info.roles());
            throw ReceiverException.unauthorized("Для вызова signal-receiver'а нужна роль " + rbac.getMemberRole());
        }
        return new ActingIdentity(info.userId(), info.projectId(), info.token(), false);
    }
}

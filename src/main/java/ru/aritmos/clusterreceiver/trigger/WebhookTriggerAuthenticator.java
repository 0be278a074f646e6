package ru.aritmos.clusterreceiver.trigger;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.credential.ActingIdentity;
import ru.aritmos.clusterreceiver.credential.CredentialDelegator;
import ru.aritmos.clusterreceiver.credential.CredentialHandle;
import ru.aritmos.clusterreceiver.receiver.Receiver;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;

/**
 * Webhook: вызывающий анонимен, права берутся из делегированного trust receiver'а.
 */
@Singleton
public class WebhookTriggerAuthenticator implements TriggerAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(WebhookTriggerAuthenticator.class);

    private final CredentialDelegator delegator;

    public WebhookTriggerAuthenticator(CredentialDelegator delegator) {
        this.delegator = delegator;
    }

    @Override
    public ReceiverType type() {
        return ReceiverType.WEBHOOK;
    }

    @Override
    public ActingIdentity authenticate(Receiver receiver, InvocationCredentials credentials) {
        CredentialHandle handle = receiver.credential()
                .orElseThrow(() -> ReceiverException.unauthorized("У receiver'а нет действующих делегированных прав"));
        try {
            return delegator.impersonate(handle);
        } catch (ReceiverException e) {
            if (e.is(ReceiverException.ErrorKind.CREDENTIAL_INVALID)) {
                log.info("[TRIGGER] Делегированные права receiver'а {} недействительны", receiver.id());
                throw new ReceiverException(ReceiverException.ErrorKind.UNAUTHORIZED,
                        "Делегированные права receiver'а отозваны или истекли", e);
            }
            throw e;
        }
    }

    @Override
    public void rejectedDownstream(Receiver receiver) {
        receiver.credential().ifPresent(delegator::evict);
    }
}

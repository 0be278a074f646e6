package ru.aritmos.clusterreceiver.trigger;

import ru.aritmos.clusterreceiver.credential.ActingIdentity;
import ru.aritmos.clusterreceiver.receiver.Receiver;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;

/**
 * Аутентификация вызова receiver'а конкретного типа.
 */
public interface TriggerAuthenticator {

    ReceiverType type();

    /**
     * Определить идентичность, от имени которой будет выполнено действие.
     *
     * @throws ru.aritmos.clusterreceiver.core.ReceiverException UNAUTHORIZED, если вызов не может быть аутентифицирован;
     *                                                           UNAVAILABLE, если недоступен identity-сервис
     */
    ActingIdentity authenticate(Receiver receiver, InvocationCredentials credentials);

    /**
     * Action engine отверг идентичность, выданную {@link #authenticate}.
     */
    default void rejectedDownstream(Receiver receiver) {
    }
}

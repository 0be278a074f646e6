package ru.aritmos.clusterreceiver.trigger;

import jakarta.inject.Singleton;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.receiver.ReceiverType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Реестр аутентификаторов вызова по типу receiver'а.
 */
@Singleton
public class TriggerAuthenticatorRegistry {

    private final Map<ReceiverType, TriggerAuthenticator> byType = new EnumMap<>(ReceiverType.class);

    public TriggerAuthenticatorRegistry(List<TriggerAuthenticator> authenticators) {
        for (TriggerAuthenticator a : authenticators) {
            TriggerAuthenticator prev = byType.put(a.type(), a);
            if (prev != null) {
                throw new IllegalStateException("Для типа " + a.type() + " зарегистрировано несколько аутентификаторов");
            }
        }
    }

    public TriggerAuthenticator forType(ReceiverType type) {
        TriggerAuthenticator a = byType.get(type);
        if (a == null) {
            throw new ReceiverException(ReceiverException.ErrorKind.INTERNAL, "Нет аутентификатора для типа " + type);
        }
        return a;
    }
}

package ru.aritmos.clusterreceiver.engine;

import ru.aritmos.clusterreceiver.credential.ActingIdentity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Запрос на постановку действия в action engine.
 *
 * @param action действие
 * @param clusterId канонический идентификатор кластера
 * @param params эффективные параметры
 * @param actor идентичность, от имени которой выполняется действие
 * @param cause источник действия (например, {@code RPC Request} / {@code Receiver <id>})
 * @param requestId идентификатор корреляции
 */
public record ActionRequest(ClusterAction action,
                            String clusterId,
                            Map<String, Object> params,
                            ActingIdentity actor,
                            String cause,
                            String requestId) {

    public ActionRequest {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}

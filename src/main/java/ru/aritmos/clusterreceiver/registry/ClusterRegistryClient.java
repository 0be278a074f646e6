package ru.aritmos.clusterreceiver.registry;

import ru.aritmos.clusterreceiver.security.RequesterIdentity;

import java.util.Optional;

/**
 * Реестр кластеров.
 */
public interface ClusterRegistryClient {

    /**
     * Разрешить ссылку на кластер (полный id, имя или короткий id) в канонический кластер,
     * видимый запрашивающему.
     *
     * @return кластер или empty, если не найден или невидим
     * @throws ru.aritmos.clusterreceiver.core.ReceiverException UNAVAILABLE при недоступности реестра
     */
    Optional<ClusterRef> find(String clusterRef, RequesterIdentity requester);

    /**
     * Проверка доступности (для стартовых проверок).
     */
    void ping();
}

package ru.aritmos.clusterreceiver.credential;

import java.util.List;

/**
 * Область делегирования: одно действие над одним кластером.
 *
 * @param clusterId целевой кластер
 * @param action действие
 * @param roles делегируемые роли; если пусто, делегируются все роли запрашивающего в проекте
 */
public record DelegationScope(String clusterId, String action, List<String> roles) {

    public DelegationScope {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}

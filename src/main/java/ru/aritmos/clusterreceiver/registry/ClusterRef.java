package ru.aritmos.clusterreceiver.registry;

/**
 * Кластер, разрешённый реестром.
 *
 * @param id канонический идентификатор
 * @param name имя
 * @param project проект-владелец
 */
public record ClusterRef(String id, String name, String project) {
}

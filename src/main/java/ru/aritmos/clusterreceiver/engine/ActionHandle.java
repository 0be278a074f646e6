package ru.aritmos.clusterreceiver.engine;

/**
 * Асинхронный handle поставленного действия.
 *
 * @param actionId идентификатор действия в action engine
 */
public record ActionHandle(String actionId) {
}

package ru.aritmos.clusterreceiver.engine;

/**
 * Клиент action engine.
 * <p>
 * Постановка действия асинхронна: сервис не ждёт его завершения.
 */
public interface ActionEngineClient {

    /**
     * Поставить действие в очередь.
     *
     * @return handle действия
     * @throws ru.aritmos.clusterreceiver.core.ReceiverException DISPATCH_REJECTED при отказе engine,
     *                                                           UNAVAILABLE при недоступности
     */
    ActionHandle submit(ActionRequest request);

    /**
     * Проверка доступности (для стартовых проверок).
     */
    void ping();
}

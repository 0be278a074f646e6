package ru.aritmos.clusterreceiver;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа Cluster Receiver Service.
 * <p>
 * Сервис хранит receiver'ы: привязки внешнего триггера (webhook URL или signal-вызов) к действию над кластером
 * и при срабатывании триггера передаёт действие во внешний action engine от имени владельца receiver'а.
 * <p>
 * Важно: сервис не хранит живую сессию пользователя. Для webhook используется делегированный trust,
 * выпущенный identity-сервисом при создании receiver'а и отзываемый при удалении.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}

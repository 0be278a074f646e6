package ru.aritmos.clusterreceiver.event;

import java.util.List;

/**
 * Журнал событий receiver'ов.
 */
public interface EventJournal {

    /**
     * Записать событие. Ошибка записи не должна прерывать основной сценарий.
     */
    void record(ReceiverEvent event);

    /**
     * События от новых к старым.
     *
     * @param project проект или null для всех проектов
     * @param objId фильтр по id объекта или null
     * @param limit максимум записей
     */
    List<ReceiverEvent> list(String project, String objId, int limit);
}

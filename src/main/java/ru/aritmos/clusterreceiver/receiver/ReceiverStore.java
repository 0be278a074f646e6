package ru.aritmos.clusterreceiver.receiver;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Долговременное хранилище receiver'ов.
 * <p>
 * Все изменяющие операции выполняются одним SQL-оператором; блокировок нет.
 * Параметр {@code project == null} означает «все проекты» (operator-scope).
 */
public interface ReceiverStore {

    /**
     * @throws ru.aritmos.clusterreceiver.core.ReceiverException CONFLICT при дубликате имени в проекте,
     *                                                           UNAVAILABLE при ошибке хранилища
     */
    Receiver insert(Receiver receiver);

    Optional<Receiver> findById(String id);

    List<Receiver> findByName(String project, String name);

    List<Receiver> findByShortId(String project, String idPrefix);

    List<Receiver> list(ReceiverQuery query, String project);

    /**
     * Очистить actor, если он всё ещё равен {@code expectedActor}.
     *
     * @return true, если запись обновлена
     */
    boolean clearActor(String id, Map<String, Object> expectedActor);

    /**
     * @return true, если запись удалена этим вызовом
     */
    boolean delete(String id);
}

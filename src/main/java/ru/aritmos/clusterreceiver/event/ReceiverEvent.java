package ru.aritmos.clusterreceiver.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Запись журнала событий.
 *
 * @param id идентификатор события
 * @param timestamp время
 * @param objId id receiver'а
 * @param objName имя receiver'а
 * @param objType тип объекта ({@code RECEIVER})
 * @param clusterId целевой кластер
 * @param action событие ({@code RECEIVER_CREATE}, {@code RECEIVER_DELETE}, {@code RECEIVER_TRIGGER})
 * @param level уровень
 * @param status итоговый статус
 * @param statusReason пояснение, без секретов
 * @param userId инициатор
 * @param project проект
 */
public record ReceiverEvent(String id,
                            Instant timestamp,
                            String objId,
                            String objName,
                            String objType,
                            String clusterId,
                            String action,
                            EventLevel level,
                            String status,
                            String statusReason,
                            String userId,
                            String project) {

    public static final String OBJ_TYPE_RECEIVER = "RECEIVER";

    public static final String RECEIVER_CREATE = "RECEIVER_CREATE";
    public static final String RECEIVER_DELETE = "RECEIVER_DELETE";
    public static final String RECEIVER_TRIGGER = "RECEIVER_TRIGGER";

    /**
     * Событие о receiver'е с новым id и текущим временем.
     */
    public static ReceiverEvent of(Instant now,
                                   String receiverId,
                                   String receiverName,
                                   String clusterId,
                                   String action,
                                   EventLevel level,
                                   String status,
                                   String statusReason,
                                   String userId,
                                   String project) {
        return new ReceiverEvent(UUID.randomUUID().toString(), now, receiverId, receiverName, OBJ_TYPE_RECEIVER,
                clusterId, action, level, status, statusReason, userId, project);
    }
}

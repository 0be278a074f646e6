package ru.aritmos.clusterreceiver.trigger;

import java.util.Map;

/**
 * Результат успешного вызова receiver'а.
 *
 * @param receiverId receiver
 * @param state итоговое состояние ({@link InvocationState#SUBMITTED})
 * @param actionId идентификатор поставленного действия
 * @param effectiveParams параметры, переданные в action engine
 */
public record TriggerOutcome(String receiverId,
                             InvocationState state,
                             String actionId,
                             Map<String, Object> effectiveParams) {
}

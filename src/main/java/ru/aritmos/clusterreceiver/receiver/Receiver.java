package ru.aritmos.clusterreceiver.receiver;

import ru.aritmos.clusterreceiver.credential.CredentialHandle;
import ru.aritmos.clusterreceiver.engine.ClusterAction;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Зарегистрированный receiver.
 * <p>
 * Все поля, кроме {@code actor}, неизменяемы после создания. {@code actor} очищается только при удалении,
 * после успешного отзыва trust. Канал не хранится и вычисляется при каждом чтении.
 *
 * @param id UUID
 * @param name имя, уникальное в пределах проекта
 * @param type тип
 * @param clusterId канонический id кластера, разрешённый при создании
 * @param action действие
 * @param actor для webhook {@code {"trust_id": ...}}, для signal пусто
 * @param params параметры действия по умолчанию
 * @param project проект создателя
 * @param domain домен создателя
 * @param userId создатель
 * @param createdAt время создания
 * @param updatedAt совпадает с createdAt
 */
public record Receiver(String id,
                       String name,
                       ReceiverType type,
                       String clusterId,
                       ClusterAction action,
                       Map<String, Object> actor,
                       Map<String, Object> params,
                       String project,
                       String domain,
                       String userId,
                       Instant createdAt,
                       Instant updatedAt) {

    public Receiver {
        actor = actor == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(actor));
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public Optional<CredentialHandle> credential() {
        return CredentialHandle.fromActor(actor);
    }

    public Receiver withActor(Map<String, Object> newActor) {
        return new Receiver(id, name, type, clusterId, action, newActor, params, project, domain, userId, createdAt, updatedAt);
    }
}

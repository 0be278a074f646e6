package ru.aritmos.clusterreceiver.credential;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Capability-объект делегированного credential'а: ссылка на trust, принадлежащий ровно одному webhook-receiver'у.
 * <p>
 * В хранилище и в представлении receiver'а хранится как поле {@code actor = {"trust_id": "..."}}.
 */
public record CredentialHandle(String trustId) {

    public static final String ACTOR_TRUST_ID = "trust_id";

    public CredentialHandle {
        if (trustId == null || trustId.isBlank()) {
            throw new IllegalArgumentException("trustId обязателен");
        }
    }

    /**
     * Извлечь handle из поля actor receiver'а.
     */
    public static Optional<CredentialHandle> fromActor(Map<String, Object> actor) {
        if (actor == null) {
            return Optional.empty();
        }
        Object v = actor.get(ACTOR_TRUST_ID);
        if (v == null || String.valueOf(v).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new CredentialHandle(String.valueOf(v)));
    }

    public Map<String, Object> toActor() {
        Map<String, Object> actor = new LinkedHashMap<>();
        actor.put(ACTOR_TRUST_ID, trustId);
        return actor;
    }

    @Override
    public String toString() {
        return "CredentialHandle[***]";
    }
}

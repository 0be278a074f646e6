package ru.aritmos.clusterreceiver.engine;

import java.util.Locale;
import java.util.Optional;

/**
 * Распознаваемые действия над кластером.
 */
public enum ClusterAction {
    CLUSTER_CREATE,
    CLUSTER_DELETE,
    CLUSTER_UPDATE,
    CLUSTER_ADD_NODES,
    CLUSTER_DEL_NODES,
    CLUSTER_SCALE_UP,
    CLUSTER_SCALE_DOWN,
    CLUSTER_SCALE_OUT,
    CLUSTER_SCALE_IN,
    CLUSTER_RESIZE,
    CLUSTER_ATTACH_POLICY,
    CLUSTER_DETACH_POLICY;

    /**
     * Разобрать имя действия без учёта регистра.
     */
    public static Optional<ClusterAction> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Receiver всегда направлен на уже существующий кластер, поэтому создание кластера через него недопустимо.
     */
    public boolean allowedForReceiver() {
        return this != CLUSTER_CREATE;
    }
}

package ru.aritmos.clusterreceiver.trigger;

/**
 * Состояние обработки одного вызова receiver'а.
 * <p>
 * {@code RECEIVED → AUTHENTICATING → AUTHORIZED → SUBMITTED} либо {@code → REJECTED} на любом шаге.
 */
public enum InvocationState {
    RECEIVED,
    AUTHENTICATING,
    AUTHORIZED,
    SUBMITTED,
    REJECTED;

    public boolean terminal() {
        return this == SUBMITTED || this == REJECTED;
    }
}

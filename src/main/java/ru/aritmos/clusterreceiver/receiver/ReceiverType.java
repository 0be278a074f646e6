package ru.aritmos.clusterreceiver.receiver;

import ru.aritmos.clusterreceiver.core.ReceiverException;

import java.util.Locale;

/**
 * Тип receiver'а.
 */
public enum ReceiverType {
    /** Вызывается анонимно по URL канала, права берутся из делегированного trust. */
    WEBHOOK("webhook"),
    /** Вызывается вызывающим, который сам предъявляет токен; делегирования нет. */
    SIGNAL("signal");

    private final String wire;

    ReceiverType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    /**
     * @throws ReceiverException VALIDATION для неизвестного типа
     */
    public static ReceiverType fromWire(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (ReceiverType t : values()) {
                if (t.wire.equals(v)) {
                    return t;
                }
            }
        }
        throw ReceiverException.validation("Некорректный тип receiver'а: '" + value + "', допустимо: webhook, signal");
    }
}

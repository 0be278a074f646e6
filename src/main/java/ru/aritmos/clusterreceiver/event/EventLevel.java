package ru.aritmos.clusterreceiver.event;

/**
 * Уровень события журнала. В хранилище пишется числовое значение.
 */
public enum EventLevel {
    DEBUG(10),
    INFO(20),
    WARNING(30),
    ERROR(40);

    private final int code;

    EventLevel(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static EventLevel fromCode(int code) {
        for (EventLevel l : values()) {
            if (l.code == code) {
                return l;
            }
        }
        return code > ERROR.code ? ERROR : INFO;
    }
}

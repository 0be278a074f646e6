package ru.aritmos.clusterreceiver.channel;

import java.util.Map;

/**
 * Канал вызова webhook-receiver'а.
 *
 * @param alarmUrl URL, по которому внешняя система вызывает receiver
 */
public record ChannelInfo(String alarmUrl) {

    public Map<String, Object> toWire() {
        return Map.of("alarm_url", alarmUrl);
    }
}

package ru.aritmos.clusterreceiver.core;

import java.util.Map;
import java.util.UUID;

/**
 * Контекст корреляции запроса.
 * <p>
 * Идентификатор запроса берётся из входящих заголовков {@code X-OpenStack-Request-Id} / {@code X-Request-Id},
 * а при их отсутствии генерируется в формате {@code req-<uuid>}. Возвращается в каждом ответе API.
 */
public record CorrelationContext(String requestId) {

    public static final String REQUEST_ID_HEADER = "X-OpenStack-Request-Id";
    public static final String FALLBACK_REQUEST_ID_HEADER = "X-Request-Id";
    public static final String ATTRIBUTE = "clusterreceiver.correlation";

    public static CorrelationContext resolve(String requestId) {
        String req = normalize(requestId);
        if (req == null) {
            return new CorrelationContext("req-" + UUID.randomUUID());
        }
        return new CorrelationContext(req);
    }

    public static CorrelationContext fromHeaders(Map<String, String> headers) {
        if (headers == null) {
            return resolve(null);
        }
        String req = firstHeader(headers, REQUEST_ID_HEADER);
        if (req == null) {
            req = firstHeader(headers, FALLBACK_REQUEST_ID_HEADER);
        }
        return resolve(req);
    }

    private static String firstHeader(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && e.getValue() != null && !e.getValue().isBlank()) {
                return e.getValue().trim();
            }
        }
        return null;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String t = value.trim();
        if (t.isEmpty() || t.length() > 128) {
            return null;
        }
        return t;
    }
}

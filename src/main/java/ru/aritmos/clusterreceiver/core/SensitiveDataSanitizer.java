package ru.aritmos.clusterreceiver.core;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Санитайзер чувствительных данных.
 * <p>
 * Назначение:
 * <ul>
 *   <li>не допустить попадания токенов identity-сервиса и идентификаторов trust в логи и тексты ошибок;</li>
 *   <li>обеспечить единообразную политику маскирования.</li>
 * </ul>
 * <p>
 * Важно: санитайзер работает эвристически и не является DLP-системой.
 */
public final class SensitiveDataSanitizer {

    private SensitiveDataSanitizer() {
    }

    /**
     * Заголовки/поля, которые нельзя хранить или логировать в сыром виде.
     */
    private static final Set<String> FORBIDDEN_KEYS = Set.of(
            "authorization",
            "cookie",
            "set-cookie",
            "x-auth-token",
            "x-subject-token",
            "x-service-token",
            "access_token",
            "trust_id",
            "password",
            "client_secret"
    );

    private static final String MASK = "***";

    private static final Pattern BEARER = Pattern.compile("(?i)bearer\\s+[A-Za-z0-9._~+/=-]+");
    private static final Pattern KEY_VALUE = Pattern.compile(
            "(?i)(x-auth-token|x-subject-token|trust_id|password|access_token)([\"']?\\s*[:=]\\s*[\"']?)([^\\s,;\"'}]+)");

    /**
     * Санитизировать карту заголовков.
     *
     * @param headers исходные заголовки
     * @return новая карта с замаскированными значениями
     */
    public static Map<String, String> sanitizeHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : headers.entrySet()) {
            String k = e.getKey();
            if (k == null) {
                continue;
            }
            if (FORBIDDEN_KEYS.contains(k.toLowerCase(Locale.ROOT))) {
                out.put(k, MASK);
            } else {
                out.put(k, sanitizeText(e.getValue()));
            }
        }
        return out;
    }

    /**
     * Санитизировать произвольный текст (сообщения ошибок, фрагменты ответов зависимостей).
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String s = BEARER.matcher(text).replaceAll("Bearer " + MASK);
        s = KEY_VALUE.matcher(s).replaceAll("$1$2" + MASK);
        return s;
    }

    /**
     * Короткое представление идентификатора для логов: первые 8 символов.
     */
    public static String shortId(String id) {
        if (id == null) {
            return null;
        }
        return id.length() <= 8 ? id : id.substring(0, 8);
    }
}

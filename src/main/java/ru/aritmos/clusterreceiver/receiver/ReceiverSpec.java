package ru.aritmos.clusterreceiver.receiver;

import ru.aritmos.clusterreceiver.core.ReceiverException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Запрос на создание receiver'а в том виде, как он пришёл от клиента.
 * <p>
 * Здесь проверяется только форма тела. Смысловые проверки (тип, действие, кластер) выполняет
 * {@link ru.aritmos.clusterreceiver.lifecycle.ReceiverLifecycleManager}.
 *
 * @param name имя
 * @param type тип в wire-виде
 * @param clusterRef ссылка на кластер (id, имя или короткий id)
 * @param action имя действия
 * @param actorHint подсказка по делегированию; для webhook допускается список {@code roles}
 * @param params параметры по умолчанию
 */
public record ReceiverSpec(String name,
                           String type,
                           String clusterRef,
                           String action,
                           Map<String, Object> actorHint,
                           Map<String, Object> params) {

    public static final String WRAPPER = "receiver";

    private static final Set<String> KNOWN_FIELDS = Set.of("name", "type", "cluster_id", "action", "actor", "params");

    /**
     * Разобрать тело {@code {"receiver": {...}}}.
     *
     * @throws ReceiverException VALIDATION при нарушении формы
     */
    public static ReceiverSpec fromBody(Map<String, Object> body) {
        if (body == null || !(body.get(WRAPPER) instanceof Map<?, ?> raw)) {
            throw ReceiverException.validation("Некорректное тело запроса: отсутствует ключ 'receiver'");
        }
        Map<String, Object> r = stringKeys(raw, WRAPPER);
        for (String key : r.keySet()) {
            if (!KNOWN_FIELDS.contains(key)) {
                throw ReceiverException.validation("Недопустимое поле receiver'а: '" + key + "'");
            }
        }
        return new ReceiverSpec(
                text(r, "name"),
                text(r, "type"),
                text(r, "cluster_id"),
                text(r, "action"),
                object(r, "actor"),
                object(r, "params")
        );
    }

    private static String text(Map<String, Object> r, String field) {
        Object v = r.get(field);
        if (v == null) {
            return null;
        }
        if (!(v instanceof String s)) {
            throw ReceiverException.validation("Поле '" + field + "' должно быть строкой");
        }
        return s;
    }

    private static Map<String, Object> object(Map<String, Object> r, String field) {
        Object v = r.get(field);
        if (v == null) {
            return Map.of();
        }
        if (!(v instanceof Map<?, ?> m)) {
            throw ReceiverException.validation("Поле '" + field + "' должно быть JSON-объектом");
        }
        return stringKeys(m, field);
    }

    private static Map<String, Object> stringKeys(Map<?, ?> raw, String field) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            if (!(e.getKey() instanceof String k)) {
                throw ReceiverException.validation("Ключи '" + field + "' должны быть строками");
            }
            out.put(k, e.getValue());
        }
        return out;
    }
}

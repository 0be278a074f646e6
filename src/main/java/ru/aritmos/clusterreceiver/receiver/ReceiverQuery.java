package ru.aritmos.clusterreceiver.receiver;

import ru.aritmos.clusterreceiver.config.ClusterReceiverProperties;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.engine.ClusterAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Разобранные параметры листинга receiver'ов.
 * <p>
 * Фильтры одного ключа объединяются через OR, разные ключи через AND.
 * Неизвестный параметр запроса считается ошибкой клиента.
 *
 * @param names фильтр по имени
 * @param types фильтр по типу
 * @param clusterIds фильтр по кластеру
 * @param actions фильтр по действию
 * @param limit размер страницы
 * @param marker последний элемент предыдущей страницы или null
 * @param sort ключи сортировки; id всегда добавляется последним как tie-breaker
 * @param globalProject листинг по всем проектам
 */
public record ReceiverQuery(List<String> names,
                            List<ReceiverType> types,
                            List<String> clusterIds,
                            List<ClusterAction> actions,
                            int limit,
                            ListMarker marker,
                            List<SortKey> sort,
                            boolean globalProject) {

    public static final Set<String> ALLOWED_PARAMS = Set.of(
            "name", "type", "cluster_id", "action", "limit", "marker", "sort", "global_project");

    /**
     * Ключ сортировки.
     *
     * @param column колонка хранилища
     * @param ascending направление
     */
    public record SortKey(String column, boolean ascending) {

        static final Set<String> ALLOWED = Set.of("name", "type", "cluster_id", "action", "created_at");
    }

    public ReceiverQuery {
        names = List.copyOf(names);
        types = List.copyOf(types);
        clusterIds = List.copyOf(clusterIds);
        actions = List.copyOf(actions);
        sort = List.copyOf(sort);
    }

    /**
     * Запрос без фильтров с лимитом по умолчанию.
     */
    public static ReceiverQuery defaults(int limit) {
        return new ReceiverQuery(List.of(), List.of(), List.of(), List.of(), limit, null,
                List.of(new SortKey("created_at", true)), false);
    }

    /**
     * Разобрать параметры запроса.
     *
     * @param params параметры (ключ → все значения)
     * @param listing ограничения листинга
     * @throws ReceiverException VALIDATION при неизвестном параметре или некорректном значении
     */
    public static ReceiverQuery parse(Map<String, List<String>> params, ClusterReceiverProperties.Listing listing) {
        Map<String, List<String>> p = params == null ? Map.of() : params;
        for (String key : p.keySet()) {
            if (!ALLOWED_PARAMS.contains(key)) {
                throw ReceiverException.validation("Недопустимый параметр запроса: '" + key + "'");
            }
        }

        List<String> names = values(p, "name");
        List<String> clusterIds = values(p, "cluster_id");

        List<ReceiverType> types = new ArrayList<>();
        for (String t : values(p, "type")) {
            types.add(ReceiverType.fromWire(t));
        }

        List<ClusterAction> actions = new ArrayList<>();
        for (String a : values(p, "action")) {
            actions.add(ClusterAction.fromName(a)
                    .orElseThrow(() -> ReceiverException.validation("Неизвестное действие в фильтре: '" + a + "'")));
        }

        int limit = listing.getDefaultLimit();
        String rawLimit = single(p, "limit");
        if (rawLimit != null) {
            try {
                limit = Integer.parseInt(rawLimit.trim());
            } catch (NumberFormatException e) {
                throw ReceiverException.validation("Параметр limit должен быть неотрицательным целым числом");
            }
            if (limit < 0) {
                throw ReceiverException.validation("Параметр limit должен быть неотрицательным целым числом");
            }
            if (limit > listing.getMaxLimit()) {
                throw ReceiverException.validation("Параметр limit не может превышать " + listing.getMaxLimit());
            }
        }

        String rawMarker = single(p, "marker");
        ListMarker marker = rawMarker == null ? null : ListMarker.parse(rawMarker);

        boolean global = false;
        String rawGlobal = single(p, "global_project");
        if (rawGlobal != null) {
            String g = rawGlobal.trim().toLowerCase(Locale.ROOT);
            if (!g.equals("true") && !g.equals("false")) {
                throw ReceiverException.validation("Параметр global_project должен быть true или false");
            }
            global = g.equals("true");
        }

        return new ReceiverQuery(names, types, clusterIds, actions, limit, marker, parseSort(single(p, "sort")), global);
    }

    static List<SortKey> parseSort(String raw) {
        List<SortKey> keys = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            keys.add(new SortKey("created_at", true));
            return keys;
        }
        for (String part : raw.split(",")) {
            String item = part.trim();
            if (item.isEmpty()) {
                continue;
            }
            String key = item;
            boolean asc = true;
            int idx = item.indexOf(':');
            if (idx >= 0) {
                key = item.substring(0, idx).trim();
                String dir = item.substring(idx + 1).trim().toLowerCase(Locale.ROOT);
                if (dir.equals("desc")) {
                    asc = false;
                } else if (!dir.equals("asc")) {
                    throw ReceiverException.validation("Некорректное направление сортировки: '" + dir + "'");
                }
            }
            if (!SortKey.ALLOWED.contains(key)) {
                throw ReceiverException.validation("Недопустимый ключ сортировки: '" + key + "'");
            }
            for (SortKey k : keys) {
                if (k.column().equals(key)) {
                    throw ReceiverException.validation("Ключ сортировки указан повторно: '" + key + "'");
                }
            }
            keys.add(new SortKey(key, asc));
        }
        if (keys.isEmpty()) {
            keys.add(new SortKey("created_at", true));
        }
        return keys;
    }

    private static List<String> values(Map<String, List<String>> p, String key) {
        List<String> out = new ArrayList<>();
        List<String> raw = p.get(key);
        if (raw == null) {
            return out;
        }
        for (String v : raw) {
            if (v != null && !v.isBlank()) {
                out.add(v.trim());
            }
        }
        return out;
    }

    private static String single(Map<String, List<String>> p, String key) {
        List<String> raw = p.get(key);
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        if (raw.size() > 1) {
            throw ReceiverException.validation("Параметр '" + key + "' указан более одного раза");
        }
        return raw.get(0);
    }
}

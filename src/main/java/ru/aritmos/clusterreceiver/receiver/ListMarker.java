package ru.aritmos.clusterreceiver.receiver;

import ru.aritmos.clusterreceiver.core.ReceiverException;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Маркер постраничного листинга: последний элемент предыдущей страницы.
 * <p>
 * Принимается в двух видах:
 * <ul>
 *   <li>id receiver'а, как его видит клиент; значения ключей сортировки берутся из записи;</li>
 *   <li>непрозрачный курсор из {@code next_marker} ответа листинга. Курсор несёт id и значения ключей
 *       сортировки, поэтому следующая страница строится и после удаления записи-маркера.</li>
 * </ul>
 *
 * @param receiverId id последнего элемента
 * @param sortValues значения ключей сортировки этого элемента (пусто для маркера-id)
 */
public record ListMarker(String receiverId, Map<String, String> sortValues) {

    private static final String CURSOR_PREFIX = "r2:";
    private static final String ID_KEY = "id";
    private static final Pattern RAW_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    public ListMarker {
        sortValues = sortValues == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sortValues));
    }

    /**
     * Курсор, указывающий на {@code last} при сортировке {@code sort}.
     */
    public static ListMarker after(Receiver last, List<ReceiverQuery.SortKey> sort) {
        Map<String, String> values = new LinkedHashMap<>();
        for (ReceiverQuery.SortKey k : sort) {
            values.put(k.column(), sortValue(last, k.column()));
        }
        return new ListMarker(last.id(), values);
    }

    /**
     * Значения ключей, если курсор покрывает всю сортировку {@code sort}.
     */
    public Optional<List<String>> valuesFor(List<ReceiverQuery.SortKey> sort) {
        if (sortValues.isEmpty()) {
            return Optional.empty();
        }
        List<String> out = new ArrayList<>();
        for (ReceiverQuery.SortKey k : sort) {
            String v = sortValues.get(k.column());
            if (v == null) {
                return Optional.empty();
            }
            out.add(v);
        }
        return Optional.of(out);
    }

    public String encode() {
        StringBuilder sb = new StringBuilder(CURSOR_PREFIX).append(ID_KEY).append('=').append(urlEncode(receiverId));
        for (Map.Entry<String, String> e : sortValues.entrySet()) {
            sb.append('&').append(e.getKey()).append('=').append(urlEncode(e.getValue()));
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Разобрать значение параметра {@code marker}: курсор или id receiver'а.
     *
     * @throws ReceiverException VALIDATION для пустого или повреждённого маркера
     */
    public static ListMarker parse(String marker) {
        if (marker == null || marker.isBlank()) {
            throw ReceiverException.validation("Пустой marker");
        }
        String value = marker.trim();
        Optional<String> cursor = cursorBody(value);
        if (cursor.isPresent()) {
            return fromCursor(cursor.get());
        }
        if (!RAW_ID.matcher(value).matches()) {
            throw ReceiverException.validation("Некорректный marker");
        }
        return new ListMarker(value, Map.of());
    }

    private static Optional<String> cursorBody(String value) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(value), StandardCharsets.UTF_8);
            return raw.startsWith(CURSOR_PREFIX) ? Optional.of(raw.substring(CURSOR_PREFIX.length())) : Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static ListMarker fromCursor(String body) {
        String id = null;
        Map<String, String> values = new LinkedHashMap<>();
        for (String pair : body.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw ReceiverException.validation("Некорректный marker");
            }
            String key = pair.substring(0, eq);
            String val;
            try {
                val = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                throw ReceiverException.validation("Некорректный marker");
            }
            if (ID_KEY.equals(key)) {
                id = val;
            } else if (ReceiverQuery.SortKey.ALLOWED.contains(key)) {
                values.put(key, val);
            } else {
                throw ReceiverException.validation("Некорректный marker");
            }
        }
        if (id == null || id.isBlank()) {
            throw ReceiverException.validation("Некорректный marker");
        }
        String createdAt = values.get("created_at");
        if (createdAt != null) {
            try {
                Instant.parse(createdAt);
            } catch (DateTimeParseException e) {
                throw ReceiverException.validation("Некорректный marker");
            }
        }
        return new ListMarker(id, values);
    }

    static String sortValue(Receiver r, String column) {
        return switch (column) {
            case "name" -> r.name();
            case "type" -> r.type().wire();
            case "cluster_id" -> r.clusterId();
            case "action" -> r.action().name();
            case "created_at" -> r.createdAt().toString();
            default -> throw new IllegalArgumentException("Неизвестная колонка сортировки: " + column);
        };
    }

    private static String urlEncode(String v) {
        return URLEncoder.encode(v, StandardCharsets.UTF_8);
    }
}

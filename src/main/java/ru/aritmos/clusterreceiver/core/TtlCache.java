package ru.aritmos.clusterreceiver.core;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Простой in-memory TTL-кэш.
 * <p>
 * Используется для краткоживущих токенов identity-сервиса:
 * <ul>
 *   <li>trust-scoped токенов, полученных при impersonation webhook-receiver'а;</li>
 *   <li>результатов валидации пользовательских токенов.</li>
 * </ul>
 * <p>
 * Важно: кэш не является источником истины. При отзыве trust запись обязательно удаляется через {@link #invalidate}.
 */
public final class TtlCache<K, V> {

    private final ConcurrentHashMap<K, Entry<V>> map = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;

    public TtlCache(Clock clock, int maxEntries) {
        this.clock = clock;
        this.maxEntries = Math.max(1, maxEntries);
    }

    /**
     * Получить значение по ключу, если оно не истекло.
     */
    public Optional<V> get(K key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry<V> e = map.get(key);
        if (e == null) {
            return Optional.empty();
        }
        if (e.expiresAtMs <= clock.millis()) {
            map.remove(key, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.value);
    }

    /**
     * Положить значение в кэш.
     * <p>
     * При переполнении сначала выбрасываются истёкшие записи, затем запись, истекающая раньше всех.
     * Живые токены остальных ключей переполнение не затрагивает.
     */
    public void put(K key, V value, long ttlMillis) {
        if (key == null || ttlMillis <= 0) {
            return;
        }
        long now = clock.millis();
        if (!map.containsKey(key) && map.size() >= maxEntries) {
            makeRoom(now);
        }
        map.put(key, new Entry<>(value, now + ttlMillis));
    }

    private void makeRoom(long now) {
        map.entrySet().removeIf(e -> e.getValue().expiresAtMs <= now);
        while (map.size() >= maxEntries) {
            K soonest = null;
            long soonestAt = Long.MAX_VALUE;
            for (Map.Entry<K, Entry<V>> e : map.entrySet()) {
                if (e.getValue().expiresAtMs < soonestAt) {
                    soonest = e.getKey();
                    soonestAt = e.getValue().expiresAtMs;
                }
            }
            if (soonest == null) {
                return;
            }
            map.remove(soonest);
        }
    }

    /**
     * Удалить значение по ключу.
     */
    public void invalidate(K key) {
        if (key != null) {
            map.remove(key);
        }
    }

    public int size() {
        return map.size();
    }

    private record Entry<V>(V value, long expiresAtMs) {
    }
}

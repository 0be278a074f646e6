package ru.aritmos.clusterreceiver.receiver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.engine.ClusterAction;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Хранилище receiver'ов в таблице {@code cr_receiver} (JDBC поверх {@link DataSource}).
 * <p>
 * {@code actor} и {@code params} хранятся как JSON-строки. Уникальность имени в проекте обеспечивает
 * ограничение {@code uq_cr_receiver_project_name}; нарушение превращается в CONFLICT.
 * <p>
 * Листинг постраничный по ключам сортировки (keyset): следующая страница начинается строго после
 * значений маркера, id используется как последний ключ. Курсор с значениями ключей не требует,
 * чтобы запись-маркер ещё существовала.
 */
@Singleton
public class JdbcReceiverStore implements ReceiverStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcReceiverStore.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final String COLUMNS =
            "id, name, type, cluster_id, action, actor_json, params_json, project, domain, user_id, created_at, updated_at";

    /** SQLSTATE класса 23 (integrity constraint violation). */
    private static final String INTEGRITY_VIOLATION_CLASS = "23";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcReceiverStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    @Override
    public Receiver insert(Receiver r) {
        String sql = "INSERT INTO cr_receiver (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, r.id());
            ps.setString(2, r.name());
            ps.setString(3, r.type().wire());
            ps.setString(4, r.clusterId());
            ps.setString(5, r.action().name());
            ps.setString(6, toJson(r.actor()));
            ps.setString(7, toJson(r.params()));
            ps.setString(8, r.project());
            ps.setString(9, r.domain());
            ps.setString(10, r.userId());
            ps.setTimestamp(11, Timestamp.from(r.createdAt()));
            ps.setTimestamp(12, Timestamp.from(r.updatedAt()));
            ps.executeUpdate();
            return r;
        } catch (SQLException e) {
            if (e.getSQLState() != null && e.getSQLState().startsWith(INTEGRITY_VIOLATION_CLASS)) {
                throw ReceiverException.conflict("Receiver с именем '" + r.name() + "' уже существует в проекте");
            }
            throw storeUnavailable("вставка receiver'а", e);
        }
    }

    @Override
    public Optional<Receiver> findById(String id) {
        List<Receiver> rows = query("SELECT " + COLUMNS + " FROM cr_receiver WHERE id=?", List.of(id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<Receiver> findByName(String project, String name) {
        if (project == null) {
            return query("SELECT " + COLUMNS + " FROM cr_receiver WHERE name=? ORDER BY id", List.of(name));
        }
        return query("SELECT " + COLUMNS + " FROM cr_receiver WHERE project=? AND name=? ORDER BY id", List.of(project, name));
    }

    @Override
    public List<Receiver> findByShortId(String project, String idPrefix) {
        String pattern = escapeLike(idPrefix) + "%";
        if (project == null) {
            return query("SELECT " + COLUMNS + " FROM cr_receiver WHERE id LIKE ? ESCAPE '!' ORDER BY id", List.of(pattern));
        }
        return query("SELECT " + COLUMNS + " FROM cr_receiver WHERE project=? AND id LIKE ? ESCAPE '!' ORDER BY id",
                List.of(project, pattern));
    }

    @Override
    public List<Receiver> list(ReceiverQuery q, String project) {
        if (q.limit() == 0) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM cr_receiver WHERE 1=1");
        List<Object> args = new ArrayList<>();

        if (project != null) {
            sql.append(" AND project=?");
            args.add(project);
        }
        appendIn(sql, args, "name", q.names());
        appendIn(sql, args, "type", q.types().stream().map(ReceiverType::wire).toList());
        appendIn(sql, args, "cluster_id", q.clusterIds());
        appendIn(sql, args, "action", q.actions().stream().map(ClusterAction::name).toList());

        if (q.marker() != null) {
            appendKeyset(sql, args, q.sort(), markerValues(q, project));
        }

        sql.append(" ORDER BY ");
        for (ReceiverQuery.SortKey k : q.sort()) {
            sql.append(k.column()).append(k.ascending() ? " ASC, " : " DESC, ");
        }
        sql.append("id ASC");
        sql.append(" LIMIT ").append(q.limit());

        return query(sql.toString(), args);
    }

    @Override
    public boolean clearActor(String id, Map<String, Object> expectedActor) {
        String sql = "UPDATE cr_receiver SET actor_json=? WHERE id=? AND actor_json=?";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, toJson(Map.of()));
            ps.setString(2, id);
            ps.setString(3, toJson(expectedActor));
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw storeUnavailable("очистка actor", e);
        }
    }

    @Override
    public boolean delete(String id) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM cr_receiver WHERE id=?")) {
            ps.setString(1, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw storeUnavailable("удаление receiver'а", e);
        }
    }

    private static void appendIn(StringBuilder sql, List<Object> args, String column, List<String> values) {
        if (values.isEmpty()) {
            return;
        }
        sql.append(" AND ").append(column).append(" IN (");
        for (int i = 0; i < values.size(); i++) {
            sql.append(i == 0 ? "?" : ",?");
            args.add(values.get(i));
        }
        sql.append(")");
    }

    /**
     * Значения ключей сортировки маркера, последним идёт id.
     * Курсор из ответа листинга несёт их сам; для маркера-id они читаются из записи.
     */
    private List<Object> markerValues(ReceiverQuery q, String project) {
        ListMarker marker = q.marker();
        List<String> raw = marker.valuesFor(q.sort()).orElse(null);
        if (raw == null) {
            Receiver row = findById(marker.receiverId())
                    .filter(m -> project == null || project.equals(m.project()))
                    .orElseThrow(() -> ReceiverException.validation("Receiver-маркер не найден"));
            raw = q.sort().stream().map(k -> ListMarker.sortValue(row, k.column())).toList();
        }
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < q.sort().size(); i++) {
            String column = q.sort().get(i).column();
            values.add(column.equals("created_at") ? Timestamp.from(Instant.parse(raw.get(i))) : raw.get(i));
        }
        values.add(marker.receiverId());
        return values;
    }

    /**
     * Условие «строго после маркера» для составного порядка:
     * {@code (k1 > v1) OR (k1 = v1 AND k2 > v2) OR ... OR (k1 = v1 AND ... AND id > marker.id)}.
     */
    private static void appendKeyset(StringBuilder sql, List<Object> args, List<ReceiverQuery.SortKey> sort, List<Object> values) {
        List<String> columns = new ArrayList<>();
        List<Boolean> ascending = new ArrayList<>();
        for (ReceiverQuery.SortKey k : sort) {
            columns.add(k.column());
            ascending.add(k.ascending());
        }
        columns.add("id");
        ascending.add(true);

        sql.append(" AND (");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sql.append(" OR ");
            }
            sql.append("(");
            for (int j = 0; j < i; j++) {
                sql.append(columns.get(j)).append("=? AND ");
                args.add(values.get(j));
            }
            sql.append(columns.get(i)).append(ascending.get(i) ? ">?" : "<?");
            args.add(values.get(i));
            sql.append(")");
        }
        sql.append(")");
    }

    private List<Receiver> query(String sql, List<?> args) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < args.size(); i++) {
                Object a = args.get(i);
                if (a instanceof Timestamp ts) {
                    ps.setTimestamp(i + 1, ts);
                } else {
                    ps.setString(i + 1, String.valueOf(a));
                }
            }
            List<Receiver> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw storeUnavailable("чтение receiver'ов", e);
        }
    }

    private Receiver map(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        Timestamp updated = rs.getTimestamp("updated_at");
        return new Receiver(
                rs.getString("id"),
                rs.getString("name"),
                ReceiverType.fromWire(rs.getString("type")),
                rs.getString("cluster_id"),
                ClusterAction.valueOf(rs.getString("action")),
                fromJson(rs.getString("actor_json")),
                fromJson(rs.getString("params_json")),
                rs.getString("project"),
                rs.getString("domain"),
                rs.getString("user_id"),
                created.toInstant(),
                updated == null ? created.toInstant() : updated.toInstant()
        );
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw ReceiverException.validation("Значение не сериализуется в JSON: " + e.getOriginalMessage());
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ReceiverException(ReceiverException.ErrorKind.INTERNAL, "Повреждённый JSON в cr_receiver", e);
        }
    }

    private static String escapeLike(String value) {
        return value.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    private static ReceiverException storeUnavailable(String operation, SQLException e) {
        log.warn("[RECEIVER] Ошибка хранилища ({}): sqlState={} {}", operation, e.getSQLState(), e.getMessage());
        return ReceiverException.unavailable("Хранилище receiver'ов недоступно: " + operation, e);
    }
}

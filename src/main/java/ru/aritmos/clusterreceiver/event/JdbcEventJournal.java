package ru.aritmos.clusterreceiver.event;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.clusterreceiver.core.ReceiverException;
import ru.aritmos.clusterreceiver.core.SensitiveDataSanitizer;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Журнал событий в таблице {@code cr_event}.
 * <p>
 * Запись событий best-effort: ошибка БД логируется и не пробрасывается.
 */
@Singleton
public class JdbcEventJournal implements EventJournal {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventJournal.class);

    private static final int MAX_REASON = 1000;

    private final DataSource dataSource;

    public JdbcEventJournal(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void record(ReceiverEvent e) {
        String sql = "INSERT INTO cr_event (id, event_ts, obj_id, obj_name, obj_type, cluster_id, action, level, status, status_reason, user_id, project) "
                + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, e.id());
            ps.setTimestamp(2, Timestamp.from(e.timestamp()));
            ps.setString(3, e.objId());
            ps.setString(4, e.objName());
            ps.setString(5, e.objType());
            ps.setString(6, e.clusterId());
            ps.setString(7, e.action());
            ps.setInt(8, e.level().code());
            ps.setString(9, e.status());
            ps.setString(10, safeShort(SensitiveDataSanitizer.sanitizeText(e.statusReason())));
            ps.setString(11, e.userId());
            ps.setString(12, e.project());
            ps.executeUpdate();
        } catch (SQLException ex) {
            log.warn("[EVENT] Не удалось записать событие {} для {}: sqlState={} {}",
                    e.action(), e.objId(), ex.getSQLState(), ex.getMessage());
        }
    }

    @Override
    public List<ReceiverEvent> list(String project, String objId, int limit) {
        StringBuilder sql = new StringBuilder(
                "SELECT id, event_ts, obj_id, obj_name, obj_type, cluster_id, action, level, status, status_reason, user_id, project FROM cr_event WHERE 1=1");
        List<String> args = new ArrayList<>();
        if (project != null) {
            sql.append(" AND project=?");
            args.add(project);
        }
        if (objId != null) {
            sql.append(" AND obj_id=?");
            args.add(objId);
        }
        sql.append(" ORDER BY event_ts DESC, id DESC LIMIT ").append(Math.max(0, limit));

        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) {
                ps.setString(i + 1, args.get(i));
            }
            List<ReceiverEvent> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ReceiverEvent(
                            rs.getString("id"),
                            rs.getTimestamp("event_ts").toInstant(),
                            rs.getString("obj_id"),
                            rs.getString("obj_name"),
                            rs.getString("obj_type"),
                            rs.getString("cluster_id"),
                            rs.getString("action"),
                            EventLevel.fromCode(rs.getInt("level")),
                            rs.getString("status"),
                            rs.getString("status_reason"),
                            rs.getString("user_id"),
                            rs.getString("project")
                    ));
                }
            }
            return out;
        } catch (SQLException ex) {
            throw ReceiverException.unavailable("Журнал событий недоступен", ex);
        }
    }

    private static String safeShort(String s) {
        if (s == null) {
            return null;
        }
        return s.length() <= MAX_REASON ? s : s.substring(0, MAX_REASON);
    }
}

package net.chime.adapter.jdbc.repo;

import net.chime.adapter.jdbc.JdbcUtil;
import net.chime.adapter.jdbc.mapper.RowMappers;
import net.chime.core.model.Reminder;
import net.chime.core.spi.ReminderRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * TB_REMINDER 저장소 (Oracle). 모든 메서드는 JdbcTxRunner 안에서 호출해야 한다.
 */
public final class JdbcReminderRepository implements ReminderRepository {

    private static final String NOW_UTC = "SYS_EXTRACT_UTC(SYSTIMESTAMP)";

    @Override
    public Reminder insert(Reminder r) {
        return JdbcUtil.inTx("insert reminder", c -> {
            long id;
            try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_REMINDER(OWNER_ID, CRON_EXPR, TIME_ZONE, PAYLOAD, ENABLED, LAST_FIRED_AT, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, %s, %s)
            """.formatted(NOW_UTC, NOW_UTC), new String[]{"ID"})) {
                int i = 1;
                ps.setString(i++, r.ownerId());
                ps.setString(i++, r.cronExpr());
                ps.setString(i++, r.timeZone());
                ps.setString(i++, r.payload());
                ps.setString(i++, JdbcUtil.flag(r.enabled()));
                JdbcUtil.setInstant(ps, i, r.lastFiredAt());
                ps.executeUpdate();
                try (ResultSet k = ps.getGeneratedKeys()) {
                    k.next();
                    id = k.getLong(1);
                }
            }
            return select(c, id).orElseThrow(() -> new IllegalStateException("insert failed to load reminder"));
        });
    }

    @Override
    public Optional<Reminder> update(long id, String cronExpr, String timeZone, String payload) {
        return JdbcUtil.inTx("update reminder " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_REMINDER
                   SET CRON_EXPR = ?, TIME_ZONE = ?, PAYLOAD = ?, UPDATED_AT = %s
                 WHERE ID = ?
            """.formatted(NOW_UTC))) {
                ps.setString(1, cronExpr);
                ps.setString(2, timeZone);
                ps.setString(3, payload);
                ps.setLong(4, id);
                if (ps.executeUpdate() == 0) return Optional.empty();
            }
            return select(c, id);
        });
    }

    @Override
    public Optional<Reminder> setEnabled(long id, boolean enabled) {
        return JdbcUtil.inTx("set enabled of reminder " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_REMINDER SET ENABLED = ?, UPDATED_AT = %s WHERE ID = ?
            """.formatted(NOW_UTC))) {
                ps.setString(1, JdbcUtil.flag(enabled));
                ps.setLong(2, id);
                if (ps.executeUpdate() == 0) return Optional.empty();
            }
            return select(c, id);
        });
    }

    @Override
    public boolean delete(long id) {
        return JdbcUtil.inTx("delete reminder " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM TB_REMINDER WHERE ID = ?")) {
                ps.setLong(1, id);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public Optional<Reminder> findById(long id) {
        return JdbcUtil.inTx("load reminder " + id, c -> select(c, id));
    }

    @Override
    public List<Reminder> findByOwner(String ownerId) {
        return JdbcUtil.inTx("list reminders of " + ownerId, c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                SELECT * FROM TB_REMINDER WHERE OWNER_ID = ? ORDER BY ID
            """)) {
                ps.setString(1, ownerId);
                return list(ps);
            }
        });
    }

    @Override
    public List<Reminder> listEnabled() {
        return JdbcUtil.inTx("list enabled reminders", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                SELECT * FROM TB_REMINDER WHERE ENABLED = 'Y' ORDER BY ID
            """)) {
                return list(ps);
            }
        });
    }

    @Override
    public boolean recordFire(long id, Instant firedAt) {
        // 단조 증가: 같거나 이전 시각이면 0건 갱신
        return JdbcUtil.inTx("record fire of reminder " + id, c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_REMINDER
                   SET LAST_FIRED_AT = ?, UPDATED_AT = %s
                 WHERE ID = ?
                   AND (LAST_FIRED_AT IS NULL OR LAST_FIRED_AT < ?)
            """.formatted(NOW_UTC))) {
                JdbcUtil.setInstant(ps, 1, firedAt);
                ps.setLong(2, id);
                JdbcUtil.setInstant(ps, 3, firedAt);
                return ps.executeUpdate() > 0;
            }
        });
    }

    private static Optional<Reminder> select(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM TB_REMINDER WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toReminder(rs));
            }
        }
    }

    private static List<Reminder> list(PreparedStatement ps) throws SQLException {
        List<Reminder> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toReminder(rs));
        }
        return out;
    }
}

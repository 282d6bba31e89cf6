package net.chime.adapter.jdbc.mapper;

import net.chime.adapter.jdbc.JdbcUtil;
import net.chime.core.model.Reminder;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Reminder ---
    public static Reminder toReminder(ResultSet rs) throws SQLException {
        return new Reminder(
                rs.getLong("ID"),
                rs.getString("OWNER_ID"),
                rs.getString("CRON_EXPR"),
                rs.getString("TIME_ZONE"),
                rs.getString("PAYLOAD"),
                "Y".equals(rs.getString("ENABLED")),
                JdbcUtil.getInstant(rs, "LAST_FIRED_AT"),
                JdbcUtil.getInstant(rs, "CREATED_AT"),
                JdbcUtil.getInstant(rs, "UPDATED_AT")
        );
    }
}

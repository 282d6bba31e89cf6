package net.chime.adapter.jdbc;

import net.chime.core.error.StoreUnavailableException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Calendar;
import java.util.TimeZone;

/**
 * 시각 컬럼은 UTC 기준 TIMESTAMP로 저장한다 (JVM 기본 타임존과 무관).
 */
public final class JdbcUtil {
    private JdbcUtil() {}

    private static final ThreadLocal<Calendar> UTC = ThreadLocal.withInitial(
            () -> Calendar.getInstance(TimeZone.getTimeZone("UTC")));

    /** 현재 트랜잭션 커넥션으로 실행, SQLException → StoreUnavailableException */
    public static <T> T inTx(String what, SqlWork<T> work) {
        Connection c = TxContext.require();
        try {
            return work.run(c);
        } catch (SQLException e) {
            throw new StoreUnavailableException(what + " failed", e);
        }
    }

    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP);
        else ps.setTimestamp(idx, Timestamp.from(i), UTC.get());
    }

    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column, UTC.get());
        return ts == null ? null : ts.toInstant();
    }

    public static String flag(boolean b) { return b ? "Y" : "N"; }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection c) throws SQLException;
    }
}

package net.chime.adapter.jdbc;

import net.chime.core.error.StoreUnavailableException;
import net.chime.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/**
 * DataSource 커넥션을 스레드에 묶어 실행하는 트랜잭션 러너.
 * 커넥션 획득/커밋 실패는 {@link StoreUnavailableException}으로 올린다.
 */
public final class JdbcTxRunner implements TxRunner {
    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // 이미 진행 중인 트랜잭션에 참여
            return body.call();
        }
        return inNewTransaction(body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        // 바깥 트랜잭션을 잠시 떼어두고 새 커넥션으로 실행, 종료 시 복원
        Connection suspended = TxContext.get();
        TxContext.clear();
        try {
            return inNewTransaction(body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T inNewTransaction(Callable<T> body) throws Exception {
        Connection c = open();
        try {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (SQLException e) {
                safeRollback(c);
                throw new StoreUnavailableException("transaction failed", e);
            } catch (Throwable t) {            // Throwable로 롤백 보장
                safeRollback(c);
                sneakyThrow(t);
                return null; // unreachable
            } finally {
                TxContext.clear();
                restoreAutoCommit(c, prevAuto);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("could not begin transaction", e);
        } finally {
            close(c);
        }
    }

    private Connection open() {
        try {
            return ds.getConnection();
        } catch (SQLException e) {
            throw new StoreUnavailableException("could not obtain connection", e);
        }
    }

    private static void safeRollback(Connection c) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.toString());
        }
    }

    private static void restoreAutoCommit(Connection c, boolean prev) {
        try { c.setAutoCommit(prev); } catch (SQLException ignore) { /* 풀 반환 시 재설정됨 */ }
    }

    private static void close(Connection c) {
        try { c.close(); } catch (SQLException ignore) { /* 반환 실패는 풀이 처리 */ }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E { throw (E) t; }
}

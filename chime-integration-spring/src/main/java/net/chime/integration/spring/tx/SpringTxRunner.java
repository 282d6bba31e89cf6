package net.chime.integration.spring.tx;

import net.chime.adapter.jdbc.TxContext;
import net.chime.core.error.StoreUnavailableException;
import net.chime.core.spi.TxRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션의 물리 커넥션을 TxContext에 꽂아 JDBC 저장소가 그대로 쓰게 한다.
 * 트랜잭션/커넥션 인프라 실패는 {@link StoreUnavailableException}.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        try {
            return tpl.execute(status -> {
                Connection suspended = TxContext.get();
                // REQUIRED 중첩이면 같은 커넥션, REQUIRES_NEW면 새 커넥션이 나온다
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedBodyFailure(e);
                } finally {
                    if (suspended != null) TxContext.set(suspended);
                    else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedBodyFailure f) {
            throw f.getCause();
        } catch (TransactionException | DataAccessException e) {
            throw new StoreUnavailableException("transaction failed", e);
        }
    }

    /** 콜백 안의 검사 예외를 템플릿 밖으로 운반 (롤백은 RuntimeException 기준) */
    private static final class CheckedBodyFailure extends RuntimeException {
        CheckedBodyFailure(Exception cause) {
            super(cause);
        }

        @Override
        public synchronized Exception getCause() {
            return (Exception) super.getCause();
        }
    }
}

package net.chime.integration.spring;

import net.chime.adapter.jdbc.repo.JdbcReminderRepository;
import net.chime.core.spi.ReminderRepository;
import net.chime.core.spi.TxRunner;
import net.chime.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** JDBC 저장소 배선: 스프링 트랜잭션 위에서 adapter-jdbc 재사용 */
@Configuration(proxyBeanMethods = false)
public class ChimeSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public ReminderRepository reminderRepository() {
        return new JdbcReminderRepository();
    }
}

package net.chime.bootstrap.autoconfigure;

import net.chime.bootstrap.catalog.CatalogRegistrar;
import net.chime.bootstrap.props.ChimeProperties;
import net.chime.bootstrap.sink.LoggingNotificationSink;
import net.chime.core.schedule.CronEvaluator;
import net.chime.core.service.ReminderChangeListener;
import net.chime.core.service.ReminderDispatcher;
import net.chime.core.service.ReminderReconciler;
import net.chime.core.service.ReminderScheduler;
import net.chime.core.service.ReminderService;
import net.chime.core.service.RetryPolicy;
import net.chime.core.service.SchedulerSettings;
import net.chime.core.spi.Clock;
import net.chime.core.spi.CronCalculator;
import net.chime.core.spi.NotificationSink;
import net.chime.core.spi.ReminderRepository;
import net.chime.core.spi.TxRunner;
import net.chime.integration.spring.ChimeSpringConfig;
import net.chime.integration.spring.sched.ChimeSchedulerLifecycle;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import javax.sql.DataSource;
import java.time.ZoneId;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration"
})
@EnableConfigurationProperties(ChimeProperties.class)
public class ChimeAutoConfiguration {

    // --- 저장소: DataSource가 있고 사용자 정의가 없으면 JDBC (integration-spring) ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnMissingBean(ReminderRepository.class)
    @Import(ChimeSpringConfig.class)
    static class JdbcStoreConfiguration {
    }

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public Clock systemClock() {
        return Clock.system();
    }

    @Bean
    @ConditionalOnMissingBean
    public CronCalculator cronCalculator() {
        return new CronEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public SchedulerSettings schedulerSettings(ChimeProperties props) {
        var s = props.getScheduler();
        return new SchedulerSettings(
                s.getDispatchThreads(),
                s.getDeliveryTimeout(),
                s.getShutdownGrace(),
                s.getMaxIdle(),
                RetryPolicy.exponential(s.getStoreRetryBackoff(), s.getStoreRetryMaxBackoff()),
                s.getRecordFireAttempts(),
                s.getReconcileAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReminderReconciler reminderReconciler(ReminderRepository reminders, TxRunner tx, CronCalculator cron) {
        return new ReminderReconciler(reminders, tx, cron);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReminderDispatcher reminderDispatcher(NotificationSink sink,
                                                 ReminderRepository reminders,
                                                 TxRunner tx,
                                                 SchedulerSettings settings) {
        return new ReminderDispatcher(sink, reminders, tx, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "chime.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ReminderScheduler reminderScheduler(ReminderRepository reminders,
                                               TxRunner tx,
                                               Clock clock,
                                               ReminderReconciler reconciler,
                                               ReminderDispatcher dispatcher,
                                               SchedulerSettings settings) {
        return new ReminderScheduler(reminders, tx, clock, reconciler, dispatcher, settings);
    }

    @Bean
    @ConditionalOnProperty(prefix = "chime.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ChimeSchedulerLifecycle chimeSchedulerLifecycle(ReminderScheduler scheduler) {
        return new ChimeSchedulerLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReminderService reminderService(ReminderRepository reminders,
                                           TxRunner tx,
                                           ObjectProvider<ReminderScheduler> scheduler) {
        // 스케줄러가 꺼져 있으면 변경 신호는 버린다
        ReminderScheduler s = scheduler.getIfAvailable();
        ReminderChangeListener listener = s != null ? s : ReminderChangeListener.NONE;
        return new ReminderService(reminders, tx, listener);
    }

    // --- 설정 파일 카탈로그 ---

    @Bean
    public CatalogRegistrar catalogRegistrar(ReminderService reminders, ChimeProperties props) {
        return new CatalogRegistrar(reminders, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "chime.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, ChimeProperties props) {
        return args -> registrar.register(props.getCatalog());
    }
}

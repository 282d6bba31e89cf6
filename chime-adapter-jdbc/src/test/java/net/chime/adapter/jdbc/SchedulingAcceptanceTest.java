package net.chime.adapter.jdbc;

import net.chime.adapter.jdbc.repo.JdbcReminderRepository;
import net.chime.core.model.Reminder;
import net.chime.core.schedule.CronEvaluator;
import net.chime.core.service.ReminderDispatcher;
import net.chime.core.service.ReminderReconciler;
import net.chime.core.service.ReminderScheduler;
import net.chime.core.service.ReminderService;
import net.chime.core.service.RetryPolicy;
import net.chime.core.service.SchedulerSettings;
import net.chime.core.spi.CronCalculator;
import net.chime.core.spi.DeliveryResult;
import net.chime.core.spi.NotificationSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/** JDBC 저장소 위에서 재조정 → 발화 → last_fired_at 기록까지 */
class SchedulingAcceptanceTest extends TestSupport {

    JdbcTxRunner tx;
    JdbcReminderRepository reminders;
    List<String> delivered;
    ReminderScheduler scheduler;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        reminders = new JdbcReminderRepository();
    }

    @BeforeEach
    void setUp() throws Exception {
        truncateReminders(tx);
        delivered = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) scheduler.stop();
    }

    private ReminderScheduler scheduler(CronCalculator cron, NotificationSink sink) {
        var settings = new SchedulerSettings(2, Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofMillis(200),
                RetryPolicy.fixed(Duration.ofMillis(100)), 3, 3);
        return new ReminderScheduler(reminders, tx, Instant::now,
                new ReminderReconciler(reminders, tx, cron),
                new ReminderDispatcher(sink, reminders, tx, settings),
                settings);
    }

    @Test
    void due_reminders_are_delivered_and_recorded() throws Exception {
        scheduler = scheduler((from, d) -> from.plusMillis(300), (owner, payload, at) -> {
            delivered.add(owner + ":" + payload);
            return DeliveryResult.ok();
        });
        var service = new ReminderService(reminders, tx, scheduler);
        Reminder r = service.createReminder("chat-1", "* * * * *", "UTC", "drink water");

        scheduler.start();

        await().atMost(10, TimeUnit.SECONDS).until(() -> delivered.contains("chat-1:drink water"));
        await().atMost(10, TimeUnit.SECONDS)
                .until(() -> tx.required(() -> reminders.findById(r.id())).orElseThrow().lastFiredAt() != null);
    }

    @Test
    @DisplayName("재시작 시 오래된 last_fired_at → 놓친 발화 없이 미래 작업 하나")
    void restart_with_stale_last_fired_schedules_one_future_job() throws Exception {
        Reminder r = tx.required(() -> reminders.insert(new Reminder(null, "chat-1", "0 * * * *", "UTC", "hourly",
                true, Instant.parse("2020-01-01T00:00:00Z"), null, null)));
        scheduler = scheduler(new CronEvaluator(), (owner, payload, at) -> {
            delivered.add(payload);
            return DeliveryResult.ok();
        });

        Instant before = Instant.now();
        scheduler.start();

        assertThat(scheduler.snapshot()).hasSize(1);
        assertThat(scheduler.jobOf(r.id()).orElseThrow().nextFireAt()).isAfter(before);
        assertThat(delivered).isEmpty();
    }
}

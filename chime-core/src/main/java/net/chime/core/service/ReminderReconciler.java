package net.chime.core.service;

import net.chime.core.error.InvalidScheduleException;
import net.chime.core.error.StoreCorruptedException;
import net.chime.core.model.Reminder;
import net.chime.core.model.ScheduledJob;
import net.chime.core.schedule.CronParser;
import net.chime.core.schedule.ScheduleDescriptor;
import net.chime.core.spi.CronCalculator;
import net.chime.core.spi.ReminderRepository;
import net.chime.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 저장소 상태로부터 실행 계획을 재구성한다.
 * <p>
 * 캐치업 정책: 다운타임 동안 놓친 발화는 보충하지 않는다.
 * 각 활성 리마인더마다 {@code max(now, lastFiredAt)} 이후의 첫 발화 하나만 계획한다.
 */
public final class ReminderReconciler {
    private static final Logger log = LoggerFactory.getLogger(ReminderReconciler.class);

    private final ReminderRepository reminders;
    private final TxRunner tx;
    private final CronCalculator cron;

    public ReminderReconciler(ReminderRepository reminders, TxRunner tx, CronCalculator cron) {
        this.reminders = reminders;
        this.tx = tx;
        this.cron = cron;
    }

    /** 활성 리마인더 전체 → 작업 목록. 저장된 스케줄이 깨져 있으면 {@link StoreCorruptedException} */
    public List<ScheduledJob> reconcile(Instant now) throws Exception {
        List<Reminder> enabled = tx.required(reminders::listEnabled);
        List<ScheduledJob> jobs = new ArrayList<>(enabled.size());
        for (Reminder r : enabled) {
            jobs.add(new ScheduledJob(r.id(), nextFireAt(r, now)));
        }
        log.info("Reconciled {} enabled reminders at {}", jobs.size(), now);
        return jobs;
    }

    public Instant nextFireAt(Reminder reminder, Instant now) {
        Instant reference = now;
        if (reminder.lastFiredAt() != null && reminder.lastFiredAt().isAfter(now)) {
            reference = reminder.lastFiredAt();
        }
        return cron.next(reference, descriptorOf(reminder));
    }

    static ScheduleDescriptor descriptorOf(Reminder reminder) {
        try {
            return CronParser.parse(reminder.cronExpr(), reminder.timeZone());
        } catch (InvalidScheduleException e) {
            throw new StoreCorruptedException(reminder.id(),
                    "stored schedule '" + reminder.cronExpr() + "' [" + reminder.timeZone() + "] is no longer valid", e);
        }
    }
}

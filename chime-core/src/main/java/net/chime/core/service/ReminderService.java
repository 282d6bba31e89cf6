package net.chime.core.service;

import net.chime.core.error.ReminderNotFoundException;
import net.chime.core.model.Reminder;
import net.chime.core.schedule.CronParser;
import net.chime.core.schedule.ScheduleDescriptor;
import net.chime.core.spi.ReminderRepository;
import net.chime.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * 리마인더 생성/수정/삭제 진입점.
 * 검증 → 저장(트랜잭션) → 커밋 후 스케줄러에 변경 신호.
 */
public final class ReminderService {
    private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

    /** 저장 컬럼 크기 (UTF-8 바이트) */
    static final int MAX_OWNER_ID_BYTES = 200;
    static final int MAX_CRON_EXPR_BYTES = 200;
    static final int MAX_PAYLOAD_BYTES = 4000;

    private final ReminderRepository reminders;
    private final TxRunner tx;
    private final ReminderChangeListener listener;

    public ReminderService(ReminderRepository reminders, TxRunner tx, ReminderChangeListener listener) {
        this.reminders = reminders;
        this.tx = tx;
        this.listener = listener != null ? listener : ReminderChangeListener.NONE;
    }

    /** 잘못된 스케줄은 {@link net.chime.core.error.InvalidScheduleException}, 저장 전에 거른다 */
    public Reminder createReminder(String ownerId, String cronExpr, String timeZone, String payload) throws Exception {
        requireText(ownerId, "ownerId", MAX_OWNER_ID_BYTES);
        requireText(payload, "payload", MAX_PAYLOAD_BYTES);
        ScheduleDescriptor d = CronParser.parse(cronExpr, timeZone);
        requireFits(d.expression(), "cronExpr", MAX_CRON_EXPR_BYTES);

        Reminder saved = tx.required(() ->
                reminders.insert(Reminder.ofNew(ownerId, d.expression(), d.timeZone(), payload)));
        log.info("Reminder {} created for owner {}: {}", saved.id(), ownerId, d);
        listener.reminderUpserted(saved);
        return saved;
    }

    public Reminder updateReminder(long id, String cronExpr, String timeZone, String payload) throws Exception {
        requireText(payload, "payload", MAX_PAYLOAD_BYTES);
        ScheduleDescriptor d = CronParser.parse(cronExpr, timeZone);
        requireFits(d.expression(), "cronExpr", MAX_CRON_EXPR_BYTES);

        Optional<Reminder> updated = tx.required(() -> reminders.update(id, d.expression(), d.timeZone(), payload));
        Reminder r = updated.orElseThrow(() -> new ReminderNotFoundException(id));
        log.info("Reminder {} rescheduled: {}", id, d);
        listener.reminderUpserted(r);
        return r;
    }

    public Reminder setEnabled(long id, boolean enabled) throws Exception {
        Optional<Reminder> updated = tx.required(() -> reminders.setEnabled(id, enabled));
        Reminder r = updated.orElseThrow(() -> new ReminderNotFoundException(id));
        log.info("Reminder {} {}", id, enabled ? "enabled" : "disabled");
        listener.reminderUpserted(r);
        return r;
    }

    /** @return 실제로 삭제했으면 true */
    public boolean deleteReminder(long id) throws Exception {
        boolean deleted = tx.required(() -> reminders.delete(id));
        if (deleted) {
            log.info("Reminder {} deleted", id);
            listener.reminderRemoved(id);
        }
        return deleted;
    }

    public Optional<Reminder> findReminder(long id) throws Exception {
        return tx.required(() -> reminders.findById(id));
    }

    public List<Reminder> listReminders(String ownerId) throws Exception {
        requireText(ownerId, "ownerId", MAX_OWNER_ID_BYTES);
        return tx.required(() -> reminders.findByOwner(ownerId));
    }

    private static void requireText(String value, String name, int maxBytes) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        requireFits(value, name, maxBytes);
    }

    private static void requireFits(String value, String name, int maxBytes) {
        int bytes = value.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > maxBytes) {
            throw new IllegalArgumentException(name + " must be at most " + maxBytes + " bytes but was " + bytes);
        }
    }
}

package net.chime.bootstrap.catalog;

import net.chime.bootstrap.props.ChimeProperties;
import net.chime.core.model.Reminder;
import net.chime.core.schedule.CronParser;
import net.chime.core.schedule.ScheduleDescriptor;
import net.chime.core.service.ReminderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;

/**
 * 설정 파일에 선언된 리마인더를 저장소에 심는다.
 * 같은 owner/스케줄/타임존/내용이 이미 있으면 건너뛴다 (멱등).
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final ReminderService reminders;
    private final ZoneId defaultZone;

    public CatalogRegistrar(ReminderService reminders, ZoneId defaultZone) {
        this.reminders = reminders;
        this.defaultZone = defaultZone;
    }

    /** @return 새로 만든 리마인더 수 */
    public int register(ChimeProperties.Catalog catalog) throws Exception {
        int created = 0;
        for (var def : catalog.getReminders()) {
            if (registerOne(def)) created++;
        }
        log.info("Catalog registered: {} declared, {} created", catalog.getReminders().size(), created);
        return created;
    }

    private boolean registerOne(ChimeProperties.ReminderDef def) throws Exception {
        if (def.getOwnerId() == null || def.getCron() == null || def.getPayload() == null) {
            throw new IllegalArgumentException("reminder.owner-id, reminder.cron and reminder.payload are required: " + def);
        }
        String zone = def.getTimeZone() != null ? def.getTimeZone() : defaultZone.getId();
        ScheduleDescriptor d = CronParser.parse(def.getCron(), zone);

        for (Reminder existing : reminders.listReminders(def.getOwnerId())) {
            if (existing.cronExpr().equals(d.expression())
                    && existing.timeZone().equals(d.timeZone())
                    && existing.payload().equals(def.getPayload())) {
                log.debug("Catalog reminder already present as {}: {}", existing.id(), def);
                return false;
            }
        }
        Reminder r = reminders.createReminder(def.getOwnerId(), d.expression(), d.timeZone(), def.getPayload());
        log.info("Catalog reminder created: id={} {}", r.id(), def);
        return true;
    }
}

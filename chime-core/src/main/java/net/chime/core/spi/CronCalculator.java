package net.chime.core.spi;

import net.chime.core.schedule.ScheduleDescriptor;

import java.time.Instant;

public interface CronCalculator {
    /** {@code from}보다 엄격히 뒤의 첫 발화 시각 (UTC) */
    Instant next(Instant from, ScheduleDescriptor schedule);
}

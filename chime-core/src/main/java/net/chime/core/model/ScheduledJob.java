package net.chime.core.model;

import java.time.Instant;

/** 스케줄러 메모리 상의 작업 항목. 영속화하지 않는다. */
public record ScheduledJob(long reminderId, Instant nextFireAt) {
}

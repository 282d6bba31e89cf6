package net.chime.core.schedule;

import net.chime.core.error.UnsatisfiableScheduleException;
import net.chime.core.spi.CronCalculator;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * 다음 발화 시각 계산 (cron-utils ExecutionTime 기반).
 * <p>
 * 현지 벽시계 시각을 UTC로 간주해 cron-utils로 후보를 뽑고, 실제 타임존 규칙은 후보마다 따로 적용한다.
 * <ul>
 *   <li>결과는 항상 기준 시각보다 엄격히 뒤, 그 중 가장 이른 순간</li>
 *   <li>서머타임 종료로 반복되는 현지 시각은 첫 번째(이른) 순간에 한 번만 발화</li>
 *   <li>서머타임 시작으로 건너뛴 현지 시각은 발화하지 않음</li>
 * </ul>
 */
public final class CronEvaluator implements CronCalculator {

    /** 윤년 2/29 + 요일 조합까지 커버하는 탐색 한도 */
    static final int SEARCH_HORIZON_YEARS = 28;

    @Override
    public Instant next(Instant from, ScheduleDescriptor schedule) {
        return nextFireAfter(schedule, from);
    }

    public static Instant nextFireAfter(ScheduleDescriptor s, Instant reference) {
        ZoneId zone = s.zone();
        ZonedDateTime cursor = LocalDateTime.ofInstant(reference, zone)
                .truncatedTo(ChronoUnit.MINUTES)
                .atZone(ZoneOffset.UTC);
        ZonedDateTime horizon = cursor.plusYears(SEARCH_HORIZON_YEARS);

        while (true) {
            Optional<ZonedDateTime> local = nextLocal(s, cursor, horizon);
            if (local.isEmpty() || local.get().isAfter(horizon)) {
                throw new UnsatisfiableScheduleException(CronField.DAY_OF_MONTH.label(),
                        "no occurrence of '" + s.expression() + "' within " + SEARCH_HORIZON_YEARS
                                + " years after " + reference);
            }
            Instant candidate = firstOccurrence(local.get().toLocalDateTime(), zone);
            // gap이면 null, 반복 구간의 두 번째 순간이면 reference 이전
            if (candidate != null && candidate.isAfter(reference)) {
                return candidate;
            }
            cursor = local.get();
        }
    }

    /** cursor 이후 첫 매칭 벽시계 시각 (UTC로 표현) */
    private static Optional<ZonedDateTime> nextLocal(ScheduleDescriptor s, ZonedDateTime cursor, ZonedDateTime horizon) {
        return switch (s.dayRule()) {
            case DAY_OF_MONTH -> s.byDayOfMonth().nextExecution(cursor);
            case DAY_OF_WEEK -> s.byDayOfWeek().nextExecution(cursor);
            case EITHER -> earlier(s.byDayOfMonth().nextExecution(cursor), s.byDayOfWeek().nextExecution(cursor));
            case BOTH -> {
                ZonedDateTime c = cursor;
                while (true) {
                    Optional<ZonedDateTime> t = s.byDayOfWeek().nextExecution(c);
                    if (t.isEmpty() || t.get().isAfter(horizon) || s.byDayOfMonth().isMatch(t.get())) {
                        yield t;
                    }
                    // 일자가 안 맞으면 그날은 건너뛴다
                    c = t.get().truncatedTo(ChronoUnit.DAYS).plusDays(1).minusMinutes(1);
                }
            }
        };
    }

    private static Optional<ZonedDateTime> earlier(Optional<ZonedDateTime> a, Optional<ZonedDateTime> b) {
        if (a.isEmpty()) return b;
        if (b.isEmpty()) return a;
        return a.get().isAfter(b.get()) ? b : a;
    }

    /** 현지 시각이 실제로 존재하면 가장 이른 UTC 순간, gap이면 null */
    static Instant firstOccurrence(LocalDateTime local, ZoneId zone) {
        List<ZoneOffset> offsets = zone.getRules().getValidOffsets(local);
        Instant earliest = null;
        for (ZoneOffset offset : offsets) {
            Instant i = local.toInstant(offset);
            if (earliest == null || i.isBefore(earliest)) earliest = i;
        }
        return earliest;
    }
}

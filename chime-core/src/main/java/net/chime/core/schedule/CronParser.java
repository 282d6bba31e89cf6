package net.chime.core.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import net.chime.core.error.InvalidScheduleException;
import net.chime.core.error.UnsatisfiableScheduleException;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 5필드 cron 식(minute hour day-of-month month day-of-week) + IANA 타임존 파서.
 * 문법 검증은 cron-utils UNIX 정의에 맡기고, 여기서는 오류 필드 지목과 날짜 조합 검사만 한다.
 * <p>
 * 월/요일 영문 약어(JAN, SUN ...)는 대소문자 무관. 요일 7은 일요일.
 */
public final class CronParser {
    public static final String TIMEZONE_FIELD = "timezone";

    private static final com.cronutils.parser.CronParser UNIX =
            new com.cronutils.parser.CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    /** 날짜 조합 검사 구간: 2/29가 최소 두 번 들어가는 8년 */
    private static final ZonedDateTime CHECK_FROM = ZonedDateTime.of(2023, 12, 31, 23, 59, 0, 0, ZoneOffset.UTC);
    private static final ZonedDateTime CHECK_UNTIL = CHECK_FROM.plusYears(8);

    // 재조정 때마다 같은 식을 다시 파싱하지 않도록 (최대 512개 LRU)
    private static final Map<String, ScheduleDescriptor> CACHE = new LruMap<>(512);

    private CronParser() {}

    public static ScheduleDescriptor parse(String expression, String timeZone) {
        ZoneId zone = parseZone(timeZone);

        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(CronField.MINUTE.label(), "cron expression is empty");
        }
        String[] f = expression.trim().toUpperCase(Locale.ROOT).split("\\s+");
        if (f.length != 5) {
            CronField blamed = f.length < 5 ? CronField.values()[f.length] : CronField.DAY_OF_WEEK;
            throw new InvalidScheduleException(blamed.label(),
                    "expected 5 fields but got " + f.length + " in '" + expression.trim() + "'");
        }
        String normalized = String.join(" ", f);
        String key = normalized + " @" + zone.getId();

        synchronized (CACHE) {
            ScheduleDescriptor cached = CACHE.get(key);
            if (cached != null) return cached;
        }
        ScheduleDescriptor d = build(normalized, f, zone);
        synchronized (CACHE) {
            CACHE.put(key, d);
        }
        return d;
    }

    public static ZoneId parseZone(String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            throw new InvalidScheduleException(TIMEZONE_FIELD, "time zone is required");
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            throw new InvalidScheduleException(TIMEZONE_FIELD, "unknown time zone '" + timeZone + "'", e);
        }
    }

    private static ScheduleDescriptor build(String normalized, String[] f, ZoneId zone) {
        try {
            UNIX.parse(normalized).validate();
        } catch (RuntimeException e) {
            throw new InvalidScheduleException(blame(f).label(), e.getMessage() + " in '" + normalized + "'", e);
        }
        var descriptor = new ScheduleDescriptor(
                normalized,
                zone,
                ScheduleDescriptor.DayRule.of(f[2], f[4]),
                ExecutionTime.forCron(cron(f[0], f[1], f[2], f[3], "*")),
                ExecutionTime.forCron(cron(f[0], f[1], "*", f[3], f[4])));

        checkSatisfiable(descriptor);
        return descriptor;
    }

    private static Cron cron(String... fields) {
        return UNIX.parse(String.join(" ", fields)).validate();
    }

    /** 필드 하나만 남기고 나머지를 '*'로 바꿔 다시 파싱해 원인 필드를 찾는다 */
    private static CronField blame(String[] f) {
        for (CronField field : CronField.values()) {
            String[] only = {"*", "*", "*", "*", "*"};
            only[field.ordinal()] = f[field.ordinal()];
            try {
                cron(only);
            } catch (RuntimeException e) {
                return field;
            }
        }
        return CronField.MINUTE;
    }

    /**
     * 일자가 day-of-month에 묶이는 경우(요일 필드가 '*'로 시작),
     * 선택된 월 중 하나라도 해당 일자를 가질 수 있어야 한다. 2월은 29일까지 인정.
     * 요일만으로 매칭될 수 있으면(OR 규칙이거나 일자 '*') 매주 해당 요일이 오므로 항상 만족된다.
     */
    private static void checkSatisfiable(ScheduleDescriptor d) {
        if (d.dayRule() == ScheduleDescriptor.DayRule.DAY_OF_WEEK
                || d.dayRule() == ScheduleDescriptor.DayRule.EITHER) {
            return;
        }
        Optional<ZonedDateTime> first = d.byDayOfMonth().nextExecution(CHECK_FROM);
        if (first.isEmpty() || first.get().isAfter(CHECK_UNTIL)) {
            throw new UnsatisfiableScheduleException(CronField.DAY_OF_MONTH.label(),
                    "no selected month has the selected day in '" + d.expression() + "'");
        }
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;

        LruMap(int max) {
            super(16, 0.75f, true);
            this.max = max;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            return size() > max;
        }
    }
}

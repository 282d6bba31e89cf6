package net.chime.core.schedule;

import com.cronutils.model.time.ExecutionTime;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * 정규화된 cron 스케줄 + 타임존. {@link CronParser}로만 생성할 것.
 * <p>
 * 두 일자 필드를 따로 평가할 수 있도록 식을 둘로 나눠 보관한다.
 * {@code byDayOfMonth}는 요일 필드를 '*'로, {@code byDayOfWeek}는 일자 필드를 '*'로 바꾼 식이다.
 */
public record ScheduleDescriptor(
        String expression,      // 대문자/공백 정규화된 식, 저장용
        ZoneId zone,
        DayRule dayRule,
        ExecutionTime byDayOfMonth,
        ExecutionTime byDayOfWeek
) {
    /**
     * 고전 cron 일자 규칙.
     * 한쪽 필드가 '*'로 시작하면 둘 다 맞아야 하고(AND), 둘 다 제한되어 있으면 하나만 맞아도 된다(OR).
     */
    public enum DayRule {
        /** 요일 필드가 정확히 '*' */
        DAY_OF_MONTH,
        /** 일자 필드가 정확히 '*' */
        DAY_OF_WEEK,
        BOTH,
        EITHER;

        static DayRule of(String dayOfMonth, String dayOfWeek) {
            if (dayOfWeek.equals("*")) return DAY_OF_MONTH;
            if (dayOfMonth.equals("*")) return DAY_OF_WEEK;
            if (dayOfMonth.startsWith("*") || dayOfWeek.startsWith("*")) return BOTH;
            return EITHER;
        }
    }

    public String timeZone() {
        return zone.getId();
    }

    /** 현지 벽시계 시각(분 단위)이 스케줄에 맞는지. 서머타임 전이는 따지지 않는다 */
    public boolean matches(LocalDateTime local) {
        ZonedDateTime t = local.truncatedTo(ChronoUnit.MINUTES).atZone(ZoneOffset.UTC);
        return switch (dayRule) {
            case DAY_OF_MONTH -> byDayOfMonth.isMatch(t);
            case DAY_OF_WEEK -> byDayOfWeek.isMatch(t);
            case BOTH -> byDayOfMonth.isMatch(t) && byDayOfWeek.isMatch(t);
            case EITHER -> byDayOfMonth.isMatch(t) || byDayOfWeek.isMatch(t);
        };
    }

    @Override
    public String toString() {
        return expression + " [" + zone.getId() + "]";
    }
}

package net.chime.core.schedule;

import net.chime.core.error.InvalidScheduleException;
import net.chime.core.error.UnsatisfiableScheduleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronParserTest {

    @Test
    @DisplayName("공백 정규화 + 타임존 보존")
    void normalizes_whitespace_and_keeps_zone() {
        ScheduleDescriptor d = CronParser.parse("  0   15 *\t* 0 ", "Europe/Warsaw");

        assertEquals("0 15 * * 0", d.expression());
        assertEquals(ZoneId.of("Europe/Warsaw"), d.zone());
        assertEquals("Europe/Warsaw", d.timeZone());
        assertEquals(ScheduleDescriptor.DayRule.DAY_OF_WEEK, d.dayRule());
    }

    @Test
    void month_and_day_names_are_case_insensitive() {
        ScheduleDescriptor d = CronParser.parse("0 9 * jan,Jul MON-fri", "UTC");

        assertEquals("0 9 * JAN,JUL MON-FRI", d.expression());
        // 2024-01-05 금요일, 2024-01-06 토요일
        assertTrue(d.matches(LocalDateTime.of(2024, 1, 5, 9, 0)));
        assertFalse(d.matches(LocalDateTime.of(2024, 1, 6, 9, 0)));
        assertTrue(d.matches(LocalDateTime.of(2024, 7, 1, 9, 0)));
        assertFalse(d.matches(LocalDateTime.of(2024, 2, 1, 9, 0)));
    }

    @Test
    @DisplayName("요일 7 = 일요일")
    void day_of_week_seven_is_sunday() {
        ScheduleDescriptor seven = CronParser.parse("0 9 * * 7", "UTC");
        ScheduleDescriptor zero = CronParser.parse("0 9 * * 0", "UTC");

        assertTrue(zero.matches(LocalDateTime.of(2024, 3, 3, 9, 0))); // 일요일
        assertTrue(seven.matches(LocalDateTime.of(2024, 3, 3, 9, 0)));
        assertFalse(seven.matches(LocalDateTime.of(2024, 3, 4, 9, 0)));
    }

    @Test
    void steps_ranges_and_lists() {
        ScheduleDescriptor d = CronParser.parse("*/20 8-18/5 1,15 * *", "UTC");

        assertTrue(d.matches(LocalDateTime.of(2024, 3, 1, 8, 0)));
        assertTrue(d.matches(LocalDateTime.of(2024, 3, 1, 13, 40)));
        assertTrue(d.matches(LocalDateTime.of(2024, 3, 15, 18, 20)));
        assertFalse(d.matches(LocalDateTime.of(2024, 3, 1, 13, 41)));
        assertFalse(d.matches(LocalDateTime.of(2024, 3, 1, 9, 0)));
        assertFalse(d.matches(LocalDateTime.of(2024, 3, 2, 8, 0)));
    }

    @Test
    void start_with_step_runs_to_field_max() {
        ScheduleDescriptor d = CronParser.parse("50/5 * * * *", "UTC");
        assertTrue(d.matches(LocalDateTime.of(2024, 3, 1, 7, 50)));
        assertTrue(d.matches(LocalDateTime.of(2024, 3, 1, 7, 55)));
        assertFalse(d.matches(LocalDateTime.of(2024, 3, 1, 7, 45)));
        assertFalse(d.matches(LocalDateTime.of(2024, 3, 1, 8, 0)));
    }

    @ParameterizedTest
    @CsvSource({
            "'60 * * * *',      minute",
            "'x * * * *',       minute",
            "'* 24 * * *',      hour",
            "'* * 0 * *',       day-of-month",
            "'* * * 13 *',      month",
            "'* * * FOO *',     month",
            "'* * * * 8',       day-of-week",
            "'* * * *',         day-of-week",
            "'* *',             day-of-month",
            "'* * * * * *',     day-of-week",
            "'',                minute"
    })
    @DisplayName("잘못된 필드는 이름으로 지목된다")
    void invalid_field_is_named(String expression, String field) {
        assertThatThrownBy(() -> CronParser.parse(expression, "UTC"))
                .isInstanceOf(InvalidScheduleException.class)
                .satisfies(e -> assertEquals(field, ((InvalidScheduleException) e).field()))
                .hasMessageStartingWith(field + ": ");
    }

    @Test
    void same_expression_and_zone_is_parsed_once() {
        assertThat(CronParser.parse("0 9 * * 1", "Asia/Seoul"))
                .isSameAs(CronParser.parse(" 0  9 *  * 1 ", "Asia/Seoul"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Mars/Olympus", "", "  "})
    void unknown_or_missing_zone_is_rejected(String zone) {
        assertThatThrownBy(() -> CronParser.parse("0 9 * * *", zone))
                .isInstanceOf(InvalidScheduleException.class)
                .satisfies(e -> assertEquals(CronParser.TIMEZONE_FIELD, ((InvalidScheduleException) e).field()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0 0 30 2 *", "0 0 31 FEB *", "0 0 31 4,6,9,11 *", "0 0 30,31 2 *"})
    @DisplayName("절대 오지 않는 날짜 조합은 거부")
    void unsatisfiable_day_month_combinations(String expression) {
        assertThatThrownBy(() -> CronParser.parse(expression, "UTC"))
                .isInstanceOf(UnsatisfiableScheduleException.class)
                .satisfies(e -> assertEquals("day-of-month", ((InvalidScheduleException) e).field()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0 0 29 2 *", "0 0 31 * *", "0 0 30 2 MON", "0 0 15,30 2 *"})
    void satisfiable_edge_combinations(String expression) {
        assertThat(CronParser.parse(expression, "UTC")).isNotNull();
    }

    @Test
    @DisplayName("두 일자 필드가 모두 제한되면 OR")
    void restricted_day_fields_match_either() {
        ScheduleDescriptor d = CronParser.parse("0 0 13 * 5", "UTC");

        assertEquals(ScheduleDescriptor.DayRule.EITHER, d.dayRule());
        assertTrue(d.matches(LocalDateTime.of(2024, 9, 6, 0, 0)));   // 금요일
        assertTrue(d.matches(LocalDateTime.of(2024, 8, 13, 0, 0)));  // 화요일, 13일
        assertFalse(d.matches(LocalDateTime.of(2024, 9, 7, 0, 0)));
    }

    @Test
    void star_day_field_forces_and() {
        ScheduleDescriptor d = CronParser.parse("0 0 */2 * 1", "UTC");

        assertEquals(ScheduleDescriptor.DayRule.BOTH, d.dayRule());
        // 2024-09-02 월요일(짝수일) → 날짜 목록(1,3,5..)에 없음
        assertFalse(d.matches(LocalDateTime.of(2024, 9, 2, 0, 0)));
        // 2024-09-09 월요일, 9일
        assertTrue(d.matches(LocalDateTime.of(2024, 9, 9, 0, 0)));
        assertFalse(d.matches(LocalDateTime.of(2024, 9, 3, 0, 0)));
    }
}

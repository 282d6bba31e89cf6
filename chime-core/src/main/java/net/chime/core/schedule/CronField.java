package net.chime.core.schedule;

/** 5필드 cron의 필드 순서와 오류 메시지용 이름 */
public enum CronField {
    MINUTE("minute"),
    HOUR("hour"),
    DAY_OF_MONTH("day-of-month"),
    MONTH("month"),
    DAY_OF_WEEK("day-of-week");

    private final String label;

    CronField(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

package net.chime.core.error;

/** cron 식 또는 타임존 검증 실패. {@link #field()}가 문제 필드를 가리킨다. */
public class InvalidScheduleException extends IllegalArgumentException {
    private final String field;

    public InvalidScheduleException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public InvalidScheduleException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}

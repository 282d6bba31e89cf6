package net.chime.core.error;

/** 문법상 올바르지만 절대 매칭되지 않는 스케줄 (예: 2월 30일). */
public class UnsatisfiableScheduleException extends InvalidScheduleException {
    public UnsatisfiableScheduleException(String field, String message) {
        super(field, message);
    }
}

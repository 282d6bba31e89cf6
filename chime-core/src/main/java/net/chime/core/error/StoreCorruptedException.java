package net.chime.core.error;

/** 이전에 승인된 데이터로 유효한 스케줄을 만들 수 없음. 기동 실패로 처리한다. */
public class StoreCorruptedException extends IllegalStateException {
    private final long reminderId;

    public StoreCorruptedException(long reminderId, String message, Throwable cause) {
        super("reminder " + reminderId + ": " + message, cause);
        this.reminderId = reminderId;
    }

    public long reminderId() {
        return reminderId;
    }
}

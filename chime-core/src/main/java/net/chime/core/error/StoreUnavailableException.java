package net.chime.core.error;

/**
 * 리마인더 저장소 I/O 실패.
 * 호출자는 부분 성공을 가정하지 않는다.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

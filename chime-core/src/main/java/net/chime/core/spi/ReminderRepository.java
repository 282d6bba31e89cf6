package net.chime.core.spi;

import net.chime.core.model.Reminder;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 리마인더 저장소. 모든 변경은 레코드 단위로 원자적이다.
 * I/O 실패는 {@link net.chime.core.error.StoreUnavailableException}으로 올라온다.
 */
public interface ReminderRepository {
    /** id/createdAt/updatedAt은 저장소가 채운다 */
    Reminder insert(Reminder reminder);

    /** 스케줄/페이로드 갱신. 대상이 없으면 empty */
    Optional<Reminder> update(long id, String cronExpr, String timeZone, String payload);

    Optional<Reminder> setEnabled(long id, boolean enabled);

    boolean delete(long id);

    Optional<Reminder> findById(long id);

    List<Reminder> findByOwner(String ownerId);

    /** Reconciler 전용: 활성 리마인더 전체 */
    List<Reminder> listEnabled();

    /**
     * last_fired_at = firedAt, 단 기존 값보다 클 때만 (멱등).
     * @return 실제로 갱신되었으면 true
     */
    boolean recordFire(long id, Instant firedAt);
}

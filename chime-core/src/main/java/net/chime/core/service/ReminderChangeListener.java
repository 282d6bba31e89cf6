package net.chime.core.service;

import net.chime.core.model.Reminder;

/**
 * 저장소 변경 신호. 스케줄러는 이를 메시지로 받아 루프 안에서 반영한다.
 * 구현체는 호출 스레드에서 스케줄 상태를 직접 건드리면 안 된다.
 */
public interface ReminderChangeListener {
    ReminderChangeListener NONE = new ReminderChangeListener() {
        @Override public void reminderUpserted(Reminder reminder) {}
        @Override public void reminderRemoved(long reminderId) {}
        @Override public void resyncRequested() {}
    };

    /** 생성/수정/활성화 변경 (비활성 상태면 작업 제거) */
    void reminderUpserted(Reminder reminder);

    void reminderRemoved(long reminderId);

    /** 대량 외부 변경 후 전체 재조정 요청 */
    void resyncRequested();
}

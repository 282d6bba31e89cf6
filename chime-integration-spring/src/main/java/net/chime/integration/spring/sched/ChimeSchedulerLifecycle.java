package net.chime.integration.spring.sched;

import net.chime.core.service.ReminderScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * 애플리케이션 컨텍스트와 스케줄러 루프의 수명을 맞춘다.
 * 기동 시 재조정 실패(저장소 손상, 재시도 소진)는 컨텍스트 기동 실패로 이어진다.
 */
public class ChimeSchedulerLifecycle implements SmartLifecycle {
    /** 웹 서버 등 다른 라이프사이클 빈보다 늦게 시작, 먼저 정지 */
    public static final int PHASE = Integer.MAX_VALUE - 1024;

    private final ReminderScheduler scheduler;

    public ChimeSchedulerLifecycle(ReminderScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        try {
            scheduler.start();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Reminder scheduler failed to start", e);
        }
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}

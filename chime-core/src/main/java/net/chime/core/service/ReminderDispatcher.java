package net.chime.core.service;

import net.chime.core.error.StoreUnavailableException;
import net.chime.core.model.Reminder;
import net.chime.core.spi.DeliveryResult;
import net.chime.core.spi.NotificationSink;
import net.chime.core.spi.ReminderRepository;
import net.chime.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 발화 한 건 처리: 외부 콜백 호출 → last_fired_at 기록.
 * 전달 실패(예외/타임아웃/거절)는 로그만 남기고, 기록은 결과와 무관하게 항상 시도한다.
 */
public final class ReminderDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReminderDispatcher.class);

    private final NotificationSink sink;
    private final ReminderRepository reminders;
    private final TxRunner tx;
    private final SchedulerSettings settings;
    private final ThreadPoolExecutor deliveryPool;

    public ReminderDispatcher(NotificationSink sink,
                              ReminderRepository reminders,
                              TxRunner tx,
                              SchedulerSettings settings) {
        this.sink = sink;
        this.reminders = reminders;
        this.tx = tx;
        this.settings = settings;
        // 인터럽트를 무시하는 콜백이 스레드를 붙잡아도 풀은 dispatchThreads개를 넘지 않는다. 대기열이 차면 거절
        int threads = settings.dispatchThreads();
        this.deliveryPool = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(threads), DaemonThreads.named("chime-delivery-"));
    }

    public DispatchOutcome dispatch(Reminder reminder, Instant firedAt) {
        DeliveryResult delivery = deliver(reminder, firedAt);
        if (delivery.delivered()) {
            log.debug("Delivered reminder {} to owner {} for {}", reminder.id(), reminder.ownerId(), firedAt);
        } else {
            log.warn("Delivery failed for reminder {} (owner {}) at {}: {}",
                    reminder.id(), reminder.ownerId(), firedAt, delivery.reason());
        }
        boolean recorded = recordFire(reminder.id(), firedAt);
        return new DispatchOutcome(reminder.id(), firedAt, delivery, recorded);
    }

    private DeliveryResult deliver(Reminder reminder, Instant firedAt) {
        Future<DeliveryResult> f;
        try {
            f = deliveryPool.submit(() -> sink.deliver(reminder.ownerId(), reminder.payload(), firedAt));
        } catch (RuntimeException e) {
            return DeliveryResult.rejected("delivery not started: " + e);
        }

        Duration timeout = settings.deliveryTimeout();
        try {
            DeliveryResult r = f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return r != null ? r : DeliveryResult.rejected("sink returned no result");
        } catch (TimeoutException e) {
            f.cancel(true);
            deliveryPool.purge();
            return DeliveryResult.rejected("timed out after " + timeout);
        } catch (ExecutionException e) {
            return DeliveryResult.rejected(String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            return DeliveryResult.rejected("interrupted");
        }
    }

    /** 저장소 장애는 설정된 횟수까지 백오프 재시도 */
    boolean recordFire(long reminderId, Instant firedAt) {
        int maxAttempts = settings.recordFireAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                boolean advanced = tx.required(() -> reminders.recordFire(reminderId, firedAt));
                if (!advanced) {
                    log.debug("last_fired_at of reminder {} already at or after {}", reminderId, firedAt);
                }
                return true;
            } catch (StoreUnavailableException e) {
                if (attempt >= maxAttempts) {
                    log.error("Giving up recording fire of reminder {} at {} after {} attempts",
                            reminderId, firedAt, attempt, e);
                    return false;
                }
                Duration backoff = settings.storeRetry().nextBackoff(attempt);
                log.warn("Store unavailable recording fire of reminder {} (attempt {}/{}), retrying in {}",
                        reminderId, attempt, maxAttempts, backoff);
                if (!sleep(backoff)) return false;
            } catch (Exception e) {
                log.error("Failed to record fire of reminder {} at {}", reminderId, firedAt, e);
                return false;
            }
        }
    }

    private static boolean sleep(Duration d) {
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        deliveryPool.shutdownNow();
    }

    /** recorded: last_fired_at 기록 호출이 성공했는지 (값이 이미 더 최신이어도 true) */
    public record DispatchOutcome(long reminderId, Instant firedAt, DeliveryResult delivery, boolean recorded) {
    }
}

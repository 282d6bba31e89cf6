package net.chime.core.service;

import java.time.Duration;
import java.util.Objects;

public record SchedulerSettings(
        int dispatchThreads,
        Duration deliveryTimeout,
        Duration shutdownGrace,
        Duration maxIdle,           // 루프가 한 번에 잠드는 최대 시간 (벽시계 점프 감지)
        RetryPolicy storeRetry,
        int recordFireAttempts,
        int reconcileAttempts
) {
    public SchedulerSettings {
        if (dispatchThreads <= 0) throw new IllegalArgumentException("dispatchThreads must be positive");
        if (recordFireAttempts <= 0) throw new IllegalArgumentException("recordFireAttempts must be positive");
        if (reconcileAttempts <= 0) throw new IllegalArgumentException("reconcileAttempts must be positive");
        Objects.requireNonNull(deliveryTimeout, "deliveryTimeout");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        Objects.requireNonNull(maxIdle, "maxIdle");
        Objects.requireNonNull(storeRetry, "storeRetry");
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(
                4,
                Duration.ofSeconds(10),
                Duration.ofSeconds(30),
                Duration.ofMinutes(1),
                RetryPolicy.exponential(Duration.ofSeconds(1), Duration.ofMinutes(1)),
                3,
                5);
    }
}

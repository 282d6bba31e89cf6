package net.chime.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** attempt는 1부터 */
    Duration nextBackoff(long attempt);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }

    /** initial * 2^(attempt-1), 상한 max */
    static RetryPolicy exponential(Duration initial, Duration max) {
        return attempt -> {
            long shift = Math.min(Math.max(attempt - 1, 0), 20);
            Duration d = initial.multipliedBy(1L << shift);
            return d.compareTo(max) > 0 ? max : d;
        };
    }
}

package net.chime.bootstrap.sink;

import net.chime.core.spi.DeliveryResult;
import net.chime.core.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/** 실제 전달 채널이 없을 때의 기본 싱크: 로그로만 남긴다 */
public class LoggingNotificationSink implements NotificationSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public DeliveryResult deliver(String ownerId, String payload, Instant firedAt) {
        log.info("Reminder for {} at {}: {}", ownerId, firedAt, payload);
        return DeliveryResult.ok();
    }
}

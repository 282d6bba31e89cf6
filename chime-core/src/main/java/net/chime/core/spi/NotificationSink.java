package net.chime.core.spi;

import java.time.Instant;

/**
 * 외부 알림 전달 콜백 (텔레그램 봇 등).
 * 디스패처가 타임아웃을 강제하므로 구현체는 블로킹이어도 된다.
 */
@FunctionalInterface
public interface NotificationSink {
    DeliveryResult deliver(String ownerId, String payload, Instant firedAt) throws Exception;
}

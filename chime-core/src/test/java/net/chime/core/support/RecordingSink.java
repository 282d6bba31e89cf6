package net.chime.core.support;

import net.chime.core.spi.DeliveryResult;
import net.chime.core.spi.NotificationSink;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** 호출을 기록하고, 지정된 동작(기본: 성공)으로 응답한다 */
public final class RecordingSink implements NotificationSink {
    public record Delivery(String ownerId, String payload, Instant firedAt) {}

    private final List<Delivery> calls = new CopyOnWriteArrayList<>();
    private volatile NotificationSink behavior = (owner, payload, firedAt) -> DeliveryResult.ok();

    public RecordingSink respondWith(NotificationSink behavior) {
        this.behavior = behavior;
        return this;
    }

    @Override
    public DeliveryResult deliver(String ownerId, String payload, Instant firedAt) throws Exception {
        calls.add(new Delivery(ownerId, payload, firedAt));
        return behavior.deliver(ownerId, payload, firedAt);
    }

    public List<Delivery> calls() {
        return List.copyOf(calls);
    }
}

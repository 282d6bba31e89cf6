package net.chime.core.model;

import java.time.Instant;

public record Reminder(
        Long id,
        String ownerId,
        String cronExpr,
        String timeZone,    // IANA, 예: "Europe/Warsaw"
        String payload,
        boolean enabled,
        Instant lastFiredAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static Reminder ofNew(String ownerId, String cronExpr, String timeZone, String payload) {
        return new Reminder(null, ownerId, cronExpr, timeZone, payload, true, null, null, null);
    }
}

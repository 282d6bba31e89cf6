package net.chime.core.error;

public class ReminderNotFoundException extends IllegalArgumentException {
    private final long reminderId;

    public ReminderNotFoundException(long reminderId) {
        super("Reminder not found: " + reminderId);
        this.reminderId = reminderId;
    }

    public long reminderId() {
        return reminderId;
    }
}

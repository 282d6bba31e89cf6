package net.chime.core.spi;

public record DeliveryResult(boolean delivered, String reason) {
    private static final DeliveryResult OK = new DeliveryResult(true, null);

    public static DeliveryResult ok() {
        return OK;
    }

    public static DeliveryResult rejected(String reason) {
        return new DeliveryResult(false, reason);
    }
}

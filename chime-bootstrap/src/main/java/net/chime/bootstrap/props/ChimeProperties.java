package net.chime.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("chime")
public class ChimeProperties {
    private String zone = "UTC";    // 카탈로그 항목에 time-zone이 없을 때 기본값
    private Scheduler scheduler = new Scheduler();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int dispatchThreads = 4;
        private Duration deliveryTimeout = Duration.ofSeconds(10);
        private Duration shutdownGrace = Duration.ofSeconds(30);
        private Duration maxIdle = Duration.ofMinutes(1);
        private Duration storeRetryBackoff = Duration.ofSeconds(1);
        private Duration storeRetryMaxBackoff = Duration.ofMinutes(1);
        private int recordFireAttempts = 3;
        private int reconcileAttempts = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getDispatchThreads() {
            return dispatchThreads;
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
        }

        public Duration getDeliveryTimeout() {
            return deliveryTimeout;
        }

        public void setDeliveryTimeout(Duration deliveryTimeout) {
            this.deliveryTimeout = deliveryTimeout;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }

        public Duration getMaxIdle() {
            return maxIdle;
        }

        public void setMaxIdle(Duration maxIdle) {
            this.maxIdle = maxIdle;
        }

        public Duration getStoreRetryBackoff() {
            return storeRetryBackoff;
        }

        public void setStoreRetryBackoff(Duration storeRetryBackoff) {
            this.storeRetryBackoff = storeRetryBackoff;
        }

        public Duration getStoreRetryMaxBackoff() {
            return storeRetryMaxBackoff;
        }

        public void setStoreRetryMaxBackoff(Duration storeRetryMaxBackoff) {
            this.storeRetryMaxBackoff = storeRetryMaxBackoff;
        }

        public int getRecordFireAttempts() {
            return recordFireAttempts;
        }

        public void setRecordFireAttempts(int recordFireAttempts) {
            this.recordFireAttempts = recordFireAttempts;
        }

        public int getReconcileAttempts() {
            return reconcileAttempts;
        }

        public void setReconcileAttempts(int reconcileAttempts) {
            this.reconcileAttempts = reconcileAttempts;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<ReminderDef> reminders = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<ReminderDef> getReminders() {
            return reminders;
        }

        public void setReminders(List<ReminderDef> reminders) {
            this.reminders = reminders;
        }
    }

    public static class ReminderDef {
        private String ownerId;
        private String cron;
        private String timeZone;
        private String payload;

        public String getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(String ownerId) {
            this.ownerId = ownerId;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }

        public String getPayload() {
            return payload;
        }

        public void setPayload(String payload) {
            this.payload = payload;
        }

        @Override
        public String toString() {
            return "ReminderDef{" +
                    "ownerId='" + ownerId + '\'' +
                    ", cron='" + cron + '\'' +
                    ", timeZone='" + timeZone + '\'' +
                    '}';
        }
    }
}

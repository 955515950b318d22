package com.everrich.reconciliation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the allocation and escalation ledger.
 * These can be customized in application.yml under the {@code reconciliation} prefix.
 */
@Component
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    /**
     * Actor recorded in history entries written by background jobs.
     * Default: system
     */
    private String systemActor = "system";

    private final Allocation allocation = new Allocation();
    private final Escalation escalation = new Escalation();
    private final Analytics analytics = new Analytics();
    private final Notification notification = new Notification();

    public String getSystemActor() {
        return systemActor;
    }

    public void setSystemActor(String systemActor) {
        this.systemActor = systemActor;
    }

    public Allocation getAllocation() {
        return allocation;
    }

    public Escalation getEscalation() {
        return escalation;
    }

    public Analytics getAnalytics() {
        return analytics;
    }

    public Notification getNotification() {
        return notification;
    }

    public static class Allocation {

        /**
         * How many times a whole operation is attempted when it hits an optimistic version conflict.
         * Default: 3
         */
        private int maxAttempts = 3;

        /**
         * Pause between attempts, in milliseconds.
         * Default: 25
         */
        private long retryBackoffMillis = 25;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryBackoffMillis() {
            return retryBackoffMillis;
        }

        public void setRetryBackoffMillis(long retryBackoffMillis) {
            this.retryBackoffMillis = retryBackoffMillis;
        }
    }

    public static class Escalation {

        /**
         * Days until escalation when no company rule matches a case.
         * Default: 7
         */
        private int defaultAfterDays = 7;

        /**
         * Highest escalation level. Levels start at 1.
         * Default: 5
         */
        private int maxLevel = 5;

        /**
         * Cron expression for the background sweep.
         * Default: top of every hour
         */
        private String sweepCron = "0 0 * * * *";

        /**
         * Recipient used for escalation notifications when the matching rule names none.
         */
        private String defaultRecipient = "finance-team";

        /**
         * Template used for escalation notifications when the matching rule names none.
         */
        private String defaultTemplate = "case-escalated";

        /**
         * Case amount (minor units) from which the business impact is MEDIUM.
         */
        private long mediumImpactAmount = 100_000;

        /**
         * Case amount (minor units) from which the business impact is HIGH.
         */
        private long highImpactAmount = 1_000_000;

        /**
         * Case amount (minor units) from which the business impact is CRITICAL.
         */
        private long criticalImpactAmount = 5_000_000;

        public int getDefaultAfterDays() {
            return defaultAfterDays;
        }

        public void setDefaultAfterDays(int defaultAfterDays) {
            this.defaultAfterDays = defaultAfterDays;
        }

        public int getMaxLevel() {
            return maxLevel;
        }

        public void setMaxLevel(int maxLevel) {
            this.maxLevel = maxLevel;
        }

        public String getSweepCron() {
            return sweepCron;
        }

        public void setSweepCron(String sweepCron) {
            this.sweepCron = sweepCron;
        }

        public String getDefaultRecipient() {
            return defaultRecipient;
        }

        public void setDefaultRecipient(String defaultRecipient) {
            this.defaultRecipient = defaultRecipient;
        }

        public String getDefaultTemplate() {
            return defaultTemplate;
        }

        public void setDefaultTemplate(String defaultTemplate) {
            this.defaultTemplate = defaultTemplate;
        }

        public long getMediumImpactAmount() {
            return mediumImpactAmount;
        }

        public void setMediumImpactAmount(long mediumImpactAmount) {
            this.mediumImpactAmount = mediumImpactAmount;
        }

        public long getHighImpactAmount() {
            return highImpactAmount;
        }

        public void setHighImpactAmount(long highImpactAmount) {
            this.highImpactAmount = highImpactAmount;
        }

        public long getCriticalImpactAmount() {
            return criticalImpactAmount;
        }

        public void setCriticalImpactAmount(long criticalImpactAmount) {
            this.criticalImpactAmount = criticalImpactAmount;
        }
    }

    public static class Analytics {

        /**
         * Cron expression for the daily analytics recomputation.
         * Default: 02:00 every day
         */
        private String cron = "0 0 2 * * *";

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }
    }

    public static class Notification {

        /**
         * Delivery attempts after which a failed notification is left alone.
         * Default: 3
         */
        private int maxAttempts = 3;

        /**
         * Cron expression for redelivering failed notifications.
         * Default: every 15 minutes
         */
        private String retryCron = "0 */15 * * * *";

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public String getRetryCron() {
            return retryCron;
        }

        public void setRetryCron(String retryCron) {
            this.retryCron = retryCron;
        }
    }
}

package com.clapgrow.reminder.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the reminder tick.
 *
 * Maps to:
 * cron:
 *   secret: ${CRON_SECRET}
 *   max-batch: 50
 *   max-runtime-ms: 25000
 *   send-delay-ms: 0
 *   stale-lock-timeout-seconds: 600
 *   failed-retry:
 *     enabled: false
 *     max-attempts: 5
 */
@Configuration
@ConfigurationProperties(prefix = "cron")
@Data
public class CronProperties {

    /**
     * Shared secret a tick request must present. Blank rejects every request.
     */
    private String secret;

    /**
     * Maximum number of reminders claimed per tick.
     */
    private int maxBatch = 50;

    /**
     * Wall-clock budget of one tick. Reminders not reached in time are released.
     */
    private long maxRuntimeMs = 25000;

    /**
     * Pause between two deliveries of the same tick. 0 disables.
     */
    private long sendDelayMs = 0;

    /**
     * Claims older than this are considered abandoned and released. 0 disables.
     */
    private long staleLockTimeoutSeconds = 600;

    /**
     * Claim owner written to locked_by. Blank means hostname:pid.
     */
    private String workerId;

    /**
     * Zone used for schedules whose row carries no timezone.
     */
    private String defaultTimezone = "Asia/Tehran";

    private FailedRetry failedRetry = new FailedRetry();

    @Data
    public static class FailedRetry {

        /**
         * Put failed reminders back to active once their retry_after_utc has passed.
         */
        private boolean enabled = false;

        private int maxAttempts = 5;
    }
}

package com.clapgrow.reminder.api.config;

import com.clapgrow.reminder.common.schedule.RecurrenceEngine;
import com.clapgrow.reminder.common.schedule.ScheduleParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the pure scheduling classes from reminder-common and the process-level
 * collaborators of the tick (clock and worker identity).
 */
@Configuration
@Slf4j
public class RecurrenceConfig {

    @Bean
    public RecurrenceEngine recurrenceEngine() {
        return new RecurrenceEngine();
    }

    @Bean
    public ScheduleParser scheduleParser(CronProperties cronProperties) {
        return new ScheduleParser(ZoneId.of(cronProperties.getDefaultTimezone()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkerIdentity workerIdentity(CronProperties cronProperties) {
        String configured = cronProperties.getWorkerId();
        if (configured != null && !configured.trim().isEmpty()) {
            return new WorkerIdentity(configured.trim());
        }
        WorkerIdentity identity = new WorkerIdentity(resolveHostName() + ":" + ProcessHandle.current().pid());
        log.info("Using worker identity {}", identity.id());
        return identity;
    }

    private String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local host name, using 'unknown-host': {}", e.getMessage());
            return "unknown-host";
        }
    }
}

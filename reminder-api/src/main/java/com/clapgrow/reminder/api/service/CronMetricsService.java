package com.clapgrow.reminder.api.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Prometheus metrics for reminder ticks.
 *
 * Tracks:
 * - Reminders claimed / sent / failed / skipped
 * - Tick duration
 * - Ticks by outcome (ok / aborted)
 *
 * Metrics are exposed at /actuator/prometheus. Meters are created once in @PostConstruct.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CronMetricsService {

    private final MeterRegistry meterRegistry;

    private Counter claimedCounter;
    private Counter sentCounter;
    private Counter failedCounter;
    private Counter skippedCounter;
    private Counter okTickCounter;
    private Counter abortedTickCounter;
    private Timer tickTimer;

    @PostConstruct
    void init() {
        claimedCounter = Counter.builder("reminder.tick.claimed")
            .description("Total number of reminders claimed by ticks")
            .register(meterRegistry);
        sentCounter = Counter.builder("reminder.tick.sent")
            .description("Total number of reminders delivered")
            .register(meterRegistry);
        failedCounter = Counter.builder("reminder.tick.failed")
            .description("Total number of reminder deliveries that failed")
            .register(meterRegistry);
        skippedCounter = Counter.builder("reminder.tick.skipped")
            .description("Total number of claimed reminders skipped (already delivered or released)")
            .register(meterRegistry);
        okTickCounter = Counter.builder("reminder.tick.runs")
            .description("Total number of ticks by outcome")
            .tag("outcome", "ok")
            .register(meterRegistry);
        abortedTickCounter = Counter.builder("reminder.tick.runs")
            .description("Total number of ticks by outcome")
            .tag("outcome", "aborted")
            .register(meterRegistry);
        tickTimer = Timer.builder("reminder.tick.duration")
            .description("Wall-clock duration of a tick")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
        log.info("Initialized reminder tick metrics");
    }

    public void recordTick(CronTickResult result) {
        claimedCounter.increment(result.claimed());
        sentCounter.increment(result.sent());
        failedCounter.increment(result.failed());
        skippedCounter.increment(result.skipped());
        (result.ok() ? okTickCounter : abortedTickCounter).increment();
        tickTimer.record(result.durationMs(), TimeUnit.MILLISECONDS);
    }
}

package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.entity.CronRun;
import com.clapgrow.reminder.api.repository.CronRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Bookkeeping of tick runs in cron_runs. Never fails a tick: storage errors are logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CronRunService {

    private final CronRunRepository cronRunRepository;

    public void start(UUID tickId, Instant startedAt) {
        try {
            cronRunRepository.save(new CronRun(tickId, startedAt));
        } catch (DataAccessException e) {
            log.warn("Failed to insert cron run start: tickId={}, error={}", tickId, e.getMessage());
        }
    }

    public void finish(CronTickResult result, Instant startedAt, Instant finishedAt) {
        try {
            int updated = cronRunRepository.finish(result.tickId(), finishedAt, result.claimed(), result.sent(),
                result.failed(), result.skipped(), result.error());
            if (updated == 0) {
                // start row is missing, write the whole run at once
                CronRun run = new CronRun(result.tickId(), startedAt);
                run.setFinishedAt(finishedAt);
                run.setClaimed(result.claimed());
                run.setSent(result.sent());
                run.setFailed(result.failed());
                run.setSkipped(result.skipped());
                run.setNotes(result.error());
                cronRunRepository.save(run);
            }
        } catch (DataAccessException e) {
            log.warn("Failed to update cron run finish: tickId={}, error={}", result.tickId(), e.getMessage());
        }
    }
}

package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.dto.CronHealthResponse;
import com.clapgrow.reminder.api.entity.CronRun;
import com.clapgrow.reminder.api.repository.CronRunRepository;
import com.clapgrow.reminder.api.repository.ReminderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class CronHealthService {

    private final CronRunRepository cronRunRepository;
    private final ReminderRepository reminderRepository;

    /**
     * Snapshot of the delivery pipeline:
     * - last_tick_id / last_error: latest run by start time (its notes)
     * - last_success_tick_time: finish time of the latest run that sent something
     * - last_sent_at: latest last_sent_at_utc over all reminders
     */
    @Transactional(readOnly = true)
    public CronHealthResponse health() {
        Optional<CronRun> lastRun = cronRunRepository.findFirstByOrderByStartedAtDesc();
        Optional<CronRun> lastSuccess =
            cronRunRepository.findFirstBySentGreaterThanAndFinishedAtIsNotNullOrderByFinishedAtDesc(0);

        return new CronHealthResponse(
            true,
            lastSuccess.map(CronRun::getFinishedAt).orElse(null),
            lastRun.map(CronRun::getTickId).orElse(null),
            reminderRepository.findLatestSentAt(),
            lastRun.map(CronRun::getNotes).orElse(null)
        );
    }
}

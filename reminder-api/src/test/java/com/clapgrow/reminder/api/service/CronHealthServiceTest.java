package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.dto.CronHealthResponse;
import com.clapgrow.reminder.api.entity.CronRun;
import com.clapgrow.reminder.api.repository.CronRunRepository;
import com.clapgrow.reminder.api.repository.ReminderRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CronHealthServiceTest {

    @Mock
    private CronRunRepository cronRunRepository;

    @Mock
    private ReminderRepository reminderRepository;

    @InjectMocks
    private CronHealthService cronHealthService;

    @Test
    void testHealth_LatestRunFailed_ReportsItsErrorAndLastSuccess() {
        CronRun success = new CronRun(UUID.randomUUID(), Instant.parse("2024-06-03T08:59:00Z"));
        success.setFinishedAt(Instant.parse("2024-06-03T08:59:02Z"));
        success.setSent(3);
        CronRun latest = new CronRun(UUID.randomUUID(), Instant.parse("2024-06-03T09:00:00Z"));
        latest.setFinishedAt(Instant.parse("2024-06-03T09:00:01Z"));
        latest.setNotes("connection refused");
        Instant lastSent = Instant.parse("2024-06-03T08:59:01Z");

        when(cronRunRepository.findFirstByOrderByStartedAtDesc()).thenReturn(Optional.of(latest));
        when(cronRunRepository.findFirstBySentGreaterThanAndFinishedAtIsNotNullOrderByFinishedAtDesc(0))
            .thenReturn(Optional.of(success));
        when(reminderRepository.findLatestSentAt()).thenReturn(lastSent);

        CronHealthResponse health = cronHealthService.health();

        assertTrue(health.ok());
        assertEquals(latest.getTickId(), health.lastTickId());
        assertEquals("connection refused", health.lastError());
        assertEquals(success.getFinishedAt(), health.lastSuccessTickTime());
        assertEquals(lastSent, health.lastSentAt());
    }

    @Test
    void testHealth_NoRunsYet_ReturnsNulls() {
        when(cronRunRepository.findFirstByOrderByStartedAtDesc()).thenReturn(Optional.empty());
        when(cronRunRepository.findFirstBySentGreaterThanAndFinishedAtIsNotNullOrderByFinishedAtDesc(0))
            .thenReturn(Optional.empty());

        CronHealthResponse health = cronHealthService.health();

        assertTrue(health.ok());
        assertNull(health.lastTickId());
        assertNull(health.lastSuccessTickTime());
        assertNull(health.lastSentAt());
        assertNull(health.lastError());
    }
}

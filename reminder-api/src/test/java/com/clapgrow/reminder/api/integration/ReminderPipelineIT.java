package com.clapgrow.reminder.api.integration;

import com.clapgrow.reminder.api.entity.AppUser;
import com.clapgrow.reminder.api.entity.Reminder;
import com.clapgrow.reminder.api.entity.ReminderDelivery;
import com.clapgrow.reminder.api.enums.ReminderStatus;
import com.clapgrow.reminder.api.repository.AppUserRepository;
import com.clapgrow.reminder.api.repository.ReminderDeliveryRepository;
import com.clapgrow.reminder.api.repository.ReminderRepository;
import com.clapgrow.reminder.api.service.DeliveryLedgerService;
import com.clapgrow.reminder.common.channel.ChannelName;
import com.clapgrow.reminder.common.channel.ChannelSendException;
import com.clapgrow.reminder.common.channel.MessageChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Runs ticks end to end against PostgreSQL with the messaging channel mocked out.
 */
class ReminderPipelineIT extends BaseIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ReminderRepository reminderRepository;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private ReminderDeliveryRepository deliveryRepository;

    @Autowired
    private DeliveryLedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private MessageChannel messageChannel;

    private AppUser user;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE reminder_deliveries, reminders_attachments, reminders, archive_items, users, cron_runs CASCADE");
        user = new AppUser();
        user.setTelegramId("555000111");
        user.setUsername("sara");
        user = appUserRepository.save(user);
    }

    private Reminder saveDue(String scheduleType, String atTime) {
        Instant due = Instant.now().minus(1, ChronoUnit.MINUTES).truncatedTo(ChronoUnit.MILLIS);
        Reminder reminder = new Reminder();
        reminder.setUserId(user.getId());
        reminder.setTitle("Water the plants");
        reminder.setScheduleType(scheduleType);
        reminder.setTimezone("UTC");
        reminder.setAtTime(atTime);
        reminder.setOnceAt("once".equals(scheduleType) ? due : null);
        reminder.setNextRunAtUtc(due);
        reminder.setStatus(ReminderStatus.ACTIVE);
        return reminderRepository.save(reminder);
    }

    @SuppressWarnings("unchecked")
    private ResponseEntity<Map<String, Object>> tick() {
        ResponseEntity<?> response = restTemplate.postForEntity("/cron/tick?key=" + CRON_SECRET, null, Map.class);
        return (ResponseEntity<Map<String, Object>>) response;
    }

    @Test
    void testTick_OnceReminder_RingsAndIsNotClaimedAgain() {
        Reminder reminder = saveDue("once", null);

        ResponseEntity<Map<String, Object>> first = tick();
        ResponseEntity<Map<String, Object>> second = tick();

        assertEquals(HttpStatus.OK, first.getStatusCode());
        assertEquals(1, first.getBody().get("claimed"));
        assertEquals(1, first.getBody().get("sent"));
        assertEquals(0, second.getBody().get("claimed"));

        Reminder stored = reminderRepository.findById(reminder.getId()).orElseThrow();
        assertEquals(ReminderStatus.RINGED, stored.getStatus());
        assertFalse(stored.isEnabled());
        assertNull(stored.getNextRunAtUtc());
        assertNotNull(stored.getLastSentAtUtc());
        assertNull(stored.getLockedBy());

        String deliveryKey = DeliveryLedgerService.deliveryKey(reminder.getId(), reminder.getNextRunAtUtc());
        assertTrue(deliveryRepository.findByReminderIdAndDeliveryKey(reminder.getId(), deliveryKey).orElseThrow().isOk());
        verify(messageChannel, times(1)).sendText(eq(555000111L), anyString());
    }

    @Test
    void testTick_DailyReminder_IsRescheduledIntoTheFuture() {
        Reminder reminder = saveDue("daily", "06:30");

        ResponseEntity<Map<String, Object>> response = tick();

        assertEquals(1, response.getBody().get("sent"));
        Reminder stored = reminderRepository.findById(reminder.getId()).orElseThrow();
        assertEquals(ReminderStatus.ACTIVE, stored.getStatus());
        assertTrue(stored.isEnabled());
        assertTrue(stored.getNextRunAtUtc().isAfter(Instant.now()));
        assertEquals(0, stored.getSendAttemptCount());
    }

    @Test
    void testTick_RateLimited_ReleasesRestOfBatch() {
        Reminder first = saveDue("daily", "06:30");
        Reminder second = saveDue("daily", "06:30");
        Reminder third = saveDue("daily", "06:30");
        doReturn(1L)
            .doThrow(ChannelSendException.rateLimited(ChannelName.TELEGRAM,
                "Telegram sendMessage failed: 429 Too Many Requests: retry after 20", 20))
            .when(messageChannel).sendText(anyLong(), anyString());

        ResponseEntity<Map<String, Object>> response = tick();

        assertTrue((Boolean) response.getBody().get("ok"));
        assertEquals(3, response.getBody().get("claimed"));
        assertEquals(1, response.getBody().get("sent"));
        assertEquals(1, response.getBody().get("failed"));
        assertEquals(1, response.getBody().get("skipped"));

        List<Reminder> stored = reminderRepository.findAllById(List.of(first.getId(), second.getId(), third.getId()));
        assertEquals(1, stored.stream().filter(r -> r.getStatus() == ReminderStatus.FAILED).count());
        assertEquals(2, stored.stream().filter(r -> r.getStatus() == ReminderStatus.ACTIVE).count());
        Reminder failed = stored.stream().filter(r -> r.getStatus() == ReminderStatus.FAILED).findFirst().orElseThrow();
        assertEquals("rate_limited:20", failed.getLastError());
        assertEquals(1, failed.getSendAttemptCount());
        assertNotNull(failed.getRetryAfterUtc());
    }

    @Test
    void testTick_WrongKey_IsRejected() {
        ResponseEntity<Map> response = restTemplate.getForEntity("/cron/tick?key=nope", Map.class);

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
        verifyNoInteractions(messageChannel);
    }

    @Test
    void testHealth_AfterTick_ReportsLastRun() {
        saveDue("daily", "06:30");
        ResponseEntity<Map<String, Object>> tickResponse = tick();

        ResponseEntity<Map> health = restTemplate.getForEntity("/cron/health", Map.class);

        assertEquals(HttpStatus.OK, health.getStatusCode());
        assertEquals(tickResponse.getBody().get("tick_id"), health.getBody().get("last_tick_id"));
        assertNotNull(health.getBody().get("last_success_tick_time"));
        assertNotNull(health.getBody().get("last_sent_at"));
    }

    @Test
    void testClaimDue_ConcurrentClaimers_GetDisjointReminders() throws Exception {
        for (int i = 0; i < 20; i++) {
            saveDue("daily", "06:30");
        }
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        Callable<List<Reminder>> claimer = () -> {
            start.await();
            return reminderRepository.claimDue(UUID.randomUUID(), "worker-" + Thread.currentThread().getId(), 15);
        };

        try {
            Future<List<Reminder>> a = executor.submit(claimer);
            Future<List<Reminder>> b = executor.submit(claimer);
            start.countDown();

            List<Reminder> claimedA = a.get();
            List<Reminder> claimedB = b.get();
            Set<UUID> ids = new HashSet<>();
            claimedA.forEach(r -> ids.add(r.getId()));
            claimedB.forEach(r -> ids.add(r.getId()));

            assertEquals(claimedA.size() + claimedB.size(), ids.size());
            assertEquals(20, ids.size());
            assertTrue(claimedA.stream().allMatch(r -> r.getStatus() == ReminderStatus.PROCESSING));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testLedgerRecord_FailureAfterSuccess_KeepsSuccess() {
        Reminder reminder = saveDue("daily", "06:30");
        String deliveryKey = DeliveryLedgerService.deliveryKey(reminder.getId(), reminder.getNextRunAtUtc());

        ledgerService.record(reminder.getId(), deliveryKey, UUID.randomUUID(), true, null);
        ledgerService.record(reminder.getId(), deliveryKey, UUID.randomUUID(), false, "boom");

        ReminderDelivery stored = deliveryRepository.findByReminderIdAndDeliveryKey(reminder.getId(), deliveryKey).orElseThrow();
        assertTrue(stored.isOk());
        assertNull(stored.getError());
        assertTrue(ledgerService.hasSucceeded(reminder.getId(), deliveryKey));
    }

    @Test
    void testLedgerRecord_SuccessAfterFailure_Overwrites() {
        Reminder reminder = saveDue("daily", "06:30");
        String deliveryKey = DeliveryLedgerService.deliveryKey(reminder.getId(), reminder.getNextRunAtUtc());

        ledgerService.record(reminder.getId(), deliveryKey, UUID.randomUUID(), false, "boom");
        assertFalse(ledgerService.hasSucceeded(reminder.getId(), deliveryKey));
        ledgerService.record(reminder.getId(), deliveryKey, UUID.randomUUID(), true, null);

        ReminderDelivery stored = deliveryRepository.findByReminderIdAndDeliveryKey(reminder.getId(), deliveryKey).orElseThrow();
        assertTrue(stored.isOk());
        assertNull(stored.getError());
    }

    @Test
    void testReleaseClaims_ProcessingReminder_BecomesClaimableAgain() {
        Reminder reminder = saveDue("daily", "06:30");
        List<Reminder> claimed = reminderRepository.claimDue(UUID.randomUUID(), "it-worker", 10);
        assertEquals(1, claimed.size());
        assertTrue(reminderRepository.claimDue(UUID.randomUUID(), "it-worker", 10).isEmpty());

        reminderRepository.releaseClaims(List.of(reminder.getId()));

        Reminder stored = reminderRepository.findById(reminder.getId()).orElseThrow();
        assertEquals(ReminderStatus.ACTIVE, stored.getStatus());
        assertNull(stored.getLockedAt());
        assertEquals(1, reminderRepository.claimDue(UUID.randomUUID(), "it-worker", 10).size());
    }
}

package com.clapgrow.reminder.api.controller;

import com.clapgrow.reminder.api.dto.ApiResponse;
import com.clapgrow.reminder.api.dto.CronHealthResponse;
import com.clapgrow.reminder.api.dto.CronTickResponse;
import com.clapgrow.reminder.api.service.CronAuthService;
import com.clapgrow.reminder.api.service.CronHealthService;
import com.clapgrow.reminder.api.service.CronTickResult;
import com.clapgrow.reminder.api.service.CronTickService;
import com.clapgrow.reminder.api.service.ReminderRecoveryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/cron")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Cron", description = "Reminder tick trigger and pipeline health")
public class CronController {

    static final String CRON_KEY_HEADER = "X-Cron-Key";

    private final CronAuthService cronAuthService;
    private final CronTickService cronTickService;
    private final CronHealthService cronHealthService;
    private final ReminderRecoveryService recoveryService;
    private final Clock clock;

    @RequestMapping(value = "/tick", method = {RequestMethod.GET, RequestMethod.POST})
    @Operation(
            summary = "Run one tick",
            description = "Claims due reminders, delivers them and reschedules them. Called by an external scheduler."
    )
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Tick completed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "401", description = "Missing or invalid cron key"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "500", description = "Tick aborted")
    })
    public ResponseEntity<CronTickResponse> tick(
            @Parameter(description = "Cron secret") @RequestParam(value = "key", required = false) String key,
            @RequestHeader(value = CRON_KEY_HEADER, required = false) String headerKey) {
        cronAuthService.validateCronKey(key != null ? key : headerKey);

        CronTickResult result = cronTickService.runTick();
        HttpStatus status = result.ok() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(CronTickResponse.from(result, clock.instant()));
    }

    @GetMapping("/health")
    @Operation(summary = "Pipeline health", description = "Latest tick, latest successful tick and latest delivery.")
    public ResponseEntity<CronHealthResponse> health() {
        return ResponseEntity.ok(cronHealthService.health());
    }

    @PostMapping("/reminders/{id}/reactivate")
    @Operation(summary = "Reactivate a failed reminder", description = "Puts a failed reminder back to active with a fresh attempt counter.")
    public ResponseEntity<ApiResponse<Map<String, Object>>> reactivate(
            @PathVariable("id") UUID reminderId,
            @RequestParam(value = "key", required = false) String key,
            @RequestHeader(value = CRON_KEY_HEADER, required = false) String headerKey) {
        cronAuthService.validateCronKey(key != null ? key : headerKey);

        recoveryService.reactivate(reminderId);
        return ResponseEntity.ok(ApiResponse.success(Map.of("reminder_id", reminderId, "status", "active")));
    }

    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<CronTickResponse> handleUnauthorized(SecurityException e) {
        log.warn("Rejected cron request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(CronTickResponse.unauthorized(clock.instant()));
    }
}

package com.clapgrow.reminder.api.dto;

import com.clapgrow.reminder.api.service.CronTickResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * Body of /cron/tick. Counts are omitted for an unauthorized request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronTickResponse(
    boolean ok,
    @JsonProperty("tick_id") UUID tickId,
    Integer claimed,
    Integer sent,
    Integer failed,
    Integer skipped,
    @JsonProperty("duration_ms") Long durationMs,
    String error,
    Instant time
) {
    public static CronTickResponse from(CronTickResult result, Instant time) {
        return new CronTickResponse(
            result.ok(),
            result.tickId(),
            result.claimed(),
            result.sent(),
            result.failed(),
            result.skipped(),
            result.durationMs(),
            result.error(),
            time
        );
    }

    public static CronTickResponse unauthorized(Instant time) {
        return new CronTickResponse(false, null, null, null, null, null, null, "unauthorized", time);
    }
}

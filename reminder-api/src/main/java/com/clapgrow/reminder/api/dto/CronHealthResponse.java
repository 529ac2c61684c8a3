package com.clapgrow.reminder.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record CronHealthResponse(
    boolean ok,
    @JsonProperty("last_success_tick_time") Instant lastSuccessTickTime,
    @JsonProperty("last_tick_id") UUID lastTickId,
    @JsonProperty("last_sent_at") Instant lastSentAt,
    @JsonProperty("last_error") String lastError
) {
}

package com.clapgrow.reminder.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Envelope of every Bot API response. Only the fields used for error handling are mapped.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramApiResponse {

    private boolean ok;

    @JsonProperty("error_code")
    private Integer errorCode;

    private String description;

    private Parameters parameters;

    /**
     * A Message object for sends and edits; plain {@code true} for some edits.
     */
    private JsonNode result;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Parameters {

        @JsonProperty("retry_after")
        private Integer retryAfter;
    }

    public Long messageId() {
        if (result == null || !result.has("message_id")) {
            return null;
        }
        return result.get("message_id").asLong();
    }

    public Integer retryAfterSeconds() {
        return parameters != null ? parameters.getRetryAfter() : null;
    }
}

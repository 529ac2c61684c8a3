package com.clapgrow.reminder.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TelegramEditMessageCaptionRequest {

    @JsonProperty("chat_id")
    private long chatId;

    @JsonProperty("message_id")
    private long messageId;

    private String caption;
}

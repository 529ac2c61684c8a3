package com.clapgrow.reminder.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TelegramCopyMessageRequest {

    @JsonProperty("chat_id")
    private long chatId;

    @JsonProperty("from_chat_id")
    private long fromChatId;

    @JsonProperty("message_id")
    private long messageId;
}

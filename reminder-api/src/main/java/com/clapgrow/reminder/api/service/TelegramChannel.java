package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.model.TelegramApiResponse;
import com.clapgrow.reminder.api.model.TelegramCopyMessageRequest;
import com.clapgrow.reminder.api.model.TelegramEditMessageCaptionRequest;
import com.clapgrow.reminder.api.model.TelegramEditMessageTextRequest;
import com.clapgrow.reminder.api.model.TelegramSendMessageRequest;
import com.clapgrow.reminder.common.channel.ChannelErrorCategory;
import com.clapgrow.reminder.common.channel.ChannelName;
import com.clapgrow.reminder.common.channel.ChannelSendException;
import com.clapgrow.reminder.common.channel.MessageChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Telegram Bot API channel: sendMessage for the reminder text, copyMessage to replay
 * archived attachments, editMessageText / editMessageCaption to annotate archive posts.
 */
@Service
@Slf4j
public class TelegramChannel implements MessageChannel {

    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("retry after (\\d{1,9})", Pattern.CASE_INSENSITIVE);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final boolean configured;
    private final Duration timeout;

    public TelegramChannel(@Qualifier("telegramWebClient") WebClient webClient,
                           ObjectMapper objectMapper,
                           @Value("${telegram.bot-token:}") String botToken,
                           @Value("${telegram.api.timeout-seconds:15}") long timeoutSeconds) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.configured = botToken != null && !botToken.trim().isEmpty();
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        if (!configured) {
            log.warn("Telegram bot token is not configured. Reminder deliveries will fail.");
        }
    }

    @Override
    public long sendText(long chatId, String text) {
        TelegramApiResponse response = call("sendMessage", new TelegramSendMessageRequest(chatId, text));
        Long messageId = response.messageId();
        log.debug("Telegram message {} sent to chat {}", messageId, chatId);
        return messageId != null ? messageId : 0L;
    }

    @Override
    public void copyMessage(long chatId, long fromChatId, long messageId) {
        call("copyMessage", new TelegramCopyMessageRequest(chatId, fromChatId, messageId));
        log.debug("Telegram message {} copied from chat {} to chat {}", messageId, fromChatId, chatId);
    }

    @Override
    public void editMessageText(long chatId, long messageId, String text) {
        call("editMessageText", new TelegramEditMessageTextRequest(chatId, messageId, text));
        log.debug("Telegram message {} in chat {} edited", messageId, chatId);
    }

    @Override
    public void editMessageCaption(long chatId, long messageId, String caption) {
        call("editMessageCaption", new TelegramEditMessageCaptionRequest(chatId, messageId, caption));
        log.debug("Telegram caption of message {} in chat {} edited", messageId, chatId);
    }

    @Override
    public ChannelName getChannelName() {
        return ChannelName.TELEGRAM;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    private TelegramApiResponse call(String method, Object request) {
        if (!configured) {
            throw new ChannelSendException(ChannelName.TELEGRAM, ChannelErrorCategory.AUTH,
                "Telegram bot token is not configured", null, null);
        }

        TelegramApiResponse response;
        try {
            response = webClient.post()
                .uri("/" + method)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(TelegramApiResponse.class)
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            throw toChannelException(method, e);
        } catch (Exception e) {
            throw new ChannelSendException(ChannelName.TELEGRAM, ChannelErrorCategory.TEMPORARY,
                "Telegram " + method + " failed: " + e.getMessage(), null, null, e);
        }

        if (response == null) {
            throw new ChannelSendException(ChannelName.TELEGRAM, ChannelErrorCategory.TEMPORARY,
                "Telegram " + method + " failed: empty response", null, null);
        }
        if (!response.isOk()) {
            throw fromApiResponse(method, response, response.getErrorCode(), null);
        }
        return response;
    }

    private ChannelSendException toChannelException(String method, WebClientResponseException e) {
        TelegramApiResponse body = parseBody(e.getResponseBodyAsString());
        int status = e.getStatusCode().value();
        if (body == null) {
            return new ChannelSendException(ChannelName.TELEGRAM, categorize(status),
                "Telegram " + method + " failed with HTTP " + status, status, null, e);
        }
        return fromApiResponse(method, body, status, e);
    }

    private ChannelSendException fromApiResponse(String method, TelegramApiResponse body, Integer status, Throwable cause) {
        int code = body.getErrorCode() != null ? body.getErrorCode() : (status != null ? status : 0);
        String description = body.getDescription() != null ? body.getDescription() : "no description";
        String message = "Telegram " + method + " failed: " + code + " " + description;

        if (code == 429) {
            Integer retryAfter = body.retryAfterSeconds();
            if (retryAfter == null) {
                retryAfter = parseRetryAfter(description);
            }
            log.warn("Telegram rate limit hit on {} (retry after {}s)", method, retryAfter);
            return new ChannelSendException(ChannelName.TELEGRAM, ChannelErrorCategory.RATE_LIMIT,
                message, 429, retryAfter, cause);
        }
        return new ChannelSendException(ChannelName.TELEGRAM, categorize(code), message, code, null, cause);
    }

    private TelegramApiResponse parseBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, TelegramApiResponse.class);
        } catch (JsonProcessingException e) {
            log.debug("Telegram error body is not JSON: {}", body);
            return null;
        }
    }

    static Integer parseRetryAfter(String description) {
        if (description == null) {
            return null;
        }
        Matcher matcher = RETRY_AFTER_PATTERN.matcher(description);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    private static ChannelErrorCategory categorize(int status) {
        if (status == 429) {
            return ChannelErrorCategory.RATE_LIMIT;
        }
        if (status == 401) {
            return ChannelErrorCategory.AUTH;
        }
        if (status >= 500 || status == 0) {
            return ChannelErrorCategory.TEMPORARY;
        }
        return ChannelErrorCategory.PERMANENT;
    }
}

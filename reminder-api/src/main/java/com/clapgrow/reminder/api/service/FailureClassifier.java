package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.common.channel.ChannelSendException;
import com.clapgrow.reminder.common.retry.DeliveryFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies reminder delivery failures to determine the retry strategy.
 *
 * Classification rules:
 * - RATE_LIMIT: the channel answered HTTP 429 (or "Too Many Requests")
 * - TERMINAL: everything else, including invalid schedules and missing recipients
 *
 * The retry-after of a rate limit comes from the channel response when present,
 * then from a "retry after N" phrase in the error text, and defaults to 30 seconds.
 */
@Service
@Slf4j
public class FailureClassifier {

    static final int DEFAULT_RETRY_AFTER_SECONDS = 30;

    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("retry after (\\d{1,9})", Pattern.CASE_INSENSITIVE);

    public DeliveryFailure classify(Throwable error) {
        String message = messageOf(error);

        if (error instanceof ChannelSendException channelError && channelError.isRateLimited()) {
            return new DeliveryFailure.RateLimit(resolveRetryAfter(channelError.getRetryAfterSeconds(), message));
        }
        if (message.contains("Too Many Requests")) {
            return new DeliveryFailure.RateLimit(resolveRetryAfter(null, message));
        }

        return new DeliveryFailure.Terminal(message);
    }

    private int resolveRetryAfter(Integer reported, String message) {
        if (reported != null && reported > 0) {
            return reported;
        }
        Matcher matcher = RETRY_AFTER_PATTERN.matcher(message);
        if (matcher.find()) {
            try {
                int parsed = Integer.parseInt(matcher.group(1));
                if (parsed > 0) {
                    return parsed;
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring unparseable retry-after in '{}'", message);
            }
        }
        return DEFAULT_RETRY_AFTER_SECONDS;
    }

    private static String messageOf(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        return (message == null || message.isBlank()) ? error.getClass().getSimpleName() : message;
    }
}

package com.clapgrow.reminder.common.channel;

/**
 * A send or replay call to a messaging channel failed.
 *
 * Carries what the channel reported so the caller can tell a rate limit
 * (with its retry-after) apart from any other failure.
 */
public class ChannelSendException extends RuntimeException {

    private final ChannelName channel;
    private final ChannelErrorCategory category;
    private final Integer httpStatusCode;
    private final Integer retryAfterSeconds;

    public ChannelSendException(ChannelName channel, ChannelErrorCategory category, String message,
                                Integer httpStatusCode, Integer retryAfterSeconds) {
        this(channel, category, message, httpStatusCode, retryAfterSeconds, null);
    }

    public ChannelSendException(ChannelName channel, ChannelErrorCategory category, String message,
                                Integer httpStatusCode, Integer retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.channel = channel;
        this.category = category;
        this.httpStatusCode = httpStatusCode;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static ChannelSendException rateLimited(ChannelName channel, String message, Integer retryAfterSeconds) {
        return new ChannelSendException(channel, ChannelErrorCategory.RATE_LIMIT, message, 429, retryAfterSeconds);
    }

    public ChannelName getChannel() {
        return channel;
    }

    public ChannelErrorCategory getCategory() {
        return category;
    }

    public Integer getHttpStatusCode() {
        return httpStatusCode;
    }

    /**
     * Seconds the channel asked us to wait, or {@code null} if it did not say.
     */
    public Integer getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public boolean isRateLimited() {
        return category == ChannelErrorCategory.RATE_LIMIT
            || (httpStatusCode != null && httpStatusCode == 429);
    }
}

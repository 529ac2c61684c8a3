package com.clapgrow.reminder.common.channel;

/**
 * Channel error category reported with every failed send.
 *
 * - RATE_LIMIT: Channel asked the caller to slow down (HTTP 429)
 * - TEMPORARY: Timeouts, connection failures, 5xx responses
 * - PERMANENT: Malformed request, recipient blocked the bot, chat not found
 * - AUTH: Bot token rejected
 */
public enum ChannelErrorCategory {
    RATE_LIMIT,
    TEMPORARY,
    PERMANENT,
    AUTH
}

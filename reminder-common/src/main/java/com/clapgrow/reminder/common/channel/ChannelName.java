package com.clapgrow.reminder.common.channel;

import java.util.Locale;

/**
 * Messaging channels reminders can be delivered through.
 */
public enum ChannelName {
    /**
     * Telegram Bot API
     */
    TELEGRAM;

    public String toConfigValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.clapgrow.reminder.common.channel;

/**
 * Outbound messaging channel used to deliver reminders.
 *
 * Implementation guidelines:
 * - Raise {@link ChannelSendException} for every failed call and categorize it
 * - Report HTTP 429 as {@link ChannelErrorCategory#RATE_LIMIT} with the retry-after when known
 * - Never log bot tokens or other credentials
 *
 * Example usage:
 * <pre>
 * channel.sendText(chatId, "⏰ Reminder: Pay rent");
 * for (long messageId : archivedMessageIds) {
 *     channel.copyMessage(chatId, archiveChatId, messageId);
 * }
 * </pre>
 */
public interface MessageChannel {

    /**
     * Send a plain text message to a recipient.
     *
     * @param chatId recipient chat
     * @param text   message body
     * @return id of the posted message, or 0 if the channel did not report one
     * @throws ChannelSendException if the channel rejected or failed the call
     */
    long sendText(long chatId, String text);

    /**
     * Replay a previously archived message to a recipient.
     *
     * @param chatId     recipient chat
     * @param fromChatId archive chat holding the original message
     * @param messageId  id of the original message inside the archive chat
     * @throws ChannelSendException if the channel rejected or failed the call
     */
    void copyMessage(long chatId, long fromChatId, long messageId);

    /**
     * Replace the text of a message already posted by the bot.
     *
     * @throws ChannelSendException if the channel rejected or failed the call
     */
    void editMessageText(long chatId, long messageId, String text);

    /**
     * Replace the caption of a media message already posted by the bot.
     *
     * @throws ChannelSendException if the channel rejected or failed the call
     */
    void editMessageCaption(long chatId, long messageId, String caption);

    /**
     * Get the channel name.
     */
    ChannelName getChannelName();

    /**
     * Check if the channel is configured and ready to send messages.
     */
    default boolean isConfigured() {
        return true;
    }
}

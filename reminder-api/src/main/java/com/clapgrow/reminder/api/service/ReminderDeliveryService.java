package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.entity.AppUser;
import com.clapgrow.reminder.api.entity.ArchiveItem;
import com.clapgrow.reminder.api.entity.Reminder;
import com.clapgrow.reminder.api.entity.ReminderAttachment;
import com.clapgrow.reminder.api.repository.AppUserRepository;
import com.clapgrow.reminder.api.repository.ArchiveItemRepository;
import com.clapgrow.reminder.api.repository.ReminderAttachmentRepository;
import com.clapgrow.reminder.common.channel.MessageChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sends one reminder to its owner: the text first, then every archived attachment
 * in the order it was archived.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderDeliveryService {

    private final AppUserRepository appUserRepository;
    private final ReminderAttachmentRepository reminderAttachmentRepository;
    private final ArchiveItemRepository archiveItemRepository;
    private final MessageChannel messageChannel;
    private final ReminderMessageFormatter messageFormatter;

    /**
     * @throws RecipientNotFoundException if the owner has no reachable chat
     * @throws com.clapgrow.reminder.common.channel.ChannelSendException if a channel call fails
     */
    public void deliver(Reminder reminder) {
        AppUser user = appUserRepository.findById(reminder.getUserId())
            .orElseThrow(() -> new RecipientNotFoundException("Missing user for reminder " + reminder.getId()));
        long chatId = chatIdOf(user);

        messageChannel.sendText(chatId, messageFormatter.format(reminder));

        List<ReminderAttachment> attachments = reminderAttachmentRepository.findByReminderIdOrderByCreatedAtAsc(reminder.getId());
        if (attachments.isEmpty()) {
            return;
        }

        Optional<ArchiveItem> archiveItem =
            archiveItemRepository.findFirstByKindAndEntityId(ArchiveItem.KIND_REMINDER, reminder.getId());
        long archiveChatId = archiveItem.map(ArchiveItem::getChannelId)
            .orElse(attachments.get(0).getArchiveChatId());

        List<Long> messageIds = orderedMessageIds(attachments, archiveItem);
        for (Long messageId : messageIds) {
            messageChannel.copyMessage(chatId, archiveChatId, messageId);
        }
        log.debug("Replayed {} attachment(s) for reminder {}", messageIds.size(), reminder.getId());
    }

    /**
     * Attachment message ids in archive order. Without an archive item the attachment
     * rows' own creation order is used.
     */
    static List<Long> orderedMessageIds(List<ReminderAttachment> attachments, Optional<ArchiveItem> archiveItem) {
        if (archiveItem.isEmpty() || archiveItem.get().getMessageIds() == null) {
            return attachments.stream().map(ReminderAttachment::getArchiveMessageId).toList();
        }
        Set<Long> attachmentIds = attachments.stream()
            .map(ReminderAttachment::getArchiveMessageId)
            .collect(Collectors.toSet());
        return archiveItem.get().getMessageIds().stream()
            .filter(attachmentIds::contains)
            .toList();
    }

    private static long chatIdOf(AppUser user) {
        String telegramId = user.getTelegramId();
        if (telegramId == null || telegramId.trim().isEmpty()) {
            throw new RecipientNotFoundException("Missing telegram id for user " + user.getId());
        }
        try {
            return Long.parseLong(telegramId.trim());
        } catch (NumberFormatException e) {
            throw new RecipientNotFoundException("Invalid telegram id for user " + user.getId() + ": " + telegramId);
        }
    }
}

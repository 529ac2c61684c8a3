package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.entity.AppUser;
import com.clapgrow.reminder.api.entity.ArchiveItem;
import com.clapgrow.reminder.api.entity.ArchiveItemMeta;
import com.clapgrow.reminder.api.entity.ArchiveItemMeta.ArchivedMessage;
import com.clapgrow.reminder.api.entity.Reminder;
import com.clapgrow.reminder.api.repository.AppUserRepository;
import com.clapgrow.reminder.api.repository.ArchiveItemRepository;
import com.clapgrow.reminder.common.channel.ChannelSendException;
import com.clapgrow.reminder.common.channel.MessageChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ArchiveService {

    static final String STATUS_RINGED = "ringed";

    // Bot API limits, with headroom on text messages
    static final int MAX_CAPTION_LENGTH = 1024;
    static final int MAX_TEXT_LENGTH = 3800;

    private final ArchiveItemRepository archiveItemRepository;
    private final AppUserRepository appUserRepository;
    private final MessageChannel messageChannel;

    /**
     * Flag the archive post of a one-shot reminder as rung.
     *
     * @return true if an archive item was updated
     * @throws ChannelSendException if a fallback status note could not be posted
     */
    public boolean markRinged(Reminder reminder) {
        Optional<ArchiveItem> archiveItem =
            archiveItemRepository.findFirstByKindAndEntityId(ArchiveItem.KIND_REMINDER, reminder.getId());
        if (archiveItem.isEmpty()) {
            return false;
        }

        String displayName = appUserRepository.findById(reminder.getUserId())
            .map(AppUser::getUsername)
            .filter(username -> !username.isBlank())
            .map(username -> "@" + username)
            .orElse("User");
        String statusLine = "🔔 Alert ringed. This alert disappeared for " + displayName;

        markStatus(archiveItem.get(), STATUS_RINGED, statusLine, statusLine);
        return true;
    }

    /**
     * Append {@code statusLine} to every message of the archive post, then store the new status.
     *
     * A message whose edit fails, or whose content would exceed the caption or text limit,
     * gets the line as a separate note in the archive channel. Notes are appended to the
     * item's message ids and metadata.
     */
    void markStatus(ArchiveItem item, String status, String statusNote, String statusLine) {
        ArchiveItemMeta meta = item.getMeta() != null ? item.getMeta() : new ArchiveItemMeta();
        List<ArchivedMessage> messages = meta.getMessages() != null ? meta.getMessages() : List.of();
        long channelId = item.getChannelId();
        List<ArchivedMessage> notes = new ArrayList<>();
        int edited = 0;

        for (ArchivedMessage message : messages) {
            String updatedContent = message.getContent() + "\n" + statusLine;
            if (appendInPlace(channelId, message, updatedContent)) {
                edited++;
                continue;
            }
            long noteId = messageChannel.sendText(channelId, statusLine);
            if (noteId > 0) {
                notes.add(new ArchivedMessage(noteId, statusLine, ArchivedMessage.KIND_TEXT));
            }
        }

        List<ArchivedMessage> mergedMessages = new ArrayList<>(messages);
        mergedMessages.addAll(notes);
        List<Long> mergedMessageIds = item.getMessageIds() != null
            ? new ArrayList<>(item.getMessageIds())
            : new ArrayList<>();
        notes.forEach(note -> mergedMessageIds.add(note.getMessageId()));

        meta.setMessages(mergedMessages);
        item.setMeta(meta);
        item.setMessageIds(mergedMessageIds);
        item.setStatus(status);
        item.setStatusNote(statusNote);
        archiveItemRepository.save(item);
        log.debug("Archive item {} marked as {} ({} message(s) edited, {} note(s) posted)",
            item.getId(), status, edited, messages.size() - edited);
    }

    private boolean appendInPlace(long channelId, ArchivedMessage message, String updatedContent) {
        int limit = message.isCaption() ? MAX_CAPTION_LENGTH : MAX_TEXT_LENGTH;
        if (updatedContent.length() > limit) {
            return false;
        }
        try {
            if (message.isCaption()) {
                messageChannel.editMessageCaption(channelId, message.getMessageId(), updatedContent);
            } else {
                messageChannel.editMessageText(channelId, message.getMessageId(), updatedContent);
            }
        } catch (ChannelSendException e) {
            log.warn("Failed to edit archive message {} in chat {}, posting a note instead: {}",
                message.getMessageId(), channelId, e.getMessage());
            return false;
        }
        message.setContent(updatedContent);
        return true;
    }
}

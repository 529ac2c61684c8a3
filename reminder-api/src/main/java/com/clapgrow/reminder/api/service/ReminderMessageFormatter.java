package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.entity.Reminder;
import org.springframework.stereotype.Component;

/**
 * Text of the message a reminder is delivered as.
 */
@Component
public class ReminderMessageFormatter {

    static final String PREFIX = "⏰ Reminder: ";

    public String format(Reminder reminder) {
        StringBuilder text = new StringBuilder(PREFIX);
        if (reminder.getTitle() != null) {
            text.append(reminder.getTitle().trim());
        }
        String description = reminder.getDescription();
        if (description != null && !description.trim().isEmpty()) {
            text.append("\n\n").append(description.trim());
        }
        return text.toString();
    }
}

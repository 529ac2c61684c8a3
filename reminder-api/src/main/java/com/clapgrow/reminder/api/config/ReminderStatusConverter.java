package com.clapgrow.reminder.api.config;

import com.clapgrow.reminder.api.enums.ReminderStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ReminderStatus} as the lowercase text the status column holds.
 */
@Converter(autoApply = true)
public class ReminderStatusConverter implements AttributeConverter<ReminderStatus, String> {

    @Override
    public String convertToDatabaseColumn(ReminderStatus attribute) {
        return attribute == null ? null : attribute.getColumnValue();
    }

    @Override
    public ReminderStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ReminderStatus.fromColumnValue(dbData);
    }
}

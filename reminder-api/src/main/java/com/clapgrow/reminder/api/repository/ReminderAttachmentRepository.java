package com.clapgrow.reminder.api.repository;

import com.clapgrow.reminder.api.entity.ReminderAttachment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ReminderAttachmentRepository extends JpaRepository<ReminderAttachment, UUID> {

    List<ReminderAttachment> findByReminderIdOrderByCreatedAtAsc(UUID reminderId);
}

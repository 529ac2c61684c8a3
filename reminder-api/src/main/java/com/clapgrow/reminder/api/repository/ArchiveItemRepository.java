package com.clapgrow.reminder.api.repository;

import com.clapgrow.reminder.api.entity.ArchiveItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ArchiveItemRepository extends JpaRepository<ArchiveItem, UUID> {

    Optional<ArchiveItem> findFirstByKindAndEntityId(String kind, UUID entityId);
}

package com.clapgrow.reminder.api.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON stored in {@code archive_items.meta}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchiveItemMeta {

    private List<ArchivedMessage> messages = new ArrayList<>();

    /**
     * One message of an archive post and the content it currently shows.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArchivedMessage {

        public static final String KIND_CAPTION = "caption";
        public static final String KIND_TEXT = "text";

        private long messageId;
        private String content;
        private String kind;

        @JsonIgnore
        public boolean isCaption() {
            return KIND_CAPTION.equals(kind);
        }
    }
}

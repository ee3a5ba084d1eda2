package com.strumbot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.time.Instant;
import java.util.List;

/**
 * Structured notification handed to a {@link com.strumbot.service.NotificationPublisher}.
 * Maps onto a single Discord embed plus an optional attachment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationMessage {

    /**
     * Plain text posted outside the embed, typically a role mention.
     */
    private String content;

    private String title;

    private String description;

    /**
     * Link attached to the title.
     */
    private String url;

    /**
     * RGB color of the embed side bar, null for the default.
     */
    private Integer color;

    @Singular
    private List<Field> fields;

    private Instant timestamp;

    private byte[] imageBytes;

    private String imageFileName;

    public boolean hasImage() {
        return imageBytes != null && imageBytes.length > 0 && imageFileName != null;
    }

    /**
     * Name/value pair rendered as an embed field.
     */
    public record Field(String name, String value, boolean inline) {
    }
}

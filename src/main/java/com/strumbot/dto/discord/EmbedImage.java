package com.strumbot.dto.discord;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Image reference; {@code attachment://<filename>} points at an uploaded file part.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmbedImage {

    private String url;
}

package com.strumbot.dto.discord;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata for the file uploaded as {@code files[id]}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Attachment {

    private int id;
    private String filename;
}

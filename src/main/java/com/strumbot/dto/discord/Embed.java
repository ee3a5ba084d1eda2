package com.strumbot.dto.discord;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Embed {

    private String title;
    private String description;
    private String url;
    private Integer color;

    /**
     * ISO-8601 instant.
     */
    private String timestamp;

    private List<EmbedField> fields;
    private EmbedImage image;
}

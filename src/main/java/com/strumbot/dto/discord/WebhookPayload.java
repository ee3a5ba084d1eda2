package com.strumbot.dto.discord;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of a Discord execute-webhook call, sent as the {@code payload_json} part.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookPayload {

    private String content;
    private String username;
    private List<Embed> embeds;
    private List<Attachment> attachments;
}

package com.strumbot.dto.twitch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned by Helix: {@code {"error": "Unauthorized", "status": 401, "message": "..."}}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HelixError {

    private String error;
    private Integer status;
    private String message;
}
